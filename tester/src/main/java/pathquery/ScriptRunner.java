package pathquery;

import pathquery.eval.Evaluator;
import pathquery.eval.QueryOptions;
import pathquery.eval.ValueFormatter;
import pathquery.parser.QueryParser;
import java.util.ArrayList;
import java.util.function.Consumer;

/**
 * Charged with running golden cases.
 *
 * Every case runs in a fresh environment.
 */
public class ScriptRunner implements Consumer<ScriptCase> {

  /**
   * How are case outcomes reported?
   */
  final ScriptReporter reporter;

  final QueryOptions options;

  public ScriptRunner(ScriptReporter reporter, QueryOptions options) {
    this.reporter = reporter;
    this.options = options;
  }

  /**
   * Accept a new case.
   *
   * @param scriptCase case to run
   */
  @Override
  public void accept(ScriptCase scriptCase) {
    final var formatter = new ValueFormatter(options.outputFormat);
    final var printed = new ArrayList<String>();

    final String foundOutput;
    try {
      final var evaluator = Evaluator.create(options, value -> printed.add(formatter.format(value)));
      evaluator.run(QueryParser.parse(scriptCase.program));
      foundOutput = ScriptCase.createOutput(printed);
    } catch (QueryException error) {
      final String errorOutput = ScriptCase.createErrorOutput(error);
      if (scriptCase.output.equals(errorOutput)) {
        reporter.onPass(scriptCase, errorOutput);
      } else if (scriptCase.expectsError()) {
        reporter.onMismatch(scriptCase, errorOutput);
      } else {
        reporter.onCrash(scriptCase, error);
      }
      return;
    } catch (RuntimeException error) {
      reporter.onCrash(scriptCase, error);
      return;
    }

    if (scriptCase.output.equals(foundOutput)) {
      reporter.onPass(scriptCase, foundOutput);
    } else {
      reporter.onMismatch(scriptCase, foundOutput);
    }
  }
}
