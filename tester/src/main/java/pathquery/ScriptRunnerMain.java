package pathquery;

import pathquery.eval.Evaluator;
import pathquery.eval.QueryOptions;
import pathquery.eval.ValueFormatter;
import pathquery.parser.QueryParser;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs query scripts, or golden case files with {@code --cases}.
 *
 * Exits with status 1 if any script or case fails and 2 on bad usage.
 */
class ScriptRunnerMain {

  private static final Logger LOG = LoggerFactory.getLogger(ScriptRunnerMain.class);

  static int successes = 0;
  static int failures = 0;

  public static void main(String[] args) {
    final ScriptRunnerOptions runnerOptions;
    final QueryOptions options;
    try {
      runnerOptions = ScriptRunnerOptions.create(args);
      options = runnerOptions.getQueryOptions();
    } catch (ParseException e) {
      System.err.println(e.getMessage());
      System.exit(2);
      return;
    }

    if (runnerOptions.displayHelp()) {
      runnerOptions.printUsage(System.err);
      System.exit(2);
      return;
    }

    LOG.debug("Running with {}", options);
    if (runnerOptions.runCases()) {
      runCases(runnerOptions, options);
    } else {
      runScripts(runnerOptions, options);
    }
    System.exit(failures == 0 ? 0 : 1);
  }

  private static void runScripts(ScriptRunnerOptions runnerOptions, QueryOptions options) {
    final var formatter = new ValueFormatter(options.outputFormat);
    for (Path script : runnerOptions.getFiles()) {
      try {
        final String source = Files.readString(script, StandardCharsets.UTF_8);
        final var evaluator = Evaluator.create(options, value -> System.out.println(formatter.format(value)));
        evaluator.run(QueryParser.parse(source));
        successes++;
      } catch (IOException e) {
        LOG.error("Failed to read script {}: {}", script, e.getMessage());
        failures++;
      } catch (QueryException e) {
        LOG.error("Script {} failed: {}", script, e.getMessage());
        failures++;
      }
    }
  }

  private static void runCases(ScriptRunnerOptions runnerOptions, QueryOptions options) {

    // Console reporter - writes its output straight to console
    final var consoleReporter = new ScriptReporter() {
      @Override
      public void onCrash(ScriptCase scriptCase, RuntimeException error) {
        System.err.println("Unexpected error running " + scriptCase.getSummary() + ": " + error.getMessage());
        ScriptRunnerMain.failures++;
      }

      @Override
      public void onMismatch(ScriptCase scriptCase, String foundOutput) {
        System.err.println("Unexpected output running " + scriptCase.getSummary() + ": expected '" + scriptCase.output + "' but got '" + foundOutput + "'");
        ScriptRunnerMain.failures++;
      }

      @Override
      public void onPass(ScriptCase scriptCase, String output) {
        LOG.debug("Passed {}: {}", scriptCase.getSummary(), output);
        ScriptRunnerMain.successes++;
      }
    };

    final var runner = new ScriptRunner(consoleReporter, options);
    for (Path caseFile : runnerOptions.getFiles()) {
      try (ScriptFileReader reader = new ScriptFileReader(caseFile)) {
        reader.forEachCase(runner);
      } catch (IOException e) {
        LOG.warn("Failed to read case file {}: {}", caseFile, e.getMessage());
        failures++;
      }
    }

    System.err.println();
    System.err.println("PASSED: " + successes + ", FAILED: " + failures);
  }
}
