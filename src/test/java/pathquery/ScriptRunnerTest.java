package pathquery;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThrows;

import pathquery.eval.QueryOptions;
import java.io.File;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class ScriptRunnerTest {

  @Rule
  public final TemporaryFolder folder = new TemporaryFolder();

  /**
   * Reporter remembering every outcome.
   */
  private static final class RecordingReporter implements ScriptReporter {
    final List<String> passed = new ArrayList<>();
    final List<String> failed = new ArrayList<>();

    @Override
    public void onCrash(ScriptCase scriptCase, RuntimeException error) {
      failed.add(scriptCase.program + " -> " + error.getMessage());
    }

    @Override
    public void onMismatch(ScriptCase scriptCase, String foundOutput) {
      failed.add(scriptCase.program + " -> " + foundOutput);
    }

    @Override
    public void onPass(ScriptCase scriptCase, String output) {
      passed.add(scriptCase.program + " -> " + output);
    }
  }

  private static Path resource(String name) throws URISyntaxException {
    return Path.of(ScriptRunnerTest.class.getClassLoader().getResource(name).toURI());
  }

  @Test
  public void whenRunningGoldenCases_AllPass() throws IOException, URISyntaxException {
    final var reporter = new RecordingReporter();
    final var runner = new ScriptRunner(reporter, QueryOptions.defaults());

    try (ScriptFileReader reader = new ScriptFileReader(resource("cases/queries.txt"))) {
      reader.forEachCase(runner);
    }

    assertThat(reporter.failed, is(empty()));
    assertThat(reporter.passed.size(), is(8));
    assertThat(reporter.passed, hasItem("print get_labels(load(\"wine\")) & get_labels(load(\"pizza\")) -> {\"subClassOf\", \"type\"}"));
    assertThat(reporter.passed, hasItem("print set_start(load(\"pizza\"), {1..100}) -> error VALUE"));
  }

  @Test
  public void whenOutputDiffers_MismatchIsReported() throws IOException {
    final File cases = folder.newFile("wrong.txt");
    Files.writeString(
      cases.toPath(),
      "// wrong expectations\nprint {1, 2}\n{2, 1}\n\nprint x\n{}\n\nprint 1\nerror TYPE\n",
      StandardCharsets.UTF_8
    );

    final var reporter = new RecordingReporter();
    try (ScriptFileReader reader = new ScriptFileReader(cases.toPath())) {
      reader.forEachCase(new ScriptRunner(reporter, QueryOptions.defaults()));
    }

    assertThat(reporter.passed, is(empty()));
    assertThat(reporter.failed.get(0), equalTo("print {1, 2} -> {1, 2}"));
    assertThat(reporter.failed.get(1), equalTo("print x -> [NAM01] Variable 'x' is not bound."));
    assertThat(reporter.failed.get(2), equalTo("print 1 -> 1"));
  }

  @Test
  public void whenCaseHasNoExpectedOutput_ReadingFails() throws IOException {
    final File cases = folder.newFile("truncated.txt");
    Files.writeString(cases.toPath(), "print 1\n{1}\nprint 2\n", StandardCharsets.UTF_8);

    try (ScriptFileReader reader = new ScriptFileReader(cases.toPath())) {
      final ScriptCase first = reader.readCase();
      assertThat(first.program, equalTo("print 1"));
      assertThat(first.lineNumber, is(1));
      assertThrows(IOException.class, reader::readCase);
    }
  }

  @Test
  public void whenExpectingError_OutputNamesTheKind() {
    final QueryException error = QueryException.of(ErrorMessage.Name.UNBOUND_VARIABLE, "x");

    assertThat(ScriptCase.createErrorOutput(error), equalTo("error NAME"));
    assertThat(ScriptCase.createOutput(List.of("{1}", "true")), equalTo("{1} | true"));
    assertThat(ScriptCase.createOutput(List.of()), equalTo(""));
  }
}
