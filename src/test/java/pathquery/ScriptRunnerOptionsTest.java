package pathquery;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThrows;

import pathquery.eval.QueryOptions;
import java.nio.file.Paths;
import org.apache.commons.cli.ParseException;
import org.junit.Test;

public class ScriptRunnerOptionsTest {

  @Test
  public void whenNoOptionsAreGiven_DefaultsApply() throws ParseException {
    final ScriptRunnerOptions options = ScriptRunnerOptions.create(new String[] {"a.pq"});
    final QueryOptions queryOptions = options.getQueryOptions();

    assertThat(options.displayHelp(), is(false));
    assertThat(options.runCases(), is(false));
    assertThat(options.getFiles(), contains(Paths.get("a.pq")));
    assertThat(queryOptions.defaultEndpoints, is(QueryOptions.DefaultEndpoints.ALL_VERTICES));
    assertThat(queryOptions.maxProductStates, is(QueryOptions.DEFAULT_MAX_PRODUCT_STATES));
    assertThat(queryOptions.outputFormat, is(QueryOptions.OutputFormat.SUMMARY));
  }

  @Test
  public void whenOptionsAreGiven_TheyReachQueryOptions() throws ParseException {
    final ScriptRunnerOptions options = ScriptRunnerOptions.create(new String[] {
      "--cases", "-d", "graphs", "-o", "dot", "-p", "-m", "500", "-e", "none", "cases.txt"
    });
    final QueryOptions queryOptions = options.getQueryOptions();

    assertThat(options.runCases(), is(true));
    assertThat(queryOptions.graphDirectory, equalTo(Paths.get("graphs")));
    assertThat(queryOptions.outputFormat, is(QueryOptions.OutputFormat.DOT));
    assertThat(queryOptions.parallelReachability, is(true));
    assertThat(queryOptions.maxProductStates, is(500L));
    assertThat(queryOptions.defaultEndpoints, is(QueryOptions.DefaultEndpoints.NO_VERTICES));
  }

  @Test
  public void whenNoFilesAreGiven_HelpIsDisplayed() throws ParseException {
    assertThat(ScriptRunnerOptions.create(new String[] {}).displayHelp(), is(true));
    assertThat(ScriptRunnerOptions.create(new String[] {"-h", "a.pq"}).displayHelp(), is(true));
  }

  @Test
  public void whenOptionValueIsInvalid_ParsingFails() throws ParseException {
    assertThrows(ParseException.class, () -> ScriptRunnerOptions.create(new String[] {"-o", "xml", "a"}).getQueryOptions());
    assertThrows(ParseException.class, () -> ScriptRunnerOptions.create(new String[] {"-m", "0", "a"}).getQueryOptions());
    assertThrows(ParseException.class, () -> ScriptRunnerOptions.create(new String[] {"-e", "some", "a"}).getQueryOptions());
    assertThrows(ParseException.class, () -> ScriptRunnerOptions.create(new String[] {"--bogus"}));
  }
}
