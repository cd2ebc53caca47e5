package pathquery.graph;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThrows;

import pathquery.ErrorMessage;
import pathquery.QueryException;
import java.io.File;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.TreeSet;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class EdgeListGraphLoaderTest {

  @Rule
  public final TemporaryFolder folder = new TemporaryFolder();

  private static StateId s(long id) {
    return StateId.of(id);
  }

  private EdgeListGraphLoader loader() {
    return new EdgeListGraphLoader(folder.getRoot().toPath(), true);
  }

  @Test
  public void whenLoadingBundledGraph_EveryVertexIsAnEndpoint() {
    final Automaton wine = loader().load("wine");

    assertThat(wine.info(), equalTo(new GraphInfo(121, 121, new TreeSet<>(List.of("domain", "label", "subClassOf", "type")))));
    assertThat(wine.start(), is(wine.states()));
    assertThat(wine.finals(), is(wine.states()));
  }

  @Test
  public void whenEndpointsAreNotDefaulted_NoVertexIsAnEndpoint() {
    final Automaton pizza = new EdgeListGraphLoader(folder.getRoot().toPath(), false).load("pizza");

    assertThat(pizza.info(), equalTo(new GraphInfo(10, 10, new TreeSet<>(List.of("hasBase", "hasTopping", "subClassOf", "type")))));
    assertThat(pizza.start().isEmpty(), is(true));
    assertThat(pizza.finals().isEmpty(), is(true));
  }

  @Test
  public void whenNameIsInGraphDirectory_CsvExtensionIsOptional() throws IOException {
    final File graph = folder.newFile("triangle.csv");
    Files.writeString(graph.toPath(), "0 1 a\n1 2 b\n2 0 c\n", StandardCharsets.UTF_8);

    assertThat(loader().load("triangle").transitionCount(), is(3));
    assertThat(loader().load("triangle.csv").transitionCount(), is(3));
    assertThat(loader().load(graph.getPath()).transitionCount(), is(3));
  }

  @Test
  public void whenEdgeHasNoLabel_ItBecomesAnEpsilonTransition() throws IOException {
    final Automaton graph = loader().read("g", new StringReader("# comment\n\n0 1\n1, 2, a\n"));

    assertThat(graph.epsilonTargets(s(0)), contains(s(1)));
    assertThat(graph.labeledEdges(), contains(new LabeledEdge(s(1), "a", s(2))));
  }

  @Test
  public void whenGraphIsMissing_LoadErrorIsRaised() {
    final QueryException error = assertThrows(QueryException.class, () -> loader().load("no_such_graph"));

    assertThat(error.kind(), is(ErrorMessage.Kind.LOAD));
    assertThat(error.errorMessage(), is(ErrorMessage.Load.GRAPH_NOT_FOUND));
    assertThat(error.getMessage(), containsString("no_such_graph"));
  }

  @Test
  public void whenVertexIsNotAnInteger_LineIsReported() {
    final QueryException error = assertThrows(
      QueryException.class,
      () -> loader().read("g", new StringReader("0 1 a\nx 2 b\n"))
    );

    assertThat(error.errorMessage(), is(ErrorMessage.Load.MALFORMED_EDGE));
    assertThat(error.getMessage(), containsString("line 2"));
    assertThat(error.getCause(), instanceOf(NumberFormatException.class));
  }

  @Test
  public void whenLineHasTooManyFields_LoadErrorIsRaised() {
    final QueryException error = assertThrows(
      QueryException.class,
      () -> loader().read("g", new StringReader("0 1 a b\n"))
    );

    assertThat(error.code(), equalTo("LOD03"));
  }
}
