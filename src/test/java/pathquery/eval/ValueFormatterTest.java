package pathquery.eval;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.startsWith;

import pathquery.graph.Automata;
import pathquery.graph.LabeledEdge;
import pathquery.graph.StateId;
import java.util.List;
import java.util.TreeSet;
import org.junit.Test;

public class ValueFormatterTest {

  private final ValueFormatter summary = new ValueFormatter(QueryOptions.OutputFormat.SUMMARY);

  private final ValueFormatter dot = new ValueFormatter(QueryOptions.OutputFormat.DOT);

  @Test
  public void whenFormattingScalars_TheyArePrintedPlainly() {
    assertThat(summary.format(new Value.Int(-3)), equalTo("-3"));
    assertThat(summary.format(new Value.Bool(true)), equalTo("true"));
    assertThat(summary.format(new Value.Str("say \"hi\"")), equalTo("\"say \\\"hi\\\"\""));
  }

  @Test
  public void whenFormattingSets_ElementsAreSorted() {
    final var vertices = new TreeSet<StateId>(List.of(
      StateId.pair(StateId.of(0), StateId.of(1)),
      StateId.of(3),
      StateId.of(1)
    ));
    assertThat(summary.format(new Value.Vertices(vertices)), equalTo("{1, 3, (0, 1)}"));
    assertThat(summary.format(new Value.Labels(new TreeSet<>(List.of("b", "a")))), equalTo("{\"a\", \"b\"}"));
    assertThat(
      summary.format(new Value.Edges(new TreeSet<>(List.of(
        new LabeledEdge(StateId.of(2), "x", StateId.of(0)),
        new LabeledEdge(StateId.of(0), "y", StateId.of(1))
      )))),
      equalTo("{(0, \"y\", 1), (2, \"x\", 0)}")
    );
  }

  @Test
  public void whenFormattingElements_TheyLookLikeSetElements() {
    assertThat(summary.format(new Value.Vertex(StateId.pair(StateId.of(4), StateId.of(5)))), equalTo("(4, 5)"));
    assertThat(
      summary.format(new Value.Edge(new LabeledEdge(StateId.of(4), "z", StateId.of(5)))),
      equalTo("(4, \"z\", 5)")
    );
  }

  @Test
  public void whenFormattingGraphs_FormatIsHonoured() {
    final Value graph = new Value.Graph(Automata.singleSymbol("a"));

    assertThat(summary.format(graph), equalTo("graph[vertices = 2, edges = 1, labels = [a], start = {0}, final = {1}]"));
    assertThat(dot.format(graph), startsWith("digraph \"graph\" {"));
    assertThat(dot.format(new Value.Int(1)), equalTo("1"));
  }
}
