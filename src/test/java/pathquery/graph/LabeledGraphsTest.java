package pathquery.graph;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasItems;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThrows;

import org.junit.Test;

public class LabeledGraphsTest {

  @Test
  public void whenGeneratingTwoCycles_CyclesShareVertexZero() {
    final Automaton graph = LabeledGraphs.twoCycles(3, 2, "a", "b");

    assertThat(graph.states().size(), is(6));
    assertThat(graph.transitionCount(), is(6));
    assertThat(graph.labels(), contains("a", "b"));
    assertThat(
      graph.labeledEdges(),
      hasItems(
        new LabeledEdge(StateId.of(0), "a", StateId.of(1)),
        new LabeledEdge(StateId.of(3), "a", StateId.of(0)),
        new LabeledEdge(StateId.of(0), "b", StateId.of(4)),
        new LabeledEdge(StateId.of(5), "b", StateId.of(0))
      )
    );
    assertThat(graph.start(), is(graph.states()));
    assertThat(graph.finals(), is(graph.states()));
  }

  @Test
  public void whenCycleIsEmpty_GenerationFails() {
    assertThrows(IllegalArgumentException.class, () -> LabeledGraphs.twoCycles(0, 2, "a", "b"));
  }
}
