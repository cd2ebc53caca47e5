package pathquery.graph;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasItems;
import static org.hamcrest.Matchers.is;

import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import org.junit.Test;

public class AutomataTest {

  private static StateId s(long id) {
    return StateId.of(id);
  }

  private static StateId left(StateId state) {
    return StateId.pair(s(0), state);
  }

  private static StateId right(StateId state) {
    return StateId.pair(s(1), state);
  }

  /**
   * Pairs of graph vertices connected by a path the query accepts.
   */
  private static SortedSet<StateId> connectedVertices(Automaton graph, Automaton query) {
    final var projected = new TreeSet<StateId>();
    for (StateId connected : Reachability.of(Product.of(graph, query)).reachablePairs()) {
      final var startAndFinal = (StateId.Pair) connected;
      projected.add(StateId.pair(
        ((StateId.Pair) startAndFinal.left()).left(),
        ((StateId.Pair) startAndFinal.right()).left()
      ));
    }
    return projected;
  }

  /**
   * Strip the tag union added to both sides of every reachable pair.
   */
  private static SortedSet<StateId> untagged(SortedSet<StateId> pairs) {
    final var stripped = new TreeSet<StateId>();
    for (StateId connected : pairs) {
      final var startAndFinal = (StateId.Pair) connected;
      stripped.add(StateId.pair(
        ((StateId.Pair) startAndFinal.left()).right(),
        ((StateId.Pair) startAndFinal.right()).right()
      ));
    }
    return stripped;
  }

  @Test
  public void whenBuildingSingleSymbol_OneTransitionLinksStartToFinal() {
    final Automaton a = Automata.singleSymbol("a");

    assertThat(a.states(), contains(s(0), s(1)));
    assertThat(a.labeledEdges(), contains(new LabeledEdge(s(0), "a", s(1))));
    assertThat(a.start(), contains(s(0)));
    assertThat(a.finals(), contains(s(1)));
  }

  @Test
  public void whenTakingUnion_OperandsAreKeptApart() {
    final Automaton union = Automata.union(Automata.singleSymbol("a"), Automata.singleSymbol("b"));

    assertThat(union.states(), contains(left(s(0)), left(s(1)), right(s(0)), right(s(1))));
    assertThat(union.start(), contains(left(s(0)), right(s(0))));
    assertThat(union.finals(), contains(left(s(1)), right(s(1))));
    assertThat(
      union.labeledEdges(),
      contains(new LabeledEdge(left(s(0)), "a", left(s(1))), new LabeledEdge(right(s(0)), "b", right(s(1))))
    );
    assertThat(union.epsilonCount(), is(0));
  }

  @Test
  public void whenTakingUnionOfAGraphWithItself_StatesAreDoubled() {
    final Automaton graph = LabeledGraphs.twoCycles(2, 1, "a", "b");
    final Automaton union = Automata.union(graph, graph);

    assertThat(union.states().size(), is(2 * graph.states().size()));
    assertThat(union.transitionCount(), is(2 * graph.transitionCount()));
    assertThat(union.start().size(), is(2 * graph.start().size()));
    assertThat(union.states(), hasItems(left(s(2)), right(s(2))));
  }

  @Test
  public void whenTakingUnionOfGraphs_ReachablePairsOfEachOperandSurvive() {
    final Automaton first = LabeledGraphs.twoCycles(2, 1, "a", "b");
    final Automaton second = LabeledGraphs.twoCycles(1, 3, "c", "d");

    final SortedSet<StateId> pairs = untagged(Reachability.of(Automata.union(first, second)).reachablePairs());

    assertThat(pairs.containsAll(Reachability.of(first).reachablePairs()), is(true));
    assertThat(pairs.containsAll(Reachability.of(second).reachablePairs()), is(true));
  }

  @Test
  public void whenQueryingWithUnion_ConnectionsOfEitherQueryAreFound() {
    final Automaton graph = LabeledGraphs.twoCycles(3, 2, "a", "b");
    final Automaton a = Automata.singleSymbol("a");
    final Automaton b = Automata.singleSymbol("b");

    final var expected = new TreeSet<StateId>(connectedVertices(graph, a));
    expected.addAll(connectedVertices(graph, b));

    assertThat(connectedVertices(graph, Automata.union(a, b)), equalTo(expected));
  }

  @Test
  public void whenConcatenating_FinalsOfPrefixLinkToStartsOfSuffix() {
    final Automaton concat = Automata.concat(Automata.singleSymbol("a"), Automata.singleSymbol("b"));

    assertThat(concat.states().size(), is(4));
    assertThat(concat.epsilonTargets(left(s(1))), contains(right(s(0))));
    assertThat(concat.start(), contains(left(s(0))));
    assertThat(concat.finals(), contains(right(s(1))));
    assertThat(Reachability.of(concat).accepts(), is(true));
  }

  @Test
  public void whenConcatenatingWithEmptyAutomaton_NothingIsAccepted() {
    final Automaton concat = Automata.concat(Automata.singleSymbol("a"), Automaton.empty());

    assertThat(concat.finals().isEmpty(), is(true));
    assertThat(Reachability.of(concat).accepts(), is(false));
  }

  @Test
  public void whenStarring_StartsBecomeFinalAndFinalsLoopBack() {
    final Automaton star = Automata.star(Automata.singleSymbol("a"));

    assertThat(star.states(), contains(s(0), s(1)));
    assertThat(star.start(), contains(s(0)));
    assertThat(star.finals(), contains(s(0), s(1)));
    assertThat(star.epsilonTargets(s(1)), contains(s(0)));
  }

  @Test
  public void whenStarringWithoutStartStates_EmptyPathIsStillAccepted() {
    final Automaton noStart = Automata.singleSymbol("a").withStart(Set.of());
    final Automaton star = Automata.star(noStart);

    assertThat(star.states().size(), is(3));
    assertThat(star.start(), contains(right(s(0))));
    assertThat(star.finals(), contains(left(s(1)), right(s(0))));
    assertThat(Reachability.of(star).accepts(), is(true));
  }

  @Test
  public void whenBuildingEmptyPath_SingleStateIsStartAndFinal() {
    final Automaton empty = Automata.emptyPath();

    assertThat(empty.states(), contains(s(0)));
    assertThat(empty.start(), contains(s(0)));
    assertThat(empty.finals(), contains(s(0)));
    assertThat(empty.transitionCount(), is(0));
  }

  @Test
  public void whenStarringTwice_SameConnectionsAreFound() {
    final Automaton graph = LabeledGraphs.twoCycles(3, 2, "a", "b");
    final Automaton a = Automata.singleSymbol("a");
    final Automaton ab = Automata.union(a, Automata.singleSymbol("b"));

    assertThat(connectedVertices(graph, Automata.star(Automata.star(a))), equalTo(connectedVertices(graph, Automata.star(a))));
    assertThat(connectedVertices(graph, Automata.star(Automata.star(ab))), equalTo(connectedVertices(graph, Automata.star(ab))));
    assertThat(Automata.star(Automata.star(a)).finals(), equalTo(Automata.star(a).finals()));
  }

  @Test
  public void whenTagging_CompositeStatesKeepTheirShape() {
    final Automaton product = Product.of(Automata.singleSymbol("a"), Automata.singleSymbol("a"));
    final Automaton tagged = Automata.tagged(product, Automata.RIGHT);

    assertThat(tagged.states().size(), is(4));
    assertThat(
      tagged.labeledEdges(),
      contains(new LabeledEdge(right(StateId.pair(s(0), s(0))), "a", right(StateId.pair(s(1), s(1)))))
    );
    assertThat(tagged.start(), contains(right(StateId.pair(s(0), s(0)))));
  }
}
