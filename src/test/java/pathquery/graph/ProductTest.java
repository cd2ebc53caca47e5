package pathquery.graph;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThrows;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;
import org.junit.Test;

public class ProductTest {

  private static StateId s(long id) {
    return StateId.of(id);
  }

  /**
   * Run an automaton on a sequence of labels.
   */
  private static boolean acceptsWord(Automaton automaton, String... word) {
    final Reachability reachability = Reachability.of(automaton);
    SortedSet<StateId> current = reachability.epsilonClosure(automaton.start());
    for (String label : word) {
      final var next = new TreeSet<StateId>();
      for (StateId state : current) {
        next.addAll(automaton.transitions(state).getOrDefault(label, Collections.emptySortedSet()));
      }
      current = reachability.epsilonClosure(next);
    }
    return current.stream().anyMatch(automaton.finals()::contains);
  }

  @Test
  public void whenIntersectingSymbols_PairsStepTogether() {
    final Automaton product = Product.of(Automata.singleSymbol("a"), Automata.singleSymbol("a"));

    assertThat(product.states().size(), is(4));
    assertThat(product.labeledEdges(), contains(new LabeledEdge(StateId.pair(s(0), s(0)), "a", StateId.pair(s(1), s(1)))));
    assertThat(product.start(), contains(StateId.pair(s(0), s(0))));
    assertThat(product.finals(), contains(StateId.pair(s(1), s(1))));
  }

  @Test
  public void whenLabelsDiffer_ProductHasNoTransitions() {
    final Automaton product = Product.of(Automata.singleSymbol("a"), Automata.singleSymbol("b"));

    assertThat(product.transitionCount(), is(0));
    assertThat(Reachability.of(product).accepts(), is(false));
  }

  @Test
  public void whenIntersectingLanguages_OnlyCommonWordsAreAccepted() {
    final Automaton x = Automata.singleSymbol("x");
    final Automaton y = Automata.singleSymbol("y");
    final Automaton z = Automata.singleSymbol("z");
    final Automaton lhs = Automata.union(x, Automata.concat(x, y));
    final Automaton rhs = Automata.union(Automata.concat(x, y), z);

    final Automaton product = Product.of(lhs, rhs);

    assertThat(acceptsWord(product, "x", "y"), is(true));
    assertThat(acceptsWord(product, "x"), is(false));
    assertThat(acceptsWord(product, "z"), is(false));
    assertThat(acceptsWord(product), is(false));
  }

  @Test
  public void whenOneSideMovesOnEpsilon_OtherSideStaysPut() {
    final Automaton ab = Automata.concat(Automata.singleSymbol("a"), Automata.singleSymbol("b"));
    final Automaton product = Product.of(ab, Automata.star(Automata.union(Automata.singleSymbol("a"), Automata.singleSymbol("b"))));

    assertThat(acceptsWord(product, "a", "b"), is(true));
    assertThat(acceptsWord(product, "a"), is(false));
    assertThat(acceptsWord(product, "b", "a"), is(false));
  }

  @Test
  public void whenProductIsTooLarge_ConstructionIsRefused() {
    final StateBudgetExceededException error = assertThrows(
      StateBudgetExceededException.class,
      () -> Product.of(Automata.singleSymbol("a"), Automata.singleSymbol("a"), 3)
    );

    assertThat(error.requiredStates, is(4L));
    assertThat(error.maxStates, is(3L));
  }
}
