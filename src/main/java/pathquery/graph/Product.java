package pathquery.graph;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Synchronized product of two automata.
 *
 * The product accepts exactly the label sequences accepted by both operands,
 * which is also how a graph gets queried with a path pattern: the compiled
 * pattern is intersected with the graph.
 *
 *   - states are all the pairs {@code (s1, s2)}, as composite state identifiers
 *
 *   - {@code ((s1, s2), l) -> (t1, t2)} iff {@code (s1, l) -> t1} in the left
 *     operand and {@code (s2, l) -> t2} in the right operand
 *
 *   - an epsilon move in one operand happens while the other operand stays
 *     put: {@code (s1, s2) -> (t1, s2)} for every epsilon {@code s1 -> t1}, and
 *     symmetrically for the right operand
 *
 *   - initial (accepting) states are the pairs of initial (accepting) states
 */
public final class Product {

  private static final Logger LOG = LoggerFactory.getLogger(Product.class);

  private Product() { }

  // Used to index the right operand transitions by label
  private record Step(StateId from, StateId to) { }

  /**
   * Build the product without any bound on its size.
   *
   * @param lhs left operand
   * @param rhs right operand
   */
  public static Automaton of(Automaton lhs, Automaton rhs) {
    return of(lhs, rhs, Long.MAX_VALUE);
  }

  /**
   * Build the product of two automata.
   *
   * @param lhs left operand
   * @param rhs right operand
   * @param maxStates largest number of states the product may have
   * @return synchronized product
   * @throws StateBudgetExceededException if the product would have too many states
   */
  public static Automaton of(Automaton lhs, Automaton rhs, long maxStates) {
    final long stateCount = (long) lhs.states().size() * rhs.states().size();
    if (stateCount > maxStates) {
      throw new StateBudgetExceededException("product", stateCount, maxStates);
    }

    final var builder = Automaton.builder();
    for (StateId left : lhs.states()) {
      for (StateId right : rhs.states()) {
        builder.addState(StateId.pair(left, right));
      }
    }

    // Labelled transitions: both sides must step on the same label
    final Map<String, List<Step>> rightSteps = new HashMap<>();
    rhs.delta().forEach((from, byLabel) -> byLabel.forEach((label, targets) -> {
      final var steps = rightSteps.computeIfAbsent(label, k -> new ArrayList<>());
      for (StateId to : targets) {
        steps.add(new Step(from, to));
      }
    }));
    lhs.delta().forEach((leftFrom, byLabel) -> byLabel.forEach((label, leftTargets) -> {
      final List<Step> steps = rightSteps.get(label);
      if (steps == null) {
        return;
      }
      for (StateId leftTo : leftTargets) {
        for (Step step : steps) {
          builder.addTransition(
            StateId.pair(leftFrom, step.from()),
            label,
            StateId.pair(leftTo, step.to())
          );
        }
      }
    }));

    // Epsilon transitions: one side moves, the other one stays
    lhs.epsilon().forEach((leftFrom, leftTargets) -> {
      for (StateId leftTo : leftTargets) {
        for (StateId right : rhs.states()) {
          builder.addEpsilon(StateId.pair(leftFrom, right), StateId.pair(leftTo, right));
        }
      }
    });
    rhs.epsilon().forEach((rightFrom, rightTargets) -> {
      for (StateId rightTo : rightTargets) {
        for (StateId left : lhs.states()) {
          builder.addEpsilon(StateId.pair(left, rightFrom), StateId.pair(left, rightTo));
        }
      }
    });

    for (StateId left : lhs.start()) {
      for (StateId right : rhs.start()) {
        builder.addStart(StateId.pair(left, right));
      }
    }
    for (StateId left : lhs.finals()) {
      for (StateId right : rhs.finals()) {
        builder.addFinal(StateId.pair(left, right));
      }
    }

    final Automaton product = builder.build();
    LOG.debug("Product of {} and {} states has {} transitions", lhs.states().size(), rhs.states().size(), product.transitionCount());
    return product;
  }
}
