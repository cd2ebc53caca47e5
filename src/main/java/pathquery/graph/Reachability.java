package pathquery.graph;

import pathquery.util.StateIndex;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reachability queries over an automaton.
 *
 * States are numbered densely once (see {@link StateIndex}) and the
 * transitions flattened into successor arrays, so that each traversal is a
 * plain breadth first search over integers costing {@code O(|states| +
 * |transitions|)}.
 *
 * Alternating "epsilon-close, take any labelled transition, epsilon-close"
 * until nothing new is found visits exactly the states reachable over any
 * mix of epsilon and labelled transitions, which is what the traversals
 * below compute directly.
 */
public final class Reachability {

  private static final Logger LOG = LoggerFactory.getLogger(Reachability.class);

  private final Automaton automaton;
  private final StateIndex index;

  // Successors over epsilon transitions only
  private final int[][] epsilonSuccessors;

  // Successors over epsilon and labelled transitions
  private final int[][] successors;

  private final BitSet finals;

  private Reachability(Automaton automaton) {
    this.automaton = automaton;
    this.index = StateIndex.of(automaton.states());
    this.epsilonSuccessors = new int[index.size()][];
    this.successors = new int[index.size()][];

    for (int i = 0; i < index.size(); i++) {
      final StateId state = index.stateAt(i);
      final var epsilonTargets = new BitSet();
      final var allTargets = new BitSet();
      for (StateId to : automaton.epsilonTargets(state)) {
        epsilonTargets.set(index.indexOf(to));
      }
      allTargets.or(epsilonTargets);
      for (var targets : automaton.transitions(state).values()) {
        for (StateId to : targets) {
          allTargets.set(index.indexOf(to));
        }
      }
      epsilonSuccessors[i] = epsilonTargets.stream().toArray();
      successors[i] = allTargets.stream().toArray();
    }

    this.finals = index.toBitSet(automaton.finals());
  }

  public static Reachability of(Automaton automaton) {
    return new Reachability(automaton);
  }

  /**
   * Smallest superset of the given states closed under epsilon transitions.
   *
   * @param states states of the automaton
   * @return epsilon closure
   */
  public SortedSet<StateId> epsilonClosure(Collection<StateId> states) {
    final BitSet closure = traverse(index.toBitSet(states), epsilonSuccessors);
    return Collections.unmodifiableSortedSet(index.fromBitSet(closure));
  }

  /**
   * States reachable from a given state over any path (including the empty one).
   *
   * @param from state of the automaton
   */
  public SortedSet<StateId> reachableFrom(StateId from) {
    final BitSet seed = new BitSet(index.size());
    seed.set(index.indexOf(from));
    return Collections.unmodifiableSortedSet(index.fromBitSet(traverse(seed, successors)));
  }

  /**
   * Connected pairs of initial and accepting states.
   *
   * @return pairs {@code (start, final)} such that {@code final} is reachable from {@code start}
   */
  public SortedSet<StateId> reachablePairs() {
    return reachablePairs(false);
  }

  /**
   * Connected pairs of initial and accepting states.
   *
   * The traversals from the different initial states are independent, so they
   * may be run in parallel. The result does not depend on how they were run.
   *
   * @param parallel whether to run the traversals on the common pool
   * @return pairs {@code (start, final)} such that {@code final} is reachable from {@code start}
   */
  public SortedSet<StateId> reachablePairs(boolean parallel) {
    final int[] starts = index.toBitSet(automaton.start()).stream().toArray();
    IntStream startStream = IntStream.range(0, starts.length);
    if (parallel) {
      startStream = startStream.parallel();
    }

    final List<List<StateId>> perStart = startStream
      .mapToObj((int i) -> pairsFrom(starts[i]))
      .collect(Collectors.toList());

    final var pairs = new TreeSet<StateId>();
    perStart.forEach(pairs::addAll);
    LOG.debug("{} initial states reach {} accepting pairs", starts.length, pairs.size());
    return Collections.unmodifiableSortedSet(pairs);
  }

  /**
   * Accepting states reachable from any initial state.
   */
  public SortedSet<StateId> reachableFinals() {
    final BitSet reached = traverse(index.toBitSet(automaton.start()), successors);
    reached.and(finals);
    return Collections.unmodifiableSortedSet(index.fromBitSet(reached));
  }

  /**
   * Does the automaton accept any path at all?
   */
  public boolean accepts() {
    return !reachableFinals().isEmpty();
  }

  private List<StateId> pairsFrom(int start) {
    final BitSet seed = new BitSet(index.size());
    seed.set(start);
    final BitSet reached = traverse(seed, successors);
    reached.and(finals);

    final StateId startState = index.stateAt(start);
    final var pairs = new ArrayList<StateId>(reached.cardinality());
    for (int f = reached.nextSetBit(0); f >= 0; f = reached.nextSetBit(f + 1)) {
      pairs.add(StateId.pair(startState, index.stateAt(f)));
    }
    return pairs;
  }

  /**
   * Breadth first search.
   *
   * @param seed initial states (not modified)
   * @param edges successor arrays to follow
   * @return all states reachable from the seed, including the seed itself
   */
  private BitSet traverse(BitSet seed, int[][] edges) {
    final BitSet visited = (BitSet) seed.clone();
    final var toVisit = new ArrayDeque<Integer>();
    seed.stream().forEach(toVisit::add);

    while (!toVisit.isEmpty()) {
      final int next = toVisit.poll();
      for (int to : edges[next]) {
        if (!visited.get(to)) {
          visited.set(to);
          toVisit.add(to);
        }
      }
    }
    return visited;
  }
}
