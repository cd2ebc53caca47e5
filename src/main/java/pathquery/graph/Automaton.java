package pathquery.graph;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * Non-deterministic finite automaton with epsilon transitions.
 *
 * This one type represents both loaded graphs (states are vertices and every
 * labelled edge is a transition) and compiled path patterns, so that every
 * language operator applies to both uniformly.
 *
 * Invariants, checked on construction:
 *
 *   - {@code start} and {@code finals} are subsets of {@code states}
 *
 *   - every state mentioned in {@code epsilon} or {@code delta} (as source or
 *     as target) is in {@code states}
 *
 * All of the collections are sorted and not modifiable. Maps only have
 * entries for states with at least one outgoing transition of that sort.
 *
 * @param states all states
 * @param epsilon epsilon transitions, indexed along the starting state
 * @param delta labelled transitions, indexed along the starting state and then the label
 * @param start initial states
 * @param finals accepting states
 */
public record Automaton(
  SortedSet<StateId> states,
  SortedMap<StateId, SortedSet<StateId>> epsilon,
  SortedMap<StateId, SortedMap<String, SortedSet<StateId>>> delta,
  SortedSet<StateId> start,
  SortedSet<StateId> finals
) implements DotGraph<StateId> {

  public Automaton {
    states = freezeSet(states);
    epsilon = freezeEpsilon(epsilon);
    delta = freezeDelta(delta);
    start = freezeSet(start);
    finals = freezeSet(finals);

    requireKnown(states, start, "start state");
    requireKnown(states, finals, "final state");
    for (var entry : epsilon.entrySet()) {
      requireKnown(states, Set.of(entry.getKey()), "epsilon source");
      requireKnown(states, entry.getValue(), "epsilon target");
    }
    for (var entry : delta.entrySet()) {
      requireKnown(states, Set.of(entry.getKey()), "transition source");
      for (var targets : entry.getValue().values()) {
        requireKnown(states, targets, "transition target");
      }
    }
  }

  /**
   * Automaton with no states at all (accepts nothing).
   */
  public static Automaton empty() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builder initialized with all of the components of this automaton.
   */
  public Builder toBuilder() {
    final var builder = new Builder();
    states.forEach(builder::addState);
    epsilon.forEach((from, targets) -> targets.forEach(to -> builder.addEpsilon(from, to)));
    delta.forEach((from, byLabel) -> byLabel.forEach((label, targets) -> {
      targets.forEach(to -> builder.addTransition(from, label, to));
    }));
    start.forEach(builder::addStart);
    finals.forEach(builder::addFinal);
    return builder;
  }

  /**
   * Labelled transitions out of a state.
   *
   * @param from state inside the automaton
   * @return mapping from label to target states (empty if there are none)
   */
  public SortedMap<String, SortedSet<StateId>> transitions(StateId from) {
    return delta.getOrDefault(from, Collections.emptySortedMap());
  }

  /**
   * Epsilon transitions out of a state.
   *
   * @param from state inside the automaton
   * @return targets of the epsilon transitions (empty if there are none)
   */
  public SortedSet<StateId> epsilonTargets(StateId from) {
    return epsilon.getOrDefault(from, Collections.emptySortedSet());
  }

  /**
   * Labels used on any labelled transition, ignoring start and final states.
   */
  public SortedSet<String> labels() {
    final var labels = new TreeSet<String>();
    for (var byLabel : delta.values()) {
      labels.addAll(byLabel.keySet());
    }
    return Collections.unmodifiableSortedSet(labels);
  }

  /**
   * All labelled transitions. Epsilon transitions are skipped.
   */
  public SortedSet<LabeledEdge> labeledEdges() {
    final var edges = new TreeSet<LabeledEdge>();
    delta.forEach((from, byLabel) -> byLabel.forEach((label, targets) -> {
      for (StateId to : targets) {
        edges.add(new LabeledEdge(from, label, to));
      }
    }));
    return Collections.unmodifiableSortedSet(edges);
  }

  public int transitionCount() {
    int count = 0;
    for (var byLabel : delta.values()) {
      for (var targets : byLabel.values()) {
        count += targets.size();
      }
    }
    return count;
  }

  public int epsilonCount() {
    int count = 0;
    for (var targets : epsilon.values()) {
      count += targets.size();
    }
    return count;
  }

  /**
   * Copy of this automaton with a different set of initial states.
   *
   * @param newStart initial states, all of which must already be states
   */
  public Automaton withStart(Set<StateId> newStart) {
    return new Automaton(states, epsilon, delta, new TreeSet<>(newStart), finals);
  }

  /**
   * Copy of this automaton with a different set of accepting states.
   *
   * @param newFinals accepting states, all of which must already be states
   */
  public Automaton withFinals(Set<StateId> newFinals) {
    return new Automaton(states, epsilon, delta, start, new TreeSet<>(newFinals));
  }

  /**
   * Rename every state.
   *
   * @param renaming injective mapping over the states
   * @return automaton with the same shape over the renamed states
   */
  public Automaton renamed(Function<StateId, StateId> renaming) {
    final var builder = new Builder();
    states.forEach(s -> builder.addState(renaming.apply(s)));
    epsilon.forEach((from, targets) -> {
      targets.forEach(to -> builder.addEpsilon(renaming.apply(from), renaming.apply(to)));
    });
    delta.forEach((from, byLabel) -> byLabel.forEach((label, targets) -> {
      targets.forEach(to -> builder.addTransition(renaming.apply(from), label, renaming.apply(to)));
    }));
    start.forEach(s -> builder.addStart(renaming.apply(s)));
    finals.forEach(s -> builder.addFinal(renaming.apply(s)));

    final Automaton renamed = builder.build();
    if (renamed.states.size() != states.size()) {
      throw new IllegalArgumentException("state renaming must be injective");
    }
    return renamed;
  }

  public GraphInfo info() {
    return new GraphInfo(states.size(), transitionCount(), labels());
  }

  @Override
  public Stream<DotGraph.Vertex<StateId>> vertices() {
    return states
      .stream()
      .map((StateId id) -> new DotGraph.Vertex<StateId>(id, start.contains(id), finals.contains(id)));
  }

  @Override
  public Stream<DotGraph.Edge<StateId>> edges() {
    final var epsilonEdges = epsilon
      .entrySet()
      .stream()
      .flatMap(entry -> entry
        .getValue()
        .stream()
        .map((StateId to) -> new DotGraph.Edge<StateId>(entry.getKey(), null, to)));
    final var labelledEdges = labeledEdges()
      .stream()
      .map(edge -> new DotGraph.Edge<StateId>(edge.from(), edge.label(), edge.to()));
    return Stream.concat(epsilonEdges, labelledEdges);
  }

  @Override
  public String toString() {
    return "Automaton" + info();
  }

  private static void requireKnown(Set<StateId> states, Set<StateId> referenced, String role) {
    for (StateId state : referenced) {
      if (!states.contains(state)) {
        throw new IllegalArgumentException(role + " " + state + " is not a state of the automaton");
      }
    }
  }

  private static SortedSet<StateId> freezeSet(Set<StateId> set) {
    return Collections.unmodifiableSortedSet(new TreeSet<>(set));
  }

  private static SortedMap<StateId, SortedSet<StateId>> freezeEpsilon(
    Map<StateId, ? extends Set<StateId>> epsilon
  ) {
    final var frozen = new TreeMap<StateId, SortedSet<StateId>>();
    epsilon.forEach((from, targets) -> {
      if (!targets.isEmpty()) {
        frozen.put(from, freezeSet(targets));
      }
    });
    return Collections.unmodifiableSortedMap(frozen);
  }

  private static SortedMap<StateId, SortedMap<String, SortedSet<StateId>>> freezeDelta(
    Map<StateId, ? extends Map<String, ? extends Set<StateId>>> delta
  ) {
    final var frozen = new TreeMap<StateId, SortedMap<String, SortedSet<StateId>>>();
    delta.forEach((from, byLabel) -> {
      final var frozenByLabel = new TreeMap<String, SortedSet<StateId>>();
      byLabel.forEach((label, targets) -> {
        if (!targets.isEmpty()) {
          frozenByLabel.put(label, freezeSet(targets));
        }
      });
      if (!frozenByLabel.isEmpty()) {
        frozen.put(from, Collections.unmodifiableSortedMap(frozenByLabel));
      }
    });
    return Collections.unmodifiableSortedMap(frozen);
  }

  /**
   * Incremental construction of an automaton.
   *
   * Adding a transition implicitly adds both of its endpoints as states, and
   * so does marking a state as initial or accepting.
   */
  public static final class Builder {
    private final SortedSet<StateId> states = new TreeSet<>();
    private final SortedMap<StateId, SortedSet<StateId>> epsilon = new TreeMap<>();
    private final SortedMap<StateId, SortedMap<String, SortedSet<StateId>>> delta = new TreeMap<>();
    private final SortedSet<StateId> start = new TreeSet<>();
    private final SortedSet<StateId> finals = new TreeSet<>();

    private Builder() { }

    public Builder addState(StateId state) {
      states.add(state);
      return this;
    }

    public Builder addTransition(StateId from, String label, StateId to) {
      states.add(from);
      states.add(to);
      delta
        .computeIfAbsent(from, k -> new TreeMap<>())
        .computeIfAbsent(label, k -> new TreeSet<>())
        .add(to);
      return this;
    }

    public Builder addEpsilon(StateId from, StateId to) {
      states.add(from);
      states.add(to);
      epsilon.computeIfAbsent(from, k -> new TreeSet<>()).add(to);
      return this;
    }

    public Builder addStart(StateId state) {
      states.add(state);
      start.add(state);
      return this;
    }

    public Builder addFinal(StateId state) {
      states.add(state);
      finals.add(state);
      return this;
    }

    public Builder addAll(Automaton other) {
      other.states.forEach(this::addState);
      other.epsilon.forEach((from, targets) -> targets.forEach(to -> addEpsilon(from, to)));
      other.delta.forEach((from, byLabel) -> byLabel.forEach((label, targets) -> {
        targets.forEach(to -> addTransition(from, label, to));
      }));
      return this;
    }

    /**
     * States added so far.
     */
    public Set<StateId> states() {
      return Collections.unmodifiableSet(states);
    }

    public Automaton build() {
      return new Automaton(states, epsilon, delta, start, finals);
    }
  }
}
