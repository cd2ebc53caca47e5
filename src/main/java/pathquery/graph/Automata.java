package pathquery.graph;

/**
 * Composition primitives over automata.
 *
 * These are the only rules used to build composite automata out of smaller
 * ones. They never remove epsilon transitions: {@link #concat} and
 * {@link #star} link operands together with epsilon transitions, and every
 * consumer epsilon-closes before looking at labelled transitions.
 *
 * Operands of a binary primitive may use overlapping state identifiers (two
 * graphs can both have a vertex {@code 1}), so every state {@code s} of the
 * left operand becomes {@code (0, s)} and every state of the right operand
 * {@code (1, s)}. The original identifier stays inside the tag, so it can
 * still be destructured.
 */
public final class Automata {

  static final StateId LEFT = StateId.of(0);
  static final StateId RIGHT = StateId.of(1);

  private Automata() { }

  /**
   * Two states, one transition on {@code label} from the initial one to the
   * accepting one.
   *
   * @param label symbol accepted
   */
  public static Automaton singleSymbol(String label) {
    final StateId from = StateId.of(0);
    final StateId to = StateId.of(1);
    return Automaton
      .builder()
      .addTransition(from, label, to)
      .addStart(from)
      .addFinal(to)
      .build();
  }

  /**
   * Single state which is both initial and accepting (accepts only the empty
   * path).
   */
  public static Automaton emptyPath() {
    final StateId state = StateId.of(0);
    return Automaton.builder().addStart(state).addFinal(state).build();
  }

  /**
   * Union of the languages of two automata.
   *
   * @param lhs first operand
   * @param rhs second operand
   * @return automaton whose states are the tagged operand states
   */
  public static Automaton union(Automaton lhs, Automaton rhs) {
    final Automaton left = tagged(lhs, LEFT);
    final Automaton right = tagged(rhs, RIGHT);

    final var builder = Automaton.builder().addAll(left).addAll(right);
    left.start().forEach(builder::addStart);
    right.start().forEach(builder::addStart);
    left.finals().forEach(builder::addFinal);
    right.finals().forEach(builder::addFinal);
    return builder.build();
  }

  /**
   * Concatenation of the languages of two automata.
   *
   * Every accepting state of the first operand gets an epsilon transition to
   * every initial state of the second.
   *
   * @param lhs prefix
   * @param rhs suffix
   * @return automaton starting where {@code lhs} starts and accepting where {@code rhs} accepts
   */
  public static Automaton concat(Automaton lhs, Automaton rhs) {
    final Automaton left = tagged(lhs, LEFT);
    final Automaton right = tagged(rhs, RIGHT);

    final var builder = Automaton.builder().addAll(left).addAll(right);
    for (StateId leftFinal : left.finals()) {
      for (StateId rightStart : right.start()) {
        builder.addEpsilon(leftFinal, rightStart);
      }
    }
    left.start().forEach(builder::addStart);
    right.finals().forEach(builder::addFinal);
    return builder.build();
  }

  /**
   * Kleene closure of the language of an automaton.
   *
   * Every accepting state loops back to every initial state with an epsilon
   * transition, and every initial state becomes accepting. States keep their
   * identifiers. An automaton without initial states gains a fresh one so that
   * the empty path is still accepted.
   *
   * @param automaton operand
   * @return automaton accepting any number of repetitions of the operand
   */
  public static Automaton star(Automaton automaton) {
    if (automaton.start().isEmpty()) {
      return union(automaton, emptyPath());
    }

    final var builder = automaton.toBuilder();
    for (StateId finalState : automaton.finals()) {
      for (StateId startState : automaton.start()) {
        builder.addEpsilon(finalState, startState);
      }
    }
    automaton.start().forEach(builder::addFinal);
    return builder.build();
  }

  /**
   * Pair every state of an automaton with a tag.
   *
   * @param automaton automaton to rename
   * @param tag left component of every renamed state
   */
  static Automaton tagged(Automaton automaton, StateId tag) {
    return automaton.renamed(state -> StateId.pair(tag, state));
  }
}
