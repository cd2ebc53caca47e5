package pathquery.graph;

import java.util.Objects;

/**
 * Identifier of a state in an automaton.
 *
 * A state is either an atomic vertex (as found in a loaded graph or produced
 * by a composition primitive) or a composite pair produced by a product
 * construction. Pairs nest arbitrarily deep when products are chained, and
 * they are never equal to an atomic state, even one with the same printed
 * form.
 *
 * States are totally ordered: atomic states come before composite ones,
 * atomic states are ordered by id and pairs lexicographically. The ordering
 * is what makes every set of states iterate deterministically.
 */
public interface StateId extends Comparable<StateId> {

  /**
   * Atomic vertex.
   *
   * @param id vertex identifier
   */
  record Atomic(long id) implements StateId {
    @Override
    public String toString() {
      return Long.toString(id);
    }
  }

  /**
   * Composite state of a product.
   *
   * @param left state of the left operand
   * @param right state of the right operand
   */
  record Pair(StateId left, StateId right) implements StateId {
    public Pair {
      Objects.requireNonNull(left, "left");
      Objects.requireNonNull(right, "right");
    }

    @Override
    public String toString() {
      return "(" + left + ", " + right + ")";
    }
  }

  static StateId of(long id) {
    return new Atomic(id);
  }

  static StateId pair(StateId left, StateId right) {
    return new Pair(left, right);
  }

  /**
   * Nesting depth of the identifier: zero for atomic states.
   */
  default int depth() {
    if (this instanceof Pair pair) {
      return 1 + Math.max(pair.left().depth(), pair.right().depth());
    }
    return 0;
  }

  @Override
  default int compareTo(StateId other) {
    if (this instanceof Atomic thisAtomic) {
      if (other instanceof Atomic otherAtomic) {
        return Long.compare(thisAtomic.id(), otherAtomic.id());
      }
      return -1;
    }

    final Pair thisPair = (Pair) this;
    if (other instanceof Pair otherPair) {
      final int byLeft = thisPair.left().compareTo(otherPair.left());
      return byLeft != 0 ? byLeft : thisPair.right().compareTo(otherPair.right());
    }
    return 1;
  }
}
