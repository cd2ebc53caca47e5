package pathquery.util;

import pathquery.graph.StateId;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Dense numbering of a set of states.
 *
 * States are numbered in their natural order, so the numbering (and anything
 * computed over it) is the same every time for the same set of states. This
 * lets traversals track visited states in a {@link BitSet} instead of a hash
 * set of (possibly deeply nested) state identifiers.
 */
public final class StateIndex {

  private final List<StateId> states;
  private final Map<StateId, Integer> indices;

  private StateIndex(List<StateId> states, Map<StateId, Integer> indices) {
    this.states = states;
    this.indices = indices;
  }

  /**
   * Number a collection of states.
   *
   * @param states states to number (duplicates are ignored)
   * @return numbering of the states
   */
  public static StateIndex of(Collection<StateId> states) {
    final var sorted = new ArrayList<StateId>(new TreeSet<StateId>(states));
    final var indices = new HashMap<StateId, Integer>(sorted.size() * 2);
    for (int i = 0; i < sorted.size(); i++) {
      indices.put(sorted.get(i), i);
    }
    return new StateIndex(Collections.unmodifiableList(sorted), indices);
  }

  public int size() {
    return states.size();
  }

  /**
   * Index of a state.
   *
   * @param state numbered state
   * @return index of the state
   * @throws IllegalArgumentException if the state was not numbered
   */
  public int indexOf(StateId state) {
    final Integer index = indices.get(state);
    if (index == null) {
      throw new IllegalArgumentException("unknown state " + state);
    }
    return index;
  }

  public StateId stateAt(int index) {
    return states.get(index);
  }

  public BitSet toBitSet(Collection<StateId> subset) {
    final var bits = new BitSet(states.size());
    for (StateId state : subset) {
      bits.set(indexOf(state));
    }
    return bits;
  }

  public SortedSet<StateId> fromBitSet(BitSet bits) {
    final var subset = new TreeSet<StateId>();
    for (int i = bits.nextSetBit(0); i >= 0; i = bits.nextSetBit(i + 1)) {
      subset.add(states.get(i));
    }
    return subset;
  }
}
