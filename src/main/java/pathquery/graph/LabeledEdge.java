package pathquery.graph;

import java.util.Comparator;
import java.util.Objects;

/**
 * Labelled transition between two states.
 *
 * Epsilon transitions are never represented as labelled edges.
 *
 * @param from state where the edge starts
 * @param label symbol on the edge
 * @param to state where the edge ends
 */
public record LabeledEdge(StateId from, String label, StateId to) implements Comparable<LabeledEdge> {

  private static final Comparator<LabeledEdge> ORDER = Comparator
    .comparing(LabeledEdge::from)
    .thenComparing(LabeledEdge::label)
    .thenComparing(LabeledEdge::to);

  public LabeledEdge {
    Objects.requireNonNull(from, "from");
    Objects.requireNonNull(label, "label");
    Objects.requireNonNull(to, "to");
  }

  @Override
  public int compareTo(LabeledEdge other) {
    return ORDER.compare(this, other);
  }

  @Override
  public String toString() {
    return "(" + from + ", \"" + label + "\", " + to + ")";
  }
}
