package pathquery.graph;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * General information about a graph.
 *
 * @param vertexCount number of states
 * @param edgeCount number of labelled transitions (epsilon transitions are not counted)
 * @param labels labels found on transitions
 */
public record GraphInfo(int vertexCount, int edgeCount, SortedSet<String> labels) {

  public GraphInfo {
    labels = Collections.unmodifiableSortedSet(new TreeSet<>(labels));
  }

  @Override
  public String toString() {
    return "[vertices = " + vertexCount + ", edges = " + edgeCount + ", labels = " + labels + "]";
  }
}
