package pathquery.graph;

/**
 * Turns the name of a persisted graph into an automaton.
 */
@FunctionalInterface
public interface GraphLoader {

  /**
   * Load a graph.
   *
   * @param nameOrPath name of the graph or path to its file
   * @return graph as an automaton (without epsilon transitions unless the
   *         graph has unlabelled edges)
   * @throws pathquery.QueryException if the graph cannot be found or read
   */
  Automaton load(String nameOrPath);
}
