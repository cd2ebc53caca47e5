package pathquery.graph;

/**
 * Generated labelled graphs.
 */
public final class LabeledGraphs {

  private LabeledGraphs() { }

  /**
   * Two directed cycles sharing the vertex {@code 0}.
   *
   * The first cycle is {@code 0 -> 1 -> ... -> firstCycle -> 0} with every edge
   * labelled {@code firstLabel}. The second cycle is {@code 0 -> firstCycle + 1
   * -> ... -> firstCycle + secondCycle -> 0} with every edge labelled
   * {@code secondLabel}. Every vertex is both initial and accepting.
   *
   * @param firstCycle number of vertices of the first cycle besides {@code 0}
   * @param secondCycle number of vertices of the second cycle besides {@code 0}
   * @param firstLabel label on the edges of the first cycle
   * @param secondLabel label on the edges of the second cycle
   */
  public static Automaton twoCycles(int firstCycle, int secondCycle, String firstLabel, String secondLabel) {
    if (firstCycle < 1 || secondCycle < 1) {
      throw new IllegalArgumentException("both cycles need at least one vertex besides 0");
    }

    final var builder = Automaton.builder();
    addCycle(builder, 1, firstCycle, firstLabel);
    addCycle(builder, firstCycle + 1, secondCycle, secondLabel);

    final Automaton graph = builder.build();
    return graph.withStart(graph.states()).withFinals(graph.states());
  }

  private static void addCycle(Automaton.Builder builder, long firstVertex, int length, String label) {
    StateId previous = StateId.of(0);
    for (long vertex = firstVertex; vertex < firstVertex + length; vertex++) {
      final StateId next = StateId.of(vertex);
      builder.addTransition(previous, label, next);
      previous = next;
    }
    builder.addTransition(previous, label, StateId.of(0));
  }
}
