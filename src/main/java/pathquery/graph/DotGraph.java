package pathquery.graph;

import java.util.stream.Stream;

/**
 * Graphs which can be rendered using the DOT language.
 *
 * Compile the output using {@code dot -Tsvg graph.dot > graph.svg}.
 *
 * @param <V> vertex in the graph
 */
public interface DotGraph<V> {

  /**
   * Vertex in the dot graph.
   *
   * @param id unique identifier for the vertex
   * @param initial does every path start here? (drawn with an entry arrow)
   * @param accepting may a path end here? (drawn with a double circle)
   */
  record Vertex<V>(V id, boolean initial, boolean accepting) { }

  /**
   * Edge in the dot graph.
   *
   * @param from vertex where the edge starts
   * @param label symbol on the edge, {@code null} for epsilon edges
   * @param to vertex where the edge ends
   */
  record Edge<V>(V from, String label, V to) { }

  Stream<Vertex<V>> vertices();

  Stream<Edge<V>> edges();

  /**
   * Render the graph into its DOT source.
   *
   * @param name title given to the graph
   * @return source code for the graph
   */
  default String dotGraph(String name) {
    final var builder = new StringBuilder();
    builder.append("digraph ").append(quote(name)).append(" {\n");
    builder.append("  rankdir = LR;\n");

    // Entry arrows come out of invisible points, one per initial vertex
    int entries = 0;
    final Iterable<Vertex<V>> vs = () -> vertices().iterator();
    for (Vertex<V> vertex : vs) {
      final String id = quote(vertex.id().toString());
      builder
        .append("  ")
        .append(id)
        .append(" [shape = ")
        .append(vertex.accepting() ? "doublecircle" : "circle")
        .append(", label = <")
        .append(escapeHtml(vertex.id().toString()))
        .append(">];\n");
      if (vertex.initial()) {
        final String entry = quote("_entry" + ++entries);
        builder.append("  ").append(entry).append(" [shape = point, style = invis];\n");
        builder.append("  ").append(entry).append(" -> ").append(id).append(";\n");
      }
    }

    final Iterable<Edge<V>> es = () -> edges().iterator();
    for (Edge<V> edge : es) {
      final String label = edge.label() == null ? "&epsilon;" : escapeHtml(edge.label());
      builder
        .append("  ")
        .append(quote(edge.from().toString()))
        .append(" -> ")
        .append(quote(edge.to().toString()))
        .append(" [label = <")
        .append(label)
        .append(">")
        .append(edge.label() == null ? ", style = dashed" : "")
        .append("];\n");
    }

    builder.append("}");
    return builder.toString();
  }

  /**
   * Turn a string into a double-quoted DOT ID.
   */
  private static String quote(String str) {
    return "\"" + str.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
  }

  private static String escapeHtml(String str) {
    return str
      .replace("&", "&amp;")
      .replace("<", "&lt;")
      .replace(">", "&gt;")
      .replace("\"", "&quot;");
  }
}
