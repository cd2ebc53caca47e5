package pathquery.eval;

import pathquery.graph.Automaton;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Renders values as text.
 *
 * Output is deterministic: sets are listed in the natural order of their
 * elements. Labels are quoted, vertices are their ids (composite vertices as
 * nested pairs) and edges are {@code (from, "label", to)}. Graphs are either
 * summarised or rendered as DOT source.
 */
public final class ValueFormatter {

  private final QueryOptions.OutputFormat graphFormat;

  public ValueFormatter(QueryOptions.OutputFormat graphFormat) {
    this.graphFormat = graphFormat;
  }

  public String format(Value value) {
    if (value instanceof Value.Graph graph && graphFormat == QueryOptions.OutputFormat.DOT) {
      return graph.automaton().dotGraph("graph");
    }
    return describe(value);
  }

  /**
   * Summary rendering of a value, independent of the graph format.
   *
   * @param value any value
   * @return one-line text
   */
  public static String describe(Value value) {
    if (value instanceof Value.Str str) {
      return quote(str.value());
    } else if (value instanceof Value.Int integer) {
      return Long.toString(integer.value());
    } else if (value instanceof Value.Bool bool) {
      return Boolean.toString(bool.value());
    } else if (value instanceof Value.Vertex vertex) {
      return vertex.id().toString();
    } else if (value instanceof Value.Edge edge) {
      return edge.edge().toString();
    } else if (value instanceof Value.Labels labels) {
      return braces(labels.labels().stream().map(ValueFormatter::quote));
    } else if (value instanceof Value.Vertices vertices) {
      return braces(vertices.vertices().stream().map(Object::toString));
    } else if (value instanceof Value.Edges edges) {
      return braces(edges.edges().stream().map(Object::toString));
    } else if (value instanceof Value.Graph graph) {
      return summary(graph.automaton());
    }
    throw new IllegalArgumentException("cannot format " + value);
  }

  private static String summary(Automaton automaton) {
    final var info = automaton.info();
    return "graph[vertices = " + info.vertexCount()
      + ", edges = " + info.edgeCount()
      + ", labels = " + info.labels()
      + ", start = " + braces(automaton.start().stream().map(Object::toString))
      + ", final = " + braces(automaton.finals().stream().map(Object::toString))
      + "]";
  }

  private static String braces(Stream<String> elements) {
    return elements.collect(Collectors.joining(", ", "{", "}"));
  }

  private static String quote(String label) {
    return "\"" + label.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
  }
}
