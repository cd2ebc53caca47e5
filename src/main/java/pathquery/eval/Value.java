package pathquery.eval;

import pathquery.graph.Automaton;
import pathquery.graph.LabeledEdge;
import pathquery.graph.StateId;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Runtime value of a query program.
 *
 * Values are immutable. The set-typed values ({@link Labels},
 * {@link Vertices}, {@link Edges}) are deduplicated and iterate in the
 * natural order of their elements; that order carries no meaning beyond
 * making output reproducible.
 *
 * Besides the values a program can name directly, there are two element
 * values, {@link Vertex} and {@link Edge}, which show up when a lambda
 * parameter is bound to one element of a set.
 */
public interface Value {

  enum Kind {
    STRING("a string"),
    INT("an int"),
    BOOL("a bool"),
    GRAPH("a graph"),
    LABELS("a set of labels"),
    VERTICES("a set of vertices"),
    EDGES("a set of edges"),
    VERTEX("a vertex"),
    EDGE("an edge");

    public final String description;

    Kind(String description) {
      this.description = description;
    }
  }

  Kind kind();

  /**
   * Set-typed value.
   */
  interface SetValue extends Value {

    int size();

    /**
     * Elements of the set, each as a value of its own.
     */
    List<Value> elements();

    /**
     * Check if an element value is in the set.
     *
     * @param element element value
     * @return whether the element is in the set, or empty if the element is
     *         of a kind which this set cannot contain
     */
    Optional<Boolean> contains(Value element);
  }

  record Str(String value) implements Value {
    @Override
    public Kind kind() {
      return Kind.STRING;
    }
  }

  record Int(long value) implements Value {
    @Override
    public Kind kind() {
      return Kind.INT;
    }
  }

  record Bool(boolean value) implements Value {
    @Override
    public Kind kind() {
      return Kind.BOOL;
    }
  }

  record Graph(Automaton automaton) implements Value {
    @Override
    public Kind kind() {
      return Kind.GRAPH;
    }
  }

  record Labels(SortedSet<String> labels) implements SetValue {
    public Labels {
      labels = Collections.unmodifiableSortedSet(new TreeSet<>(labels));
    }

    @Override
    public Kind kind() {
      return Kind.LABELS;
    }

    @Override
    public int size() {
      return labels.size();
    }

    @Override
    public List<Value> elements() {
      return labels.stream().map(Str::new).collect(Collectors.toList());
    }

    @Override
    public Optional<Boolean> contains(Value element) {
      if (element instanceof Str str) {
        return Optional.of(labels.contains(str.value()));
      }
      return Optional.empty();
    }
  }

  record Vertices(SortedSet<StateId> vertices) implements SetValue {
    public Vertices {
      vertices = Collections.unmodifiableSortedSet(new TreeSet<>(vertices));
    }

    @Override
    public Kind kind() {
      return Kind.VERTICES;
    }

    @Override
    public int size() {
      return vertices.size();
    }

    @Override
    public List<Value> elements() {
      return vertices.stream().map(Vertex::new).collect(Collectors.toList());
    }

    @Override
    public Optional<Boolean> contains(Value element) {
      return asState(element).map(vertices::contains);
    }
  }

  record Edges(SortedSet<LabeledEdge> edges) implements SetValue {
    public Edges {
      edges = Collections.unmodifiableSortedSet(new TreeSet<>(edges));
    }

    @Override
    public Kind kind() {
      return Kind.EDGES;
    }

    @Override
    public int size() {
      return edges.size();
    }

    @Override
    public List<Value> elements() {
      return edges.stream().map(Edge::new).collect(Collectors.toList());
    }

    @Override
    public Optional<Boolean> contains(Value element) {
      if (element instanceof Edge edge) {
        return Optional.of(edges.contains(edge.edge()));
      }
      return Optional.empty();
    }
  }

  /**
   * Single (atomic or composite) vertex.
   */
  record Vertex(StateId id) implements Value {
    @Override
    public Kind kind() {
      return Kind.VERTEX;
    }
  }

  /**
   * Single labelled edge.
   */
  record Edge(LabeledEdge edge) implements Value {
    @Override
    public Kind kind() {
      return Kind.EDGE;
    }
  }

  /**
   * View a value as a vertex: an int denotes the atomic vertex with that id.
   *
   * @param value any value
   * @return state identifier, or empty if the value is not vertex-like
   */
  static Optional<StateId> asState(Value value) {
    if (value instanceof Vertex vertex) {
      return Optional.of(vertex.id());
    } else if (value instanceof Int integer) {
      return Optional.of(StateId.of(integer.value()));
    }
    return Optional.empty();
  }
}
