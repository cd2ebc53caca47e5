package pathquery.eval;

import pathquery.ErrorMessage;
import pathquery.QueryException;
import pathquery.graph.Automaton;
import pathquery.graph.EdgeListGraphLoader;
import pathquery.graph.GraphLoader;
import pathquery.graph.LabeledEdge;
import pathquery.graph.Reachability;
import pathquery.graph.StateId;
import pathquery.parser.Expr;
import pathquery.parser.ExprVisitor;
import pathquery.parser.Lambda;
import pathquery.parser.Pattern;
import pathquery.parser.Program;
import pathquery.parser.Stmt;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs query programs.
 *
 * Statements execute strictly in source order against one environment. The
 * first error aborts the run: there is no partial success.
 *
 * An evaluator is bound to one environment. Lambda bodies are evaluated by a
 * child evaluator sharing everything but the environment.
 */
public final class Evaluator implements ExprVisitor<Value>, Stmt.Visitor<Void> {

  private static final Logger LOG = LoggerFactory.getLogger(Evaluator.class);

  // Shape errors only show this many of the offending vertices
  private static final int MAX_REPORTED_VERTICES = 10;

  private final Environment environment;
  private final GraphLoader loader;
  private final RegexCompiler compiler;
  private final QueryOptions options;
  private final Consumer<Value> printer;

  public Evaluator(
    Environment environment,
    GraphLoader loader,
    QueryOptions options,
    Consumer<Value> printer
  ) {
    this.environment = environment;
    this.loader = loader;
    this.compiler = new RegexCompiler(options.maxProductStates);
    this.options = options;
    this.printer = printer;
  }

  /**
   * Evaluator over a fresh environment, loading graphs from edge lists.
   *
   * @param options settings of the run
   * @param printer receives every printed value
   */
  public static Evaluator create(QueryOptions options, Consumer<Value> printer) {
    final var loader = new EdgeListGraphLoader(
      options.graphDirectory,
      options.defaultEndpoints == QueryOptions.DefaultEndpoints.ALL_VERTICES
    );
    return new Evaluator(Environment.empty(), loader, options, printer);
  }

  public Environment environment() {
    return environment;
  }

  /**
   * Run every statement of a program.
   *
   * @param program parsed program
   * @throws QueryException on the first statement that fails
   */
  public void run(Program program) {
    for (Stmt statement : program.statements()) {
      execute(statement);
    }
  }

  public void execute(Stmt statement) {
    LOG.debug("Executing line {}: {}", statement.line(), statement);
    statement.accept(this);
  }

  public Value evaluate(Expr expr) {
    return expr.accept(this);
  }

  @Override
  public Void visitBind(Stmt.Bind bind) {
    final Value value = evaluate(bind.expr());
    environment.bind(bind.name(), value);
    LOG.debug("Bound '{}' to {}", bind.name(), value.kind().description);
    return null;
  }

  @Override
  public Void visitPrint(Stmt.Print print) {
    printer.accept(evaluate(print.expr()));
    return null;
  }

  @Override
  public Value visitVar(Expr.Var var) {
    return environment.lookup(var.name());
  }

  @Override
  public Value visitString(Expr.StringLiteral literal) {
    return new Value.Str(literal.value());
  }

  @Override
  public Value visitInt(Expr.IntLiteral literal) {
    return new Value.Int(literal.value());
  }

  @Override
  public Value visitBool(Expr.BoolLiteral literal) {
    return new Value.Bool(literal.value());
  }

  @Override
  public Value visitSet(Expr.SetLiteral literal) {
    final var elements = new ArrayList<Value>();
    for (Expr element : literal.elements()) {
      elements.add(evaluate(element));
    }
    return collect(elements, Value.Kind.VERTICES, ErrorMessage.Type.MIXED_SET, null);
  }

  @Override
  public Value visitRange(Expr.RangeLiteral literal) {
    final long from = literal.from();
    final long to = literal.to();
    final var vertices = new TreeSet<StateId>();
    if (to < from) {
      return new Value.Vertices(vertices);
    }

    // A negative difference means the subtraction overflowed
    final long span = to - from;
    if (span < 0 || span >= options.maxProductStates) {
      throw QueryException.of(ErrorMessage.Resource.RANGE_TOO_LARGE, from, to, options.maxProductStates);
    }
    for (long id = from; ; id++) {
      vertices.add(StateId.of(id));
      if (id == to) {
        break;
      }
    }
    return new Value.Vertices(vertices);
  }

  @Override
  public Value visitTuple(Expr.TupleLiteral literal) {
    final var components = new ArrayList<Value>();
    for (Expr element : literal.elements()) {
      components.add(evaluate(element));
    }

    if (components.size() == 2) {
      final Optional<StateId> left = Value.asState(components.get(0));
      final Optional<StateId> right = Value.asState(components.get(1));
      if (left.isPresent() && right.isPresent()) {
        return new Value.Vertex(StateId.pair(left.get(), right.get()));
      }
    } else if (components.size() == 3 && components.get(1) instanceof Value.Str label) {
      final Optional<StateId> from = Value.asState(components.get(0));
      final Optional<StateId> to = Value.asState(components.get(2));
      if (from.isPresent() && to.isPresent()) {
        return new Value.Edge(new LabeledEdge(from.get(), label.value(), to.get()));
      }
    }

    final String kinds = components
      .stream()
      .map(component -> component.kind().description)
      .collect(Collectors.joining(", "));
    throw QueryException.of(ErrorMessage.Type.INVALID_TUPLE, kinds);
  }

  @Override
  public Value visitLoad(Expr.Load load) {
    final Value path = evaluate(load.path());
    if (path instanceof Value.Str name) {
      return new Value.Graph(loader.load(name.value()));
    }
    throw unexpectedKind("load", Value.Kind.STRING, path);
  }

  @Override
  public Value visitUpdateEndpoints(Expr.UpdateEndpoints update) {
    final String operator = update.update().keyword;
    Value verticesValue = evaluate(update.vertices());
    Value graphValue = evaluate(update.graph());

    // The operands differ in kind, so they may be written in either order
    if (verticesValue instanceof Value.Graph && !(graphValue instanceof Value.Graph)) {
      final Value swapped = verticesValue;
      verticesValue = graphValue;
      graphValue = swapped;
    }
    if (!(verticesValue instanceof Value.Vertices vertices)) {
      throw unexpectedKind(operator, Value.Kind.VERTICES, verticesValue);
    }
    final Automaton graph = graphOperand(operator, graphValue);

    final var unknown = new TreeSet<StateId>(vertices.vertices());
    unknown.removeAll(graph.states());
    if (!unknown.isEmpty()) {
      final String shown = unknown
        .stream()
        .limit(MAX_REPORTED_VERTICES)
        .map(StateId::toString)
        .collect(Collectors.joining(", ", "{", unknown.size() > MAX_REPORTED_VERTICES ? ", ...}" : "}"));
      throw QueryException.of(ErrorMessage.Value.UNKNOWN_VERTICES, operator, unknown.size() + " vertices " + shown);
    }

    final SortedSet<StateId> current = update.update().start() ? graph.start() : graph.finals();
    final var updated = new TreeSet<StateId>(vertices.vertices());
    if (!update.update().replaces()) {
      updated.addAll(current);
    }

    return new Value.Graph(update.update().start() ? graph.withStart(updated) : graph.withFinals(updated));
  }

  @Override
  public Value visitProject(Expr.Project project) {
    final Automaton graph = graphOperand(project.projection().keyword, evaluate(project.graph()));
    switch (project.projection()) {
      case GET_START:
        return new Value.Vertices(graph.start());
      case GET_FINAL:
        return new Value.Vertices(graph.finals());
      case GET_VERTICES:
        return new Value.Vertices(graph.states());
      case GET_LABELS:
        return new Value.Labels(graph.labels());
      case GET_EDGES:
        return new Value.Edges(graph.labeledEdges());
      case GET_REACHABLE:
        return new Value.Vertices(Reachability.of(graph).reachablePairs(options.parallelReachability));
      default:
        throw new IllegalStateException("unknown projection " + project.projection());
    }
  }

  @Override
  public Value visitMap(Expr.Map map) {
    final Value.SetValue source = setOperand("map", evaluate(map.source()));
    final var results = new ArrayList<Value>(source.size());
    for (Value element : source.elements()) {
      results.add(apply(map.lambda(), element));
    }
    return collect(results, source.kind(), ErrorMessage.Type.MIXED_MAP_RESULT, ErrorMessage.Type.MAP_RESULT);
  }

  @Override
  public Value visitFilter(Expr.Filter filter) {
    final Value.SetValue source = setOperand("filter", evaluate(filter.source()));
    final var kept = new ArrayList<Value>();
    for (Value element : source.elements()) {
      final Value keep = apply(filter.lambda(), element);
      if (!(keep instanceof Value.Bool predicate)) {
        throw QueryException.of(ErrorMessage.Type.FILTER_RESULT, keep.kind().description);
      }
      if (predicate.value()) {
        kept.add(element);
      }
    }
    return collect(kept, source.kind(), ErrorMessage.Type.MIXED_SET, null);
  }

  @Override
  public Value visitIntersect(Expr.Intersect intersect) {
    final Value lhs = evaluate(intersect.lhs());
    final Value rhs = evaluate(intersect.rhs());
    if (lhs instanceof Value.SetValue left && rhs instanceof Value.SetValue right) {
      return combineSets("&", left, right, true);
    }
    return new Value.Graph(compiler.intersect(lhs, rhs));
  }

  @Override
  public Value visitConcat(Expr.Concat concat) {
    return new Value.Graph(compiler.concat(evaluate(concat.lhs()), evaluate(concat.rhs())));
  }

  @Override
  public Value visitUnion(Expr.Union union) {
    final Value lhs = evaluate(union.lhs());
    final Value rhs = evaluate(union.rhs());
    if (lhs instanceof Value.SetValue left && rhs instanceof Value.SetValue right) {
      return combineSets("|", left, right, false);
    }
    return new Value.Graph(compiler.union(lhs, rhs));
  }

  @Override
  public Value visitStar(Expr.Star star) {
    return new Value.Graph(compiler.star(evaluate(star.arg())));
  }

  @Override
  public Value visitSmb(Expr.Smb smb) {
    return new Value.Graph(compiler.symbol(evaluate(smb.label())));
  }

  @Override
  public Value visitIn(Expr.In in) {
    final Value element = evaluate(in.element());
    final Value.SetValue collection = setOperand("in", evaluate(in.collection()));
    return collection
      .contains(element)
      .map(Value.Bool::new)
      .orElseThrow(() -> QueryException.of(
        ErrorMessage.Type.INVALID_MEMBERSHIP,
        element.kind().description,
        collection.kind().description
      ));
  }

  @Override
  public Value visitNot(Expr.Not not) {
    return new Value.Bool(!boolOperand("not", evaluate(not.arg())));
  }

  @Override
  public Value visitAnd(Expr.And and) {
    return new Value.Bool(
      boolOperand("and", evaluate(and.lhs())) && boolOperand("and", evaluate(and.rhs()))
    );
  }

  @Override
  public Value visitOr(Expr.Or or) {
    return new Value.Bool(
      boolOperand("or", evaluate(or.lhs())) || boolOperand("or", evaluate(or.rhs()))
    );
  }

  /**
   * Evaluate a lambda body on one element.
   *
   * @param lambda function to apply
   * @param element argument, matched against the parameter pattern
   * @return value of the body
   */
  private Value apply(Lambda lambda, Value element) {
    final Environment scope = environment.child();
    bindPattern(lambda.parameter(), element, scope);
    final var bodyEvaluator = new Evaluator(scope, loader, options, printer);
    return bodyEvaluator.evaluate(lambda.body());
  }

  /**
   * Match a value against a parameter pattern, binding the variables it names.
   *
   * Composite vertices destructure into their two components and edges into
   * source vertex, label and target vertex.
   */
  private static void bindPattern(Pattern pattern, Value value, Environment scope) {
    if (pattern instanceof Pattern.Name name) {
      scope.bind(name.name(), value);
    } else if (pattern instanceof Pattern.Tuple tuple) {
      final List<Value> components = components(value);
      if (components.size() != tuple.components().size()) {
        throw QueryException.of(
          ErrorMessage.Pattern.SHAPE_MISMATCH,
          ValueFormatter.describe(value),
          pattern
        );
      }
      for (int i = 0; i < components.size(); i++) {
        bindPattern(tuple.components().get(i), components.get(i), scope);
      }
    }
  }

  private static List<Value> components(Value value) {
    if (value instanceof Value.Vertex vertex && vertex.id() instanceof StateId.Pair pair) {
      return List.of(new Value.Vertex(pair.left()), new Value.Vertex(pair.right()));
    } else if (value instanceof Value.Edge edge) {
      final LabeledEdge labeled = edge.edge();
      return List.of(
        new Value.Vertex(labeled.from()),
        new Value.Str(labeled.label()),
        new Value.Vertex(labeled.to())
      );
    }
    return List.of();
  }

  /**
   * Gather element values into a set.
   *
   * @param elements element values
   * @param emptyKind kind of set produced when there are no elements
   * @param mixed error when elements belong in different kinds of sets
   * @param notElement error when an element cannot be in a set, or
   *                   {@code null} for a set literal
   */
  private static Value.SetValue collect(
    List<Value> elements,
    Value.Kind emptyKind,
    ErrorMessage.Type mixed,
    ErrorMessage.Type notElement
  ) {
    Value.Kind setKind = null;
    Value first = null;
    for (Value element : elements) {
      final Value.Kind elementSet = setKindOf(element);
      if (elementSet == null) {
        if (notElement != null) {
          throw QueryException.of(notElement, element.kind().description);
        }
        throw QueryException.of(
          ErrorMessage.Type.UNEXPECTED_KIND,
          "{...}",
          "vertices, labels or edges as elements",
          element.kind().description
        );
      } else if (setKind == null) {
        setKind = elementSet;
        first = element;
      } else if (setKind != elementSet) {
        throw QueryException.of(mixed, first.kind().description, element.kind().description);
      }
    }
    return setOf(setKind == null ? emptyKind : setKind, elements);
  }

  private static Value.Kind setKindOf(Value element) {
    switch (element.kind()) {
      case INT:
      case VERTEX:
        return Value.Kind.VERTICES;
      case STRING:
        return Value.Kind.LABELS;
      case EDGE:
        return Value.Kind.EDGES;
      default:
        return null;
    }
  }

  private static Value.SetValue setOf(Value.Kind kind, List<Value> elements) {
    switch (kind) {
      case VERTICES: {
        final var vertices = new TreeSet<StateId>();
        elements.forEach(element -> vertices.add(Value.asState(element).orElseThrow()));
        return new Value.Vertices(vertices);
      }
      case LABELS: {
        final var labels = new TreeSet<String>();
        elements.forEach(element -> labels.add(((Value.Str) element).value()));
        return new Value.Labels(labels);
      }
      case EDGES: {
        final var edges = new TreeSet<LabeledEdge>();
        elements.forEach(element -> edges.add(((Value.Edge) element).edge()));
        return new Value.Edges(edges);
      }
      default:
        throw new IllegalArgumentException(kind + " is not a set kind");
    }
  }

  private static Value.SetValue combineSets(
    String operator,
    Value.SetValue lhs,
    Value.SetValue rhs,
    boolean intersection
  ) {
    if (lhs.kind() != rhs.kind()) {
      throw QueryException.of(
        ErrorMessage.Type.MISMATCHED_SETS,
        operator,
        lhs.kind().description,
        rhs.kind().description
      );
    }

    final var combined = new ArrayList<Value>();
    if (intersection) {
      for (Value element : lhs.elements()) {
        if (rhs.contains(element).orElse(false)) {
          combined.add(element);
        }
      }
    } else {
      combined.addAll(lhs.elements());
      combined.addAll(rhs.elements());
    }
    return setOf(lhs.kind(), combined);
  }

  private static Automaton graphOperand(String operator, Value value) {
    if (value instanceof Value.Graph graph) {
      return graph.automaton();
    }
    throw unexpectedKind(operator, Value.Kind.GRAPH, value);
  }

  private static Value.SetValue setOperand(String operator, Value value) {
    if (value instanceof Value.SetValue set) {
      return set;
    }
    throw QueryException.of(
      ErrorMessage.Type.UNEXPECTED_KIND,
      operator,
      "a set of vertices, labels or edges",
      value.kind().description
    );
  }

  private static boolean boolOperand(String operator, Value value) {
    if (value instanceof Value.Bool bool) {
      return bool.value();
    }
    throw unexpectedKind(operator, Value.Kind.BOOL, value);
  }

  private static QueryException unexpectedKind(String operator, Value.Kind expected, Value actual) {
    return QueryException.of(
      ErrorMessage.Type.UNEXPECTED_KIND,
      operator,
      expected.description,
      actual.kind().description
    );
  }
}
