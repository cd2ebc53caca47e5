package pathquery.parser;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Expression of a query program.
 */
public interface Expr {

  <R> R accept(ExprVisitor<R> visitor);

  /**
   * Graph components which can be replaced or extended with a vertex set.
   */
  enum EndpointUpdate {
    SET_START("set_start"),
    SET_FINAL("set_final"),
    ADD_START("add_start"),
    ADD_FINAL("add_final");

    public final String keyword;

    EndpointUpdate(String keyword) {
      this.keyword = keyword;
    }

    public boolean replaces() {
      return this == SET_START || this == SET_FINAL;
    }

    public boolean start() {
      return this == SET_START || this == ADD_START;
    }
  }

  /**
   * Components which can be read off a graph.
   */
  enum Projection {
    GET_START("get_start"),
    GET_FINAL("get_final"),
    GET_VERTICES("get_vertices"),
    GET_LABELS("get_labels"),
    GET_EDGES("get_edges"),
    GET_REACHABLE("get_reachable");

    public final String keyword;

    Projection(String keyword) {
      this.keyword = keyword;
    }
  }

  record Var(String name) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitVar(this);
    }

    @Override
    public String toString() {
      return name;
    }
  }

  record StringLiteral(String value) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitString(this);
    }

    @Override
    public String toString() {
      return "\"" + value + "\"";
    }
  }

  record IntLiteral(long value) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitInt(this);
    }

    @Override
    public String toString() {
      return Long.toString(value);
    }
  }

  record BoolLiteral(boolean value) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitBool(this);
    }

    @Override
    public String toString() {
      return Boolean.toString(value);
    }
  }

  /**
   * Set enumerated element by element, eg. {@code {1, 2, 3}} or {@code {"a", "b"}}.
   */
  record SetLiteral(List<Expr> elements) implements Expr {
    public SetLiteral {
      elements = List.copyOf(elements);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitSet(this);
    }

    @Override
    public String toString() {
      return join(elements, "{", "}");
    }
  }

  /**
   * Inclusive range of atomic vertices, eg. {@code {1..100}}.
   */
  record RangeLiteral(long from, long to) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitRange(this);
    }

    @Override
    public String toString() {
      return "{" + from + ".." + to + "}";
    }
  }

  /**
   * Composite vertex {@code (v, w)} or edge {@code (v, "l", w)}.
   */
  record TupleLiteral(List<Expr> elements) implements Expr {
    public TupleLiteral {
      elements = List.copyOf(elements);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitTuple(this);
    }

    @Override
    public String toString() {
      return join(elements, "(", ")");
    }
  }

  record Load(Expr path) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitLoad(this);
    }

    @Override
    public String toString() {
      return "load(" + path + ")";
    }
  }

  /**
   * One of {@code set_start}, {@code set_final}, {@code add_start}, {@code add_final}.
   */
  record UpdateEndpoints(EndpointUpdate update, Expr vertices, Expr graph) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitUpdateEndpoints(this);
    }

    @Override
    public String toString() {
      return update.keyword + "(" + vertices + ", " + graph + ")";
    }
  }

  /**
   * One of the {@code get_*} forms.
   */
  record Project(Projection projection, Expr graph) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitProject(this);
    }

    @Override
    public String toString() {
      return projection.keyword + "(" + graph + ")";
    }
  }

  record Map(Lambda lambda, Expr source) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitMap(this);
    }

    @Override
    public String toString() {
      return "map(" + lambda + ", " + source + ")";
    }
  }

  record Filter(Lambda lambda, Expr source) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitFilter(this);
    }

    @Override
    public String toString() {
      return "filter(" + lambda + ", " + source + ")";
    }
  }

  record Intersect(Expr lhs, Expr rhs) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitIntersect(this);
    }

    @Override
    public String toString() {
      return "(" + lhs + " & " + rhs + ")";
    }
  }

  record Concat(Expr lhs, Expr rhs) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitConcat(this);
    }

    @Override
    public String toString() {
      return "(" + lhs + " . " + rhs + ")";
    }
  }

  record Union(Expr lhs, Expr rhs) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitUnion(this);
    }

    @Override
    public String toString() {
      return "(" + lhs + " | " + rhs + ")";
    }
  }

  record Star(Expr arg) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitStar(this);
    }

    @Override
    public String toString() {
      return arg + "*";
    }
  }

  /**
   * Single-symbol pattern on the label an expression evaluates to.
   */
  record Smb(Expr label) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitSmb(this);
    }

    @Override
    public String toString() {
      return "smb(" + label + ")";
    }
  }

  record In(Expr element, Expr collection) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitIn(this);
    }

    @Override
    public String toString() {
      return "(" + element + " in " + collection + ")";
    }
  }

  record Not(Expr arg) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitNot(this);
    }

    @Override
    public String toString() {
      return "not " + arg;
    }
  }

  record And(Expr lhs, Expr rhs) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitAnd(this);
    }

    @Override
    public String toString() {
      return "(" + lhs + " and " + rhs + ")";
    }
  }

  record Or(Expr lhs, Expr rhs) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
      return visitor.visitOr(this);
    }

    @Override
    public String toString() {
      return "(" + lhs + " or " + rhs + ")";
    }
  }

  private static String join(List<Expr> elements, String open, String close) {
    return elements
      .stream()
      .map(Expr::toString)
      .collect(Collectors.joining(", ", open, close));
  }
}
