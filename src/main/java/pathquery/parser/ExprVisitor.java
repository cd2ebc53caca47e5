package pathquery.parser;

/**
 * Bottom-up traversal of the expression AST.
 *
 * @param <R> output from traversing an expression
 */
public interface ExprVisitor<R> {

  R visitVar(Expr.Var var);

  R visitString(Expr.StringLiteral literal);

  R visitInt(Expr.IntLiteral literal);

  R visitBool(Expr.BoolLiteral literal);

  R visitSet(Expr.SetLiteral literal);

  R visitRange(Expr.RangeLiteral literal);

  R visitTuple(Expr.TupleLiteral literal);

  R visitLoad(Expr.Load load);

  /**
   * Replace or extend the initial or accepting states of a graph.
   */
  R visitUpdateEndpoints(Expr.UpdateEndpoints update);

  /**
   * Read a component off a graph.
   */
  R visitProject(Expr.Project project);

  R visitMap(Expr.Map map);

  R visitFilter(Expr.Filter filter);

  /**
   * Intersection of two languages, or of two sets.
   */
  R visitIntersect(Expr.Intersect intersect);

  R visitConcat(Expr.Concat concat);

  /**
   * Union of two languages, or of two sets.
   */
  R visitUnion(Expr.Union union);

  R visitStar(Expr.Star star);

  R visitSmb(Expr.Smb smb);

  R visitIn(Expr.In in);

  R visitNot(Expr.Not not);

  R visitAnd(Expr.And and);

  R visitOr(Expr.Or or);
}
