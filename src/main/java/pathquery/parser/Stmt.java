package pathquery.parser;

/**
 * Statement of a query program.
 */
public interface Stmt {

  /**
   * Line of the source text where the statement starts (1-based).
   */
  int line();

  <R> R accept(Visitor<R> visitor);

  /**
   * Bind the value of an expression to a variable, replacing any earlier binding.
   *
   * @param name variable name
   * @param expr bound expression
   * @param line source line
   */
  record Bind(String name, Expr expr, int line) implements Stmt {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitBind(this);
    }
  }

  /**
   * Hand the value of an expression to the output.
   *
   * @param expr printed expression
   * @param line source line
   */
  record Print(Expr expr, int line) implements Stmt {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitPrint(this);
    }
  }

  interface Visitor<R> {
    R visitBind(Bind bind);

    R visitPrint(Print print);
  }
}
