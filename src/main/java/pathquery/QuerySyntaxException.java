package pathquery;

/**
 * Malformed program text, along with where in the text the problem is.
 */
public class QuerySyntaxException extends QueryException {

  @java.io.Serial
  private static final long serialVersionUID = 6025981131370436702L;

  /**
   * Line of the error (1-based).
   */
  public final int line;

  /**
   * Column of the error (1-based).
   */
  public final int column;

  public QuerySyntaxException(ErrorMessage.Syntax errorMessage, int line, int column, Object... parameters) {
    super(errorMessage.message(parameters) + " (at line " + line + ", column " + column + ")", errorMessage, null);
    this.line = line;
    this.column = column;
  }

  public int line() {
    return line;
  }

  public int column() {
    return column;
  }
}
