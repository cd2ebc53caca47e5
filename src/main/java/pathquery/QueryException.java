package pathquery;

/**
 * Error which aborts the run of a query program.
 *
 * None of these are recoverable: all operations are deterministic over
 * in-memory values, so retrying would fail the same way.
 */
public class QueryException extends RuntimeException {

  @java.io.Serial
  private static final long serialVersionUID = -2871560912235587316L;

  private final ErrorMessage errorMessage;

  protected QueryException(String message, ErrorMessage errorMessage, Throwable cause) {
    super(message, cause);
    this.errorMessage = errorMessage;
  }

  public static QueryException of(ErrorMessage errorMessage, Object... parameters) {
    return new QueryException(errorMessage.message(parameters), errorMessage, null);
  }

  public static QueryException of(Throwable cause, ErrorMessage errorMessage, Object... parameters) {
    return new QueryException(errorMessage.message(parameters), errorMessage, cause);
  }

  public ErrorMessage errorMessage() {
    return errorMessage;
  }

  public ErrorMessage.Kind kind() {
    return errorMessage.kind();
  }

  public String code() {
    return errorMessage.code();
  }
}
