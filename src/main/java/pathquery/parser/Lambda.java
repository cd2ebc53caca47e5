package pathquery.parser;

/**
 * Anonymous function of one (possibly destructured) parameter.
 *
 * @param parameter parameter pattern matched against each element
 * @param body expression evaluated with the parameter bindings in scope
 */
public record Lambda(Pattern parameter, Expr body) {

  @Override
  public String toString() {
    return "fun " + parameter + ": " + body;
  }
}
