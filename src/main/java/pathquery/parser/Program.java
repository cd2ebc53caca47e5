package pathquery.parser;

import java.util.List;

/**
 * Parsed query program: statements run in source order.
 *
 * @param statements statements of the program
 */
public record Program(List<Stmt> statements) {

  public Program {
    statements = List.copyOf(statements);
  }
}
