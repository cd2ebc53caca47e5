package pathquery.parser;

import pathquery.ErrorMessage;
import pathquery.QuerySyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Parser for query programs.
 *
 * This is a fairly standard recursive descent parser working directly on the
 * characters of the input (there is no separate lexer). Whitespace and
 * {@code //} line comments may appear between any two tokens. Operator
 * precedence, loosest first:
 *
 *   - {@code or}, then {@code and}, then prefix {@code not}
 *
 *   - {@code in} (non-associative)
 *
 *   - {@code |} (union), then {@code &} (intersection), then {@code .} (concatenation)
 *
 *   - postfix {@code *} (Kleene star)
 */
public final class QueryParser {

  private static final Set<String> RESERVED = Set.of(
    "let", "print", "fun", "load", "smb", "map", "filter", "in", "not", "and", "or",
    "true", "false", "_"
  );

  // Bookkeeping around position in source
  private final String input;
  private final int length;
  private int position = 0;

  private QueryParser(String input) {
    this.input = input;
    this.length = input.length();
  }

  /**
   * Parse a whole program.
   *
   * @param input program text
   * @return parsed program
   * @throws QuerySyntaxException if the text is not a valid program
   */
  public static Program parse(String input) throws QuerySyntaxException {
    final var parser = new QueryParser(input);
    final var statements = new ArrayList<Stmt>();
    while (parser.peekChar() != -1) {
      if (parser.nextCharIf(';')) {
        continue;
      }
      statements.add(parser.parseStatement());
    }
    return new Program(statements);
  }

  /**
   * Parse a single expression, which must span the whole input.
   *
   * @param input expression text
   * @return parsed expression
   * @throws QuerySyntaxException if the text is not a valid expression
   */
  public static Expr parseExpression(String input) throws QuerySyntaxException {
    final var parser = new QueryParser(input);
    final Expr expr = parser.parseExpr();
    if (parser.peekChar() != -1) {
      throw parser.expected("the end of the expression");
    }
    return expr;
  }

  private QuerySyntaxException error(ErrorMessage.Syntax message, int at, Object... parameters) {
    int line = 1;
    int column = 1;
    for (int i = 0; i < at && i < length; i++) {
      if (input.charAt(i) == '\n') {
        line++;
        column = 1;
      } else {
        column++;
      }
    }
    return new QuerySyntaxException(message, line, column, parameters);
  }

  private QuerySyntaxException expected(String what) {
    peekChar();
    return error(ErrorMessage.Syntax.UNEXPECTED_TOKEN, position, what, describeNext());
  }

  private String describeNext() {
    if (position >= length) {
      return "the end of the input";
    }
    final String word = peekWord();
    return word.isEmpty() ? "'" + input.charAt(position) + "'" : "'" + word + "'";
  }

  /**
   * Advance the cursor past any whitespace or comments.
   */
  private void skipSpaceAndComments() {
    while (position < length) {
      final char c = input.charAt(position);
      if (c == '/' && position + 1 < length && input.charAt(position + 1) == '/') {
        while (position < length && input.charAt(position) != '\n') {
          position++;
        }
      } else if (Character.isWhitespace(c)) {
        position++;
      } else {
        break;
      }
    }
  }

  /**
   * Peek the next character in the input without advancing the position.
   *
   * @return next character or else -1 if there is none
   */
  private int peekChar() {
    skipSpaceAndComments();
    return position < length ? input.charAt(position) : -1;
  }

  /**
   * Advance past the next character only if it matches the expected.
   *
   * @param matching desired character
   * @return whether the character was found
   */
  private boolean nextCharIf(char matching) {
    skipSpaceAndComments();
    final boolean matches = position < length && input.charAt(position) == matching;
    if (matches) {
      position++;
    }
    return matches;
  }

  private boolean nextSymbolIf(String symbol) {
    skipSpaceAndComments();
    final boolean matches = input.startsWith(symbol, position);
    if (matches) {
      position += symbol.length();
    }
    return matches;
  }

  private void expectChar(char expected) {
    if (!nextCharIf(expected)) {
      throw expected("'" + expected + "'");
    }
  }

  /**
   * Identifier-like word at the cursor, without consuming it.
   *
   * @return word or else the empty string
   */
  private String peekWord() {
    skipSpaceAndComments();
    int end = position;
    if (end < length && isWordStart(input.charAt(end))) {
      end++;
      while (end < length && isWordPart(input.charAt(end))) {
        end++;
      }
    }
    return input.substring(position, end);
  }

  private boolean nextWordIf(String keyword) {
    final boolean matches = peekWord().equals(keyword);
    if (matches) {
      position += keyword.length();
    }
    return matches;
  }

  private void expectWord(String keyword) {
    if (!nextWordIf(keyword)) {
      throw expected("'" + keyword + "'");
    }
  }

  private String parseIdentifier() {
    final String word = peekWord();
    if (word.isEmpty() || isReserved(word)) {
      throw expected("a variable name");
    }
    position += word.length();
    return word;
  }

  private static boolean isWordStart(char c) {
    return Character.isLetter(c) || c == '_';
  }

  private static boolean isWordPart(char c) {
    return Character.isLetterOrDigit(c) || c == '_';
  }

  private static boolean isReserved(String word) {
    return RESERVED.contains(word) || projection(word) != null || endpointUpdate(word) != null;
  }

  private static Expr.Projection projection(String word) {
    for (Expr.Projection projection : Expr.Projection.values()) {
      if (projection.keyword.equals(word)) {
        return projection;
      }
    }
    return null;
  }

  private static Expr.EndpointUpdate endpointUpdate(String word) {
    for (Expr.EndpointUpdate update : Expr.EndpointUpdate.values()) {
      if (update.keyword.equals(word)) {
        return update;
      }
    }
    return null;
  }

  private int currentLine() {
    peekChar();
    int line = 1;
    for (int i = 0; i < position; i++) {
      if (input.charAt(i) == '\n') {
        line++;
      }
    }
    return line;
  }

  private Stmt parseStatement() {
    final int line = currentLine();
    if (nextWordIf("let")) {
      final String name = parseIdentifier();
      expectChar('=');
      return new Stmt.Bind(name, parseExpr(), line);
    } else if (nextWordIf("print")) {
      return new Stmt.Print(parseExpr(), line);
    }
    throw expected("a statement ('let' or 'print')");
  }

  private Expr parseExpr() {
    return parseOr();
  }

  private Expr parseOr() {
    Expr lhs = parseAnd();
    while (nextWordIf("or")) {
      lhs = new Expr.Or(lhs, parseAnd());
    }
    return lhs;
  }

  private Expr parseAnd() {
    Expr lhs = parseNot();
    while (nextWordIf("and")) {
      lhs = new Expr.And(lhs, parseNot());
    }
    return lhs;
  }

  private Expr parseNot() {
    if (nextWordIf("not")) {
      return new Expr.Not(parseNot());
    }
    return parseIn();
  }

  private Expr parseIn() {
    final Expr element = parseUnion();
    if (nextWordIf("in")) {
      return new Expr.In(element, parseUnion());
    }
    return element;
  }

  private Expr parseUnion() {
    Expr lhs = parseIntersect();
    while (nextCharIf('|')) {
      lhs = new Expr.Union(lhs, parseIntersect());
    }
    return lhs;
  }

  private Expr parseIntersect() {
    Expr lhs = parseConcat();
    while (nextCharIf('&')) {
      lhs = new Expr.Intersect(lhs, parseConcat());
    }
    return lhs;
  }

  private Expr parseConcat() {
    Expr lhs = parseStar();

    // A lone `.` concatenates, `..` belongs to a range literal
    while (peekChar() == '.' && !input.startsWith("..", position)) {
      position++;
      lhs = new Expr.Concat(lhs, parseStar());
    }
    return lhs;
  }

  private Expr parseStar() {
    Expr starred = parsePrimary();
    while (nextCharIf('*')) {
      starred = new Expr.Star(starred);
    }
    return starred;
  }

  private Expr parsePrimary() {
    final int c = peekChar();
    if (c == -1) {
      throw expected("an expression");
    } else if (c == '"') {
      return new Expr.StringLiteral(parseString());
    } else if (Character.isDigit(c) || c == '-') {
      return new Expr.IntLiteral(parseInteger());
    } else if (c == '(') {
      return parseParenthesized();
    } else if (c == '{') {
      return parseSet();
    } else if (isWordStart((char) c)) {
      return parseWord();
    }
    throw error(ErrorMessage.Syntax.UNEXPECTED_CHARACTER, position, (char) c);
  }

  private Expr parseParenthesized() {
    expectChar('(');
    final Expr first = parseExpr();
    if (nextCharIf(')')) {
      return first;
    }

    final var elements = new ArrayList<Expr>();
    elements.add(first);
    while (nextCharIf(',')) {
      elements.add(parseExpr());
    }
    expectChar(')');
    return new Expr.TupleLiteral(elements);
  }

  private Expr parseSet() {
    expectChar('{');
    if (nextCharIf('}')) {
      return new Expr.SetLiteral(List.of());
    }

    final Expr first = parseExpr();
    if (first instanceof Expr.IntLiteral from && nextSymbolIf("..")) {
      final long to = parseInteger();
      expectChar('}');
      return new Expr.RangeLiteral(from.value(), to);
    }

    final var elements = new ArrayList<Expr>();
    elements.add(first);
    while (nextCharIf(',')) {
      elements.add(parseExpr());
    }
    expectChar('}');
    return new Expr.SetLiteral(elements);
  }

  private Expr parseWord() {
    final int wordPosition = position;
    final String word = peekWord();

    switch (word) {
      case "true":
        position += word.length();
        return new Expr.BoolLiteral(true);
      case "false":
        position += word.length();
        return new Expr.BoolLiteral(false);
      case "load":
        position += word.length();
        return new Expr.Load(parseSingleArgument());
      case "smb":
        position += word.length();
        return new Expr.Smb(parseSingleArgument());
      case "map":
      case "filter": {
        position += word.length();
        expectChar('(');
        final Lambda lambda = parseLambda();
        expectChar(',');
        final Expr source = parseExpr();
        expectChar(')');
        return word.equals("map") ? new Expr.Map(lambda, source) : new Expr.Filter(lambda, source);
      }
      default:
        break;
    }

    final Expr.Projection projection = projection(word);
    if (projection != null) {
      position += word.length();
      return new Expr.Project(projection, parseSingleArgument());
    }

    final Expr.EndpointUpdate update = endpointUpdate(word);
    if (update != null) {
      position += word.length();
      expectChar('(');
      final Expr vertices = parseExpr();
      expectChar(',');
      final Expr graph = parseExpr();
      expectChar(')');
      return new Expr.UpdateEndpoints(update, vertices, graph);
    }

    if (isReserved(word)) {
      throw error(ErrorMessage.Syntax.UNEXPECTED_TOKEN, wordPosition, "an expression", "'" + word + "'");
    }
    position += word.length();
    return new Expr.Var(word);
  }

  private Expr parseSingleArgument() {
    expectChar('(');
    final Expr argument = parseExpr();
    expectChar(')');
    return argument;
  }

  private Lambda parseLambda() {
    expectWord("fun");
    final Pattern parameter = parsePattern();
    expectChar(':');
    return new Lambda(parameter, parseExpr());
  }

  private Pattern parsePattern() {
    if (nextCharIf('(')) {
      final var components = new ArrayList<Pattern>();
      components.add(parsePattern());
      while (nextCharIf(',')) {
        components.add(parsePattern());
      }
      expectChar(')');
      return components.size() == 1 ? components.get(0) : new Pattern.Tuple(components);
    } else if (nextWordIf("_")) {
      return new Pattern.Wildcard();
    }
    return new Pattern.Name(parseIdentifier());
  }

  private String parseString() {
    final int start = position;
    expectChar('"');
    final var builder = new StringBuilder();
    while (true) {
      if (position >= length) {
        throw error(ErrorMessage.Syntax.UNTERMINATED_STRING, start);
      }
      final char c = input.charAt(position++);
      if (c == '"') {
        return builder.toString();
      } else if (c == '\\') {
        if (position >= length) {
          throw error(ErrorMessage.Syntax.UNTERMINATED_STRING, start);
        }
        final char escaped = input.charAt(position++);
        switch (escaped) {
          case '"':
          case '\\':
            builder.append(escaped);
            break;
          case 'n':
            builder.append('\n');
            break;
          case 't':
            builder.append('\t');
            break;
          default:
            throw error(ErrorMessage.Syntax.INVALID_ESCAPE, position - 2, escaped);
        }
      } else {
        builder.append(c);
      }
    }
  }

  private long parseInteger() {
    skipSpaceAndComments();
    final int start = position;
    if (position < length && input.charAt(position) == '-') {
      position++;
    }
    while (position < length && Character.isDigit(input.charAt(position))) {
      position++;
    }

    final String digits = input.substring(start, position);
    if (digits.isEmpty() || digits.equals("-")) {
      position = start;
      throw expected("an integer");
    }
    try {
      return Long.parseLong(digits);
    } catch (NumberFormatException e) {
      throw error(ErrorMessage.Syntax.INTEGER_OUT_OF_RANGE, start, digits);
    }
  }
}
