package pathquery;

/**
 * Catalogue of the errors a query program can fail with.
 *
 * Every message belongs to a {@link Kind} and has a stable code made of the
 * kind prefix and a number, eg. {@code TYP03}.
 */
public abstract class ErrorMessage {

  /**
   * Category of an error.
   */
  public enum Kind {
    /** Malformed program text. */
    SYNTAX("SYN"),

    /** Reference to a variable which is not bound. */
    NAME("NAM"),

    /** Graph name or path which does not resolve to a readable graph. */
    LOAD("LOD"),

    /** Operator applied to a value of the wrong kind. */
    TYPE("TYP"),

    /** Well-typed but semantically invalid input. */
    VALUE("VAL"),

    /** Lambda parameter whose shape does not match the element. */
    PATTERN_MISMATCH("PAT"),

    /** Construction exceeding the configured budget. */
    RESOURCE_EXHAUSTED("RES");

    public final String prefix;

    Kind(String prefix) {
      this.prefix = prefix;
    }
  }

  private final Kind kind;
  private final int number;
  private final String template;

  private ErrorMessage(Kind kind, int number, String template) {
    this.kind = kind;
    this.number = number;
    this.template = template;
  }

  public Kind kind() {
    return kind;
  }

  public String code() {
    return String.format("%s%02d", kind.prefix, number);
  }

  /**
   * Render the message.
   *
   * @param parameters values substituted into the template
   * @return message prefixed with its code
   */
  public String message(Object... parameters) {
    return "[" + code() + "] " + String.format(template, parameters);
  }

  @Override
  public String toString() {
    return code();
  }

  public static class Syntax extends ErrorMessage {
    public static final Syntax UNEXPECTED_TOKEN =
      new Syntax(1, "Expected %s but found %s.");
    public static final Syntax UNTERMINATED_STRING =
      new Syntax(2, "Unterminated string literal.");
    public static final Syntax UNEXPECTED_CHARACTER =
      new Syntax(3, "Unexpected character '%s'.");
    public static final Syntax INVALID_ESCAPE =
      new Syntax(4, "Invalid escape sequence '\\%s' in string literal.");
    public static final Syntax INTEGER_OUT_OF_RANGE =
      new Syntax(5, "Integer literal '%s' is out of range.");

    private Syntax(int number, String template) {
      super(Kind.SYNTAX, number, template);
    }
  }

  public static class Name extends ErrorMessage {
    public static final Name UNBOUND_VARIABLE =
      new Name(1, "Variable '%s' is not bound.");

    private Name(int number, String template) {
      super(Kind.NAME, number, template);
    }
  }

  public static class Load extends ErrorMessage {
    public static final Load GRAPH_NOT_FOUND =
      new Load(1, "Graph '%s' could not be found (looked for %s).");
    public static final Load GRAPH_UNREADABLE =
      new Load(2, "Graph '%s' could not be read: %s");
    public static final Load MALFORMED_EDGE =
      new Load(3, "Graph '%s', line %d: expected 'from to [label]' with integer vertices but found '%s'.");

    private Load(int number, String template) {
      super(Kind.LOAD, number, template);
    }
  }

  public static class Type extends ErrorMessage {
    public static final Type UNEXPECTED_KIND =
      new Type(1, "'%s' expects %s but got %s.");
    public static final Type NOT_AN_AUTOMATON =
      new Type(2, "'%s' expects a graph or a label but got %s.");
    public static final Type MIXED_SET =
      new Type(3, "Set elements must all be vertices, all labels or all edges, but found %s and %s.");
    public static final Type MAP_RESULT =
      new Type(4, "'map' body must produce a vertex, a label or an edge but produced %s.");
    public static final Type MIXED_MAP_RESULT =
      new Type(5, "'map' body must produce elements of one kind but produced %s and %s.");
    public static final Type FILTER_RESULT =
      new Type(6, "'filter' predicate must produce bool but produced %s.");
    public static final Type INVALID_TUPLE =
      new Type(7, "Tuples must be (vertex, vertex) or (vertex, label, vertex) but got (%s).");
    public static final Type MISMATCHED_SETS =
      new Type(8, "'%s' cannot combine %s with %s.");
    public static final Type INVALID_MEMBERSHIP =
      new Type(9, "'in' cannot look for %s inside %s.");

    private Type(int number, String template) {
      super(Kind.TYPE, number, template);
    }
  }

  public static class Value extends ErrorMessage {
    public static final Value UNKNOWN_VERTICES =
      new Value(1, "'%s' was given %s which are not vertices of the graph.");

    private Value(int number, String template) {
      super(Kind.VALUE, number, template);
    }
  }

  public static class Pattern extends ErrorMessage {
    public static final Pattern SHAPE_MISMATCH =
      new Pattern(1, "Cannot destructure %s with the parameter pattern %s.");

    private Pattern(int number, String template) {
      super(Kind.PATTERN_MISMATCH, number, template);
    }
  }

  public static class Resource extends ErrorMessage {
    public static final Resource STATE_BUDGET_EXCEEDED =
      new Resource(1, "'%s' gave up: %s.");
    public static final Resource RANGE_TOO_LARGE =
      new Resource(2, "Range %d..%d has more than %d vertices.");

    private Resource(int number, String template) {
      super(Kind.RESOURCE_EXHAUSTED, number, template);
    }
  }
}
