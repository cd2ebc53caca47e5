package pathquery.eval;

import pathquery.ErrorMessage;
import pathquery.QueryException;
import pathquery.graph.Automata;
import pathquery.graph.Automaton;
import pathquery.graph.Product;
import pathquery.graph.StateBudgetExceededException;

/**
 * Compiles path-pattern values into automata.
 *
 * A label literal becomes a single-symbol automaton; a graph is already an
 * automaton. The language operators then apply the same composition
 * primitives whether their operands came from labels or from graphs.
 */
public final class RegexCompiler {

  private final long maxProductStates;

  public RegexCompiler(long maxProductStates) {
    this.maxProductStates = maxProductStates;
  }

  /**
   * View a value as an automaton.
   *
   * @param operator name of the operator needing the automaton (for errors)
   * @param value label or graph
   * @return automaton of the value
   */
  public Automaton compile(String operator, Value value) {
    if (value instanceof Value.Str label) {
      return Automata.singleSymbol(label.value());
    } else if (value instanceof Value.Graph graph) {
      return graph.automaton();
    }
    throw QueryException.of(ErrorMessage.Type.NOT_AN_AUTOMATON, operator, value.kind().description);
  }

  /**
   * Single-symbol automaton on the label a value holds.
   *
   * @param value label
   */
  public Automaton symbol(Value value) {
    if (value instanceof Value.Str label) {
      return Automata.singleSymbol(label.value());
    }
    throw QueryException.of(
      ErrorMessage.Type.UNEXPECTED_KIND,
      "smb",
      Value.Kind.STRING.description,
      value.kind().description
    );
  }

  public Automaton union(Value lhs, Value rhs) {
    return Automata.union(compile("|", lhs), compile("|", rhs));
  }

  public Automaton concat(Value lhs, Value rhs) {
    return Automata.concat(compile(".", lhs), compile(".", rhs));
  }

  public Automaton star(Value arg) {
    return Automata.star(compile("*", arg));
  }

  /**
   * Product of two automata, within the configured state budget.
   */
  public Automaton intersect(Value lhs, Value rhs) {
    final Automaton left = compile("&", lhs);
    final Automaton right = compile("&", rhs);
    try {
      return Product.of(left, right, maxProductStates);
    } catch (StateBudgetExceededException e) {
      throw QueryException.of(e, ErrorMessage.Resource.STATE_BUDGET_EXCEEDED, "&", e.getMessage());
    }
  }
}
