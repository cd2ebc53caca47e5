package pathquery.eval;

import pathquery.ErrorMessage;
import pathquery.QueryException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Variable bindings of a program run.
 *
 * The global environment lives for one program run. Lambda bodies evaluate
 * in a child environment holding the parameter bindings, which shadow (but
 * never modify) the enclosing bindings.
 */
public final class Environment {

  private final Environment parent;
  private final Map<String, Value> bindings = new LinkedHashMap<>();

  private Environment(Environment parent) {
    this.parent = parent;
  }

  /**
   * Fresh environment without any bindings.
   */
  public static Environment empty() {
    return new Environment(null);
  }

  /**
   * Environment whose lookups fall back on this one.
   */
  public Environment child() {
    return new Environment(this);
  }

  /**
   * Bind a variable in this environment, replacing any earlier binding of the
   * same name in this environment.
   *
   * @param name variable name
   * @param value bound value
   */
  public void bind(String name, Value value) {
    bindings.put(name, value);
  }

  public Optional<Value> find(String name) {
    for (Environment env = this; env != null; env = env.parent) {
      final Value value = env.bindings.get(name);
      if (value != null) {
        return Optional.of(value);
      }
    }
    return Optional.empty();
  }

  /**
   * Look up a variable.
   *
   * @param name variable name
   * @return bound value
   * @throws QueryException if the variable is not bound
   */
  public Value lookup(String name) {
    return find(name).orElseThrow(() -> QueryException.of(ErrorMessage.Name.UNBOUND_VARIABLE, name));
  }

  /**
   * Bindings made directly in this environment, in the order they were first made.
   */
  public Map<String, Value> bindings() {
    return Collections.unmodifiableMap(bindings);
  }
}
