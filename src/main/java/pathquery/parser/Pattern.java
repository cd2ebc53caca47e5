package pathquery.parser;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Shape of a lambda parameter.
 *
 * Tuple patterns destructure composite vertices {@code (left, right)} and
 * edges {@code (from, label, to)}, recursively.
 */
public interface Pattern {

  /**
   * Binds the whole element to a variable.
   *
   * @param name variable name
   */
  record Name(String name) implements Pattern {
    @Override
    public String toString() {
      return name;
    }
  }

  /**
   * Matches anything, binds nothing.
   */
  record Wildcard() implements Pattern {
    @Override
    public String toString() {
      return "_";
    }
  }

  /**
   * Destructures a composite element component by component.
   *
   * @param components patterns for the components
   */
  record Tuple(List<Pattern> components) implements Pattern {
    public Tuple {
      components = List.copyOf(components);
    }

    @Override
    public String toString() {
      return components
        .stream()
        .map(Pattern::toString)
        .collect(Collectors.joining(", ", "(", ")"));
    }
  }
}
