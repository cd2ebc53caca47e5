package pathquery.graph;

/**
 * Thrown when a construction would need more states than it is allowed.
 */
public class StateBudgetExceededException extends RuntimeException {

  @java.io.Serial
  private static final long serialVersionUID = 4170318745219913468L;

  /**
   * Number of states the construction would have needed.
   */
  public final long requiredStates;

  /**
   * Maximum number of states allowed.
   */
  public final long maxStates;

  public StateBudgetExceededException(String construction, long requiredStates, long maxStates) {
    super(construction + " needs " + requiredStates + " states but at most " + maxStates + " are allowed");
    this.requiredStates = requiredStates;
    this.maxStates = maxStates;
  }
}
