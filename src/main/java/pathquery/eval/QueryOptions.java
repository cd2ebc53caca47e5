package pathquery.eval;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * Settings of a program run.
 */
public final class QueryOptions {

  /**
   * Initial and accepting states given to a freshly loaded graph.
   */
  public enum DefaultEndpoints {
    /** Every vertex is both initial and accepting. */
    ALL_VERTICES,

    /** No vertex is initial or accepting until the program sets some. */
    NO_VERTICES
  }

  /**
   * How printed graphs are rendered.
   */
  public enum OutputFormat {
    /** Counts of vertices and edges, labels, initial and accepting states. */
    SUMMARY,

    /** Source of a DOT graph. */
    DOT
  }

  public static final long DEFAULT_MAX_PRODUCT_STATES = 10_000_000L;

  public final Path graphDirectory;
  public final DefaultEndpoints defaultEndpoints;
  public final long maxProductStates;
  public final boolean parallelReachability;
  public final OutputFormat outputFormat;

  private QueryOptions(Builder builder) {
    this.graphDirectory = builder.graphDirectory;
    this.defaultEndpoints = builder.defaultEndpoints;
    this.maxProductStates = builder.maxProductStates;
    this.parallelReachability = builder.parallelReachability;
    this.outputFormat = builder.outputFormat;
  }

  public static QueryOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public String toString() {
    return "QueryOptions[graphDirectory = " + graphDirectory
      + ", defaultEndpoints = " + defaultEndpoints
      + ", maxProductStates = " + maxProductStates
      + ", parallelReachability = " + parallelReachability
      + ", outputFormat = " + outputFormat + "]";
  }

  public static final class Builder {
    private Path graphDirectory = Paths.get(".");
    private DefaultEndpoints defaultEndpoints = DefaultEndpoints.ALL_VERTICES;
    private long maxProductStates = DEFAULT_MAX_PRODUCT_STATES;
    private boolean parallelReachability = false;
    private OutputFormat outputFormat = OutputFormat.SUMMARY;

    private Builder() { }

    public Builder graphDirectory(Path graphDirectory) {
      this.graphDirectory = Objects.requireNonNull(graphDirectory);
      return this;
    }

    public Builder defaultEndpoints(DefaultEndpoints defaultEndpoints) {
      this.defaultEndpoints = Objects.requireNonNull(defaultEndpoints);
      return this;
    }

    public Builder maxProductStates(long maxProductStates) {
      if (maxProductStates < 1) {
        throw new IllegalArgumentException("the product state budget must be positive");
      }
      this.maxProductStates = maxProductStates;
      return this;
    }

    public Builder parallelReachability(boolean parallelReachability) {
      this.parallelReachability = parallelReachability;
      return this;
    }

    public Builder outputFormat(OutputFormat outputFormat) {
      this.outputFormat = Objects.requireNonNull(outputFormat);
      return this;
    }

    public QueryOptions build() {
      return new QueryOptions(this);
    }
  }
}
