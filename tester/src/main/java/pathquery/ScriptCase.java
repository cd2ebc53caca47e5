package pathquery;

import java.util.List;

/**
 * Case in a golden case file.
 *
 * @param program one-line query program
 * @param output expected output
 * @param filePath source file from which the case originated
 * @param lineNumber line in the source file where the program is
 */
public class ScriptCase {

  /**
   * One-line query program.
   */
  public final String program;

  /**
   * Expected output: printed values joined with {@code " | "}, or
   * {@code error <KIND>} if the program should fail.
   */
  public final String output;

  public final String filePath;

  public final int lineNumber;

  public ScriptCase(String program, String output, String filePath, int lineNumber) {
    this.program = program;
    this.output = output;
    this.filePath = filePath;
    this.lineNumber = lineNumber;
  }

  /**
   * Construct an output string from the printed values.
   *
   * @param printed rendered values, in print order
   * @return output string
   */
  public static String createOutput(List<String> printed) {
    return String.join(" | ", printed);
  }

  /**
   * Construct an output string for a failed program.
   *
   * @param error exception that aborted the program
   * @return output string
   */
  public static String createErrorOutput(QueryException error) {
    return "error " + error.kind();
  }

  public boolean expectsError() {
    return output.startsWith("error ");
  }

  /**
   * Render the case and its source location in a human readable fashion.
   */
  public String getSummary() {
    return "'" + program + "' (at " + filePath + ":" + lineNumber + ")";
  }
}
