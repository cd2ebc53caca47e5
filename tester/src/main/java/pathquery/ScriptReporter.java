package pathquery;

/**
 * Receives the outcome of every golden case.
 */
interface ScriptReporter {

  /**
   * The program threw something other than a query error, or a query error
   * while it was expected to print.
   *
   * @param scriptCase case which failed
   * @param error exception that aborted the program
   */
  void onCrash(ScriptCase scriptCase, RuntimeException error);

  /**
   * The program ran to completion (or failed with a query error) but its
   * output is not the expected one.
   *
   * @param scriptCase case which failed
   * @param foundOutput printed values, or {@code error <KIND>}
   */
  void onMismatch(ScriptCase scriptCase, String foundOutput);

  /**
   * @param scriptCase case which passed
   * @param output printed values, or {@code error <KIND>} when the case
   *               expected the program to fail
   */
  void onPass(ScriptCase scriptCase, String output);
}
