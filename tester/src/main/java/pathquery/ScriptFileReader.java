package pathquery;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;

/**
 * Reads golden case files, skipping blank lines and {@code //} comments.
 */
public class ScriptFileReader implements AutoCloseable {

  private final BufferedReader reader;

  private final String filePath;

  private int lineNumber = 0;

  public ScriptFileReader(Path filePath) throws IOException {
    this.reader = Files.newBufferedReader(filePath, StandardCharsets.UTF_8);
    this.filePath = filePath.toString();
  }

  /**
   * Read the next meaningful line from the input.
   *
   * @return line, or {@code null} at the end of the file
   */
  public String readLine() throws IOException {
    while (true) {
      final String line = reader.readLine();
      lineNumber++;
      if (line == null) {
        return null;
      } else if (line.startsWith("//") || line.isBlank()) {
        continue;
      }
      return line.strip();
    }
  }

  /**
   * Read the next case from the input.
   *
   * @return case, or {@code null} at the end of the file
   * @throws IOException if the file cannot be read or ends in the middle of a case
   */
  public ScriptCase readCase() throws IOException {
    final String program = readLine();
    if (program == null) {
      return null;
    }
    final int programLine = this.lineNumber;
    final String output = readLine();
    if (output == null) {
      throw new IOException(filePath + ":" + programLine + ": case has no expected output");
    }
    return new ScriptCase(program, output, filePath, programLine);
  }

  /**
   * Run an action for every remaining case in the file.
   *
   * @param action action to run on each case
   */
  public void forEachCase(Consumer<? super ScriptCase> action) throws IOException {
    ScriptCase scriptCase;
    while ((scriptCase = readCase()) != null) {
      action.accept(scriptCase);
    }
  }

  public int getLineNumber() {
    return lineNumber;
  }

  @Override
  public void close() throws IOException {
    reader.close();
  }
}
