package ca.gc.cra.agentreplay.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Console output for command results, usage text, and the replay prompt.
 *
 * <p>Writes to the stdout file descriptor directly; logging goes to stderr so piped output stays clean.</p>
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  public static void println(String message) {
    writer().println(message);
  }

  /**
   * Prints each line in order.
   *
   * @param lines lines to emit; {@code null} prints nothing
   */
  public static void printLines(List<String> lines) {
    if (lines == null) {
      return;
    }
    PrintWriter writer = writer();
    lines.forEach(writer::println);
    writer.flush();
  }

  /**
   * Prints text without a line break and flushes, so the cursor waits after it.
   *
   * @param prompt prompt text such as {@code "> "}
   */
  public static void prompt(String prompt) {
    PrintWriter writer = writer();
    writer.print(prompt);
    writer.flush();
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  private static PrintWriter writer() {
    PrintWriter current = override;
    return current != null ? current : STDOUT;
  }
}
