package ca.gc.cra.keyscan.api;

import java.io.BufferedWriter;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Console output helper for usage text, dry-run plans and scan results.
 *
 * <p>Writes to the stdout file descriptor directly; logs go to stderr, so stdout carries only results. Output is
 * buffered and flushed once per call, so a dump with thousands of primes is not flushed line by line. Reporters
 * writing through {@link #stdout()} flush when they finish.</p>
 */
public final class CliPrinter {
  private static final int BUFFER_CHARS = 64 * 1024;
  private static final PrintWriter STDOUT = new PrintWriter(
      new BufferedWriter(
          new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), BUFFER_CHARS),
      false);
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  /**
   * Prints a single line to stdout.
   *
   * @param message line to emit
   */
  public static void println(String message) {
    PrintWriter writer = writer();
    writer.println(message);
    writer.flush();
  }

  /**
   * Prints zero or more lines to stdout.
   *
   * @param lines lines to emit
   */
  public static void printLines(String... lines) {
    if (lines == null || lines.length == 0) {
      return;
    }
    PrintWriter writer = writer();
    for (String line : lines) {
      writer.println(line == null ? "" : line);
    }
    writer.flush();
  }

  /**
   * Returns the writer result reporters should target.
   *
   * @return active stdout writer; callers flush it and never close it
   */
  static PrintWriter stdout() {
    return writer();
  }

  /**
   * Overrides the CLI writer for tests.
   *
   * @param writer writer to use during the test
   */
  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  /** Clears any test writer override. */
  static void clearTestWriter() {
    override = null;
  }

  private static PrintWriter writer() {
    PrintWriter current = override;
    return current != null ? current : STDOUT;
  }
}
