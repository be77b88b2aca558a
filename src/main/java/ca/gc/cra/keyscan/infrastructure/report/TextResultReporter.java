package ca.gc.cra.keyscan.infrastructure.report;

import ca.gc.cra.keyscan.application.pipeline.ScanReport;
import ca.gc.cra.keyscan.application.port.ResultReporter;
import ca.gc.cra.keyscan.domain.scan.MatchResult;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.math.BigInteger;
import java.util.Objects;

/**
 * Writes results as plain text: one decimal prime per line for primes-only runs, otherwise one
 * {@code P:<p> Q:<q> N:<n>} line per match.
 *
 * @since 0.1.0
 */
public final class TextResultReporter implements ResultReporter {
  private final Writer out;

  /**
   * Creates a reporter writing to {@code out}. The writer is flushed but not closed.
   *
   * @param out destination
   */
  public TextResultReporter(Writer out) {
    this.out = Objects.requireNonNull(out, "out");
  }

  @Override
  public void report(ScanReport report) throws IOException {
    Objects.requireNonNull(report, "report");
    PrintWriter writer = out instanceof PrintWriter printWriter ? printWriter : new PrintWriter(out);
    if (report.primesOnly()) {
      for (BigInteger prime : report.primes()) {
        writer.println(prime);
      }
    } else {
      for (MatchResult match : report.matches()) {
        writer.println(format(match));
      }
    }
    writer.flush();
    if (writer.checkError()) {
      throw new IOException("Failed to write scan results");
    }
  }

  static String format(MatchResult match) {
    return "P:" + match.p() + " Q:" + match.q() + " N:" + match.n();
  }
}
