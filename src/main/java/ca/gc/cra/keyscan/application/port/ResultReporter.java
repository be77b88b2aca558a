package ca.gc.cra.keyscan.application.port;

import ca.gc.cra.keyscan.application.pipeline.ScanReport;
import java.io.IOException;

/**
 * Renders the outcome of a scan for the operator.
 *
 * <p>Implementations write full key material; they are the only place where complete primes and moduli leave
 * the process.</p>
 *
 * @since 0.1.0
 */
public interface ResultReporter {

  /**
   * Writes the confirmed primes or matches contained in {@code report}.
   *
   * @param report completed scan report
   * @throws IOException when the destination cannot be written
   */
  void report(ScanReport report) throws IOException;
}
