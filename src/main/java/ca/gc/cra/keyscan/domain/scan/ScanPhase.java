package ca.gc.cra.keyscan.domain.scan;

/**
 * Stages of a scan run, used to label progress and timing signals.
 *
 * @since 0.1.0
 */
public enum ScanPhase {
  /** Sliding-window scan and two-stage primality filtering. */
  PRIME_SCAN("primeScan"),
  /** Pair enumeration and composite index construction. */
  INDEX_BUILD("indexBuild"),
  /** Searching the dump for composite encodings. */
  MATCH("match");

  private final String metricName;

  ScanPhase(String metricName) {
    this.metricName = metricName;
  }

  /**
   * Returns the camel-case name used in metric keys.
   *
   * @return metric segment such as {@code primeScan}
   */
  public String metricName() {
    return metricName;
  }
}
