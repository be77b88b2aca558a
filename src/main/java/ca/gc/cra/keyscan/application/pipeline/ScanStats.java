package ca.gc.cra.keyscan.application.pipeline;

/**
 * Counters gathered across a scan run.
 *
 * @param windowsVisited windows examined by the scanner
 * @param windowsNullRun windows excluded by the null-run filter
 * @param stage1Rejected candidates rejected by the cheap primality test
 * @param stage2Rejected candidates rejected by the confirming primality test
 * @param primesConfirmed distinct confirmed primes
 * @param pairs indexed composite pairs
 * @param indexKeys distinct index keys
 * @param keysRejected pairs left out of the index because their encoding was too wide
 * @param matches distinct matched pairs
 * @since 0.1.0
 */
public record ScanStats(
    long windowsVisited,
    long windowsNullRun,
    long stage1Rejected,
    long stage2Rejected,
    long primesConfirmed,
    long pairs,
    long indexKeys,
    long keysRejected,
    long matches) {

  /**
   * Creates stats covering the prime scan only.
   *
   * @param scan scanner outcome
   * @return stats with index and match counters at zero
   */
  public static ScanStats of(WindowScanner.Result scan) {
    return new ScanStats(
        scan.windowsVisited(),
        scan.windowsNullRun(),
        scan.stage1Rejected(),
        scan.stage2Rejected(),
        scan.primes().size(),
        0,
        0,
        0,
        0);
  }

  /**
   * Returns a copy carrying index counters.
   *
   * @param index built composite index
   * @return updated stats
   */
  public ScanStats withIndex(CompositeIndex index) {
    return new ScanStats(
        windowsVisited,
        windowsNullRun,
        stage1Rejected,
        stage2Rejected,
        primesConfirmed,
        index.pairCount(),
        index.keyCount(),
        index.rejectedKeys(),
        matches);
  }

  /**
   * Returns a copy carrying the match count.
   *
   * @param matchCount distinct matched pairs
   * @return updated stats
   */
  public ScanStats withMatches(long matchCount) {
    return new ScanStats(
        windowsVisited,
        windowsNullRun,
        stage1Rejected,
        stage2Rejected,
        primesConfirmed,
        pairs,
        indexKeys,
        keysRejected,
        matchCount);
  }

  /**
   * Renders a one-line summary for logs.
   *
   * @return summary text
   */
  public String summary() {
    return "windows=" + windowsVisited
        + " nullRun=" + windowsNullRun
        + " stage1Rejected=" + stage1Rejected
        + " stage2Rejected=" + stage2Rejected
        + " primes=" + primesConfirmed
        + " pairs=" + pairs
        + " keys=" + indexKeys
        + " keysRejected=" + keysRejected
        + " matches=" + matches;
  }
}
