package ca.gc.cra.keyscan.application.pipeline;

import ca.gc.cra.keyscan.domain.scan.MatchResult;
import ca.gc.cra.keyscan.domain.scan.MatcherStrategy;
import java.math.BigInteger;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Completed scan outcome handed to a {@link ca.gc.cra.keyscan.application.port.ResultReporter}.
 *
 * @param primesOnly {@code true} when the run stopped after the prime scan
 * @param primes confirmed primes in ascending order
 * @param matches matched pairs ordered by {@code (p, q)}; empty when {@code primesOnly}
 * @param strategy matcher used, or {@code null} when {@code primesOnly}
 * @param stats run counters
 * @since 0.1.0
 */
public record ScanReport(
    boolean primesOnly,
    List<BigInteger> primes,
    List<MatchResult> matches,
    MatcherStrategy strategy,
    ScanStats stats) {

  /**
   * Copies collections and validates required fields.
   */
  public ScanReport {
    primes = List.copyOf(primes);
    matches = List.copyOf(matches);
    Objects.requireNonNull(stats, "stats");
  }

  /**
   * Builds a report for a primes-only run.
   *
   * @param primes confirmed primes in any order
   * @param stats run counters
   * @return report with sorted primes
   */
  public static ScanReport primesOnly(Collection<BigInteger> primes, ScanStats stats) {
    return new ScanReport(true, sorted(primes), List.of(), null, stats);
  }

  /**
   * Builds a report for a full run.
   *
   * @param primes confirmed primes in any order
   * @param matches matched pairs in any order
   * @param strategy matcher used
   * @param stats run counters
   * @return report with sorted primes and matches
   */
  public static ScanReport withMatches(
      Collection<BigInteger> primes,
      Collection<MatchResult> matches,
      MatcherStrategy strategy,
      ScanStats stats) {
    List<MatchResult> ordered =
        matches.stream().sorted(MatchResult.BY_PAIR).collect(Collectors.toList());
    return new ScanReport(false, sorted(primes), ordered, Objects.requireNonNull(strategy, "strategy"), stats);
  }

  /**
   * Returns the matcher used, if any.
   *
   * @return strategy, empty for primes-only runs
   */
  public Optional<MatcherStrategy> matcher() {
    return Optional.ofNullable(strategy);
  }

  private static List<BigInteger> sorted(Collection<BigInteger> primes) {
    return primes.stream().sorted().collect(Collectors.toList());
  }
}
