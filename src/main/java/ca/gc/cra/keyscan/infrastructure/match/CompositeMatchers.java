package ca.gc.cra.keyscan.infrastructure.match;

import ca.gc.cra.keyscan.application.port.CompositeMatcher;
import ca.gc.cra.keyscan.application.port.MetricsPort;
import ca.gc.cra.keyscan.application.port.ScanObserver;
import ca.gc.cra.keyscan.domain.scan.MatcherStrategy;
import java.util.Objects;

/**
 * Creates the {@link CompositeMatcher} selected by configuration.
 *
 * @since 0.1.0
 */
public final class CompositeMatchers {

  private CompositeMatchers() {}

  /**
   * Creates a matcher for {@code strategy}.
   *
   * @param strategy requested strategy
   * @param parallelism number of pool workers the buffer partitions are sized for
   * @param fingerprintWidth rolling-hash window in bytes; ignored by other strategies
   * @param observer progress sink
   * @param metrics metrics sink
   * @return new matcher
   */
  public static CompositeMatcher create(
      MatcherStrategy strategy,
      int parallelism,
      int fingerprintWidth,
      ScanObserver observer,
      MetricsPort metrics) {
    Objects.requireNonNull(strategy, "strategy");
    return switch (strategy) {
      case NAIVE -> new NaiveWindowMatcher(parallelism, observer);
      case AUTOMATON -> new AhoCorasickMatcher(parallelism, observer);
      case ROLLING_HASH -> new RollingHashMatcher(parallelism, fingerprintWidth, observer, metrics);
    };
  }
}
