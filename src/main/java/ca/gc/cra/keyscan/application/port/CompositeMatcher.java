package ca.gc.cra.keyscan.application.port;

import ca.gc.cra.keyscan.application.pipeline.CancellationToken;
import ca.gc.cra.keyscan.application.pipeline.CompositeIndex;
import ca.gc.cra.keyscan.domain.scan.DumpBuffer;
import ca.gc.cra.keyscan.domain.scan.MatchResult;
import ca.gc.cra.keyscan.domain.scan.MatcherStrategy;
import java.util.Set;
import java.util.concurrent.ForkJoinPool;

/**
 * <strong>What:</strong> Searches a dump for the byte encodings held in a composite index.
 * <p><strong>Why:</strong> Naive, automaton and rolling-hash searches trade memory for throughput differently but
 * must return the same results; one contract lets the strategy be chosen by configuration.</p>
 * <p><strong>Role:</strong> Port implemented by the adapters in {@code infrastructure.match}.</p>
 * <p><strong>Thread-safety:</strong> Implementations run their parallel work on the caller's pool and create no
 * threads of their own; instances are not required to support concurrent {@link #match} calls.</p>
 *
 * @since 0.1.0
 */
public interface CompositeMatcher {

  /**
   * Returns every composite whose LSF or MSF encoding occurs as a contiguous run of {@code buffer}.
   *
   * @param buffer dump to search
   * @param index composite index built from the confirmed primes
   * @param pool worker pool that runs the search; owned by the caller
   * @param cancellation token checked between partitions
   * @return results deduplicated by {@code (p, q)}; never {@code null}
   * @throws ca.gc.cra.keyscan.application.pipeline.ScanAbortedException when cancelled
   */
  Set<MatchResult> match(
      DumpBuffer buffer, CompositeIndex index, ForkJoinPool pool, CancellationToken cancellation);

  /**
   * Identifies the strategy implemented by this matcher.
   *
   * @return strategy constant
   */
  MatcherStrategy strategy();
}
