package ca.gc.cra.keyscan.infrastructure.match;

import ca.gc.cra.keyscan.application.pipeline.CancellationToken;
import ca.gc.cra.keyscan.application.pipeline.CompositeIndex;
import ca.gc.cra.keyscan.application.port.CompositeMatcher;
import ca.gc.cra.keyscan.application.port.ScanObserver;
import ca.gc.cra.keyscan.domain.scan.CompositeCandidate;
import ca.gc.cra.keyscan.domain.scan.DumpBuffer;
import ca.gc.cra.keyscan.domain.scan.MatchResult;
import ca.gc.cra.keyscan.domain.scan.ScanPhase;
import ca.gc.cra.keyscan.infrastructure.exec.ExecutorFactories;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ForkJoinPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base for matchers that scan buffer partitions independently and union their results.
 *
 * <p>Subclasses prepare a read-only search structure once per call and scan each partition with it. Partitions
 * run on the pool handed to {@link #match}.</p>
 */
abstract class PartitionedMatcher implements CompositeMatcher {
  private static final Logger log = LoggerFactory.getLogger(PartitionedMatcher.class);

  private final BufferPartitioner partitioner;
  private final ScanObserver observer;

  PartitionedMatcher(BufferPartitioner partitioner, ScanObserver observer) {
    this.partitioner = Objects.requireNonNull(partitioner, "partitioner");
    this.observer = Objects.requireNonNull(observer, "observer");
  }

  @Override
  public final Set<MatchResult> match(
      DumpBuffer buffer, CompositeIndex index, ForkJoinPool pool, CancellationToken cancellation) {
    Objects.requireNonNull(buffer, "buffer");
    Objects.requireNonNull(index, "index");
    Objects.requireNonNull(pool, "pool");
    Objects.requireNonNull(cancellation, "cancellation");
    resetRunState();
    if (index.isEmpty() || buffer.length() < index.minKeyLength()) {
      return Set.of();
    }
    PartitionScanner scanner = prepare(index);
    List<BufferPartitioner.Partition> partitions = partitioner.partition(buffer.length());
    log.debug("{} matcher scanning {} bytes in {} partitions", strategy().cliName(), buffer.length(), partitions.size());
    Set<MatchResult> results =
        ExecutorFactories.invoke(
            pool,
            () ->
                partitions.parallelStream()
                    .map(
                        partition -> {
                          cancellation.throwIfCancelled();
                          Set<MatchResult> found = new HashSet<>();
                          scanner.scan(buffer, index, partition, found);
                          observer.onProgress(ScanPhase.MATCH, partition.length());
                          return found;
                        })
                    .reduce(new HashSet<>(), PartitionedMatcher::union));
    cancellation.throwIfCancelled();
    return Set.copyOf(results);
  }

  /** Clears per-run counters before each {@link #match} call. */
  void resetRunState() {}

  /**
   * Builds the per-call search structure.
   *
   * @param index non-empty composite index
   * @return scanner shared by all partitions
   */
  abstract PartitionScanner prepare(CompositeIndex index);

  /**
   * Confirms the dump bytes at {@code [offset, offset + length)} against the index.
   *
   * @return {@code true} if at least one pair matched
   */
  static boolean confirm(
      DumpBuffer buffer, CompositeIndex index, int offset, int length, Set<MatchResult> sink) {
    List<CompositeCandidate> hits = index.lookup(buffer, offset, length);
    for (CompositeCandidate hit : hits) {
      sink.add(hit.toMatch());
    }
    return !hits.isEmpty();
  }

  private static Set<MatchResult> union(Set<MatchResult> left, Set<MatchResult> right) {
    Set<MatchResult> merged = new HashSet<>(left);
    merged.addAll(right);
    return merged;
  }

  /** Scans one partition. Implementations must be safe to call concurrently. */
  @FunctionalInterface
  interface PartitionScanner {
    void scan(
        DumpBuffer buffer,
        CompositeIndex index,
        BufferPartitioner.Partition partition,
        Set<MatchResult> sink);
  }
}
