package ca.gc.cra.keyscan.infrastructure.match;

import ca.gc.cra.keyscan.application.pipeline.CompositeIndex;
import ca.gc.cra.keyscan.application.port.ScanObserver;
import ca.gc.cra.keyscan.domain.scan.MatcherStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Streams the dump once through an Aho-Corasick automaton built over every index key.
 *
 * <p>Construction is single threaded and costs memory proportional to total key length; the scan itself is split
 * into partitions that each restart the automaton at the root.</p>
 *
 * @since 0.1.0
 */
public final class AhoCorasickMatcher extends PartitionedMatcher {
  private static final Logger log = LoggerFactory.getLogger(AhoCorasickMatcher.class);

  /**
   * Creates a matcher.
   *
   * @param parallelism number of workers the partitions are sized for
   * @param observer progress sink
   */
  public AhoCorasickMatcher(int parallelism, ScanObserver observer) {
    this(new BufferPartitioner(parallelism), observer);
  }

  AhoCorasickMatcher(BufferPartitioner partitioner, ScanObserver observer) {
    super(partitioner, observer);
  }

  @Override
  public MatcherStrategy strategy() {
    return MatcherStrategy.AUTOMATON;
  }

  @Override
  PartitionScanner prepare(CompositeIndex index) {
    long started = System.nanoTime();
    ByteAutomaton automaton = ByteAutomaton.build(index.keys());
    log.debug(
        "Built automaton with {} states for {} patterns in {} ms",
        automaton.stateCount(),
        automaton.patternCount(),
        (System.nanoTime() - started) / 1_000_000L);
    int maxKeyLength = automaton.maxPatternLength();
    return (buffer, idx, partition, sink) ->
        automaton.search(
            buffer,
            partition.start(),
            partition.end(),
            partition.readLimit(buffer.length(), maxKeyLength),
            (start, length) -> confirm(buffer, idx, start, length, sink));
  }
}
