package ca.gc.cra.keyscan.infrastructure.match;

import ca.gc.cra.keyscan.application.pipeline.CompositeIndex;
import ca.gc.cra.keyscan.application.port.ScanObserver;
import ca.gc.cra.keyscan.domain.scan.MatcherStrategy;

/**
 * Looks up every window of every indexed key length directly in the composite index.
 *
 * <p>With well-formed moduli every key is {@code 2 * primeSize} bytes and this reduces to a single sliding window.
 * Cost is one hash lookup per offset and key length.</p>
 *
 * @since 0.1.0
 */
public final class NaiveWindowMatcher extends PartitionedMatcher {

  /**
   * Creates a matcher.
   *
   * @param parallelism number of workers the partitions are sized for
   * @param observer progress sink
   */
  public NaiveWindowMatcher(int parallelism, ScanObserver observer) {
    this(new BufferPartitioner(parallelism), observer);
  }

  NaiveWindowMatcher(BufferPartitioner partitioner, ScanObserver observer) {
    super(partitioner, observer);
  }

  @Override
  public MatcherStrategy strategy() {
    return MatcherStrategy.NAIVE;
  }

  @Override
  PartitionScanner prepare(CompositeIndex index) {
    int[] lengths = index.keyLengths();
    return (buffer, idx, partition, sink) -> {
      int bufferLength = buffer.length();
      for (int offset = partition.start(); offset < partition.end(); offset++) {
        for (int length : lengths) {
          if (offset > bufferLength - length) {
            break;
          }
          confirm(buffer, idx, offset, length, sink);
        }
      }
    };
  }
}
