package ca.gc.cra.keyscan.infrastructure.match;

import ca.gc.cra.keyscan.application.pipeline.CompositeIndex;
import ca.gc.cra.keyscan.application.port.MetricsPort;
import ca.gc.cra.keyscan.application.port.ScanObserver;
import ca.gc.cra.keyscan.domain.scan.ByteKey;
import ca.gc.cra.keyscan.domain.scan.MatcherStrategy;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.concurrent.atomic.LongAdder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Slides a Rabin fingerprint over the dump and treats positions whose fingerprint equals that of some key prefix as
 * separators.
 *
 * <p>Every separator is re-sliced at each key length registered under its fingerprint and confirmed by exact
 * index lookup; unconfirmed separators are counted as collisions and never reported. The fingerprint covers the
 * first {@code min(fingerprintWidth, shortest key)} bytes of each key.</p>
 *
 * @since 0.1.0
 */
public final class RollingHashMatcher extends PartitionedMatcher {
  private static final Logger log = LoggerFactory.getLogger(RollingHashMatcher.class);
  /** Default fingerprint width in bytes. */
  public static final int DEFAULT_FINGERPRINT_WIDTH = 8;

  private final int fingerprintWidth;
  private final MetricsPort metrics;
  private final LongAdder collisions = new LongAdder();

  /**
   * Creates a matcher.
   *
   * @param parallelism number of workers the partitions are sized for
   * @param fingerprintWidth preferred fingerprint width in bytes
   * @param observer progress sink
   * @param metrics receives {@code match.rolling.collisions}
   */
  public RollingHashMatcher(int parallelism, int fingerprintWidth, ScanObserver observer, MetricsPort metrics) {
    this(fingerprintWidth, new BufferPartitioner(parallelism), observer, metrics);
  }

  RollingHashMatcher(
      int fingerprintWidth, BufferPartitioner partitioner, ScanObserver observer, MetricsPort metrics) {
    super(partitioner, observer);
    if (fingerprintWidth <= 0) {
      throw new IllegalArgumentException("fingerprintWidth must be positive");
    }
    this.fingerprintWidth = fingerprintWidth;
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public MatcherStrategy strategy() {
    return MatcherStrategy.ROLLING_HASH;
  }

  /**
   * Returns the number of separators rejected by exact confirmation during the most recent {@code match} call.
   *
   * @return collision count
   */
  public long collisions() {
    return collisions.sum();
  }

  @Override
  void resetRunState() {
    collisions.reset();
  }

  @Override
  PartitionScanner prepare(CompositeIndex index) {
    RabinFingerprint rabin = new RabinFingerprint(Math.min(fingerprintWidth, index.minKeyLength()));
    SeparatorTable table = SeparatorTable.build(index, rabin);
    log.debug("Fingerprint table holds {} separators of width {}", table.size(), table.fingerprint.width());
    return (buffer, idx, partition, sink) -> {
      RabinFingerprint fingerprint = table.fingerprint;
      int width = fingerprint.width();
      int bufferLength = buffer.length();
      int lastStart = Math.min(partition.end(), bufferLength - width + 1);
      if (partition.start() >= lastStart) {
        return;
      }
      long hash = fingerprint.of(buffer, partition.start());
      for (int offset = partition.start(); ; ) {
        int[] lengths = table.lengths(hash);
        if (lengths != null) {
          for (int length : lengths) {
            if (offset > bufferLength - length) {
              break;
            }
            if (!confirm(buffer, idx, offset, length, sink)) {
              collisions.increment();
              metrics.increment("match.rolling.collisions");
            }
          }
        }
        offset++;
        if (offset >= lastStart) {
          break;
        }
        hash = fingerprint.roll(hash, buffer.unsignedAt(offset - 1), buffer.unsignedAt(offset + width - 1));
      }
    };
  }

  /** Fingerprint to key-length table with a bit filter in front of the map. */
  private static final class SeparatorTable {
    private final RabinFingerprint fingerprint;
    private final Map<Long, int[]> lengthsByHash;
    private final long[] filter;
    private final int filterMask;

    private SeparatorTable(
        RabinFingerprint fingerprint, Map<Long, int[]> lengthsByHash, long[] filter, int filterMask) {
      this.fingerprint = fingerprint;
      this.lengthsByHash = lengthsByHash;
      this.filter = filter;
      this.filterMask = filterMask;
    }

    static SeparatorTable build(CompositeIndex index, RabinFingerprint fingerprint) {
      Map<Long, TreeSet<Integer>> grouped = new HashMap<>();
      for (ByteKey key : index.keys()) {
        grouped.computeIfAbsent(fingerprint.of(key), h -> new TreeSet<>()).add(key.length());
      }
      int bits = Integer.highestOneBit(Math.max(1024, grouped.size() * 8 - 1)) << 1;
      if (bits <= 0) {
        bits = 1 << 30;
      }
      long[] filter = new long[bits >>> 6];
      int mask = bits - 1;
      Map<Long, int[]> lengths = new HashMap<>(grouped.size() * 2);
      grouped.forEach(
          (hash, set) -> {
            lengths.put(hash, set.stream().mapToInt(Integer::intValue).toArray());
            int slot = (int) (hash & mask);
            filter[slot >>> 6] |= 1L << slot;
          });
      return new SeparatorTable(fingerprint, lengths, filter, mask);
    }

    int[] lengths(long hash) {
      int slot = (int) (hash & filterMask);
      if ((filter[slot >>> 6] & (1L << slot)) == 0) {
        return null;
      }
      return lengthsByHash.get(hash);
    }

    int size() {
      return lengthsByHash.size();
    }
  }
}
