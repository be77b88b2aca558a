package ca.gc.cra.keyscan.infrastructure.match;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits the start offsets of a dump into contiguous partitions for parallel matching.
 *
 * <p>A partition owns the match start offsets in {@code [start, end)}. Scanners read past {@code end} by up to
 * the longest key length minus one so that matches straddling a boundary are found exactly once.</p>
 *
 * @since 0.1.0
 */
final class BufferPartitioner {
  static final int DEFAULT_MIN_PARTITION = 1 << 20;
  private static final int PARTITIONS_PER_WORKER = 4;

  private final int parallelism;
  private final int minPartition;

  BufferPartitioner(int parallelism) {
    this(parallelism, DEFAULT_MIN_PARTITION);
  }

  BufferPartitioner(int parallelism, int minPartition) {
    if (parallelism <= 0 || minPartition <= 0) {
      throw new IllegalArgumentException("parallelism and minPartition must be positive");
    }
    this.parallelism = parallelism;
    this.minPartition = minPartition;
  }

  /**
   * Partitions {@code [0, length)}.
   *
   * @param length number of start offsets
   * @return ordered, non-overlapping partitions covering every offset; empty when {@code length == 0}
   */
  List<Partition> partition(int length) {
    if (length < 0) {
      throw new IllegalArgumentException("length must not be negative");
    }
    List<Partition> partitions = new ArrayList<>();
    if (length == 0) {
      return partitions;
    }
    long target = (long) parallelism * PARTITIONS_PER_WORKER;
    int size = (int) Math.max(minPartition, (length + target - 1) / target);
    for (int start = 0; start < length; ) {
      int end = (int) Math.min((long) start + size, length);
      partitions.add(new Partition(start, end));
      start = end;
    }
    return partitions;
  }

  /**
   * Owned start offsets {@code [start, end)}.
   *
   * @param start first owned offset
   * @param end one past the last owned offset
   */
  record Partition(int start, int end) {
    Partition {
      if (start < 0 || end < start) {
        throw new IllegalArgumentException("invalid partition [" + start + ", " + end + ")");
      }
    }

    int length() {
      return end - start;
    }

    /**
     * Returns the exclusive read limit for keys up to {@code maxKeyLength} bytes.
     *
     * @param bufferLength dump length
     * @param maxKeyLength longest key
     * @return last readable offset plus one
     */
    int readLimit(int bufferLength, int maxKeyLength) {
      return (int) Math.min(bufferLength, (long) end + Math.max(0, maxKeyLength - 1));
    }
  }
}
