package ca.gc.cra.keyscan.application.pipeline;

import ca.gc.cra.keyscan.application.port.ScanObserver;
import ca.gc.cra.keyscan.domain.scan.DigitOrder;
import ca.gc.cra.keyscan.domain.scan.DumpBuffer;
import ca.gc.cra.keyscan.domain.scan.ScanPhase;
import ca.gc.cra.keyscan.infrastructure.exec.ExecutorFactories;
import java.math.BigInteger;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.IntStream;

/**
 * <strong>What:</strong> Slides a {@code primeSize}-byte window over every offset of a dump and collects the
 * integers that survive the null-run filter and both primality stages.
 * <p><strong>Why:</strong> Prime factors of in-memory RSA keys sit in the dump as raw byte runs of the modulus
 * half-width.</p>
 * <p><strong>Role:</strong> First stage of {@link KeyScanUseCase}.</p>
 * <p><strong>Thread-safety:</strong> Thread-safe; offsets are split into blocks that run independently and whose
 * tallies are merged at the end.</p>
 * <p><strong>Performance:</strong> Progress and cancellation are handled once per block of
 * {@value #BLOCK_SIZE} windows.</p>
 *
 * @since 0.1.0
 */
public final class WindowScanner {
  /** Number of window offsets handled by one work unit. */
  static final int BLOCK_SIZE = 1 << 16;

  private final PrimalityFilter filter;
  private final ScanObserver observer;
  private final int blockSize;

  /**
   * Creates a scanner.
   *
   * @param filter two-stage primality filter
   * @param observer progress sink
   */
  public WindowScanner(PrimalityFilter filter, ScanObserver observer) {
    this(filter, observer, BLOCK_SIZE);
  }

  WindowScanner(PrimalityFilter filter, ScanObserver observer, int blockSize) {
    this.filter = Objects.requireNonNull(filter, "filter");
    this.observer = Objects.requireNonNull(observer, "observer");
    if (blockSize <= 0) {
      throw new IllegalArgumentException("blockSize must be positive");
    }
    this.blockSize = blockSize;
  }

  /**
   * Scans every window of {@code buffer}.
   *
   * @param buffer dump to scan
   * @param primeSize window width in bytes
   * @param nullFilterLength zero-run length that excludes a window
   * @param pool workers executing the blocks
   * @param cancellation token checked before each block
   * @return confirmed primes with per-stage counts
   * @throws ScanAbortedException with reason {@code NO_WINDOWS} if {@code primeSize} exceeds the dump length
   */
  public Result scan(
      DumpBuffer buffer,
      int primeSize,
      int nullFilterLength,
      ForkJoinPool pool,
      CancellationToken cancellation) {
    Objects.requireNonNull(buffer, "buffer");
    Objects.requireNonNull(pool, "pool");
    Objects.requireNonNull(cancellation, "cancellation");
    if (primeSize <= 0 || nullFilterLength <= 0) {
      throw new IllegalArgumentException("primeSize and nullFilterLength must be positive");
    }
    if (primeSize > buffer.length()) {
      throw new ScanAbortedException(
          ScanAbortedException.Reason.NO_WINDOWS,
          "primeSize " + primeSize + " exceeds dump length " + buffer.length());
    }
    int windowCount = buffer.length() - primeSize + 1;
    int blocks = (int) (((long) windowCount + blockSize - 1) / blockSize);
    observer.onPhaseStarted(ScanPhase.PRIME_SCAN, windowCount);

    Tally total =
        ExecutorFactories.invoke(
            pool,
            () ->
                IntStream.range(0, blocks)
                    .parallel()
                    .mapToObj(
                        block -> {
                          cancellation.throwIfCancelled();
                          int start = block * blockSize;
                          int end = (int) Math.min((long) start + blockSize, windowCount);
                          Tally tally = scanBlock(buffer, primeSize, nullFilterLength, start, end);
                          observer.onProgress(ScanPhase.PRIME_SCAN, end - start);
                          return tally;
                        })
                    .reduce(new Tally(), Tally::merge));
    cancellation.throwIfCancelled();
    return total.toResult();
  }

  private Tally scanBlock(DumpBuffer buffer, int primeSize, int nullFilterLength, int start, int end) {
    Tally tally = new Tally();
    NullRunFilter nullRuns = new NullRunFilter(buffer, primeSize, nullFilterLength, start);
    for (int offset = start; offset < end; offset++) {
      tally.visited++;
      if (nullRuns.excludes(offset)) {
        tally.nullRun++;
        continue;
      }
      byte[] window = buffer.slice(offset, primeSize);
      for (DigitOrder order : filter.orders()) {
        BigInteger candidate = filter.decode(window, order);
        switch (filter.classify(candidate)) {
          case STAGE1_REJECTED -> tally.stage1Rejected++;
          case STAGE2_REJECTED -> tally.stage2Rejected++;
          case CONFIRMED -> tally.primes.add(candidate);
          default -> throw new IllegalStateException("unknown verdict");
        }
      }
    }
    return tally;
  }

  /**
   * Outcome of a window scan.
   *
   * @param primes distinct confirmed primes
   * @param windowsVisited windows examined
   * @param windowsNullRun windows excluded by the null-run filter
   * @param stage1Rejected candidates rejected by the cheap test
   * @param stage2Rejected candidates rejected by the confirming test
   */
  public record Result(
      Set<BigInteger> primes,
      long windowsVisited,
      long windowsNullRun,
      long stage1Rejected,
      long stage2Rejected) {

    /**
     * Copies the prime set.
     */
    public Result {
      primes = Set.copyOf(primes);
    }
  }

  private static final class Tally {
    private final Set<BigInteger> primes = new HashSet<>();
    private long visited;
    private long nullRun;
    private long stage1Rejected;
    private long stage2Rejected;

    Tally merge(Tally other) {
      Tally merged = new Tally();
      merged.primes.addAll(primes);
      merged.primes.addAll(other.primes);
      merged.visited = visited + other.visited;
      merged.nullRun = nullRun + other.nullRun;
      merged.stage1Rejected = stage1Rejected + other.stage1Rejected;
      merged.stage2Rejected = stage2Rejected + other.stage2Rejected;
      return merged;
    }

    Result toResult() {
      return new Result(primes, visited, nullRun, stage1Rejected, stage2Rejected);
    }
  }
}
