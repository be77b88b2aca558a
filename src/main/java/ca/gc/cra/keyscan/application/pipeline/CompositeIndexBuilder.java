package ca.gc.cra.keyscan.application.pipeline;

import ca.gc.cra.keyscan.application.port.MetricsPort;
import ca.gc.cra.keyscan.application.port.PrimalityPort;
import ca.gc.cra.keyscan.application.port.ScanObserver;
import ca.gc.cra.keyscan.domain.scan.Advisory;
import ca.gc.cra.keyscan.domain.scan.ByteKey;
import ca.gc.cra.keyscan.domain.scan.CompositeCandidate;
import ca.gc.cra.keyscan.domain.scan.DigitOrder;
import ca.gc.cra.keyscan.domain.scan.ScanPhase;
import ca.gc.cra.keyscan.infrastructure.exec.ExecutorFactories;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.atomic.LongAdder;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * <strong>What:</strong> Forms every pair {@code P <= Q} of confirmed primes, self pairs included, and indexes both
 * minimal encodings of {@code N = P * Q}.
 * <p><strong>Why:</strong> A modulus stored next to its factors confirms that the factors are real key material.</p>
 * <p><strong>Role:</strong> Second stage of {@link KeyScanUseCase}.</p>
 * <p><strong>Thread-safety:</strong> Thread-safe; rows of the pair triangle are computed in parallel and merged in
 * ascending order of {@code P}.</p>
 * <p><strong>Performance:</strong> O(k<sup>2</sup>) time and memory in the number of primes.</p>
 *
 * @since 0.1.0
 */
public final class CompositeIndexBuilder {
  private final PrimalityPort primality;
  private final ScanObserver observer;
  private final MetricsPort metrics;

  /**
   * Creates a builder.
   *
   * @param primality big-integer capability used for products and encodings
   * @param observer progress and advisory sink
   * @param metrics metrics sink for rejected keys
   */
  public CompositeIndexBuilder(PrimalityPort primality, ScanObserver observer, MetricsPort metrics) {
    this.primality = Objects.requireNonNull(primality, "primality");
    this.observer = Objects.requireNonNull(observer, "observer");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Builds the index.
   *
   * @param primes distinct confirmed primes
   * @param primeSize window width the primes were found with; keys wider than twice this are rejected
   * @param pool workers computing the pair rows
   * @param cancellation token checked before each row
   * @return immutable index
   */
  public CompositeIndex build(
      Collection<BigInteger> primes, int primeSize, ForkJoinPool pool, CancellationToken cancellation) {
    Objects.requireNonNull(primes, "primes");
    Objects.requireNonNull(pool, "pool");
    Objects.requireNonNull(cancellation, "cancellation");
    List<BigInteger> sorted = primes.stream().distinct().sorted().collect(Collectors.toList());
    int count = sorted.size();
    int maxKeyLength = 2 * primeSize;
    long pairTotal = (long) count * (count + 1) / 2;
    observer.onPhaseStarted(ScanPhase.INDEX_BUILD, pairTotal);

    LongAdder rejected = new LongAdder();
    List<CompositeCandidate> candidates =
        ExecutorFactories.invoke(
            pool,
            () ->
                IntStream.range(0, count)
                    .parallel()
                    .mapToObj(
                        i -> {
                          cancellation.throwIfCancelled();
                          List<CompositeCandidate> row = row(sorted, i, maxKeyLength, rejected);
                          observer.onProgress(ScanPhase.INDEX_BUILD, count - i);
                          return row;
                        })
                    .flatMap(List::stream)
                    .collect(Collectors.toList()));
    cancellation.throwIfCancelled();

    long rejectedCount = rejected.sum();
    if (rejectedCount > 0) {
      observer.onAdvisory(
          new Advisory(
              Advisory.Kind.OVERSIZED_COMPOSITE,
              rejectedCount + " composite encodings exceeded " + maxKeyLength + " bytes and were not indexed",
              rejectedCount));
    }
    return CompositeIndex.of(candidates, rejectedCount);
  }

  private List<CompositeCandidate> row(
      List<BigInteger> sorted, int i, int maxKeyLength, LongAdder rejected) {
    BigInteger p = sorted.get(i);
    List<CompositeCandidate> row = new ArrayList<>(sorted.size() - i);
    for (int j = i; j < sorted.size(); j++) {
      BigInteger q = sorted.get(j);
      BigInteger n = primality.multiply(p, q);
      byte[] msf = primality.toBytes(n, DigitOrder.MSF);
      if (msf.length > maxKeyLength) {
        rejected.increment();
        metrics.increment("index.keys.rejected");
        continue;
      }
      byte[] lsf = primality.toBytes(n, DigitOrder.LSF);
      row.add(new CompositeCandidate(p, q, n, ByteKey.of(lsf), ByteKey.of(msf)));
    }
    return row;
  }
}
