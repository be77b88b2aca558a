package ca.gc.cra.keyscan.application.pipeline;

import ca.gc.cra.keyscan.application.port.ScanObserver;
import ca.gc.cra.keyscan.domain.scan.Advisory;
import java.util.Objects;

/**
 * Checks the confirmed prime count before quadratic pair construction starts.
 *
 * <p>A count above the warning threshold raises a {@link Advisory.Kind#PRIME_COUNT_HIGH} advisory and the scan
 * continues. A count above the optional ceiling aborts the scan.</p>
 *
 * @since 0.1.0
 */
public final class PrimeVolumeGuard {
  /** Confirmed prime count above which an advisory is raised. */
  public static final int DEFAULT_WARN_THRESHOLD = 1000;

  private final int warnThreshold;
  private final int maxPrimes;
  private final ScanObserver observer;

  /**
   * Creates a guard.
   *
   * @param warnThreshold counts strictly above this value raise an advisory
   * @param maxPrimes counts strictly above this value abort; {@code 0} disables the ceiling
   * @param observer advisory sink
   */
  public PrimeVolumeGuard(int warnThreshold, int maxPrimes, ScanObserver observer) {
    if (warnThreshold < 0 || maxPrimes < 0) {
      throw new IllegalArgumentException("warnThreshold and maxPrimes must not be negative");
    }
    this.warnThreshold = warnThreshold;
    this.maxPrimes = maxPrimes;
    this.observer = Objects.requireNonNull(observer, "observer");
  }

  /**
   * Applies the threshold and ceiling to {@code primeCount}.
   *
   * @param primeCount number of distinct confirmed primes
   * @return {@code true} if an advisory was raised
   * @throws ScanAbortedException with reason {@code PRIME_LIMIT_EXCEEDED} when the ceiling is exceeded
   */
  public boolean check(int primeCount) {
    if (maxPrimes > 0 && primeCount > maxPrimes) {
      throw new ScanAbortedException(
          ScanAbortedException.Reason.PRIME_LIMIT_EXCEEDED,
          primeCount + " confirmed primes exceed maxPrimes=" + maxPrimes);
    }
    if (primeCount > warnThreshold) {
      long pairs = (long) primeCount * (primeCount + 1) / 2;
      observer.onAdvisory(
          new Advisory(
              Advisory.Kind.PRIME_COUNT_HIGH,
              primeCount + " confirmed primes will produce " + pairs
                  + " composite pairs; consider a smaller nullFilterLength",
              primeCount));
      return true;
    }
    return false;
  }
}
