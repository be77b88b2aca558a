package ca.gc.cra.keyscan.domain.scan;

import java.math.BigInteger;
import java.util.Objects;

/**
 * <strong>What:</strong> Product {@code N = P * Q} of two confirmed primes together with its byte encodings.
 * <p><strong>Why:</strong> The encodings are the search patterns fed to every matcher strategy.</p>
 * <p><strong>Role:</strong> Domain value produced by the composite index builder and shared read-only by matchers.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 * <p><strong>Performance:</strong> Encodings are computed once per pair and held as {@link ByteKey}s.</p>
 *
 * @param p smaller prime; {@code p <= q}
 * @param q larger prime
 * @param n product of {@code p} and {@code q}
 * @param lsf minimal least-significant-first encoding of {@code n}
 * @param msf minimal most-significant-first encoding of {@code n}
 * @since 0.1.0
 */
public record CompositeCandidate(BigInteger p, BigInteger q, BigInteger n, ByteKey lsf, ByteKey msf) {

  /**
   * Enforces the canonical orientation {@code p <= q}.
   *
   * @throws IllegalArgumentException when {@code p > q}
   */
  public CompositeCandidate {
    Objects.requireNonNull(p, "p");
    Objects.requireNonNull(q, "q");
    Objects.requireNonNull(n, "n");
    Objects.requireNonNull(lsf, "lsf");
    Objects.requireNonNull(msf, "msf");
    if (p.compareTo(q) > 0) {
      throw new IllegalArgumentException("composite pairs must be canonical (p <= q)");
    }
  }

  /**
   * Returns the encoding for the requested order.
   *
   * @param order byte order
   * @return encoded key
   */
  public ByteKey encoding(DigitOrder order) {
    return order == DigitOrder.LSF ? lsf : msf;
  }

  /**
   * Converts this candidate into the result reported when one of its encodings is found.
   *
   * @return match result carrying {@code (p, q, n)}
   */
  public MatchResult toMatch() {
    return new MatchResult(p, q, n);
  }
}
