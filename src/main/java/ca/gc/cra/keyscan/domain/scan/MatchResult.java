package ca.gc.cra.keyscan.domain.scan;

import java.math.BigInteger;
import java.util.Comparator;
import java.util.Objects;

/**
 * <strong>What:</strong> Confirmed RSA modulus triple whose product encoding was found in the dump.
 * <p><strong>Why:</strong> Matches are deduplicated by {@code (p, q)}; record equality provides exactly that since
 * {@code n} is determined by the pair.</p>
 * <p><strong>Role:</strong> Domain value produced by matchers and consumed by result reporters.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param p smaller prime; {@code p <= q}
 * @param q larger prime
 * @param n modulus {@code p * q}
 * @since 0.1.0
 */
public record MatchResult(BigInteger p, BigInteger q, BigInteger n) {

  /** Orders results by {@code p} then {@code q} for stable reporting. */
  public static final Comparator<MatchResult> BY_PAIR =
      Comparator.comparing(MatchResult::p).thenComparing(MatchResult::q);

  /**
   * Enforces the canonical orientation.
   *
   * @throws IllegalArgumentException when {@code p > q}
   */
  public MatchResult {
    Objects.requireNonNull(p, "p");
    Objects.requireNonNull(q, "q");
    Objects.requireNonNull(n, "n");
    if (p.compareTo(q) > 0) {
      throw new IllegalArgumentException("match results must be canonical (p <= q)");
    }
  }
}
