package ca.gc.cra.keyscan.application.pipeline;

import ca.gc.cra.keyscan.application.port.PrimalityPort;
import ca.gc.cra.keyscan.domain.scan.DigitOrder;
import ca.gc.cra.keyscan.domain.scan.OrderPolicy;
import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Two-stage probable-prime test applied to the integers decoded from a window.
 * <p><strong>Why:</strong> Most windows are composite; a cheap low-round test discards them so the expensive
 * high-round test only runs on survivors.</p>
 * <p><strong>Role:</strong> Stateless collaborator of {@link WindowScanner}.</p>
 * <p><strong>Thread-safety:</strong> Thread-safe when the supplied {@link PrimalityPort} is.</p>
 *
 * @since 0.1.0
 */
public final class PrimalityFilter {

  /** Outcome of classifying one candidate. */
  public enum Verdict {
    /** Rejected by the cheap test. */
    STAGE1_REJECTED,
    /** Passed the cheap test but rejected by the confirming test. */
    STAGE2_REJECTED,
    /** Passed both tests. */
    CONFIRMED
  }

  private final PrimalityPort primality;
  private final List<DigitOrder> orders;
  private final int stage1Rounds;
  private final int stage2Rounds;

  /**
   * Creates a filter.
   *
   * @param primality big-integer capability
   * @param policy byte orders to decode each window in
   * @param stage1Rounds rounds for the cheap test; must be positive
   * @param stage2Rounds rounds for the confirming test; must be at least {@code stage1Rounds}
   */
  public PrimalityFilter(PrimalityPort primality, OrderPolicy policy, int stage1Rounds, int stage2Rounds) {
    this.primality = Objects.requireNonNull(primality, "primality");
    this.orders = Objects.requireNonNull(policy, "policy").orders();
    if (stage1Rounds <= 0) {
      throw new IllegalArgumentException("stage1Rounds must be positive");
    }
    if (stage2Rounds < stage1Rounds) {
      throw new IllegalArgumentException("stage2Rounds must be >= stage1Rounds");
    }
    this.stage1Rounds = stage1Rounds;
    this.stage2Rounds = stage2Rounds;
  }

  /**
   * Returns the byte orders each window is decoded in.
   *
   * @return immutable order list
   */
  public List<DigitOrder> orders() {
    return orders;
  }

  /**
   * Decodes window bytes in the given order.
   *
   * @param windowBytes window contents
   * @param order byte order
   * @return candidate integer
   */
  public BigInteger decode(byte[] windowBytes, DigitOrder order) {
    return primality.fromBytes(windowBytes, 0, windowBytes.length, order);
  }

  /**
   * Runs both test stages on {@code candidate}.
   *
   * @param candidate integer to classify
   * @return verdict naming the stage that rejected it, or {@link Verdict#CONFIRMED}
   */
  public Verdict classify(BigInteger candidate) {
    if (!primality.isProbablePrime(candidate, stage1Rounds)) {
      return Verdict.STAGE1_REJECTED;
    }
    if (!primality.isProbablePrime(candidate, stage2Rounds)) {
      return Verdict.STAGE2_REJECTED;
    }
    return Verdict.CONFIRMED;
  }
}
