package ca.gc.cra.keyscan.domain.scan;

import java.util.List;
import java.util.Locale;

/**
 * Selects which {@link DigitOrder}s each surviving window is interpreted in.
 *
 * <p>{@link #BOTH} doubles the candidate volume per window; the confirmed prime set is deduplicated by
 * value so a prime found in both orders is reported once.</p>
 *
 * @since 0.1.0
 */
public enum OrderPolicy {
  /** Interpret windows most significant byte first only. */
  MSF(List.of(DigitOrder.MSF)),
  /** Interpret windows least significant byte first only. */
  LSF(List.of(DigitOrder.LSF)),
  /** Interpret every window in both orders. */
  BOTH(List.of(DigitOrder.MSF, DigitOrder.LSF));

  private final List<DigitOrder> orders;

  OrderPolicy(List<DigitOrder> orders) {
    this.orders = orders;
  }

  /**
   * Returns the orders applied to each window.
   *
   * @return immutable list of one or two orders
   */
  public List<DigitOrder> orders() {
    return orders;
  }

  /**
   * Parses a CLI value such as {@code both}, {@code msf} or {@code lsf}.
   *
   * @param raw raw value; blank yields {@link #BOTH}
   * @return parsed policy
   * @throws IllegalArgumentException when the value is not recognised
   */
  public static OrderPolicy parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return BOTH;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "both" -> BOTH;
      case "msf", "be", "big-endian" -> MSF;
      case "lsf", "le", "little-endian" -> LSF;
      default -> throw new IllegalArgumentException("byteOrder must be one of both, msf, lsf (was " + raw + ")");
    };
  }
}
