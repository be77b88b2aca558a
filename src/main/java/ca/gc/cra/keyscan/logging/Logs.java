package ca.gc.cra.keyscan.logging;

import java.math.BigInteger;

/**
 * <strong>What:</strong> Logging hygiene helpers for recovered key material.
 * <p><strong>Why:</strong> Confirmed primes and moduli are private keys; logs carry only a short prefix and the bit
 * length so runs can be correlated without leaking the values.
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final int PREFIX_HEX_DIGITS = 8;

  private Logs() {
    // Utility
  }

  /**
   * Renders a redacted fingerprint of {@code value}: its leading hex digits and bit length.
   *
   * @param value integer to describe; {@code null} yields {@code "<null>"}
   * @return text such as {@code 0xfffffffb (32 bits)} or {@code 0xc90fdaa2... (1024 bits)}
   */
  public static String fingerprint(BigInteger value) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    String hex = value.toString(16);
    String prefix = hex.length() > PREFIX_HEX_DIGITS ? hex.substring(0, PREFIX_HEX_DIGITS) + "..." : hex;
    return "0x" + prefix + " (" + value.bitLength() + " bits)";
  }
}
