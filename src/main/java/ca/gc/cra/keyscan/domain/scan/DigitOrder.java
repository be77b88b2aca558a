package ca.gc.cra.keyscan.domain.scan;

/**
 * <strong>What:</strong> Byte order used to interpret a byte sequence as an unsigned integer.
 * <p><strong>Why:</strong> Key material appears in dumps in whatever order the owning library stored its limbs.</p>
 * <p><strong>Role:</strong> Domain enumeration shared by the primality filter and the composite index.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum DigitOrder {
  /** Most significant byte first (big-endian). */
  MSF,
  /** Least significant byte first (little-endian). */
  LSF
}
