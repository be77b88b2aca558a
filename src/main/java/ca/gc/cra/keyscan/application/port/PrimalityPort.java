package ca.gc.cra.keyscan.application.port;

import ca.gc.cra.keyscan.domain.scan.DigitOrder;
import java.math.BigInteger;

/**
 * <strong>What:</strong> Narrow arbitrary-precision integer capability used by the scan pipeline.
 * <p><strong>Why:</strong> Keeps window decoding, product encoding and probable-prime testing behind one seam so the
 * pipeline does not depend on a particular big-integer library.</p>
 * <p><strong>Role:</strong> Port implemented by {@code JdkPrimalityAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be stateless or otherwise safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public interface PrimalityPort {

  /**
   * Interprets {@code length} bytes as an unsigned integer.
   *
   * @param bytes source array
   * @param offset first byte
   * @param length number of bytes
   * @param order byte order of the source bytes
   * @return non-negative integer
   */
  BigInteger fromBytes(byte[] bytes, int offset, int length, DigitOrder order);

  /**
   * Encodes a non-negative integer in its minimal byte form.
   *
   * <p>Zero encodes to an empty array. For {@link DigitOrder#MSF} the result has no leading zero byte; for
   * {@link DigitOrder#LSF} it has no trailing zero byte.</p>
   *
   * @param value non-negative integer
   * @param order requested byte order
   * @return minimal encoding
   * @throws IllegalArgumentException when {@code value} is negative
   */
  byte[] toBytes(BigInteger value, DigitOrder order);

  /**
   * Runs a probabilistic primality test.
   *
   * <p>Values below two and even values other than two are reported composite without testing.</p>
   *
   * @param value integer to test
   * @param rounds confirmation rounds; higher values lower the false-positive rate
   * @return {@code true} when {@code value} is probably prime
   */
  boolean isProbablePrime(BigInteger value, int rounds);

  /**
   * Multiplies two integers.
   *
   * @param left first factor
   * @param right second factor
   * @return product
   */
  BigInteger multiply(BigInteger left, BigInteger right);
}
