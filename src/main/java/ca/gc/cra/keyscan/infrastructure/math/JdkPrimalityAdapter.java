package ca.gc.cra.keyscan.infrastructure.math;

import ca.gc.cra.keyscan.application.port.PrimalityPort;
import ca.gc.cra.keyscan.domain.scan.DigitOrder;
import java.math.BigInteger;
import java.util.Objects;

/**
 * {@link PrimalityPort} backed by {@link BigInteger}.
 *
 * <p>{@link BigInteger#isProbablePrime(int)} takes a certainty exponent rather than a round count; one round of a
 * Miller-Rabin style test bounds the error by 4<sup>-1</sup>, so {@code rounds} maps to a certainty of
 * {@code 2 * rounds}.</p>
 *
 * @since 0.1.0
 */
public final class JdkPrimalityAdapter implements PrimalityPort {
  private static final BigInteger TWO = BigInteger.TWO;

  @Override
  public BigInteger fromBytes(byte[] bytes, int offset, int length, DigitOrder order) {
    Objects.requireNonNull(bytes, "bytes");
    Objects.requireNonNull(order, "order");
    Objects.checkFromIndexSize(offset, length, bytes.length);
    if (order == DigitOrder.MSF) {
      return new BigInteger(1, bytes, offset, length);
    }
    byte[] reversed = new byte[length];
    for (int i = 0; i < length; i++) {
      reversed[i] = bytes[offset + length - 1 - i];
    }
    return new BigInteger(1, reversed);
  }

  @Override
  public byte[] toBytes(BigInteger value, DigitOrder order) {
    Objects.requireNonNull(value, "value");
    Objects.requireNonNull(order, "order");
    if (value.signum() < 0) {
      throw new IllegalArgumentException("value must not be negative");
    }
    if (value.signum() == 0) {
      return new byte[0];
    }
    byte[] twos = value.toByteArray();
    // toByteArray adds a leading sign byte when the top bit is set
    int start = twos[0] == 0 ? 1 : 0;
    int length = twos.length - start;
    byte[] out = new byte[length];
    if (order == DigitOrder.MSF) {
      System.arraycopy(twos, start, out, 0, length);
    } else {
      for (int i = 0; i < length; i++) {
        out[i] = twos[twos.length - 1 - i];
      }
    }
    return out;
  }

  @Override
  public boolean isProbablePrime(BigInteger value, int rounds) {
    Objects.requireNonNull(value, "value");
    if (rounds <= 0) {
      throw new IllegalArgumentException("rounds must be positive");
    }
    if (value.compareTo(TWO) < 0) {
      return false;
    }
    if (!value.testBit(0)) {
      return value.equals(TWO);
    }
    return value.isProbablePrime(Math.multiplyExact(2, rounds));
  }

  @Override
  public BigInteger multiply(BigInteger left, BigInteger right) {
    return Objects.requireNonNull(left, "left").multiply(Objects.requireNonNull(right, "right"));
  }
}
