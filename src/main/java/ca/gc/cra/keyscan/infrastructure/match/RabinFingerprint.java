package ca.gc.cra.keyscan.infrastructure.match;

import ca.gc.cra.keyscan.domain.scan.ByteKey;
import ca.gc.cra.keyscan.domain.scan.DumpBuffer;

/**
 * Rabin-Karp polynomial fingerprint over a fixed byte width.
 *
 * <p>Hashes are computed modulo the Mersenne prime 2<sup>61</sup>-1 with base 257, so removing the oldest byte
 * and appending a new one costs two modular multiplications.</p>
 *
 * @since 0.1.0
 */
final class RabinFingerprint {
  static final long MOD = (1L << 61) - 1;
  static final long BASE = 257;

  private final int width;
  private final long outgoingWeight;

  RabinFingerprint(int width) {
    if (width <= 0) {
      throw new IllegalArgumentException("width must be positive");
    }
    this.width = width;
    long weight = 1;
    for (int i = 0; i < width - 1; i++) {
      weight = mulMod(weight, BASE);
    }
    this.outgoingWeight = weight;
  }

  int width() {
    return width;
  }

  /**
   * Fingerprints the first {@link #width()} bytes of {@code key}.
   *
   * @param key key at least {@code width} bytes long
   * @return fingerprint
   */
  long of(ByteKey key) {
    if (key.length() < width) {
      throw new IllegalArgumentException("key shorter than fingerprint width");
    }
    long hash = 0;
    for (int i = 0; i < width; i++) {
      hash = append(hash, key.byteAt(i) & 0xFF);
    }
    return hash;
  }

  /**
   * Fingerprints {@code width} bytes of {@code buffer} starting at {@code offset}.
   *
   * @param buffer dump
   * @param offset first byte
   * @return fingerprint
   */
  long of(DumpBuffer buffer, int offset) {
    long hash = 0;
    for (int i = 0; i < width; i++) {
      hash = append(hash, buffer.unsignedAt(offset + i));
    }
    return hash;
  }

  /**
   * Slides the window one byte to the right.
   *
   * @param hash fingerprint of the current window
   * @param outgoing unsigned value of the byte leaving the window
   * @param incoming unsigned value of the byte entering the window
   * @return fingerprint of the shifted window
   */
  long roll(long hash, int outgoing, int incoming) {
    long without = hash - mulMod(outgoing, outgoingWeight);
    if (without < 0) {
      without += MOD;
    }
    return append(without, incoming);
  }

  private static long append(long hash, int value) {
    long next = mulMod(hash, BASE) + value;
    return next >= MOD ? next - MOD : next;
  }

  static long mulMod(long a, long b) {
    long low = a * b;
    long high = Math.multiplyHigh(a, b);
    // 2^64 is congruent to 8 modulo 2^61-1
    long folded = (low & MOD) + (low >>> 61) + (high << 3);
    folded = (folded & MOD) + (folded >>> 61);
    return folded >= MOD ? folded - MOD : folded;
  }
}
