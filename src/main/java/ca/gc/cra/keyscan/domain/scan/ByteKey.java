package ca.gc.cra.keyscan.domain.scan;

import java.util.Arrays;
import java.util.HexFormat;

/**
 * Byte string usable as a hash map key.
 *
 * <p>Arrays use identity equality, so the composite index wraps every encoded product in a {@code ByteKey} that
 * compares by content. The constructor copies its input and the hash is computed once.</p>
 *
 * @since 0.1.0
 */
public final class ByteKey {
  private final byte[] bytes;
  private final int hash;

  private ByteKey(byte[] bytes) {
    this.bytes = bytes;
    this.hash = Arrays.hashCode(bytes);
  }

  /**
   * Creates a key holding a private copy of {@code bytes}.
   *
   * @param bytes key contents; must not be {@code null}
   * @return new key
   */
  public static ByteKey of(byte[] bytes) {
    if (bytes == null) {
      throw new IllegalArgumentException("bytes must not be null");
    }
    return new ByteKey(bytes.clone());
  }

  /**
   * Creates a key from a region of a dump.
   *
   * @param buffer source dump
   * @param offset first byte
   * @param length key length in bytes
   * @return new key
   */
  public static ByteKey of(DumpBuffer buffer, int offset, int length) {
    return new ByteKey(buffer.slice(offset, length));
  }

  /**
   * Returns the key length.
   *
   * @return number of bytes
   */
  public int length() {
    return bytes.length;
  }

  /**
   * Returns the byte at {@code index}.
   *
   * @param index position within the key
   * @return raw byte
   */
  public byte byteAt(int index) {
    return bytes[index];
  }

  /**
   * Returns a copy of the key contents.
   *
   * @return new array
   */
  public byte[] toByteArray() {
    return bytes.clone();
  }

  /**
   * Tests whether this key occurs in {@code buffer} at {@code offset}.
   *
   * @param buffer dump to compare against
   * @param offset candidate start offset
   * @return {@code true} on an exact match
   */
  public boolean matchesAt(DumpBuffer buffer, int offset) {
    return buffer.regionMatches(offset, bytes);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof ByteKey other)) {
      return false;
    }
    return hash == other.hash && Arrays.equals(bytes, other.bytes);
  }

  @Override
  public int hashCode() {
    return hash;
  }

  @Override
  public String toString() {
    if (bytes.length <= 16) {
      return "ByteKey{" + HexFormat.of().formatHex(bytes) + '}';
    }
    return "ByteKey{" + HexFormat.of().formatHex(bytes, 0, 16) + "..., length=" + bytes.length + '}';
  }
}
