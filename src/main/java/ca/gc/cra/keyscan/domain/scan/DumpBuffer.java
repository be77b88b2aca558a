package ca.gc.cra.keyscan.domain.scan;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Arrays;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable view over the full contents of a memory or disk dump.
 * <p><strong>Why:</strong> Every pipeline stage reads the same bytes concurrently; sharing one read-only instance
 * removes the need for any synchronization.</p>
 * <p><strong>Role:</strong> Domain value owned by the scan use case for the whole run.</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction; safe to share across worker threads.</p>
 * <p><strong>Performance:</strong> Accessors are constant time; only {@link #slice(int, int)} copies.</p>
 *
 * @since 0.1.0
 */
public final class DumpBuffer {
  private final byte[] data;

  @SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "Dumps can be hundreds of megabytes; wrap() transfers ownership.")
  private DumpBuffer(byte[] data) {
    this.data = data;
  }

  /**
   * Wraps an array without copying. The caller hands over ownership and must not mutate it afterwards.
   *
   * @param data dump contents; must not be {@code null}
   * @return buffer backed by {@code data}
   */
  public static DumpBuffer wrap(byte[] data) {
    return new DumpBuffer(Objects.requireNonNull(data, "data"));
  }

  /**
   * Copies the supplied array into a new buffer.
   *
   * @param data dump contents; must not be {@code null}
   * @return buffer backed by a private copy
   */
  public static DumpBuffer copyOf(byte[] data) {
    return new DumpBuffer(Objects.requireNonNull(data, "data").clone());
  }

  /**
   * Returns the number of bytes in the dump.
   *
   * @return length in bytes
   */
  public int length() {
    return data.length;
  }

  /**
   * Returns the byte at {@code index}.
   *
   * @param index zero-based offset
   * @return raw byte value
   * @throws ArrayIndexOutOfBoundsException when {@code index} is outside the buffer
   */
  public byte byteAt(int index) {
    return data[index];
  }

  /**
   * Returns the byte at {@code index} as an unsigned value.
   *
   * @param index zero-based offset
   * @return value in {@code [0, 255]}
   */
  public int unsignedAt(int index) {
    return data[index] & 0xFF;
  }

  /**
   * Copies {@code length} bytes starting at {@code offset}.
   *
   * @param offset first byte to copy
   * @param length number of bytes
   * @return new array owned by the caller
   * @throws IndexOutOfBoundsException when the range does not fit the buffer
   */
  public byte[] slice(int offset, int length) {
    Objects.checkFromIndexSize(offset, length, data.length);
    return Arrays.copyOfRange(data, offset, offset + length);
  }

  /**
   * Tests whether {@code pattern} occurs at {@code offset}.
   *
   * @param offset candidate start offset
   * @param pattern bytes to compare
   * @return {@code true} when the range is in bounds and equal to {@code pattern}
   */
  public boolean regionMatches(int offset, byte[] pattern) {
    if (offset < 0 || offset > data.length - pattern.length) {
      return false;
    }
    return Arrays.equals(data, offset, offset + pattern.length, pattern, 0, pattern.length);
  }

  @Override
  public String toString() {
    return "DumpBuffer{length=" + data.length + '}';
  }
}
