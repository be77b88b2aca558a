package ca.gc.cra.keyscan.domain.scan;

import java.util.Objects;

/**
 * Fixed-length view into a {@link DumpBuffer}.
 *
 * <p>Windows never copy the underlying bytes; {@link #bytes()} materializes a private copy on demand.</p>
 *
 * @param buffer backing dump; never {@code null}
 * @param offset first byte of the window
 * @param length window width in bytes
 * @since 0.1.0
 */
public record Window(DumpBuffer buffer, int offset, int length) {

  /**
   * Validates that the window lies within its buffer.
   *
   * @throws IndexOutOfBoundsException when the range does not fit
   */
  public Window {
    Objects.requireNonNull(buffer, "buffer");
    Objects.checkFromIndexSize(offset, length, buffer.length());
  }

  /**
   * Returns the byte at a position relative to the window start.
   *
   * @param index position within the window
   * @return raw byte value
   */
  public byte byteAt(int index) {
    Objects.checkIndex(index, length);
    return buffer.byteAt(offset + index);
  }

  /**
   * Copies the window contents.
   *
   * @return new array of {@link #length()} bytes
   */
  public byte[] bytes() {
    return buffer.slice(offset, length);
  }
}
