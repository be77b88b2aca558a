package ca.gc.cra.keyscan.domain.scan;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class DumpBufferTest {

  @Test
  void copyOfIsIsolatedFromSource() {
    byte[] data = {1, 2, 3};
    DumpBuffer buffer = DumpBuffer.copyOf(data);
    data[0] = 42;

    assertEquals(1, buffer.byteAt(0));
  }

  @Test
  void unsignedAccessAndSlices() {
    DumpBuffer buffer = DumpBuffer.wrap(new byte[] {(byte) 0x80, 0x01, (byte) 0xFF});

    assertEquals(0x80, buffer.unsignedAt(0));
    assertEquals(-1, buffer.byteAt(2));
    assertArrayEquals(new byte[] {0x01, (byte) 0xFF}, buffer.slice(1, 2));
    assertThrows(IndexOutOfBoundsException.class, () -> buffer.slice(2, 2));
  }

  @Test
  void windowReadsThroughToBuffer() {
    DumpBuffer buffer = DumpBuffer.wrap(new byte[] {5, 6, 7, 8});
    Window window = new Window(buffer, 1, 2);

    assertEquals(7, window.byteAt(1));
    assertArrayEquals(new byte[] {6, 7}, window.bytes());
    assertThrows(IndexOutOfBoundsException.class, () -> window.byteAt(2));
    assertThrows(IndexOutOfBoundsException.class, () -> new Window(buffer, 3, 2));
  }
}
