package ca.gc.cra.keyscan.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeReturnsValueWithinBounds() {
    assertEquals(10, Numbers.requireRange("parallelism", 10, 1, 64));
  }

  @Test
  void requireRangeRejectsValuesOutsideBounds() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("parallelism", 0, 1, 64));
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("parallelism", 65, 1, 64));
    assertEquals("parallelism must be between 1 and 64 (was 65)", ex.getMessage());
  }

  @Test
  void parseIntTrimsAndValidates() {
    assertEquals(128, Numbers.parseInt("primeSize", " 128 ", 1, 65_536));
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Numbers.parseInt("primeSize", "12x", 1, 65_536));
    assertTrue(ex.getMessage().contains("must be an integer"));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseInt("primeSize", " ", 1, 65_536));
  }
}
