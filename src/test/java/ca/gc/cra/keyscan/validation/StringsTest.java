package ca.gc.cra.keyscan.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrims() {
    assertEquals("value", Strings.requireNonBlank("name", "  value "));
  }

  @Test
  void requireNonBlankRejectsBlankAndControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("name", "   "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("name", "a\u0007b"));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("name", null));
  }

  @Test
  void requireOneOfNormalizesCase() {
    assertEquals("json", Strings.requireOneOf("format", "JSON", "text", "json"));
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Strings.requireOneOf("format", "xml", "text", "json"));
    assertEquals("format must be one of text|json (was 'xml')", ex.getMessage());
  }

  @Test
  void requirePrintableAsciiEnforcesLengthAndCharset() {
    assertEquals("team=ir", Strings.requirePrintableAscii("attrs", "team=ir", 16));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "team=incident", 4));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "team=é", 16));
  }
}
