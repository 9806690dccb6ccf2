package ca.gc.cra.logdrop.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrims() {
    assertEquals("value", Strings.requireNonBlank("field", "  value "));
  }

  @Test
  void requireNonBlankRejectsBlankAndControlCharacters() {
    IllegalArgumentException blank =
        assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("field", "   "));
    assertEquals("field must not be blank", blank.getMessage());
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("field", "a\nb"));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("field", null));
  }

  @Test
  void requireIdentifierAcceptsOutputNames() {
    assertEquals("es_main-2.b", Strings.requireIdentifier("name", "es_main-2.b"));
  }

  @Test
  void requireIdentifierRejectsSeparators() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Strings.requireIdentifier("name", "a/b"));
    assertTrue(ex.getMessage().startsWith("name "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireIdentifier("name", "a b"));
  }
}
