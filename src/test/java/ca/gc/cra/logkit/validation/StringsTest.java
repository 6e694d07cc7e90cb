package ca.gc.cra.logkit.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrims() {
    assertEquals("value", Strings.requireNonBlank("name", "  value "));
  }

  @Test
  void requireNonBlankRejectsBlankAndControlCharacters() {
    IllegalArgumentException blank =
        assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("output", "  "));
    assertEquals("output must not be blank", blank.getMessage());
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank(null, "a\u0000b"));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("output", null));
  }

  @Test
  void containsControlDetectsIsoControls() {
    assertTrue(Strings.containsControl("tab\there"));
    assertFalse(Strings.containsControl("plain"));
    assertFalse(Strings.containsControl(null));
  }
}
