package ca.gc.cra.logvault.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrims() {
    assertEquals("billing", Strings.requireNonBlank("service.name", "  billing "));
  }

  @Test
  void requireNonBlankRejectsBlankAndControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("service.name", "   "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("service.name", "bad\u0007name"));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("service.name", null));
  }

  @Test
  void requireFileNameRejectsPathSegments() {
    assertEquals("app", Strings.requireFileName("file.name", "app"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireFileName("file.name", "a/b"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireFileName("file.name", ".."));
  }
}
