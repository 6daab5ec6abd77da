package ca.gc.cra.logkit.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankStripsWhitespace() {
    assertEquals("value", Strings.requireNonBlank("test", "  value  "));
  }

  @Test
  void requireNonBlankRejectsControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("test", "bad\u0001"));
  }

  @Test
  void requireNonBlankRejectsBlank() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("zone", "   "));
    assertEquals("zone must not be blank", ex.getMessage());
  }

  @Test
  void fileNameSegmentAllowsEmptyAndNull() {
    assertEquals("", Strings.requireFileNameSegment("prefix", ""));
    assertEquals("", Strings.requireFileNameSegment("prefix", null));
  }

  @Test
  void fileNameSegmentKeepsOrdinaryNames() {
    assertEquals("billing.api_v2", Strings.requireFileNameSegment("prefix", "billing.api_v2"));
  }

  @Test
  void fileNameSegmentRejectsSeparators() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireFileNameSegment("prefix", "a/b"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireFileNameSegment("prefix", "a\\b"));
  }

  @Test
  void fileNameSegmentRejectsDotSegments() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireFileNameSegment("prefix", ".."));
  }

  @Test
  void fileNameSegmentRejectsControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireFileNameSegment("prefix", "api\n"));
  }
}
