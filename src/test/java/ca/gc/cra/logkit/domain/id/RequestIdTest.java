package ca.gc.cra.logkit.domain.id;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class RequestIdTest {

  @Test
  void parseSplitsHostRandomAndSequence() {
    RequestId id = RequestId.parse("web-1.example.org.AbCdEf0123-000042");

    assertEquals("web-1.example.org", id.host());
    assertEquals("AbCdEf0123", id.random());
    assertEquals(42L, id.sequence());
  }

  @Test
  void toStringPadsSequenceToSixDigits() {
    assertEquals("h.AbCdEf0123-000007", new RequestId("h", "AbCdEf0123", 7).toString());
  }

  @Test
  void parseRejectsMissingSequence() {
    assertThrows(IllegalArgumentException.class, () -> RequestId.parse("h.AbCdEf0123"));
    assertThrows(IllegalArgumentException.class, () -> RequestId.parse("h.AbCdEf0123-"));
  }

  @Test
  void parseRejectsNonNumericSequence() {
    assertThrows(IllegalArgumentException.class, () -> RequestId.parse("h.AbCdEf0123-00x001"));
  }

  @Test
  void parseRejectsShortRandomSegment() {
    assertThrows(IllegalArgumentException.class, () -> RequestId.parse("h.Ab12-000001"));
  }

  @Test
  void parseRejectsRandomSegmentWithBase64Symbols() {
    assertThrows(IllegalArgumentException.class, () -> RequestId.parse("h.AbCd+f01/3-000001"));
  }

  @Test
  void parseRejectsEmptyHost() {
    assertThrows(IllegalArgumentException.class, () -> RequestId.parse(".AbCdEf0123-000001"));
  }
}
