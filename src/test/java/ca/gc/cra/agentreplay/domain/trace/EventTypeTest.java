package ca.gc.cra.agentreplay.domain.trace;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class EventTypeTest {

  @Test
  void wireValuesRoundTrip() {
    for (EventType type : EventType.values()) {
      assertEquals(type, EventType.fromWire(type.wireValue()));
    }
  }

  @Test
  void labelUppercasesAndSpacesTheWireValue() {
    assertEquals("TOOL CALL", EventType.TOOL_CALL.label());
    assertEquals("LOG", EventType.LOG.label());
  }

  @Test
  void unknownOrDifferentlyCasedKindIsRejected() {
    assertThrows(TraceFormatException.class, () -> EventType.fromWire("TOOL_CALL"));
    assertThrows(TraceFormatException.class, () -> EventType.fromWire("thought"));
    assertThrows(TraceFormatException.class, () -> EventType.fromWire(null));
  }
}
