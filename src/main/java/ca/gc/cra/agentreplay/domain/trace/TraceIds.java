package ca.gc.cra.agentreplay.domain.trace;

import java.util.UUID;

/**
 * Generates the opaque hex identifiers carried by traces, spans, and events.
 *
 * @since 0.1.0
 */
public final class TraceIds {
  static final int TRACE_ID_LENGTH = 16;
  static final int SPAN_ID_LENGTH = 12;
  static final int EVENT_ID_LENGTH = 12;

  private TraceIds() {}

  /**
   * Returns a new 16 character trace id.
   *
   * @return lowercase hex id
   */
  public static String newTraceId() {
    return randomHex(TRACE_ID_LENGTH);
  }

  /**
   * Returns a new 12 character span id.
   *
   * @return lowercase hex id
   */
  public static String newSpanId() {
    return randomHex(SPAN_ID_LENGTH);
  }

  /**
   * Returns a new 12 character event id.
   *
   * @return lowercase hex id
   */
  public static String newEventId() {
    return randomHex(EVENT_ID_LENGTH);
  }

  private static String randomHex(int length) {
    // UUID v4 hex without dashes; only the version nibble at index 12 is fixed.
    String hex = UUID.randomUUID().toString().replace("-", "");
    return hex.substring(0, length);
  }
}
