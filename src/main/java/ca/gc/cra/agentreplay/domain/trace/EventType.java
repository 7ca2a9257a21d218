package ca.gc.cra.agentreplay.domain.trace;

import java.util.Locale;

/**
 * <strong>What:</strong> Closed set of occurrence kinds an agent trace can record.
 * <p><strong>Why:</strong> The lowercase wire spellings are part of the persisted trace contract and must
 * stay byte-stable across releases.</p>
 * <p><strong>Role:</strong> Domain enumeration shared by the recorder, replay, diff, and persistence layers.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and globally shareable.</p>
 *
 * @since 0.1.0
 */
public enum EventType {
  /** Prompt or request sent to a language model. */
  LLM_REQUEST("llm_request"),
  /** Completion returned by a language model. */
  LLM_RESPONSE("llm_response"),
  /** Tool invocation issued by the agent. */
  TOOL_CALL("tool_call"),
  /** Result returned by a tool. */
  TOOL_RESULT("tool_result"),
  /** Branching decision taken by the agent. */
  DECISION("decision"),
  /** Mutation of agent state. */
  STATE_CHANGE("state_change"),
  /** Error raised during the run. */
  ERROR("error"),
  /** Free-form log line. */
  LOG("log");

  private final String wireValue;

  EventType(String wireValue) {
    this.wireValue = wireValue;
  }

  /**
   * Returns the persisted spelling of this kind.
   *
   * @return lowercase, underscore separated wire value (e.g., {@code tool_call})
   */
  public String wireValue() {
    return wireValue;
  }

  /**
   * Returns a display label such as {@code TOOL CALL}.
   *
   * @return uppercase label with spaces in place of underscores
   */
  public String label() {
    return wireValue.replace('_', ' ').toUpperCase(Locale.ROOT);
  }

  /**
   * Resolves a wire value back to its kind.
   *
   * @param value persisted spelling; must match exactly
   * @return matching kind
   * @throws TraceFormatException if {@code value} is {@code null} or not a known kind
   */
  public static EventType fromWire(String value) {
    if (value != null) {
      for (EventType type : values()) {
        if (type.wireValue.equals(value)) {
          return type;
        }
      }
    }
    throw new TraceFormatException("unknown event_type: " + value);
  }

  @Override
  public String toString() {
    return wireValue;
  }
}
