package ca.gc.cra.agentreplay.application.diff;

import ca.gc.cra.agentreplay.domain.trace.EventType;
import ca.gc.cra.agentreplay.domain.trace.TraceEvent;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Payload field compared when two aligned events share a kind.
 *
 * <p>One constant per compared event kind. Kinds without a constant are never compared beyond their type.
 * Missing fields read as {@code null}, except LLM response content which reads as the empty string.</p>
 *
 * @since 0.1.0
 */
enum PayloadComparison {
  TOOL(EventType.TOOL_CALL, "tool", null, Severity.CRITICAL) {
    @Override
    String describe(Object a, Object b) {
      return "Different tool called: " + a + " vs " + b;
    }
  },
  CONTENT(EventType.LLM_RESPONSE, "content", "", Severity.INFO) {
    @Override
    String describe(Object a, Object b) {
      return "LLM response content differs";
    }
  },
  CHOICE(EventType.DECISION, "choice", null, Severity.CRITICAL) {
    @Override
    String describe(Object a, Object b) {
      return "Decision divergence: '" + a + "' vs '" + b + "'";
    }
  };

  private final EventType eventType;
  private final String field;
  private final Object missingValue;
  private final Severity severity;

  PayloadComparison(EventType eventType, String field, Object missingValue, Severity severity) {
    this.eventType = eventType;
    this.field = field;
    this.missingValue = missingValue;
    this.severity = severity;
  }

  abstract String describe(Object a, Object b);

  Severity severity() {
    return severity;
  }

  /**
   * Finds the comparison registered for an event kind.
   *
   * @param type event kind shared by both sides
   * @return comparison, or empty when payloads of this kind are not compared
   */
  static Optional<PayloadComparison> forType(EventType type) {
    for (PayloadComparison comparison : values()) {
      if (comparison.eventType == type) {
        return Optional.of(comparison);
      }
    }
    return Optional.empty();
  }

  /**
   * Compares the field on both events.
   *
   * @return description of the difference, or empty when the values are equal
   */
  Optional<String> compare(TraceEvent a, TraceEvent b) {
    Object left = valueOf(a);
    Object right = valueOf(b);
    if (sameValue(left, right)) {
      return Optional.empty();
    }
    return Optional.of(describe(left, right));
  }

  private Object valueOf(TraceEvent event) {
    return event.data().containsKey(field) ? event.data().get(field) : missingValue;
  }

  // JSON numbers decode as Integer, Long, Double, or BigDecimal depending on their text; 1 and 1.0 are equal
  // at any depth.
  static boolean sameValue(Object a, Object b) {
    if (a instanceof Number x && b instanceof Number y && isFinite(x) && isFinite(y)) {
      return toDecimal(x).compareTo(toDecimal(y)) == 0;
    }
    if (a instanceof Map<?, ?> left && b instanceof Map<?, ?> right) {
      if (!left.keySet().equals(right.keySet())) {
        return false;
      }
      for (Map.Entry<?, ?> entry : left.entrySet()) {
        if (!sameValue(entry.getValue(), right.get(entry.getKey()))) {
          return false;
        }
      }
      return true;
    }
    if (a instanceof List<?> left && b instanceof List<?> right) {
      if (left.size() != right.size()) {
        return false;
      }
      for (int i = 0; i < left.size(); i++) {
        if (!sameValue(left.get(i), right.get(i))) {
          return false;
        }
      }
      return true;
    }
    return Objects.equals(a, b);
  }

  private static boolean isFinite(Number number) {
    return !(number instanceof Double || number instanceof Float) || Double.isFinite(number.doubleValue());
  }

  private static BigDecimal toDecimal(Number number) {
    if (number instanceof BigDecimal decimal) {
      return decimal;
    }
    if (number instanceof Double || number instanceof Float) {
      return BigDecimal.valueOf(number.doubleValue());
    }
    return new BigDecimal(number.toString());
  }
}
