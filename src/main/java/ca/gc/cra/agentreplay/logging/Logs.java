package ca.gc.cra.agentreplay.logging;

/**
 * Helpers that keep recorded payloads short when they are printed or logged.
 *
 * <p>Agent payloads routinely hold whole prompts and completions; previews cut them to a character budget and
 * fold line breaks so one event stays on one line.</p>
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final String ELLIPSIS = "...";

  private Logs() {
    // Utility
  }

  /**
   * Shortens a string to at most {@code maxChars} characters, ending with {@code ...} when cut.
   *
   * @param value text to shorten; {@code null} yields {@code "<null>"}
   * @param maxChars maximum length of the result; must be positive
   * @return original value when short enough, otherwise a prefix followed by {@code ...}
   * @throws IllegalArgumentException if {@code maxChars} is not positive
   */
  public static String truncate(String value, int maxChars) {
    if (maxChars <= 0) {
      throw new IllegalArgumentException("maxChars must be positive");
    }
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (value.length() <= maxChars) {
      return value;
    }
    if (maxChars <= ELLIPSIS.length()) {
      return value.substring(0, maxChars);
    }
    int cut = maxChars - ELLIPSIS.length();
    if (Character.isHighSurrogate(value.charAt(cut - 1))) {
      cut--;
    }
    return value.substring(0, cut) + ELLIPSIS;
  }

  /**
   * Produces a single-line preview: line breaks and tabs become spaces, then the result is truncated.
   *
   * @param value text to preview; {@code null} yields {@code "<null>"}
   * @param maxChars maximum length of the result; must be positive
   * @return single-line preview
   */
  public static String preview(String value, int maxChars) {
    if (value == null) {
      return truncate(null, maxChars);
    }
    return truncate(value.replace("\r\n", " ").replace('\n', ' ').replace('\r', ' ').replace('\t', ' '), maxChars);
  }
}
