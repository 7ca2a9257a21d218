package ca.gc.cra.agentreplay.validation;

import java.util.Locale;
import java.util.Objects;

/**
 * <strong>What:</strong> Validation utilities for strings supplied on the command line or in YAML config.
 * <p><strong>Why:</strong> Rejects blank and control-character inputs before they reach file paths or trace
 * lookups.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent access.</p>
 *
 * @since 0.1.0
 * @see Numbers
 * @see Paths
 */
public final class Strings {
  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and free of control characters.
   *
   * @param name logical parameter name for diagnostics; {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Returns a choice from a closed set, compared case-insensitively.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate; {@code null} or blank yields {@code defaultValue}
   * @param defaultValue value used when {@code value} is absent
   * @param allowed permitted lowercase spellings
   * @return lowercase choice
   * @throws IllegalArgumentException if {@code value} is not one of {@code allowed}
   */
  public static String requireOneOf(String name, String value, String defaultValue, String... allowed) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (String candidate : allowed) {
      if (candidate.equals(normalized)) {
        return candidate;
      }
    }
    throw new IllegalArgumentException(
        message(name, "must be one of " + String.join("|", allowed) + " (was " + value + ")"));
  }

  /**
   * Ensures a value holds only printable ASCII characters and fits a length budget.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate string; must not be {@code null}
   * @param maxLength maximum permitted length in characters
   * @return trimmed value
   * @throws IllegalArgumentException if the value is blank, too long, or holds characters outside {@code 0x20-0x7E}
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "length must be <= " + maxLength));
    }
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII characters"));
      }
    }
    return sanitized;
  }

  static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
