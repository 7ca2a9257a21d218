package ca.gc.cra.agentreplay.application.port;

import java.util.Locale;

/**
 * Output formats supported by {@link TraceExporter} implementations.
 *
 * @since 0.1.0
 */
public enum ExportFormat {
  JSON("json"),
  HTML("html");

  private final String extension;

  ExportFormat(String extension) {
    this.extension = extension;
  }

  /**
   * Returns the file extension written by this format, without the leading dot.
   *
   * @return lowercase extension
   */
  public String extension() {
    return extension;
  }

  /**
   * Parses a user supplied format name.
   *
   * @param value case-insensitive format name
   * @return matching format
   * @throws IllegalArgumentException when {@code value} is blank or unsupported
   */
  public static ExportFormat fromString(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("format must not be blank");
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (ExportFormat format : values()) {
      if (format.extension.equals(normalized)) {
        return format;
      }
    }
    throw new IllegalArgumentException("format must be json or html (was " + value + ")");
  }
}
