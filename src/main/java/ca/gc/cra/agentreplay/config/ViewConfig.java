package ca.gc.cra.agentreplay.config;

import ca.gc.cra.agentreplay.validation.Numbers;
import ca.gc.cra.agentreplay.validation.Paths;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Settings shared by the read-only commands ({@code show}, {@code replay}, {@code info}).
 *
 * @param trace trace file to open
 * @param tree whether {@code show} renders the span hierarchy instead of the flat listing
 * @param previewChars maximum characters of payload text printed per event
 *
 * @since 0.1.0
 */
public record ViewConfig(Path trace, boolean tree, int previewChars) {
  /** Payload preview budget of the {@code show} listing. */
  public static final int DEFAULT_PREVIEW_CHARS = 80;
  /** Payload preview budget of a single replay step. */
  public static final int DEFAULT_STEP_PREVIEW_CHARS = 500;
  private static final int MAX_PREVIEW_CHARS = 100_000;

  /** Validates the preview budget. */
  public ViewConfig {
    trace = Objects.requireNonNull(trace, "trace");
    Numbers.requireRange("previewChars", previewChars, 8, MAX_PREVIEW_CHARS);
  }

  /**
   * Builds a view configuration from merged key/value settings.
   *
   * @param args settings; {@code trace} is required
   * @return configuration
   * @throws IllegalArgumentException if {@code trace} is missing or a value is invalid
   */
  public static ViewConfig fromMap(Map<String, String> args) {
    Objects.requireNonNull(args, "args");
    String rawTrace = args.get("trace");
    if (rawTrace == null || rawTrace.isBlank()) {
      throw new IllegalArgumentException("trace is required (trace=PATH)");
    }
    Path trace = Paths.parse("trace", rawTrace);
    boolean tree = Boolean.parseBoolean(args.getOrDefault("tree", "false").trim());
    int previewChars = Numbers.parseIntInRange(
        "previewChars", args.get("previewChars"), DEFAULT_PREVIEW_CHARS, 8, MAX_PREVIEW_CHARS);
    return new ViewConfig(trace, tree, previewChars);
  }
}
