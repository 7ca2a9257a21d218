package ca.gc.cra.agentreplay.config;

import ca.gc.cra.agentreplay.validation.Paths;
import ca.gc.cra.agentreplay.validation.Strings;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Settings for the {@code diff} command.
 *
 * @param traceA reference trace file
 * @param traceB trace file compared against the reference
 * @param output report format
 * @param failOnCritical whether critical divergences turn into a non-zero exit code
 *
 * @since 0.1.0
 */
public record DiffConfig(Path traceA, Path traceB, OutputMode output, boolean failOnCritical) {

  /** Report formats of the {@code diff} command. */
  public enum OutputMode {
    TEXT,
    JSON
  }

  /** Validates required components. */
  public DiffConfig {
    traceA = Objects.requireNonNull(traceA, "traceA");
    traceB = Objects.requireNonNull(traceB, "traceB");
    output = Objects.requireNonNull(output, "output");
  }

  /**
   * Builds a diff configuration from merged key/value settings.
   *
   * @param args settings; {@code a} and {@code b} are required
   * @return configuration
   * @throws IllegalArgumentException if a trace path is missing or the output format is unknown
   */
  public static DiffConfig fromMap(Map<String, String> args) {
    Objects.requireNonNull(args, "args");
    Path a = requiredPath(args, "a");
    Path b = requiredPath(args, "b");
    String output = Strings.requireOneOf("output", args.get("output"), "text", "text", "json");
    boolean failOnCritical = Boolean.parseBoolean(args.getOrDefault("failOnCritical", "false").trim());
    return new DiffConfig(a, b, OutputMode.valueOf(output.toUpperCase(Locale.ROOT)), failOnCritical);
  }

  private static Path requiredPath(Map<String, String> args, String key) {
    String raw = args.get(key);
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException(key + " is required (" + key + "=PATH)");
    }
    return Paths.parse(key, raw);
  }
}
