package ca.gc.cra.agentreplay.config;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Supplies flattened default settings for each CLI command.
 *
 * <p>The defaults are the single source of truth for optional YAML keys and omitted CLI arguments.</p>
 */
public final class DefaultsForMode {
  /** Commands that own a defaults block, in usage order. */
  public static final List<String> COMMANDS = List.of("show", "replay", "info", "diff", "export");

  private static final Map<String, String> COMMON_DEFAULTS = Map.of(
      "metricsExporter", "none",
      "otelEndpoint", "",
      "otelResourceAttributes", "",
      "verbose", "false");

  private DefaultsForMode() {}

  public static boolean isCommand(String name) {
    return name != null && COMMANDS.contains(name.trim().toLowerCase(Locale.ROOT));
  }

  /**
   * Returns the keys shared by every command.
   *
   * @return unmodifiable key set
   */
  public static Set<String> commonKeys() {
    return COMMON_DEFAULTS.keySet();
  }

  /**
   * Returns defaults for {@code command} merged over the common defaults.
   *
   * @param command CLI command name
   * @return unmodifiable map of default key/value pairs
   * @throws IllegalArgumentException for an unknown command
   */
  public static Map<String, String> asFlatMap(String command) {
    Objects.requireNonNull(command, "command");
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (command.trim().toLowerCase(Locale.ROOT)) {
      case "show" -> Map.of(
          "trace", "",
          "tree", "false",
          "previewChars", Integer.toString(ViewConfig.DEFAULT_PREVIEW_CHARS));
      case "replay" -> Map.of(
          "trace", "",
          "previewChars", Integer.toString(ViewConfig.DEFAULT_STEP_PREVIEW_CHARS));
      case "info" -> Map.of("trace", "");
      case "diff" -> Map.of(
          "a", "",
          "b", "",
          "output", DiffConfig.OutputMode.TEXT.name().toLowerCase(Locale.ROOT),
          "failOnCritical", "false");
      case "export" -> Map.of(
          "trace", "",
          "format", "json",
          "out", "",
          "allowOverwrite", "false");
      default -> throw new IllegalArgumentException("Unsupported command: " + command);
    });
    return Map.copyOf(defaults);
  }
}
