package ca.gc.cra.agentreplay.api;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Helpers that fold flags and positional tokens into the {@code key=value} settings map before YAML merging.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Removes and returns the YAML configuration path.
   *
   * @param args mutable settings map
   * @return trimmed {@code config} value, or {@code null} when absent
   */
  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove("config");
    return value == null || value.isBlank() ? null : value.trim();
  }

  /**
   * Assigns positional tokens to setting keys in order, so {@code diff a.jsonl b.jsonl} equals
   * {@code diff a=a.jsonl b=b.jsonl}.
   *
   * @param positionals bare tokens after the command name
   * @param args mutable settings map
   * @param keys setting keys accepting positional values, in order
   * @throws IllegalArgumentException when there are more tokens than keys or a key is also given as {@code key=value}
   */
  static void bindPositionals(List<String> positionals, Map<String, String> args, String... keys) {
    if (positionals.size() > keys.length) {
      throw new IllegalArgumentException(
          "unexpected argument: " + positionals.get(keys.length));
    }
    for (int i = 0; i < positionals.size(); i++) {
      if (args.putIfAbsent(keys[i], positionals.get(i)) != null) {
        throw new IllegalArgumentException(keys[i] + " given both positionally and as " + keys[i] + "=VALUE");
      }
    }
  }

  /**
   * Records each supplied flag as {@code key=true}.
   *
   * @param input parsed arguments
   * @param args mutable settings map
   * @param flagKeys flag (e.g. {@code --tree}) to setting key (e.g. {@code tree})
   */
  static void applyFlags(CliInput input, Map<String, String> args, Map<String, String> flagKeys) {
    flagKeys.forEach((flag, key) -> {
      if (input.hasFlag(flag)) {
        args.put(key, "true");
      }
    });
  }

  /**
   * Reads a boolean setting strictly.
   *
   * @param map settings
   * @param key setting key
   * @return parsed value; {@code false} when absent or blank
   * @throws IllegalArgumentException when the value is neither {@code true} nor {@code false}
   */
  static boolean parseBoolean(Map<String, String> map, String key) {
    String value = map == null ? null : map.get(key);
    if (value == null || value.isBlank()) {
      return false;
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "true" -> true;
      case "false" -> false;
      default -> throw new IllegalArgumentException(key + " must be true or false (was '" + value + "')");
    };
  }
}
