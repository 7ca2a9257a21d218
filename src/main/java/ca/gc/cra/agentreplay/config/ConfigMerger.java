package ca.gc.cra.agentreplay.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges settings from defaults, YAML, and the command line with precedence CLI &gt; YAML &gt; defaults.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds the effective settings for one command.
   *
   * @param command active CLI command
   * @param yaml optional YAML-derived settings for the command
   * @param cli command-line overrides (may be empty)
   * @param defaults embedded defaults for the command
   * @param warn receives a message whenever a CLI key overrides a YAML key; may be {@code null}
   * @return immutable merged map
   * @throws IllegalArgumentException when cross-field validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String command,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(command, "command");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null || entry.getValue() == null) {
        continue;
      }
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      merged.put(key, entry.getValue());
    }

    validate(command, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String command, Map<String, String> effective) {
    if ("export".equalsIgnoreCase(command)) {
      String out = trim(effective.get("out"));
      String trace = trim(effective.get("trace"));
      if (!out.isEmpty() && out.equals(trace)) {
        throw new IllegalArgumentException("out must differ from trace; export would overwrite the source");
      }
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
