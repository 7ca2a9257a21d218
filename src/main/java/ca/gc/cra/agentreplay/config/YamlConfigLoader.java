package ca.gc.cra.agentreplay.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads agent-replay settings from a YAML document with one section per command.
 *
 * <pre>{@code
 * common:
 *   metricsExporter: none
 *   previewChars: 80
 * show:
 *   tree: true
 * export:
 *   format: html
 * }</pre>
 *
 * <p>Top-level sections are {@code common} and the names in {@link DefaultsForMode#COMMANDS}, matched
 * case-insensitively; any other section is rejected. A command section may only set keys that command has
 * defaults for. {@code common} may set any key some command knows; keys the active command does not use are
 * skipped, so {@code previewChars} in {@code common} reaches {@code show} and {@code replay} only. Values must
 * be scalars.</p>
 */
public final class YamlConfigLoader {
  static final String COMMON_SECTION = "common";

  private YamlConfigLoader() {}

  /**
   * Loads the settings that apply to {@code command}; the command's own section wins over {@code common}.
   *
   * @param path location of the YAML file
   * @param command command name, one of {@link DefaultsForMode#COMMANDS}
   * @return settings keyed like the CLI, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML is malformed, names an unknown section or key, or holds a
   *     non-scalar value
   */
  public static Optional<Map<String, String>> load(Path path, String command) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!DefaultsForMode.isCommand(command)) {
      throw new IllegalArgumentException("Unsupported command: " + command);
    }
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml().load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }
    Map<String, Map<?, ?>> sections = sections(document);
    String active = command.trim().toLowerCase(Locale.ROOT);
    Set<String> activeKeys = DefaultsForMode.asFlatMap(active).keySet();

    Map<String, String> settings = new LinkedHashMap<>();
    Map<?, ?> common = sections.get(COMMON_SECTION);
    if (common != null) {
      for (Map.Entry<String, String> entry : scalars(COMMON_SECTION, common).entrySet()) {
        if (!isKnownAnywhere(entry.getKey())) {
          throw unknownKey(COMMON_SECTION, entry.getKey());
        }
        if (activeKeys.contains(entry.getKey())) {
          settings.put(entry.getKey(), entry.getValue());
        }
      }
    }
    for (String name : DefaultsForMode.COMMANDS) {
      Map<?, ?> section = sections.get(name);
      if (section == null) {
        continue;
      }
      Set<String> allowed = DefaultsForMode.asFlatMap(name).keySet();
      Map<String, String> values = scalars(name, section);
      for (String key : values.keySet()) {
        if (!allowed.contains(key)) {
          throw unknownKey(name, key);
        }
      }
      if (name.equals(active)) {
        settings.putAll(values);
      }
    }
    return Optional.of(Map.copyOf(settings));
  }

  private static Map<String, Map<?, ?>> sections(Object document) {
    if (!(document instanceof Map<?, ?> root)) {
      throw new IllegalArgumentException("YAML config must be a mapping of command sections");
    }
    Map<String, Map<?, ?>> sections = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : root.entrySet()) {
      String name = String.valueOf(entry.getKey()).trim().toLowerCase(Locale.ROOT);
      if (!COMMON_SECTION.equals(name) && !DefaultsForMode.isCommand(name)) {
        throw new IllegalArgumentException("Unknown config section '" + entry.getKey() + "'; expected "
            + COMMON_SECTION + " or one of " + DefaultsForMode.COMMANDS);
      }
      if (entry.getValue() == null) {
        continue;
      }
      if (!(entry.getValue() instanceof Map<?, ?> body)) {
        throw new IllegalArgumentException("Config section '" + name + "' must be a mapping");
      }
      if (sections.putIfAbsent(name, body) != null) {
        throw new IllegalArgumentException("Config section '" + name + "' appears more than once");
      }
    }
    return sections;
  }

  private static Map<String, String> scalars(String section, Map<?, ?> body) {
    Map<String, String> values = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : body.entrySet()) {
      if (!(entry.getKey() instanceof String key) || key.isBlank()) {
        throw new IllegalArgumentException("Config section '" + section + "' has a blank or non-string key");
      }
      Object value = entry.getValue();
      if (value instanceof Map<?, ?> || value instanceof Iterable<?>) {
        throw new IllegalArgumentException(
            "Config key '" + section + "." + key + "' must be a scalar value");
      }
      values.put(key, value == null ? "" : value.toString());
    }
    return values;
  }

  private static boolean isKnownAnywhere(String key) {
    if (DefaultsForMode.commonKeys().contains(key)) {
      return true;
    }
    for (String command : DefaultsForMode.COMMANDS) {
      if (DefaultsForMode.asFlatMap(command).containsKey(key)) {
        return true;
      }
    }
    return false;
  }

  private static IllegalArgumentException unknownKey(String section, String key) {
    return new IllegalArgumentException("Unknown setting '" + key + "' in config section '" + section + "'");
  }
}
