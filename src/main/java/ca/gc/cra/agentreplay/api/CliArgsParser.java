package ca.gc.cra.agentreplay.api;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} tokens into an ordered settings map.
 * <p>Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");

  private CliArgsParser() {}

  /**
   * Splits each token on its first {@code '='}.
   *
   * @param args {@code key=value} tokens; {@code null} returns an empty map
   * @return mutable map in token order
   * @throws IllegalArgumentException when a token has no key or no value, a key is malformed or repeated, or a value
   *         holds control characters
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> settings = new LinkedHashMap<>();
    if (args == null) {
      return settings;
    }
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String token = raw.trim();
      int split = token.indexOf('=');
      if (split <= 0 || split == token.length() - 1) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      String key = token.substring(0, split).trim();
      String value = token.substring(split + 1).trim();
      if (!KEY_PATTERN.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid argument name: " + key);
      }
      if (value.isEmpty()) {
        throw new IllegalArgumentException("argument " + key + " must have a value");
      }
      if (hasControlCharacter(value)) {
        throw new IllegalArgumentException("argument " + key + " must not contain control characters");
      }
      if (settings.putIfAbsent(key, value) != null) {
        throw new IllegalArgumentException("argument " + key + " given more than once");
      }
    }
    return settings;
  }

  private static boolean hasControlCharacter(String value) {
    return value.chars().anyMatch(Character::isISOControl);
  }
}
