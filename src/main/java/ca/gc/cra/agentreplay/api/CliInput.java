package ca.gc.cra.agentreplay.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Command-line arguments split into flags, {@code key=value} settings, and bare positional tokens.
 *
 * <p>A token is a flag when it starts with {@code -} and has no {@code =}; a setting when it contains {@code =};
 * anything else is positional (the command name, or a trace path given without {@code trace=}).</p>
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");
  private static final CliInput EMPTY = new CliInput(List.of(), List.of(), Set.of());

  private final List<String> positionals;
  private final List<String> keyValueArgs;
  private final Set<String> flags;

  private CliInput(List<String> positionals, List<String> keyValueArgs, Set<String> flags) {
    this.positionals = positionals;
    this.keyValueArgs = keyValueArgs;
    this.flags = flags;
  }

  /**
   * Classifies raw arguments.
   *
   * @param args raw CLI arguments (may be {@code null}); blank tokens are ignored
   * @return parsed arguments
   */
  public static CliInput parse(String[] args) {
    if (args == null || args.length == 0) {
      return EMPTY;
    }
    List<String> positionals = new ArrayList<>();
    List<String> keyValues = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    for (String raw : args) {
      String arg = raw == null ? "" : raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      String lower = arg.toLowerCase(Locale.ROOT);
      if (HELP_FLAGS.contains(lower)) {
        flags.add("--help");
      } else if (VERBOSE_FLAGS.contains(lower)) {
        flags.add("--verbose");
      } else if (isFlag(arg)) {
        flags.add(lower);
      } else if (arg.indexOf('=') >= 0) {
        keyValues.add(arg);
      } else {
        positionals.add(arg);
      }
    }
    return new CliInput(List.copyOf(positionals), List.copyOf(keyValues), Set.copyOf(flags));
  }

  /**
   * Reports whether a raw token is a flag such as {@code --tree}.
   *
   * @param arg raw token
   * @return {@code true} for a dash-prefixed token without {@code =}
   */
  static boolean isFlag(String arg) {
    return arg != null && arg.startsWith("-") && arg.indexOf('=') < 0;
  }

  /**
   * Returns the bare tokens in command-line order.
   *
   * @return immutable list
   */
  public List<String> positionals() {
    return positionals;
  }

  /**
   * Returns a copy of the {@code key=value} tokens.
   *
   * @return tokens in command-line order
   */
  public String[] keyValueArgs() {
    return keyValueArgs.toArray(String[]::new);
  }

  public boolean help() {
    return flags.contains("--help");
  }

  public boolean verbose() {
    return flags.contains("--verbose");
  }

  /**
   * Checks whether a flag such as {@code --fail-on-critical} was supplied.
   *
   * @param flag flag to query (case-insensitive)
   * @return {@code true} if the flag was supplied
   */
  public boolean hasFlag(String flag) {
    if (flag == null || flag.isBlank()) {
      return false;
    }
    return flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  /**
   * Returns the normalized (lowercase) flags.
   *
   * @return immutable set
   */
  public Set<String> flags() {
    return flags;
  }

  @Override
  public String toString() {
    return "CliInput[positionals=" + positionals + ", settings=" + Arrays.toString(keyValueArgs())
        + ", flags=" + flags + "]";
  }
}
