package ca.gc.cra.agentreplay.api;

import ca.gc.cra.agentreplay.config.ConfigMerger;
import ca.gc.cra.agentreplay.config.DefaultsForMode;
import ca.gc.cra.agentreplay.config.YamlConfigLoader;
import ca.gc.cra.agentreplay.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Shared settings pipeline for the trace commands: {@code key=value} arguments, positional tokens, and flags are
 * merged over the YAML file named by {@code config=PATH} and the command defaults, then telemetry keys are applied.
 */
final class CommandSupport {
  private CommandSupport() {
    // Utility class
  }

  /**
   * Resolves the effective settings of one command.
   *
   * @param command command name; selects the YAML section and defaults
   * @param input parsed arguments after the command token
   * @param usage one-line usage printed on argument errors
   * @param log logger of the calling command
   * @param flagKeys flags mapped to the boolean setting they enable
   * @param positionalKeys setting keys that accept positional tokens, in order
   * @return resolved settings, or the exit code to return
   */
  static Resolution resolve(
      String command,
      CliInput input,
      String usage,
      Logger log,
      Map<String, String> flagKeys,
      String... positionalKeys) {
    Map<String, String> cli;
    try {
      cli = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      ConfigCliUtils.bindPositionals(input.positionals(), cli, positionalKeys);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(usage);
      return Resolution.failed(ExitCode.INVALID_ARGS);
    }
    ConfigCliUtils.applyFlags(input, cli, flagKeys);

    String configPath = ConfigCliUtils.extractConfigPath(cli);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(usage);
        return Resolution.failed(ExitCode.INVALID_ARGS);
      }
      try {
        yaml = YamlConfigLoader.load(yamlPath, command);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        CliPrinter.println(usage);
        return Resolution.failed(ExitCode.INVALID_ARGS);
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return Resolution.failed(ExitCode.IO_ERROR);
      }
    }

    Map<String, String> settings;
    try {
      Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
          command, yaml, cli, DefaultsForMode.asFlatMap(command), log::warn);
      if (ConfigCliUtils.parseBoolean(effective, "verbose")) {
        LoggingConfigurator.enableVerboseLogging();
      }
      settings = new LinkedHashMap<>(effective);
      settings.remove("verbose");
      TelemetryConfigurator.configureMetrics(settings);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} arguments: {}", command, ex.getMessage());
      CliPrinter.println(usage);
      return Resolution.failed(ExitCode.INVALID_ARGS);
    }
    return Resolution.of(settings);
  }

  /**
   * Outcome of {@link #resolve}: either settings to run with or the exit code to stop with.
   *
   * @param settings effective settings; empty when resolution failed
   * @param failure exit code when resolution failed, otherwise {@code null}
   */
  record Resolution(Map<String, String> settings, ExitCode failure) {
    Resolution {
      settings = Map.copyOf(Objects.requireNonNull(settings, "settings"));
    }

    static Resolution of(Map<String, String> settings) {
      return new Resolution(settings, null);
    }

    static Resolution failed(ExitCode failure) {
      return new Resolution(Map.of(), Objects.requireNonNull(failure, "failure"));
    }

    boolean ok() {
      return failure == null;
    }
  }
}
