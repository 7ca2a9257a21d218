package ca.gc.cra.agentreplay.api;

import ca.gc.cra.agentreplay.config.CompositionRoot;
import ca.gc.cra.agentreplay.config.ViewConfig;
import ca.gc.cra.agentreplay.domain.trace.NotFoundException;
import ca.gc.cra.agentreplay.domain.trace.Trace;
import ca.gc.cra.agentreplay.domain.trace.TraceFormatException;
import ca.gc.cra.agentreplay.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.agentreplay.logging.LoggingConfigurator;
import ca.gc.cra.agentreplay.validation.Paths;
import java.io.IOException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code info}: prints name, id, span and event counts, duration, and metadata of a trace.
 *
 * @since 0.1.0
 */
public final class InfoCli {
  private static final Logger log = LoggerFactory.getLogger(InfoCli.class);
  private static final String SUMMARY_USAGE = "usage: info trace=PATH|PATH [config=PATH] [--verbose]";
  private static final String HELP_TEXT = """
      agent-replay info

      Usage:
        info run.jsonl

      Required:
        trace=PATH          Trace file (NDJSON); may be given positionally

      Optional:
        config=PATH         YAML file with common/info sections
        --verbose           Enable DEBUG logging
        --help              Show this message
      """;

  private InfoCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    CommandSupport.Resolution resolution =
        CommandSupport.resolve("info", input, SUMMARY_USAGE, log, Map.of(), "trace");
    if (!resolution.ok()) {
      return resolution.failure();
    }

    ViewConfig config;
    try {
      config = ViewConfig.fromMap(resolution.settings());
      Paths.requireReadableFile(config.trace());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid info arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try (OpenTelemetryMetricsAdapter metrics = OpenTelemetryMetricsAdapter.fromEnvironment()) {
      Trace trace = new CompositionRoot(metrics).traceStore().load(config.trace());
      CliPrinter.printLines(new TraceTextRenderer(config.previewChars()).renderInfo(trace));
      return ExitCode.SUCCESS;
    } catch (TraceFormatException ex) {
      log.error("Malformed trace {}: {}", config.trace(), ex.getMessage());
      return ExitCode.INVALID_ARGS;
    } catch (NotFoundException ex) {
      log.error("Trace not found: {}", ex.getMessage());
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read trace {}", config.trace(), ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected failure summarizing trace {}", config.trace(), ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
