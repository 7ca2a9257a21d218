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
 * {@code show}: prints a trace as a flat listing or, with {@code --tree}, as a span hierarchy.
 *
 * @since 0.1.0
 */
public final class ShowCli {
  private static final Logger log = LoggerFactory.getLogger(ShowCli.class);
  private static final String SUMMARY_USAGE =
      "usage: show trace=PATH|PATH [--tree] [previewChars=N] [config=PATH] [--verbose]";
  private static final String HELP_TEXT = """
      agent-replay show

      Usage:
        show run.jsonl [options]

      Required:
        trace=PATH          Trace file (NDJSON); may be given positionally

      Optional:
        --tree              Render the span hierarchy instead of the event listing
        previewChars=N      Characters of payload text per event (default 80)
        config=PATH         YAML file with common/show sections
        metricsExporter=otlp|none  Metrics exporter (default none)
        --verbose           Enable DEBUG logging
        --help              Show this message
      """;

  private ShowCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  /**
   * Runs the command without terminating the JVM.
   *
   * @param args arguments after the command name
   * @return exit code
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for show");
    }

    CommandSupport.Resolution resolution =
        CommandSupport.resolve("show", input, SUMMARY_USAGE, log, Map.of("--tree", "tree"), "trace");
    if (!resolution.ok()) {
      return resolution.failure();
    }

    ViewConfig config;
    try {
      config = ViewConfig.fromMap(resolution.settings());
      Paths.requireReadableFile(config.trace());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid show arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try (OpenTelemetryMetricsAdapter metrics = OpenTelemetryMetricsAdapter.fromEnvironment()) {
      CompositionRoot root = new CompositionRoot(metrics);
      Trace trace = root.traceStore().load(config.trace());
      TraceTextRenderer renderer = new TraceTextRenderer(config.previewChars());
      CliPrinter.printLines(config.tree() ? renderer.renderTree(trace) : renderer.renderTrace(trace));
      return ExitCode.SUCCESS;
    } catch (TraceFormatException ex) {
      log.error("Malformed trace {}: {}", config.trace(), ex.getMessage());
      return ExitCode.INVALID_ARGS;
    } catch (NotFoundException ex) {
      log.error("Trace not found: {}", ex.getMessage());
      return ExitCode.INVALID_ARGS;
    } catch (IllegalArgumentException ex) {
      log.error("Show configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read trace {}", config.trace(), ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected failure rendering trace {}", config.trace(), ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
