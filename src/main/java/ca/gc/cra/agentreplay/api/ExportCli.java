package ca.gc.cra.agentreplay.api;

import ca.gc.cra.agentreplay.config.CompositionRoot;
import ca.gc.cra.agentreplay.config.ExportConfig;
import ca.gc.cra.agentreplay.domain.trace.NotFoundException;
import ca.gc.cra.agentreplay.domain.trace.Trace;
import ca.gc.cra.agentreplay.domain.trace.TraceFormatException;
import ca.gc.cra.agentreplay.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.agentreplay.logging.LoggingConfigurator;
import ca.gc.cra.agentreplay.validation.Paths;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code export}: writes a trace as one pretty-printed JSON document or a self-contained HTML timeline.
 *
 * @since 0.1.0
 */
public final class ExportCli {
  private static final Logger log = LoggerFactory.getLogger(ExportCli.class);
  private static final String SUMMARY_USAGE =
      "usage: export trace=PATH|PATH [format=json|html] [out=PATH] [--allow-overwrite] [config=PATH] [--verbose]";
  private static final String HELP_TEXT = """
      agent-replay export

      Usage:
        export run.jsonl format=html [options]

      Required:
        trace=PATH          Trace file (NDJSON); may be given positionally

      Optional:
        format=json|html    Output format (default json)
        out=PATH            Destination file (default: trace path with the format's extension)
        --allow-overwrite   Replace an existing destination file
        config=PATH         YAML file with common/export sections
        --verbose           Enable DEBUG logging
        --help              Show this message
      """;

  private ExportCli() {}

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
      log.debug("Verbose logging enabled for export");
    }

    CommandSupport.Resolution resolution = CommandSupport.resolve(
        "export", input, SUMMARY_USAGE, log, Map.of("--allow-overwrite", "allowOverwrite"), "trace");
    if (!resolution.ok()) {
      return resolution.failure();
    }

    ExportConfig config;
    Path out;
    try {
      config = ExportConfig.fromMap(resolution.settings());
      Paths.requireReadableFile(config.trace());
      out = Paths.validateWritableFile(config.outputPath(), config.allowOverwrite());
      if (out.equals(config.trace())) {
        throw new IllegalArgumentException("out must differ from trace; export would overwrite the source");
      }
    } catch (IllegalArgumentException ex) {
      log.error("Invalid export arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try (OpenTelemetryMetricsAdapter metrics = OpenTelemetryMetricsAdapter.fromEnvironment()) {
      CompositionRoot root = new CompositionRoot(metrics);
      Trace trace = root.traceStore().load(config.trace());
      Path written = root.exporter(config.format()).export(trace, out);
      CliPrinter.println("Exported to " + written);
      log.info("Exported trace {} as {} to {}", trace.traceId(), config.format(), written);
      return ExitCode.SUCCESS;
    } catch (TraceFormatException ex) {
      log.error("Malformed trace {}: {}", config.trace(), ex.getMessage());
      return ExitCode.INVALID_ARGS;
    } catch (NotFoundException ex) {
      log.error("Trace not found: {}", ex.getMessage());
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Export I/O failure writing {}", out, ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected failure exporting {}", config.trace(), ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
