package ca.gc.cra.agentreplay.api;

import ca.gc.cra.agentreplay.application.diff.DiffResult;
import ca.gc.cra.agentreplay.application.json.JsonSupport;
import ca.gc.cra.agentreplay.application.port.TraceStore;
import ca.gc.cra.agentreplay.config.CompositionRoot;
import ca.gc.cra.agentreplay.config.DiffConfig;
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
 * {@code diff}: aligns two traces event by event and reports where they diverge.
 *
 * <p>Exits {@link ExitCode#SUCCESS} whatever the outcome unless {@code --fail-on-critical} is set, in which case
 * critical divergences yield {@link ExitCode#DIVERGED}.</p>
 *
 * @since 0.1.0
 */
public final class DiffCli {
  private static final Logger log = LoggerFactory.getLogger(DiffCli.class);
  private static final String SUMMARY_USAGE =
      "usage: diff a=PATH b=PATH | diff PATH PATH [output=text|json] [--fail-on-critical] "
          + "[config=PATH] [metricsExporter=otlp|none] [--verbose]";
  private static final String HELP_TEXT = """
      agent-replay diff

      Usage:
        diff baseline.jsonl candidate.jsonl [options]

      Required:
        a=PATH               Reference trace (first positional argument)
        b=PATH               Trace compared against the reference (second positional argument)

      Optional:
        output=text|json     Report format (default text)
        --fail-on-critical   Exit with status 1 when a critical divergence is found
        config=PATH          YAML file with common/diff sections
        metricsExporter=otlp|none  Metrics exporter (default none)
        otelEndpoint=URL     OTLP metrics endpoint when metricsExporter=otlp
        --verbose            Enable DEBUG logging
        --help               Show this message

      Notes:
        Events are aligned by position on each trace's timeline; an inserted event shifts every later pair.
      """;

  private DiffCli() {}

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
      log.debug("Verbose logging enabled for diff");
    }

    CommandSupport.Resolution resolution = CommandSupport.resolve(
        "diff", input, SUMMARY_USAGE, log, Map.of("--fail-on-critical", "failOnCritical"), "a", "b");
    if (!resolution.ok()) {
      return resolution.failure();
    }

    DiffConfig config;
    try {
      config = DiffConfig.fromMap(resolution.settings());
      Paths.requireReadableFile(config.traceA());
      Paths.requireReadableFile(config.traceB());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid diff arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try (OpenTelemetryMetricsAdapter metrics = OpenTelemetryMetricsAdapter.fromEnvironment()) {
      CompositionRoot root = new CompositionRoot(metrics);
      TraceStore store = root.traceStore();
      Trace a = store.load(config.traceA());
      Trace b = store.load(config.traceB());
      DiffResult result = root.diffEngine().diff(a, b);
      if (config.output() == DiffConfig.OutputMode.JSON) {
        CliPrinter.println(new JsonSupport().toPrettyJson(result.toMap()));
      } else {
        CliPrinter.printLines(new TraceTextRenderer(Integer.MAX_VALUE).renderDiff(result));
      }
      log.info("Compared {} with {}: {}", config.traceA(), config.traceB(), result.summary());
      if (config.failOnCritical() && result.criticalCount() > 0) {
        return ExitCode.DIVERGED;
      }
      return ExitCode.SUCCESS;
    } catch (TraceFormatException ex) {
      log.error("Malformed trace: {}", ex.getMessage());
      return ExitCode.INVALID_ARGS;
    } catch (NotFoundException ex) {
      log.error("Trace not found: {}", ex.getMessage());
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read traces {} and {}", config.traceA(), config.traceB(), ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected failure comparing traces", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
