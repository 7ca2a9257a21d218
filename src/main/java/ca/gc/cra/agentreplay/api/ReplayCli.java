package ca.gc.cra.agentreplay.api;

import ca.gc.cra.agentreplay.application.replay.ReplayEngine;
import ca.gc.cra.agentreplay.config.CompositionRoot;
import ca.gc.cra.agentreplay.config.ViewConfig;
import ca.gc.cra.agentreplay.domain.trace.NotFoundException;
import ca.gc.cra.agentreplay.domain.trace.TraceFormatException;
import ca.gc.cra.agentreplay.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.agentreplay.logging.LoggingConfigurator;
import ca.gc.cra.agentreplay.validation.Paths;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code replay}: steps through a trace interactively, one event per prompt.
 *
 * <p>Commands are read line by line; end of input quits the session. An interrupted session exits with
 * {@link ExitCode#INTERRUPTED}.</p>
 *
 * @since 0.1.0
 */
public final class ReplayCli {
  private static final Logger log = LoggerFactory.getLogger(ReplayCli.class);
  private static final String SUMMARY_USAGE =
      "usage: replay trace=PATH|PATH [previewChars=N] [config=PATH] [--verbose]";
  private static final String HELP_TEXT = """
      agent-replay replay

      Usage:
        replay run.jsonl [options]

      Required:
        trace=PATH          Trace file (NDJSON); may be given positionally

      Optional:
        previewChars=N      Characters of payload text per step (default 500)
        config=PATH         YAML file with common/replay sections
        --verbose           Enable DEBUG logging
        --help              Show this message

      Session commands:
        n, next, <enter>    Advance one event
        p, prev, back       Go back one event
        j N, jump N         Jump to event N (1-based)
        s TEXT, search TEXT Find events mentioning TEXT and jump to the next match
        r, reset            Return to the first event
        q, quit, exit       Leave the session
      """;
  static final String COMMANDS_HINT =
      "Commands: (n)ext, (p)rev, (j)ump N, (s)earch TEXT, (r)eset, (q)uit";
  private static final String PROMPT = "> ";

  private ReplayCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    return run(args, new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
  }

  /**
   * Runs the command reading session commands from {@code in}.
   *
   * @param args arguments after the command name
   * @param in source of session commands
   * @return exit code
   */
  static ExitCode run(String[] args, BufferedReader in) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for replay");
    }

    CommandSupport.Resolution resolution =
        CommandSupport.resolve("replay", input, SUMMARY_USAGE, log, Map.of(), "trace");
    if (!resolution.ok()) {
      return resolution.failure();
    }

    ViewConfig config;
    try {
      config = ViewConfig.fromMap(resolution.settings());
      Paths.requireReadableFile(config.trace());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid replay arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try (OpenTelemetryMetricsAdapter metrics = OpenTelemetryMetricsAdapter.fromEnvironment()) {
      ReplayEngine engine = ReplayEngine.fromFile(new CompositionRoot(metrics).traceStore(), config.trace());
      interact(engine, new TraceTextRenderer(config.previewChars()), in);
      return ExitCode.SUCCESS;
    } catch (TraceFormatException ex) {
      log.error("Malformed trace {}: {}", config.trace(), ex.getMessage());
      return ExitCode.INVALID_ARGS;
    } catch (NotFoundException ex) {
      log.error("Trace not found: {}", ex.getMessage());
      return ExitCode.INVALID_ARGS;
    } catch (InterruptedIOException ex) {
      log.warn("Replay of {} interrupted", config.trace());
      Thread.currentThread().interrupt();
      return ExitCode.INTERRUPTED;
    } catch (IOException ex) {
      log.error("Replay I/O failure for {}", config.trace(), ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected failure replaying {}", config.trace(), ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  static void interact(ReplayEngine engine, TraceTextRenderer renderer, BufferedReader in) throws IOException {
    CliPrinter.println("Replay: " + engine.trace().name());
    CliPrinter.println(engine.totalSteps() + " events. " + COMMANDS_HINT);
    while (true) {
      if (Thread.interrupted()) {
        throw new InterruptedIOException("replay session interrupted");
      }
      CliPrinter.printLines(renderer.renderStep(engine));
      CliPrinter.prompt(PROMPT);
      String line = in.readLine();
      if (line == null) {
        CliPrinter.println("");
        return;
      }
      String command = line.strip();
      int space = command.indexOf(' ');
      String verb = (space < 0 ? command : command.substring(0, space)).toLowerCase(Locale.ROOT);
      String argument = space < 0 ? "" : command.substring(space + 1).strip();
      switch (verb) {
        case "q", "quit", "exit" -> {
          return;
        }
        case "", "n", "next" -> engine.step();
        case "p", "prev", "back" -> engine.stepBack();
        case "r", "reset" -> engine.reset();
        case "j", "jump" -> jump(engine, argument);
        case "s", "search" -> search(engine, argument);
        default -> CliPrinter.println("Unknown command. " + COMMANDS_HINT);
      }
    }
  }

  private static void jump(ReplayEngine engine, String argument) {
    String usage = "Usage: j <position> (1-" + engine.totalSteps() + ")";
    int target;
    try {
      target = Integer.parseInt(argument) - 1;
    } catch (NumberFormatException ex) {
      CliPrinter.println(usage);
      return;
    }
    if (engine.jump(target).isEmpty()) {
      CliPrinter.println(usage);
    }
  }

  private static void search(ReplayEngine engine, String query) {
    if (query.isEmpty()) {
      CliPrinter.println("Usage: s <text>");
      return;
    }
    List<Integer> matches = engine.search(query);
    if (matches.isEmpty()) {
      CliPrinter.println("No events match '" + query + "'");
      return;
    }
    CliPrinter.println("Matches at: " + matches.stream()
        .map(position -> Integer.toString(position + 1))
        .collect(Collectors.joining(", ")));
    int next = matches.stream()
        .filter(position -> position > engine.position())
        .findFirst()
        .orElse(matches.get(0));
    engine.jump(next);
  }
}
