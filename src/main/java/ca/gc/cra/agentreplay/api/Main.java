package ca.gc.cra.agentreplay.api;

import ca.gc.cra.agentreplay.logging.LoggingConfigurator;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code agent-replay} dispatcher that routes to the trace commands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  static final String VERSION = "agent-replay 0.1.0";
  private static final String SUMMARY_USAGE =
      "usage: agent-replay <show|replay|diff|export|info> [options]";
  private static final String HELP_TEXT = """
      agent-replay: record, replay, and debug AI agent execution traces

      Usage:
        agent-replay <command> [options]

      Commands:
        show      Display a trace file (show --help for details)
        replay    Step through a trace interactively
        diff      Compare two trace files and report divergences
        export    Export a trace to JSON or HTML
        info      Summarize a trace

      Global flags:
        --help      Show this message, or a command's help after the command name
        --version   Print the version
        --verbose   Enable DEBUG logging
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches to a command and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments; the first bare token names the command
   * @return exit code reported by the command
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.positionals().isEmpty()) {
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      if (input.hasFlag("--version")) {
        CliPrinter.println(VERSION);
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }

    String token = input.positionals().get(0);
    String[] delegateArgs = withoutFirst(args, token);
    return switch (token.toLowerCase(Locale.ROOT)) {
      case "show" -> ShowCli.run(delegateArgs);
      case "replay" -> ReplayCli.run(delegateArgs);
      case "diff" -> DiffCli.run(delegateArgs);
      case "export" -> ExportCli.run(delegateArgs);
      case "info" -> InfoCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", token);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  private static String[] withoutFirst(String[] args, String token) {
    List<String> remaining = new ArrayList<>(args.length);
    boolean removed = false;
    for (String arg : args) {
      if (!removed && arg != null && arg.trim().equals(token)) {
        removed = true;
        continue;
      }
      remaining.add(arg);
    }
    return remaining.toArray(String[]::new);
  }
}
