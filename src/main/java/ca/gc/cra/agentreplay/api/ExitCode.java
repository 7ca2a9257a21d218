package ca.gc.cra.agentreplay.api;

/**
 * <strong>What:</strong> Process exit codes returned by every {@code agent-replay} command.
 * <p><strong>Why:</strong> Scripts and CI jobs branch on the status; {@link #DIVERGED} lets a pipeline fail when two
 * runs disagree without treating it as a tool failure.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Command completed. */
  SUCCESS(0),
  /** {@code diff --fail-on-critical} found at least one critical divergence. */
  DIVERGED(1),
  /** Arguments, configuration values, or the input trace were invalid. */
  INVALID_ARGS(2),
  /** Reading or writing a file failed. */
  IO_ERROR(3),
  /** Settings passed validation but could not be applied. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure. */
  RUNTIME_FAILURE(5),
  /** The interactive replay session was interrupted. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric status handed to {@link System#exit(int)}.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
