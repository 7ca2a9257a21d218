package ca.gc.cra.agentreplay.domain.trace;

/**
 * Thrown when a persisted trace, or a record decoded from one, is malformed.
 *
 * <p>Loading fails as a whole when this is raised; no partially populated trace is returned.</p>
 *
 * @since 0.1.0
 */
public final class TraceFormatException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable error
   */
  public TraceFormatException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param message human-readable error
   * @param cause parser or conversion failure
   */
  public TraceFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}
