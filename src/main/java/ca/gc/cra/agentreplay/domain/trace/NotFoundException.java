package ca.gc.cra.agentreplay.domain.trace;

/**
 * Thrown when a referenced span id or trace file does not exist.
 *
 * @since 0.1.0
 */
public final class NotFoundException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable error naming the missing reference
   */
  public NotFoundException(String message) {
    super(message);
  }

  /**
   * Creates an exception for a span id absent from a trace.
   *
   * @param spanId missing span id
   * @return exception instance
   */
  public static NotFoundException span(String spanId) {
    return new NotFoundException("span not found: " + spanId);
  }

  /**
   * Creates an exception for a trace file that does not exist.
   *
   * @param path missing path
   * @return exception instance
   */
  public static NotFoundException tracePath(Object path) {
    return new NotFoundException("trace file not found: " + path);
  }
}
