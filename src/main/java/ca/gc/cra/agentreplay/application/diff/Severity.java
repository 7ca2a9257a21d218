package ca.gc.cra.agentreplay.application.diff;

/**
 * Classification of a {@link Divergence}.
 *
 * @since 0.1.0
 */
public enum Severity {
  /** Cosmetic or expected variation, such as differing LLM wording. */
  INFO("info"),
  /** Structural length mismatch: one trace has events the other lacks. */
  WARNING("warning"),
  /** Behavioural divergence: different event kind, tool, or decision. */
  CRITICAL("critical");

  private final String wireValue;

  Severity(String wireValue) {
    this.wireValue = wireValue;
  }

  /**
   * Returns the lowercase spelling used in diff reports.
   *
   * @return wire value
   */
  public String wireValue() {
    return wireValue;
  }

  @Override
  public String toString() {
    return wireValue;
  }
}
