package ca.gc.cra.agentreplay.domain.trace;

import java.time.Instant;

/**
 * <strong>What:</strong> Time source used to stamp events, span bounds, and trace bounds.
 * <p><strong>Why:</strong> Lets recorders and tests inject deterministic clocks so replay ordering can be
 * asserted exactly.</p>
 * <p><strong>Role:</strong> Domain seam injected into {@link Trace}; spans inherit their trace's clock.</p>
 * <p><strong>Thread-safety:</strong> {@link #SYSTEM} is thread-safe; custom clocks document their own guarantees.</p>
 *
 * @implNote Default implementation reads {@link Instant#now()} with sub-millisecond precision where the JVM
 * provides it.
 * @since 0.1.0
 */
@FunctionalInterface
public interface TraceClock {
  /**
   * Returns the current wall-clock time.
   *
   * @return seconds since 1970-01-01T00:00:00Z with fractional part
   */
  double nowSeconds();

  /** Wall-clock implementation backed by {@link Instant#now()}. */
  TraceClock SYSTEM = () -> {
    Instant now = Instant.now();
    return now.getEpochSecond() + now.getNano() / 1_000_000_000.0;
  };
}
