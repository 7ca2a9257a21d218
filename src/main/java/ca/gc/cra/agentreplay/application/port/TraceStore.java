package ca.gc.cra.agentreplay.application.port;

import ca.gc.cra.agentreplay.domain.trace.Trace;
import java.io.IOException;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Port for persisting and reloading whole traces.
 * <p><strong>Why:</strong> Recorder, replay, and diff depend on this contract rather than a file format.</p>
 * <p><strong>Role:</strong> Implemented by {@code JsonlTraceStore} (one NDJSON file per trace).</p>
 * <p><strong>Thread-safety:</strong> Implementations are not required to coordinate concurrent writers of the same
 * path.</p>
 *
 * @since 0.1.0
 */
public interface TraceStore {
  /**
   * Writes a trace, replacing any existing file at {@code path}.
   *
   * @param trace trace to persist
   * @param path destination; parent directories are created when missing
   * @return the path written
   * @throws IOException when the destination cannot be written
   */
  Path save(Trace trace, Path path) throws IOException;

  /**
   * Reads a trace. The load is all-or-nothing: no partial trace is returned.
   *
   * @param path source file
   * @return reconstructed trace
   * @throws IOException when the file cannot be read
   * @throws ca.gc.cra.agentreplay.domain.trace.NotFoundException when {@code path} does not exist
   * @throws ca.gc.cra.agentreplay.domain.trace.TraceFormatException when the content is malformed
   */
  Trace load(Path path) throws IOException;
}
