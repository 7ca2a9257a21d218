package ca.gc.cra.agentreplay.application.port;

import ca.gc.cra.agentreplay.domain.trace.Trace;
import java.io.IOException;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Port for rendering a trace into a standalone document for sharing.
 * <p><strong>Role:</strong> Implemented by {@code JsonTraceExporter} and {@code HtmlTraceExporter}.</p>
 *
 * @since 0.1.0
 */
public interface TraceExporter {
  /**
   * Identifies the format this exporter writes.
   *
   * @return export format
   */
  ExportFormat format();

  /**
   * Writes the rendered trace, replacing any existing file.
   *
   * @param trace trace to export
   * @param path destination file
   * @return the path written
   * @throws IOException when the destination cannot be written
   */
  Path export(Trace trace, Path path) throws IOException;
}
