package ca.gc.cra.agentreplay.infrastructure.export;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.agentreplay.application.json.JsonSupport;
import ca.gc.cra.agentreplay.application.port.ExportFormat;
import ca.gc.cra.agentreplay.domain.trace.Trace;
import ca.gc.cra.agentreplay.domain.trace.TraceRecords;
import ca.gc.cra.agentreplay.testutil.TraceFixtures;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonTraceExporterTest {
  @TempDir Path tempDir;

  @Test
  void writesOnePrettyDocumentWithNestedSpans() throws Exception {
    Trace trace = TraceFixtures.searchRun();
    JsonTraceExporter exporter = new JsonTraceExporter();

    Path out = exporter.export(trace, tempDir.resolve("run.json"));

    String text = Files.readString(out, StandardCharsets.UTF_8);
    assertTrue(text.contains("\n"));
    @SuppressWarnings("unchecked")
    Map<String, Object> document = (Map<String, Object>) new JsonSupport().parse(text);
    assertEquals(trace.traceId(), document.get("trace_id"));
    assertEquals(2, ((List<?>) document.get("spans")).size());
    assertEquals(trace.eventCount(), TraceRecords.fromMap(document).eventCount());
    assertEquals(ExportFormat.JSON, exporter.format());
  }
}
