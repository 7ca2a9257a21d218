package ca.gc.cra.agentreplay.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.agentreplay.application.port.ExportFormat;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ExportConfigTest {

  @TempDir Path tempDir;

  @Test
  void outputDefaultsToTraceWithFormatExtension() {
    Path trace = tempDir.resolve("run.jsonl");

    ExportConfig config = ExportConfig.fromMap(Map.of("trace", trace.toString(), "format", "HTML"));

    assertEquals(ExportFormat.HTML, config.format());
    assertEquals(tempDir.resolve("run.html").toAbsolutePath().normalize(), config.outputPath());
    assertFalse(config.allowOverwrite());
  }

  @Test
  void traceWithoutExtensionGetsOneAppended() {
    ExportConfig config = ExportConfig.fromMap(Map.of("trace", tempDir.resolve("run").toString()));

    assertEquals("run.json", config.outputPath().getFileName().toString());
  }

  @Test
  void explicitOutputWins() {
    Path out = tempDir.resolve("report.json");

    ExportConfig config = ExportConfig.fromMap(Map.of(
        "trace", tempDir.resolve("run.jsonl").toString(),
        "out", out.toString(),
        "allowOverwrite", "true"));

    assertEquals(out.toAbsolutePath().normalize(), config.outputPath());
    assertTrue(config.allowOverwrite());
  }

  @Test
  void unsupportedFormatIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> ExportConfig.fromMap(Map.of(
        "trace", "run.jsonl", "format", "pdf")));
  }

  @Test
  void traceIsRequired() {
    assertThrows(IllegalArgumentException.class, () -> ExportConfig.fromMap(Map.of("trace", " ")));
  }
}
