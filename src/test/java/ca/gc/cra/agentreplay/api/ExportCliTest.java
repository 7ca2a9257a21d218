package ca.gc.cra.agentreplay.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.agentreplay.infrastructure.persistence.JsonlTraceStore;
import ca.gc.cra.agentreplay.testutil.TraceFixtures;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class ExportCliTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private StringWriter buffer;
  private Path trace;

  @BeforeEach
  void setUp() throws Exception {
    logger = (Logger) LoggerFactory.getLogger(ExportCli.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
    trace = new JsonlTraceStore().save(TraceFixtures.searchRun(), tempDir.resolve("run.jsonl"));
  }

  @AfterEach
  void tearDown() {
    if (logger != null && appender != null) {
      logger.detachAppender(appender);
    }
    CliPrinter.clearTestWriter();
  }

  @Test
  void htmlIsWrittenNextToTrace() throws Exception {
    ExitCode code = ExportCli.run(new String[] {trace.toString(), "format=html"});

    assertEquals(ExitCode.SUCCESS, code);
    Path html = tempDir.resolve("run.html");
    assertTrue(Files.exists(html));
    assertTrue(Files.readString(html, StandardCharsets.UTF_8).contains("<h1>research-agent</h1>"));
    assertTrue(buffer.toString().contains("Exported to "));
  }

  @Test
  void jsonIsDefaultFormat() throws Exception {
    Path out = tempDir.resolve("report.json");

    ExitCode code = ExportCli.run(new String[] {"trace=" + trace, "out=" + out});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(Files.readString(out, StandardCharsets.UTF_8).contains("\"name\" : \"research-agent\""));
  }

  @Test
  void existingOutputNeedsAllowOverwrite() throws Exception {
    Path html = Files.writeString(tempDir.resolve("run.html"), "old", StandardCharsets.UTF_8);

    ExitCode refused = ExportCli.run(new String[] {trace.toString(), "format=html"});
    assertEquals(ExitCode.INVALID_ARGS, refused);
    assertEquals("old", Files.readString(html, StandardCharsets.UTF_8));
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getFormattedMessage().contains("--allow-overwrite")));

    ExitCode replaced = ExportCli.run(new String[] {trace.toString(), "format=html", "--allow-overwrite"});
    assertEquals(ExitCode.SUCCESS, replaced);
  }

  @Test
  void refusesToOverwriteSourceTrace() {
    ExitCode code = ExportCli.run(new String[] {trace.toString(), "out=" + trace, "--allow-overwrite"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: export"));
  }

  @Test
  void unknownFormatIsRejected() {
    assertEquals(ExitCode.INVALID_ARGS, ExportCli.run(new String[] {trace.toString(), "format=pdf"}));
  }
}
