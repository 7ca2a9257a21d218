package ca.gc.cra.agentreplay.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.agentreplay.application.diff.DiffResult;
import ca.gc.cra.agentreplay.application.json.JsonSupport;
import ca.gc.cra.agentreplay.infrastructure.persistence.JsonlTraceStore;
import ca.gc.cra.agentreplay.testutil.TraceFixtures;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class DiffCliTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private Level previousLevel;
  private StringWriter buffer;
  private Path search;
  private Path browse;

  @BeforeEach
  void setUp() throws Exception {
    logger = (Logger) LoggerFactory.getLogger(DiffCli.class);
    previousLevel = logger.getLevel();
    logger.setLevel(Level.INFO);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
    JsonlTraceStore store = new JsonlTraceStore();
    search = store.save(TraceFixtures.searchRun(), tempDir.resolve("search.jsonl"));
    browse = store.save(TraceFixtures.browseRun(), tempDir.resolve("browse.jsonl"));
  }

  @AfterEach
  void tearDown() {
    if (logger != null && appender != null) {
      logger.detachAppender(appender);
      logger.setLevel(previousLevel);
    }
    CliPrinter.clearTestWriter();
  }

  @Test
  void identicalTracesSucceed() {
    ExitCode code = DiffCli.run(new String[] {search.toString(), search.toString(), "--fail-on-critical"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains(DiffResult.IDENTICAL_SUMMARY));
  }

  @Test
  void criticalDivergenceFailsWhenRequested() {
    ExitCode code = DiffCli.run(new String[] {"a=" + search, "b=" + browse, "--fail-on-critical"});

    assertEquals(ExitCode.DIVERGED, code);
    String output = buffer.toString();
    assertTrue(output.contains("Found 1 divergence(s): 1 critical, 0 informational."));
    assertTrue(output.contains("Different tool called: search vs browse"));
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.INFO
            && event.getFormattedMessage().startsWith("Compared ")));
  }

  @Test
  void divergenceWithoutFlagStillSucceeds() {
    assertEquals(ExitCode.SUCCESS, DiffCli.run(new String[] {search.toString(), browse.toString()}));
  }

  @Test
  @SuppressWarnings("unchecked")
  void jsonOutputCarriesDivergences() {
    ExitCode code = DiffCli.run(new String[] {search.toString(), browse.toString(), "output=json"});

    assertEquals(ExitCode.SUCCESS, code);
    Map<String, Object> report = (Map<String, Object>) new JsonSupport().parse(buffer.toString());
    assertEquals(Boolean.FALSE, report.get("identical"));
    assertEquals(1, ((Number) report.get("critical_count")).intValue());
    Map<String, Object> first = (Map<String, Object>) ((List<Object>) report.get("divergences")).get(0);
    assertEquals("critical", first.get("severity"));
    assertEquals("act", first.get("trace_a_span"));
  }

  @Test
  void missingSecondTraceReturnsInvalidArgs() {
    ExitCode code = DiffCli.run(new String[] {search.toString()});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: diff"));
  }
}
