package ca.gc.cra.agentreplay.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.agentreplay.application.diff.DiffEngine;
import ca.gc.cra.agentreplay.application.diff.DiffResult;
import ca.gc.cra.agentreplay.application.replay.ReplayEngine;
import ca.gc.cra.agentreplay.domain.trace.EventType;
import ca.gc.cra.agentreplay.domain.trace.Span;
import ca.gc.cra.agentreplay.domain.trace.Trace;
import ca.gc.cra.agentreplay.domain.trace.TraceEvent;
import ca.gc.cra.agentreplay.testutil.TraceFixtures;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TraceTextRendererTest {
  private final TraceTextRenderer renderer = new TraceTextRenderer(80);

  @Test
  void listingIndentsChildSpans() {
    Trace trace = TraceFixtures.searchRun();

    List<String> lines = renderer.renderTrace(trace);

    assertEquals(List.of(
        "Agent Trace: research-agent",
        "ID: " + trace.traceId(),
        "Spans: 2 | Events: 4",
        "Duration: 2.250s",
        "",
        ">>> plan (0.750s)",
        "  LLM REQUEST model=gpt-4 messages=1",
        "  LLM RESPONSE \"I will look it up\" (12 tokens)",
        "",
        "  >>> act (0.750s)",
        "    TOOL CALL search({\"q\":\"capital of France\"})",
        "    TOOL RESULT search -> Paris"), lines);
  }

  @Test
  void treeListsEventsBeforeChildSpans() {
    Trace trace = TraceFixtures.searchRun();

    List<String> lines = renderer.renderTree(trace);

    assertEquals(List.of(
        "research-agent (" + trace.traceId() + ")",
        "└── plan [0.750s]",
        "    ├── llm_request",
        "    ├── llm_response",
        "    └── act [0.750s]",
        "        ├── tool_call",
        "        └── tool_result"), lines);
  }

  @Test
  void openTraceShowsRunning() {
    Trace trace = new Trace("live", Map.of(), TraceFixtures.steppingClock());
    trace.addSpan("think");

    List<String> lines = renderer.renderTrace(trace);

    assertEquals("Duration: running", lines.get(3));
    assertEquals(">>> think", lines.get(5));
  }

  @Test
  void stepShowsPositionAndPayloadPreview() {
    ReplayEngine engine = new ReplayEngine(TraceFixtures.searchRun());

    assertEquals(List.of(
        "[1/4] plan llm_request",
        "  {\"model\":\"gpt-4\",\"messages\":[\"find the capital\"]}"), renderer.renderStep(engine));

    engine.jump(3);
    engine.step();
    assertEquals(List.of(TraceTextRenderer.END_OF_TRACE), renderer.renderStep(engine));
  }

  @Test
  void diffListsOneRowPerDivergence() {
    Trace a = TraceFixtures.searchRun();
    Trace b = TraceFixtures.browseRun();
    DiffResult result = new DiffEngine().diff(a, b);

    List<String> lines = renderer.renderDiff(result);

    assertEquals("Trace Diff", lines.get(0));
    assertEquals("Trace A: " + a.traceId(), lines.get(1));
    assertEquals("Found 1 divergence(s): 1 critical, 0 informational.", lines.get(3));
    assertEquals("#    SEVERITY   POSITION DESCRIPTION", lines.get(5));
    assertEquals("1    CRITICAL   2        Different tool called: search vs browse", lines.get(6));
  }

  @Test
  void identicalDiffHasNoTable() {
    Trace trace = TraceFixtures.searchRun();

    List<String> lines = renderer.renderDiff(new DiffEngine().diff(trace, trace));

    assertEquals(4, lines.size());
    assertEquals(DiffResult.IDENTICAL_SUMMARY, lines.get(3));
  }

  @Test
  void infoSummarizesCountsAndMetadata() {
    Trace trace = TraceFixtures.searchRun();

    List<String> lines = renderer.renderInfo(trace);

    assertEquals("research-agent (" + trace.traceId() + ")", lines.get(0));
    assertEquals("  Spans:    2", lines.get(1));
    assertEquals("  Events:   4", lines.get(2));
    assertEquals("  Duration: 2.250s", lines.get(3));
    assertEquals("  Metadata: {\"env\":\"test\"}", lines.get(4));
  }

  @Test
  void describesRemainingEventKinds() {
    Trace trace = new Trace("kinds", Map.of(), TraceFixtures.steppingClock());
    Span span = trace.addSpan("s");
    TraceEvent decision = span.addEvent(EventType.DECISION,
        TraceFixtures.data("description", "pick tool", "choice", "search"));
    TraceEvent error = span.addEvent(EventType.ERROR, TraceFixtures.data("message", "timeout\nretrying"));
    TraceEvent state = span.addEvent(EventType.STATE_CHANGE, TraceFixtures.data("step", 2));
    TraceEvent log = span.addEvent(EventType.LOG, TraceFixtures.data("message", "done"));

    assertEquals("DECISION pick tool -> search", renderer.describe(decision));
    assertEquals("ERROR timeout retrying", renderer.describe(error));
    assertEquals("STATE CHANGE {\"step\":2}", renderer.describe(state));
    assertEquals("LOG done", renderer.describe(log));
  }

  @Test
  void longPayloadsAreTruncated() {
    TraceTextRenderer narrow = new TraceTextRenderer(10);
    Trace trace = new Trace("long", Map.of(), TraceFixtures.steppingClock());
    TraceEvent event = trace.addSpan("s").addEvent(EventType.TOOL_RESULT,
        TraceFixtures.data("tool", "fetch", "result", "abcdefghijklmnopqrstuvwxyz"));

    assertEquals("TOOL RESULT fetch -> abcdefg...", narrow.describe(event));
  }

  @Test
  void rejectsNonPositivePreview() {
    assertThrows(IllegalArgumentException.class, () -> new TraceTextRenderer(0));
  }
}
