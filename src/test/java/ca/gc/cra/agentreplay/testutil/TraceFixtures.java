package ca.gc.cra.agentreplay.testutil;

import ca.gc.cra.agentreplay.domain.trace.EventType;
import ca.gc.cra.agentreplay.domain.trace.Span;
import ca.gc.cra.agentreplay.domain.trace.Trace;
import ca.gc.cra.agentreplay.domain.trace.TraceClock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Deterministic traces and clocks shared by tests. */
public final class TraceFixtures {
  /** Start of every stepping clock: 2023-11-14T22:13:20Z. */
  public static final double EPOCH = 1_700_000_000.0;

  private TraceFixtures() {}

  /** Returns a clock that starts at {@link #EPOCH} and advances a quarter second per reading. */
  public static SteppingClock steppingClock() {
    return new SteppingClock(EPOCH, 0.25);
  }

  /** Agent run that plans, searches the web, and answers. */
  public static Trace searchRun() {
    return run("research-agent", "search");
  }

  /** Same run as {@link #searchRun()} but the agent browses instead of searching. */
  public static Trace browseRun() {
    return run("research-agent", "browse");
  }

  /** A trace holding one span with a single LLM request. */
  public static Trace requestOnly() {
    Trace trace = new Trace("chat", Map.of(), steppingClock());
    Span span = trace.addSpan("chat");
    span.addEvent(EventType.LLM_REQUEST, data("model", "gpt-4", "messages", List.of("hi")));
    trace.close();
    return trace;
  }

  /** {@link #requestOnly()} followed by the model's answer. */
  public static Trace requestAndResponse() {
    Trace trace = new Trace("chat", Map.of(), steppingClock());
    Span span = trace.addSpan("chat");
    span.addEvent(EventType.LLM_REQUEST, data("model", "gpt-4", "messages", List.of("hi")));
    span.addEvent(EventType.LLM_RESPONSE, data("content", "hello", "tokens", 3));
    trace.close();
    return trace;
  }

  private static Trace run(String name, String tool) {
    Trace trace = new Trace(name, Map.of("env", "test"), steppingClock());
    Span plan = trace.addSpan("plan");
    plan.addEvent(EventType.LLM_REQUEST, data("model", "gpt-4", "messages", List.of("find the capital")));
    plan.addEvent(EventType.LLM_RESPONSE, data("content", "I will look it up", "tokens", 12));
    plan.close();
    Span act = trace.addSpan("act", plan.spanId(), null);
    act.addEvent(EventType.TOOL_CALL, data("tool", tool, "args", Map.of("q", "capital of France")));
    act.addEvent(EventType.TOOL_RESULT, data("tool", tool, "result", "Paris"));
    act.close();
    trace.close();
    return trace;
  }

  /** Builds an insertion-ordered payload from alternating keys and values. */
  public static Map<String, Object> data(Object... keyValues) {
    Map<String, Object> map = new LinkedHashMap<>();
    for (int i = 0; i < keyValues.length; i += 2) {
      map.put((String) keyValues[i], keyValues[i + 1]);
    }
    return map;
  }

  /** Clock returning evenly spaced readings. */
  public static final class SteppingClock implements TraceClock {
    private double next;
    private final double step;

    public SteppingClock(double start, double step) {
      this.next = start;
      this.step = step;
    }

    @Override
    public double nowSeconds() {
      double now = next;
      next += step;
      return now;
    }
  }
}
