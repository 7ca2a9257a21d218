package ca.gc.cra.agentreplay.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {

  @Test
  void parsesKeyValuePairsInOrder() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"trace=run.jsonl", "format=html"});

    assertEquals(List.of("trace", "format"), List.copyOf(map.keySet()));
    assertEquals("html", map.get("format"));
  }

  @Test
  void splitsOnFirstEquals() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"otelResourceAttributes=team=replay"});

    assertEquals("team=replay", map.get("otelResourceAttributes"));
  }

  @Test
  void rejectsMissingValue() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"trace="}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=run.jsonl"}));
  }

  @Test
  void rejectsRepeatedKey() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> CliArgsParser.toMap(new String[] {"a=x.jsonl", "a=y.jsonl"}));
    assertEquals("argument a given more than once", ex.getMessage());
  }

  @Test
  void rejectsMalformedKey() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"pre view=1"}));
  }

  @Test
  void nullYieldsEmptyMap() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
  }
}
