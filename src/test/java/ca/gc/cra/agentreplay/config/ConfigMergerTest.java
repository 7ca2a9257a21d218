package ca.gc.cra.agentreplay.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlAndEmitsWarning() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("show");
    Map<String, String> yaml = Map.of("previewChars", "120", "tree", "true");
    Map<String, String> cli = Map.of("previewChars", "60", "trace", "run.jsonl");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "show",
        Optional.of(yaml),
        cli,
        defaults,
        warnings::add);

    assertEquals("60", merged.get("previewChars"));
    assertEquals("true", merged.get("tree"));
    assertEquals("run.jsonl", merged.get("trace"));
    assertEquals("none", merged.get("metricsExporter"));
    assertEquals(List.of("CLI overrides YAML for key: previewChars"), warnings);
  }

  @Test
  void defaultsApplyWhenNothingElseIsGiven() {
    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "diff",
        Optional.empty(),
        Map.of(),
        DefaultsForMode.asFlatMap("diff"),
        null);

    assertEquals("text", merged.get("output"));
    assertEquals("false", merged.get("failOnCritical"));
  }

  @Test
  void exportRejectsOutputEqualToTrace() {
    Map<String, String> cli = Map.of("trace", "run.jsonl", "out", " run.jsonl ");

    assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "export",
            Optional.empty(),
            cli,
            DefaultsForMode.asFlatMap("export"),
            msg -> {}));
  }

  @Test
  void unknownCommandHasNoDefaults() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("record"));
    assertTrue(ex.getMessage().contains("record"));
  }
}
