package ca.gc.cra.agentreplay.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class ViewConfigTest {

  @Test
  void parsesTreeAndPreview() {
    ViewConfig config = ViewConfig.fromMap(Map.of("trace", "run.jsonl", "tree", "true", "previewChars", "200"));

    assertTrue(config.tree());
    assertEquals(200, config.previewChars());
    assertTrue(config.trace().isAbsolute());
  }

  @Test
  void previewDefaultsWhenAbsent() {
    ViewConfig config = ViewConfig.fromMap(Map.of("trace", "run.jsonl"));

    assertFalse(config.tree());
    assertEquals(ViewConfig.DEFAULT_PREVIEW_CHARS, config.previewChars());
  }

  @Test
  void rejectsTinyPreview() {
    assertThrows(IllegalArgumentException.class,
        () -> ViewConfig.fromMap(Map.of("trace", "run.jsonl", "previewChars", "2")));
  }

  @Test
  void rejectsMissingTrace() {
    assertThrows(IllegalArgumentException.class, () -> ViewConfig.fromMap(Map.of()));
  }
}
