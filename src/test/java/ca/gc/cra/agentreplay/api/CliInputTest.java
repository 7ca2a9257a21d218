package ca.gc.cra.agentreplay.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void classifiesPositionalsSettingsAndFlags() {
    CliInput input = CliInput.parse(new String[] {"show", " run.jsonl ", "--TREE", "previewChars=40", "-v", ""});

    assertEquals(List.of("show", "run.jsonl"), input.positionals());
    assertArrayEquals(new String[] {"previewChars=40"}, input.keyValueArgs());
    assertTrue(input.hasFlag("--tree"));
    assertTrue(input.verbose());
    assertFalse(input.help());
  }

  @Test
  void helpAliasesAreNormalized() {
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertTrue(CliInput.parse(new String[] {"HELP"}).help());
    assertTrue(CliInput.parse(new String[] {"--debug"}).verbose());
  }

  @Test
  void dashedSettingIsNotAFlag() {
    assertFalse(CliInput.isFlag("--out=x.html"));
    assertTrue(CliInput.isFlag("--fail-on-critical"));
    assertEquals(1, CliInput.parse(new String[] {"--out=x.html"}).keyValueArgs().length);
  }

  @Test
  void nullArgsAreEmpty() {
    CliInput input = CliInput.parse(null);

    assertTrue(input.positionals().isEmpty());
    assertTrue(input.flags().isEmpty());
    assertFalse(input.hasFlag(null));
  }
}
