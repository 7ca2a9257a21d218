package ca.gc.cra.agentreplay.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankStripsWhitespace() {
    assertEquals("value", Strings.requireNonBlank("test", "  value  "));
  }

  @Test
  void requireNonBlankRejectsControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("test", "bad\u0001"));
  }

  @Test
  void requireNonBlankRejectsControlCharactersAtEitherEnd() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("test", "\u0007value"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("test", "value\n"));
  }

  @Test
  void requireOneOfNormalizesCase() {
    assertEquals("otlp", Strings.requireOneOf("metricsExporter", " OTLP ", "none", "none", "otlp"));
    assertEquals("none", Strings.requireOneOf("metricsExporter", "", "none", "none", "otlp"));
  }

  @Test
  void requireOneOfRejectsUnknownChoice() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Strings.requireOneOf("output", "xml", "text", "text", "json"));
    assertEquals("output must be one of text|json (was xml)", ex.getMessage());
  }

  @Test
  void requirePrintableAsciiRejectsNonAscii() {
    assertThrows(IllegalArgumentException.class,
        () -> Strings.requirePrintableAscii("otelResourceAttributes", "v☃l", 16));
  }

  @Test
  void requirePrintableAsciiRejectsExcessLength() {
    assertThrows(IllegalArgumentException.class,
        () -> Strings.requirePrintableAscii("otelResourceAttributes", "abc", 2));
  }
}
