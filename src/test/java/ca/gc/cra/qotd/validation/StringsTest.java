package ca.gc.cra.qotd.validation;

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
  void requireOneOfNormalizesCase() {
    assertEquals("none", Strings.requireOneOf("metricsExporter", "NONE", "otlp", "none"));
  }

  @Test
  void requireOneOfRejectsUnknownKeyword() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Strings.requireOneOf("metricsExporter", "statsd", "otlp", "none"));
    assertEquals("metricsExporter must be one of otlp|none (was statsd)", ex.getMessage());
  }

  @Test
  void requirePrintableAsciiRejectsNonAscii() {
    assertThrows(IllegalArgumentException.class,
        () -> Strings.requirePrintableAscii("otelResourceAttributes", "team=\u2603", 64));
  }

  @Test
  void requirePrintableAsciiRejectsExcessLength() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "abc", 2));
  }
}
