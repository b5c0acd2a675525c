package ca.gc.cra.qotd.domain.quote;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class QuoteSpanTest {

  @Test
  void endIsExclusive() {
    assertEquals(12L, new QuoteSpan(2, 10).end());
  }

  @Test
  void rejectsNegativeOffsetAndEmptyLength() {
    assertThrows(IllegalArgumentException.class, () -> new QuoteSpan(-1, 4));
    assertThrows(IllegalArgumentException.class, () -> new QuoteSpan(0, 0));
  }
}
