package org.codeforiati.stats.domain.stats;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class StatisticDeclarationTest {

  @Test
  void nullResultBecomesShapeIdentity() {
    StatisticDeclaration<String> declaration = StatisticDeclaration.summed("empty", Shape.COUNTER2, ctx -> null);
    assertSame(Counter2.EMPTY, declaration.evaluate("ignored"));
  }

  @Test
  void wrongShapeIsRejected() {
    StatisticDeclaration<String> declaration =
        StatisticDeclaration.summed("count", Shape.NUMBER, ctx -> Counter1.label(ctx));
    IllegalStateException ex = assertThrows(IllegalStateException.class, () -> declaration.evaluate("x"));
    assertTrue(ex.getMessage().contains("count"));
  }

  @Test
  void derivedDeclarationsAreNotFoldable() {
    assertTrue(StatisticDeclaration.<String>summed("a", Shape.NUMBER, ctx -> NumberStat.ONE).isFoldable());
    assertFalse(StatisticDeclaration.<String>derived("b", Shape.NUMBER, ctx -> NumberStat.ONE).isFoldable());
  }

  @Test
  void blankNamesAreRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> StatisticDeclaration.<String>summed(" ", Shape.NUMBER, ctx -> NumberStat.ONE));
  }

  @Test
  void nullKeysAreCountedUnderLiteralNull() {
    Counter1 counter = Counter1.builder().add(null, 1).add(null, 2).build();
    assertEquals(0, counter.get(StatKeys.NULL).compareTo(BigDecimal.valueOf(3)));
  }
}
