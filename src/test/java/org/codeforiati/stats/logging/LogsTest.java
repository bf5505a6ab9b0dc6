package org.codeforiati.stats.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void shortValuesAreKeptAndLineBreaksFlattened() {
    assertEquals("GB-COH-1 A", Logs.truncate("GB-COH-1\nA", 40));
    assertEquals("<null>", Logs.truncate(null, 5));
  }

  @Test
  void longValuesAreCutWithSuffix() {
    assertEquals("abcde... (truncated, 5 of 10)", Logs.truncate("abcdefghij", 5));
  }

  @Test
  void surrogatePairsAreNotSplit() {
    String value = "ab\uD83D\uDE00cd";

    String truncated = Logs.truncate(value, 3);

    assertTrue(truncated.startsWith("ab..."));
    assertEquals("ab... (truncated, 2 of 6)", truncated);
  }

  @Test
  void identifierUsesFixedBudget() {
    String longId = "X".repeat(Logs.IDENTIFIER_BUDGET + 10);
    assertTrue(Logs.identifier(longId).startsWith("X".repeat(Logs.IDENTIFIER_BUDGET) + "..."));
  }

  @Test
  void nonPositiveBudgetIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }
}
