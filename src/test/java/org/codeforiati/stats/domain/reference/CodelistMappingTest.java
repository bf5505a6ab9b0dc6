package org.codeforiati.stats.domain.reference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.codeforiati.stats.domain.record.Node;
import org.junit.jupiter.api.Test;

class CodelistMappingTest {

  private static final Node ACTIVITY = Node.builder("iati-activity")
      .attribute("default-currency", "EUR")
      .child(Node.builder("sector").attribute("code", "11110"))
      .child(Node.builder("sector").attribute("code", "111").attribute("vocabulary", "2"))
      .child(Node.builder("sector").attribute("code", "72010").attribute("vocabulary", "1"))
      .child(Node.builder("transaction")
          .child(Node.builder("transaction-type").attribute("code", "3"))
          .child(Node.builder("sector").attribute("code", "12220"))
          .child(Node.builder("value").attribute("currency", "USD").text("10")))
      .build();

  @Test
  void keysFollowTheDescendantPathForm() {
    assertEquals(".//sector/@code", CodelistMapping.of("//iati-activity/sector/@code", null).key());
    assertEquals(".//transaction/transaction-type/@code",
        CodelistMapping.of("//transaction/transaction-type/@code", null).key());
    assertEquals(".//sector[@vocabulary = '2']/@code",
        CodelistMapping.of("//iati-activity/sector/@code", "@vocabulary = '2'").key());
  }

  @Test
  void activityPathsMatchAtAnyDepth() {
    List<String> codes = CodelistMapping.of("//iati-activity/sector/@code", null).values(ACTIVITY);

    assertEquals(List.of("11110", "111", "72010", "12220"), codes);
  }

  @Test
  void conditionAlternativesSelectMatchingElements() {
    CodelistMapping dac = CodelistMapping.of("//iati-activity/sector/@code", "@vocabulary = '1' or not(@vocabulary)");

    assertEquals(List.of("11110", "72010", "12220"), dac.values(ACTIVITY));
    assertEquals(List.of("111"),
        CodelistMapping.of("//iati-activity/sector/@code", "@vocabulary='2'").values(ACTIVITY));
  }

  @Test
  void attributeOnlyPathIncludesTheRoot() {
    List<String> currencies = CodelistMapping.of("//@currency", null).values(ACTIVITY);
    List<String> defaults = CodelistMapping.of("//iati-activity/@default-currency", null).values(ACTIVITY);

    assertEquals(List.of("USD"), currencies);
    assertEquals(List.of("EUR"), defaults);
  }

  @Test
  void elementPathsYieldText() {
    assertEquals(List.of("10"), CodelistMapping.of("//transaction/value", null).values(ACTIVITY));
  }

  @Test
  void unsupportedPathsAndConditionsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> CodelistMapping.of("iati-activity/sector/@code", null));
    assertThrows(IllegalArgumentException.class,
        () -> CodelistMapping.of("//sector/@code", "starts-with(@code, '1')"));
    assertThrows(IllegalArgumentException.class, () -> CodelistMapping.of("//sector//@code", null));
  }
}
