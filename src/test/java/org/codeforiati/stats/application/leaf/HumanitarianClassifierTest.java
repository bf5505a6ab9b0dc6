package org.codeforiati.stats.application.leaf;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.codeforiati.stats.domain.record.Node;
import org.codeforiati.stats.domain.stats.Counter1;
import org.codeforiati.stats.fixtures.RecordFixtures;
import org.junit.jupiter.api.Test;

class HumanitarianClassifierTest {

  @Test
  void attributeCountsForRecentVersions() {
    Counter1 result = classify(RecordFixtures.activity("A").attribute("humanitarian", "1").build(), "2.03");

    assertEquals(1, result.get("is_humanitarian").intValue());
    assertEquals(1, result.get("is_humanitarian_by_attrib").intValue());
  }

  @Test
  void attributeIsIgnoredBeforeItWasIntroduced() {
    Counter1 result = classify(RecordFixtures.activity("A").attribute("humanitarian", "1").build(), "2.01");

    assertEquals(0, result.get("is_humanitarian").intValue());
    assertEquals(0, result.get("is_humanitarian_by_attrib").intValue());
  }

  @Test
  void humanitarianSectorClassifiesWithoutAttribute() {
    Node activity = RecordFixtures.activity("A").child(RecordFixtures.sector("72010", "1", null)).build();
    Counter1 result = classify(activity, "2.03");

    assertEquals(1, result.get("is_humanitarian").intValue());
    assertEquals(0, result.get("is_humanitarian_by_attrib").intValue());
  }

  @Test
  void explicitFalseAttributeVetoesSectors() {
    Node activity = RecordFixtures.activity("A")
        .attribute("humanitarian", "0")
        .child(RecordFixtures.sector("72010", "1", null))
        .build();

    assertEquals(0, classify(activity, "2.03").get("is_humanitarian").intValue());
  }

  @Test
  void explicitFalseAttributeVetoesTransactionSectors() {
    Node activity = RecordFixtures.activity("A")
        .attribute("humanitarian", "0")
        .child(RecordFixtures.transaction("3", "2023-05-01", "10", "USD")
            .child(RecordFixtures.sector("72010", "1", null)))
        .build();
    Counter1 result = classify(activity, "2.03");

    assertEquals(0, result.get("is_humanitarian").intValue());
    assertEquals(0, result.get("is_humanitarian_by_attrib").intValue());
  }

  @Test
  void transactionSectorClassifiesWithoutActivityFlag() {
    Node activity = RecordFixtures.activity("A")
        .child(RecordFixtures.transaction("3", "2023-05-01", "10", "USD")
            .child(RecordFixtures.sector("72010", "1", null)))
        .build();

    assertEquals(1, classify(activity, "2.03").get("is_humanitarian").intValue());
  }

  @Test
  void transactionSectorsCountOnlyForVersionTwo() {
    Node v1 = RecordFixtures.activity("A")
        .child(Node.builder("transaction").child(RecordFixtures.sector("72010", null, null)))
        .build();
    Node v2 = RecordFixtures.activity("A")
        .child(Node.builder("transaction").child(RecordFixtures.sector("720", "2", null)))
        .build();

    assertEquals(0, classify(v1, "1.05").get("is_humanitarian").intValue());
    assertEquals(1, classify(v2, "2.02").get("is_humanitarian").intValue());
  }

  @Test
  void scopeUsageIsSplitByClassification() {
    Node activity = RecordFixtures.activity("A")
        .child(Node.builder("humanitarian-scope")
            .attribute("type", "1")
            .attribute("vocabulary", "1-2")
            .attribute("code", "EQ-2015-000048-NPL"))
        .build();
    Counter1 result = classify(activity, "2.03");

    assertEquals(0, result.get("contains_humanitarian_scope").intValue());
    assertEquals(1, result.get("contains_humanitarian_scope_without_humanitarian").intValue());
    assertEquals(1, result.get("uses_humanitarian_glide_codes_without_humanitarian").intValue());
    assertEquals(0, result.get("uses_humanitarian_hrp_codes_without_humanitarian").intValue());
  }

  private static Counter1 classify(Node activity, String version) {
    return (Counter1) HumanitarianClassifier.classify(RecordFixtures.context(activity, version));
  }
}
