package org.codeforiati.stats.application.leaf;

import static org.codeforiati.stats.fixtures.RecordFixtures.activity;
import static org.codeforiati.stats.fixtures.RecordFixtures.context;
import static org.codeforiati.stats.fixtures.RecordFixtures.sector;
import static org.codeforiati.stats.fixtures.RecordFixtures.transaction;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.codeforiati.stats.domain.record.Node;
import org.codeforiati.stats.domain.stats.Counter1;
import org.codeforiati.stats.domain.stats.Counter2;
import org.codeforiati.stats.domain.stats.Counter3;
import org.codeforiati.stats.fixtures.RecordFixtures;
import org.junit.jupiter.api.Test;

class CodelistStatisticsTest {

  private static LeafContext withSectors(String version) {
    Node node = activity("A-1")
        .child(Node.builder("activity-status").attribute("code", "2"))
        .child(sector("11110", "1", "50"))
        .child(sector("12220", null, "30"))
        .child(sector("111", "2", "20"))
        .child(transaction("3", "2024-01-01", "10", "USD"))
        .child(transaction("3", "2024-02-01", "10", "USD"))
        .build();
    return context(node, version);
  }

  @Test
  void valuesAreCountedPerUsageLocation() {
    Counter2 values = (Counter2) CodelistStatistics.codelistValues(withSectors(RecordFixtures.V2));

    Counter1 sectors = values.get(".//sector[@vocabulary = '1' or not(@vocabulary)]/@code");
    assertEquals(1, sectors.get("11110").intValue());
    assertEquals(1, sectors.get("12220").intValue());
    assertFalse(sectors.containsKey("111"));
    assertEquals(2, values.get(".//transaction/transaction-type/@code").get("3").intValue());
    assertEquals(1, values.get(".//activity-status/@code").get("2").intValue());
  }

  @Test
  void mappingsFollowTheRecordsMajorVersion() {
    LeafContext ctx = withSectors("1.05");

    Counter2 values = (Counter2) CodelistStatistics.codelistValues(ctx);
    Counter3 byMajor = (Counter3) CodelistStatistics.byMajorVersion(ctx);

    assertEquals(1, values.values().size());
    assertEquals(1, byMajor.get("1").get(".//activity-status/@code").get("2").intValue());
    assertSame(Counter2.EMPTY, byMajor.get("2"));
  }

  @Test
  void activityWithoutCodedValuesCountsNothing() {
    LeafContext ctx = context(Node.builder("iati-activity").build(), RecordFixtures.V2);

    assertTrue(CodelistStatistics.codelistValues(ctx).isEmpty());
    assertTrue(CodelistStatistics.byMajorVersion(ctx).isEmpty());
  }
}
