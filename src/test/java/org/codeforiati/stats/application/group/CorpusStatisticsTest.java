package org.codeforiati.stats.application.group;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.util.Map;
import org.codeforiati.stats.domain.reference.ReferenceTables;
import org.codeforiati.stats.domain.stats.Aggregate;
import org.codeforiati.stats.domain.stats.Counter1;
import org.codeforiati.stats.domain.stats.Counter2;
import org.codeforiati.stats.domain.stats.HierarchyLevel;
import org.codeforiati.stats.domain.stats.StatResult;
import org.codeforiati.stats.fixtures.RecordFixtures;
import org.junit.jupiter.api.Test;

class CorpusStatisticsTest {
  private static final String BY_PUBLISHER = "sum_commitments_and_disbursements_by_activity_id_by_publisher_id_usd";

  @Test
  void traceableTotalsOnlyCitedActivities() {
    GroupContext ctx = corpus(Map.of(
        "provider_activity_id_without_own", Counter1.of("B-1", 2),
        BY_PUBLISHER, Counter2.builder()
            .add("pub-b", "B-1", 100)
            .add("pub-b", "B-2", 50)
            .add("pub-a", "A-1", 10)
            .build()));

    Counter1 traceable = CorpusStatistics.traceable(ctx, BY_PUBLISHER, true);
    Counter1 denominator = CorpusStatistics.traceable(ctx, BY_PUBLISHER, false);

    assertEquals(0, BigDecimal.valueOf(100).compareTo(traceable.get("pub-b")));
    assertTrue(traceable.containsKey("pub-a"));
    assertEquals(0, traceable.get("pub-a").signum());
    assertEquals(0, BigDecimal.valueOf(150).compareTo(denominator.get("pub-b")));
    assertEquals(0, BigDecimal.TEN.compareTo(denominator.get("pub-a")));
  }

  @Test
  void duplicatesAreIdentifiersSeenMoreThanOnce() {
    Counter1 identifiers = Counter1.builder().add("A", 1).add("B", 3).build();

    Counter1 duplicates = GroupCounters.duplicates(identifiers);

    assertEquals(1, duplicates.size());
    assertEquals(3, duplicates.get("B").intValue());
  }

  @Test
  void providerIdsWithoutOwnExcludePublishersOwnActivities() {
    GroupContext ctx = corpus(Map.of(
        "iati_identifiers", Counter1.builder().add("A-1", 1).add("A-2", 1).build(),
        "provider_activity_id", Counter1.builder().add("A-1", 1).add("B-9", 2).build()));

    Counter1 external = (Counter1) PublisherStatistics.providerActivityIdsWithoutOwn(ctx);

    assertEquals(1, external.size());
    assertEquals(2, external.get("B-9").intValue());
  }

  private static GroupContext corpus(Map<String, StatResult> values) {
    return new GroupContext(HierarchyLevel.CORPUS, Aggregate.EMPTY.withValues(values), null, null,
        RecordFixtures.TODAY, ReferenceTables.EMPTY, RecordFixtures.converter());
  }
}
