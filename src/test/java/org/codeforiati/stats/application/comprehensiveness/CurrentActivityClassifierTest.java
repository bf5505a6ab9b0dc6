package org.codeforiati.stats.application.comprehensiveness;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.LocalDate;
import org.codeforiati.stats.domain.record.Node;
import org.codeforiati.stats.fixtures.RecordFixtures;
import org.junit.jupiter.api.Test;

class CurrentActivityClassifierTest {

  @Test
  void activeStatusWithoutPlannedEndIsCurrent() {
    assertEquals(CurrentStatus.BY_STATUS, classify(RecordFixtures.activity("A")
        .child(Node.builder("activity-status").attribute("code", "4"))));
  }

  @Test
  void activeStatusIsIgnoredWhenAPlannedEndExists() {
    assertEquals(CurrentStatus.NOT_CURRENT, classify(RecordFixtures.activity("A")
        .child(Node.builder("activity-status").attribute("code", "2"))
        .child(RecordFixtures.activityDate("3", "2020-01-01"))));
  }

  @Test
  void actualEndWithinTheLastYearIsCurrent() {
    assertEquals(CurrentStatus.BY_RECENT_ACTUAL_END, classify(RecordFixtures.activity("A")
        .child(RecordFixtures.activityDate("4", "2023-03-15"))));
    assertEquals(CurrentStatus.NOT_CURRENT, classify(RecordFixtures.activity("A")
        .child(RecordFixtures.activityDate("4", "2023-03-14"))));
  }

  @Test
  void plannedEndTodayOrLaterIsCurrent() {
    assertEquals(CurrentStatus.BY_FUTURE_PLANNED_END, classify(RecordFixtures.activity("A")
        .child(RecordFixtures.activityDate("3", "2024-03-15"))));
  }

  @Test
  void versionOneUsesNamedDateTypes() {
    Node activity = RecordFixtures.activity("A")
        .child(RecordFixtures.activityDate("end-planned", "2030-01-01"))
        .build();
    assertEquals(CurrentStatus.BY_FUTURE_PLANNED_END,
        CurrentActivityClassifier.classify(RecordFixtures.context(activity, "1.04")));
  }

  @Test
  void leapDayYearAgoLandsOnFirstOfMarch() {
    Node activity = RecordFixtures.activity("A")
        .child(RecordFixtures.activityDate("4", "2023-03-01"))
        .build();
    LocalDate leapDay = LocalDate.of(2024, 2, 29);
    assertEquals(CurrentStatus.BY_RECENT_ACTUAL_END,
        CurrentActivityClassifier.classify(RecordFixtures.context(activity, "2.03", leapDay)));
  }

  private static CurrentStatus classify(Node.Builder activity) {
    return CurrentActivityClassifier.classify(RecordFixtures.context(activity.build(), RecordFixtures.V2));
  }
}
