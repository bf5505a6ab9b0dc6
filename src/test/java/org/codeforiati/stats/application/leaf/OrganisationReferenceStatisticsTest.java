package org.codeforiati.stats.application.leaf;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.util.Map;
import org.codeforiati.stats.domain.record.MalformedRecordException;
import org.codeforiati.stats.domain.record.Node;
import org.codeforiati.stats.domain.stats.Counter1;
import org.codeforiati.stats.domain.stats.StatResult;
import org.codeforiati.stats.fixtures.RecordFixtures;
import org.junit.jupiter.api.Test;

class OrganisationReferenceStatisticsTest {

  private static Node.Builder participating(String role, String ref) {
    return Node.builder("participating-org").attribute("role", role).attribute("ref", ref);
  }

  @Test
  void participatingReferencesAreGradedPerRole() throws MalformedRecordException {
    Node element = RecordFixtures.activity("A-1")
        .child(participating("1", "GB-COH-1"))
        .child(participating("1", "GB-CHC-123"))
        .child(participating("1", "XX-999"))
        .child(participating("1", ""))
        .child(participating("1", null))
        .child(participating("4", "GB-CHC-9"))
        .build();

    Map<String, StatResult> result = RecordFixtures.evaluator().evaluate(element, RecordFixtures.V2);

    Counter1 funding = (Counter1) result.get("funding_org_transaction_stats");
    assertEquals(5, funding.get("total_orgs").intValue());
    assertEquals(4, funding.get("total_refs").intValue());
    assertEquals(3, funding.get("total_full_refs").intValue());
    assertEquals(2, funding.get("total_notself_refs").intValue());
    assertEquals(1, funding.get("total_valid_refs").intValue());

    Counter1 prefixes = (Counter1) result.get("funding_org_valid_prefixes");
    assertEquals(1, prefixes.get("GB-CHC").intValue());
    assertEquals(1, prefixes.get("None").intValue());
    assertEquals(2, prefixes.size());

    assertEquals(1, ((Counter1) result.get("implementing_org_transaction_stats")).get("total_valid_refs").intValue());
    assertEquals(0, ((Counter1) result.get("accountable_org_transaction_stats")).get("total_orgs").intValue());
  }

  @Test
  void transactionPartiesUseChannelCodes() throws MalformedRecordException {
    Node element = RecordFixtures.activity("A-1")
        .child(RecordFixtures.transaction("3", "2024-01-01", "10", "USD")
            .child(Node.builder("receiver-org").attribute("ref", "41100-UNDP")))
        .build();

    Map<String, StatResult> result = RecordFixtures.evaluator().evaluate(element, RecordFixtures.V2);

    assertEquals(Counter1.of("41100", 1), result.get("receiver_org_valid_prefixes"));
    assertSame(Counter1.EMPTY, result.get("provider_org_valid_prefixes"));
    assertEquals(1, ((Counter1) result.get("receiver_org_transaction_stats")).get("total_valid_refs").intValue());
  }
}
