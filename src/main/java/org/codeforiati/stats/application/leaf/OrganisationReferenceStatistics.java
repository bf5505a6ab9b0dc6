package org.codeforiati.stats.application.leaf;

import static org.codeforiati.stats.domain.stats.StatisticDeclaration.summed;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.codeforiati.stats.domain.record.Node;
import org.codeforiati.stats.domain.stats.Counter1;
import org.codeforiati.stats.domain.stats.Shape;
import org.codeforiati.stats.domain.stats.StatResult;
import org.codeforiati.stats.domain.stats.StatisticDeclaration;

/**
 * Quality of organisation references on participating organisations and transaction parties.
 *
 * <p>Each {@code *_transaction_stats} counter reports {@code total_orgs}, {@code total_refs} (a {@code ref}
 * attribute exists), {@code total_full_refs} (it is non-empty), {@code total_notself_refs} (it differs from the
 * reporting organisation) and {@code total_valid_refs} (it also starts with a registered prefix). The matching
 * {@code *_valid_prefixes} counter tallies not-self refs by the prefix they start with, or {@code null}.</p>
 */
public final class OrganisationReferenceStatistics {
  static final String NO_VALID_PREFIX = "None";
  private static final String TOTAL_ORGS = "total_orgs";
  private static final String TOTAL_REFS = "total_refs";
  private static final String TOTAL_FULL_REFS = "total_full_refs";
  private static final String TOTAL_NOTSELF_REFS = "total_notself_refs";
  private static final String TOTAL_VALID_REFS = "total_valid_refs";

  private OrganisationReferenceStatistics() {}

  public static List<StatisticDeclaration<LeafContext>> declarations() {
    List<StatisticDeclaration<LeafContext>> out = new ArrayList<>();
    participatingRole(out, "funding", "1");
    participatingRole(out, "accountable", "2");
    participatingRole(out, "extending", "3");
    participatingRole(out, "implementing", "4");
    transactionParty(out, "provider", "provider-org");
    transactionParty(out, "receiver", "receiver-org");
    return List.copyOf(out);
  }

  private static void participatingRole(List<StatisticDeclaration<LeafContext>> out, String label, String role) {
    out.add(summed(label + "_org_transaction_stats", Shape.COUNTER1,
        ctx -> referenceStats(ctx, participatingOrgs(ctx, role))));
    out.add(summed(label + "_org_valid_prefixes", Shape.COUNTER1,
        ctx -> validPrefixes(ctx, participatingOrgs(ctx, role))));
  }

  private static void transactionParty(List<StatisticDeclaration<LeafContext>> out, String label, String tag) {
    out.add(summed(label + "_org_transaction_stats", Shape.COUNTER1,
        ctx -> referenceStats(ctx, transactionOrgs(ctx, tag))));
    out.add(summed(label + "_org_valid_prefixes", Shape.COUNTER1,
        ctx -> validPrefixes(ctx, transactionOrgs(ctx, tag))));
  }

  private static List<Node> participatingOrgs(LeafContext ctx, String role) {
    List<Node> out = new ArrayList<>();
    for (Node org : ctx.element().children("participating-org")) {
      if (role.equals(org.attribute("role"))) {
        out.add(org);
      }
    }
    return out;
  }

  private static List<Node> transactionOrgs(LeafContext ctx, String tag) {
    List<Node> out = new ArrayList<>();
    for (Node transaction : ctx.element().children("transaction")) {
      Node org = transaction.child(tag);
      if (org != null) {
        out.add(org);
      }
    }
    return out;
  }

  static StatResult referenceStats(LeafContext ctx, List<Node> orgs) {
    String reporter = ctx.facts().reportingOrgRef();
    String major = ctx.facts().majorVersion();
    long refs = 0;
    long fullRefs = 0;
    long notSelf = 0;
    long valid = 0;
    for (Node org : orgs) {
      String ref = org.attribute("ref");
      if (ref == null) {
        continue;
      }
      refs++;
      if (ref.isEmpty()) {
        continue;
      }
      fullRefs++;
      if (ref.equals(reporter)) {
        continue;
      }
      notSelf++;
      if (ctx.tables().validOrgPrefix(major, ref).isPresent()) {
        valid++;
      }
    }
    return Counter1.builder()
        .add(TOTAL_ORGS, orgs.size())
        .add(TOTAL_REFS, refs)
        .add(TOTAL_FULL_REFS, fullRefs)
        .add(TOTAL_NOTSELF_REFS, notSelf)
        .add(TOTAL_VALID_REFS, valid)
        .build();
  }

  /** References with no recognised prefix count under {@value #NO_VALID_PREFIX}. */
  static StatResult validPrefixes(LeafContext ctx, List<Node> orgs) {
    String reporter = ctx.facts().reportingOrgRef();
    Counter1.Builder out = Counter1.builder();
    for (Node org : orgs) {
      String ref = org.attribute("ref");
      if (ref == null || ref.isEmpty() || ref.equals(reporter)) {
        continue;
      }
      Optional<String> prefix = ctx.tables().validOrgPrefix(ctx.facts().majorVersion(), ref);
      out.add(prefix.orElse(NO_VALID_PREFIX), 1);
    }
    return out.build();
  }
}
