package org.codeforiati.stats.application.leaf;

import static org.codeforiati.stats.domain.stats.StatisticDeclaration.derived;
import static org.codeforiati.stats.domain.stats.StatisticDeclaration.summed;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.codeforiati.stats.domain.record.Node;
import org.codeforiati.stats.domain.stats.Counter1;
import org.codeforiati.stats.domain.stats.Counter2;
import org.codeforiati.stats.domain.stats.Shape;
import org.codeforiati.stats.domain.stats.StatResult;
import org.codeforiati.stats.domain.stats.StatisticDeclaration;

/**
 * Statistics shared by activity and organisation records.
 *
 * @since 0.1.0
 */
public final class CommonStatistics {
  /** Raw document version per record; feeds the file level {@code versions} statistic. */
  public static final String DOCUMENT_VERSIONS = "_document_versions";

  /** Versions whose schema is addressed under the legacy version name. */
  private static final Set<String> LEGACY_SCHEMA_ALIASES = Set.of("1", "1.0", "1.00");

  private CommonStatistics() {}

  public static List<StatisticDeclaration<LeafContext>> declarations() {
    return List.of(
        derived("iati_identifier", Shape.COUNTER1, CommonStatistics::iatiIdentifier),
        summed("reporting_orgs", Shape.COUNTER1, CommonStatistics::reportingOrgs),
        summed("participating_orgs", Shape.COUNTER1, CommonStatistics::participatingOrgs),
        summed("participating_orgs_text", Shape.COUNTER2, CommonStatistics::participatingOrgsText),
        summed("participating_orgs_by_role", Shape.COUNTER2, CommonStatistics::participatingOrgsByRole),
        summed("element_versions", Shape.COUNTER1, ctx -> Counter1.label(ctx.element().attribute("version"))),
        summed("version", Shape.COUNTER1, ctx -> Counter1.label(ctx.facts().version())),
        summed("major_version", Shape.COUNTER1, ctx -> Counter1.label(ctx.facts().majorVersion())),
        summed("version_mismatch", Shape.COUNTER1, CommonStatistics::versionMismatch),
        summed("validation", Shape.COUNTER1, CommonStatistics::validation),
        summed(DOCUMENT_VERSIONS, Shape.COUNTER1, ctx -> Counter1.label(ctx.record().documentVersion())));
  }

  static StatResult iatiIdentifier(LeafContext ctx) {
    Node id = ctx.element().child("iati-identifier");
    return id == null ? Counter1.EMPTY : Counter1.label(id.text());
  }

  static StatResult reportingOrgs(LeafContext ctx) {
    Node org = ctx.element().child("reporting-org");
    return Counter1.label(org == null ? null : org.attribute("ref"));
  }

  static StatResult participatingOrgs(LeafContext ctx) {
    Counter1.Builder out = Counter1.builder();
    for (Node org : ctx.element().children("participating-org")) {
      out.put(org.attribute("ref"), 1);
    }
    return out.build();
  }

  // One entry per ref; a later element with the same ref replaces an earlier one.
  static StatResult participatingOrgsText(LeafContext ctx) {
    Map<String, String> textByRef = new LinkedHashMap<>();
    for (Node org : ctx.element().children("participating-org")) {
      textByRef.put(org.attribute("ref"), org.text());
    }
    Counter2.Builder out = Counter2.builder();
    textByRef.forEach((ref, text) -> out.add(ref, text, 1));
    return out.build();
  }

  static StatResult participatingOrgsByRole(LeafContext ctx) {
    Map<String, String> refByRole = new LinkedHashMap<>();
    for (Node org : ctx.element().children("participating-org")) {
      refByRole.put(org.attribute("role"), org.attribute("ref"));
    }
    Counter2.Builder out = Counter2.builder();
    refByRole.forEach((role, ref) -> out.add(role, ref, 1));
    return out.build();
  }

  /**
   * {@code true} when the document version is missing or unrecognised, or the record's own {@code @version}
   * disagrees with it.
   */
  static StatResult versionMismatch(LeafContext ctx) {
    String documentVersion = ctx.record().documentVersion();
    String elementVersion = ctx.element().attribute("version");
    boolean mismatch = !ctx.facts().versionRecognised()
        || (elementVersion != null && !elementVersion.equals(documentVersion));
    return Counter1.label(mismatch ? "true" : "false");
  }

  static StatResult validation(LeafContext ctx) {
    String version = ctx.record().documentVersion();
    if (version == null || LEGACY_SCHEMA_ALIASES.contains(version)) {
      version = ctx.settings().legacyVersion();
    }
    return Counter1.label(ctx.validator().isValid(ctx.record(), version) ? "pass" : "fail");
  }
}
