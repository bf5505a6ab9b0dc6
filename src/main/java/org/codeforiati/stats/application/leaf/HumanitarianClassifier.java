package org.codeforiati.stats.application.leaf;

import static org.codeforiati.stats.domain.stats.StatisticDeclaration.summed;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.codeforiati.stats.domain.record.Node;
import org.codeforiati.stats.domain.stats.Counter1;
import org.codeforiati.stats.domain.stats.Shape;
import org.codeforiati.stats.domain.stats.StatResult;
import org.codeforiati.stats.domain.stats.StatisticDeclaration;

/**
 * <strong>What:</strong> Classifies an activity as humanitarian and reports related usage flags.
 * <p><strong>Rules:</strong>
 * <ul>
 *   <li>The {@code @humanitarian} flag counts only for versions 2.02 and 2.03, on the activity or on any
 *   transaction.</li>
 *   <li>Humanitarian DAC sectors count at activity level for every version and at transaction level for major
 *   version 2, skipping transactions explicitly flagged as not humanitarian.</li>
 *   <li>An explicit "not humanitarian" flag on the activity vetoes every positive signal. It is applied last.</li>
 * </ul>
 *
 * @since 0.1.0
 */
public final class HumanitarianClassifier {
  static final Set<String> SECTORS_DAC_5_DIGIT =
      Set.of("72010", "72011", "72012", "72040", "72050", "73010", "74010", "74020");
  static final Set<String> SECTORS_DAC_3_DIGIT = Set.of("720", "730", "740");
  private static final Set<String> FLAG_VERSIONS = Set.of("2.02", "2.03");
  private static final Set<String> TRUE_VALUES = Set.of("1", "true");
  private static final Set<String> FALSE_VALUES = Set.of("0", "false");

  private HumanitarianClassifier() {}

  public static List<StatisticDeclaration<LeafContext>> declarations() {
    return List.of(summed("humanitarian", Shape.COUNTER1, HumanitarianClassifier::classify));
  }

  static StatResult classify(LeafContext ctx) {
    ActivityFacts facts = ctx.facts();
    Node activity = ctx.element();
    boolean flagVersion = FLAG_VERSIONS.contains(facts.version());

    String activityFlag = activity.attribute("humanitarian");
    boolean flaggedActivity = activityFlag != null && TRUE_VALUES.contains(activityFlag);
    boolean flaggedNotHumanitarian = activityFlag != null && FALSE_VALUES.contains(activityFlag);
    boolean flaggedTransaction = false;
    for (String flag : activity.values("transaction/@humanitarian")) {
      flaggedTransaction |= TRUE_VALUES.contains(flag);
    }
    boolean byAttribute = flagVersion && (flaggedActivity || (flaggedTransaction && !flaggedNotHumanitarian));

    boolean bySectorActivity = hasSector(activity.children("sector"), facts);
    List<Node> transactionSectors = new ArrayList<>();
    for (Node transaction : activity.children("transaction")) {
      String flag = transaction.attribute("humanitarian");
      if (flag == null || !FALSE_VALUES.contains(flag)) {
        transactionSectors.addAll(transaction.children("sector"));
      }
    }
    boolean bySectorTransaction = hasSector(transactionSectors, facts);
    boolean bySector = bySectorActivity || (bySectorTransaction && !facts.isV1());

    boolean humanitarian = byAttribute || bySector;
    if (flaggedNotHumanitarian) {
      humanitarian = false;
    }

    boolean hasScope = allNonEmpty(activity.values("humanitarian-scope/@type"))
        && allNonEmpty(activity.values("humanitarian-scope/@code"));
    boolean clusters = activity.values("sector/@vocabulary").contains("10");
    List<String> scopeVocabularies = activity.values("humanitarian-scope/@vocabulary");
    boolean glide = scopeVocabularies.contains("1-2");
    boolean hrp = scopeVocabularies.contains("2-1");

    Counter1.Builder out = Counter1.builder()
        .put("is_humanitarian", flag(humanitarian))
        .put("is_humanitarian_by_attrib", flag(byAttribute));
    usage(out, "contains_humanitarian_scope", flagVersion && hasScope, humanitarian);
    usage(out, "uses_humanitarian_clusters_vocab", flagVersion && clusters, humanitarian);
    usage(out, "uses_humanitarian_glide_codes", flagVersion && glide, humanitarian);
    usage(out, "uses_humanitarian_hrp_codes", flagVersion && hrp, humanitarian);
    return out.build();
  }

  private static void usage(Counter1.Builder out, String name, boolean used, boolean humanitarian) {
    out.put(name, flag(used && humanitarian));
    out.put(name + "_without_humanitarian", flag(used && !humanitarian));
  }

  private static boolean hasSector(List<Node> sectors, ActivityFacts facts) {
    for (Node sector : sectors) {
      String vocabulary = sector.attribute("vocabulary");
      String code = sector.attribute("code");
      if (code == null) {
        continue;
      }
      if ((vocabulary == null || vocabulary.equals(facts.dac5Code())) && SECTORS_DAC_5_DIGIT.contains(code)) {
        return true;
      }
      if (facts.dac3Code().equals(vocabulary) && SECTORS_DAC_3_DIGIT.contains(code)) {
        return true;
      }
    }
    return false;
  }

  private static boolean allNonEmpty(List<String> values) {
    if (values.isEmpty()) {
      return false;
    }
    for (String value : values) {
      if (value.isEmpty()) {
        return false;
      }
    }
    return true;
  }

  private static long flag(boolean value) {
    return value ? 1 : 0;
  }
}
