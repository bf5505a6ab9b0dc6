package org.codeforiati.stats.application.leaf;

import static org.codeforiati.stats.domain.stats.StatisticDeclaration.summed;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.codeforiati.stats.domain.reference.CodelistMapping;
import org.codeforiati.stats.domain.stats.Counter1;
import org.codeforiati.stats.domain.stats.Counter2;
import org.codeforiati.stats.domain.stats.Counter3;
import org.codeforiati.stats.domain.stats.Shape;
import org.codeforiati.stats.domain.stats.StatResult;
import org.codeforiati.stats.domain.stats.StatisticDeclaration;

/**
 * <strong>What:</strong> Which coded values each activity uses, per codelist usage location.
 * <p><strong>How:</strong> Every {@link CodelistMapping} loaded for the record's major version selects values
 * from the activity; counts are keyed by the mapping's path key, then by value. Summing over a file gives the
 * file's usage counts.</p>
 *
 * @since 0.1.0
 */
public final class CodelistStatistics {
  private CodelistStatistics() {}

  public static List<StatisticDeclaration<LeafContext>> declarations() {
    return List.of(
        summed("codelist_values", Shape.COUNTER2, CodelistStatistics::codelistValues),
        summed("codelist_values_by_major_version", Shape.COUNTER3, CodelistStatistics::byMajorVersion));
  }

  static StatResult codelistValues(LeafContext ctx) {
    Counter2.Builder out = Counter2.builder();
    for (CodelistMapping mapping : ctx.tables().codelistMappings(ctx.facts().majorVersion())) {
      for (String value : mapping.values(ctx.element())) {
        out.add(mapping.key(), value, 1);
      }
    }
    return out.build();
  }

  static StatResult byMajorVersion(LeafContext ctx) {
    Counter2 values = (Counter2) ctx.statistic("codelist_values");
    Counter3.Builder out = Counter3.builder();
    String major = ctx.facts().majorVersion();
    for (Map.Entry<String, Counter1> path : values.values().entrySet()) {
      for (Map.Entry<String, BigDecimal> value : path.getValue().values().entrySet()) {
        out.add(major, path.getKey(), value.getKey(), value.getValue());
      }
    }
    return out.build();
  }
}
