package org.codeforiati.stats.application.group;

import java.math.BigDecimal;
import java.util.Map;
import java.util.function.Predicate;
import org.codeforiati.stats.domain.stats.Counter1;

/** Counter transformations shared by group statistics. */
final class GroupCounters {
  private GroupCounters() {
    // Utility
  }

  /** Every key of {@code counter} mapped to one. */
  static Counter1 presence(Counter1 counter) {
    Counter1.Builder out = Counter1.builder();
    counter.values().keySet().forEach(key -> out.put(key, 1));
    return out.build();
  }

  /** Entries of {@code counter} whose key passes {@code keep}. */
  static Counter1 filterKeys(Counter1 counter, Predicate<String> keep) {
    Counter1.Builder out = Counter1.builder();
    for (Map.Entry<String, BigDecimal> entry : counter.values().entrySet()) {
      if (keep.test(entry.getKey())) {
        out.put(entry.getKey(), entry.getValue());
      }
    }
    return out.build();
  }

  /** Entries counted more than once. */
  static Counter1 duplicates(Counter1 counter) {
    Counter1.Builder out = Counter1.builder();
    for (Map.Entry<String, BigDecimal> entry : counter.values().entrySet()) {
      if (entry.getValue().compareTo(BigDecimal.ONE) > 0) {
        out.put(entry.getKey(), entry.getValue());
      }
    }
    return out.build();
  }
}
