package org.codeforiati.stats.application.leaf;

import java.math.BigDecimal;
import java.util.Map;
import org.codeforiati.stats.application.merge.ShapeMerger;
import org.codeforiati.stats.domain.record.Node;
import org.codeforiati.stats.domain.stats.Counter1;

/**
 * Counts element and attribute paths in a record tree.
 *
 * <p>Paths look like {@code iati-activity/transaction/value/@currency}. Attributes with an empty value are not
 * counted.</p>
 */
public final class ElementCounter {
  private ElementCounter() {
    // Utility
  }

  /**
   * Counts every occurrence of every path below {@code element}.
   *
   * @param element subtree root
   * @param path path of {@code element} itself
   * @return path to occurrence count
   */
  public static Counter1 countOccurrences(Node element, String path) {
    Counter1.Builder own = Counter1.builder().add(path, 1);
    for (Map.Entry<String, String> attribute : element.attributes().entrySet()) {
      if (!attribute.getValue().isEmpty()) {
        own.add(path + "/@" + attribute.getKey(), 1);
      }
    }
    Counter1 result = own.build();
    for (Node child : element.children()) {
      result = (Counter1) ShapeMerger.merge(result, countOccurrences(child, path + "/" + child.tag()));
    }
    return result;
  }

  /**
   * Reduces occurrence counts to presence: each counted path maps to one.
   *
   * @param occurrences result of {@link #countOccurrences(Node, String)}
   * @return path to {@code 1}
   */
  public static Counter1 presence(Counter1 occurrences) {
    Counter1.Builder out = Counter1.builder();
    for (String path : occurrences.values().keySet()) {
      out.put(path, BigDecimal.ONE);
    }
    return out.build();
  }
}
