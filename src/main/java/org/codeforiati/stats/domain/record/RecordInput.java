package org.codeforiati.stats.domain.record;

import java.util.Objects;

/**
 * One unit of work handed to the aggregation pipeline by the external parser.
 *
 * <p>The element is not checked here. Well-formedness is established by {@link Record#of} so that a
 * malformed element surfaces as a skipped record instead of failing submission.</p>
 *
 * @param element root element of the record, possibly malformed
 * @param documentVersion version declared by the enclosing document, may be {@code null}
 * @param key grouping key for file and publisher folds
 * @since 0.1.0
 */
public record RecordInput(Node element, String documentVersion, GroupingKey key) {
  public RecordInput {
    Objects.requireNonNull(key, "key");
  }
}
