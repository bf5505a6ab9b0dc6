package org.codeforiati.stats.domain.record;

import java.util.Objects;

/**
 * Identifies the source file and publishing organisation a record belongs to.
 *
 * @param publisher publisher registry identifier
 * @param file source file name, unique within the publisher
 * @since 0.1.0
 */
public record GroupingKey(String publisher, String file) {
  public GroupingKey {
    Objects.requireNonNull(publisher, "publisher");
    Objects.requireNonNull(file, "file");
  }
}
