package org.codeforiati.stats.application.pipeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import org.codeforiati.stats.domain.record.GroupingKey;
import org.codeforiati.stats.domain.stats.Aggregate;

/**
 * Result of one corpus run.
 *
 * @param files closed aggregate per source file, in first-seen order
 * @param publishers closed aggregate per publisher
 * @param corpus closed aggregate of the whole corpus
 * @since 0.1.0
 */
public record CorpusReport(
    Map<GroupingKey, Aggregate> files, SortedMap<String, Aggregate> publishers, Aggregate corpus) {

  public CorpusReport {
    files = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(files, "files")));
    publishers = Collections.unmodifiableSortedMap(new TreeMap<>(Objects.requireNonNull(publishers, "publishers")));
    Objects.requireNonNull(corpus, "corpus");
  }

  /** Records that could not be evaluated. */
  public long skippedRecords() {
    return corpus.skippedRecords();
  }

  public Aggregate publisher(String publisher) {
    return publishers.get(publisher);
  }
}
