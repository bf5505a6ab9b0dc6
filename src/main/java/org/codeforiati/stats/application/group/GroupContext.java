package org.codeforiati.stats.application.group;

import java.time.LocalDate;
import java.util.Objects;
import org.codeforiati.stats.domain.currency.CurrencyConverter;
import org.codeforiati.stats.domain.reference.ReferenceTables;
import org.codeforiati.stats.domain.stats.Aggregate;
import org.codeforiati.stats.domain.stats.HierarchyLevel;

/**
 * Input of a group statistic: the folded aggregate of one hierarchy node and its identity.
 *
 * @param level hierarchy level being closed
 * @param aggregate folded statistics of every record below this node
 * @param publisher publisher identifier; {@code null} at corpus level
 * @param file source file name; {@code null} above file level
 * @param today evaluation date
 * @param tables shared reference data
 * @param converter USD converter
 * @since 0.1.0
 */
public record GroupContext(
    HierarchyLevel level,
    Aggregate aggregate,
    String publisher,
    String file,
    LocalDate today,
    ReferenceTables tables,
    CurrencyConverter converter) {

  public GroupContext {
    Objects.requireNonNull(level, "level");
    Objects.requireNonNull(aggregate, "aggregate");
    Objects.requireNonNull(today, "today");
    Objects.requireNonNull(tables, "tables");
    Objects.requireNonNull(converter, "converter");
  }

  /** Returns a copy describing another node at the same level. */
  public GroupContext forNode(Aggregate nodeAggregate, String nodePublisher, String nodeFile) {
    return new GroupContext(level, nodeAggregate, nodePublisher, nodeFile, today, tables, converter);
  }
}
