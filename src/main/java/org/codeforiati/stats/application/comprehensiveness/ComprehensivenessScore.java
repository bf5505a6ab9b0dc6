package org.codeforiati.stats.application.comprehensiveness;

import java.util.Objects;
import org.codeforiati.stats.domain.stats.Counter1;

/**
 * Comprehensiveness outcome for one record.
 *
 * @param status current-activity classification
 * @param presence criterion to 0/1 numerator using presence tests
 * @param validity criterion to 0/1 numerator using validity tests
 * @param denominators criterion to 0/1 for criteria with a denominator override
 * @since 0.1.0
 */
public record ComprehensivenessScore(
    CurrentStatus status, Counter1 presence, Counter1 validity, Counter1 denominators) {

  public static final ComprehensivenessScore NOT_CURRENT =
      new ComprehensivenessScore(CurrentStatus.NOT_CURRENT, Counter1.EMPTY, Counter1.EMPTY, Counter1.EMPTY);

  public ComprehensivenessScore {
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(presence, "presence");
    Objects.requireNonNull(validity, "validity");
    Objects.requireNonNull(denominators, "denominators");
  }

  /** Default denominator: one for current records, zero otherwise. */
  public int defaultDenominator() {
    return status.isCurrent() ? 1 : 0;
  }
}
