package org.codeforiati.stats.application.comprehensiveness;

/**
 * Why an activity counts as current for comprehensiveness scoring.
 *
 * <p>Codes are reported by {@code comprehensiveness_current_activities}.</p>
 */
public enum CurrentStatus {
  NOT_CURRENT(0),
  /** No planned end date and status implementation or post-completion. */
  BY_STATUS(1),
  /** An actual end date within the last year. */
  BY_RECENT_ACTUAL_END(2),
  /** A planned end date today or later. */
  BY_FUTURE_PLANNED_END(3);

  private final int code;

  CurrentStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public boolean isCurrent() {
    return this != NOT_CURRENT;
  }
}
