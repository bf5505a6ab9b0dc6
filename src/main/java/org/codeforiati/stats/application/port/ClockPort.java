package org.codeforiati.stats.application.port;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * <strong>What:</strong> Port supplying the evaluation date to date-sensitive statistics.
 * <p><strong>Why:</strong> Current-activity classification, timeliness and forward-looking statistics depend on
 * "today"; pinning it makes corpus runs reproducible.</p>
 * <p><strong>Role:</strong> Port consumed by the leaf and group evaluation contexts.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; the date is read once per run.</p>
 *
 * @implNote Default {@link #today()} derives the UTC calendar date from {@link #nowMillis()}.
 * @since 0.1.0
 * @see org.codeforiati.stats.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /**
   * Returns the evaluation date.
   *
   * @return UTC calendar date of {@link #nowMillis()}
   */
  default LocalDate today() {
    return Instant.ofEpochMilli(nowMillis()).atZone(ZoneOffset.UTC).toLocalDate();
  }

  /**
   * Clock frozen at the start of the given date.
   *
   * @param date date to report
   * @return fixed clock
   */
  static ClockPort fixed(LocalDate date) {
    long millis = date.atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
    return () -> millis;
  }

  /** Default {@link ClockPort} using {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
