package org.codeforiati.stats.infrastructure.time;

import java.time.LocalDate;
import org.codeforiati.stats.application.port.ClockPort;

/**
 * {@link ClockPort} backed by the system clock, optionally pinned to a configured evaluation date.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  private final LocalDate pinnedToday;

  /** Creates an adapter reporting the real date. */
  public SystemClockAdapter() {
    this(null);
  }

  /**
   * Creates an adapter.
   *
   * @param pinnedToday date reported by {@link #today()}; {@code null} to follow the system clock
   */
  public SystemClockAdapter(LocalDate pinnedToday) {
    this.pinnedToday = pinnedToday;
  }

  @Override
  public long nowMillis() {
    return System.currentTimeMillis();
  }

  @Override
  public LocalDate today() {
    return pinnedToday != null ? pinnedToday : ClockPort.super.today();
  }
}
