package org.codeforiati.stats.infrastructure.time;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDate;
import org.codeforiati.stats.application.port.ClockPort;
import org.junit.jupiter.api.Test;

class SystemClockAdapterTest {

  @Test
  void pinnedDateIsReportedRegardlessOfClock() {
    LocalDate pinned = LocalDate.of(2024, 3, 15);

    assertEquals(pinned, new SystemClockAdapter(pinned).today());
  }

  @Test
  void unpinnedAdapterFollowsSystemClock() {
    SystemClockAdapter adapter = new SystemClockAdapter();
    long before = System.currentTimeMillis();
    long now = adapter.nowMillis();

    assertTrue(now >= before);
    assertTrue(Math.abs(adapter.today().toEpochDay() - ClockPort.SYSTEM.today().toEpochDay()) <= 1);
  }

  @Test
  void fixedClockStartsAtMidnightUtc() {
    ClockPort clock = ClockPort.fixed(LocalDate.of(2020, 2, 29));

    assertEquals(LocalDate.of(2020, 2, 29), clock.today());
  }
}
