package io.dealmotion.autopilot.lifecycle;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;

/** Snooze presets offered to the owner, resolved in the engine's configured zone. */
public enum SnoozeOption {
  LATER_TODAY {
    @Override
    public Instant resolve(Instant now, ZoneId zone, int morningHour) {
      return now.plus(Duration.ofHours(4));
    }
  },
  TOMORROW_MORNING {
    @Override
    public Instant resolve(Instant now, ZoneId zone, int morningHour) {
      var tomorrow = now.atZone(zone).toLocalDate().plusDays(1);
      return tomorrow.atTime(LocalTime.of(morningHour, 0)).atZone(zone).toInstant();
    }
  },
  NEXT_WORKING_DAY {
    @Override
    public Instant resolve(Instant now, ZoneId zone, int morningHour) {
      var day = now.atZone(zone).toLocalDate().plusDays(1);
      while (day.getDayOfWeek() == DayOfWeek.SATURDAY || day.getDayOfWeek() == DayOfWeek.SUNDAY) {
        day = day.plusDays(1);
      }
      return day.atTime(LocalTime.of(morningHour, 0)).atZone(zone).toInstant();
    }
  };

  public abstract Instant resolve(Instant now, ZoneId zone, int morningHour);
}
