package io.dealmotion.autopilot.pipeline;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

public record MeetingRecord(
    UUID id,
    UUID userId,
    UUID organizationId,
    UUID prospectId,
    String title,
    Instant startTime,
    Instant endTime,
    String status) {

  public double hoursUntilStart(Instant now) {
    return Duration.between(now, startTime).toMinutes() / 60.0;
  }
}
