package io.dealmotion.autopilot.pipeline;

import java.time.Instant;
import java.util.UUID;

public record PrepRecord(
    UUID id,
    UUID userId,
    UUID organizationId,
    UUID prospectId,
    UUID meetingId,
    String status,
    Instant completedAt,
    Instant createdAt) {}
