package io.dealmotion.autopilot.pipeline;

import java.time.Instant;
import java.util.UUID;

public record OutreachRecord(
    UUID id,
    UUID userId,
    UUID organizationId,
    UUID prospectId,
    UUID contactId,
    String status,
    Instant sentAt,
    Instant createdAt) {}
