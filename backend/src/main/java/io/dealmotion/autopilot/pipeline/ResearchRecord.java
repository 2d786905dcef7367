package io.dealmotion.autopilot.pipeline;

import java.time.Instant;
import java.util.UUID;

public record ResearchRecord(
    UUID id,
    UUID userId,
    UUID organizationId,
    UUID prospectId,
    String companyName,
    String status,
    Instant completedAt,
    Instant createdAt) {}
