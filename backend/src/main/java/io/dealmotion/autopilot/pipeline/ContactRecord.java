package io.dealmotion.autopilot.pipeline;

import java.time.Instant;
import java.util.UUID;

public record ContactRecord(
    UUID id, UUID prospectId, UUID organizationId, String name, Instant createdAt) {}
