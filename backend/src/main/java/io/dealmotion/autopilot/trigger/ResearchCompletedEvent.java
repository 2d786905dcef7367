package io.dealmotion.autopilot.trigger;

import java.util.UUID;

/** Published when a research brief for one of the user's prospects completes. */
public record ResearchCompletedEvent(UUID userId, UUID organizationId, UUID researchId) {}
