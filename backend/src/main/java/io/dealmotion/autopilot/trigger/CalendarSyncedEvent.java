package io.dealmotion.autopilot.trigger;

import java.util.UUID;

/** Published by calendar ingestion once a user's meetings have been synced. */
public record CalendarSyncedEvent(UUID userId, UUID organizationId) {}
