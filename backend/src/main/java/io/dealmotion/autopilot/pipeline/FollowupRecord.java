package io.dealmotion.autopilot.pipeline;

import java.time.Instant;
import java.util.UUID;

public record FollowupRecord(
    UUID id,
    UUID userId,
    UUID organizationId,
    UUID prospectId,
    UUID meetingId,
    String status,
    String executiveSummary,
    int actionItemCount,
    Instant completedAt,
    Instant createdAt) {

  public boolean hasExecutiveSummary() {
    return executiveSummary != null && !executiveSummary.isBlank();
  }
}
