package io.dealmotion.autopilot.pipeline;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;

public record ProspectRecord(
    UUID id,
    UUID organizationId,
    String companyName,
    String status,
    BigDecimal dealValue,
    Instant lastActivityAt,
    Instant createdAt) {

  public static final Set<String> CLOSED_STATUSES = Set.of("won", "lost", "inactive");

  public boolean isActive() {
    return !CLOSED_STATUSES.contains(status);
  }

  /** Whole days since the last recorded activity, falling back to the creation time. */
  public int daysSilent(Instant now) {
    var last = lastActivityAt != null ? lastActivityAt : createdAt;
    if (last == null || last.isAfter(now)) {
      return 0;
    }
    return (int) Duration.between(last, now).toDays();
  }
}
