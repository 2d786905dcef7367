package io.dealmotion.autopilot.audit;

import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Fluent builder for {@link AuditEventRecord}. The actor type defaults to "USER" when an actor id
 * is given and "SYSTEM" otherwise; the source defaults to "INTERNAL".
 *
 * <pre>{@code
 * auditService.log(
 *     AuditEventBuilder.builder()
 *         .eventType("autopilot_proposal.accepted")
 *         .entityType("autopilot_proposal")
 *         .entityId(proposal.getId())
 *         .actorId(owner.userId())
 *         .details(Map.of("type", proposal.getType().key()))
 *         .build());
 * }</pre>
 */
public class AuditEventBuilder {

  private String eventType;
  private String entityType;
  private UUID entityId;
  private UUID actorId;
  private String actorType;
  private String source;
  private Map<String, Object> details;

  private AuditEventBuilder() {}

  public static AuditEventBuilder builder() {
    return new AuditEventBuilder();
  }

  public AuditEventBuilder eventType(String eventType) {
    this.eventType = eventType;
    return this;
  }

  public AuditEventBuilder entityType(String entityType) {
    this.entityType = entityType;
    return this;
  }

  public AuditEventBuilder entityId(UUID entityId) {
    this.entityId = entityId;
    return this;
  }

  public AuditEventBuilder actorId(UUID actorId) {
    this.actorId = actorId;
    return this;
  }

  public AuditEventBuilder actorType(String actorType) {
    this.actorType = actorType;
    return this;
  }

  public AuditEventBuilder source(String source) {
    this.source = source;
    return this;
  }

  public AuditEventBuilder details(Map<String, Object> details) {
    this.details = details;
    return this;
  }

  public AuditEventRecord build() {
    Objects.requireNonNull(eventType, "eventType must not be null");
    Objects.requireNonNull(entityType, "entityType must not be null");
    Objects.requireNonNull(entityId, "entityId must not be null");
    String resolvedActorType = actorType != null ? actorType : actorId != null ? "USER" : "SYSTEM";
    String resolvedSource = source != null ? source : "INTERNAL";
    return new AuditEventRecord(
        eventType,
        entityType,
        entityId,
        actorId,
        resolvedActorType,
        resolvedSource,
        details != null ? details : Map.of());
  }
}
