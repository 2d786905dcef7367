package io.dealmotion.autopilot.audit;

import java.util.Map;
import java.util.UUID;

/**
 * Non-JPA value passed to {@link AuditService#log(AuditEventRecord)}. Built with {@link
 * AuditEventBuilder}.
 *
 * @param eventType event type following the {@code {entity}.{action}} convention
 * @param entityType the kind of entity being audited (e.g. "autopilot_proposal")
 * @param entityId id of the audited entity
 * @param actorId user who triggered the change, or null for system actors
 * @param actorType "USER" or "SYSTEM"
 * @param source where the change originated ("USER_ACTION", "DETECTION", "WATCHDOG", ...)
 * @param details free-form details stored as JSON
 */
public record AuditEventRecord(
    String eventType,
    String entityType,
    UUID entityId,
    UUID actorId,
    String actorType,
    String source,
    Map<String, Object> details) {}
