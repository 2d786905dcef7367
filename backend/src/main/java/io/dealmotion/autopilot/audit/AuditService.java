package io.dealmotion.autopilot.audit;

import java.util.List;
import java.util.UUID;

/** Records and reads the audit trail of proposal and settings changes. */
public interface AuditService {

  /**
   * Records a single audit event within the current transaction. If the enclosing transaction rolls
   * back, the audit event is also rolled back.
   */
  void log(AuditEventRecord record);

  /** Returns the events recorded for one entity, oldest first. */
  List<AuditEvent> findByEntity(String entityType, UUID entityId);
}
