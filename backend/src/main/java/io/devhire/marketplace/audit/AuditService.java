package io.devhire.marketplace.audit;

import java.util.List;
import java.util.UUID;

/** Service interface for recording and querying audit events. */
public interface AuditService {

  /**
   * Records a single audit event within the current transaction. If the enclosing transaction rolls
   * back, the audit event is also rolled back (no REQUIRES_NEW).
   *
   * @param record the audit event data to persist
   */
  void log(AuditEventRecord record);

  /** Returns the trail of a single entity, oldest first. */
  List<AuditEvent> findByEntity(String entityType, UUID entityId);
}
