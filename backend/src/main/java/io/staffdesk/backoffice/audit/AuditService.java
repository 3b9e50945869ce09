package io.staffdesk.backoffice.audit;

import java.util.List;
import java.util.UUID;

/** Records and reads the activity trail of timesheet changes. */
public interface AuditService {

  /**
   * Records a single audit event within the current transaction. If the enclosing transaction rolls
   * back, the audit event is also rolled back.
   *
   * @param record the audit event data to persist
   */
  void log(AuditEventRecord record);

  /**
   * Returns the events recorded against one entity, newest first.
   *
   * @param entityType the kind of entity, e.g. "timesheet"
   * @param entityId the entity identifier
   */
  List<AuditEvent> findByEntity(String entityType, UUID entityId);
}
