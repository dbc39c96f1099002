package io.b2mash.crmsync.audit;

import java.util.List;
import java.util.UUID;

/** Records lifecycle events for CRM integrations. */
public interface AuditService {

  /**
   * Records a single audit event within the current transaction. If the enclosing transaction rolls
   * back, the audit event is rolled back too.
   */
  void log(AuditEventRecord record);

  /** Events recorded for one entity, oldest first. */
  List<AuditEvent> findForEntity(UUID entityId);
}
