package io.b2mash.crmsync.audit;

import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import tools.jackson.databind.ObjectMapper;

/**
 * Database-backed {@link AuditService}. {@code log()} participates in the caller's transaction (no
 * REQUIRES_NEW).
 */
@Service
public class DatabaseAuditService implements AuditService {

  private static final Logger log = LoggerFactory.getLogger(DatabaseAuditService.class);

  private final AuditEventRepository auditEventRepository;
  private final ObjectMapper objectMapper;

  public DatabaseAuditService(
      AuditEventRepository auditEventRepository, ObjectMapper objectMapper) {
    this.auditEventRepository = auditEventRepository;
    this.objectMapper = objectMapper;
  }

  @Override
  @Transactional
  public void log(AuditEventRecord record) {
    var event = new AuditEvent(record, objectMapper.writeValueAsString(record.details()));
    auditEventRepository.save(event);
    log.debug(
        "Audit event recorded: type={}, entity={}/{}",
        record.eventType(),
        record.entityType(),
        record.entityId());
  }

  @Override
  @Transactional(readOnly = true)
  public List<AuditEvent> findForEntity(UUID entityId) {
    return auditEventRepository.findByEntityIdOrderByOccurredAtAsc(entityId);
  }
}
