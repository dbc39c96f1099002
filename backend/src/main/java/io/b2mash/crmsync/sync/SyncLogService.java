package io.b2mash.crmsync.sync;

import io.b2mash.crmsync.exception.ResourceNotFoundException;
import io.b2mash.crmsync.integration.CrmIntegration;
import io.b2mash.crmsync.integration.provider.TargetOutcome;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import tools.jackson.databind.ObjectMapper;

/**
 * Writes sync log rows. Opening and completing an entry each commit in their own transaction, so
 * log rows survive a rollback of whatever triggered the sync.
 */
@Service
public class SyncLogService {

  private final SyncLogRepository syncLogRepository;
  private final ObjectMapper objectMapper;

  public SyncLogService(SyncLogRepository syncLogRepository, ObjectMapper objectMapper) {
    this.syncLogRepository = syncLogRepository;
    this.objectMapper = objectMapper;
  }

  /** Inserts a PENDING entry capturing the outbound request and returns its id. */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public UUID open(
      CrmIntegration integration,
      SyncOperation operation,
      String entityType,
      String entityId,
      Object requestPayload) {
    var entry =
        new SyncLog(
            integration.getId(),
            integration.getOwnerId(),
            integration.getCrmType(),
            operation,
            entityType,
            entityId,
            objectMapper.writeValueAsString(requestPayload));
    return syncLogRepository.save(entry).getId();
  }

  /** Moves a PENDING entry to its terminal state. */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public void complete(UUID logId, TargetOutcome outcome) {
    var entry =
        syncLogRepository
            .findById(logId)
            .orElseThrow(() -> new ResourceNotFoundException("Sync log", logId));
    var completedAt = Instant.now();
    if (outcome.success()) {
      entry.markSucceeded(
          outcome.statusCode(), objectMapper.writeValueAsString(outcome.data()), completedAt);
    } else {
      entry.markFailed(outcome.statusCode(), outcome.errorType(), outcome.error(), completedAt);
    }
    syncLogRepository.save(entry);
  }

  @Transactional(readOnly = true)
  public Page<SyncLogDto> findForIntegration(UUID integrationId, Pageable pageable) {
    return syncLogRepository.findByIntegrationId(integrationId, pageable).map(SyncLogDto::from);
  }

  @Transactional(readOnly = true)
  public List<SyncLog> entriesFor(UUID integrationId) {
    return syncLogRepository.findByIntegrationIdOrderByCreatedAtAsc(integrationId);
  }
}
