package io.b2mash.crmsync.sync;

import io.b2mash.crmsync.integration.CrmType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * One outbound CRM call. Inserted as {@link SyncLogStatus#PENDING} before the request is sent and
 * moved exactly once to SUCCESS or FAILED afterwards; rows are never deleted.
 */
@Entity
@Table(name = "crm_sync_logs")
public class SyncLog {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "integration_id", nullable = false, updatable = false)
  private UUID integrationId;

  @Column(name = "owner_id", nullable = false, updatable = false)
  private UUID ownerId;

  @Enumerated(EnumType.STRING)
  @Column(name = "crm_type", nullable = false, updatable = false, length = 30)
  private CrmType crmType;

  @Enumerated(EnumType.STRING)
  @Column(name = "operation_type", nullable = false, updatable = false, length = 30)
  private SyncOperation operationType;

  @Column(name = "entity_type", nullable = false, updatable = false, length = 30)
  private String entityType;

  @Column(name = "entity_id", length = 320)
  private String entityId;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private SyncLogStatus status;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "request_payload", columnDefinition = "jsonb")
  private String requestPayload;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "response_payload", columnDefinition = "jsonb")
  private String responsePayload;

  @Column(name = "status_code")
  private Integer statusCode;

  @Column(name = "error_type", length = 30)
  private String errorType;

  @Column(name = "error_message", columnDefinition = "TEXT")
  private String errorMessage;

  @Column(name = "retry_count", nullable = false)
  private int retryCount;

  @Column(name = "duration_ms")
  private Long durationMs;

  @Column(name = "request_started_at", nullable = false, updatable = false)
  private Instant requestStartedAt;

  @Column(name = "request_completed_at")
  private Instant requestCompletedAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected SyncLog() {}

  public SyncLog(
      UUID integrationId,
      UUID ownerId,
      CrmType crmType,
      SyncOperation operationType,
      String entityType,
      String entityId,
      String requestPayload) {
    this.integrationId = integrationId;
    this.ownerId = ownerId;
    this.crmType = crmType;
    this.operationType = operationType;
    this.entityType = entityType;
    this.entityId = entityId;
    this.requestPayload = requestPayload;
    this.status = SyncLogStatus.PENDING;
    this.retryCount = 0;
    this.requestStartedAt = Instant.now();
  }

  @PrePersist
  void onPrePersist() {
    this.createdAt = Instant.now();
  }

  public void markSucceeded(Integer statusCode, String responsePayload, Instant completedAt) {
    complete(SyncLogStatus.SUCCESS, completedAt);
    this.statusCode = statusCode;
    this.responsePayload = responsePayload;
  }

  public void markFailed(
      Integer statusCode, String errorType, String errorMessage, Instant completedAt) {
    complete(SyncLogStatus.FAILED, completedAt);
    this.statusCode = statusCode;
    this.errorType = errorType;
    this.errorMessage = errorMessage;
  }

  private void complete(SyncLogStatus terminalStatus, Instant completedAt) {
    if (status != SyncLogStatus.PENDING) {
      throw new IllegalStateException("Sync log " + id + " is already " + status);
    }
    this.status = terminalStatus;
    this.requestCompletedAt = completedAt;
    this.durationMs = Math.max(0, Duration.between(requestStartedAt, completedAt).toMillis());
  }

  public UUID getId() {
    return id;
  }

  public UUID getIntegrationId() {
    return integrationId;
  }

  public UUID getOwnerId() {
    return ownerId;
  }

  public CrmType getCrmType() {
    return crmType;
  }

  public SyncOperation getOperationType() {
    return operationType;
  }

  public String getEntityType() {
    return entityType;
  }

  public String getEntityId() {
    return entityId;
  }

  public SyncLogStatus getStatus() {
    return status;
  }

  public String getRequestPayload() {
    return requestPayload;
  }

  public String getResponsePayload() {
    return responsePayload;
  }

  public Integer getStatusCode() {
    return statusCode;
  }

  public String getErrorType() {
    return errorType;
  }

  public String getErrorMessage() {
    return errorMessage;
  }

  public int getRetryCount() {
    return retryCount;
  }

  public Long getDurationMs() {
    return durationMs;
  }

  public Instant getRequestStartedAt() {
    return requestStartedAt;
  }

  public Instant getRequestCompletedAt() {
    return requestCompletedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
