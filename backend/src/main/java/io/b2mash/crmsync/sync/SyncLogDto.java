package io.b2mash.crmsync.sync;

import java.time.Instant;
import java.util.UUID;

public record SyncLogDto(
    UUID id,
    UUID integrationId,
    String crmType,
    String operationType,
    String entityType,
    String entityId,
    String status,
    Integer statusCode,
    String errorType,
    String errorMessage,
    int retryCount,
    Long durationMs,
    Instant requestStartedAt,
    Instant requestCompletedAt) {

  public static SyncLogDto from(SyncLog entry) {
    return new SyncLogDto(
        entry.getId(),
        entry.getIntegrationId(),
        entry.getCrmType().slug(),
        entry.getOperationType().name().toLowerCase(),
        entry.getEntityType(),
        entry.getEntityId(),
        entry.getStatus().name().toLowerCase(),
        entry.getStatusCode(),
        entry.getErrorType(),
        entry.getErrorMessage(),
        entry.getRetryCount(),
        entry.getDurationMs(),
        entry.getRequestStartedAt(),
        entry.getRequestCompletedAt());
  }
}
