package io.b2mash.crmsync.integration;

import java.time.Instant;
import java.util.UUID;

/** API view of an integration. Credentials never leave the service; only a masked hint does. */
public record CrmIntegrationDto(
    UUID id,
    UUID ownerId,
    String crmType,
    boolean active,
    String syncStatus,
    String syncError,
    Instant lastSyncAt,
    String credentialHint,
    IntegrationSettings settings,
    Instant createdAt,
    Instant updatedAt) {

  public static CrmIntegrationDto from(CrmIntegration entity, IntegrationSettings settings) {
    return new CrmIntegrationDto(
        entity.getId(),
        entity.getOwnerId(),
        entity.getCrmType().slug(),
        entity.isActive(),
        entity.getSyncStatus().value(),
        entity.getSyncError(),
        entity.getLastSyncAt(),
        entity.getCredentialHint(),
        settings,
        entity.getCreatedAt(),
        entity.getUpdatedAt());
  }
}
