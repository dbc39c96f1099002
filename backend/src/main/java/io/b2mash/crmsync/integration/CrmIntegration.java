package io.b2mash.crmsync.integration;

import io.b2mash.crmsync.integration.secret.EncryptedCredentials;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * An owner's connection to one CRM. At most one row exists per (owner, CRM type); disconnecting
 * keeps the row with {@code active = false} so it can be reconnected later.
 */
@Entity
@Table(name = "crm_integrations")
public class CrmIntegration {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "owner_id", nullable = false, updatable = false)
  private UUID ownerId;

  @Enumerated(EnumType.STRING)
  @Column(name = "crm_type", nullable = false, updatable = false, length = 30)
  private CrmType crmType;

  @Column(name = "encrypted_credentials", nullable = false, columnDefinition = "TEXT")
  private String encryptedCredentials;

  @Column(name = "credentials_iv", nullable = false, length = 24)
  private String credentialsIv;

  @Column(name = "key_version", nullable = false)
  private int keyVersion;

  @Column(name = "credential_hint", length = 20)
  private String credentialHint;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "settings", nullable = false, columnDefinition = "jsonb")
  private String settingsJson;

  @Column(name = "active", nullable = false)
  private boolean active;

  @Enumerated(EnumType.STRING)
  @Column(name = "sync_status", nullable = false, length = 20)
  private SyncStatus syncStatus;

  @Column(name = "sync_error", columnDefinition = "TEXT")
  private String syncError;

  @Column(name = "last_sync_at")
  private Instant lastSyncAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected CrmIntegration() {}

  public CrmIntegration(
      UUID ownerId,
      CrmType crmType,
      EncryptedCredentials credentials,
      String credentialHint,
      String settingsJson) {
    this.ownerId = ownerId;
    this.crmType = crmType;
    replaceCredentials(credentials, credentialHint);
    this.settingsJson = settingsJson;
    this.active = true;
    this.syncStatus = SyncStatus.CONNECTED;
  }

  @PrePersist
  void onPrePersist() {
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  @PreUpdate
  void onPreUpdate() {
    this.updatedAt = Instant.now();
  }

  public void replaceCredentials(EncryptedCredentials credentials, String credentialHint) {
    this.encryptedCredentials = credentials.ciphertext();
    this.credentialsIv = credentials.iv();
    this.keyVersion = credentials.keyVersion();
    this.credentialHint = credentialHint;
  }

  public void updateSettings(String settingsJson) {
    this.settingsJson = settingsJson;
  }

  public void disconnect() {
    this.active = false;
    this.syncStatus = SyncStatus.DISCONNECTED;
  }

  /** Reactivates the integration and clears any error left by an earlier sync. */
  public void reconnect() {
    this.active = true;
    this.syncStatus = SyncStatus.CONNECTED;
    this.syncError = null;
  }

  public void recordSyncSuccess(Instant syncedAt) {
    this.lastSyncAt = syncedAt;
    this.syncStatus = SyncStatus.CONNECTED;
    this.syncError = null;
  }

  public void recordSyncFailure(String error) {
    this.syncStatus = SyncStatus.ERROR;
    this.syncError = error;
  }

  public UUID getId() {
    return id;
  }

  public UUID getOwnerId() {
    return ownerId;
  }

  public CrmType getCrmType() {
    return crmType;
  }

  public EncryptedCredentials getEncryptedCredentials() {
    return new EncryptedCredentials(encryptedCredentials, credentialsIv, keyVersion);
  }

  public String getCredentialHint() {
    return credentialHint;
  }

  public String getSettingsJson() {
    return settingsJson;
  }

  public boolean isActive() {
    return active;
  }

  public SyncStatus getSyncStatus() {
    return syncStatus;
  }

  public String getSyncError() {
    return syncError;
  }

  public Instant getLastSyncAt() {
    return lastSyncAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
