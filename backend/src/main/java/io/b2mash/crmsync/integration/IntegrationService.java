package io.b2mash.crmsync.integration;

import io.b2mash.crmsync.audit.AuditEventBuilder;
import io.b2mash.crmsync.audit.AuditService;
import io.b2mash.crmsync.exception.InvalidStateException;
import io.b2mash.crmsync.exception.ResourceConflictException;
import io.b2mash.crmsync.exception.ResourceNotFoundException;
import io.b2mash.crmsync.integration.provider.CrmCredentials;
import io.b2mash.crmsync.integration.provider.ProviderManager;
import io.b2mash.crmsync.integration.secret.CredentialVault;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Owns the integration lifecycle: connect, update, reconnect, disconnect, status and listing.
 * Credentials are checked against the remote CRM before any row is written, and that remote call
 * runs outside the database transaction.
 */
@Service
public class IntegrationService {

  private static final Logger log = LoggerFactory.getLogger(IntegrationService.class);

  private static final String ENTITY_TYPE = "crm_integration";

  private final CrmIntegrationRepository integrationRepository;
  private final ProviderManager providerManager;
  private final CredentialVault credentialVault;
  private final IntegrationSettingsMapper settingsMapper;
  private final AuditService auditService;
  private final TransactionTemplate transactionTemplate;

  public IntegrationService(
      CrmIntegrationRepository integrationRepository,
      ProviderManager providerManager,
      CredentialVault credentialVault,
      IntegrationSettingsMapper settingsMapper,
      AuditService auditService,
      TransactionTemplate transactionTemplate) {
    this.integrationRepository = integrationRepository;
    this.providerManager = providerManager;
    this.credentialVault = credentialVault;
    this.settingsMapper = settingsMapper;
    this.auditService = auditService;
    this.transactionTemplate = transactionTemplate;
  }

  /** Checks credentials against the CRM without storing anything. */
  public CredentialValidationResult validateCredentials(
      CrmType crmType, Map<String, Object> credentials) {
    providerManager.validateCredentials(crmType, CrmCredentials.of(credentials));
    return new CredentialValidationResult(crmType.slug(), true, "Credentials are valid");
  }

  /**
   * Creates a new integration. Any existing row for the same owner and CRM, active or not, is a
   * conflict; a disconnected integration comes back through {@link #update} with {@code
   * reconnect}.
   */
  public CrmIntegrationDto connect(
      UUID ownerId,
      CrmType crmType,
      Map<String, Object> credentials,
      Map<String, Object> settingsPatch) {
    providerManager.get(crmType);
    if (integrationRepository.findByOwnerIdAndCrmType(ownerId, crmType).isPresent()) {
      throw alreadyExists(crmType);
    }

    var crmCredentials = CrmCredentials.of(credentials);
    providerManager.validateCredentials(crmType, crmCredentials);
    var sealed = credentialVault.encrypt(crmCredentials);
    var settings = settingsMapper.merge(IntegrationSettings.defaults(), settingsPatch);

    return transactionTemplate.execute(
        status -> {
          var integration =
              new CrmIntegration(
                  ownerId, crmType, sealed, crmCredentials.hint(), settingsMapper.toJson(settings));
          try {
            integration = integrationRepository.saveAndFlush(integration);
          } catch (DataIntegrityViolationException e) {
            log.warn("Concurrent connect for {} rejected: {}", crmType.slug(), e.getMessage());
            throw alreadyExists(crmType);
          }

          audit("integration.connected", integration, Map.of("crmType", crmType.slug()));
          log.info("Connected {} integration {}", crmType.slug(), integration.getId());
          return toDto(integration);
        });
  }

  /**
   * Updates credentials and/or settings. New credentials are validated before they replace the
   * stored ones. A disconnected integration can only be updated with {@code reconnect = true},
   * which also re-validates the stored credentials when no new ones are given.
   */
  public CrmIntegrationDto update(
      UUID ownerId,
      CrmType crmType,
      Map<String, Object> credentials,
      Map<String, Object> settingsPatch,
      boolean reconnect) {
    var existing = findOrThrow(ownerId, crmType);
    if (!existing.isActive() && !reconnect) {
      throw new InvalidStateException(
          "Integration disconnected",
          "The "
              + crmType.slug()
              + " integration is disconnected; update it with reconnect=true to reactivate it");
    }

    var newCredentials =
        credentials == null || credentials.isEmpty() ? null : CrmCredentials.of(credentials);
    if (newCredentials != null) {
      providerManager.validateCredentials(crmType, newCredentials);
    } else if (reconnect) {
      providerManager.validateCredentials(
          crmType, credentialVault.decrypt(existing.getEncryptedCredentials()));
    }
    var sealed = newCredentials != null ? credentialVault.encrypt(newCredentials) : null;

    return transactionTemplate.execute(
        status -> {
          var integration = findOrThrow(ownerId, crmType);
          boolean wasActive = integration.isActive();
          if (sealed != null) {
            integration.replaceCredentials(sealed, newCredentials.hint());
          }
          var settings =
              settingsMapper.merge(
                  settingsMapper.fromJson(integration.getSettingsJson()), settingsPatch);
          integration.updateSettings(settingsMapper.toJson(settings));
          if (reconnect) {
            integration.reconnect();
          }
          integration = integrationRepository.save(integration);

          audit(
              reconnect && !wasActive ? "integration.reconnected" : "integration.updated",
              integration,
              Map.of(
                  "crmType", crmType.slug(),
                  "credentialsRotated", sealed != null,
                  "settingsKeys",
                      settingsPatch == null ? List.of() : List.copyOf(settingsPatch.keySet())));
          return toDto(integration);
        });
  }

  /** Marks the active integration inactive; the row is kept for a later reconnect. */
  @Transactional
  public CrmIntegrationDto disconnect(UUID ownerId, CrmType crmType) {
    var integration =
        integrationRepository
            .findByOwnerIdAndCrmType(ownerId, crmType)
            .filter(CrmIntegration::isActive)
            .orElseThrow(
                () ->
                    ResourceNotFoundException.withDetail(
                        "Integration not found",
                        "No active " + crmType.slug() + " integration found"));

    integration.disconnect();
    integration = integrationRepository.save(integration);

    audit("integration.disconnected", integration, Map.of("crmType", crmType.slug()));
    log.info("Disconnected {} integration {}", crmType.slug(), integration.getId());
    return toDto(integration);
  }

  /** The integration for this owner and CRM in whatever state it is, or empty if none exists. */
  @Transactional(readOnly = true)
  public Optional<CrmIntegrationDto> status(UUID ownerId, CrmType crmType) {
    return integrationRepository.findByOwnerIdAndCrmType(ownerId, crmType).map(this::toDto);
  }

  /** All of the owner's integrations, active and inactive, newest first. */
  @Transactional(readOnly = true)
  public List<CrmIntegrationDto> list(UUID ownerId) {
    return integrationRepository.findByOwnerIdOrderByCreatedAtDesc(ownerId).stream()
        .map(this::toDto)
        .toList();
  }

  /** Active integrations of the owner, optionally restricted to the given CRM types. */
  @Transactional(readOnly = true)
  public List<CrmIntegration> activeIntegrations(UUID ownerId, Collection<CrmType> crmTypes) {
    if (crmTypes == null || crmTypes.isEmpty()) {
      return integrationRepository.findByOwnerIdAndActiveTrueOrderByCreatedAtAsc(ownerId);
    }
    return integrationRepository.findByOwnerIdAndActiveTrueAndCrmTypeInOrderByCreatedAtAsc(
        ownerId, crmTypes);
  }

  public IntegrationSettings settingsOf(CrmIntegration integration) {
    return settingsMapper.fromJson(integration.getSettingsJson());
  }

  /** Records the outcome of a sync in its own transaction so it survives a caller rollback. */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public void recordSyncOutcome(UUID integrationId, boolean success, String error) {
    integrationRepository
        .findById(integrationId)
        .ifPresent(
            integration -> {
              if (success) {
                integration.recordSyncSuccess(Instant.now());
              } else {
                integration.recordSyncFailure(error);
              }
            });
  }

  private CrmIntegration findOrThrow(UUID ownerId, CrmType crmType) {
    return integrationRepository
        .findByOwnerIdAndCrmType(ownerId, crmType)
        .orElseThrow(
            () ->
                ResourceNotFoundException.withDetail(
                    "Integration not found", "No " + crmType.slug() + " integration found"));
  }

  private CrmIntegrationDto toDto(CrmIntegration integration) {
    return CrmIntegrationDto.from(integration, settingsOf(integration));
  }

  private static ResourceConflictException alreadyExists(CrmType crmType) {
    return new ResourceConflictException(
        "Integration already exists",
        "A "
            + crmType.slug()
            + " integration already exists; update it with reconnect=true instead");
  }

  private void audit(String eventType, CrmIntegration integration, Map<String, Object> details) {
    auditService.log(
        AuditEventBuilder.builder()
            .eventType(eventType)
            .entityType(ENTITY_TYPE)
            .entityId(integration.getId())
            .ownerId(integration.getOwnerId())
            .details(details)
            .build());
  }
}
