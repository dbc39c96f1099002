package io.b2mash.crmsync.sync;

import io.b2mash.crmsync.canonical.CanonicalContact;
import io.b2mash.crmsync.canonical.CanonicalEvent;
import io.b2mash.crmsync.canonical.ContactIdentifier;
import io.b2mash.crmsync.exception.InvalidStateException;
import io.b2mash.crmsync.exception.ResourceNotFoundException;
import io.b2mash.crmsync.integration.CrmIntegration;
import io.b2mash.crmsync.integration.CrmType;
import io.b2mash.crmsync.integration.IntegrationService;
import io.b2mash.crmsync.integration.IntegrationSettings;
import io.b2mash.crmsync.integration.provider.CrmCredentials;
import io.b2mash.crmsync.integration.provider.ProviderManager;
import io.b2mash.crmsync.integration.provider.RemoteRecord;
import io.b2mash.crmsync.integration.provider.TargetOutcome;
import io.b2mash.crmsync.integration.secret.CredentialVault;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Fans a contact or event out to the owner's active integrations, one target at a time. Each target
 * gets its own sync log entry and its own result; a failing target never stops the others.
 *
 * <p>Per target: load credentials and settings, open a PENDING log entry, call the CRM through
 * {@link ProviderManager}, complete the log entry, then record the outcome on the integration. Log
 * write failures are reported as {@code auditError} on the result without hiding the remote
 * outcome.
 */
@Service
public class CrmSyncService {

  private static final Logger log = LoggerFactory.getLogger(CrmSyncService.class);

  private final IntegrationService integrationService;
  private final ProviderManager providerManager;
  private final CredentialVault credentialVault;
  private final SyncLogService syncLogService;

  public CrmSyncService(
      IntegrationService integrationService,
      ProviderManager providerManager,
      CredentialVault credentialVault,
      SyncLogService syncLogService) {
    this.integrationService = integrationService;
    this.providerManager = providerManager;
    this.credentialVault = credentialVault;
    this.syncLogService = syncLogService;
  }

  /**
   * Upserts the contact into every active integration of the owner (or the requested subset).
   *
   * @return results keyed by CRM slug, in integration creation order
   * @throws ResourceNotFoundException if no matching integration is active
   */
  public Map<String, TargetOutcome> syncContact(
      UUID ownerId, CanonicalContact contact, Collection<CrmType> crmTypes) {
    var results = new LinkedHashMap<String, TargetOutcome>();
    for (var integration : requireActive(ownerId, crmTypes)) {
      var crmType = integration.getCrmType();
      var outcome =
          withTargetConfig(
              integration,
              config -> {
                var selected = contact.selectFields(config.settings().getSelectedFields());
                return runLogged(
                    integration,
                    SyncOperation.CONTACT_UPSERT,
                    "contact",
                    selected.email(),
                    selected,
                    () -> providerManager.upsertContact(crmType, config.credentials(), selected));
              });
      results.put(crmType.slug(), outcome);
    }
    logSummary("Contact sync", results);
    return results;
  }

  /**
   * Sends the event to every active integration of the owner (or the requested subset) whose
   * {@code enabled_events} allows it. Integrations that filter the event out are skipped entirely
   * and do not appear in the result.
   *
   * @throws InvalidStateException if the contact identifier carries no id, email or phone
   * @throws ResourceNotFoundException if no matching integration is active
   */
  public Map<String, TargetOutcome> syncEvent(
      UUID ownerId,
      CanonicalEvent event,
      ContactIdentifier contact,
      Collection<CrmType> crmTypes) {
    if (contact == null || !contact.hasAny()) {
      throw new InvalidStateException(
          "Contact identifier required", "Provide a contact id, email or phone for the event");
    }

    var results = new LinkedHashMap<String, TargetOutcome>();
    for (var integration : requireActive(ownerId, crmTypes)) {
      var crmType = integration.getCrmType();
      var outcome =
          withTargetConfig(
              integration,
              config -> {
                if (!config.settings().allowsEvent(event.name())) {
                  log.debug(
                      "Event '{}' is not enabled for {} integration {}",
                      event.name(),
                      crmType.slug(),
                      integration.getId());
                  return null;
                }
                var requestPayload = new LinkedHashMap<String, Object>();
                requestPayload.put("event", event);
                requestPayload.put("contact", contact);
                return runLogged(
                    integration,
                    SyncOperation.EVENT_SEND,
                    "event",
                    event.name(),
                    requestPayload,
                    () -> providerManager.sendEvent(crmType, config.credentials(), contact, event));
              });
      if (outcome != null) {
        results.put(crmType.slug(), outcome);
      }
    }
    logSummary("Event '" + event.name() + "' sync", results);
    return results;
  }

  private List<CrmIntegration> requireActive(UUID ownerId, Collection<CrmType> crmTypes) {
    var integrations = integrationService.activeIntegrations(ownerId, crmTypes);
    if (integrations.isEmpty()) {
      throw ResourceNotFoundException.noActiveIntegrations();
    }
    return integrations;
  }

  private record TargetConfig(CrmCredentials credentials, IntegrationSettings settings) {}

  /** Decrypts credentials and parses settings; a failure here fails only this target. */
  private TargetOutcome withTargetConfig(
      CrmIntegration integration, Function<TargetConfig, TargetOutcome> work) {
    TargetConfig config;
    try {
      config =
          new TargetConfig(
              credentialVault.decrypt(integration.getEncryptedCredentials()),
              integrationService.settingsOf(integration));
    } catch (RuntimeException e) {
      log.error(
          "Stored configuration of {} integration {} could not be read",
          integration.getCrmType().slug(),
          integration.getId(),
          e);
      var outcome =
          TargetOutcome.failed(
              TargetOutcome.UNEXPECTED, "Stored integration configuration could not be read", null);
      recordIntegrationState(integration, outcome);
      return outcome;
    }
    return work.apply(config);
  }

  private TargetOutcome runLogged(
      CrmIntegration integration,
      SyncOperation operation,
      String entityType,
      String entityId,
      Object requestPayload,
      Supplier<RemoteRecord> call) {
    var crmType = integration.getCrmType();
    UUID logId = null;
    String auditError = null;
    try {
      logId = syncLogService.open(integration, operation, entityType, entityId, requestPayload);
    } catch (RuntimeException e) {
      log.error(
          "Could not open sync log for {} integration {}", crmType.slug(), integration.getId(), e);
      auditError = "Sync log entry could not be written: " + e.getMessage();
    }

    var outcome = TargetOutcome.execute(crmType, call);

    if (logId != null) {
      try {
        syncLogService.complete(logId, outcome);
      } catch (RuntimeException e) {
        log.error("Could not complete sync log {}", logId, e);
        auditError = "Sync log entry could not be completed: " + e.getMessage();
      }
    }
    recordIntegrationState(integration, outcome);
    return auditError != null ? outcome.withAuditError(auditError) : outcome;
  }

  private void recordIntegrationState(CrmIntegration integration, TargetOutcome outcome) {
    try {
      integrationService.recordSyncOutcome(
          integration.getId(), outcome.success(), outcome.error());
    } catch (RuntimeException e) {
      log.error("Could not record sync outcome on integration {}", integration.getId(), e);
    }
  }

  private static void logSummary(String operation, Map<String, TargetOutcome> results) {
    long succeeded = results.values().stream().filter(TargetOutcome::success).count();
    log.info("{} finished: {} of {} targets succeeded", operation, succeeded, results.size());
  }
}
