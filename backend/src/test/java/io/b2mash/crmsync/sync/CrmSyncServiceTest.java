package io.b2mash.crmsync.sync;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.b2mash.crmsync.canonical.CanonicalContact;
import io.b2mash.crmsync.canonical.CanonicalEvent;
import io.b2mash.crmsync.canonical.ContactIdentifier;
import io.b2mash.crmsync.exception.InvalidStateException;
import io.b2mash.crmsync.exception.ResourceNotFoundException;
import io.b2mash.crmsync.integration.CrmIntegration;
import io.b2mash.crmsync.integration.CrmType;
import io.b2mash.crmsync.integration.IntegrationService;
import io.b2mash.crmsync.integration.IntegrationSettings;
import io.b2mash.crmsync.integration.mapping.FieldMappingRegistry;
import io.b2mash.crmsync.integration.mapping.FieldMappingService;
import io.b2mash.crmsync.integration.provider.CrmApiException;
import io.b2mash.crmsync.integration.provider.CrmCredentials;
import io.b2mash.crmsync.integration.provider.ProviderManager;
import io.b2mash.crmsync.integration.provider.RemoteRecord;
import io.b2mash.crmsync.integration.provider.TargetOutcome;
import io.b2mash.crmsync.integration.secret.CredentialVault;
import io.b2mash.crmsync.integration.secret.EncryptedCredentials;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class CrmSyncServiceTest {

  private static final UUID OWNER_ID = UUID.randomUUID();

  @Mock private IntegrationService integrationService;
  @Mock private ProviderManager providerManager;
  @Mock private CredentialVault credentialVault;
  @Mock private SyncLogService syncLogService;

  private CrmSyncService service;
  private CrmIntegration klaviyo;
  private CrmIntegration salesforce;
  private final CrmCredentials credentials = CrmCredentials.of(Map.of("api_key", "pk_1"));

  @BeforeEach
  void setUp() {
    service =
        new CrmSyncService(integrationService, providerManager, credentialVault, syncLogService);
    klaviyo = integration(CrmType.KLAVIYO);
    salesforce = integration(CrmType.SALESFORCE);
  }

  private static CrmIntegration integration(CrmType crmType) {
    var integration =
        new CrmIntegration(
            OWNER_ID, crmType, new EncryptedCredentials("c2VhbGVk", "aXY=", 1), "****", "{}");
    ReflectionTestUtils.setField(integration, "id", UUID.randomUUID());
    return integration;
  }

  private static IntegrationSettings enabledEvents(String... events) {
    var settings = IntegrationSettings.defaults();
    settings.setEnabledEvents(List.of(events));
    return settings;
  }

  private static CanonicalContact contact() {
    return CanonicalContact.builder("ada@example.com")
        .firstName("Ada")
        .lastName("Lovelace")
        .company("Engines")
        .build();
  }

  private void givenActive(CrmIntegration... integrations) {
    when(integrationService.activeIntegrations(OWNER_ID, List.of()))
        .thenReturn(List.of(integrations));
  }

  private void givenReadableConfig(CrmIntegration integration, IntegrationSettings settings) {
    when(credentialVault.decrypt(integration.getEncryptedCredentials())).thenReturn(credentials);
    when(integrationService.settingsOf(integration)).thenReturn(settings);
  }

  @Test
  void syncContact_reports_each_target_independently() {
    givenActive(klaviyo, salesforce);
    givenReadableConfig(klaviyo, IntegrationSettings.defaults());
    givenReadableConfig(salesforce, IntegrationSettings.defaults());
    when(syncLogService.open(any(), any(), anyString(), anyString(), any()))
        .thenReturn(UUID.randomUUID());
    when(providerManager.upsertContact(eq(CrmType.KLAVIYO), eq(credentials), any()))
        .thenReturn(new RemoteRecord(201, Map.of("id", "P1")));
    when(providerManager.upsertContact(eq(CrmType.SALESFORCE), eq(credentials), any()))
        .thenThrow(new CrmApiException(CrmType.SALESFORCE, "Salesforce unavailable", 503));

    var results = service.syncContact(OWNER_ID, contact(), List.of());

    assertThat(results).containsOnlyKeys("klaviyo", "salesforce");
    assertThat(results.get("klaviyo").success()).isTrue();
    assertThat(results.get("klaviyo").data()).containsEntry("id", "P1");
    assertThat(results.get("salesforce").success()).isFalse();
    assertThat(results.get("salesforce").errorType()).isEqualTo("remote_api");
    assertThat(results.get("salesforce").statusCode()).isEqualTo(503);
    verify(integrationService).recordSyncOutcome(klaviyo.getId(), true, null);
    verify(integrationService)
        .recordSyncOutcome(salesforce.getId(), false, "Salesforce unavailable");
  }

  @Test
  void syncContact_records_mapping_failure_without_touching_other_targets() {
    var mapping = new FieldMappingService(new FieldMappingRegistry());
    var klaviyoLog = UUID.randomUUID();
    var salesforceLog = UUID.randomUUID();
    givenActive(klaviyo, salesforce);
    givenReadableConfig(klaviyo, IntegrationSettings.defaults());
    givenReadableConfig(salesforce, IntegrationSettings.defaults());
    when(syncLogService.open(eq(klaviyo), any(), anyString(), anyString(), any()))
        .thenReturn(klaviyoLog);
    when(syncLogService.open(eq(salesforce), any(), anyString(), anyString(), any()))
        .thenReturn(salesforceLog);
    when(providerManager.upsertContact(eq(CrmType.KLAVIYO), eq(credentials), any()))
        .thenReturn(new RemoteRecord(202, Map.of()));
    when(providerManager.upsertContact(eq(CrmType.SALESFORCE), eq(credentials), any()))
        .thenAnswer(
            invocation -> {
              mapping.transformContact(
                  invocation.<CanonicalContact>getArgument(2), CrmType.SALESFORCE);
              return new RemoteRecord(201, Map.of());
            });
    var noLastName = CanonicalContact.builder("ada@example.com").firstName("Ada").build();

    var results = service.syncContact(OWNER_ID, noLastName, List.of());

    assertThat(results.get("klaviyo").success()).isTrue();
    assertThat(results.get("salesforce").success()).isFalse();
    assertThat(results.get("salesforce").errorType()).isEqualTo("mapping");
    assertThat(results.get("salesforce").error()).contains("last_name");

    var klaviyoOutcome = ArgumentCaptor.forClass(TargetOutcome.class);
    var salesforceOutcome = ArgumentCaptor.forClass(TargetOutcome.class);
    verify(syncLogService).complete(eq(klaviyoLog), klaviyoOutcome.capture());
    verify(syncLogService).complete(eq(salesforceLog), salesforceOutcome.capture());
    assertThat(klaviyoOutcome.getValue().success()).isTrue();
    assertThat(salesforceOutcome.getValue().errorType()).isEqualTo("mapping");
    assertThat(salesforceOutcome.getValue().error()).contains("last_name");
    verify(integrationService).recordSyncOutcome(klaviyo.getId(), true, null);
    verify(integrationService)
        .recordSyncOutcome(eq(salesforce.getId()), eq(false), anyString());
  }

  @Test
  void syncContact_logs_each_attempt_before_and_after_the_remote_call() {
    var logId = UUID.randomUUID();
    givenActive(klaviyo);
    givenReadableConfig(klaviyo, IntegrationSettings.defaults());
    when(syncLogService.open(
            eq(klaviyo),
            eq(SyncOperation.CONTACT_UPSERT),
            eq("contact"),
            eq("ada@example.com"),
            any()))
        .thenReturn(logId);
    when(providerManager.upsertContact(eq(CrmType.KLAVIYO), eq(credentials), any()))
        .thenReturn(new RemoteRecord(200, Map.of()));

    service.syncContact(OWNER_ID, contact(), List.of());

    var outcome = ArgumentCaptor.forClass(TargetOutcome.class);
    verify(syncLogService).complete(eq(logId), outcome.capture());
    assertThat(outcome.getValue().success()).isTrue();
    assertThat(outcome.getValue().statusCode()).isEqualTo(200);
  }

  @Test
  void syncContact_applies_selected_fields_per_integration() {
    var settings = IntegrationSettings.defaults();
    settings.setSelectedFields(List.of("first_name"));
    givenActive(klaviyo);
    givenReadableConfig(klaviyo, settings);
    when(syncLogService.open(any(), any(), anyString(), anyString(), any()))
        .thenReturn(UUID.randomUUID());
    when(providerManager.upsertContact(eq(CrmType.KLAVIYO), eq(credentials), any()))
        .thenReturn(new RemoteRecord(200, Map.of()));

    service.syncContact(OWNER_ID, contact(), List.of());

    var sent = ArgumentCaptor.forClass(CanonicalContact.class);
    verify(providerManager).upsertContact(eq(CrmType.KLAVIYO), eq(credentials), sent.capture());
    assertThat(sent.getValue().firstName()).isEqualTo("Ada");
    assertThat(sent.getValue().lastName()).isNull();
    assertThat(sent.getValue().company()).isNull();
  }

  @Test
  void syncContact_without_active_integrations_is_not_found() {
    when(integrationService.activeIntegrations(OWNER_ID, List.of(CrmType.HUBSPOT)))
        .thenReturn(List.of());

    assertThatThrownBy(() -> service.syncContact(OWNER_ID, contact(), List.of(CrmType.HUBSPOT)))
        .isInstanceOf(ResourceNotFoundException.class);
    verifyNoInteractions(providerManager, syncLogService);
  }

  @Test
  void log_write_failure_is_reported_without_hiding_the_remote_result() {
    givenActive(klaviyo);
    givenReadableConfig(klaviyo, IntegrationSettings.defaults());
    when(syncLogService.open(any(), any(), anyString(), anyString(), any()))
        .thenThrow(new IllegalStateException("database unavailable"));
    when(providerManager.upsertContact(eq(CrmType.KLAVIYO), eq(credentials), any()))
        .thenReturn(new RemoteRecord(201, Map.of("id", "P1")));

    var result = service.syncContact(OWNER_ID, contact(), List.of()).get("klaviyo");

    assertThat(result.success()).isTrue();
    assertThat(result.auditError()).contains("database unavailable");
    verify(syncLogService, never()).complete(any(), any());
  }

  @Test
  void unreadable_stored_credentials_fail_only_that_target() {
    givenActive(klaviyo, salesforce);
    when(credentialVault.decrypt(klaviyo.getEncryptedCredentials()))
        .thenThrow(new IllegalStateException("Decryption failed"));
    givenReadableConfig(salesforce, IntegrationSettings.defaults());
    when(syncLogService.open(any(), any(), anyString(), anyString(), any()))
        .thenReturn(UUID.randomUUID());
    when(providerManager.upsertContact(eq(CrmType.SALESFORCE), eq(credentials), any()))
        .thenReturn(new RemoteRecord(201, Map.of()));

    var results = service.syncContact(OWNER_ID, contact(), List.of());

    assertThat(results.get("klaviyo").errorType()).isEqualTo(TargetOutcome.UNEXPECTED);
    assertThat(results.get("salesforce").success()).isTrue();
    verify(providerManager, never()).upsertContact(eq(CrmType.KLAVIYO), any(), any());
    verify(integrationService).recordSyncOutcome(eq(klaviyo.getId()), eq(false), anyString());
  }

  @Test
  void syncEvent_skips_integrations_that_do_not_enable_the_event() {
    givenActive(klaviyo, salesforce);
    givenReadableConfig(klaviyo, enabledEvents("Signed Up"));
    givenReadableConfig(salesforce, IntegrationSettings.defaults());
    when(syncLogService.open(any(), any(), anyString(), anyString(), any()))
        .thenReturn(UUID.randomUUID());
    when(providerManager.sendEvent(eq(CrmType.SALESFORCE), eq(credentials), any(), any()))
        .thenReturn(new RemoteRecord(201, Map.of("id", "00T1")));

    var results =
        service.syncEvent(
            OWNER_ID,
            CanonicalEvent.named("Placed Order", Map.of()),
            ContactIdentifier.ofEmail("ada@example.com"),
            List.of());

    assertThat(results).containsOnlyKeys("salesforce");
    verify(providerManager, never()).sendEvent(eq(CrmType.KLAVIYO), any(), any(), any());
    verify(syncLogService, never()).open(eq(klaviyo), any(), anyString(), anyString(), any());
    verify(integrationService, never()).recordSyncOutcome(eq(klaviyo.getId()), anyBoolean(), any());
  }

  @Test
  void syncEvent_requires_a_contact_identifier() {
    var event = CanonicalEvent.named("Signed Up", Map.of());
    var empty = new ContactIdentifier(null, " ", null);

    assertThatThrownBy(() -> service.syncEvent(OWNER_ID, event, empty, List.of()))
        .isInstanceOf(InvalidStateException.class);
    verifyNoInteractions(integrationService, providerManager);
  }
}
