package io.b2mash.crmsync.integration;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.b2mash.crmsync.config.DiagnosticsProperties;
import io.b2mash.crmsync.config.RequestHeaders;
import io.b2mash.crmsync.exception.GlobalExceptionHandler;
import io.b2mash.crmsync.exception.ResourceConflictException;
import io.b2mash.crmsync.integration.mapping.FieldMappingRegistry;
import io.b2mash.crmsync.integration.mapping.FieldMappingService;
import io.b2mash.crmsync.integration.provider.CrmApiException;
import io.b2mash.crmsync.integration.provider.CrmAuthenticationException;
import io.b2mash.crmsync.integration.provider.ProviderManager;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class IntegrationControllerTest {

  private static final UUID OWNER_ID = UUID.fromString("6f1c2a3b-0000-4000-8000-000000000001");

  @Mock private IntegrationService integrationService;
  @Mock private ProviderManager providerManager;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    var controller =
        new IntegrationController(
            integrationService,
            new FieldMappingService(new FieldMappingRegistry()),
            providerManager);
    mockMvc =
        MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler(new DiagnosticsProperties(false)))
            .build();
  }

  private static CrmIntegrationDto dto(String crmType, boolean active) {
    return new CrmIntegrationDto(
        UUID.randomUUID(),
        OWNER_ID,
        crmType,
        active,
        active ? "connected" : "disconnected",
        null,
        null,
        "****5678",
        IntegrationSettings.defaults(),
        null,
        null);
  }

  @Test
  void connect_returns_created_integration() throws Exception {
    when(integrationService.connect(eq(OWNER_ID), eq(CrmType.KLAVIYO), anyMap(), anyMap()))
        .thenReturn(dto("klaviyo", true));

    mockMvc
        .perform(
            post("/api/crm/connect")
                .header(RequestHeaders.OWNER_ID, OWNER_ID.toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"crmType": "klaviyo",
                     "credentials": {"api_key": "pk_live_12345678"},
                     "selectedFields": ["email", "first_name"]}
                    """))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.crmType").value("klaviyo"))
        .andExpect(jsonPath("$.credentialHint").value("****5678"))
        .andExpect(jsonPath("$.settings.sync_frequency").value("real-time"));

    verify(integrationService)
        .connect(
            OWNER_ID,
            CrmType.KLAVIYO,
            Map.of("api_key", "pk_live_12345678"),
            Map.of("selected_fields", List.of("email", "first_name")));
  }

  @Test
  void connect_with_unknown_crm_type_is_bad_request() throws Exception {
    mockMvc
        .perform(
            post("/api/crm/connect")
                .header(RequestHeaders.OWNER_ID, OWNER_ID.toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"crmType\": \"dynamics\", \"credentials\": {\"k\": \"v\"}}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errorCode").value("CRM_INVALID_TYPE"));
    verifyNoInteractions(integrationService);
  }

  @Test
  void connect_without_credentials_fails_validation() throws Exception {
    mockMvc
        .perform(
            post("/api/crm/connect")
                .header(RequestHeaders.OWNER_ID, OWNER_ID.toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"crmType\": \"klaviyo\", \"credentials\": {}}"))
        .andExpect(status().isBadRequest());
    verifyNoInteractions(integrationService);
  }

  @Test
  void connect_without_owner_header_is_bad_request() throws Exception {
    mockMvc
        .perform(
            post("/api/crm/connect")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"crmType\": \"klaviyo\", \"credentials\": {\"api_key\": \"k\"}}"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void connect_conflict_maps_to_409() throws Exception {
    when(integrationService.connect(any(), any(), anyMap(), anyMap()))
        .thenThrow(new ResourceConflictException("Integration already exists", "exists"));

    mockMvc
        .perform(
            post("/api/crm/connect")
                .header(RequestHeaders.OWNER_ID, OWNER_ID.toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"crmType\": \"klaviyo\", \"credentials\": {\"api_key\": \"k\"}}"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.errorCode").value("CRM_INTEGRATION_EXISTS"));
  }

  @Test
  void rejected_credentials_map_to_401() throws Exception {
    when(integrationService.validateCredentials(eq(CrmType.KLAVIYO), anyMap()))
        .thenThrow(new CrmAuthenticationException(CrmType.KLAVIYO, "Invalid Klaviyo API key"));

    mockMvc
        .perform(
            post("/api/crm/validate")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"crmType\": \"klaviyo\", \"credentials\": {\"api_key\": \"bad\"}}"))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.errorCode").value("CRM_INVALID_CREDENTIALS"))
        .andExpect(jsonPath("$.crmType").value("klaviyo"))
        .andExpect(jsonPath("$.detail").value("Invalid Klaviyo API key"));
  }

  @Test
  void unreachable_crm_maps_to_503() throws Exception {
    when(integrationService.validateCredentials(eq(CrmType.KLAVIYO), anyMap()))
        .thenThrow(new CrmApiException(CrmType.KLAVIYO, "klaviyo request timed out"));

    mockMvc
        .perform(
            post("/api/crm/validate")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"crmType\": \"klaviyo\", \"credentials\": {\"api_key\": \"k\"}}"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.errorCode").value("CRM_CONNECTION_FAILED"));
  }

  @Test
  void update_with_reconnect_flag() throws Exception {
    when(integrationService.update(eq(OWNER_ID), eq(CrmType.SALESFORCE), any(), anyMap(), eq(true)))
        .thenReturn(dto("salesforce", true));

    mockMvc
        .perform(
            patch("/api/crm/salesforce")
                .header(RequestHeaders.OWNER_ID, OWNER_ID.toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"reconnect\": true, \"leadQuality\": \"hot\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.active").value(true));
  }

  @Test
  void disconnect_returns_inactive_integration() throws Exception {
    when(integrationService.disconnect(OWNER_ID, CrmType.KLAVIYO))
        .thenReturn(dto("klaviyo", false));

    mockMvc
        .perform(
            delete("/api/crm/klaviyo/disconnect")
                .header(RequestHeaders.OWNER_ID, OWNER_ID.toString()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.active").value(false))
        .andExpect(jsonPath("$.syncStatus").value("disconnected"));
  }

  @Test
  void status_without_integration_returns_null() throws Exception {
    when(integrationService.status(OWNER_ID, CrmType.HUBSPOT)).thenReturn(Optional.empty());

    mockMvc
        .perform(
            get("/api/crm/hubspot/status").header(RequestHeaders.OWNER_ID, OWNER_ID.toString()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.integration").doesNotExist());
  }

  @Test
  void list_includes_inactive_integrations() throws Exception {
    when(integrationService.list(OWNER_ID))
        .thenReturn(List.of(dto("klaviyo", true), dto("salesforce", false)));

    mockMvc
        .perform(get("/api/crm/list").header(RequestHeaders.OWNER_ID, OWNER_ID.toString()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.integrations", hasSize(2)))
        .andExpect(jsonPath("$.total").value(2));
  }

  @Test
  void field_mapping_describes_crm() throws Exception {
    mockMvc
        .perform(get("/api/crm/salesforce/field-mapping"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.requiredFields", hasSize(2)))
        .andExpect(jsonPath("$.fieldMapping.last_name").value("LastName"))
        .andExpect(jsonPath("$.structure").value("flat_suffixed"));
  }

  @Test
  void supported_lists_mapped_and_connectable_types() throws Exception {
    when(providerManager.connectableTypes())
        .thenReturn(List.of(CrmType.KLAVIYO, CrmType.SALESFORCE, CrmType.CREATIO));

    mockMvc
        .perform(get("/api/crm/supported"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.crmTypes", hasSize(11)))
        .andExpect(jsonPath("$.connectable", hasSize(3)));
  }
}
