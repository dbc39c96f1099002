package io.b2mash.crmsync.integration;

import io.b2mash.crmsync.config.RequestHeaders;
import io.b2mash.crmsync.integration.mapping.FieldMappingDto;
import io.b2mash.crmsync.integration.mapping.FieldMappingService;
import io.b2mash.crmsync.integration.provider.ProviderManager;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/crm")
public class IntegrationController {

  private final IntegrationService integrationService;
  private final FieldMappingService fieldMappingService;
  private final ProviderManager providerManager;

  public IntegrationController(
      IntegrationService integrationService,
      FieldMappingService fieldMappingService,
      ProviderManager providerManager) {
    this.integrationService = integrationService;
    this.fieldMappingService = fieldMappingService;
    this.providerManager = providerManager;
  }

  @PostMapping("/validate")
  public ResponseEntity<CredentialValidationResult> validateCredentials(
      @Valid @RequestBody ValidateCredentialsRequest request) {
    return ResponseEntity.ok(
        integrationService.validateCredentials(
            CrmType.fromSlug(request.crmType()), request.credentials()));
  }

  @PostMapping("/connect")
  public ResponseEntity<CrmIntegrationDto> connect(
      @RequestHeader(RequestHeaders.OWNER_ID) UUID ownerId,
      @Valid @RequestBody ConnectRequest request) {
    var integration =
        integrationService.connect(
            ownerId,
            CrmType.fromSlug(request.crmType()),
            request.credentials(),
            settingsPatch(request.settings(), request.selectedFields(), request.leadQuality()));
    return ResponseEntity.status(HttpStatus.CREATED).body(integration);
  }

  @PatchMapping("/{crmType}")
  public ResponseEntity<CrmIntegrationDto> update(
      @RequestHeader(RequestHeaders.OWNER_ID) UUID ownerId,
      @PathVariable String crmType,
      @Valid @RequestBody UpdateRequest request) {
    return ResponseEntity.ok(
        integrationService.update(
            ownerId,
            CrmType.fromSlug(crmType),
            request.credentials(),
            settingsPatch(request.settings(), request.selectedFields(), request.leadQuality()),
            Boolean.TRUE.equals(request.reconnect())));
  }

  @DeleteMapping("/{crmType}/disconnect")
  public ResponseEntity<CrmIntegrationDto> disconnect(
      @RequestHeader(RequestHeaders.OWNER_ID) UUID ownerId, @PathVariable String crmType) {
    return ResponseEntity.ok(integrationService.disconnect(ownerId, CrmType.fromSlug(crmType)));
  }

  @GetMapping("/{crmType}/status")
  public ResponseEntity<IntegrationStatusResponse> status(
      @RequestHeader(RequestHeaders.OWNER_ID) UUID ownerId, @PathVariable String crmType) {
    var integration = integrationService.status(ownerId, CrmType.fromSlug(crmType));
    return ResponseEntity.ok(new IntegrationStatusResponse(integration.orElse(null)));
  }

  @GetMapping("/list")
  public ResponseEntity<IntegrationListResponse> list(
      @RequestHeader(RequestHeaders.OWNER_ID) UUID ownerId) {
    var integrations = integrationService.list(ownerId);
    return ResponseEntity.ok(new IntegrationListResponse(integrations, integrations.size()));
  }

  @GetMapping("/{crmType}/field-mapping")
  public ResponseEntity<FieldMappingDto> fieldMapping(@PathVariable String crmType) {
    return ResponseEntity.ok(fieldMappingService.describe(CrmType.fromSlug(crmType)));
  }

  @GetMapping("/supported")
  public ResponseEntity<SupportedCrmsResponse> supported() {
    return ResponseEntity.ok(
        new SupportedCrmsResponse(
            fieldMappingService.supportedTypes().stream().map(CrmType::slug).toList(),
            providerManager.connectableTypes().stream().map(CrmType::slug).toList()));
  }

  /** Top-level convenience fields win over the same keys inside {@code settings}. */
  private static Map<String, Object> settingsPatch(
      Map<String, Object> settings, List<String> selectedFields, String leadQuality) {
    var patch = new LinkedHashMap<String, Object>();
    if (settings != null) {
      patch.putAll(settings);
    }
    if (selectedFields != null) {
      patch.put("selected_fields", selectedFields);
    }
    if (leadQuality != null) {
      patch.put("lead_quality", leadQuality);
    }
    return patch;
  }

  // --- DTOs ---

  public record ValidateCredentialsRequest(
      @NotBlank(message = "crmType must not be blank") String crmType,
      @NotEmpty(message = "credentials must not be empty") Map<String, Object> credentials) {}

  public record ConnectRequest(
      @NotBlank(message = "crmType must not be blank") String crmType,
      @NotEmpty(message = "credentials must not be empty") Map<String, Object> credentials,
      List<String> selectedFields,
      String leadQuality,
      Map<String, Object> settings) {}

  public record UpdateRequest(
      Map<String, Object> credentials,
      List<String> selectedFields,
      String leadQuality,
      Map<String, Object> settings,
      Boolean reconnect) {}

  public record IntegrationStatusResponse(CrmIntegrationDto integration) {}

  public record IntegrationListResponse(List<CrmIntegrationDto> integrations, int total) {}

  /**
   * @param crmTypes every CRM with a field mapping
   * @param connectable the subset with a bound adapter
   */
  public record SupportedCrmsResponse(List<String> crmTypes, List<String> connectable) {}
}
