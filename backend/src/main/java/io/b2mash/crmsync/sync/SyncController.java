package io.b2mash.crmsync.sync;

import io.b2mash.crmsync.canonical.CanonicalContact;
import io.b2mash.crmsync.canonical.CanonicalEvent;
import io.b2mash.crmsync.canonical.ContactIdentifier;
import io.b2mash.crmsync.config.RequestHeaders;
import io.b2mash.crmsync.exception.ResourceNotFoundException;
import io.b2mash.crmsync.integration.CrmType;
import io.b2mash.crmsync.integration.IntegrationService;
import io.b2mash.crmsync.integration.provider.TargetOutcome;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/crm")
public class SyncController {

  private final CrmSyncService crmSyncService;
  private final IntegrationService integrationService;
  private final SyncLogService syncLogService;

  public SyncController(
      CrmSyncService crmSyncService,
      IntegrationService integrationService,
      SyncLogService syncLogService) {
    this.crmSyncService = crmSyncService;
    this.integrationService = integrationService;
    this.syncLogService = syncLogService;
  }

  @PostMapping("/sync/contact")
  public ResponseEntity<SyncResponse> syncContact(
      @RequestHeader(RequestHeaders.OWNER_ID) UUID ownerId,
      @Valid @RequestBody SyncContactRequest request) {
    var results =
        crmSyncService.syncContact(ownerId, request.contact(), toCrmTypes(request.crmTypes()));
    return ResponseEntity.ok(SyncResponse.of(results));
  }

  @PostMapping("/sync/event")
  public ResponseEntity<SyncResponse> syncEvent(
      @RequestHeader(RequestHeaders.OWNER_ID) UUID ownerId,
      @Valid @RequestBody SyncEventRequest request) {
    var results =
        crmSyncService.syncEvent(
            ownerId, request.event(), request.contact(), toCrmTypes(request.crmTypes()));
    return ResponseEntity.ok(SyncResponse.of(results));
  }

  @GetMapping("/{crmType}/sync-logs")
  public ResponseEntity<SyncLogPage> syncLogs(
      @RequestHeader(RequestHeaders.OWNER_ID) UUID ownerId,
      @PathVariable String crmType,
      @RequestParam(defaultValue = "0") @Min(0) int page,
      @RequestParam(defaultValue = "20") @Min(1) @Max(100) int size) {
    var type = CrmType.fromSlug(crmType);
    var integration =
        integrationService
            .status(ownerId, type)
            .orElseThrow(
                () ->
                    ResourceNotFoundException.withDetail(
                        "Integration not found", "No " + type.slug() + " integration found"));
    var entries =
        syncLogService.findForIntegration(
            integration.id(),
            PageRequest.of(page, size, Sort.by(Sort.Direction.DESC, "createdAt")));
    return ResponseEntity.ok(
        new SyncLogPage(entries.getContent(), page, size, entries.getTotalElements()));
  }

  private static List<CrmType> toCrmTypes(List<String> slugs) {
    return slugs == null ? List.of() : slugs.stream().map(CrmType::fromSlug).toList();
  }

  // --- DTOs ---

  public record SyncContactRequest(
      @NotNull(message = "contact is required") @Valid CanonicalContact contact,
      List<String> crmTypes) {}

  public record SyncEventRequest(
      @NotNull(message = "event is required") @Valid CanonicalEvent event,
      @NotNull(message = "contact is required") ContactIdentifier contact,
      List<String> crmTypes) {}

  public record SyncResponse(Map<String, TargetOutcome> results, int succeeded, int failed) {

    static SyncResponse of(Map<String, TargetOutcome> results) {
      int succeeded = (int) results.values().stream().filter(TargetOutcome::success).count();
      return new SyncResponse(results, succeeded, results.size() - succeeded);
    }
  }

  public record SyncLogPage(List<SyncLogDto> content, int page, int size, long totalElements) {}
}
