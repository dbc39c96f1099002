package io.b2mash.crmsync.integration.provider;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.b2mash.crmsync.integration.CrmType;
import io.b2mash.crmsync.integration.mapping.FieldMappingException;
import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Result of one CRM target in a fan-out. Exactly one of {@code data} or {@code error} is set.
 *
 * @param success whether the remote call succeeded
 * @param data remote record on success
 * @param error human-readable failure message
 * @param errorType authentication, remote_api, mapping or unexpected
 * @param statusCode remote HTTP status, when one was received
 * @param auditError set when the sync log could not be written; independent of {@code success}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TargetOutcome(
    boolean success,
    Map<String, Object> data,
    String error,
    String errorType,
    Integer statusCode,
    String auditError) {

  private static final Logger log = LoggerFactory.getLogger(TargetOutcome.class);

  public static final String UNEXPECTED = "unexpected";

  public static TargetOutcome succeeded(RemoteRecord remote) {
    return new TargetOutcome(true, remote.body(), null, null, remote.statusCode(), null);
  }

  public static TargetOutcome failed(String errorType, String error, Integer statusCode) {
    return new TargetOutcome(false, null, error, errorType, statusCode, null);
  }

  /**
   * Runs one target's remote work and converts any failure into a failed outcome, so a failing
   * target never aborts its siblings.
   */
  public static TargetOutcome execute(CrmType crmType, Supplier<RemoteRecord> call) {
    try {
      return succeeded(call.get());
    } catch (CrmApiException e) {
      log.warn("{} API error: {}", crmType.slug(), e.getMessage());
      return failed(e.errorType(), e.getMessage(), e.getStatusCode());
    } catch (CrmProviderException e) {
      log.warn("{} rejected credentials: {}", crmType.slug(), e.getMessage());
      return failed(e.errorType(), e.getMessage(), null);
    } catch (FieldMappingException e) {
      log.warn("{} mapping failed: {}", crmType.slug(), e.getMessage());
      return failed(e.errorType(), e.getMessage(), null);
    } catch (RuntimeException e) {
      log.error("Unexpected error syncing to {}", crmType.slug(), e);
      return failed(UNEXPECTED, "Unexpected error: " + e.getMessage(), null);
    }
  }

  public TargetOutcome withAuditError(String message) {
    return new TargetOutcome(success, data, error, errorType, statusCode, message);
  }
}
