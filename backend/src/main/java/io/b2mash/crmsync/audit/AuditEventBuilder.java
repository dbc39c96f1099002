package io.b2mash.crmsync.audit;

import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import java.util.UUID;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * Builder that constructs an {@link AuditEventRecord}. Source and client IP are taken from the
 * current request when there is one.
 *
 * <pre>{@code
 * AuditEventRecord record = AuditEventBuilder.builder()
 *     .eventType("integration.connected")
 *     .entityType("crm_integration")
 *     .entityId(integration.getId())
 *     .ownerId(ownerId)
 *     .details(Map.of("crmType", "klaviyo"))
 *     .build();
 * }</pre>
 */
public class AuditEventBuilder {

  private String eventType;
  private String entityType;
  private UUID entityId;
  private UUID ownerId;
  private String source;
  private Map<String, Object> details;

  private AuditEventBuilder() {}

  public static AuditEventBuilder builder() {
    return new AuditEventBuilder();
  }

  public AuditEventBuilder eventType(String eventType) {
    this.eventType = eventType;
    return this;
  }

  public AuditEventBuilder entityType(String entityType) {
    this.entityType = entityType;
    return this;
  }

  public AuditEventBuilder entityId(UUID entityId) {
    this.entityId = entityId;
    return this;
  }

  public AuditEventBuilder ownerId(UUID ownerId) {
    this.ownerId = ownerId;
    return this;
  }

  public AuditEventBuilder source(String source) {
    this.source = source;
    return this;
  }

  public AuditEventBuilder details(Map<String, Object> details) {
    this.details = details;
    return this;
  }

  public AuditEventRecord build() {
    HttpServletRequest request = resolveHttpRequest();
    String resolvedSource = source != null ? source : (request != null ? "API" : "INTERNAL");
    String ipAddress = request != null ? request.getRemoteAddr() : null;
    return new AuditEventRecord(
        eventType,
        entityType,
        entityId,
        ownerId,
        resolvedSource,
        ipAddress,
        details != null ? details : Map.of());
  }

  private static HttpServletRequest resolveHttpRequest() {
    var attrs = RequestContextHolder.getRequestAttributes();
    if (attrs instanceof ServletRequestAttributes servletAttrs) {
      return servletAttrs.getRequest();
    }
    return null;
  }
}
