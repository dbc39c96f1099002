package io.b2mash.crmsync.audit;

import java.util.Map;
import java.util.UUID;

/**
 * Non-JPA DTO passed to {@link AuditService#log(AuditEventRecord)}. Constructed by {@link
 * AuditEventBuilder}, which fills in source and request metadata.
 *
 * @param eventType event type following the {@code {entity}.{action}} convention
 * @param entityType the kind of entity being audited, e.g. "crm_integration"
 * @param entityId ID of the affected entity
 * @param ownerId owning user or account; null for system events
 * @param source API or INTERNAL
 * @param ipAddress client IP; null outside an HTTP request
 * @param details key facts about the change; never credentials
 */
public record AuditEventRecord(
    String eventType,
    String entityType,
    UUID entityId,
    UUID ownerId,
    String source,
    String ipAddress,
    Map<String, Object> details) {}
