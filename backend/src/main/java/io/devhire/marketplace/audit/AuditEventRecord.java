package io.devhire.marketplace.audit;

import java.util.Map;
import java.util.UUID;

/**
 * Non-JPA DTO passed to {@link AuditService#log(AuditEventRecord)} for recording audit events.
 * Constructed by {@link AuditEventBuilder} which auto-populates actor and request metadata.
 *
 * @param eventType free-form event type following {@code {entity}.{action}} convention
 * @param entityType the kind of entity being audited (e.g., "project", "task")
 * @param entityId ID of the affected entity (not a FK -- entity may be deleted later)
 * @param actorId user ID of the acting principal; null for system-initiated events
 * @param actorRole ADMIN, BUYER, DEVELOPER or SYSTEM
 * @param source origin of the action: API or INTERNAL
 * @param ipAddress client IP; null for non-HTTP sources
 * @param details key field changes; nullable
 */
public record AuditEventRecord(
    String eventType,
    String entityType,
    UUID entityId,
    UUID actorId,
    String actorRole,
    String source,
    String ipAddress,
    Map<String, Object> details) {}
