package io.b2mash.payables.audit;

import java.util.Map;
import java.util.UUID;

/**
 * Non-JPA DTO passed to {@link AuditService#log(AuditEventRecord)}. Constructed by {@link
 * AuditEventBuilder}, which fills in actor and request metadata.
 *
 * @param eventType event type following the {@code {entity}.{action}} convention
 * @param entityType the kind of entity being audited (e.g., "invoice", "report_period")
 * @param entityId ID of the affected entity
 * @param actorId JWT subject of the acting user; "system" for internal actions
 * @param actorName display name of the actor
 * @param source origin of the action: API or INTERNAL
 * @param ipAddress client IP; null for non-HTTP sources
 * @param userAgent truncated User-Agent header; null for non-HTTP sources
 * @param details key field changes; nullable
 */
public record AuditEventRecord(
    String eventType,
    String entityType,
    UUID entityId,
    String actorId,
    String actorName,
    String source,
    String ipAddress,
    String userAgent,
    Map<String, Object> details) {}
