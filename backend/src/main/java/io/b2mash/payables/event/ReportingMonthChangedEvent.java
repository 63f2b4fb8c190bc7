package io.b2mash.payables.event;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import java.util.UUID;

/**
 * @param previousMonth first day of the month the document was filed under before; null if none
 * @param newMonth first day of the new reporting month; null when the override was cleared
 */
public record ReportingMonthChangedEvent(
    String eventType,
    String entityType,
    UUID entityId,
    String actorId,
    String actorName,
    Instant occurredAt,
    Map<String, Object> details,
    LocalDate previousMonth,
    LocalDate newMonth)
    implements DomainEvent {}
