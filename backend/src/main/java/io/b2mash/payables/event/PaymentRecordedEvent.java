package io.b2mash.payables.event;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record PaymentRecordedEvent(
    String eventType,
    String entityType,
    UUID entityId,
    String actorId,
    String actorName,
    Instant occurredAt,
    Map<String, Object> details,
    UUID invoiceId,
    BigDecimal amount)
    implements DomainEvent {}
