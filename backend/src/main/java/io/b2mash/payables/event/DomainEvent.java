package io.b2mash.payables.event;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Base interface for domain events published via Spring ApplicationEventPublisher. Implementations
 * are records holding identifiers and values only, never JPA entities, so they stay valid after the
 * publishing transaction commits.
 *
 * <p>Events are the explicit signal that derived views (pending counts, ledgers, reports) changed;
 * nothing is cached behind them.
 */
public sealed interface DomainEvent
    permits DocumentApprovedEvent,
        DocumentRejectedEvent,
        DocumentArchivedEvent,
        PaymentRecordedEvent,
        ReportingMonthChangedEvent,
        ReportFinalizedEvent,
        ReportSubmittedEvent,
        ReportUnfinalizedEvent {

  String eventType();

  String entityType();

  UUID entityId();

  String actorId();

  String actorName();

  Instant occurredAt();

  Map<String, Object> details();
}
