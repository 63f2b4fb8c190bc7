package io.b2mash.payables.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/** Logs every committed domain event. Events of rolled-back transactions are never seen here. */
@Component
public class DomainEventLogger {

  private static final Logger log = LoggerFactory.getLogger(DomainEventLogger.class);

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onDomainEvent(DomainEvent event) {
    log.info(
        "{} {}={} by {} details={}",
        event.eventType(),
        event.entityType(),
        event.entityId(),
        event.actorId(),
        event.details());
  }
}
