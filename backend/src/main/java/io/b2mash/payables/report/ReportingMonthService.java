package io.b2mash.payables.report;

import io.b2mash.payables.advance.AdvancePaymentRepository;
import io.b2mash.payables.approval.DocumentKind;
import io.b2mash.payables.audit.AuditEventBuilder;
import io.b2mash.payables.audit.AuditService;
import io.b2mash.payables.creditnote.CreditNoteRepository;
import io.b2mash.payables.event.ReportingMonthChangedEvent;
import io.b2mash.payables.exception.InvalidInputException;
import io.b2mash.payables.exception.ResourceNotFoundException;
import io.b2mash.payables.invoice.InvoiceRepository;
import io.b2mash.payables.security.CurrentActor;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Moves invoices, credit notes and advance payments between report periods by setting or clearing
 * their reporting month. Finalized snapshots are unaffected; the move shows up in live views only.
 */
@Service
public class ReportingMonthService {

  private static final Logger log = LoggerFactory.getLogger(ReportingMonthService.class);

  private final InvoiceRepository invoiceRepository;
  private final CreditNoteRepository creditNoteRepository;
  private final AdvancePaymentRepository advancePaymentRepository;
  private final AuditService auditService;
  private final ApplicationEventPublisher eventPublisher;

  public ReportingMonthService(
      InvoiceRepository invoiceRepository,
      CreditNoteRepository creditNoteRepository,
      AdvancePaymentRepository advancePaymentRepository,
      AuditService auditService,
      ApplicationEventPublisher eventPublisher) {
    this.invoiceRepository = invoiceRepository;
    this.creditNoteRepository = creditNoteRepository;
    this.advancePaymentRepository = advancePaymentRepository;
    this.auditService = auditService;
    this.eventPublisher = eventPublisher;
  }

  /**
   * Assigns a reporting month. Passing null for both month and year clears the override.
   *
   * @return the first day of the new reporting month, or null when cleared
   */
  @Transactional
  public LocalDate setReportingMonth(DocumentKind kind, UUID id, Integer month, Integer year) {
    if (!kind.hasReportingMonth()) {
      throw new InvalidInputException(
          "Invalid document type", "A " + kind.label() + " has no reporting month");
    }
    YearMonth target = toTarget(month, year);

    LocalDate previous =
        switch (kind) {
          case INVOICE -> {
            var invoice =
                invoiceRepository
                    .findById(id)
                    .orElseThrow(() -> new ResourceNotFoundException("Invoice", id));
            var before = invoice.getReportingMonth();
            invoice.assignReportingMonth(target);
            invoiceRepository.save(invoice);
            yield before;
          }
          case CREDIT_NOTE -> {
            var creditNote =
                creditNoteRepository
                    .findById(id)
                    .orElseThrow(() -> new ResourceNotFoundException("CreditNote", id));
            var before = creditNote.getReportingMonth();
            creditNote.assignReportingMonth(target);
            creditNoteRepository.save(creditNote);
            yield before;
          }
          case ADVANCE_PAYMENT -> {
            var advance =
                advancePaymentRepository
                    .findById(id)
                    .orElseThrow(() -> new ResourceNotFoundException("AdvancePayment", id));
            var before = advance.getReportingMonth();
            advance.assignReportingMonth(target);
            advancePaymentRepository.save(advance);
            yield before;
          }
          case VENDOR, PAYMENT -> throw new IllegalStateException("Unreachable: " + kind);
        };

    LocalDate next = target != null ? target.atDay(1) : null;
    var actor = CurrentActor.resolve();
    Map<String, Object> details = new HashMap<>();
    details.put("previous_month", previous != null ? previous.toString() : null);
    details.put("new_month", next != null ? next.toString() : null);
    auditService.log(
        AuditEventBuilder.builder()
            .eventType(kind.value() + ".reporting_month_changed")
            .entityType(kind.value())
            .entityId(id)
            .actor(actor)
            .details(details)
            .build());
    eventPublisher.publishEvent(
        new ReportingMonthChangedEvent(
            kind.value() + ".reporting_month_changed",
            kind.value(),
            id,
            actor.id(),
            actor.name(),
            Instant.now(),
            details,
            previous,
            next));

    log.info("Moved {} {} from reporting month {} to {}", kind.value(), id, previous, next);
    return next;
  }

  private static YearMonth toTarget(Integer month, Integer year) {
    if (month == null && year == null) {
      return null;
    }
    if (month == null || year == null) {
      throw new InvalidInputException(
          "Invalid reporting month", "Month and year must be given together");
    }
    return MonthlyReportService.toYearMonth(month, year);
  }
}
