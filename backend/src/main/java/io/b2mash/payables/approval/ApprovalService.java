package io.b2mash.payables.approval;

import io.b2mash.payables.advance.AdvancePayment;
import io.b2mash.payables.advance.AdvancePaymentRepository;
import io.b2mash.payables.audit.AuditEventBuilder;
import io.b2mash.payables.audit.AuditService;
import io.b2mash.payables.creditnote.CreditNote;
import io.b2mash.payables.creditnote.CreditNoteRepository;
import io.b2mash.payables.event.DocumentApprovedEvent;
import io.b2mash.payables.event.DocumentArchivedEvent;
import io.b2mash.payables.event.DocumentRejectedEvent;
import io.b2mash.payables.exception.InvalidInputException;
import io.b2mash.payables.exception.ResourceNotFoundException;
import io.b2mash.payables.invoice.Invoice;
import io.b2mash.payables.invoice.InvoiceRepository;
import io.b2mash.payables.invoice.InvoiceSettlementService;
import io.b2mash.payables.invoice.InvoiceStatus;
import io.b2mash.payables.payment.Payment;
import io.b2mash.payables.payment.PaymentRepository;
import io.b2mash.payables.security.CurrentActor;
import io.b2mash.payables.vendor.Vendor;
import io.b2mash.payables.vendor.VendorRepository;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Approve, reject and archive for every reviewed document kind. Repeating an action that already
 * happened succeeds without side effects; the opposite action on a reviewed document is a
 * conflict. Concurrent reviews of the same document are serialized by its version column.
 */
@Service
public class ApprovalService {

  private static final Logger log = LoggerFactory.getLogger(ApprovalService.class);

  static final int MIN_REASON_LENGTH = 10;
  static final int MAX_REASON_LENGTH = 500;

  private final VendorRepository vendorRepository;
  private final InvoiceRepository invoiceRepository;
  private final PaymentRepository paymentRepository;
  private final CreditNoteRepository creditNoteRepository;
  private final AdvancePaymentRepository advancePaymentRepository;
  private final InvoiceSettlementService settlementService;
  private final AuditService auditService;
  private final ApplicationEventPublisher eventPublisher;

  public ApprovalService(
      VendorRepository vendorRepository,
      InvoiceRepository invoiceRepository,
      PaymentRepository paymentRepository,
      CreditNoteRepository creditNoteRepository,
      AdvancePaymentRepository advancePaymentRepository,
      InvoiceSettlementService settlementService,
      AuditService auditService,
      ApplicationEventPublisher eventPublisher) {
    this.vendorRepository = vendorRepository;
    this.invoiceRepository = invoiceRepository;
    this.paymentRepository = paymentRepository;
    this.creditNoteRepository = creditNoteRepository;
    this.advancePaymentRepository = advancePaymentRepository;
    this.settlementService = settlementService;
    this.auditService = auditService;
    this.eventPublisher = eventPublisher;
  }

  @Transactional
  public ApprovalResult approve(DocumentKind kind, UUID id) {
    var actor = CurrentActor.resolve();
    boolean changed;
    String status;
    switch (kind) {
      case VENDOR -> {
        Vendor vendor = findVendor(id);
        changed = vendor.approve();
        vendorRepository.save(vendor);
        status = vendor.getStatus().value();
      }
      case INVOICE -> {
        Invoice invoice = findInvoice(id);
        changed = invoice.approve();
        invoice = changed ? settlementService.refresh(invoice) : invoice;
        status = invoice.getStatus().value();
      }
      case PAYMENT -> {
        Payment payment = findPayment(id);
        changed = payment.approve(actor.id());
        paymentRepository.save(payment);
        if (changed) {
          settlementService.refresh(findInvoice(payment.getInvoiceId()));
        }
        status = payment.getStatus().value();
      }
      case CREDIT_NOTE -> {
        CreditNote creditNote = findCreditNote(id);
        changed = creditNote.approve();
        creditNoteRepository.save(creditNote);
        status = creditNote.getStatus().value();
      }
      case ADVANCE_PAYMENT -> {
        AdvancePayment advance = findAdvance(id);
        changed = advance.approve();
        advancePaymentRepository.save(advance);
        status = advance.getStatus().value();
      }
      default -> throw new IllegalStateException("Unexpected document kind: " + kind);
    }

    if (changed) {
      var details = details(kind, status);
      record(kind.value() + ".approved", kind, id, actor, details);
      eventPublisher.publishEvent(
          new DocumentApprovedEvent(
              kind.value() + ".approved",
              kind.value(),
              id,
              actor.id(),
              actor.name(),
              Instant.now(),
              details));
      log.info("Approved {} {}", kind.label(), id);
    } else {
      log.debug("Ignored repeated approval of {} {}", kind.label(), id);
    }
    return new ApprovalResult(kind, id, status, changed);
  }

  @Transactional
  public ApprovalResult reject(DocumentKind kind, UUID id, String reason) {
    String trimmed = validateReason(reason);
    var actor = CurrentActor.resolve();
    boolean changed;
    String status;
    switch (kind) {
      case VENDOR -> {
        Vendor vendor = findVendor(id);
        changed = vendor.reject(trimmed);
        vendorRepository.save(vendor);
        status = vendor.getStatus().value();
      }
      case INVOICE -> {
        Invoice invoice = findInvoice(id);
        changed = invoice.reject(trimmed);
        invoiceRepository.save(invoice);
        status = invoice.getStatus().value();
      }
      case PAYMENT -> {
        Payment payment = findPayment(id);
        changed = payment.reject(trimmed);
        paymentRepository.save(payment);
        status = payment.getStatus().value();
      }
      case CREDIT_NOTE -> {
        CreditNote creditNote = findCreditNote(id);
        changed = creditNote.reject(trimmed);
        creditNoteRepository.save(creditNote);
        status = creditNote.getStatus().value();
      }
      case ADVANCE_PAYMENT -> {
        AdvancePayment advance = findAdvance(id);
        changed = advance.reject(trimmed);
        advancePaymentRepository.save(advance);
        status = advance.getStatus().value();
      }
      default -> throw new IllegalStateException("Unexpected document kind: " + kind);
    }

    if (changed) {
      var details = details(kind, status);
      details.put("reason", trimmed);
      record(kind.value() + ".rejected", kind, id, actor, details);
      eventPublisher.publishEvent(
          new DocumentRejectedEvent(
              kind.value() + ".rejected",
              kind.value(),
              id,
              actor.id(),
              actor.name(),
              Instant.now(),
              details));
      log.info("Rejected {} {}", kind.label(), id);
    }
    return new ApprovalResult(kind, id, status, changed);
  }

  /**
   * Soft-deletes an invoice, credit note or advance payment.
   *
   * @throws io.b2mash.payables.exception.ResourceConflictException if already archived
   */
  @Transactional
  public ApprovalResult archive(DocumentKind kind, UUID id, String reason) {
    if (!kind.isArchivable()) {
      throw new InvalidInputException(
          "Invalid document type", "A " + kind.label() + " cannot be archived");
    }
    String trimmed = reason != null && !reason.isBlank() ? reason.trim() : null;
    if (trimmed != null && trimmed.length() > MAX_REASON_LENGTH) {
      throw new InvalidInputException(
          "Invalid reason", "Reason must be at most " + MAX_REASON_LENGTH + " characters");
    }
    var actor = CurrentActor.resolve();
    String status;
    switch (kind) {
      case INVOICE -> {
        Invoice invoice = findInvoice(id);
        invoice.archive(trimmed, actor.id());
        invoiceRepository.save(invoice);
        status = invoice.getStatus().value();
      }
      case CREDIT_NOTE -> {
        CreditNote creditNote = findCreditNote(id);
        creditNote.archive(trimmed, actor.id());
        creditNoteRepository.save(creditNote);
        status = creditNote.getStatus().value();
      }
      case ADVANCE_PAYMENT -> {
        AdvancePayment advance = findAdvance(id);
        advance.archive(trimmed, actor.id());
        advancePaymentRepository.save(advance);
        status = advance.getStatus().value();
      }
      default -> throw new IllegalStateException("Unexpected document kind: " + kind);
    }

    var details = details(kind, status);
    if (trimmed != null) {
      details.put("reason", trimmed);
    }
    record(kind.value() + ".archived", kind, id, actor, details);
    eventPublisher.publishEvent(
        new DocumentArchivedEvent(
            kind.value() + ".archived",
            kind.value(),
            id,
            actor.id(),
            actor.name(),
            Instant.now(),
            details));
    log.info("Archived {} {}", kind.label(), id);
    return new ApprovalResult(kind, id, status, true);
  }

  @Transactional(readOnly = true)
  public PendingCounts pendingCounts() {
    return new PendingCounts(
        vendorRepository.countByStatus(ApprovalStatus.PENDING_APPROVAL),
        invoiceRepository.countActiveByStatus(InvoiceStatus.PENDING_APPROVAL),
        paymentRepository.countByStatus(ApprovalStatus.PENDING_APPROVAL),
        creditNoteRepository.countActiveByStatus(ApprovalStatus.PENDING_APPROVAL),
        advancePaymentRepository.countActiveByStatus(ApprovalStatus.PENDING_APPROVAL));
  }

  static String validateReason(String reason) {
    String trimmed = reason == null ? "" : reason.trim();
    if (trimmed.length() < MIN_REASON_LENGTH || trimmed.length() > MAX_REASON_LENGTH) {
      throw new InvalidInputException(
          "Invalid rejection reason",
          "Rejection reason must be between "
              + MIN_REASON_LENGTH
              + " and "
              + MAX_REASON_LENGTH
              + " characters");
    }
    return trimmed;
  }

  private void record(
      String eventType,
      DocumentKind kind,
      UUID id,
      CurrentActor actor,
      Map<String, Object> details) {
    auditService.log(
        AuditEventBuilder.builder()
            .eventType(eventType)
            .entityType(kind.value())
            .entityId(id)
            .actor(actor)
            .details(details)
            .build());
  }

  private static Map<String, Object> details(DocumentKind kind, String status) {
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("document_type", kind.value());
    details.put("status", status);
    return details;
  }

  private Vendor findVendor(UUID id) {
    return vendorRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("Vendor", id));
  }

  private Invoice findInvoice(UUID id) {
    return invoiceRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("Invoice", id));
  }

  private Payment findPayment(UUID id) {
    return paymentRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("Payment", id));
  }

  private CreditNote findCreditNote(UUID id) {
    return creditNoteRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("CreditNote", id));
  }

  private AdvancePayment findAdvance(UUID id) {
    return advancePaymentRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("AdvancePayment", id));
  }
}
