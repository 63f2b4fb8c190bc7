package io.b2mash.payables.payment;

import io.b2mash.payables.approval.ApprovalStatus;
import io.b2mash.payables.audit.AuditEventBuilder;
import io.b2mash.payables.audit.AuditService;
import io.b2mash.payables.event.PaymentRecordedEvent;
import io.b2mash.payables.exception.InvalidInputException;
import io.b2mash.payables.exception.ResourceConflictException;
import io.b2mash.payables.exception.ResourceNotFoundException;
import io.b2mash.payables.invoice.Invoice;
import io.b2mash.payables.invoice.InvoiceRepository;
import io.b2mash.payables.paymenttype.PaymentTypeRepository;
import io.b2mash.payables.security.CurrentActor;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Records payments against invoices. A new payment waits for approval and does not affect the
 * invoice status until it is approved.
 */
@Service
public class PaymentRecordingService {

  private static final Logger log = LoggerFactory.getLogger(PaymentRecordingService.class);

  private final PaymentRepository paymentRepository;
  private final InvoiceRepository invoiceRepository;
  private final PaymentTypeRepository paymentTypeRepository;
  private final AuditService auditService;
  private final ApplicationEventPublisher eventPublisher;

  public PaymentRecordingService(
      PaymentRepository paymentRepository,
      InvoiceRepository invoiceRepository,
      PaymentTypeRepository paymentTypeRepository,
      AuditService auditService,
      ApplicationEventPublisher eventPublisher) {
    this.paymentRepository = paymentRepository;
    this.invoiceRepository = invoiceRepository;
    this.paymentTypeRepository = paymentTypeRepository;
    this.auditService = auditService;
    this.eventPublisher = eventPublisher;
  }

  /**
   * Records a pending payment.
   *
   * @param tdsAmountApplied withholding actually deducted; null to derive it from the invoice
   * @param tdsRounded rounding used at payment time; null to use the invoice's setting
   */
  @Transactional
  public Payment recordPayment(
      UUID invoiceId,
      BigDecimal amount,
      LocalDate paymentDate,
      UUID paymentTypeId,
      String transactionRef,
      BigDecimal tdsAmountApplied,
      Boolean tdsRounded) {
    if (amount == null || amount.signum() <= 0) {
      throw new InvalidInputException("Invalid amount", "Payment amount must be positive");
    }
    if (tdsAmountApplied != null && tdsAmountApplied.signum() < 0) {
      throw new InvalidInputException("Invalid TDS amount", "TDS amount must not be negative");
    }
    Invoice invoice =
        invoiceRepository
            .findById(invoiceId)
            .orElseThrow(() -> new ResourceNotFoundException("Invoice", invoiceId));
    requirePayable(invoice);
    if (paymentTypeId != null) {
      var paymentType =
          paymentTypeRepository
              .findById(paymentTypeId)
              .orElseThrow(() -> new ResourceNotFoundException("PaymentType", paymentTypeId));
      if (!paymentType.isActive()) {
        throw new InvalidInputException(
            "Invalid payment type", "Payment type " + paymentType.getName() + " is inactive");
      }
    }

    var actor = CurrentActor.resolve();
    var payment =
        new Payment(
            invoiceId,
            amount,
            paymentDate != null ? paymentDate : LocalDate.now(),
            paymentTypeId,
            transactionRef,
            actor.id());
    payment.recordWithholding(
        tdsAmountApplied, tdsRounded != null ? tdsRounded : invoice.isTdsRounded());
    payment = paymentRepository.save(payment);

    Map<String, Object> details = new LinkedHashMap<>();
    details.put("invoice_id", invoiceId.toString());
    details.put("invoice_number", invoice.getInvoiceNumber());
    details.put("amount", amount.toPlainString());
    details.put("payment_date", payment.getPaymentDate().toString());
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("payment.recorded")
            .entityType("payment")
            .entityId(payment.getId())
            .actor(actor)
            .details(details)
            .build());
    eventPublisher.publishEvent(
        new PaymentRecordedEvent(
            "payment.recorded",
            "payment",
            payment.getId(),
            actor.id(),
            actor.name(),
            Instant.now(),
            details,
            invoiceId,
            amount));

    log.info(
        "Recorded payment {} of {} against invoice {}",
        payment.getId(),
        amount,
        invoice.getInvoiceNumber());
    return payment;
  }

  private void requirePayable(Invoice invoice) {
    if (invoice.isArchived()) {
      throw new ResourceConflictException(
          "Invoice archived", "Cannot record a payment against an archived invoice");
    }
    switch (invoice.getStatus()) {
      case PENDING_APPROVAL ->
          throw new ResourceConflictException(
              "Invoice not approved", "Invoice must be approved before recording payments");
      case REJECTED ->
          throw new ResourceConflictException(
              "Invoice rejected", "Cannot record a payment against a rejected invoice");
      case ON_HOLD ->
          throw new ResourceConflictException(
              "Invoice on hold", "Cannot record a payment against an invoice on hold");
      case PAID ->
          throw new ResourceConflictException("Invoice paid", "Invoice is already fully paid");
      case UNPAID, PARTIAL, OVERDUE -> {}
    }
    if (paymentRepository.existsByInvoiceIdAndStatus(
        invoice.getId(), ApprovalStatus.PENDING_APPROVAL)) {
      throw new ResourceConflictException(
          "Payment pending", "Invoice already has a payment awaiting approval");
    }
  }
}
