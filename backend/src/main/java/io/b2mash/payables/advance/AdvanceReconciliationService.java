package io.b2mash.payables.advance;

import io.b2mash.payables.audit.AuditEventBuilder;
import io.b2mash.payables.audit.AuditService;
import io.b2mash.payables.exception.InvalidInputException;
import io.b2mash.payables.exception.ResourceConflictException;
import io.b2mash.payables.exception.ResourceNotFoundException;
import io.b2mash.payables.invoice.InvoiceRepository;
import io.b2mash.payables.security.CurrentActor;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Links advance payments to the invoices they settle. An unlinked advance shows up in reports but
 * not in any profile ledger.
 */
@Service
public class AdvanceReconciliationService {

  private static final Logger log = LoggerFactory.getLogger(AdvanceReconciliationService.class);

  private final AdvancePaymentRepository advancePaymentRepository;
  private final InvoiceRepository invoiceRepository;
  private final AuditService auditService;

  public AdvanceReconciliationService(
      AdvancePaymentRepository advancePaymentRepository,
      InvoiceRepository invoiceRepository,
      AuditService auditService) {
    this.advancePaymentRepository = advancePaymentRepository;
    this.invoiceRepository = invoiceRepository;
    this.auditService = auditService;
  }

  @Transactional
  public AdvancePayment link(UUID advanceId, UUID invoiceId) {
    var advance = findAdvance(advanceId);
    if (advance.isArchived()) {
      throw new ResourceConflictException(
          "Advance payment archived", "Cannot link an archived advance payment");
    }
    var invoice =
        invoiceRepository
            .findById(invoiceId)
            .orElseThrow(() -> new ResourceNotFoundException("Invoice", invoiceId));
    if (!invoice.getVendorId().equals(advance.getVendorId())) {
      throw new InvalidInputException(
          "Vendor mismatch", "Advance payment and invoice belong to different vendors");
    }
    if (invoice.isArchived()) {
      throw new ResourceConflictException(
          "Invoice archived", "Cannot link an advance payment to an archived invoice");
    }
    advance.linkTo(invoiceId);
    advance = advancePaymentRepository.save(advance);

    Map<String, Object> details = new LinkedHashMap<>();
    details.put("invoice_id", invoiceId.toString());
    details.put("invoice_number", invoice.getInvoiceNumber());
    audit("advance_payment.linked", advanceId, details);
    log.info("Linked advance payment {} to invoice {}", advanceId, invoice.getInvoiceNumber());
    return advance;
  }

  @Transactional
  public AdvancePayment unlink(UUID advanceId) {
    var advance = findAdvance(advanceId);
    var previous = advance.getInvoiceId();
    if (previous == null) {
      throw new ResourceConflictException(
          "Advance payment not linked", "Advance payment is not linked to an invoice");
    }
    advance.unlink();
    advance = advancePaymentRepository.save(advance);

    Map<String, Object> details = new LinkedHashMap<>();
    details.put("previous_invoice_id", previous.toString());
    audit("advance_payment.unlinked", advanceId, details);
    log.info("Unlinked advance payment {} from invoice {}", advanceId, previous);
    return advance;
  }

  private void audit(String eventType, UUID advanceId, Map<String, Object> details) {
    auditService.log(
        AuditEventBuilder.builder()
            .eventType(eventType)
            .entityType("advance_payment")
            .entityId(advanceId)
            .actor(CurrentActor.resolve())
            .details(details)
            .build());
  }

  private AdvancePayment findAdvance(UUID id) {
    return advancePaymentRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("AdvancePayment", id));
  }
}
