package io.b2mash.payables.entry;

import io.b2mash.payables.advance.AdvancePayment;
import io.b2mash.payables.advance.AdvancePaymentRepository;
import io.b2mash.payables.approval.ApprovalStatus;
import io.b2mash.payables.creditnote.CreditNote;
import io.b2mash.payables.creditnote.CreditNoteRepository;
import io.b2mash.payables.invoice.Invoice;
import io.b2mash.payables.invoice.InvoiceRepository;
import io.b2mash.payables.payment.Payment;
import io.b2mash.payables.payment.PaymentRepository;
import io.b2mash.payables.paymenttype.PaymentType;
import io.b2mash.payables.paymenttype.PaymentTypeRepository;
import io.b2mash.payables.vendor.Vendor;
import io.b2mash.payables.vendor.VendorRepository;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Fetches the source documents a ledger, report or feed needs. Every loader closes the invoice set
 * over the documents it returns, and for period loads also pulls every approved payment of those
 * invoices so cumulative paid amounts are correct regardless of when a payment was made.
 */
@Service
public class SourceRecordLoader {

  private static final Logger log = LoggerFactory.getLogger(SourceRecordLoader.class);

  private final InvoiceRepository invoiceRepository;
  private final PaymentRepository paymentRepository;
  private final CreditNoteRepository creditNoteRepository;
  private final AdvancePaymentRepository advancePaymentRepository;
  private final VendorRepository vendorRepository;
  private final PaymentTypeRepository paymentTypeRepository;

  public SourceRecordLoader(
      InvoiceRepository invoiceRepository,
      PaymentRepository paymentRepository,
      CreditNoteRepository creditNoteRepository,
      AdvancePaymentRepository advancePaymentRepository,
      VendorRepository vendorRepository,
      PaymentTypeRepository paymentTypeRepository) {
    this.invoiceRepository = invoiceRepository;
    this.paymentRepository = paymentRepository;
    this.creditNoteRepository = creditNoteRepository;
    this.advancePaymentRepository = advancePaymentRepository;
    this.vendorRepository = vendorRepository;
    this.paymentTypeRepository = paymentTypeRepository;
  }

  /** Invoices of one billing profile with their approved payments, credit notes and advances. */
  @Transactional(readOnly = true)
  public SourceRecords forProfile(UUID profileId) {
    var invoices = invoiceRepository.findByProfileId(profileId);
    var invoiceIds = idsOf(invoices);
    if (invoiceIds.isEmpty()) {
      return assemble(invoices, List.of(), List.of(), List.of());
    }
    return assemble(
        invoices,
        paymentRepository.findByInvoiceIdsAndStatus(invoiceIds, ApprovalStatus.APPROVED),
        creditNoteRepository.findByInvoiceIds(invoiceIds),
        advancePaymentRepository.findByInvoiceIds(invoiceIds));
  }

  /**
   * Documents whose effective date falls in the range, plus approved payments made in the range.
   * Used by the live report.
   */
  @Transactional(readOnly = true)
  public SourceRecords forEffectivePeriod(LocalDate start, LocalDate end) {
    return completePeriod(
        invoiceRepository.findByEffectiveDateBetween(start, end),
        paymentRepository.findByStatusAndPaymentDateBetween(ApprovalStatus.APPROVED, start, end),
        creditNoteRepository.findByEffectiveDateBetween(start, end),
        advancePaymentRepository.findByEffectiveDateBetween(start, end));
  }

  /** Documents dated in the range, ignoring reporting-month overrides. */
  @Transactional(readOnly = true)
  public SourceRecords forInvoiceDatePeriod(LocalDate start, LocalDate end) {
    return completePeriod(
        invoiceRepository.findByInvoiceDateBetween(start, end),
        List.of(),
        creditNoteRepository.findByCreditNoteDateBetween(start, end),
        advancePaymentRepository.findByPaymentDateBetween(start, end));
  }

  /** Every document in every status, for the unified feed. */
  @Transactional(readOnly = true)
  public SourceRecords all() {
    return assemble(
        invoiceRepository.findAllOrdered(),
        paymentRepository.findAllOrdered(),
        creditNoteRepository.findAllOrdered(),
        advancePaymentRepository.findAllOrdered());
  }

  private SourceRecords completePeriod(
      List<Invoice> invoices,
      List<Payment> payments,
      List<CreditNote> creditNotes,
      List<AdvancePayment> advances) {
    Map<UUID, Invoice> invoicesById = new LinkedHashMap<>();
    invoices.forEach(invoice -> invoicesById.put(invoice.getId(), invoice));

    Set<UUID> referenced = new LinkedHashSet<>();
    payments.forEach(payment -> referenced.add(payment.getInvoiceId()));
    creditNotes.forEach(creditNote -> referenced.add(creditNote.getInvoiceId()));
    advances.stream()
        .map(AdvancePayment::getInvoiceId)
        .filter(id -> id != null)
        .forEach(referenced::add);
    referenced.removeAll(invoicesById.keySet());
    if (!referenced.isEmpty()) {
      invoiceRepository
          .findAllById(referenced)
          .forEach(invoice -> invoicesById.put(invoice.getId(), invoice));
    }

    Map<UUID, Payment> paymentsById = new LinkedHashMap<>();
    if (!invoicesById.isEmpty()) {
      paymentRepository
          .findByInvoiceIdsAndStatus(invoicesById.keySet(), ApprovalStatus.APPROVED)
          .forEach(payment -> paymentsById.put(payment.getId(), payment));
    }
    payments.forEach(payment -> paymentsById.putIfAbsent(payment.getId(), payment));

    log.debug(
        "Loaded period records: {} invoices, {} payments, {} credit notes, {} advances",
        invoicesById.size(),
        paymentsById.size(),
        creditNotes.size(),
        advances.size());
    return assemble(
        new ArrayList<>(invoicesById.values()),
        new ArrayList<>(paymentsById.values()),
        creditNotes,
        advances);
  }

  private SourceRecords assemble(
      List<Invoice> invoices,
      List<Payment> payments,
      List<CreditNote> creditNotes,
      List<AdvancePayment> advances) {
    Map<UUID, String> vendorNames = new HashMap<>();
    for (Vendor vendor : vendorRepository.findAll()) {
      vendorNames.put(vendor.getId(), vendor.getName());
    }
    Map<UUID, String> paymentTypeNames = new HashMap<>();
    for (PaymentType paymentType : paymentTypeRepository.findAll()) {
      paymentTypeNames.put(paymentType.getId(), paymentType.getName());
    }
    return new SourceRecords(
        List.copyOf(invoices),
        List.copyOf(payments),
        List.copyOf(creditNotes),
        List.copyOf(advances),
        vendorNames,
        paymentTypeNames);
  }

  private static List<UUID> idsOf(List<Invoice> invoices) {
    return invoices.stream().map(Invoice::getId).toList();
  }
}
