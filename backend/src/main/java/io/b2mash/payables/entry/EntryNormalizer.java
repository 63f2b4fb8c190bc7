package io.b2mash.payables.entry;

import io.b2mash.payables.advance.AdvancePayment;
import io.b2mash.payables.approval.ApprovalStatus;
import io.b2mash.payables.creditnote.CreditNote;
import io.b2mash.payables.invoice.Invoice;
import io.b2mash.payables.invoice.InvoiceStatus;
import io.b2mash.payables.payment.Payment;
import io.b2mash.payables.tds.Amounts;
import io.b2mash.payables.tds.WithholdingCalculator;
import io.b2mash.payables.tds.WithholdingResult;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Converts invoices, payments, credit notes and advance payments into {@link NormalizedEntry}
 * values. Malformed records are reported as {@link EntryIssue}s and skipped; normalization itself
 * never fails.
 */
@Component
public class EntryNormalizer {

  private static final Logger log = LoggerFactory.getLogger(EntryNormalizer.class);

  private final WithholdingCalculator calculator;

  public EntryNormalizer(WithholdingCalculator calculator) {
    this.calculator = calculator;
  }

  public NormalizationResult normalize(SourceRecords records) {
    var entries = new ArrayList<NormalizedEntry>();
    var issues = new ArrayList<EntryIssue>();

    Map<UUID, BigDecimal> paidByInvoice = new HashMap<>();
    for (Payment payment : records.payments()) {
      if (payment.getStatus() == ApprovalStatus.APPROVED && payment.getAmountPaid() != null) {
        paidByInvoice.merge(payment.getInvoiceId(), payment.getAmountPaid(), BigDecimal::add);
      }
    }

    Map<UUID, Invoice> invoicesById = new HashMap<>();
    Map<UUID, String> malformedInvoices = new HashMap<>();
    for (Invoice invoice : records.invoices()) {
      invoicesById.put(invoice.getId(), invoice);
      Optional<String> problem = invoiceProblem(invoice);
      if (problem.isPresent()) {
        malformedInvoices.put(invoice.getId(), problem.get());
        issues.add(
            new EntryIssue(
                EntryKind.INVOICE, invoice.getId(), invoice.getInvoiceNumber(), problem.get()));
        continue;
      }
      entries.add(
          toInvoiceEntry(
              invoice,
              records.vendorNames(),
              paidByInvoice.getOrDefault(invoice.getId(), BigDecimal.ZERO)));
    }

    for (Payment payment : records.payments()) {
      Invoice invoice = invoicesById.get(payment.getInvoiceId());
      Optional<String> problem =
          parentProblem(payment.getInvoiceId(), invoice, malformedInvoices)
              .or(() -> negativeAmount(payment.getAmountPaid()));
      if (problem.isPresent()) {
        issues.add(
            new EntryIssue(
                EntryKind.PAYMENT, payment.getId(), payment.getTransactionRef(), problem.get()));
        continue;
      }
      entries.add(toPaymentEntry(payment, invoice, records));
    }

    for (CreditNote creditNote : records.creditNotes()) {
      Invoice invoice = invoicesById.get(creditNote.getInvoiceId());
      Optional<String> problem =
          parentProblem(creditNote.getInvoiceId(), invoice, malformedInvoices)
              .or(() -> negativeAmount(creditNote.getAmount()));
      if (problem.isPresent()) {
        issues.add(
            new EntryIssue(
                EntryKind.CREDIT_NOTE,
                creditNote.getId(),
                creditNote.getCreditNoteNumber(),
                problem.get()));
        continue;
      }
      entries.add(toCreditNoteEntry(creditNote, invoice, records.vendorNames()));
    }

    for (AdvancePayment advance : records.advancePayments()) {
      Invoice invoice =
          advance.getInvoiceId() != null ? invoicesById.get(advance.getInvoiceId()) : null;
      Optional<String> problem = negativeAmount(advance.getAmount());
      if (problem.isEmpty() && advance.getInvoiceId() != null) {
        problem = parentProblem(advance.getInvoiceId(), invoice, malformedInvoices);
      }
      if (problem.isPresent()) {
        issues.add(
            new EntryIssue(
                EntryKind.ADVANCE_PAYMENT,
                advance.getId(),
                advance.getTransactionRef(),
                problem.get()));
        continue;
      }
      entries.add(toAdvanceEntry(advance, invoice, records));
    }

    if (!issues.isEmpty()) {
      log.warn("Excluded {} malformed record(s) during normalization", issues.size());
    }
    return new NormalizationResult(List.copyOf(entries), List.copyOf(issues));
  }

  private Optional<String> invoiceProblem(Invoice invoice) {
    if (invoice.getInvoiceAmount() == null) {
      return Optional.of("Invoice amount is missing");
    }
    if (invoice.getInvoiceAmount().signum() < 0) {
      return Optional.of("Invoice amount must not be negative");
    }
    if (invoice.getInvoiceDate() == null) {
      return Optional.of("Invoice date is missing");
    }
    if (invoice.isTdsApplicable() && invoice.getTdsPercentage() == null) {
      return Optional.of("TDS is applicable but no TDS percentage is set");
    }
    if (invoice.isTdsApplicable()) {
      return calculator.validatePercentage(invoice.getTdsPercentage());
    }
    return Optional.empty();
  }

  private static Optional<String> parentProblem(
      UUID invoiceId, Invoice invoice, Map<UUID, String> malformedInvoices) {
    if (invoice == null) {
      return Optional.of("Referenced invoice " + invoiceId + " was not found");
    }
    if (malformedInvoices.containsKey(invoiceId)) {
      return Optional.of(
          "Referenced invoice "
              + invoice.getInvoiceNumber()
              + " is malformed: "
              + malformedInvoices.get(invoiceId));
    }
    return Optional.empty();
  }

  private static Optional<String> negativeAmount(BigDecimal amount) {
    if (amount == null) {
      return Optional.of("Amount is missing");
    }
    if (amount.signum() < 0) {
      return Optional.of("Amount must not be negative");
    }
    return Optional.empty();
  }

  private WithholdingResult invoiceWithholding(
      Invoice invoice, BigDecimal grossAmount, boolean roundUp) {
    if (!invoice.isTdsApplicable()) {
      return WithholdingResult.none(grossAmount);
    }
    return calculator.withhold(grossAmount, invoice.getTdsPercentage(), roundUp);
  }

  private InvoiceEntry toInvoiceEntry(
      Invoice invoice, Map<UUID, String> vendorNames, BigDecimal paidToDate) {
    var withholding =
        invoiceWithholding(invoice, invoice.getInvoiceAmount(), invoice.isTdsRounded());
    BigDecimal paid = Amounts.money(paidToDate);
    String status = invoice.getStatus().value();
    return new InvoiceEntry(
        invoice.getId(),
        contextOf(invoice, vendorNames, invoice.isArchived()),
        invoice.getInvoiceNumber(),
        invoice.getInvoiceName(),
        invoice.getInvoiceDate(),
        effectiveDate(invoice),
        invoice.getDueDate(),
        invoice.getCurrency(),
        Amounts.money(invoice.getInvoiceAmount()),
        invoice.isTdsApplicable() ? invoice.getTdsPercentage() : null,
        invoice.isTdsRounded(),
        withholding.withheldAmount(),
        withholding.payableAmount(),
        paid,
        status,
        displayStatus(invoice.getStatus(), paid, withholding.payableAmount()));
  }

  private static LocalDate effectiveDate(Invoice invoice) {
    if (invoice.getReportingMonth() != null) {
      return invoice.getReportingMonth();
    }
    return invoice.getReceivedDate() != null ? invoice.getReceivedDate() : invoice.getInvoiceDate();
  }

  private static String displayStatus(InvoiceStatus status, BigDecimal paid, BigDecimal payable) {
    if (status == InvoiceStatus.PARTIAL || (status.isSettlementTracked() && paid.signum() > 0)) {
      if (!Amounts.isSettled(paid, payable)) {
        return status.value() + " " + Amounts.percentOf(paid, payable) + "%";
      }
    }
    return status.value();
  }

  private PaymentEntry toPaymentEntry(Payment payment, Invoice invoice, SourceRecords records) {
    BigDecimal withheld =
        payment.getTdsAmountApplied() != null
            ? Amounts.money(payment.getTdsAmountApplied())
            : invoiceWithholding(invoice, invoice.getInvoiceAmount(), payment.isTdsRounded())
                .withheldAmount();
    return new PaymentEntry(
        payment.getId(),
        contextOf(invoice, records.vendorNames(), invoice.isArchived()),
        invoice.getId(),
        invoice.getInvoiceNumber(),
        payment.getPaymentDate(),
        Amounts.money(payment.getAmountPaid()),
        payment.getPaymentTypeId(),
        records.paymentTypeNames().get(payment.getPaymentTypeId()),
        payment.getTransactionRef(),
        withheld,
        payment.isTdsRounded(),
        payment.getStatus().value());
  }

  private CreditNoteEntry toCreditNoteEntry(
      CreditNote creditNote, Invoice invoice, Map<UUID, String> vendorNames) {
    BigDecimal gross = Amounts.money(creditNote.getAmount()).negate();
    BigDecimal withheld;
    if (!creditNote.isTdsApplicable()) {
      withheld = Amounts.ZERO;
    } else if (creditNote.getTdsAmount() != null) {
      withheld = Amounts.money(creditNote.getTdsAmount()).negate();
    } else {
      withheld = invoiceWithholding(invoice, gross, invoice.isTdsRounded()).withheldAmount();
    }
    return new CreditNoteEntry(
        creditNote.getId(),
        contextOf(invoice, vendorNames, creditNote.isArchived()),
        invoice.getId(),
        invoice.getInvoiceNumber(),
        creditNote.getCreditNoteNumber(),
        creditNote.getCreditNoteDate(),
        creditNote.getReportingMonth() != null
            ? creditNote.getReportingMonth()
            : creditNote.getCreditNoteDate(),
        gross,
        withheld,
        creditNote.getStatus().value(),
        creditNote.getReason());
  }

  private AdvancePaymentEntry toAdvanceEntry(
      AdvancePayment advance, Invoice invoice, SourceRecords records) {
    var context =
        new EntryContext(
            invoice != null ? invoice.getProfileId() : null,
            advance.getVendorId(),
            records.vendorNames().get(advance.getVendorId()),
            invoice != null ? invoice.getEntityId() : null,
            invoice != null ? invoice.getCategoryId() : null,
            invoice != null && invoice.isRecurring(),
            false,
            advance.isArchived());
    return new AdvancePaymentEntry(
        advance.getId(),
        context,
        advance.getInvoiceId(),
        invoice != null ? invoice.getInvoiceNumber() : null,
        advance.getPaymentDate(),
        advance.getReportingMonth() != null
            ? advance.getReportingMonth()
            : advance.getPaymentDate(),
        Amounts.money(advance.getAmount()),
        advance.getPaymentTypeId(),
        records.paymentTypeNames().get(advance.getPaymentTypeId()),
        advance.getTransactionRef(),
        advance.getDescription(),
        advance.getStatus().value());
  }

  private static EntryContext contextOf(
      Invoice invoice, Map<UUID, String> vendorNames, boolean archived) {
    return new EntryContext(
        invoice.getProfileId(),
        invoice.getVendorId(),
        vendorNames.get(invoice.getVendorId()),
        invoice.getEntityId(),
        invoice.getCategoryId(),
        invoice.isRecurring(),
        invoice.isTdsApplicable(),
        archived);
  }
}
