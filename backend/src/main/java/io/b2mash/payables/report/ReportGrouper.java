package io.b2mash.payables.report;

import io.b2mash.payables.approval.ApprovalStatus;
import io.b2mash.payables.entry.AdvancePaymentEntry;
import io.b2mash.payables.entry.CreditNoteEntry;
import io.b2mash.payables.entry.EntryKind;
import io.b2mash.payables.entry.InvoiceEntry;
import io.b2mash.payables.entry.NormalizationResult;
import io.b2mash.payables.entry.NormalizedEntry;
import io.b2mash.payables.entry.PaymentEntry;
import io.b2mash.payables.tds.Amounts;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * Groups one month of normalized entries into report sections.
 *
 * <p>Sections appear in this order: configured payment types (as given), payment types that are no
 * longer configured (first seen first), Credit Notes, Unpaid. Empty sections are dropped and serial
 * numbers restart at 1 in every section.
 *
 * <p>The entries passed in must include every approved payment of every invoice involved, not only
 * the payments of the month, so that cumulative payment statuses are right.
 */
@Component
public class ReportGrouper {

  static final String CREDIT_NOTES_SECTION = "Credit Notes";
  static final String UNPAID_SECTION = "Unpaid";
  static final String UNKNOWN_PAYMENT_TYPE = "Unknown payment type";

  public MonthlyReport buildReport(
      YearMonth period,
      ReportMode mode,
      NormalizationResult normalized,
      List<PaymentTypeRef> paymentTypes,
      Instant generatedAt) {
    var input = new Input(normalized.entries());
    var sections = new SectionSet(paymentTypes);

    switch (mode) {
      case LIVE -> groupLive(period, input, sections);
      case INVOICE_DATE -> groupByInvoiceDate(period, input, sections);
    }

    var built = sections.build();
    BigDecimal grandTotal =
        built.stream().map(ReportSection::subtotal).reduce(Amounts.ZERO, BigDecimal::add);
    int totalEntries = built.stream().mapToInt(ReportSection::entryCount).sum();
    return new MonthlyReport(
        period.getMonthValue(),
        period.getYear(),
        label(period),
        mode,
        built,
        grandTotal,
        totalEntries,
        generatedAt,
        normalized.issues());
  }

  public static String label(YearMonth period) {
    return period.getMonth().getDisplayName(TextStyle.FULL, Locale.ENGLISH)
        + " "
        + period.getYear();
  }

  private void groupLive(YearMonth period, Input input, SectionSet sections) {
    Set<UUID> listedPayments = new HashSet<>();

    for (InvoiceEntry invoice : input.reportableInvoices()) {
      if (!inPeriod(invoice.effectiveDate(), period)) {
        continue;
      }
      var entryType =
          inPeriod(invoice.date(), period)
              ? ReportEntryType.STANDARD
              : ReportEntryType.LATE_INVOICE;
      var payments = input.paymentsOf(invoice.id());
      var paidThisMonth = payments.stream().filter(p -> inPeriod(p.date(), period)).toList();

      if (paidThisMonth.isEmpty()) {
        // settled in another month: reported there
        if (!invoice.settled()) {
          sections.unpaid(openInvoiceLine(invoice, entryType));
        }
        continue;
      }
      for (PaymentEntry payment : paidThisMonth) {
        sections.paymentType(payment, paymentLine(invoice, payment, payments, entryType));
        listedPayments.add(payment.id());
      }
    }

    for (PaymentEntry payment : input.approvedPayments()) {
      if (listedPayments.contains(payment.id()) || !inPeriod(payment.date(), period)) {
        continue;
      }
      InvoiceEntry invoice = input.invoice(payment.invoiceId());
      if (invoice == null || !isReportable(invoice)) {
        continue;
      }
      sections.paymentType(
          payment,
          paymentLine(
              invoice, payment, input.paymentsOf(invoice.id()), ReportEntryType.LATE_PAYMENT));
    }

    input.creditNotes().stream()
        .filter(creditNote -> inPeriod(creditNote.effectiveDate(), period))
        .forEach(creditNote -> sections.creditNote(creditNoteLine(creditNote, input)));

    input.advances().stream()
        .filter(advance -> inPeriod(advance.effectiveDate(), period))
        .forEach(advance -> sections.advance(advance, advanceLine(advance)));
  }

  private void groupByInvoiceDate(YearMonth period, Input input, SectionSet sections) {
    for (InvoiceEntry invoice : input.reportableInvoices()) {
      if (!inPeriod(invoice.date(), period)) {
        continue;
      }
      var payments = input.paymentsOf(invoice.id());
      if (payments.isEmpty()) {
        sections.unpaid(openInvoiceLine(invoice, ReportEntryType.STANDARD));
        continue;
      }
      for (PaymentEntry payment : payments) {
        var entryType =
            inPeriod(payment.date(), period)
                ? ReportEntryType.STANDARD
                : ReportEntryType.LATE_PAYMENT;
        sections.paymentType(payment, paymentLine(invoice, payment, payments, entryType));
      }
    }

    input.creditNotes().stream()
        .filter(creditNote -> inPeriod(creditNote.date(), period))
        .forEach(creditNote -> sections.creditNote(creditNoteLine(creditNote, input)));

    input.advances().stream()
        .filter(advance -> inPeriod(advance.date(), period))
        .forEach(advance -> sections.advance(advance, advanceLine(advance)));
  }

  private static ReportEntry openInvoiceLine(InvoiceEntry invoice, ReportEntryType entryType) {
    var outcome = PaymentStatusRules.forOpenInvoice(invoice.payableAmount(), invoice.paidToDate());
    return new ReportEntry(
        0,
        entryType,
        EntryKind.INVOICE,
        invoice.id(),
        invoice.id(),
        invoice.invoiceNumber(),
        invoiceName(invoice),
        invoice.vendorName(),
        invoice.date(),
        invoice.grossAmount(),
        null,
        null,
        null,
        outcome.status(),
        outcome.percentage(),
        invoice.currency(),
        invoice.payableAmount());
  }

  private static ReportEntry paymentLine(
      InvoiceEntry invoice,
      PaymentEntry payment,
      List<PaymentEntry> invoicePayments,
      ReportEntryType entryType) {
    BigDecimal paidBefore = Amounts.ZERO;
    for (PaymentEntry earlier : invoicePayments) {
      if (earlier.id().equals(payment.id())) {
        break;
      }
      paidBefore = paidBefore.add(earlier.grossAmount());
    }
    var outcome =
        PaymentStatusRules.forPayment(
            invoice.payableAmount(), paidBefore, payment.grossAmount());
    return new ReportEntry(
        0,
        entryType,
        EntryKind.PAYMENT,
        payment.id(),
        invoice.id(),
        invoice.invoiceNumber(),
        invoiceName(invoice),
        invoice.vendorName(),
        invoice.date(),
        invoice.grossAmount(),
        payment.grossAmount(),
        payment.date(),
        payment.transactionRef(),
        outcome.status(),
        outcome.percentage(),
        invoice.currency(),
        payment.grossAmount());
  }

  private static ReportEntry creditNoteLine(CreditNoteEntry creditNote, Input input) {
    InvoiceEntry invoice = input.invoice(creditNote.invoiceId());
    return new ReportEntry(
        0,
        ReportEntryType.CREDIT_NOTE,
        EntryKind.CREDIT_NOTE,
        creditNote.id(),
        creditNote.invoiceId(),
        creditNote.invoiceNumber(),
        creditNote.description(),
        creditNote.vendorName(),
        invoice != null ? invoice.date() : null,
        invoice != null ? invoice.grossAmount() : null,
        null,
        creditNote.date(),
        creditNote.creditNoteNumber(),
        ReportEntryStatus.CREDIT_NOTE,
        null,
        invoice != null ? invoice.currency() : null,
        creditNote.grossAmount());
  }

  private static ReportEntry advanceLine(AdvancePaymentEntry advance) {
    return new ReportEntry(
        0,
        ReportEntryType.ADVANCE_PAYMENT,
        EntryKind.ADVANCE_PAYMENT,
        advance.id(),
        advance.linkedInvoiceId(),
        advance.linkedInvoiceNumber(),
        advance.notes() != null ? advance.notes() : advance.description(),
        advance.vendorName(),
        null,
        advance.grossAmount(),
        advance.grossAmount(),
        advance.date(),
        advance.transactionRef(),
        ReportEntryStatus.ADVANCE,
        null,
        null,
        advance.grossAmount());
  }

  private static String invoiceName(InvoiceEntry invoice) {
    return invoice.invoiceName() != null ? invoice.invoiceName() : invoice.description();
  }

  private static boolean inPeriod(LocalDate date, YearMonth period) {
    return date != null && YearMonth.from(date).equals(period);
  }

  private static boolean isApproved(NormalizedEntry entry) {
    return ApprovalStatus.APPROVED.value().equals(entry.status());
  }

  private static boolean isReportable(InvoiceEntry invoice) {
    return invoice.approved() && !invoice.archived();
  }

  /** Entries indexed for grouping. Lists keep input order after a stable sort by date. */
  private static final class Input {

    private final Map<UUID, InvoiceEntry> invoicesById = new HashMap<>();
    private final List<InvoiceEntry> reportableInvoices = new ArrayList<>();
    private final List<PaymentEntry> approvedPayments = new ArrayList<>();
    private final Map<UUID, List<PaymentEntry>> paymentsByInvoice = new HashMap<>();
    private final List<CreditNoteEntry> creditNotes = new ArrayList<>();
    private final List<AdvancePaymentEntry> advances = new ArrayList<>();

    Input(List<NormalizedEntry> entries) {
      for (NormalizedEntry entry : entries) {
        switch (entry.kind()) {
          case INVOICE -> {
            var invoice = (InvoiceEntry) entry;
            invoicesById.put(invoice.id(), invoice);
            if (isReportable(invoice)) {
              reportableInvoices.add(invoice);
            }
          }
          case PAYMENT -> {
            if (isApproved(entry)) {
              approvedPayments.add((PaymentEntry) entry);
            }
          }
          case CREDIT_NOTE -> {
            if (isApproved(entry) && !entry.archived()) {
              creditNotes.add((CreditNoteEntry) entry);
            }
          }
          case ADVANCE_PAYMENT -> {
            if (isApproved(entry) && !entry.archived()) {
              advances.add((AdvancePaymentEntry) entry);
            }
          }
        }
      }
      reportableInvoices.sort(Comparator.comparing(InvoiceEntry::date));
      approvedPayments.sort(Comparator.comparing(PaymentEntry::date));
      creditNotes.sort(Comparator.comparing(CreditNoteEntry::date));
      advances.sort(Comparator.comparing(AdvancePaymentEntry::date));
      for (PaymentEntry payment : approvedPayments) {
        paymentsByInvoice
            .computeIfAbsent(payment.invoiceId(), id -> new ArrayList<>())
            .add(payment);
      }
    }

    InvoiceEntry invoice(UUID id) {
      return invoicesById.get(id);
    }

    List<InvoiceEntry> reportableInvoices() {
      return reportableInvoices;
    }

    List<PaymentEntry> approvedPayments() {
      return approvedPayments;
    }

    List<PaymentEntry> paymentsOf(UUID invoiceId) {
      return paymentsByInvoice.getOrDefault(invoiceId, List.of());
    }

    List<CreditNoteEntry> creditNotes() {
      return creditNotes;
    }

    List<AdvancePaymentEntry> advances() {
      return advances;
    }
  }

  /** Accumulates lines per section and emits them in report order. */
  private static final class SectionSet {

    private final Map<UUID, SectionBuilder> configured = new LinkedHashMap<>();
    private final Map<UUID, SectionBuilder> unconfigured = new LinkedHashMap<>();
    private final SectionBuilder creditNotes =
        new SectionBuilder(SectionKind.CREDIT_NOTES, null, CREDIT_NOTES_SECTION);
    private final SectionBuilder unpaid =
        new SectionBuilder(SectionKind.UNPAID, null, UNPAID_SECTION);

    SectionSet(List<PaymentTypeRef> paymentTypes) {
      for (PaymentTypeRef type : paymentTypes) {
        configured.put(
            type.id(), new SectionBuilder(SectionKind.PAYMENT_TYPE, type.id(), type.name()));
      }
    }

    void paymentType(PaymentEntry payment, ReportEntry line) {
      section(payment.paymentMethodId(), payment.paymentMethodName()).add(line);
    }

    void advance(AdvancePaymentEntry advance, ReportEntry line) {
      section(advance.paymentMethodId(), advance.paymentMethodName()).add(line);
    }

    void creditNote(ReportEntry line) {
      creditNotes.add(line);
    }

    void unpaid(ReportEntry line) {
      unpaid.add(line);
    }

    private SectionBuilder section(UUID paymentTypeId, String fallbackName) {
      var known = paymentTypeId != null ? configured.get(paymentTypeId) : null;
      if (known != null) {
        return known;
      }
      return unconfigured.computeIfAbsent(
          paymentTypeId,
          id ->
              new SectionBuilder(
                  SectionKind.PAYMENT_TYPE,
                  id,
                  fallbackName != null ? fallbackName : UNKNOWN_PAYMENT_TYPE));
    }

    List<ReportSection> build() {
      var ordered = new ArrayList<SectionBuilder>(configured.values());
      ordered.addAll(unconfigured.values());
      ordered.add(creditNotes);
      ordered.add(unpaid);
      return ordered.stream().filter(SectionBuilder::hasLines).map(SectionBuilder::build).toList();
    }
  }

  private static final class SectionBuilder {

    private final SectionKind kind;
    private final UUID paymentTypeId;
    private final String name;
    private final List<ReportEntry> lines = new ArrayList<>();

    SectionBuilder(SectionKind kind, UUID paymentTypeId, String name) {
      this.kind = kind;
      this.paymentTypeId = paymentTypeId;
      this.name = name;
    }

    void add(ReportEntry line) {
      lines.add(line);
    }

    boolean hasLines() {
      return !lines.isEmpty();
    }

    ReportSection build() {
      var numbered = new ArrayList<ReportEntry>(lines.size());
      BigDecimal subtotal = Amounts.ZERO;
      for (int i = 0; i < lines.size(); i++) {
        numbered.add(lines.get(i).withSerial(i + 1));
        subtotal = subtotal.add(lines.get(i).amount());
      }
      return new ReportSection(
          kind, paymentTypeId, name, List.copyOf(numbered), subtotal, numbered.size());
    }
  }
}
