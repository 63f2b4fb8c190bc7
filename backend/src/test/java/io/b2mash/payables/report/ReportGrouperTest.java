package io.b2mash.payables.report;

import static io.b2mash.payables.testutil.TestEntries.advance;
import static io.b2mash.payables.testutil.TestEntries.context;
import static io.b2mash.payables.testutil.TestEntries.creditNote;
import static io.b2mash.payables.testutil.TestEntries.invoice;
import static io.b2mash.payables.testutil.TestEntries.payment;
import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.payables.entry.InvoiceEntry;
import io.b2mash.payables.entry.NormalizationResult;
import io.b2mash.payables.entry.NormalizedEntry;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class ReportGrouperTest {

  private static final YearMonth MARCH = YearMonth.of(2026, 3);
  private static final UUID PROFILE_ID = UUID.randomUUID();
  private static final UUID CHEQUE = UUID.randomUUID();
  private static final UUID BANK = UUID.randomUUID();
  private static final UUID RETIRED_TYPE = UUID.randomUUID();
  private static final List<PaymentTypeRef> TYPES =
      List.of(new PaymentTypeRef(CHEQUE, "Cheque"), new PaymentTypeRef(BANK, "Bank Transfer"));

  private final ReportGrouper grouper = new ReportGrouper();

  @Test
  void live_singleFullPayment_isPaidUnderItsPaymentType() {
    var inv = marchInvoice("INV-1", "9000", "9000", "paid");
    var pay = payment(inv, LocalDate.of(2026, 3, 20), "9000", BANK, "Bank Transfer");

    var report = live(inv, pay);

    assertThat(report.sections()).singleElement().satisfies(
        section -> {
          assertThat(section.name()).isEqualTo("Bank Transfer");
          assertThat(section.kind()).isEqualTo(SectionKind.PAYMENT_TYPE);
          assertThat(section.entries()).singleElement().satisfies(
              entry -> {
                assertThat(entry.serial()).isEqualTo(1);
                assertThat(entry.entryType()).isEqualTo(ReportEntryType.STANDARD);
                assertThat(entry.status()).isEqualTo(ReportEntryStatus.PAID);
                assertThat(entry.amount()).isEqualByComparingTo("9000.00");
              });
        });
    assertThat(report.grandTotal()).isEqualByComparingTo("9000.00");
    assertThat(report.label()).isEqualTo("March 2026");
  }

  @Test
  void live_twoPaymentsInMonth_carryCumulativeStatuses() {
    var inv = marchInvoice("INV-2", "9000", "9000", "paid");
    var first = payment(inv, LocalDate.of(2026, 3, 10), "4000", BANK, "Bank Transfer");
    var second = payment(inv, LocalDate.of(2026, 3, 25), "5000", BANK, "Bank Transfer");

    var entries = live(inv, second, first).sections().get(0).entries();

    assertThat(entries).extracting(ReportEntry::status)
        .containsExactly(ReportEntryStatus.PARTIALLY_PAID, ReportEntryStatus.PAID_PARTIAL);
    assertThat(entries).extracting(ReportEntry::statusPercentage).containsExactly(44, 56);
    assertThat(entries).extracting(ReportEntry::serial).containsExactly(1, 2);
  }

  @Test
  void live_unpaidInvoice_isListedUnderUnpaidWithPayableAmount() {
    var inv =
        invoice(
            context(PROFILE_ID),
            "INV-3",
            LocalDate.of(2026, 3, 4),
            LocalDate.of(2026, 3, 4),
            "10000",
            "1000",
            "0",
            "unpaid");

    var report = live(inv);

    var section = report.sections().get(0);
    assertThat(section.kind()).isEqualTo(SectionKind.UNPAID);
    assertThat(section.name()).isEqualTo("Unpaid");
    assertThat(section.paymentTypeId()).isNull();
    assertThat(section.entries().get(0).status()).isEqualTo(ReportEntryStatus.UNPAID);
    assertThat(section.subtotal()).isEqualByComparingTo("9000.00");
  }

  @Test
  void live_paymentForEarlierInvoice_isLatePayment() {
    var february =
        invoice(
            context(PROFILE_ID),
            "INV-4",
            LocalDate.of(2026, 2, 10),
            LocalDate.of(2026, 2, 10),
            "1000",
            "0",
            "1000",
            "paid");
    var febPayment = payment(february, LocalDate.of(2026, 2, 20), "600", CHEQUE, "Cheque");
    var marPayment = payment(february, LocalDate.of(2026, 3, 5), "400", CHEQUE, "Cheque");

    var report = live(february, febPayment, marPayment);

    var entry = report.sections().get(0).entries().get(0);
    assertThat(report.totalEntries()).isEqualTo(1);
    assertThat(entry.entryType()).isEqualTo(ReportEntryType.LATE_PAYMENT);
    assertThat(entry.sourceId()).isEqualTo(marPayment.id());
    assertThat(entry.status()).isEqualTo(ReportEntryStatus.PAID_PARTIAL);
    assertThat(entry.statusPercentage()).isEqualTo(40);
  }

  @Test
  void live_invoiceReceivedInMonth_isLateInvoice() {
    var late =
        invoice(
            context(PROFILE_ID),
            "INV-5",
            LocalDate.of(2026, 2, 26),
            LocalDate.of(2026, 3, 2),
            "500",
            "0",
            "0",
            "unpaid");

    var marchReport = live(late);
    var februaryReport = report(YearMonth.of(2026, 2), ReportMode.LIVE, late);

    assertThat(marchReport.sections().get(0).entries().get(0).entryType())
        .isEqualTo(ReportEntryType.LATE_INVOICE);
    assertThat(februaryReport.sections()).isEmpty();
  }

  @Test
  void live_invoiceSettledInEarlierMonth_isOmitted() {
    var inv =
        invoice(
            context(PROFILE_ID),
            "INV-6",
            LocalDate.of(2026, 3, 1),
            LocalDate.of(2026, 3, 1),
            "100",
            "0",
            "100",
            "paid");
    var earlyPayment = payment(inv, LocalDate.of(2026, 2, 28), "100", BANK, "Bank Transfer");

    assertThat(live(inv, earlyPayment).sections()).isEmpty();
  }

  @Test
  void live_sectionsFollowConfiguredThenUnconfiguredThenCreditNotesThenUnpaid() {
    var paidByBank = marchInvoice("INV-7", "100", "100", "paid");
    var paidByCheque = marchInvoice("INV-8", "200", "200", "paid");
    var paidByRetired = marchInvoice("INV-9", "300", "300", "paid");
    var open = marchInvoice("INV-10", "400", "0", "unpaid");
    List<NormalizedEntry> entries =
        List.of(
            open,
            paidByBank,
            paidByCheque,
            paidByRetired,
            payment(paidByBank, LocalDate.of(2026, 3, 11), "100", BANK, "Bank Transfer"),
            payment(paidByRetired, LocalDate.of(2026, 3, 12), "300", RETIRED_TYPE, "Demand Draft"),
            payment(paidByCheque, LocalDate.of(2026, 3, 13), "200", CHEQUE, "Cheque"),
            creditNote(open, "CN-1", LocalDate.of(2026, 3, 14), "40", "0"),
            advance(null, context(null), LocalDate.of(2026, 3, 15), "50", CHEQUE, "Cheque"));

    var report = report(MARCH, ReportMode.LIVE, entries.toArray(NormalizedEntry[]::new));

    assertThat(report.sections()).extracting(ReportSection::name)
        .containsExactly("Cheque", "Bank Transfer", "Demand Draft", "Credit Notes", "Unpaid");
    assertThat(report.sections().get(0).entryCount()).isEqualTo(2);
    assertThat(report.sections().get(0).subtotal()).isEqualByComparingTo("250.00");
    assertThat(report.sections().get(3).subtotal()).isEqualByComparingTo("-40.00");
    assertThat(report.grandTotal()).isEqualByComparingTo("1010.00");
    assertThat(report.totalEntries()).isEqualTo(6);
    for (ReportSection section : report.sections()) {
      assertThat(section.entries().get(0).serial()).isEqualTo(1);
    }
  }

  @Test
  void invoiceDate_listsAllPaymentsAndFlagsThoseOutsideMonth() {
    var inv = marchInvoice("INV-11", "1000", "1000", "paid");
    var march = payment(inv, LocalDate.of(2026, 3, 30), "250", BANK, "Bank Transfer");
    var april = payment(inv, LocalDate.of(2026, 4, 2), "750", BANK, "Bank Transfer");

    var report = report(MARCH, ReportMode.INVOICE_DATE, inv, april, march);

    assertThat(report.sections().get(0).entries())
        .extracting(ReportEntry::entryType)
        .containsExactly(ReportEntryType.STANDARD, ReportEntryType.LATE_PAYMENT);
    assertThat(report.grandTotal()).isEqualByComparingTo("1000.00");
    assertThat(report.mode()).isEqualTo(ReportMode.INVOICE_DATE);
  }

  @Test
  void invoiceDate_ignoresReportingMonthOverride() {
    var moved =
        invoice(
            context(PROFILE_ID),
            "INV-12",
            LocalDate.of(2026, 3, 3),
            LocalDate.of(2026, 4, 1),
            "700",
            "0",
            "0",
            "unpaid");

    assertThat(report(MARCH, ReportMode.INVOICE_DATE, moved).totalEntries()).isEqualTo(1);
    assertThat(live(moved).totalEntries()).isZero();
  }

  // --- Helpers ---

  private static InvoiceEntry marchInvoice(
      String number, String gross, String paid, String status) {
    var date = LocalDate.of(2026, 3, 1);
    return invoice(context(PROFILE_ID), number, date, date, gross, "0", paid, status);
  }

  private MonthlyReport live(NormalizedEntry... entries) {
    return report(MARCH, ReportMode.LIVE, entries);
  }

  private MonthlyReport report(YearMonth period, ReportMode mode, NormalizedEntry... entries) {
    return grouper.buildReport(
        period,
        mode,
        new NormalizationResult(List.of(entries), List.of()),
        TYPES,
        Instant.parse("2026-04-01T00:00:00Z"));
  }
}
