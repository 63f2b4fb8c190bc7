package io.b2mash.payables.ledger;

import static io.b2mash.payables.testutil.TestEntries.advance;
import static io.b2mash.payables.testutil.TestEntries.context;
import static io.b2mash.payables.testutil.TestEntries.creditNote;
import static io.b2mash.payables.testutil.TestEntries.invoice;
import static io.b2mash.payables.testutil.TestEntries.payment;
import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.payables.entry.EntryKind;
import io.b2mash.payables.entry.NormalizedEntry;
import io.b2mash.payables.testutil.TestEntries;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class LedgerBuilderTest {

  private static final UUID PROFILE_ID = UUID.randomUUID();
  private static final UUID OTHER_PROFILE_ID = UUID.randomUUID();
  private static final UUID BANK = UUID.randomUUID();
  private static final LocalDate AS_OF = LocalDate.of(2026, 6, 1);

  private final LedgerBuilder builder = new LedgerBuilder();

  @Test
  void buildLedger_fullPaymentAfterWithholding_settlesBalance() {
    var inv =
        invoice(
            context(PROFILE_ID),
            "INV-1",
            LocalDate.of(2026, 3, 1),
            LocalDate.of(2026, 3, 1),
            "10000",
            "1000",
            "9000",
            "paid");
    var pay = payment(inv, LocalDate.of(2026, 3, 15), "9000", BANK, "Bank");

    var ledger = builder.buildLedger(PROFILE_ID, List.of(pay, inv), AS_OF);

    assertThat(ledger.entries()).extracting(row -> row.entry().kind())
        .containsExactly(EntryKind.INVOICE, EntryKind.PAYMENT);
    assertThat(ledger.entries().get(0).runningBalance()).isEqualByComparingTo("9000.00");
    assertThat(ledger.entries().get(1).runningBalance()).isEqualByComparingTo("0.00");
    assertThat(ledger.summary().totalInvoiced()).isEqualByComparingTo("10000.00");
    assertThat(ledger.summary().totalWithheld()).isEqualByComparingTo("1000.00");
    assertThat(ledger.summary().outstandingBalance()).isEqualByComparingTo("0.00");
    assertThat(ledger.summary().unpaidInvoiceCount()).isZero();
  }

  @Test
  void buildLedger_sameDate_putsDebitsBeforeCredits() {
    var date = LocalDate.of(2026, 4, 10);
    var inv = invoice(PROFILE_ID, "INV-2", date, "500", "200");
    var pay = payment(inv, date, "200", BANK, "Bank");
    var cn = creditNote(inv, "CN-2", date, "50", "0");

    var ledger = builder.buildLedger(PROFILE_ID, List.of(pay, inv, cn), AS_OF);

    assertThat(ledger.entries()).extracting(row -> row.entry().kind())
        .containsExactly(EntryKind.INVOICE, EntryKind.CREDIT_NOTE, EntryKind.PAYMENT);
    assertThat(ledger.summary().outstandingBalance()).isEqualByComparingTo("250.00");
  }

  @Test
  void buildLedger_runningBalanceFoldMatchesOutstanding() {
    var first = invoice(PROFILE_ID, "INV-3", LocalDate.of(2026, 1, 5), "1200", "700");
    var second = invoice(PROFILE_ID, "INV-4", LocalDate.of(2026, 2, 5), "800", "0");
    List<NormalizedEntry> entries =
        List.of(
            second,
            payment(first, LocalDate.of(2026, 1, 20), "500", BANK, "Bank"),
            first,
            payment(first, LocalDate.of(2026, 2, 1), "200", BANK, "Bank"),
            creditNote(second, "CN-4", LocalDate.of(2026, 2, 10), "100", "0"));

    var ledger = builder.buildLedger(PROFILE_ID, entries, AS_OF);

    var balance = BigDecimal.ZERO;
    for (LedgerEntry row : ledger.entries()) {
      balance = balance.add(row.payableAmount()).subtract(row.paidAmount());
      assertThat(row.runningBalance()).isEqualByComparingTo(balance);
    }
    assertThat(ledger.summary().outstandingBalance()).isEqualByComparingTo(balance);
    assertThat(balance).isEqualByComparingTo("1200.00");
    assertThat(ledger.summary().totalPayable().subtract(ledger.summary().totalPaid()))
        .isEqualByComparingTo(balance);
  }

  @Test
  void buildLedger_excludesOtherProfilesPendingArchivedAndUnlinked() {
    var inv = invoice(PROFILE_ID, "INV-5", LocalDate.of(2026, 3, 1), "300", "0");
    var pending =
        invoice(
            context(PROFILE_ID),
            "INV-6",
            LocalDate.of(2026, 3, 2),
            LocalDate.of(2026, 3, 2),
            "999",
            "0",
            "0",
            "pending_approval");
    var archived =
        invoice(
            TestEntries.archivedContext(PROFILE_ID),
            "INV-7",
            LocalDate.of(2026, 3, 3),
            LocalDate.of(2026, 3, 3),
            "999",
            "0",
            "0",
            "unpaid");
    var foreign = invoice(OTHER_PROFILE_ID, "INV-8", LocalDate.of(2026, 3, 4), "999", "0");
    var pendingPayment = payment(inv, LocalDate.of(2026, 3, 5), "100", BANK, "Bank", "pending");
    var unlinked = advance(null, context(PROFILE_ID), LocalDate.of(2026, 3, 6), "50", BANK, "Bank");
    var linked = advance(inv, context(PROFILE_ID), LocalDate.of(2026, 3, 7), "75", BANK, "Bank");

    var ledger =
        builder.buildLedger(
            PROFILE_ID,
            List.of(inv, pending, archived, foreign, pendingPayment, unlinked, linked),
            AS_OF);

    assertThat(ledger.entries()).extracting(row -> row.entry().id())
        .containsExactly(inv.id(), linked.id());
    assertThat(ledger.summary().outstandingBalance()).isEqualByComparingTo("225.00");
    assertThat(ledger.summary().advancePaymentCount()).isEqualTo(1);
  }

  @Test
  void buildLedger_countsOverdueInvoicesAgainstReferenceDate() {
    var overdue = invoice(PROFILE_ID, "INV-9", LocalDate.of(2026, 1, 1), "100", "0");
    var notDue = invoice(PROFILE_ID, "INV-10", LocalDate.of(2026, 5, 20), "100", "0");
    var settled = invoice(PROFILE_ID, "INV-11", LocalDate.of(2026, 1, 1), "100", "99.99");

    var summary =
        builder.buildLedger(PROFILE_ID, List.of(overdue, notDue, settled), AS_OF).summary();

    assertThat(summary.invoiceCount()).isEqualTo(3);
    assertThat(summary.unpaidInvoiceCount()).isEqualTo(2);
    assertThat(summary.overdueInvoiceCount()).isEqualTo(1);
  }

  @Test
  void buildLedger_noEntries_returnsZeroSummary() {
    var ledger = builder.buildLedger(PROFILE_ID, List.of(), AS_OF);

    assertThat(ledger.entries()).isEmpty();
    assertThat(ledger.summary().outstandingBalance()).isEqualByComparingTo("0");
    assertThat(ledger.summary().invoiceCount()).isZero();
  }
}
