package io.b2mash.payables.ledger;

import io.b2mash.payables.approval.ApprovalStatus;
import io.b2mash.payables.entry.AdvancePaymentEntry;
import io.b2mash.payables.entry.CreditNoteEntry;
import io.b2mash.payables.entry.InvoiceEntry;
import io.b2mash.payables.entry.NormalizedEntry;
import io.b2mash.payables.tds.Amounts;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * Builds the chronological ledger of one billing profile.
 *
 * <p>Only approved, non-archived documents contribute. Rows are ordered by date; on the same date
 * debits (invoices, credit notes) come before credits (payments, advances), and anything still tied
 * keeps its input order. The running balance is a left fold over that order:
 *
 * <pre>
 *   balance[i] = balance[i-1] + payable[i] - paid[i],  balance[-1] = 0
 * </pre>
 */
@Component
public class LedgerBuilder {

  private static final Comparator<LedgerEntry> CHRONOLOGICAL =
      Comparator.comparing((LedgerEntry row) -> row.entry().date())
          .thenComparing(row -> row.entry().kind().isDebit() ? 0 : 1);

  public Ledger buildLedger(UUID profileId, List<NormalizedEntry> entries) {
    return buildLedger(profileId, entries, LocalDate.now());
  }

  /**
   * @param asOf reference date for counting overdue invoices
   */
  public Ledger buildLedger(UUID profileId, List<NormalizedEntry> entries, LocalDate asOf) {
    var rows = new ArrayList<LedgerEntry>();
    for (NormalizedEntry entry : entries) {
      if (Objects.equals(entry.profileId(), profileId) && contributes(entry)) {
        rows.add(contribution(entry));
      }
    }
    // List.sort is a stable merge sort: equal keys keep insertion order
    rows.sort(CHRONOLOGICAL);

    var folded = new ArrayList<LedgerEntry>(rows.size());
    BigDecimal balance = Amounts.ZERO;
    for (LedgerEntry row : rows) {
      balance = balance.add(row.payableAmount()).subtract(row.paidAmount());
      folded.add(new LedgerEntry(row.entry(), row.payableAmount(), row.paidAmount(), balance));
    }
    return new Ledger(profileId, List.copyOf(folded), summarize(folded, asOf));
  }

  static boolean contributes(NormalizedEntry entry) {
    if (entry.archived()) {
      return false;
    }
    return switch (entry.kind()) {
      case INVOICE -> ((InvoiceEntry) entry).approved();
      case PAYMENT, CREDIT_NOTE -> isApproved(entry);
      case ADVANCE_PAYMENT ->
          isApproved(entry) && ((AdvancePaymentEntry) entry).linkedInvoiceId() != null;
    };
  }

  private static boolean isApproved(NormalizedEntry entry) {
    return ApprovalStatus.APPROVED.value().equals(entry.status());
  }

  private static LedgerEntry contribution(NormalizedEntry entry) {
    return switch (entry.kind()) {
      case INVOICE ->
          new LedgerEntry(entry, ((InvoiceEntry) entry).payableAmount(), Amounts.ZERO, null);
      case CREDIT_NOTE ->
          new LedgerEntry(entry, ((CreditNoteEntry) entry).payableAmount(), Amounts.ZERO, null);
      case PAYMENT, ADVANCE_PAYMENT ->
          new LedgerEntry(entry, Amounts.ZERO, entry.grossAmount(), null);
    };
  }

  private static LedgerSummary summarize(List<LedgerEntry> rows, LocalDate asOf) {
    BigDecimal invoiced = Amounts.ZERO;
    BigDecimal withheld = Amounts.ZERO;
    BigDecimal payable = Amounts.ZERO;
    BigDecimal paid = Amounts.ZERO;
    int invoices = 0;
    int payments = 0;
    int creditNotes = 0;
    int advances = 0;
    int unpaid = 0;
    int overdue = 0;

    for (LedgerEntry row : rows) {
      payable = payable.add(row.payableAmount());
      paid = paid.add(row.paidAmount());
      switch (row.entry().kind()) {
        case INVOICE -> {
          var invoice = (InvoiceEntry) row.entry();
          invoices++;
          invoiced = invoiced.add(invoice.grossAmount());
          withheld = withheld.add(invoice.withheldAmount());
          if (invoice.remainingBalance().compareTo(Amounts.PAID_TOLERANCE) > 0) {
            unpaid++;
            if (invoice.dueDate() != null && invoice.dueDate().isBefore(asOf)) {
              overdue++;
            }
          }
        }
        case CREDIT_NOTE -> {
          var creditNote = (CreditNoteEntry) row.entry();
          creditNotes++;
          invoiced = invoiced.add(creditNote.grossAmount());
          withheld = withheld.add(creditNote.withheldAmount());
        }
        case PAYMENT -> payments++;
        case ADVANCE_PAYMENT -> advances++;
      }
    }

    BigDecimal outstanding =
        rows.isEmpty() ? Amounts.ZERO : rows.get(rows.size() - 1).runningBalance();
    return new LedgerSummary(
        invoiced,
        withheld,
        payable,
        paid,
        outstanding,
        invoices,
        payments,
        creditNotes,
        advances,
        unpaid,
        overdue);
  }
}
