package io.b2mash.payables.report;

import io.b2mash.payables.tds.Amounts;
import java.math.BigDecimal;

/** Status labels for payments and unpaid invoices in a monthly report. */
final class PaymentStatusRules {

  record Outcome(ReportEntryStatus status, Integer percentage) {}

  /**
   * Status of one payment given what was paid before it.
   *
   * <ul>
   *   <li>{@code PAID}: the invoice is settled and this payment alone covers it
   *   <li>{@code PAID_PARTIAL n%}: this payment completes what earlier payments started
   *   <li>{@code PARTIALLY_PAID n%}: a balance remains
   * </ul>
   *
   * where n is this payment's share of the payable amount, rounded HALF_UP to a whole number.
   */
  static Outcome forPayment(BigDecimal payable, BigDecimal paidBefore, BigDecimal payment) {
    if (payable.signum() <= 0) {
      return new Outcome(ReportEntryStatus.PAID, null);
    }
    int percentage = Amounts.percentOf(payment, payable);
    if (Amounts.isSettled(paidBefore.add(payment), payable)) {
      return percentage >= 100
          ? new Outcome(ReportEntryStatus.PAID, null)
          : new Outcome(ReportEntryStatus.PAID_PARTIAL, percentage);
    }
    return new Outcome(ReportEntryStatus.PARTIALLY_PAID, percentage);
  }

  /** Status of an invoice listed in the Unpaid section. */
  static Outcome forOpenInvoice(BigDecimal payable, BigDecimal totalPaid) {
    if (totalPaid.signum() > 0) {
      return new Outcome(
          ReportEntryStatus.PARTIALLY_PAID, Amounts.percentOf(totalPaid, payable));
    }
    return new Outcome(ReportEntryStatus.UNPAID, null);
  }

  private PaymentStatusRules() {}
}
