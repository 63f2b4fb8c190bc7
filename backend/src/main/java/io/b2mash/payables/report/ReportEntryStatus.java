package io.b2mash.payables.report;

public enum ReportEntryStatus {
  /** This payment settled the invoice on its own. */
  PAID,
  /** This payment completed an invoice that earlier payments had partly settled. */
  PAID_PARTIAL,
  /** Balance remains after this payment, or after all payments for an unpaid-section entry. */
  PARTIALLY_PAID,
  UNPAID,
  ADVANCE,
  CREDIT_NOTE
}
