package io.b2mash.payables.report;

public enum ReportEntryType {
  STANDARD,
  /** Invoice filed under this month although dated in another one. */
  LATE_INVOICE,
  /** Payment listed for an invoice that belongs to another month. */
  LATE_PAYMENT,
  ADVANCE_PAYMENT,
  CREDIT_NOTE
}
