package io.b2mash.payables.report;

/** How a monthly report selects its documents. */
public enum ReportMode {
  /** By effective month: what happened this month, including late invoices and payments. */
  LIVE,
  /** Strictly by invoice date: what this month's invoices settled to, whenever they were paid. */
  INVOICE_DATE;

  public String value() {
    return name().toLowerCase();
  }
}
