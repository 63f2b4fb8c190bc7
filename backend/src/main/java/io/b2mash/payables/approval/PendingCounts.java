package io.b2mash.payables.approval;

/** Documents awaiting review, per kind. Archived documents are not counted. */
public record PendingCounts(
    long vendors, long invoices, long payments, long creditNotes, long advancePayments) {

  public long total() {
    return vendors + invoices + payments + creditNotes + advancePayments;
  }
}
