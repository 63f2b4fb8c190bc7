package io.b2mash.payables.entry;

import io.b2mash.payables.tds.Amounts;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/** @param linkedInvoiceId invoice the advance was reconciled against; null until linked */
public record AdvancePaymentEntry(
    UUID id,
    EntryContext context,
    UUID linkedInvoiceId,
    String linkedInvoiceNumber,
    LocalDate date,
    LocalDate effectiveDate,
    BigDecimal grossAmount,
    UUID paymentMethodId,
    String paymentMethodName,
    String transactionRef,
    String notes,
    String status)
    implements NormalizedEntry {

  @Override
  public EntryKind kind() {
    return EntryKind.ADVANCE_PAYMENT;
  }

  @Override
  public String displayStatus() {
    return linkedInvoiceId == null ? status + " (unlinked)" : status;
  }

  @Override
  public String referenceNumber() {
    return "ADV-" + id.toString().substring(0, 8);
  }

  @Override
  public String description() {
    return paymentMethodName != null
        ? "Advance Payment (" + paymentMethodName + ")"
        : "Advance Payment";
  }

  /** An unreconciled advance is still open for its full amount. */
  @Override
  public BigDecimal remainingBalance() {
    return linkedInvoiceId == null ? grossAmount : Amounts.ZERO;
  }
}
