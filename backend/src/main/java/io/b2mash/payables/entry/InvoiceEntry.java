package io.b2mash.payables.entry;

import io.b2mash.payables.invoice.InvoiceStatus;
import io.b2mash.payables.tds.Amounts;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Locale;
import java.util.UUID;

/**
 * @param date invoice date
 * @param effectiveDate date the live report files the invoice under
 * @param payableAmount gross minus withholding under the invoice's own rounding flag
 * @param paidToDate sum of approved payments against the invoice
 */
public record InvoiceEntry(
    UUID id,
    EntryContext context,
    String invoiceNumber,
    String invoiceName,
    LocalDate date,
    LocalDate effectiveDate,
    LocalDate dueDate,
    String currency,
    BigDecimal grossAmount,
    BigDecimal tdsPercentage,
    boolean tdsRounded,
    BigDecimal withheldAmount,
    BigDecimal payableAmount,
    BigDecimal paidToDate,
    String status,
    String displayStatus)
    implements NormalizedEntry {

  @Override
  public EntryKind kind() {
    return EntryKind.INVOICE;
  }

  @Override
  public UUID paymentMethodId() {
    return null;
  }

  @Override
  public String referenceNumber() {
    return invoiceNumber;
  }

  @Override
  public String description() {
    return "Invoice #" + invoiceNumber;
  }

  @Override
  public BigDecimal remainingBalance() {
    return payableAmount.subtract(paidToDate).max(Amounts.ZERO);
  }

  public boolean settled() {
    return Amounts.isSettled(paidToDate, payableAmount);
  }

  /** Whether the invoice passed review; pending and rejected invoices stay out of balances. */
  public boolean approved() {
    return InvoiceStatus.valueOf(status.toUpperCase(Locale.ROOT)).isApproved();
  }
}
