package io.b2mash.payables.entry;

import io.b2mash.payables.tds.Amounts;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * @param withheldAmount withholding deducted at payment time: the recorded override when present,
 *     otherwise computed with the rounding flag stored on the payment
 */
public record PaymentEntry(
    UUID id,
    EntryContext context,
    UUID invoiceId,
    String invoiceNumber,
    LocalDate date,
    BigDecimal grossAmount,
    UUID paymentMethodId,
    String paymentMethodName,
    String transactionRef,
    BigDecimal withheldAmount,
    boolean tdsRounded,
    String status)
    implements NormalizedEntry {

  @Override
  public EntryKind kind() {
    return EntryKind.PAYMENT;
  }

  @Override
  public String displayStatus() {
    return status;
  }

  @Override
  public String referenceNumber() {
    return transactionRef != null ? transactionRef : "PAY-" + id.toString().substring(0, 8);
  }

  @Override
  public String description() {
    return paymentMethodName != null ? "Payment (" + paymentMethodName + ")" : "Payment";
  }

  @Override
  public BigDecimal remainingBalance() {
    return Amounts.ZERO;
  }
}
