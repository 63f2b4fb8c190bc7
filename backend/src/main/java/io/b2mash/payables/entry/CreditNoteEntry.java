package io.b2mash.payables.entry;

import io.b2mash.payables.tds.Amounts;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * @param grossAmount credit amount, negated
 * @param withheldAmount withholding reversed by the credit, negated
 */
public record CreditNoteEntry(
    UUID id,
    EntryContext context,
    UUID invoiceId,
    String invoiceNumber,
    String creditNoteNumber,
    LocalDate date,
    LocalDate effectiveDate,
    BigDecimal grossAmount,
    BigDecimal withheldAmount,
    String status,
    String reason)
    implements NormalizedEntry {

  @Override
  public EntryKind kind() {
    return EntryKind.CREDIT_NOTE;
  }

  @Override
  public String displayStatus() {
    return status;
  }

  @Override
  public UUID paymentMethodId() {
    return null;
  }

  @Override
  public String referenceNumber() {
    return creditNoteNumber;
  }

  @Override
  public String description() {
    return "Credit Note #" + creditNoteNumber;
  }

  @Override
  public BigDecimal remainingBalance() {
    return Amounts.ZERO;
  }

  /** Net reduction of the payable amount; negative. */
  public BigDecimal payableAmount() {
    return grossAmount.subtract(withheldAmount);
  }
}
