package io.b2mash.payables.entry;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One financial document projected onto a common shape. The set of implementations is closed;
 * consumers switch over {@link #kind()} and the compiler rejects a switch that misses a kind.
 *
 * <p>Amounts are signed: credit notes carry a negative gross and a negative withholding, so sums
 * over mixed entries need no special cases.
 */
public sealed interface NormalizedEntry
    permits InvoiceEntry, PaymentEntry, CreditNoteEntry, AdvancePaymentEntry {

  EntryKind kind();

  UUID id();

  EntryContext context();

  LocalDate date();

  BigDecimal grossAmount();

  /** Raw status value, unmodified, used for filtering. */
  String status();

  /** Status label for read models, e.g. {@code partial 60%}. */
  String displayStatus();

  /** Payment type that settled this entry; null when nothing has been paid through it. */
  UUID paymentMethodId();

  String referenceNumber();

  String description();

  /** Amount still to be settled; zero for entries that settle rather than owe. */
  BigDecimal remainingBalance();

  default UUID profileId() {
    return context().profileId();
  }

  default String vendorName() {
    return context().vendorName();
  }

  default boolean archived() {
    return context().archived();
  }
}
