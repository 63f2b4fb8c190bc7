package io.b2mash.payables.ledger;

import io.b2mash.payables.entry.NormalizedEntry;
import java.math.BigDecimal;

/**
 * One row of a profile ledger.
 *
 * @param payableAmount amount the row adds to what is owed; negative for credit notes
 * @param paidAmount amount the row settles
 * @param runningBalance outstanding balance after this row
 */
public record LedgerEntry(
    NormalizedEntry entry,
    BigDecimal payableAmount,
    BigDecimal paidAmount,
    BigDecimal runningBalance) {}
