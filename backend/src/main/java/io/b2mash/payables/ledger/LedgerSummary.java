package io.b2mash.payables.ledger;

import java.math.BigDecimal;

/**
 * Totals over the rows of a ledger. {@code outstandingBalance} always equals the running balance of
 * the last row, or zero for an empty ledger.
 */
public record LedgerSummary(
    BigDecimal totalInvoiced,
    BigDecimal totalWithheld,
    BigDecimal totalPayable,
    BigDecimal totalPaid,
    BigDecimal outstandingBalance,
    int invoiceCount,
    int paymentCount,
    int creditNoteCount,
    int advancePaymentCount,
    int unpaidInvoiceCount,
    int overdueInvoiceCount) {}
