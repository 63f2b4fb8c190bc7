package io.b2mash.payables.ledger;

import java.math.BigDecimal;
import java.util.UUID;

/** Billing profile choice for the ledger picker, with its current open position. */
public record ProfileOption(
    UUID id, String name, String vendorName, int unpaidInvoiceCount, BigDecimal outstanding) {}
