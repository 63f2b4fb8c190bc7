package io.b2mash.payables.entry;

import java.util.UUID;

/**
 * Attributes an entry inherits from its invoice or vendor, shared by every entry kind so filters
 * and the ledger never need to look at the source document.
 *
 * @param profileId billing profile; null for one-time invoices and unlinked advances
 * @param archived whether the entry (or, for payments, its invoice) is archived
 */
public record EntryContext(
    UUID profileId,
    UUID vendorId,
    String vendorName,
    UUID entityId,
    UUID categoryId,
    boolean recurring,
    boolean tdsApplicable,
    boolean archived) {}
