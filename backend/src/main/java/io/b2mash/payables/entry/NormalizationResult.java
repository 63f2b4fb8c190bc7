package io.b2mash.payables.entry;

import java.util.List;

/** Entries in input order (invoices, payments, credit notes, advances) plus flagged records. */
public record NormalizationResult(List<NormalizedEntry> entries, List<EntryIssue> issues) {}
