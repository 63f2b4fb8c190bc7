package io.b2mash.payables.ledger;

import io.b2mash.payables.entry.EntryIssue;
import java.util.List;
import java.util.UUID;

/**
 * A ledger as served to callers: filtered rows, with the summary computed over the whole profile.
 */
public record LedgerView(
    UUID profileId,
    String profileName,
    List<LedgerEntry> entries,
    LedgerSummary summary,
    List<EntryIssue> issues) {}
