package io.b2mash.payables.ledger;

import java.util.List;
import java.util.UUID;

public record Ledger(UUID profileId, List<LedgerEntry> entries, LedgerSummary summary) {}
