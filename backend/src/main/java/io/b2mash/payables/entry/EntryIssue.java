package io.b2mash.payables.entry;

import java.util.UUID;

/**
 * A source record that could not be normalized. It is left out of every total and reported next to
 * the result instead of failing the whole ledger or report.
 */
public record EntryIssue(EntryKind kind, UUID id, String reference, String message) {}
