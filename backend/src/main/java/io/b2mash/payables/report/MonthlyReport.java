package io.b2mash.payables.report;

import io.b2mash.payables.entry.EntryIssue;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * A grouped monthly report. Immutable; a finalized period stores it verbatim as its snapshot.
 *
 * @param label human-readable period, e.g. {@code March 2026}
 * @param grandTotal sum of all section subtotals
 * @param issues records left out of the totals because they were malformed
 */
public record MonthlyReport(
    int month,
    int year,
    String label,
    ReportMode mode,
    List<ReportSection> sections,
    BigDecimal grandTotal,
    int totalEntries,
    Instant generatedAt,
    List<EntryIssue> issues) {}
