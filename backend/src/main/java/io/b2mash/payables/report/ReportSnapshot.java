package io.b2mash.payables.report;

import java.time.Instant;

/**
 * Stored form of a finalized report.
 *
 * @param version format version of the stored JSON
 */
public record ReportSnapshot(
    int version, MonthlyReport report, Instant finalizedAt, String finalizedBy) {

  public static final int CURRENT_VERSION = 1;
}
