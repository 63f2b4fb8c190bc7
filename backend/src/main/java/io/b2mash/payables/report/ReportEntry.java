package io.b2mash.payables.report;

import io.b2mash.payables.entry.EntryKind;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One line of a report section.
 *
 * @param serial 1-based position within the section
 * @param sourceKind document the line was produced from
 * @param invoiceId related invoice; null for unlinked advances
 * @param statusPercentage share of the payable amount this line represents, when shown
 * @param amount what the line adds to its section subtotal
 */
public record ReportEntry(
    int serial,
    ReportEntryType entryType,
    EntryKind sourceKind,
    UUID sourceId,
    UUID invoiceId,
    String invoiceNumber,
    String invoiceName,
    String vendorName,
    LocalDate invoiceDate,
    BigDecimal invoiceAmount,
    BigDecimal paymentAmount,
    LocalDate paymentDate,
    String paymentReference,
    ReportEntryStatus status,
    Integer statusPercentage,
    String currency,
    BigDecimal amount) {

  ReportEntry withSerial(int newSerial) {
    return new ReportEntry(
        newSerial,
        entryType,
        sourceKind,
        sourceId,
        invoiceId,
        invoiceNumber,
        invoiceName,
        vendorName,
        invoiceDate,
        invoiceAmount,
        paymentAmount,
        paymentDate,
        paymentReference,
        status,
        statusPercentage,
        currency,
        amount);
  }
}
