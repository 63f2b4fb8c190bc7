package io.b2mash.payables.export;

import io.b2mash.payables.report.MonthlyReport;
import io.b2mash.payables.report.ReportEntry;
import io.b2mash.payables.report.ReportSection;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Flattens a monthly report into export rows. Each section contributes its entries followed by a
 * subtotal row; the grand total goes into the table summary.
 */
@Component
public class MonthlyReportExporter {

  static final List<ExportColumn> COLUMNS =
      List.of(
          ExportColumn.text("section", "Section"),
          ExportColumn.integer("serial", "S.No"),
          ExportColumn.text("invoiceNumber", "Invoice #"),
          ExportColumn.text("invoiceName", "Invoice Name"),
          ExportColumn.text("vendorName", "Vendor"),
          ExportColumn.date("invoiceDate", "Invoice Date"),
          ExportColumn.currency("invoiceAmount", "Invoice Amount"),
          ExportColumn.date("paymentDate", "Payment Date"),
          ExportColumn.text("paymentReference", "Reference"),
          ExportColumn.text("status", "Status"),
          ExportColumn.currency("amount", "Amount"));

  public ExportTable export(MonthlyReport report) {
    var rows = new ArrayList<Map<String, Object>>();
    for (ReportSection section : report.sections()) {
      for (ReportEntry entry : section.entries()) {
        rows.add(toRow(section, entry));
      }
      rows.add(subtotalRow(section));
    }

    Map<String, Object> summary = new LinkedHashMap<>();
    summary.put("period", report.label());
    summary.put("mode", report.mode().value());
    summary.put("totalEntries", report.totalEntries());
    summary.put("grandTotal", report.grandTotal());
    return new ExportTable("Monthly Report - " + report.label(), COLUMNS, rows, summary);
  }

  /** Status as printed: {@code PAID_PARTIAL 40%}, {@code UNPAID}. */
  static String statusLabel(ReportEntry entry) {
    return entry.statusPercentage() != null
        ? entry.status().name() + " " + entry.statusPercentage() + "%"
        : entry.status().name();
  }

  private static Map<String, Object> toRow(ReportSection section, ReportEntry entry) {
    Map<String, Object> values = emptyRow();
    values.put("section", section.name());
    values.put("serial", entry.serial());
    values.put("invoiceNumber", entry.invoiceNumber());
    values.put("invoiceName", entry.invoiceName());
    values.put("vendorName", entry.vendorName());
    values.put("invoiceDate", entry.invoiceDate());
    values.put("invoiceAmount", entry.invoiceAmount());
    values.put("paymentDate", entry.paymentDate());
    values.put("paymentReference", entry.paymentReference());
    values.put("status", statusLabel(entry));
    values.put("amount", entry.amount());
    return values;
  }

  private static Map<String, Object> subtotalRow(ReportSection section) {
    Map<String, Object> values = emptyRow();
    values.put("section", section.name());
    values.put("status", "Subtotal (" + section.entryCount() + ")");
    values.put("amount", section.subtotal());
    return values;
  }

  private static Map<String, Object> emptyRow() {
    Map<String, Object> values = new LinkedHashMap<>();
    COLUMNS.forEach(column -> values.put(column.key(), null));
    return values;
  }
}
