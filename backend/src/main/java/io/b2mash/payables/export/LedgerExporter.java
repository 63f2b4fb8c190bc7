package io.b2mash.payables.export;

import io.b2mash.payables.ledger.LedgerEntry;
import io.b2mash.payables.ledger.LedgerView;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Flattens a profile ledger into export rows, one per ledger row, in ledger order. */
@Component
public class LedgerExporter {

  static final List<ExportColumn> COLUMNS =
      List.of(
          ExportColumn.date("date", "Date"),
          ExportColumn.text("type", "Type"),
          ExportColumn.text("reference", "Reference"),
          ExportColumn.text("description", "Description"),
          ExportColumn.text("status", "Status"),
          ExportColumn.currency("payable", "Payable"),
          ExportColumn.currency("paid", "Paid"),
          ExportColumn.currency("balance", "Balance"));

  public ExportTable export(LedgerView ledger) {
    var rows = ledger.entries().stream().map(LedgerExporter::toRow).toList();

    var summary = ledger.summary();
    Map<String, Object> totals = new LinkedHashMap<>();
    totals.put("totalInvoiced", summary.totalInvoiced());
    totals.put("totalWithheld", summary.totalWithheld());
    totals.put("totalPayable", summary.totalPayable());
    totals.put("totalPaid", summary.totalPaid());
    totals.put("outstandingBalance", summary.outstandingBalance());
    return new ExportTable("Ledger - " + ledger.profileName(), COLUMNS, rows, totals);
  }

  private static Map<String, Object> toRow(LedgerEntry row) {
    var entry = row.entry();
    Map<String, Object> values = new LinkedHashMap<>();
    values.put("date", entry.date());
    values.put("type", entry.kind().value());
    values.put("reference", entry.referenceNumber());
    values.put("description", entry.description());
    values.put("status", entry.displayStatus());
    values.put("payable", row.payableAmount());
    values.put("paid", row.paidAmount());
    values.put("balance", row.runningBalance());
    return values;
  }
}
