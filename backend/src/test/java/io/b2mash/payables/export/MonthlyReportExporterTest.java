package io.b2mash.payables.export;

import static io.b2mash.payables.testutil.TestEntries.context;
import static io.b2mash.payables.testutil.TestEntries.invoice;
import static io.b2mash.payables.testutil.TestEntries.payment;
import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.payables.entry.NormalizationResult;
import io.b2mash.payables.report.MonthlyReport;
import io.b2mash.payables.report.PaymentTypeRef;
import io.b2mash.payables.report.ReportGrouper;
import io.b2mash.payables.report.ReportMode;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class MonthlyReportExporterTest {

  private static final UUID BANK = UUID.randomUUID();

  private final MonthlyReportExporter exporter = new MonthlyReportExporter();

  @Test
  void export_writesEntriesThenSubtotalPerSection() {
    var table = exporter.export(marchReport());

    assertThat(table.title()).isEqualTo("Monthly Report - March 2026");
    assertThat(table.rows()).hasSize(4);
    assertThat(table.rows())
        .extracting(row -> row.get("status"))
        .containsExactly("PARTIALLY_PAID 40%", "Subtotal (1)", "UNPAID", "Subtotal (1)");
    assertThat(table.rows().get(1).get("serial")).isNull();
    assertThat((BigDecimal) table.rows().get(1).get("amount")).isEqualByComparingTo("400.00");
  }

  @Test
  void export_everyRowHasEveryColumnKey() {
    var table = exporter.export(marchReport());

    var keys = table.columns().stream().map(ExportColumn::key).toList();
    assertThat(table.rows()).allSatisfy(row -> assertThat(row).containsOnlyKeys(keys));
  }

  @Test
  void export_summaryCarriesGrandTotal() {
    var table = exporter.export(marchReport());

    assertThat(table.summary())
        .containsEntry("period", "March 2026")
        .containsEntry("mode", "live")
        .containsEntry("totalEntries", 2);
    assertThat((BigDecimal) table.summary().get("grandTotal")).isEqualByComparingTo("600.00");
  }

  private static MonthlyReport marchReport() {
    var date = LocalDate.of(2026, 3, 3);
    var partlyPaid =
        invoice(context(UUID.randomUUID()), "EXP-1", date, date, "1000", "0", "400", "partial");
    var open = invoice(context(UUID.randomUUID()), "EXP-2", date, date, "200", "0", "0", "unpaid");
    var pay = payment(partlyPaid, LocalDate.of(2026, 3, 9), "400", BANK, "Bank Transfer");
    return new ReportGrouper()
        .buildReport(
            YearMonth.of(2026, 3),
            ReportMode.LIVE,
            new NormalizationResult(List.of(partlyPaid, open, pay), List.of()),
            List.of(new PaymentTypeRef(BANK, "Bank Transfer")),
            Instant.parse("2026-04-01T00:00:00Z"));
  }
}
