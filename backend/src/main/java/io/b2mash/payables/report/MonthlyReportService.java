package io.b2mash.payables.report;

import io.b2mash.payables.entry.EntryNormalizer;
import io.b2mash.payables.entry.SourceRecordLoader;
import io.b2mash.payables.exception.InvalidInputException;
import io.b2mash.payables.exception.ResourceNotFoundException;
import io.b2mash.payables.paymenttype.PaymentTypeRepository;
import java.time.Instant;
import java.time.YearMonth;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Computes monthly reports and serves the three report views. */
@Service
public class MonthlyReportService {

  private static final Logger log = LoggerFactory.getLogger(MonthlyReportService.class);

  private final SourceRecordLoader recordLoader;
  private final EntryNormalizer normalizer;
  private final ReportGrouper grouper;
  private final PaymentTypeRepository paymentTypeRepository;
  private final ReportPeriodRepository periodRepository;
  private final ReportSnapshotCodec snapshotCodec;

  public MonthlyReportService(
      SourceRecordLoader recordLoader,
      EntryNormalizer normalizer,
      ReportGrouper grouper,
      PaymentTypeRepository paymentTypeRepository,
      ReportPeriodRepository periodRepository,
      ReportSnapshotCodec snapshotCodec) {
    this.recordLoader = recordLoader;
    this.normalizer = normalizer;
    this.grouper = grouper;
    this.paymentTypeRepository = paymentTypeRepository;
    this.periodRepository = periodRepository;
    this.snapshotCodec = snapshotCodec;
  }

  /** Recomputes the report of a month from the current records. */
  @Transactional(readOnly = true)
  public MonthlyReport generate(YearMonth period, ReportMode mode) {
    var start = period.atDay(1);
    var end = period.atEndOfMonth();
    var records =
        switch (mode) {
          case LIVE -> recordLoader.forEffectivePeriod(start, end);
          case INVOICE_DATE -> recordLoader.forInvoiceDatePeriod(start, end);
        };
    var paymentTypes =
        paymentTypeRepository.findByActiveTrueOrderByDisplayOrderAscNameAsc().stream()
            .map(type -> new PaymentTypeRef(type.getId(), type.getName()))
            .toList();

    var report =
        grouper.buildReport(
            period, mode, normalizer.normalize(records), paymentTypes, Instant.now());
    log.debug(
        "Generated {} report for {}: {} sections, {} entries, total {}",
        mode.value(),
        period,
        report.sections().size(),
        report.totalEntries(),
        report.grandTotal());
    return report;
  }

  /**
   * Renders a report view. {@code live} and {@code invoice_date} are recomputed; {@code submitted}
   * returns the snapshot captured at finalization, unchanged by any later edit.
   *
   * @throws ResourceNotFoundException for the submitted view of a month that has no snapshot
   */
  @Transactional(readOnly = true)
  public ReportViewResult view(int month, int year, ReportView view) {
    var period = toYearMonth(month, year);
    var stored = periodRepository.findByMonthAndYear(month, year);
    var status = stored.map(ReportPeriod::getStatus).orElse(ReportPeriodStatus.DRAFT);

    if (view == ReportView.SUBMITTED) {
      var snapshotPeriod =
          stored
              .filter(ReportPeriod::hasSnapshot)
              .orElseThrow(
                  () ->
                      ResourceNotFoundException.withDetail(
                          "Report snapshot not found",
                          "No finalized report exists for " + ReportGrouper.label(period)));
      var snapshot = snapshotCodec.read(snapshotPeriod.getSnapshotData());
      return new ReportViewResult(view, status, snapshot.report(), snapshot);
    }
    return new ReportViewResult(view, status, generate(period, view.mode()), null);
  }

  static YearMonth toYearMonth(int month, int year) {
    if (month < 1 || month > 12) {
      throw new InvalidInputException("Invalid month", "Month must be between 1 and 12");
    }
    if (year < 2000 || year > 9999) {
      throw new InvalidInputException("Invalid year", "Year must be between 2000 and 9999");
    }
    return YearMonth.of(year, month);
  }

  /**
   * @param snapshot the stored snapshot for the submitted view; null for recomputed views
   */
  public record ReportViewResult(
      ReportView view,
      ReportPeriodStatus periodStatus,
      MonthlyReport report,
      ReportSnapshot snapshot) {}
}
