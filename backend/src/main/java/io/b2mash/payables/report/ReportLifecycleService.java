package io.b2mash.payables.report;

import io.b2mash.payables.audit.AuditEventBuilder;
import io.b2mash.payables.audit.AuditService;
import io.b2mash.payables.event.ReportFinalizedEvent;
import io.b2mash.payables.event.ReportSubmittedEvent;
import io.b2mash.payables.event.ReportUnfinalizedEvent;
import io.b2mash.payables.security.CurrentActor;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Drives report periods through draft → finalized → submitted.
 *
 * <p>Every transition re-reads the period inside the transaction and checks its current status.
 * The row is versioned: of two concurrent finalizations the second one fails with a conflict and
 * the first snapshot stays in place.
 */
@Service
public class ReportLifecycleService {

  private static final Logger log = LoggerFactory.getLogger(ReportLifecycleService.class);

  private final ReportPeriodRepository periodRepository;
  private final MonthlyReportService reportService;
  private final ReportSnapshotCodec snapshotCodec;
  private final AuditService auditService;
  private final ApplicationEventPublisher eventPublisher;

  public ReportLifecycleService(
      ReportPeriodRepository periodRepository,
      MonthlyReportService reportService,
      ReportSnapshotCodec snapshotCodec,
      AuditService auditService,
      ApplicationEventPublisher eventPublisher) {
    this.periodRepository = periodRepository;
    this.reportService = reportService;
    this.snapshotCodec = snapshotCodec;
    this.auditService = auditService;
    this.eventPublisher = eventPublisher;
  }

  /** Returns the period of a month, creating it as a draft on first access. */
  @Transactional
  public ReportPeriod getReportPeriod(int month, int year) {
    MonthlyReportService.toYearMonth(month, year);
    return periodRepository
        .findByMonthAndYear(month, year)
        .orElseGet(
            () -> {
              log.info("Creating draft report period {}/{}", month, year);
              return periodRepository.saveAndFlush(new ReportPeriod(month, year));
            });
  }

  @Transactional(readOnly = true)
  public List<ReportPeriod> periods(int year) {
    return periodRepository.findByYearOrderByMonthDesc(year);
  }

  /** Captures the live report as the period's immutable snapshot. */
  @Transactional
  public ReportPeriod finalizeReport(int month, int year, String notes) {
    var period = getReportPeriod(month, year);
    period.requireFinalizable();

    var actor = CurrentActor.resolve();
    var report =
        reportService.generate(MonthlyReportService.toYearMonth(month, year), ReportMode.LIVE);
    var finalizedAt = Instant.now();
    var snapshot =
        new ReportSnapshot(ReportSnapshot.CURRENT_VERSION, report, finalizedAt, actor.name());
    period.finalizeWith(
        snapshotCodec.write(snapshot), actor.id(), actor.name(), finalizedAt, notes);
    period = periodRepository.saveAndFlush(period);

    Map<String, Object> details = periodDetails(period);
    details.put("grand_total", report.grandTotal().toPlainString());
    details.put("total_entries", report.totalEntries());
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("report.finalized")
            .entityType("report_period")
            .entityId(period.getId())
            .actor(actor)
            .details(details)
            .build());
    eventPublisher.publishEvent(
        new ReportFinalizedEvent(
            "report.finalized",
            "report_period",
            period.getId(),
            actor.id(),
            actor.name(),
            finalizedAt,
            details,
            month,
            year));

    log.info(
        "Finalized report {}/{} with {} entries, total {}",
        month,
        year,
        report.totalEntries(),
        report.grandTotal());
    return period;
  }

  /** Records that a finalized report was handed over. The snapshot is not touched. */
  @Transactional
  public ReportPeriod submitReport(int month, int year, String submittedTo) {
    var period = getReportPeriod(month, year);
    var actor = CurrentActor.resolve();
    var submittedAt = Instant.now();
    period.markSubmitted(submittedTo, actor.id(), submittedAt);
    period = periodRepository.saveAndFlush(period);

    Map<String, Object> details = periodDetails(period);
    details.put("submitted_to", submittedTo);
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("report.submitted")
            .entityType("report_period")
            .entityId(period.getId())
            .actor(actor)
            .details(details)
            .build());
    eventPublisher.publishEvent(
        new ReportSubmittedEvent(
            "report.submitted",
            "report_period",
            period.getId(),
            actor.id(),
            actor.name(),
            submittedAt,
            details,
            month,
            year));

    log.info("Submitted report {}/{} to {}", month, year, submittedTo);
    return period;
  }

  /** Discards the snapshot of a finalized report and reopens it as a draft. */
  @Transactional
  public ReportPeriod unfinalizeReport(int month, int year) {
    var period = getReportPeriod(month, year);
    var actor = CurrentActor.resolve();
    var previouslyFinalizedBy = period.getFinalizedByName();
    period.clearSnapshot();
    period = periodRepository.saveAndFlush(period);

    Map<String, Object> details = periodDetails(period);
    if (previouslyFinalizedBy != null) {
      details.put("previously_finalized_by", previouslyFinalizedBy);
    }
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("report.unfinalized")
            .entityType("report_period")
            .entityId(period.getId())
            .actor(actor)
            .details(details)
            .build());
    eventPublisher.publishEvent(
        new ReportUnfinalizedEvent(
            "report.unfinalized",
            "report_period",
            period.getId(),
            actor.id(),
            actor.name(),
            Instant.now(),
            details,
            month,
            year));

    log.warn("Unfinalized report {}/{}; snapshot discarded", month, year);
    return period;
  }

  private static Map<String, Object> periodDetails(ReportPeriod period) {
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("month", period.getMonth());
    details.put("year", period.getYear());
    details.put("status", period.getStatus().value());
    return details;
  }
}
