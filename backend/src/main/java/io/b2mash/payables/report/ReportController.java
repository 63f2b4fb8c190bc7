package io.b2mash.payables.report;

import io.b2mash.payables.approval.DocumentKind;
import io.b2mash.payables.export.ExportTable;
import io.b2mash.payables.export.MonthlyReportExporter;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/reports")
public class ReportController {

  private final MonthlyReportService reportService;
  private final ReportLifecycleService lifecycleService;
  private final ReportingMonthService reportingMonthService;
  private final MonthlyReportExporter reportExporter;

  public ReportController(
      MonthlyReportService reportService,
      ReportLifecycleService lifecycleService,
      ReportingMonthService reportingMonthService,
      MonthlyReportExporter reportExporter) {
    this.reportService = reportService;
    this.lifecycleService = lifecycleService;
    this.reportingMonthService = reportingMonthService;
    this.reportExporter = reportExporter;
  }

  @GetMapping("/monthly")
  @PreAuthorize("hasAnyRole('MEMBER', 'ADMIN', 'SUPER_ADMIN')")
  public ResponseEntity<MonthlyReportResponse> getMonthlyReport(
      @RequestParam int month,
      @RequestParam int year,
      @RequestParam(defaultValue = "live") String view) {
    var result = reportService.view(month, year, ReportView.fromValue(view));
    return ResponseEntity.ok(MonthlyReportResponse.from(result));
  }

  @GetMapping("/monthly/export-rows")
  @PreAuthorize("hasAnyRole('MEMBER', 'ADMIN', 'SUPER_ADMIN')")
  public ResponseEntity<ExportTable> exportMonthlyReport(
      @RequestParam int month,
      @RequestParam int year,
      @RequestParam(defaultValue = "live") String view) {
    var result = reportService.view(month, year, ReportView.fromValue(view));
    return ResponseEntity.ok(reportExporter.export(result.report()));
  }

  @GetMapping("/periods")
  @PreAuthorize("hasAnyRole('MEMBER', 'ADMIN', 'SUPER_ADMIN')")
  public ResponseEntity<List<ReportPeriodResponse>> listPeriods(@RequestParam int year) {
    return ResponseEntity.ok(
        lifecycleService.periods(year).stream().map(ReportPeriodResponse::from).toList());
  }

  @GetMapping("/periods/{year}/{month}")
  @PreAuthorize("hasAnyRole('MEMBER', 'ADMIN', 'SUPER_ADMIN')")
  public ResponseEntity<ReportPeriodResponse> getPeriod(
      @PathVariable int year, @PathVariable int month) {
    return ResponseEntity.ok(
        ReportPeriodResponse.from(lifecycleService.getReportPeriod(month, year)));
  }

  @PostMapping("/periods/{year}/{month}/finalize")
  @PreAuthorize("hasAnyRole('ADMIN', 'SUPER_ADMIN')")
  public ResponseEntity<ReportPeriodResponse> finalizeReport(
      @PathVariable int year,
      @PathVariable int month,
      @Valid @RequestBody(required = false) FinalizeRequest request) {
    var notes = request != null ? request.notes() : null;
    return ResponseEntity.ok(
        ReportPeriodResponse.from(lifecycleService.finalizeReport(month, year, notes)));
  }

  @PostMapping("/periods/{year}/{month}/submit")
  @PreAuthorize("hasAnyRole('ADMIN', 'SUPER_ADMIN')")
  public ResponseEntity<ReportPeriodResponse> submitReport(
      @PathVariable int year, @PathVariable int month, @Valid @RequestBody SubmitRequest request) {
    return ResponseEntity.ok(
        ReportPeriodResponse.from(
            lifecycleService.submitReport(month, year, request.submittedTo().trim())));
  }

  @PostMapping("/periods/{year}/{month}/unfinalize")
  @PreAuthorize("hasRole('SUPER_ADMIN')")
  public ResponseEntity<ReportPeriodResponse> unfinalizeReport(
      @PathVariable int year, @PathVariable int month) {
    return ResponseEntity.ok(
        ReportPeriodResponse.from(lifecycleService.unfinalizeReport(month, year)));
  }

  @PutMapping("/reporting-month")
  @PreAuthorize("hasAnyRole('ADMIN', 'SUPER_ADMIN')")
  public ResponseEntity<ReportingMonthResponse> setReportingMonth(
      @Valid @RequestBody ReportingMonthRequest request) {
    var kind = DocumentKind.fromValue(request.documentType());
    var reportingMonth =
        reportingMonthService.setReportingMonth(
            kind, request.documentId(), request.month(), request.year());
    return ResponseEntity.ok(
        new ReportingMonthResponse(kind.value(), request.documentId(), reportingMonth));
  }

  // --- DTOs ---

  public record FinalizeRequest(@Size(max = 2000) String notes) {}

  public record SubmitRequest(@NotBlank @Size(max = 255) String submittedTo) {}

  public record ReportingMonthRequest(
      @NotBlank String documentType, @NotNull UUID documentId, Integer month, Integer year) {}

  public record ReportingMonthResponse(
      String documentType, UUID documentId, LocalDate reportingMonth) {}

  public record MonthlyReportResponse(
      String view,
      String periodStatus,
      MonthlyReport report,
      Instant finalizedAt,
      String finalizedBy) {

    static MonthlyReportResponse from(MonthlyReportService.ReportViewResult result) {
      var snapshot = result.snapshot();
      return new MonthlyReportResponse(
          result.view().name().toLowerCase(),
          result.periodStatus().value(),
          result.report(),
          snapshot != null ? snapshot.finalizedAt() : null,
          snapshot != null ? snapshot.finalizedBy() : null);
    }
  }

  public record ReportPeriodResponse(
      UUID id,
      int month,
      int year,
      String label,
      String status,
      boolean hasSnapshot,
      Instant finalizedAt,
      String finalizedBy,
      Instant submittedAt,
      String submittedBy,
      String submittedTo,
      String notes) {

    static ReportPeriodResponse from(ReportPeriod period) {
      return new ReportPeriodResponse(
          period.getId(),
          period.getMonth(),
          period.getYear(),
          ReportGrouper.label(YearMonth.of(period.getYear(), period.getMonth())),
          period.getStatus().value(),
          period.hasSnapshot(),
          period.getFinalizedAt(),
          period.getFinalizedByName(),
          period.getSubmittedAt(),
          period.getSubmittedBy(),
          period.getSubmittedTo(),
          period.getNotes());
    }
  }
}
