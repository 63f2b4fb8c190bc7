package io.b2mash.payables.ledger;

import io.b2mash.payables.entry.EntryIssue;
import io.b2mash.payables.entry.EntryKind;
import io.b2mash.payables.exception.InvalidInputException;
import io.b2mash.payables.export.ExportTable;
import io.b2mash.payables.export.LedgerExporter;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/ledger")
public class LedgerController {

  private final LedgerService ledgerService;
  private final LedgerExporter ledgerExporter;

  public LedgerController(LedgerService ledgerService, LedgerExporter ledgerExporter) {
    this.ledgerService = ledgerService;
    this.ledgerExporter = ledgerExporter;
  }

  @GetMapping("/profiles")
  @PreAuthorize("hasAnyRole('MEMBER', 'ADMIN', 'SUPER_ADMIN')")
  public ResponseEntity<List<ProfileOption>> listProfiles() {
    return ResponseEntity.ok(ledgerService.profileOptions());
  }

  @GetMapping("/{profileId}")
  @PreAuthorize("hasAnyRole('MEMBER', 'ADMIN', 'SUPER_ADMIN')")
  public ResponseEntity<LedgerResponse> getLedger(
      @PathVariable UUID profileId,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate startDate,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate endDate,
      @RequestParam(required = false) String kind,
      @RequestParam(required = false) String search) {
    var view = ledgerService.getLedger(profileId, toFilter(startDate, endDate, kind, search));
    return ResponseEntity.ok(LedgerResponse.from(view));
  }

  @GetMapping("/{profileId}/export-rows")
  @PreAuthorize("hasAnyRole('MEMBER', 'ADMIN', 'SUPER_ADMIN')")
  public ResponseEntity<ExportTable> exportRows(
      @PathVariable UUID profileId,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate startDate,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate endDate,
      @RequestParam(required = false) String kind,
      @RequestParam(required = false) String search) {
    var view = ledgerService.getLedger(profileId, toFilter(startDate, endDate, kind, search));
    return ResponseEntity.ok(ledgerExporter.export(view));
  }

  private static LedgerFilter toFilter(
      LocalDate startDate, LocalDate endDate, String kind, String search) {
    if (startDate != null && endDate != null && endDate.isBefore(startDate)) {
      throw new InvalidInputException("Invalid date range", "endDate must not precede startDate");
    }
    return new LedgerFilter(
        startDate, endDate, kind == null ? null : EntryKind.fromValue(kind), search);
  }

  // --- DTOs ---

  public record LedgerResponse(
      UUID profileId,
      String profileName,
      List<LedgerRowResponse> entries,
      LedgerSummary summary,
      List<EntryIssue> issues) {

    static LedgerResponse from(LedgerView view) {
      return new LedgerResponse(
          view.profileId(),
          view.profileName(),
          view.entries().stream().map(LedgerRowResponse::from).toList(),
          view.summary(),
          view.issues());
    }
  }

  public record LedgerRowResponse(
      String kind,
      UUID id,
      LocalDate date,
      String referenceNumber,
      String description,
      String status,
      String displayStatus,
      BigDecimal grossAmount,
      BigDecimal payableAmount,
      BigDecimal paidAmount,
      BigDecimal runningBalance) {

    static LedgerRowResponse from(LedgerEntry row) {
      var entry = row.entry();
      return new LedgerRowResponse(
          entry.kind().value(),
          entry.id(),
          entry.date(),
          entry.referenceNumber(),
          entry.description(),
          entry.status(),
          entry.displayStatus(),
          entry.grossAmount(),
          row.payableAmount(),
          row.paidAmount(),
          row.runningBalance());
    }
  }
}
