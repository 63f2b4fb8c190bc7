package io.b2mash.payables.approval;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/approvals")
public class ApprovalController {

  private final ApprovalService approvalService;
  private final BulkOperationService bulkOperationService;

  public ApprovalController(
      ApprovalService approvalService, BulkOperationService bulkOperationService) {
    this.approvalService = approvalService;
    this.bulkOperationService = bulkOperationService;
  }

  @GetMapping("/pending-counts")
  @PreAuthorize("hasAnyRole('MEMBER', 'ADMIN', 'SUPER_ADMIN')")
  public ResponseEntity<PendingCountsResponse> pendingCounts() {
    return ResponseEntity.ok(PendingCountsResponse.from(approvalService.pendingCounts()));
  }

  @PostMapping("/{kind}/{id}/approve")
  @PreAuthorize("hasAnyRole('ADMIN', 'SUPER_ADMIN')")
  public ResponseEntity<ApprovalResponse> approve(
      @PathVariable String kind, @PathVariable UUID id) {
    var result = approvalService.approve(DocumentKind.fromValue(kind), id);
    return ResponseEntity.ok(ApprovalResponse.from(result));
  }

  @PostMapping("/{kind}/{id}/reject")
  @PreAuthorize("hasAnyRole('ADMIN', 'SUPER_ADMIN')")
  public ResponseEntity<ApprovalResponse> reject(
      @PathVariable String kind,
      @PathVariable UUID id,
      @Valid @RequestBody RejectRequest request) {
    var result = approvalService.reject(DocumentKind.fromValue(kind), id, request.reason());
    return ResponseEntity.ok(ApprovalResponse.from(result));
  }

  @PostMapping("/{kind}/{id}/archive")
  @PreAuthorize("hasAnyRole('ADMIN', 'SUPER_ADMIN')")
  public ResponseEntity<ApprovalResponse> archive(
      @PathVariable String kind,
      @PathVariable UUID id,
      @Valid @RequestBody(required = false) ArchiveRequest request) {
    var reason = request != null ? request.reason() : null;
    var result = approvalService.archive(DocumentKind.fromValue(kind), id, reason);
    return ResponseEntity.ok(ApprovalResponse.from(result));
  }

  @PostMapping("/bulk/{action}")
  @PreAuthorize("hasAnyRole('ADMIN', 'SUPER_ADMIN')")
  public ResponseEntity<BulkOperationResult> bulk(
      @PathVariable String action, @Valid @RequestBody BulkRequest request) {
    var result =
        bulkOperationService.execute(
            ApprovalAction.fromValue(action),
            DocumentKind.fromValue(request.documentType()),
            request.ids(),
            request.reason());
    return ResponseEntity.ok(result);
  }

  // --- DTOs ---

  public record RejectRequest(@NotNull @Size(min = 10, max = 500) String reason) {}

  public record ArchiveRequest(@Size(max = 500) String reason) {}

  public record BulkRequest(
      @NotNull String documentType, @NotEmpty List<UUID> ids, @Size(max = 500) String reason) {}

  public record ApprovalResponse(String documentType, UUID id, String status, boolean changed) {

    static ApprovalResponse from(ApprovalResult result) {
      return new ApprovalResponse(
          result.kind().value(), result.id(), result.status(), result.changed());
    }
  }

  public record PendingCountsResponse(
      long vendors,
      long invoices,
      long payments,
      long creditNotes,
      long advancePayments,
      long total) {

    static PendingCountsResponse from(PendingCounts counts) {
      return new PendingCountsResponse(
          counts.vendors(),
          counts.invoices(),
          counts.payments(),
          counts.creditNotes(),
          counts.advancePayments(),
          counts.total());
    }
  }
}
