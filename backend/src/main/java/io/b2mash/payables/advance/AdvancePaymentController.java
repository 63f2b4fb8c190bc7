package io.b2mash.payables.advance;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/advance-payments")
public class AdvancePaymentController {

  private final AdvanceReconciliationService reconciliationService;

  public AdvancePaymentController(AdvanceReconciliationService reconciliationService) {
    this.reconciliationService = reconciliationService;
  }

  @PutMapping("/{id}/invoice")
  @PreAuthorize("hasAnyRole('ADMIN', 'SUPER_ADMIN')")
  public ResponseEntity<AdvancePaymentResponse> link(
      @PathVariable UUID id, @Valid @RequestBody LinkRequest request) {
    return ResponseEntity.ok(
        AdvancePaymentResponse.from(reconciliationService.link(id, request.invoiceId())));
  }

  @DeleteMapping("/{id}/invoice")
  @PreAuthorize("hasAnyRole('ADMIN', 'SUPER_ADMIN')")
  public ResponseEntity<AdvancePaymentResponse> unlink(@PathVariable UUID id) {
    return ResponseEntity.ok(AdvancePaymentResponse.from(reconciliationService.unlink(id)));
  }

  // --- DTOs ---

  public record LinkRequest(@NotNull UUID invoiceId) {}

  public record AdvancePaymentResponse(
      UUID id,
      UUID vendorId,
      UUID invoiceId,
      BigDecimal amount,
      LocalDate paymentDate,
      String status,
      boolean archived) {

    static AdvancePaymentResponse from(AdvancePayment advance) {
      return new AdvancePaymentResponse(
          advance.getId(),
          advance.getVendorId(),
          advance.getInvoiceId(),
          advance.getAmount(),
          advance.getPaymentDate(),
          advance.getStatus().value(),
          advance.isArchived());
    }
  }
}
