package io.b2mash.payables.payment;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.net.URI;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class PaymentController {

  private final PaymentRecordingService recordingService;

  public PaymentController(PaymentRecordingService recordingService) {
    this.recordingService = recordingService;
  }

  @PostMapping("/api/invoices/{invoiceId}/payments")
  @PreAuthorize("hasAnyRole('MEMBER', 'ADMIN', 'SUPER_ADMIN')")
  public ResponseEntity<PaymentResponse> recordPayment(
      @PathVariable UUID invoiceId, @Valid @RequestBody RecordPaymentRequest request) {
    var payment =
        recordingService.recordPayment(
            invoiceId,
            request.amount(),
            request.paymentDate(),
            request.paymentTypeId(),
            request.transactionRef(),
            request.tdsAmountApplied(),
            request.tdsRounded());
    return ResponseEntity.created(URI.create("/api/payments/" + payment.getId()))
        .body(PaymentResponse.from(payment));
  }

  // --- DTOs ---

  public record RecordPaymentRequest(
      @NotNull @DecimalMin(value = "0.01") BigDecimal amount,
      LocalDate paymentDate,
      UUID paymentTypeId,
      @Size(max = 255) String transactionRef,
      @DecimalMin(value = "0.00") BigDecimal tdsAmountApplied,
      Boolean tdsRounded) {}

  public record PaymentResponse(
      UUID id,
      UUID invoiceId,
      BigDecimal amount,
      LocalDate paymentDate,
      UUID paymentTypeId,
      String transactionRef,
      BigDecimal tdsAmountApplied,
      boolean tdsRounded,
      String status,
      Instant createdAt) {

    static PaymentResponse from(Payment payment) {
      return new PaymentResponse(
          payment.getId(),
          payment.getInvoiceId(),
          payment.getAmountPaid(),
          payment.getPaymentDate(),
          payment.getPaymentTypeId(),
          payment.getTransactionRef(),
          payment.getTdsAmountApplied(),
          payment.isTdsRounded(),
          payment.getStatus().value(),
          payment.getCreatedAt());
    }
  }
}
