package io.b2mash.payables.payment;

import io.b2mash.payables.approval.ApprovalStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A payment made against an invoice. Payments are recorded as PENDING_APPROVAL and only count
 * toward balances once approved.
 *
 * <p>{@code tdsAmountApplied} is the withholding actually deducted when paying, which may differ
 * from the computed amount after a manual override; {@code tdsRounded} is the rounding policy in
 * force at payment time.
 */
@Entity
@Table(name = "payments")
public class Payment {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "invoice_id", nullable = false)
  private UUID invoiceId;

  @Column(name = "amount_paid", precision = 14, scale = 2, nullable = false)
  private BigDecimal amountPaid;

  @Column(name = "payment_date", nullable = false)
  private LocalDate paymentDate;

  @Column(name = "payment_type_id")
  private UUID paymentTypeId;

  @Column(name = "transaction_ref", length = 255)
  private String transactionRef;

  @Column(name = "tds_amount_applied", precision = 14, scale = 2)
  private BigDecimal tdsAmountApplied;

  @Column(name = "tds_rounded", nullable = false)
  private boolean tdsRounded;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private ApprovalStatus status = ApprovalStatus.PENDING_APPROVAL;

  @Column(name = "rejection_reason", length = 500)
  private String rejectionReason;

  @Column(name = "created_by", length = 255)
  private String createdBy;

  @Column(name = "approved_by", length = 255)
  private String approvedBy;

  @Column(name = "approved_at")
  private Instant approvedAt;

  @Version private Long version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Payment() {}

  public Payment(
      UUID invoiceId,
      BigDecimal amountPaid,
      LocalDate paymentDate,
      UUID paymentTypeId,
      String transactionRef,
      String createdBy) {
    this.invoiceId = invoiceId;
    this.amountPaid = amountPaid;
    this.paymentDate = paymentDate;
    this.paymentTypeId = paymentTypeId;
    this.transactionRef = transactionRef;
    this.createdBy = createdBy;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void recordWithholding(BigDecimal tdsAmountApplied, boolean tdsRounded) {
    this.tdsAmountApplied = tdsAmountApplied;
    this.tdsRounded = tdsRounded;
    this.updatedAt = Instant.now();
  }

  /** Returns true if the status changed, false if the payment was already approved. */
  public boolean approve(String actorId) {
    if (!status.approvalChangesState("payment")) {
      return false;
    }
    this.status = ApprovalStatus.APPROVED;
    this.approvedBy = actorId;
    this.approvedAt = Instant.now();
    this.updatedAt = Instant.now();
    return true;
  }

  /** Returns true if the status changed, false if the payment was already rejected. */
  public boolean reject(String reason) {
    if (!status.rejectionChangesState("payment")) {
      return false;
    }
    this.status = ApprovalStatus.REJECTED;
    this.rejectionReason = reason;
    this.updatedAt = Instant.now();
    return true;
  }

  public UUID getId() {
    return id;
  }

  public UUID getInvoiceId() {
    return invoiceId;
  }

  public BigDecimal getAmountPaid() {
    return amountPaid;
  }

  public LocalDate getPaymentDate() {
    return paymentDate;
  }

  public UUID getPaymentTypeId() {
    return paymentTypeId;
  }

  public String getTransactionRef() {
    return transactionRef;
  }

  public BigDecimal getTdsAmountApplied() {
    return tdsAmountApplied;
  }

  public boolean isTdsRounded() {
    return tdsRounded;
  }

  public ApprovalStatus getStatus() {
    return status;
  }

  public String getRejectionReason() {
    return rejectionReason;
  }

  public String getCreatedBy() {
    return createdBy;
  }

  public String getApprovedBy() {
    return approvedBy;
  }

  public Instant getApprovedAt() {
    return approvedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
