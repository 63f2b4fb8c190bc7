package io.b2mash.payables.advance;

import io.b2mash.payables.approval.ApprovalStatus;
import io.b2mash.payables.exception.ResourceConflictException;
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
import java.time.YearMonth;
import java.util.UUID;

/**
 * Money paid to a vendor before an invoice exists. It is reconciled later by linking it to one of
 * the vendor's invoices; until then {@code invoiceId} is null.
 */
@Entity
@Table(name = "advance_payments")
public class AdvancePayment {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "vendor_id", nullable = false)
  private UUID vendorId;

  @Column(name = "invoice_id")
  private UUID invoiceId;

  @Column(name = "amount", precision = 14, scale = 2, nullable = false)
  private BigDecimal amount;

  @Column(name = "payment_date", nullable = false)
  private LocalDate paymentDate;

  @Column(name = "payment_type_id", nullable = false)
  private UUID paymentTypeId;

  @Column(name = "transaction_ref", length = 255)
  private String transactionRef;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Column(name = "reporting_month")
  private LocalDate reportingMonth;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private ApprovalStatus status = ApprovalStatus.PENDING_APPROVAL;

  @Column(name = "rejection_reason", length = 500)
  private String rejectionReason;

  @Column(name = "archived", nullable = false)
  private boolean archived;

  @Column(name = "archived_at")
  private Instant archivedAt;

  @Column(name = "archived_by", length = 255)
  private String archivedBy;

  @Column(name = "archive_reason", length = 500)
  private String archiveReason;

  @Version private Long version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected AdvancePayment() {}

  public AdvancePayment(
      UUID vendorId,
      BigDecimal amount,
      LocalDate paymentDate,
      UUID paymentTypeId,
      String transactionRef,
      String description) {
    this.vendorId = vendorId;
    this.amount = amount;
    this.paymentDate = paymentDate;
    this.paymentTypeId = paymentTypeId;
    this.transactionRef = transactionRef;
    this.description = description;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /**
   * Reconciles the advance against an invoice.
   *
   * @throws ResourceConflictException if the advance is already linked
   */
  public void linkTo(UUID invoiceId) {
    if (this.invoiceId != null) {
      throw new ResourceConflictException(
          "Advance payment already linked", "Advance payment is already linked to an invoice");
    }
    this.invoiceId = invoiceId;
    this.updatedAt = Instant.now();
  }

  public void unlink() {
    this.invoiceId = null;
    this.updatedAt = Instant.now();
  }

  public void assignReportingMonth(YearMonth month) {
    this.reportingMonth = month != null ? month.atDay(1) : null;
    this.updatedAt = Instant.now();
  }

  public boolean approve() {
    if (!status.approvalChangesState("advance payment")) {
      return false;
    }
    this.status = ApprovalStatus.APPROVED;
    this.updatedAt = Instant.now();
    return true;
  }

  public boolean reject(String rejectionReason) {
    if (!status.rejectionChangesState("advance payment")) {
      return false;
    }
    this.status = ApprovalStatus.REJECTED;
    this.rejectionReason = rejectionReason;
    this.updatedAt = Instant.now();
    return true;
  }

  public void archive(String reason, String actorId) {
    if (archived) {
      throw new ResourceConflictException(
          "Advance payment already archived", "Advance payment is already archived");
    }
    this.archived = true;
    this.archivedAt = Instant.now();
    this.archivedBy = actorId;
    this.archiveReason = reason;
    this.updatedAt = Instant.now();
  }

  public YearMonth effectiveMonth() {
    return YearMonth.from(reportingMonth != null ? reportingMonth : paymentDate);
  }

  public UUID getId() {
    return id;
  }

  public UUID getVendorId() {
    return vendorId;
  }

  public UUID getInvoiceId() {
    return invoiceId;
  }

  public BigDecimal getAmount() {
    return amount;
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

  public String getDescription() {
    return description;
  }

  public LocalDate getReportingMonth() {
    return reportingMonth;
  }

  public ApprovalStatus getStatus() {
    return status;
  }

  public String getRejectionReason() {
    return rejectionReason;
  }

  public boolean isArchived() {
    return archived;
  }

  public Instant getArchivedAt() {
    return archivedAt;
  }

  public String getArchivedBy() {
    return archivedBy;
  }

  public String getArchiveReason() {
    return archiveReason;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
