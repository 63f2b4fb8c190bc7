package io.b2mash.payables.creditnote;

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
 * A credit note reducing what is owed on a parent invoice. The amount is stored positive; the
 * normalizer negates it. {@code tdsAmount} is the withholding reversed along with the credit.
 */
@Entity
@Table(name = "credit_notes")
public class CreditNote {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "invoice_id", nullable = false)
  private UUID invoiceId;

  @Column(name = "credit_note_number", nullable = false, length = 100)
  private String creditNoteNumber;

  @Column(name = "amount", precision = 14, scale = 2, nullable = false)
  private BigDecimal amount;

  @Column(name = "credit_note_date", nullable = false)
  private LocalDate creditNoteDate;

  @Column(name = "reporting_month")
  private LocalDate reportingMonth;

  @Column(name = "tds_applicable", nullable = false)
  private boolean tdsApplicable;

  @Column(name = "tds_amount", precision = 14, scale = 2)
  private BigDecimal tdsAmount;

  @Column(name = "reason", columnDefinition = "TEXT")
  private String reason;

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

  protected CreditNote() {}

  public CreditNote(
      UUID invoiceId,
      String creditNoteNumber,
      BigDecimal amount,
      LocalDate creditNoteDate,
      String reason) {
    this.invoiceId = invoiceId;
    this.creditNoteNumber = creditNoteNumber;
    this.amount = amount;
    this.creditNoteDate = creditNoteDate;
    this.reason = reason;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /** Null {@code tdsAmount} with the flag set means the reversal is derived from the invoice. */
  public void configureTds(boolean applicable, BigDecimal tdsAmount) {
    this.tdsApplicable = applicable;
    this.tdsAmount = applicable ? tdsAmount : null;
    this.updatedAt = Instant.now();
  }

  public void assignReportingMonth(YearMonth month) {
    this.reportingMonth = month != null ? month.atDay(1) : null;
    this.updatedAt = Instant.now();
  }

  public boolean approve() {
    if (!status.approvalChangesState("credit note")) {
      return false;
    }
    this.status = ApprovalStatus.APPROVED;
    this.updatedAt = Instant.now();
    return true;
  }

  public boolean reject(String rejectionReason) {
    if (!status.rejectionChangesState("credit note")) {
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
          "Credit note already archived", "Credit note is already archived");
    }
    this.archived = true;
    this.archivedAt = Instant.now();
    this.archivedBy = actorId;
    this.archiveReason = reason;
    this.updatedAt = Instant.now();
  }

  public YearMonth effectiveMonth() {
    return YearMonth.from(reportingMonth != null ? reportingMonth : creditNoteDate);
  }

  public UUID getId() {
    return id;
  }

  public UUID getInvoiceId() {
    return invoiceId;
  }

  public String getCreditNoteNumber() {
    return creditNoteNumber;
  }

  public BigDecimal getAmount() {
    return amount;
  }

  public LocalDate getCreditNoteDate() {
    return creditNoteDate;
  }

  public LocalDate getReportingMonth() {
    return reportingMonth;
  }

  public boolean isTdsApplicable() {
    return tdsApplicable;
  }

  public BigDecimal getTdsAmount() {
    return tdsAmount;
  }

  public String getReason() {
    return reason;
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
