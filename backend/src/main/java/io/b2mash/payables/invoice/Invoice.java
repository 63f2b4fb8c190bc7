package io.b2mash.payables.invoice;

import io.b2mash.payables.exception.ResourceConflictException;
import io.b2mash.payables.tds.Amounts;
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
 * A vendor invoice awaiting payment.
 *
 * <p>Recurring invoices belong to a {@code BillingProfile}; one-time invoices have no profile. The
 * TDS configuration is copied onto the invoice when it is raised: {@code tdsPercentage} is only
 * meaningful when {@code tdsApplicable} is set, and {@code tdsRounded} selects ceiling rounding of
 * the withheld amount.
 *
 * <p>The monthly report places an invoice in its reporting month when one is assigned, otherwise in
 * the month it was received, otherwise in the month of its invoice date.
 */
@Entity
@Table(name = "invoices")
public class Invoice {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "invoice_number", nullable = false, length = 100)
  private String invoiceNumber;

  @Column(name = "invoice_name", length = 255)
  private String invoiceName;

  @Column(name = "vendor_id", nullable = false)
  private UUID vendorId;

  @Column(name = "profile_id")
  private UUID profileId;

  @Column(name = "entity_id")
  private UUID entityId;

  @Column(name = "category_id")
  private UUID categoryId;

  @Column(name = "invoice_amount", precision = 14, scale = 2, nullable = false)
  private BigDecimal invoiceAmount;

  @Column(name = "currency", nullable = false, length = 3)
  private String currency;

  @Column(name = "invoice_date", nullable = false)
  private LocalDate invoiceDate;

  @Column(name = "received_date")
  private LocalDate receivedDate;

  @Column(name = "due_date")
  private LocalDate dueDate;

  @Column(name = "reporting_month")
  private LocalDate reportingMonth;

  @Column(name = "tds_applicable", nullable = false)
  private boolean tdsApplicable;

  @Column(name = "tds_percentage", precision = 5, scale = 2)
  private BigDecimal tdsPercentage;

  @Column(name = "tds_rounded", nullable = false)
  private boolean tdsRounded;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private InvoiceStatus status = InvoiceStatus.PENDING_APPROVAL;

  @Column(name = "recurring", nullable = false)
  private boolean recurring;

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

  protected Invoice() {}

  public Invoice(
      String invoiceNumber,
      UUID vendorId,
      UUID profileId,
      BigDecimal invoiceAmount,
      String currency,
      LocalDate invoiceDate,
      LocalDate dueDate) {
    this.invoiceNumber = invoiceNumber;
    this.vendorId = vendorId;
    this.profileId = profileId;
    this.recurring = profileId != null;
    this.invoiceAmount = invoiceAmount;
    this.currency = currency != null ? currency : "INR";
    this.invoiceDate = invoiceDate;
    this.dueDate = dueDate;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void describe(String invoiceName, UUID entityId, UUID categoryId) {
    this.invoiceName = invoiceName;
    this.entityId = entityId;
    this.categoryId = categoryId;
    this.updatedAt = Instant.now();
  }

  public void configureTds(boolean applicable, BigDecimal percentage, boolean rounded) {
    this.tdsApplicable = applicable;
    this.tdsPercentage = percentage;
    this.tdsRounded = rounded;
    this.updatedAt = Instant.now();
  }

  public void markReceived(LocalDate receivedDate) {
    this.receivedDate = receivedDate;
    this.updatedAt = Instant.now();
  }

  /** Moves the invoice into another report period; null restores the date-based default. */
  public void assignReportingMonth(YearMonth month) {
    this.reportingMonth = month != null ? month.atDay(1) : null;
    this.updatedAt = Instant.now();
  }

  /**
   * Approves the invoice, moving it from PENDING_APPROVAL to UNPAID.
   *
   * @return false if the invoice was already past review
   * @throws ResourceConflictException if the invoice was rejected
   */
  public boolean approve() {
    if (status == InvoiceStatus.REJECTED) {
      throw new ResourceConflictException(
          "No longer pending approval", "Cannot approve a rejected invoice");
    }
    if (status != InvoiceStatus.PENDING_APPROVAL) {
      return false;
    }
    this.status = InvoiceStatus.UNPAID;
    this.updatedAt = Instant.now();
    return true;
  }

  /**
   * Rejects a pending invoice.
   *
   * @return false if the invoice was already rejected
   * @throws ResourceConflictException if the invoice was approved
   */
  public boolean reject(String reason) {
    if (status == InvoiceStatus.REJECTED) {
      return false;
    }
    if (status != InvoiceStatus.PENDING_APPROVAL) {
      throw new ResourceConflictException(
          "No longer pending approval", "Cannot reject an approved invoice");
    }
    this.status = InvoiceStatus.REJECTED;
    this.rejectionReason = reason;
    this.updatedAt = Instant.now();
    return true;
  }

  public void putOnHold() {
    if (!status.isSettlementTracked()) {
      throw new ResourceConflictException(
          "Invalid invoice status", "Cannot put invoice on hold in status " + status.value());
    }
    this.status = InvoiceStatus.ON_HOLD;
    this.updatedAt = Instant.now();
  }

  /**
   * Soft-deletes the invoice. Archived invoices drop out of ledgers, reports and the default feed.
   *
   * @throws ResourceConflictException if the invoice is already archived
   */
  public void archive(String reason, String actorId) {
    if (archived) {
      throw new ResourceConflictException(
          "Invoice already archived", "Invoice is already archived");
    }
    this.archived = true;
    this.archivedAt = Instant.now();
    this.archivedBy = actorId;
    this.archiveReason = reason;
    this.updatedAt = Instant.now();
  }

  /**
   * Recomputes the payment status from the total of approved payments against the net payable
   * amount. Invoices that are pending, on hold or rejected keep their status.
   */
  public void applySettlement(BigDecimal totalPaid, BigDecimal payableAmount) {
    if (!status.isSettlementTracked()) {
      return;
    }
    InvoiceStatus next;
    if (totalPaid.signum() > 0 && Amounts.isSettled(totalPaid, payableAmount)) {
      next = InvoiceStatus.PAID;
    } else if (totalPaid.signum() > 0) {
      next = InvoiceStatus.PARTIAL;
    } else {
      next = status == InvoiceStatus.OVERDUE ? InvoiceStatus.OVERDUE : InvoiceStatus.UNPAID;
    }
    if (next != status) {
      this.status = next;
      this.updatedAt = Instant.now();
    }
  }

  /** The month the live report files this invoice under. */
  public YearMonth effectiveMonth() {
    if (reportingMonth != null) {
      return YearMonth.from(reportingMonth);
    }
    return YearMonth.from(receivedDate != null ? receivedDate : invoiceDate);
  }

  public UUID getId() {
    return id;
  }

  public String getInvoiceNumber() {
    return invoiceNumber;
  }

  public String getInvoiceName() {
    return invoiceName;
  }

  public UUID getVendorId() {
    return vendorId;
  }

  public UUID getProfileId() {
    return profileId;
  }

  public UUID getEntityId() {
    return entityId;
  }

  public UUID getCategoryId() {
    return categoryId;
  }

  public BigDecimal getInvoiceAmount() {
    return invoiceAmount;
  }

  public String getCurrency() {
    return currency;
  }

  public LocalDate getInvoiceDate() {
    return invoiceDate;
  }

  public LocalDate getReceivedDate() {
    return receivedDate;
  }

  public LocalDate getDueDate() {
    return dueDate;
  }

  public LocalDate getReportingMonth() {
    return reportingMonth;
  }

  public boolean isTdsApplicable() {
    return tdsApplicable;
  }

  public BigDecimal getTdsPercentage() {
    return tdsPercentage;
  }

  public boolean isTdsRounded() {
    return tdsRounded;
  }

  public InvoiceStatus getStatus() {
    return status;
  }

  public boolean isRecurring() {
    return recurring;
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
