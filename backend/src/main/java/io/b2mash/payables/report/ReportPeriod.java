package io.b2mash.payables.report;

import io.b2mash.payables.exception.ResourceConflictException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import java.time.Instant;
import java.util.UUID;

/**
 * One calendar month of reporting. Created lazily in DRAFT the first time the month is touched.
 *
 * <p>{@code snapshotData} holds the JSON of the report captured at finalization and is never
 * modified afterwards; only unfinalize clears it.
 */
@Entity
@Table(
    name = "report_periods",
    uniqueConstraints = @UniqueConstraint(columnNames = {"period_month", "period_year"}))
public class ReportPeriod {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "period_month", nullable = false)
  private int month;

  @Column(name = "period_year", nullable = false)
  private int year;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private ReportPeriodStatus status = ReportPeriodStatus.DRAFT;

  @Column(name = "snapshot_data", columnDefinition = "TEXT")
  private String snapshotData;

  @Column(name = "finalized_at")
  private Instant finalizedAt;

  @Column(name = "finalized_by", length = 255)
  private String finalizedBy;

  @Column(name = "finalized_by_name", length = 255)
  private String finalizedByName;

  @Column(name = "submitted_at")
  private Instant submittedAt;

  @Column(name = "submitted_by", length = 255)
  private String submittedBy;

  @Column(name = "submitted_to", length = 255)
  private String submittedTo;

  @Column(name = "notes", columnDefinition = "TEXT")
  private String notes;

  @Version private Long version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected ReportPeriod() {}

  public ReportPeriod(int month, int year) {
    this.month = month;
    this.year = year;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /**
   * Freezes the report.
   *
   * @throws ResourceConflictException unless the period is a draft
   */
  public void finalizeWith(
      String snapshotJson, String actorId, String actorName, Instant at, String notes) {
    requireFinalizable();
    this.status = ReportPeriodStatus.FINALIZED;
    this.snapshotData = snapshotJson;
    this.finalizedAt = at;
    this.finalizedBy = actorId;
    this.finalizedByName = actorName;
    this.notes = notes;
    this.updatedAt = Instant.now();
  }

  /** Fails the way {@link #finalizeWith} would, before any snapshot is computed. */
  public void requireFinalizable() {
    switch (status) {
      case FINALIZED ->
          throw new ResourceConflictException(
              "Report already finalized", "Report already finalized");
      case SUBMITTED ->
          throw new ResourceConflictException(
              "Report already submitted", "Report already submitted");
      case DRAFT -> {}
    }
  }

  /**
   * Records the hand-over of a finalized report. The snapshot is left untouched.
   *
   * @throws ResourceConflictException unless the period is finalized
   */
  public void markSubmitted(String submittedTo, String actorId, Instant at) {
    switch (status) {
      case DRAFT ->
          throw new ResourceConflictException(
              "Report not finalized", "Report must be finalized before submitting");
      case SUBMITTED ->
          throw new ResourceConflictException(
              "Report already submitted", "Report is already submitted");
      case FINALIZED -> {}
    }
    this.status = ReportPeriodStatus.SUBMITTED;
    this.submittedTo = submittedTo;
    this.submittedBy = actorId;
    this.submittedAt = at;
    this.updatedAt = Instant.now();
  }

  /**
   * Discards the snapshot and reopens the period as a draft.
   *
   * @throws ResourceConflictException unless the period is finalized
   */
  public void clearSnapshot() {
    if (!status.canTransitionTo(ReportPeriodStatus.DRAFT)) {
      throw new ResourceConflictException(
          "Cannot unfinalize report",
          status == ReportPeriodStatus.SUBMITTED
              ? "Report is already submitted"
              : "Report is not finalized");
    }
    this.status = ReportPeriodStatus.DRAFT;
    this.snapshotData = null;
    this.finalizedAt = null;
    this.finalizedBy = null;
    this.finalizedByName = null;
    this.notes = null;
    this.updatedAt = Instant.now();
  }

  public boolean hasSnapshot() {
    return snapshotData != null;
  }

  public UUID getId() {
    return id;
  }

  public int getMonth() {
    return month;
  }

  public int getYear() {
    return year;
  }

  public ReportPeriodStatus getStatus() {
    return status;
  }

  public String getSnapshotData() {
    return snapshotData;
  }

  public Instant getFinalizedAt() {
    return finalizedAt;
  }

  public String getFinalizedBy() {
    return finalizedBy;
  }

  public String getFinalizedByName() {
    return finalizedByName;
  }

  public Instant getSubmittedAt() {
    return submittedAt;
  }

  public String getSubmittedBy() {
    return submittedBy;
  }

  public String getSubmittedTo() {
    return submittedTo;
  }

  public String getNotes() {
    return notes;
  }

  public Long getVersion() {
    return version;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
