package io.b2mash.payables.profile;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Recurring billing arrangement with a vendor. Recurring invoices reference a profile and the
 * ledger is computed per profile. The TDS fields are the defaults copied onto new invoices; each
 * invoice keeps its own copy so later profile edits never rewrite history.
 */
@Entity
@Table(name = "billing_profiles")
public class BillingProfile {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "name", nullable = false, length = 255)
  private String name;

  @Column(name = "vendor_id", nullable = false)
  private UUID vendorId;

  @Column(name = "entity_id")
  private UUID entityId;

  @Column(name = "category_id")
  private UUID categoryId;

  @Column(name = "tds_applicable", nullable = false)
  private boolean tdsApplicable;

  @Column(name = "tds_percentage", precision = 5, scale = 2)
  private BigDecimal tdsPercentage;

  @Column(name = "tds_rounded", nullable = false)
  private boolean tdsRounded;

  @Column(name = "active", nullable = false)
  private boolean active = true;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected BillingProfile() {}

  public BillingProfile(String name, UUID vendorId, UUID entityId, UUID categoryId) {
    this.name = name;
    this.vendorId = vendorId;
    this.entityId = entityId;
    this.categoryId = categoryId;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void configureTds(boolean applicable, BigDecimal percentage, boolean rounded) {
    this.tdsApplicable = applicable;
    this.tdsPercentage = applicable ? percentage : null;
    this.tdsRounded = applicable && rounded;
    this.updatedAt = Instant.now();
  }

  public void deactivate() {
    this.active = false;
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public UUID getVendorId() {
    return vendorId;
  }

  public UUID getEntityId() {
    return entityId;
  }

  public UUID getCategoryId() {
    return categoryId;
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

  public boolean isActive() {
    return active;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
