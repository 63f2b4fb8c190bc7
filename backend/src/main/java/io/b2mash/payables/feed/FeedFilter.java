package io.b2mash.payables.feed;

import io.b2mash.payables.entry.EntryKind;
import java.time.LocalDate;
import java.util.Set;
import java.util.UUID;

/**
 * Conjunction of optional criteria over normalized entries. Empty sets and null values do not
 * restrict. Archived entries are excluded unless {@code includeArchived} is set.
 *
 * @param statuses raw status values; {@link FeedQuery#PENDING_ACTIONS} expands per entry kind
 * @param search case-insensitive text matched against reference number and description
 */
public record FeedFilter(
    Set<EntryKind> kinds,
    Set<String> statuses,
    LocalDate startDate,
    LocalDate endDate,
    UUID profileId,
    UUID vendorId,
    UUID categoryId,
    UUID entityId,
    UUID paymentTypeId,
    Boolean recurring,
    Boolean tdsApplicable,
    boolean includeArchived,
    String search) {

  public FeedFilter {
    kinds = kinds == null ? Set.of() : Set.copyOf(kinds);
    statuses = statuses == null ? Set.of() : Set.copyOf(statuses);
  }

  public static final FeedFilter ALL = builder().build();

  public static Builder builder() {
    return new Builder();
  }

  /** The same filter with the kind criterion removed, used for per-kind counts. */
  public FeedFilter withoutKinds() {
    return new FeedFilter(
        Set.of(),
        statuses,
        startDate,
        endDate,
        profileId,
        vendorId,
        categoryId,
        entityId,
        paymentTypeId,
        recurring,
        tdsApplicable,
        includeArchived,
        search);
  }

  public static final class Builder {

    private Set<EntryKind> kinds;
    private Set<String> statuses;
    private LocalDate startDate;
    private LocalDate endDate;
    private UUID profileId;
    private UUID vendorId;
    private UUID categoryId;
    private UUID entityId;
    private UUID paymentTypeId;
    private Boolean recurring;
    private Boolean tdsApplicable;
    private boolean includeArchived;
    private String search;

    private Builder() {}

    public Builder kinds(Set<EntryKind> kinds) {
      this.kinds = kinds;
      return this;
    }

    public Builder statuses(Set<String> statuses) {
      this.statuses = statuses;
      return this;
    }

    public Builder dateRange(LocalDate startDate, LocalDate endDate) {
      this.startDate = startDate;
      this.endDate = endDate;
      return this;
    }

    public Builder profileId(UUID profileId) {
      this.profileId = profileId;
      return this;
    }

    public Builder vendorId(UUID vendorId) {
      this.vendorId = vendorId;
      return this;
    }

    public Builder categoryId(UUID categoryId) {
      this.categoryId = categoryId;
      return this;
    }

    public Builder entityId(UUID entityId) {
      this.entityId = entityId;
      return this;
    }

    public Builder paymentTypeId(UUID paymentTypeId) {
      this.paymentTypeId = paymentTypeId;
      return this;
    }

    public Builder recurring(Boolean recurring) {
      this.recurring = recurring;
      return this;
    }

    public Builder tdsApplicable(Boolean tdsApplicable) {
      this.tdsApplicable = tdsApplicable;
      return this;
    }

    public Builder includeArchived(boolean includeArchived) {
      this.includeArchived = includeArchived;
      return this;
    }

    public Builder search(String search) {
      this.search = search;
      return this;
    }

    public FeedFilter build() {
      return new FeedFilter(
          kinds,
          statuses,
          startDate,
          endDate,
          profileId,
          vendorId,
          categoryId,
          entityId,
          paymentTypeId,
          recurring,
          tdsApplicable,
          includeArchived,
          search);
    }
  }
}
