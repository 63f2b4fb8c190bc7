package io.b2mash.payables.feed;

import io.b2mash.payables.entry.EntryContext;
import io.b2mash.payables.entry.EntryKind;
import io.b2mash.payables.entry.NormalizedEntry;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Filters and sorts normalized entries for the unified feed. The sort is stable: entries that
 * compare equal keep their input order in both directions.
 */
@Component
public class FeedQuery {

  /** Composite status selecting everything that still needs someone's attention. */
  public static final String PENDING_ACTIONS = "pending_actions";

  private static final Set<String> INVOICE_PENDING_ACTIONS =
      Set.of("pending_approval", "unpaid", "partial", "overdue", "on_hold");
  private static final Set<String> REVIEW_PENDING_ACTIONS = Set.of("pending_approval");

  public List<NormalizedEntry> query(
      List<NormalizedEntry> entries, FeedFilter filter, FeedSort sort) {
    var result = new ArrayList<NormalizedEntry>();
    for (NormalizedEntry entry : entries) {
      if (matches(entry, filter)) {
        result.add(entry);
      }
    }
    result.sort(sort.comparator());
    return result;
  }

  public boolean matches(NormalizedEntry entry, FeedFilter filter) {
    EntryContext context = entry.context();
    if (!filter.includeArchived() && entry.archived()) {
      return false;
    }
    if (!filter.kinds().isEmpty() && !filter.kinds().contains(entry.kind())) {
      return false;
    }
    if (!filter.statuses().isEmpty() && !statusMatches(entry, filter.statuses())) {
      return false;
    }
    if (filter.startDate() != null && entry.date().isBefore(filter.startDate())) {
      return false;
    }
    if (filter.endDate() != null && entry.date().isAfter(filter.endDate())) {
      return false;
    }
    if (filter.profileId() != null && !filter.profileId().equals(context.profileId())) {
      return false;
    }
    if (filter.vendorId() != null && !filter.vendorId().equals(context.vendorId())) {
      return false;
    }
    if (filter.categoryId() != null && !filter.categoryId().equals(context.categoryId())) {
      return false;
    }
    if (filter.entityId() != null && !filter.entityId().equals(context.entityId())) {
      return false;
    }
    if (filter.paymentTypeId() != null
        && !filter.paymentTypeId().equals(entry.paymentMethodId())) {
      return false;
    }
    if (filter.recurring() != null && filter.recurring() != context.recurring()) {
      return false;
    }
    if (filter.tdsApplicable() != null && filter.tdsApplicable() != context.tdsApplicable()) {
      return false;
    }
    return searchMatches(entry, filter.search());
  }

  private static boolean statusMatches(NormalizedEntry entry, Set<String> statuses) {
    if (statuses.contains(entry.status())) {
      return true;
    }
    return statuses.contains(PENDING_ACTIONS)
        && pendingActionStatuses(entry.kind()).contains(entry.status());
  }

  static Set<String> pendingActionStatuses(EntryKind kind) {
    return switch (kind) {
      case INVOICE -> INVOICE_PENDING_ACTIONS;
      case PAYMENT, CREDIT_NOTE, ADVANCE_PAYMENT -> REVIEW_PENDING_ACTIONS;
    };
  }

  private static boolean searchMatches(NormalizedEntry entry, String search) {
    if (search == null || search.isBlank()) {
      return true;
    }
    String needle = search.trim().toLowerCase(Locale.ROOT);
    return Objects.toString(entry.referenceNumber(), "").toLowerCase(Locale.ROOT).contains(needle)
        || Objects.toString(entry.description(), "").toLowerCase(Locale.ROOT).contains(needle);
  }
}
