package io.b2mash.payables.ledger;

import io.b2mash.payables.entry.EntryKind;
import java.time.LocalDate;
import java.util.Locale;

/**
 * Row filter applied to an already folded ledger, so the running balance of a visible row still
 * reflects every earlier row. All criteria are optional.
 */
public record LedgerFilter(LocalDate startDate, LocalDate endDate, EntryKind kind, String search) {

  public static final LedgerFilter NONE = new LedgerFilter(null, null, null, null);

  public boolean matches(LedgerEntry row) {
    var entry = row.entry();
    if (startDate != null && entry.date().isBefore(startDate)) {
      return false;
    }
    if (endDate != null && entry.date().isAfter(endDate)) {
      return false;
    }
    if (kind != null && entry.kind() != kind) {
      return false;
    }
    if (search != null && !search.isBlank()) {
      String needle = search.trim().toLowerCase(Locale.ROOT);
      return contains(entry.referenceNumber(), needle) || contains(entry.description(), needle);
    }
    return true;
  }

  private static boolean contains(String haystack, String needle) {
    return haystack != null && haystack.toLowerCase(Locale.ROOT).contains(needle);
  }
}
