package io.b2mash.payables.feed;

import io.b2mash.payables.entry.NormalizedEntry;
import io.b2mash.payables.exception.InvalidInputException;
import java.util.Arrays;
import java.util.Comparator;

public enum FeedSortKey {
  DATE("date", Comparator.comparing(NormalizedEntry::date)),
  AMOUNT("amount", Comparator.comparing(NormalizedEntry::grossAmount)),
  STATUS("status", Comparator.comparing(NormalizedEntry::status)),
  REMAINING_BALANCE("remaining_balance", Comparator.comparing(NormalizedEntry::remainingBalance));

  private final String value;
  private final Comparator<NormalizedEntry> comparator;

  FeedSortKey(String value, Comparator<NormalizedEntry> comparator) {
    this.value = value;
    this.comparator = comparator;
  }

  public String value() {
    return value;
  }

  Comparator<NormalizedEntry> comparator() {
    return comparator;
  }

  public static FeedSortKey fromValue(String value) {
    return Arrays.stream(values())
        .filter(key -> key.value.equalsIgnoreCase(value) || key.name().equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(
            () ->
                new InvalidInputException(
                    "Invalid sort key",
                    "Unknown sort key '"
                        + value
                        + "'; use date, amount, status or remaining_balance"));
  }
}
