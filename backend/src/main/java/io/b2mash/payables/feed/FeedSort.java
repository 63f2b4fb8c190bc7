package io.b2mash.payables.feed;

import io.b2mash.payables.entry.NormalizedEntry;
import java.util.Comparator;
import org.springframework.data.domain.Sort;

/** Single-key sort over the feed. */
public record FeedSort(FeedSortKey key, Sort.Direction direction) {

  public static final FeedSort DEFAULT = new FeedSort(FeedSortKey.DATE, Sort.Direction.DESC);

  Comparator<NormalizedEntry> comparator() {
    return direction.isDescending() ? key.comparator().reversed() : key.comparator();
  }
}
