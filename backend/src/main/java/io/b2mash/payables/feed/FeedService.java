package io.b2mash.payables.feed;

import io.b2mash.payables.config.FeedProperties;
import io.b2mash.payables.entry.EntryKind;
import io.b2mash.payables.entry.EntryNormalizer;
import io.b2mash.payables.entry.NormalizedEntry;
import io.b2mash.payables.entry.SourceRecordLoader;
import io.b2mash.payables.exception.InvalidInputException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class FeedService {

  private static final Logger log = LoggerFactory.getLogger(FeedService.class);

  private final SourceRecordLoader recordLoader;
  private final EntryNormalizer normalizer;
  private final FeedQuery feedQuery;
  private final FeedProperties feedProperties;

  public FeedService(
      SourceRecordLoader recordLoader,
      EntryNormalizer normalizer,
      FeedQuery feedQuery,
      FeedProperties feedProperties) {
    this.recordLoader = recordLoader;
    this.normalizer = normalizer;
    this.feedQuery = feedQuery;
    this.feedProperties = feedProperties;
  }

  /**
   * Filters, sorts and pages every document. A null size falls back to the configured default; a
   * size above the configured maximum is clamped.
   */
  @Transactional(readOnly = true)
  public FeedPage getEntries(FeedFilter filter, FeedSort sort, int page, Integer size) {
    if (page < 0) {
      throw new InvalidInputException("Invalid page", "Page index must not be negative");
    }
    int pageSize = resolvePageSize(size);

    var normalized = normalizer.normalize(recordLoader.all());
    var matched = feedQuery.query(normalized.entries(), filter, sort);
    var counts = countByKind(normalized.entries(), filter.withoutKinds());

    int from = (int) Math.min((long) page * pageSize, matched.size());
    int to = Math.min(from + pageSize, matched.size());
    int totalPages = (matched.size() + pageSize - 1) / pageSize;

    log.debug(
        "Feed query matched {} of {} entries, page {} of {}",
        matched.size(),
        normalized.entries().size(),
        page,
        totalPages);
    return new FeedPage(
        List.copyOf(matched.subList(from, to)),
        page,
        pageSize,
        matched.size(),
        totalPages,
        counts,
        normalized.issues());
  }

  private int resolvePageSize(Integer size) {
    if (size == null) {
      return feedProperties.defaultPageSize();
    }
    if (size < 1) {
      throw new InvalidInputException("Invalid page size", "Page size must be at least 1");
    }
    return Math.min(size, feedProperties.maxPageSize());
  }

  private Map<EntryKind, Long> countByKind(List<NormalizedEntry> entries, FeedFilter filter) {
    Map<EntryKind, Long> counts = new EnumMap<>(EntryKind.class);
    for (EntryKind kind : EntryKind.values()) {
      counts.put(kind, 0L);
    }
    for (NormalizedEntry entry : entries) {
      if (feedQuery.matches(entry, filter)) {
        counts.merge(entry.kind(), 1L, Long::sum);
      }
    }
    return counts;
  }
}
