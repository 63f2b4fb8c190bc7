package io.b2mash.payables.feed;

import io.b2mash.payables.entry.EntryIssue;
import io.b2mash.payables.entry.EntryKind;
import io.b2mash.payables.entry.NormalizedEntry;
import java.util.List;
import java.util.Map;

/**
 * One page of the filtered feed.
 *
 * @param countsByKind matches per entry kind over the whole filtered set, ignoring the kind
 *     criterion and pagination
 */
public record FeedPage(
    List<NormalizedEntry> content,
    int page,
    int size,
    long totalElements,
    int totalPages,
    Map<EntryKind, Long> countsByKind,
    List<EntryIssue> issues) {}
