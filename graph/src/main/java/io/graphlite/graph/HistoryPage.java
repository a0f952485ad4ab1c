package io.graphlite.graph;

import io.graphlite.core.ObjectVersion;

import java.util.List;

/**
 * One page of an object's history, newest first.
 *
 * @param nextCursor pass back to {@code history} for the next page; null on the last page
 */
public record HistoryPage(List<ObjectVersion> items, Long nextCursor) {
    public HistoryPage {
        items = List.copyOf(items);
    }
}
