package io.graphlite.graph;

import java.util.List;

/**
 * Published after a new object version is committed.
 * Consumers (re-embedding, notifications) react to {@code changedPaths}.
 */
public record ObjectChangedEvent(
        String objectId,
        String canonicalId,
        String branchId,
        String type,
        List<String> changedPaths,
        ChangeKind kind
) {
    public ObjectChangedEvent {
        changedPaths = List.copyOf(changedPaths);
    }
}
