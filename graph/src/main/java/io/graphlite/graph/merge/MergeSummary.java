package io.graphlite.graph.merge;

import java.util.List;

/**
 * Result of a merge call. Counts cover the enumerated objects;
 * {@code totalObjects} counts every candidate and {@code truncated} tells
 * whether some were left out by the limit.
 */
public record MergeSummary(
        String targetBranchId,
        String sourceBranchId,
        String baseBranchId,
        int addedCount,
        int fastForwardCount,
        int conflictCount,
        int unchangedCount,
        int totalObjects,
        boolean truncated,
        List<MergeObjectSummary> objects,
        boolean applied,
        List<AppliedObject> appliedObjects
) {
    public MergeSummary {
        objects = List.copyOf(objects);
        appliedObjects = List.copyOf(appliedObjects);
    }

    /** New version written on the target by an executed merge. */
    public record AppliedObject(String canonicalId, String mergedVersionId) {}

    public boolean hasConflicts() { return conflictCount > 0; }
}
