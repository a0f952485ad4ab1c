package io.graphlite.graph.merge;

import io.graphlite.core.MergeStatus;

import java.util.List;

/**
 * Classification of one canonical object.
 * Change paths are JSON Pointers relative to {@code baseVersionId}; they are
 * empty when no base version was needed or none could be found.
 */
public record MergeObjectSummary(
        String canonicalId,
        String type,
        String key,
        MergeStatus status,
        String sourceHeadId,
        String targetHeadId,
        String baseVersionId,
        List<String> sourceChangedPaths,
        List<String> targetChangedPaths,
        List<String> conflictPaths
) {
    public MergeObjectSummary {
        sourceChangedPaths = List.copyOf(sourceChangedPaths);
        targetChangedPaths = List.copyOf(targetChangedPaths);
        conflictPaths = List.copyOf(conflictPaths);
    }
}
