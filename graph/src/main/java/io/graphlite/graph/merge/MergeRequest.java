package io.graphlite.graph.merge;

import java.util.Objects;

/**
 * Merge {@code sourceBranchId} into {@code targetBranchId}.
 *
 * @param limit max objects enumerated (and applied) by one call; null for {@link #DEFAULT_LIMIT},
 *              larger values are capped at {@link #MAX_LIMIT}
 */
public record MergeRequest(String targetBranchId, String sourceBranchId, MergeMode mode, Integer limit) {
    public static final int DEFAULT_LIMIT = 500;
    public static final int MAX_LIMIT = 5000;

    public MergeRequest {
        Objects.requireNonNull(targetBranchId, "targetBranchId");
        Objects.requireNonNull(sourceBranchId, "sourceBranchId");
        if (mode == null) mode = MergeMode.DRY_RUN;
        if (limit != null && limit <= 0) throw new IllegalArgumentException("limit must be > 0");
    }

    public static MergeRequest dryRun(String targetBranchId, String sourceBranchId) {
        return new MergeRequest(targetBranchId, sourceBranchId, MergeMode.DRY_RUN, null);
    }

    public static MergeRequest execute(String targetBranchId, String sourceBranchId) {
        return new MergeRequest(targetBranchId, sourceBranchId, MergeMode.EXECUTE, null);
    }

    public int effectiveLimit() {
        return limit == null ? DEFAULT_LIMIT : Math.min(limit, MAX_LIMIT);
    }
}
