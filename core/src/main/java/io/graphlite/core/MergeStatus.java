package io.graphlite.core;

/**
 * Per-object outcome of a branch merge.
 * <p>
 * Interpretation for merging SOURCE into TARGET:
 *  - ADDED:        object is visible on source only.
 *  - UNCHANGED:    both sides hold the same content, or target already
 *                  descends from the source head.
 *  - FAST_FORWARD: both sides diverged but touched disjoint property paths.
 *  - CONFLICT:     both sides touched overlapping paths, or no common base.
 * <p>
 * CONFLICT is an ordinary result, not an error.
 */
public enum MergeStatus {
    ADDED, UNCHANGED, FAST_FORWARD, CONFLICT;

    /** True for outcomes that an execute-mode merge writes to the target. */
    public boolean applicable() {
        return this == ADDED || this == FAST_FORWARD;
    }
}
