package io.graphlite.core;

import java.util.Objects;

/**
 * One entry of a branch's ancestor closure.
 * depth = 0 is the branch itself, 1 its parent, and so on.
 */
public record LineageEdge(String branchId, String ancestorBranchId, int depth) {
    public LineageEdge {
        Objects.requireNonNull(branchId, "branchId");
        Objects.requireNonNull(ancestorBranchId, "ancestorBranchId");
        if (depth < 0) throw new IllegalArgumentException("depth must be >= 0");
        if (depth == 0 && !branchId.equals(ancestorBranchId))
            throw new IllegalArgumentException("depth 0 is reserved for the self edge");
    }
}
