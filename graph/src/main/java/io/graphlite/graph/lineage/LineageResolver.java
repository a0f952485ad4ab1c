package io.graphlite.graph.lineage;

import io.graphlite.core.LineageEdge;
import io.graphlite.core.ObjectVersion;
import io.graphlite.storage.RecordStore;
import io.graphlite.storage.StoreView;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Lazy fallback resolution of objects through branch ancestry.
 * <p>
 * A branch sees its own versions first, then its parent's, and so on. The
 * nearest branch holding any version of an object decides what is visible:
 * its head if live, nothing if its head is a tombstone. Resolution never
 * blocks and never throws; unknown branches or objects resolve to empty.
 * <p>
 * Inside a transaction the resolver sees the rows staged so far.
 */
public final class LineageResolver {
    private final RecordStore store;

    public LineageResolver(RecordStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    /** Ancestor branch ids, nearest first (the branch itself at index 0). */
    public List<String> ancestorIds(String branchId) {
        List<LineageEdge> closure = store.view().lineage(branchId);
        List<String> out = new ArrayList<>(closure.size());
        for (LineageEdge e : closure) out.add(e.ancestorBranchId());
        return out;
    }

    /** The deciding head for an object on a branch, tombstones included. */
    public Optional<ObjectVersion> headOf(String branchId, String canonicalId) {
        StoreView view = store.view();
        for (LineageEdge e : view.lineage(branchId)) {
            Optional<ObjectVersion> head = view.headOnBranch(e.ancestorBranchId(), canonicalId);
            if (head.isPresent()) return head;
        }
        return Optional.empty();
    }

    /** Live version of an object visible on a branch. */
    public Optional<ObjectVersion> resolve(String branchId, String canonicalId) {
        return headOf(branchId, canonicalId).filter(v -> !v.deleted());
    }

    /** Live object with this (type, key) visible on a branch. */
    public Optional<ObjectVersion> resolveByKey(String branchId, String type, String key) {
        if (key == null) return Optional.empty();
        StoreView view = store.view();
        return view.branch(branchId).flatMap(b ->
                view.canonicalIdsByKey(b.projectId(), type, key).stream()
                        .map(c -> resolve(branchId, c))
                        .flatMap(Optional::stream)
                        .max(Comparator.comparingLong(ObjectVersion::version)));
    }

    /** Canonical ids with a version on the branch or any of its ancestors. */
    public Set<String> visibleCanonicalIds(String branchId) {
        StoreView view = store.view();
        Set<String> out = new HashSet<>();
        for (LineageEdge e : view.lineage(branchId)) out.addAll(view.canonicalIdsOnBranch(e.ancestorBranchId()));
        return out;
    }

    /**
     * Nearest branch that is an ancestor of both. Among shared ancestors the
     * one with the larger ancestor set wins, then the smaller branch id.
     */
    public Optional<String> commonAncestor(String branchA, String branchB) {
        StoreView view = store.view();
        Set<String> ofB = new HashSet<>(ancestorIds(branchB));
        return ancestorIds(branchA).stream()
                .filter(ofB::contains)
                .min(Comparator.comparingInt((String id) -> -view.lineage(id).size())
                        .thenComparing(Comparator.naturalOrder()));
    }
}
