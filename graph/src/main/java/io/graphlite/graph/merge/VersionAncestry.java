package io.graphlite.graph.merge;

import io.graphlite.core.ObjectVersion;
import io.graphlite.core.ProvenanceEdge;
import io.graphlite.core.ProvenanceRole;
import io.graphlite.storage.StoreView;

import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Ancestry DAG of object versions.
 * <p>
 * Parents of a version are its predecessor ({@code supersedesId}) and, for
 * merged versions, the SOURCE head recorded in provenance. Ancestor sets
 * include the version itself and are memoized for the lifetime of one
 * instance, which is one merge call.
 */
final class VersionAncestry {
    private final StoreView view;
    private final Map<String, Set<String>> memo = new HashMap<>();

    VersionAncestry(StoreView view) {
        this.view = view;
    }

    Set<String> ancestors(String versionId) {
        Set<String> cached = memo.get(versionId);
        if (cached != null) return cached;

        Set<String> seen = new HashSet<>();
        Deque<String> todo = new ArrayDeque<>();
        todo.push(versionId);
        while (!todo.isEmpty()) {
            String id = todo.pop();
            if (!seen.add(id)) continue;
            view.version(id).map(ObjectVersion::supersedesId).ifPresent(todo::push);
            for (ProvenanceEdge e : view.provenanceOfChild(id)) {
                if (e.role() == ProvenanceRole.SOURCE) todo.push(e.parentVersionId());
            }
        }
        memo.put(versionId, seen);
        return seen;
    }

    boolean isAncestor(String ancestorId, String versionId) {
        return ancestors(versionId).contains(ancestorId);
    }

    /**
     * Nearest common ancestor of two versions. A proper descendant always has a
     * strictly larger ancestor set, so the largest set is a nearest one; ties
     * (criss-cross histories) go to the higher version number.
     */
    Optional<ObjectVersion> commonAncestor(String a, String b) {
        Set<String> ofB = ancestors(b);
        return ancestors(a).stream()
                .filter(ofB::contains)
                .map(view::version)
                .flatMap(Optional::stream)
                .max(Comparator.comparingInt((ObjectVersion v) -> ancestors(v.id()).size())
                        .thenComparingLong(ObjectVersion::version));
    }
}
