package io.graphlite.graph.merge;

import io.graphlite.core.ProvenanceEdge;
import io.graphlite.core.ProvenanceRole;
import io.graphlite.storage.Mutation;
import io.graphlite.storage.RecordStore;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Append-only audit trail of merged versions: which heads contributed to
 * each version written by a merge, and in which role.
 */
public final class ProvenanceRecorder {
    private final RecordStore store;
    private final Clock clock;

    public ProvenanceRecorder(RecordStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** Stage one edge in the caller's transaction. Repeating an edge is a no-op. */
    public ProvenanceEdge record(String childVersionId, String parentVersionId, ProvenanceRole role) {
        ProvenanceEdge edge = new ProvenanceEdge(childVersionId, parentVersionId, role, clock.instant());
        return store.inTransaction(tx -> {
            boolean exists = tx.view().provenanceOfChild(childVersionId).stream()
                    .anyMatch(e -> e.parentVersionId().equals(parentVersionId) && e.role() == role);
            if (!exists) tx.stage(new Mutation.PutProvenance(edge));
            return edge;
        });
    }

    /** Versions that contributed to a merged version. */
    public List<ProvenanceEdge> parentsOf(String childVersionId) {
        return store.view().provenanceOfChild(childVersionId);
    }

    /** Merged versions a version contributed to. */
    public List<ProvenanceEdge> childrenOf(String parentVersionId) {
        return store.view().provenanceOfParent(parentVersionId);
    }
}
