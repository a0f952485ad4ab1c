package io.graphlite.storage;

import io.graphlite.core.Branch;
import io.graphlite.core.LineageEdge;
import io.graphlite.core.ObjectVersion;
import io.graphlite.core.ProvenanceEdge;

import java.util.List;

/**
 * Full copy of the four record sets as of transaction {@code lastSeq}.
 * Branches are listed parents first so they can be re-applied in order.
 */
public record StoreSnapshot(
        long lastSeq,
        List<Branch> branches,
        List<LineageEdge> lineage,
        List<ObjectVersion> versions,
        List<ProvenanceEdge> provenance
) {
    public StoreSnapshot {
        branches = List.copyOf(branches);
        lineage = List.copyOf(lineage);
        versions = List.copyOf(versions);
        provenance = List.copyOf(provenance);
    }
}
