package io.graphlite.storage;

import io.graphlite.core.Branch;
import io.graphlite.core.LineageEdge;
import io.graphlite.core.ObjectVersion;
import io.graphlite.core.ProvenanceEdge;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only, non-blocking view over the committed record sets.
 * <p>
 * Reads never take the key locks. Every returned collection is an immutable
 * snapshot; concurrent commits publish new collections instead of mutating
 * the ones already handed out.
 */
public interface StoreView {

    Optional<ObjectVersion> version(String versionId);

    /** All versions of a canonical object on every branch, oldest first. */
    List<ObjectVersion> versionsOf(String canonicalId);

    /** Latest version (possibly a tombstone) written on exactly this branch. */
    Optional<ObjectVersion> headOnBranch(String branchId, String canonicalId);

    /** Highest version number of the canonical object, 0 if unknown. */
    long maxVersion(String canonicalId);

    /** Canonical ids with at least one version written on exactly this branch. */
    Set<String> canonicalIdsOnBranch(String branchId);

    /** Canonical ids ever created with this identity, on any branch. */
    Set<String> canonicalIdsByKey(String projectId, String type, String key);

    Optional<Branch> branch(String branchId);

    Optional<Branch> branchByName(String projectId, String name);

    Collection<Branch> branches();

    /** Ancestor closure of a branch ordered by depth (self first); empty if unknown. */
    List<LineageEdge> lineage(String branchId);

    List<ProvenanceEdge> provenanceOfChild(String childVersionId);

    List<ProvenanceEdge> provenanceOfParent(String parentVersionId);

    /** Sequence number of the last applied transaction, 0 when empty. */
    long lastSeq();
}
