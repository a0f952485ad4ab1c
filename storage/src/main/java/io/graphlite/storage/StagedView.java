package io.graphlite.storage;

import io.graphlite.core.Branch;
import io.graphlite.core.LineageEdge;
import io.graphlite.core.ObjectVersion;
import io.graphlite.core.ProvenanceEdge;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Read-your-writes view of an open transaction: staged rows layered over the
 * committed state. Staged versions are always newer than committed ones,
 * because they were written under the key lock after reading the committed
 * head.
 */
final class StagedView implements StoreView {
    private final StoreView committed;
    private final StoreState pending;

    StagedView(StoreView committed, StoreState pending) {
        this.committed = committed;
        this.pending = pending;
    }

    @Override
    public Optional<ObjectVersion> version(String versionId) {
        return pending.version(versionId).or(() -> committed.version(versionId));
    }

    @Override
    public List<ObjectVersion> versionsOf(String canonicalId) {
        List<ObjectVersion> staged = pending.versionsOf(canonicalId);
        if (staged.isEmpty()) return committed.versionsOf(canonicalId);
        List<ObjectVersion> all = new ArrayList<>(committed.versionsOf(canonicalId));
        all.addAll(staged);
        all.sort(Comparator.comparingLong(ObjectVersion::version));
        return List.copyOf(all);
    }

    @Override
    public Optional<ObjectVersion> headOnBranch(String branchId, String canonicalId) {
        return pending.headOnBranch(branchId, canonicalId).or(() -> committed.headOnBranch(branchId, canonicalId));
    }

    @Override
    public long maxVersion(String canonicalId) {
        return Math.max(pending.maxVersion(canonicalId), committed.maxVersion(canonicalId));
    }

    @Override
    public Set<String> canonicalIdsOnBranch(String branchId) {
        return union(committed.canonicalIdsOnBranch(branchId), pending.canonicalIdsOnBranch(branchId));
    }

    @Override
    public Set<String> canonicalIdsByKey(String projectId, String type, String key) {
        return union(committed.canonicalIdsByKey(projectId, type, key), pending.canonicalIdsByKey(projectId, type, key));
    }

    @Override
    public Optional<Branch> branch(String branchId) {
        return pending.branch(branchId).or(() -> committed.branch(branchId));
    }

    @Override
    public Optional<Branch> branchByName(String projectId, String name) {
        return pending.branchByName(projectId, name).or(() -> committed.branchByName(projectId, name));
    }

    @Override
    public Collection<Branch> branches() {
        List<Branch> all = new ArrayList<>(committed.branches());
        all.addAll(pending.branches());
        return all;
    }

    @Override
    public List<LineageEdge> lineage(String branchId) {
        List<LineageEdge> staged = pending.lineage(branchId);
        return staged.isEmpty() ? committed.lineage(branchId) : staged;
    }

    @Override
    public List<ProvenanceEdge> provenanceOfChild(String childVersionId) {
        return concat(committed.provenanceOfChild(childVersionId), pending.provenanceOfChild(childVersionId));
    }

    @Override
    public List<ProvenanceEdge> provenanceOfParent(String parentVersionId) {
        return concat(committed.provenanceOfParent(parentVersionId), pending.provenanceOfParent(parentVersionId));
    }

    @Override
    public long lastSeq() {
        return committed.lastSeq();
    }

    private static Set<String> union(Set<String> a, Set<String> b) {
        if (b.isEmpty()) return a;
        Set<String> out = new HashSet<>(a);
        out.addAll(b);
        return out;
    }

    private static <T> List<T> concat(List<T> a, List<T> b) {
        if (b.isEmpty()) return a;
        List<T> out = new ArrayList<>(a);
        out.addAll(b);
        return out;
    }
}
