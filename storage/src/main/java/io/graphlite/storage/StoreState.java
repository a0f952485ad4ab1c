package io.graphlite.storage;

import io.graphlite.core.Branch;
import io.graphlite.core.LineageEdge;
import io.graphlite.core.ObjectVersion;
import io.graphlite.core.ProvenanceEdge;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory indexes over the committed record sets.
 * <p>
 * Writers: only {@link #apply(TxRecord)} and {@link #load(StoreSnapshot)},
 * called by the store while it holds its commit monitor.
 * Readers: any thread, without locking. Indexes are concurrent maps whose
 * values are replaced (copy-on-write) rather than mutated in place.
 */
final class StoreState implements StoreView {
    private static final char SEP = '\u0000';

    private final Map<String, ObjectVersion> versionsById = new ConcurrentHashMap<>();
    private final Map<String, List<ObjectVersion>> versionsByCanonical = new ConcurrentHashMap<>();
    // branchId -> (canonicalId -> latest version on that branch)
    private final Map<String, Map<String, ObjectVersion>> headsByBranch = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> canonicalsByKey = new ConcurrentHashMap<>();
    private final Map<String, Branch> branches = new ConcurrentHashMap<>();
    private final Map<String, String> branchIdsByName = new ConcurrentHashMap<>();
    private final Map<String, List<LineageEdge>> lineage = new ConcurrentHashMap<>();
    private final Map<String, List<ProvenanceEdge>> provenanceByChild = new ConcurrentHashMap<>();
    private final Map<String, List<ProvenanceEdge>> provenanceByParent = new ConcurrentHashMap<>();
    private volatile long lastSeq = 0;

    void apply(TxRecord record) {
        if (record.seq() <= lastSeq) return; // already reflected (e.g. covered by the snapshot)
        for (Mutation m : record.mutations()) apply(m);
        lastSeq = record.seq();
    }

    void load(StoreSnapshot snapshot) {
        Map<String, List<LineageEdge>> closure = new ConcurrentHashMap<>();
        for (LineageEdge e : snapshot.lineage()) {
            closure.computeIfAbsent(e.branchId(), k -> new ArrayList<>()).add(e);
        }
        for (Branch b : snapshot.branches()) {
            apply(new Mutation.PutBranch(b, closure.getOrDefault(b.id(), List.of())));
        }
        snapshot.versions().stream()
                .sorted(Comparator.comparingLong(ObjectVersion::version))
                .forEach(v -> apply(new Mutation.PutVersion(v)));
        for (ProvenanceEdge e : snapshot.provenance()) apply(new Mutation.PutProvenance(e));
        lastSeq = snapshot.lastSeq();
    }

    StoreSnapshot snapshot() {
        List<Branch> orderedBranches = new ArrayList<>(branches.values());
        // parents before children: a branch's closure is larger than its parent's
        orderedBranches.sort(Comparator.comparingInt((Branch b) -> lineage(b.id()).size()).thenComparing(Branch::id));
        List<LineageEdge> edges = new ArrayList<>();
        for (Branch b : orderedBranches) edges.addAll(lineage(b.id()));
        List<ProvenanceEdge> prov = new ArrayList<>();
        provenanceByChild.values().forEach(prov::addAll);
        return new StoreSnapshot(lastSeq, orderedBranches, edges, new ArrayList<>(versionsById.values()), prov);
    }

    void apply(Mutation m) {
        if (m instanceof Mutation.PutVersion) {
            putVersion(((Mutation.PutVersion) m).version());
        } else if (m instanceof Mutation.PutBranch) {
            Mutation.PutBranch pb = (Mutation.PutBranch) m;
            putBranch(pb.branch(), pb.lineage());
        } else if (m instanceof Mutation.PutProvenance) {
            putProvenance(((Mutation.PutProvenance) m).edge());
        } else {
            throw new IllegalStateException("Unknown mutation type: " + m);
        }
    }

    private void putVersion(ObjectVersion v) {
        if (versionsById.putIfAbsent(v.id(), v) != null) return;

        versionsByCanonical.compute(v.canonicalId(), (k, existing) -> {
            List<ObjectVersion> next = existing == null ? new ArrayList<>(1) : new ArrayList<>(existing);
            next.add(v);
            next.sort(Comparator.comparingLong(ObjectVersion::version));
            return List.copyOf(next);
        });

        headsByBranch.computeIfAbsent(v.branchId(), k -> new ConcurrentHashMap<>())
                .merge(v.canonicalId(), v, (old, neu) -> neu.version() > old.version() ? neu : old);

        if (v.key() != null) {
            canonicalsByKey.computeIfAbsent(keyOf(v.projectId(), v.type(), v.key()), k -> ConcurrentHashMap.newKeySet())
                    .add(v.canonicalId());
        }
    }

    private void putBranch(Branch b, List<LineageEdge> closure) {
        if (branches.putIfAbsent(b.id(), b) != null) return;
        branchIdsByName.put(nameKey(b.projectId(), b.name()), b.id());
        List<LineageEdge> ordered = new ArrayList<>(closure);
        ordered.sort(Comparator.comparingInt(LineageEdge::depth));
        lineage.put(b.id(), List.copyOf(ordered));
    }

    private void putProvenance(ProvenanceEdge e) {
        List<ProvenanceEdge> existing = provenanceByChild.getOrDefault(e.childVersionId(), List.of());
        for (ProvenanceEdge x : existing) {
            if (x.parentVersionId().equals(e.parentVersionId()) && x.role() == e.role()) return;
        }
        provenanceByChild.merge(e.childVersionId(), List.of(e), StoreState::concat);
        provenanceByParent.merge(e.parentVersionId(), List.of(e), StoreState::concat);
    }

    private static <T> List<T> concat(List<T> a, List<T> b) {
        List<T> out = new ArrayList<>(a.size() + b.size());
        out.addAll(a);
        out.addAll(b);
        return List.copyOf(out);
    }

    private static String keyOf(String projectId, String type, String key) {
        return projectId + SEP + type + SEP + key;
    }

    private static String nameKey(String projectId, String name) {
        return projectId + SEP + name;
    }

    // ----------------- StoreView -----------------

    @Override
    public Optional<ObjectVersion> version(String versionId) {
        return versionId == null ? Optional.empty() : Optional.ofNullable(versionsById.get(versionId));
    }

    @Override
    public List<ObjectVersion> versionsOf(String canonicalId) {
        return versionsByCanonical.getOrDefault(canonicalId, List.of());
    }

    @Override
    public Optional<ObjectVersion> headOnBranch(String branchId, String canonicalId) {
        Map<String, ObjectVersion> heads = headsByBranch.get(branchId);
        return heads == null ? Optional.empty() : Optional.ofNullable(heads.get(canonicalId));
    }

    @Override
    public long maxVersion(String canonicalId) {
        List<ObjectVersion> all = versionsOf(canonicalId);
        return all.isEmpty() ? 0 : all.get(all.size() - 1).version();
    }

    @Override
    public Set<String> canonicalIdsOnBranch(String branchId) {
        Map<String, ObjectVersion> heads = headsByBranch.get(branchId);
        return heads == null ? Set.of() : Set.copyOf(heads.keySet());
    }

    @Override
    public Set<String> canonicalIdsByKey(String projectId, String type, String key) {
        Set<String> ids = canonicalsByKey.get(keyOf(projectId, type, key));
        return ids == null ? Set.of() : Set.copyOf(ids);
    }

    @Override
    public Optional<Branch> branch(String branchId) {
        return branchId == null ? Optional.empty() : Optional.ofNullable(branches.get(branchId));
    }

    @Override
    public Optional<Branch> branchByName(String projectId, String name) {
        return branch(branchIdsByName.get(nameKey(projectId, name)));
    }

    @Override
    public Collection<Branch> branches() {
        return List.copyOf(branches.values());
    }

    @Override
    public List<LineageEdge> lineage(String branchId) {
        return branchId == null ? List.of() : lineage.getOrDefault(branchId, List.of());
    }

    @Override
    public List<ProvenanceEdge> provenanceOfChild(String childVersionId) {
        return provenanceByChild.getOrDefault(childVersionId, List.of());
    }

    @Override
    public List<ProvenanceEdge> provenanceOfParent(String parentVersionId) {
        return provenanceByParent.getOrDefault(parentVersionId, List.of());
    }

    @Override
    public long lastSeq() { return lastSeq; }
}
