package io.graphlite.graph.merge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.graphlite.core.Branch;
import io.graphlite.core.MergeStatus;
import io.graphlite.core.ObjectVersion;
import io.graphlite.core.ProvenanceRole;
import io.graphlite.core.diff.ChangeSummary;
import io.graphlite.core.diff.DiffEngine;
import io.graphlite.graph.ObjectStore;
import io.graphlite.graph.lineage.BranchService;
import io.graphlite.graph.lineage.LineageResolver;
import io.graphlite.storage.RecordStore;
import io.graphlite.storage.StoreView;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * Three-way branch merge at the granularity of property paths.
 * <p>
 * For every canonical object visible on the source branch:
 *  - ADDED:        not visible on the target at all,
 *  - UNCHANGED:    same content, or the target already descends from the source head,
 *  - FAST_FORWARD: both sides changed since the base version, at disjoint paths,
 *  - CONFLICT:     overlapping paths, no base version, a target tombstone the
 *                  source head does not precede, or an added object whose
 *                  (type, key) is taken on the target.
 * <p>
 * The base version is the nearest common ancestor of the two heads in the
 * version DAG ({@link VersionAncestry}), so objects merged before do not
 * re-conflict. Conflicts are reported, never applied and never thrown.
 * <p>
 * Execute mode locks every candidate before classifying and commits all
 * merged versions and provenance edges as one record: either the whole
 * merge is visible or none of it.
 */
public final class MergeEngine {
    private static final Logger log = Logger.getLogger(MergeEngine.class.getName());

    private final RecordStore store;
    private final BranchService branches;
    private final LineageResolver lineage;
    private final ObjectStore objects;
    private final ProvenanceRecorder provenance;
    private final DiffEngine diff;

    public MergeEngine(RecordStore store, BranchService branches, LineageResolver lineage,
                       ObjectStore objects, ProvenanceRecorder provenance, DiffEngine diff) {
        this.store = Objects.requireNonNull(store, "store");
        this.branches = Objects.requireNonNull(branches, "branches");
        this.lineage = Objects.requireNonNull(lineage, "lineage");
        this.objects = Objects.requireNonNull(objects, "objects");
        this.provenance = Objects.requireNonNull(provenance, "provenance");
        this.diff = Objects.requireNonNull(diff, "diff");
    }

    /** @throws io.graphlite.core.error.NotFoundException unknown target or source branch */
    public MergeSummary merge(MergeRequest req) {
        Branch target = branches.getBranch(req.targetBranchId());
        Branch source = branches.getBranch(req.sourceBranchId());
        String baseBranchId = lineage.commonAncestor(target.id(), source.id()).orElse(null);

        if (target.id().equals(source.id())) {
            return new MergeSummary(target.id(), source.id(), target.id(), 0, 0, 0, 0, 0, false,
                    List.of(), false, List.of());
        }

        MergeSummary summary = req.mode() == MergeMode.EXECUTE
                ? store.inTransaction(tx -> {
                    Set<String> candidates = candidateIds(target, source);
                    tx.lockAll(identityKeys(target, candidates));
                    tx.lockAll(candidates);
                    Plan plan = classify(target, source, candidates, req.effectiveLimit());
                    return apply(plan, target.id(), source.id(), baseBranchId);
                })
                : toSummary(classify(target, source, candidateIds(target, source), req.effectiveLimit()),
                        target.id(), source.id(), baseBranchId, false, List.of());

        log.info(() -> "Merge " + source.name() + " -> " + target.name() + " (" + req.mode() + "): "
                + summary.addedCount() + " added, " + summary.fastForwardCount() + " fast-forward, "
                + summary.conflictCount() + " conflict, " + summary.unchangedCount() + " unchanged"
                + (summary.truncated() ? ", truncated at " + summary.objects().size() + "/" + summary.totalObjects() : ""));
        return summary;
    }

    // ----------------- classification -----------------

    private record Plan(List<Decision> decisions, int total) {}

    private record Decision(MergeObjectSummary summary, ObjectVersion sourceHead,
                            ObjectVersion targetHead, ObjectVersion base) {}

    /** Objects with a version on any branch in either ancestor set. */
    private Set<String> candidateIds(Branch target, Branch source) {
        Set<String> ids = new TreeSet<>(lineage.visibleCanonicalIds(source.id()));
        ids.addAll(lineage.visibleCanonicalIds(target.id()));
        return ids;
    }

    private Set<String> identityKeys(Branch target, Set<String> candidates) {
        Set<String> keys = new TreeSet<>();
        for (String c : candidates) {
            for (ObjectVersion v : store.view().versionsOf(c)) {
                if (v.key() != null) keys.add(ObjectStore.identityKey(target.projectId(), v.type(), v.key()));
            }
        }
        return keys;
    }

    private Plan classify(Branch target, Branch source, Set<String> candidates, int limit) {
        StoreView view = store.view();
        VersionAncestry ancestry = new VersionAncestry(view);
        List<Decision> decisions = new ArrayList<>();
        int total = 0;
        for (String canonicalId : candidates) {
            Optional<ObjectVersion> sourceHead = lineage.resolve(source.id(), canonicalId);
            if (sourceHead.isEmpty()) continue;
            total++;
            if (decisions.size() >= limit) continue;
            Decision d = classifyOne(target, sourceHead.get(), lineage.headOf(target.id(), canonicalId).orElse(null), ancestry);
            log.fine(() -> canonicalId + ": " + d.summary().status());
            decisions.add(d);
        }
        return new Plan(decisions, total);
    }

    private Decision classifyOne(Branch target, ObjectVersion src, ObjectVersion tgt, VersionAncestry ancestry) {
        if (tgt == null) {
            Optional<ObjectVersion> taken = lineage.resolveByKey(target.id(), src.type(), src.key())
                    .filter(v -> !v.canonicalId().equals(src.canonicalId()));
            if (taken.isPresent()) {
                return decision(MergeStatus.CONFLICT, src, taken.get(), null, List.of(), List.of(), List.of());
            }
            return decision(MergeStatus.ADDED, src, null, null, List.of(), List.of(), List.of());
        }

        if (tgt.deleted()) {
            MergeStatus status = ancestry.isAncestor(src.id(), tgt.id()) ? MergeStatus.UNCHANGED : MergeStatus.CONFLICT;
            return decision(status, src, tgt, null, List.of(), List.of(), List.of());
        }

        if (src.contentHash().equals(tgt.contentHash()) || ancestry.isAncestor(src.id(), tgt.id())) {
            return decision(MergeStatus.UNCHANGED, src, tgt, null, List.of(), List.of(), List.of());
        }

        Optional<ObjectVersion> base = ancestry.commonAncestor(src.id(), tgt.id());
        if (base.isEmpty()) {
            return decision(MergeStatus.CONFLICT, src, tgt, null, List.of(), List.of(), List.of());
        }

        List<String> sourcePaths = pathsSince(base.get(), src);
        List<String> targetPaths = pathsSince(base.get(), tgt);
        if (sourcePaths.isEmpty() && tgt.labels().containsAll(src.labels())) {
            // nothing on the source side to carry over
            return decision(MergeStatus.UNCHANGED, src, tgt, base.get(), sourcePaths, targetPaths, List.of());
        }
        List<String> conflicts = ChangeSummary.overlappingPaths(sourcePaths, targetPaths);
        MergeStatus status = conflicts.isEmpty() ? MergeStatus.FAST_FORWARD : MergeStatus.CONFLICT;
        return decision(status, src, tgt, base.get(), sourcePaths, targetPaths, conflicts);
    }

    /** Changed paths of {@code head} relative to {@code base}; the stored summary when it is the direct successor. */
    private List<String> pathsSince(ObjectVersion base, ObjectVersion head) {
        if (head.id().equals(base.id())) return List.of();
        if (base.id().equals(head.supersedesId())) return head.changeSummary().paths();
        return diff.changedPaths(base.properties(), head.properties());
    }

    private static Decision decision(MergeStatus status, ObjectVersion src, ObjectVersion tgt, ObjectVersion base,
                                     List<String> sourcePaths, List<String> targetPaths, List<String> conflicts) {
        MergeObjectSummary s = new MergeObjectSummary(src.canonicalId(), src.type(), src.key(), status,
                src.id(), tgt == null ? null : tgt.id(), base == null ? null : base.id(),
                sourcePaths, targetPaths, conflicts);
        return new Decision(s, src, tgt, base);
    }

    // ----------------- apply -----------------

    private MergeSummary apply(Plan plan, String targetBranchId, String sourceBranchId, String baseBranchId) {
        List<MergeSummary.AppliedObject> applied = new ArrayList<>();
        for (Decision d : plan.decisions()) {
            MergeStatus status = d.summary().status();
            if (!status.applicable()) continue;

            ObjectVersion merged = status == MergeStatus.ADDED
                    ? applyAdded(targetBranchId, d)
                    : applyFastForward(targetBranchId, d);
            if (merged != null) applied.add(new MergeSummary.AppliedObject(merged.canonicalId(), merged.id()));
        }
        return toSummary(plan, targetBranchId, sourceBranchId, baseBranchId, true, applied);
    }

    private ObjectVersion applyAdded(String targetBranchId, Decision d) {
        ObjectVersion src = d.sourceHead();
        ObjectVersion merged = objects.writeMerged(targetBranchId, src, src.properties(), src.labels());
        provenance.record(merged.id(), src.id(), ProvenanceRole.SOURCE);
        return merged;
    }

    /** Source-side changes laid over the target head; null when that changes nothing. */
    private ObjectVersion applyFastForward(String targetBranchId, Decision d) {
        ObjectVersion src = d.sourceHead();
        ObjectVersion tgt = d.targetHead();
        ObjectNode merged = tgt.properties();
        ObjectNode sourceProps = src.properties();

        List<String> paths = new ArrayList<>(d.summary().sourceChangedPaths());
        paths.sort(TreePaths.POINTER_ORDER);
        List<String> removals = new ArrayList<>();
        for (String p : paths) {
            JsonNode value = sourceProps.at(p);
            if (value.isMissingNode()) removals.add(p);
            else TreePaths.set(merged, p, value.deepCopy());
        }
        // highest array index first, so earlier removals don't shift later ones
        for (int i = removals.size() - 1; i >= 0; i--) TreePaths.remove(merged, removals.get(i));

        TreeSet<String> labels = new TreeSet<>(tgt.labels());
        labels.addAll(src.labels());
        if (diff.contentHash(merged).equals(tgt.contentHash()) && List.copyOf(labels).equals(tgt.labels())) {
            return null;
        }

        ObjectVersion written = objects.writeMerged(targetBranchId, tgt, merged, List.copyOf(labels));
        provenance.record(written.id(), tgt.id(), ProvenanceRole.TARGET);
        provenance.record(written.id(), src.id(), ProvenanceRole.SOURCE);
        if (d.base() != null) provenance.record(written.id(), d.base().id(), ProvenanceRole.BASE);
        return written;
    }

    private static MergeSummary toSummary(Plan plan, String targetBranchId, String sourceBranchId,
                                          String baseBranchId, boolean applied,
                                          List<MergeSummary.AppliedObject> appliedObjects) {
        Map<MergeStatus, Integer> counts = new EnumMap<>(MergeStatus.class);
        List<MergeObjectSummary> objs = new ArrayList<>(plan.decisions().size());
        for (Decision d : plan.decisions()) {
            counts.merge(d.summary().status(), 1, Integer::sum);
            objs.add(d.summary());
        }
        return new MergeSummary(targetBranchId, sourceBranchId, baseBranchId,
                counts.getOrDefault(MergeStatus.ADDED, 0),
                counts.getOrDefault(MergeStatus.FAST_FORWARD, 0),
                counts.getOrDefault(MergeStatus.CONFLICT, 0),
                counts.getOrDefault(MergeStatus.UNCHANGED, 0),
                plan.total(), plan.total() > objs.size(), objs, applied, appliedObjects);
    }
}
