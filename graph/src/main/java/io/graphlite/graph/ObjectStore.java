package io.graphlite.graph;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.graphlite.core.Branch;
import io.graphlite.core.ObjectVersion;
import io.graphlite.core.diff.ChangeSummary;
import io.graphlite.core.diff.DiffEngine;
import io.graphlite.core.error.ConflictException;
import io.graphlite.core.error.NotFoundException;
import io.graphlite.core.error.ValidationException;
import io.graphlite.graph.lineage.LineageResolver;
import io.graphlite.storage.Mutation;
import io.graphlite.storage.RecordStore;
import io.graphlite.storage.StoreView;
import io.graphlite.storage.Transaction;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Append-only object store.
 * <p>
 * Every mutation inserts a new immutable {@link ObjectVersion}:
 *  - write:   version 1 of a new canonical object,
 *  - patch:   version N+1 with the delta applied,
 *  - delete:  a tombstone version N+1 carrying the last content,
 *  - restore: version N+1 bringing the tombstoned content back,
 *  - merge:   version N+1 produced by the merge engine.
 * <p>
 * Version numbers are monotonic per canonical object across all branches.
 * Each version stores its content hash and its change summary against the
 * predecessor, so merges never have to re-diff linear histories.
 * <p>
 * Concurrency: mutations lock the canonical id (creates lock the identity
 * key) for the rest of the transaction and re-read the head after locking.
 * A caller that patched from a stale head gets a {@link ConflictException}.
 */
public final class ObjectStore {
    private static final Logger log = Logger.getLogger(ObjectStore.class.getName());

    public static final int MAX_HISTORY_PAGE = 1000;

    private final RecordStore store;
    private final LineageResolver lineage;
    private final DiffEngine diff;
    private final SchemaValidator validator;
    private final Clock clock;
    private final Supplier<String> ids;
    private final List<ObjectChangeListener> listeners = new CopyOnWriteArrayList<>();

    public ObjectStore(RecordStore store, LineageResolver lineage, DiffEngine diff,
                       SchemaValidator validator, Clock clock, Supplier<String> ids) {
        this.store = Objects.requireNonNull(store, "store");
        this.lineage = Objects.requireNonNull(lineage, "lineage");
        this.diff = Objects.requireNonNull(diff, "diff");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.ids = Objects.requireNonNull(ids, "ids");
    }

    public void addListener(ObjectChangeListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    // ----------------- writes -----------------

    /**
     * @throws NotFoundException   unknown branch
     * @throws ConflictException   a live object with the same (type, key) is visible on the branch
     * @throws ValidationException the schema validator rejected the properties
     */
    public ObjectVersion write(WriteRequest req) {
        return store.inTransaction(tx -> {
            Branch branch = tx.view().branch(req.branchId()).orElseThrow(() -> NotFoundException.branch(req.branchId()));
            if (!branch.projectId().equals(req.projectId())) {
                throw new IllegalArgumentException("branch " + branch.id() + " belongs to project " + branch.projectId());
            }
            if (req.key() != null) {
                tx.lock(identityKey(req.projectId(), req.type(), req.key()));
                lineage.resolveByKey(branch.id(), req.type(), req.key()).ifPresent(existing -> {
                    throw new ConflictException("object_key_exists: " + req.type() + "/" + req.key()
                            + " is " + existing.canonicalId());
                });
            }

            ObjectNode props = req.properties();
            validate(req.type(), props);

            String canonicalId = ids.get();
            tx.lock(canonicalId);
            ChangeSummary summary = diff.diff(null, props);
            ObjectVersion created = new ObjectVersion(ids.get(), canonicalId, branch.id(),
                    req.organizationId() != null ? req.organizationId() : branch.organizationId(),
                    req.projectId(), req.type(), req.key(), props, req.labels(), 1, null,
                    diff.contentHash(props), summary, clock.instant(), null);
            return append(tx, created, ChangeKind.CREATED, summary.paths());
        });
    }

    /** Patch on the branch the version lives on. */
    public ObjectVersion patch(String objectId, PatchRequest req) {
        ObjectVersion v = get(objectId);
        return patch(v.branchId(), objectId, req);
    }

    /**
     * Patch the object as seen on {@code branchId}; the new version is written
     * on that branch even if {@code objectId} lives on an ancestor.
     *
     * @throws NotFoundException unknown branch or object, or the object is deleted
     * @throws ConflictException {@code objectId} is no longer the head visible on the branch
     */
    public ObjectVersion patch(String branchId, String objectId, PatchRequest req) {
        Objects.requireNonNull(req, "req");
        return store.inTransaction(tx -> {
            StoreView view = tx.view();
            ObjectVersion target = view.version(objectId).orElseThrow(() -> NotFoundException.object(objectId));
            view.branch(branchId).orElseThrow(() -> NotFoundException.branch(branchId));
            tx.lock(target.canonicalId());

            ObjectVersion head = lineage.headOf(branchId, target.canonicalId())
                    .orElseThrow(() -> NotFoundException.object(objectId));
            if (head.deleted()) throw NotFoundException.object(objectId);
            requireHead(head, objectId);

            ObjectNode props = head.properties();
            for (Iterator<Map.Entry<String, JsonNode>> it = req.properties().fields(); it.hasNext(); ) {
                Map.Entry<String, JsonNode> f = it.next();
                if (f.getValue().isNull()) props.remove(f.getKey());
                else props.set(f.getKey(), f.getValue().deepCopy());
            }
            List<String> labels = req.replaceLabels() ? sortedLabels(req.labels()) : union(head.labels(), req.labels());

            ChangeSummary summary = diff.diff(head.properties(), props);
            if (summary.isNoOp() && labels.equals(head.labels())) {
                log.fine(() -> "No-op patch of " + objectId);
                return head;
            }
            validate(head.type(), props);

            String hash = diff.contentHash(props);
            ObjectVersion next = successor(view, head, branchId, props, labels, hash, summary, null);
            return append(tx, next, ChangeKind.UPDATED, summary.paths());
        });
    }

    /** Tombstone the object on the branch the version lives on. */
    public ObjectVersion softDelete(String objectId) {
        ObjectVersion v = get(objectId);
        return softDelete(v.branchId(), objectId);
    }

    /**
     * Insert a tombstone on {@code branchId}. The tombstone keeps the last
     * content so that it can be restored and hides ancestor versions.
     *
     * @throws ConflictException already deleted, or {@code objectId} is not the visible head
     */
    public ObjectVersion softDelete(String branchId, String objectId) {
        return store.inTransaction(tx -> {
            StoreView view = tx.view();
            ObjectVersion target = view.version(objectId).orElseThrow(() -> NotFoundException.object(objectId));
            view.branch(branchId).orElseThrow(() -> NotFoundException.branch(branchId));
            tx.lock(target.canonicalId());

            ObjectVersion head = lineage.headOf(branchId, target.canonicalId())
                    .orElseThrow(() -> NotFoundException.object(objectId));
            if (head.deleted()) throw new ConflictException("object_already_deleted: " + objectId);
            requireHead(head, objectId);

            ObjectNode props = head.properties();
            ObjectVersion tombstone = successor(view, head, branchId, props, head.labels(),
                    head.contentHash(), ChangeSummary.empty(), clock.instant());
            return append(tx, tombstone, ChangeKind.DELETED, diff.changedPaths(null, props));
        });
    }

    /**
     * Bring back the content hidden by the tombstone that is the current head
     * on the version's branch.
     *
     * @throws ConflictException the object is not deleted, or its (type, key) was reused meanwhile
     */
    public ObjectVersion restore(String objectId) {
        return store.inTransaction(tx -> {
            StoreView view = tx.view();
            ObjectVersion target = view.version(objectId).orElseThrow(() -> NotFoundException.object(objectId));
            String branchId = target.branchId();
            if (target.key() != null) tx.lock(identityKey(target.projectId(), target.type(), target.key()));
            tx.lock(target.canonicalId());

            ObjectVersion head = lineage.headOf(branchId, target.canonicalId())
                    .orElseThrow(() -> NotFoundException.object(objectId));
            if (!head.deleted()) throw new ConflictException("object_not_deleted: " + objectId);
            if (head.key() != null) {
                lineage.resolveByKey(branchId, head.type(), head.key()).ifPresent(other -> {
                    throw new ConflictException("object_key_exists: " + head.type() + "/" + head.key()
                            + " is " + other.canonicalId());
                });
            }

            ObjectNode props = head.properties();
            validate(head.type(), props);
            ObjectVersion restored = successor(view, head, branchId, props, head.labels(),
                    head.contentHash(), ChangeSummary.empty(), null);
            return append(tx, restored, ChangeKind.RESTORED, diff.changedPaths(null, props));
        });
    }

    /**
     * Write a merged version on the target branch. Must run inside the
     * merge transaction, with the canonical id already locked.
     *
     * @param predecessor the target head for a fast-forward, the source head for an added object
     */
    public ObjectVersion writeMerged(String targetBranchId, ObjectVersion predecessor,
                                     ObjectNode properties, List<String> labels) {
        return store.inTransaction(tx -> {
            validate(predecessor.type(), properties);
            ChangeSummary summary = diff.diff(predecessor.properties(), properties);
            ObjectVersion merged = successor(tx.view(), predecessor, targetBranchId, properties,
                    sortedLabels(labels), diff.contentHash(properties), summary, null);
            return append(tx, merged, ChangeKind.MERGED, summary.paths());
        });
    }

    // ----------------- reads -----------------

    /** @throws NotFoundException unknown version id */
    public ObjectVersion get(String versionId) {
        return find(versionId).orElseThrow(() -> NotFoundException.object(versionId));
    }

    public Optional<ObjectVersion> find(String versionId) {
        return store.view().version(versionId);
    }

    /**
     * Versions of the object's canonical identity on every branch, newest
     * first, keyset-paginated by version number.
     *
     * @param cursor version number to continue below; null for the first page
     */
    public HistoryPage history(String objectId, int limit, Long cursor) {
        if (limit <= 0) throw new IllegalArgumentException("limit must be > 0");
        int pageSize = Math.min(limit, MAX_HISTORY_PAGE);
        ObjectVersion v = get(objectId);
        List<ObjectVersion> all = store.view().versionsOf(v.canonicalId());

        List<ObjectVersion> page = new ArrayList<>(pageSize);
        boolean more = false;
        for (int i = all.size() - 1; i >= 0; i--) {
            ObjectVersion x = all.get(i);
            if (cursor != null && x.version() >= cursor) continue;
            if (page.size() == pageSize) {
                more = true;
                break;
            }
            page.add(x);
        }
        Long next = more ? page.get(page.size() - 1).version() : null;
        return new HistoryPage(page, next);
    }

    // ----------------- internals -----------------

    private ObjectVersion successor(StoreView view, ObjectVersion predecessor, String branchId, ObjectNode props,
                                    List<String> labels, String hash, ChangeSummary summary, Instant deletedAt) {
        return new ObjectVersion(ids.get(), predecessor.canonicalId(), branchId, predecessor.organizationId(),
                predecessor.projectId(), predecessor.type(), predecessor.key(), props, labels,
                view.maxVersion(predecessor.canonicalId()) + 1, predecessor.id(), hash, summary,
                clock.instant(), deletedAt);
    }

    private ObjectVersion append(Transaction tx, ObjectVersion v, ChangeKind kind, List<String> changedPaths) {
        tx.stage(new Mutation.PutVersion(v));
        log.fine(() -> kind + " " + v);
        if (!listeners.isEmpty()) {
            ObjectChangedEvent event = new ObjectChangedEvent(v.id(), v.canonicalId(), v.branchId(), v.type(),
                    changedPaths, kind);
            tx.afterCommit(() -> publish(event));
        }
        return v;
    }

    private void publish(ObjectChangedEvent event) {
        for (ObjectChangeListener l : listeners) {
            try {
                l.onObjectChanged(event);
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "Listener failed for " + event.kind() + " of " + event.objectId(), e);
            }
        }
    }

    private void validate(String type, ObjectNode props) {
        List<String> errors = validator.validate(type, props);
        if (errors != null && !errors.isEmpty()) throw new ValidationException(type, errors);
    }

    private static void requireHead(ObjectVersion head, String objectId) {
        if (!head.id().equals(objectId)) {
            throw new ConflictException("object_version_conflict: " + objectId + " superseded by " + head.id());
        }
    }

    /** Lock key guarding the (type, key) identity of objects in a project. */
    public static String identityKey(String projectId, String type, String key) {
        return "key:" + projectId + "|" + type + "|" + key;
    }

    private static List<String> union(List<String> a, List<String> b) {
        TreeSet<String> all = new TreeSet<>(a);
        all.addAll(b);
        return List.copyOf(all);
    }

    private static List<String> sortedLabels(List<String> labels) {
        return List.copyOf(new TreeSet<>(labels));
    }
}
