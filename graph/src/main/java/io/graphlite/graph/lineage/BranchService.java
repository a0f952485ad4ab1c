package io.graphlite.graph.lineage;

import io.graphlite.core.Branch;
import io.graphlite.core.LineageEdge;
import io.graphlite.core.error.ConflictException;
import io.graphlite.core.error.NotFoundException;
import io.graphlite.storage.Mutation;
import io.graphlite.storage.RecordStore;
import io.graphlite.storage.StoreView;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Creates branches and answers branch-level questions.
 * <p>
 * A branch's ancestor closure is materialized once, at creation, by copying
 * the parent's closure one level deeper and adding the self edge. Creating a
 * branch never touches object versions: children see their ancestors' objects
 * through {@link LineageResolver}.
 */
public final class BranchService {
    private static final Logger log = Logger.getLogger(BranchService.class.getName());

    private final RecordStore store;
    private final Clock clock;
    private final Supplier<String> ids;

    public BranchService(RecordStore store, Clock clock, Supplier<String> ids) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.ids = Objects.requireNonNull(ids, "ids");
    }

    /**
     * @param parentBranchId null creates a root branch
     * @throws IllegalArgumentException for a blank name or a parent in another project
     * @throws NotFoundException        for an unknown parent
     * @throws ConflictException        if the name is taken in the project
     */
    public Branch createBranch(String organizationId, String projectId, String name, String parentBranchId) {
        Objects.requireNonNull(projectId, "projectId");
        if (name == null || name.isBlank()) throw new IllegalArgumentException("name must not be blank");

        Branch created = store.inTransaction(tx -> {
            tx.lock("branch-name:" + projectId + "|" + name);
            StoreView view = tx.view();
            if (view.branchByName(projectId, name).isPresent()) {
                throw new ConflictException("branch_name_exists: " + name);
            }

            String id = ids.get();
            List<LineageEdge> closure = new ArrayList<>();
            closure.add(new LineageEdge(id, id, 0));
            if (parentBranchId != null) {
                Branch parent = view.branch(parentBranchId).orElseThrow(() -> NotFoundException.branch(parentBranchId));
                if (!parent.projectId().equals(projectId)) {
                    throw new IllegalArgumentException("parent branch " + parentBranchId + " belongs to another project");
                }
                for (LineageEdge e : view.lineage(parentBranchId)) {
                    closure.add(new LineageEdge(id, e.ancestorBranchId(), e.depth() + 1));
                }
            }

            Branch branch = new Branch(id, name, organizationId, projectId, parentBranchId, clock.instant());
            tx.stage(new Mutation.PutBranch(branch, closure));
            return branch;
        });
        log.info(() -> "Created branch " + created.name() + " (" + created.id() + ")"
                + (created.isRoot() ? "" : " from " + created.parentBranchId()));
        return created;
    }

    public Branch getBranch(String branchId) {
        return store.view().branch(branchId).orElseThrow(() -> NotFoundException.branch(branchId));
    }

    /** Branches of a project, oldest first. */
    public List<Branch> listBranches(String projectId) {
        return store.view().branches().stream()
                .filter(b -> b.projectId().equals(projectId))
                .sorted(Comparator.comparing(Branch::createdAt).thenComparing(Branch::name))
                .toList();
    }

    /** The branch itself, then its parent, up to the root. */
    public List<Branch> ancestors(String branchId) {
        StoreView view = store.view();
        List<LineageEdge> closure = view.lineage(branchId);
        if (closure.isEmpty()) throw NotFoundException.branch(branchId);
        List<Branch> out = new ArrayList<>(closure.size());
        for (LineageEdge e : closure) {
            out.add(view.branch(e.ancestorBranchId()).orElseThrow(() -> NotFoundException.branch(e.ancestorBranchId())));
        }
        return out;
    }
}
