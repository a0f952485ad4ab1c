package io.graphlite.graph;

import io.graphlite.core.diff.DiffEngine;
import io.graphlite.graph.lineage.BranchService;
import io.graphlite.graph.lineage.LineageResolver;
import io.graphlite.graph.merge.MergeEngine;
import io.graphlite.graph.merge.ProvenanceRecorder;
import io.graphlite.storage.DurableStore;
import io.graphlite.storage.RecordStore;

import java.time.Clock;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Entry point: opens the durable record store under the configured data
 * directory and wires the services on top of it.
 * <p>
 * Wiring:
 *  - {@link DurableStore}  : log + snapshots + key locks + transactions,
 *  - {@link DiffEngine}    : content hashes and change summaries,
 *  - {@link BranchService} and {@link LineageResolver} : branches and visibility,
 *  - {@link ObjectStore}   : versioned writes,
 *  - {@link ProvenanceRecorder} and {@link MergeEngine} : branch merges.
 */
public final class GraphStore implements AutoCloseable {
    private static final Logger log = Logger.getLogger(GraphStore.class.getName());

    private final RecordStore store;
    private final BranchService branches;
    private final LineageResolver lineage;
    private final ObjectStore objects;
    private final ProvenanceRecorder provenance;
    private final MergeEngine merges;

    public GraphStore(RecordStore store, DiffEngine diff, SchemaValidator validator, Clock clock, Supplier<String> ids) {
        this.store = Objects.requireNonNull(store, "store");
        this.branches = new BranchService(store, clock, ids);
        this.lineage = new LineageResolver(store);
        this.objects = new ObjectStore(store, lineage, diff, validator, clock, ids);
        this.provenance = new ProvenanceRecorder(store, clock);
        this.merges = new MergeEngine(store, branches, lineage, objects, provenance, diff);
    }

    public static GraphStore open(GraphStoreConfig config) {
        return open(config, SchemaValidator.NONE);
    }

    public static GraphStore open(GraphStoreConfig config, SchemaValidator validator) {
        DurableStore store = DurableStore.open(config.dataDir(), config.walRotateBytes(), config.snapshotEveryTx());
        log.info(() -> "Opened graph store at " + config.dataDir());
        return new GraphStore(store, new DiffEngine(config.diffOptions()), validator,
                Clock.systemUTC(), () -> UUID.randomUUID().toString());
    }

    public BranchService branches() { return branches; }

    public LineageResolver lineage() { return lineage; }

    public ObjectStore objects() { return objects; }

    public ProvenanceRecorder provenance() { return provenance; }

    public MergeEngine merges() { return merges; }

    @Override
    public void close() {
        store.close();
    }
}
