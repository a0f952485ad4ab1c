package io.graphlite.storage;

import io.graphlite.core.error.StorageException;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Durable record store.
 * <p>
 * Responsibilities:
 *  - Maintain the in-memory indexes ({@link StoreState}).
 *  - On commit:
 *      1) Encode all staged mutations as one {@link TxRecord}.
 *      2) Append+fsync it to the WAL.
 *      3) Apply it to memory.
 *      4) Rotate the WAL segment if needed.
 *      5) Possibly write a full snapshot based on {@link SnapshotPolicy}.
 *      Failures in 4) and 5) are logged; the commit already stands.
 * <p>
 *  - On startup:
 *      1) Load the latest snapshot (if any) into memory.
 *      2) Replay WAL records with a higher sequence number.
 * <p>
 * Commits are serialized by a monitor; the work inside a transaction is not,
 * only the key locks it takes order it against other writers.
 */
public class DurableStore implements RecordStore {
    private static final Logger log = Logger.getLogger(DurableStore.class.getName());

    private final StoreState state = new StoreState();
    private final KeyLocker locker = new KeyLocker();
    private final ThreadLocal<Transaction> current = new ThreadLocal<>();
    private final Object commitMonitor = new Object();
    private final Wal wal;
    private final Snapshotter snaps;
    private final SnapshotPolicy snapPolicy;
    private final Clock clock;
    private volatile boolean closed;

    public DurableStore(Wal wal, Snapshotter snaps, SnapshotPolicy snapPolicy) {
        this(wal, snaps, snapPolicy, Clock.systemUTC());
    }

    public DurableStore(Wal wal, Snapshotter snaps, SnapshotPolicy snapPolicy, Clock clock) {
        this.wal = wal;
        this.snaps = snaps;
        this.snapPolicy = snapPolicy;
        this.clock = clock;
        recover();
    }

    /** Store with its log under {@code dataDir/wal} and snapshots under {@code dataDir/snapshots}. */
    public static DurableStore open(Path dataDir, long walRotateBytes, int snapshotEveryTx) {
        return new DurableStore(
                new FileWal(dataDir.resolve("wal"), walRotateBytes),
                new FileSnapshotter(dataDir.resolve("snapshots")),
                new SnapshotPolicy(snapshotEveryTx));
    }

    @Override
    public StoreView view() {
        Transaction tx = current.get();
        return tx != null ? tx.view() : state;
    }

    @Override
    public <T> T inTransaction(Function<Transaction, T> work) {
        Transaction outer = current.get();
        if (outer != null) return work.apply(outer);
        if (closed) throw new IllegalStateException("store is closed");

        Transaction tx = new Transaction(state, locker);
        current.set(tx);
        T result;
        try {
            result = work.apply(tx);
            commit(tx.staged());
        } finally {
            current.remove();
            tx.releaseLocks();
        }
        for (Runnable callback : tx.afterCommitCallbacks()) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "after-commit callback failed", e);
            }
        }
        return result;
    }

    private void commit(List<Mutation> mutations) {
        if (mutations.isEmpty()) return;
        synchronized (commitMonitor) {
            TxRecord record = new TxRecord(state.lastSeq() + 1, clock.instant(), mutations);
            // If the process crashes after append returns, recovery will still see this record.
            wal.append(RecordCodec.encode(record));
            state.apply(record);
            // The record is durable and visible from here on; housekeeping failures must not fail the commit.
            try {
                wal.rotateIfNeeded();
            } catch (StorageException e) {
                log.log(Level.WARNING, "WAL rotation failed after seq " + record.seq(), e);
            }
            try {
                if (snapPolicy.maybeSnapshot(state, snaps)) {
                    log.fine(() -> "Snapshot written at seq " + record.seq());
                }
            } catch (StorageException e) {
                log.log(Level.WARNING, "Snapshot failed at seq " + record.seq(), e);
            }
        }
    }

    /** Force a snapshot of the committed state. Returns the snapshot id. */
    public String snapshotNow() {
        synchronized (commitMonitor) {
            return snaps.writeSnapshot(state.snapshot());
        }
    }

    /** Last committed sequence number. */
    public long lastSeq() {
        return state.lastSeq();
    }

    private void recover() {
        Snapshotter.LoadedSnapshot loaded = snaps.loadLatest();
        if (loaded != null && loaded.data() != null) {
            state.load(loaded.data());
        }

        long replayed = 0;
        try (Wal.WalReader r = wal.openReader()) {
            for (byte[] payload; (payload = r.next()) != null; ) {
                TxRecord rec = RecordCodec.decode(payload);
                if (rec.seq() > state.lastSeq()) {
                    state.apply(rec);
                    replayed++;
                }
            }
        } catch (StorageException e) {
            throw new StorageException("Recovery failed", e);
        }
        long fromLog = replayed;
        log.info(() -> "Recovered store at seq " + state.lastSeq()
                + (loaded != null ? " from snapshot " + loaded.id() : "")
                + ", replayed " + fromLog + " log records");
    }

    @Override
    public void close() {
        synchronized (commitMonitor) {
            if (closed) return;
            closed = true;
            wal.close();
        }
    }
}
