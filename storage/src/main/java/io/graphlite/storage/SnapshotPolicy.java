package io.graphlite.storage;

/**
 * Snapshot policy that triggers a full snapshot after every N commits.
 * <p>
 * Bounds worst-case recovery time by limiting log replay length.
 * Not thread-safe: called by the store under its commit monitor.
 */
public final class SnapshotPolicy {
    private final int everyTx;
    private int sinceLast;

    public SnapshotPolicy(int everyTx) {
        if (everyTx <= 0) throw new IllegalArgumentException("everyTx must be > 0");
        this.everyTx = everyTx;
    }

    public int everyTx() { return everyTx; }

    /** Call after each successful commit. Returns true when a snapshot was written. */
    boolean maybeSnapshot(StoreState state, Snapshotter snaps) {
        if (++sinceLast < everyTx) return false;
        // Reset first: a failed attempt waits for the next window instead of retrying on every commit.
        sinceLast = 0;
        snaps.writeSnapshot(state.snapshot());
        return true;
    }
}
