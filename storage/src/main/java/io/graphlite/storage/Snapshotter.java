package io.graphlite.storage;

/**
 * Snapshot abstraction to bound recovery time.
 * <p>
 * A snapshot is a full copy of the committed record sets at some transaction
 * sequence number. On restart:
 *  - we load the latest snapshot, then
 *  - replay log records whose sequence number is higher.
 */
public interface Snapshotter {

    /**
     * Persist a full copy of the record sets.
     *
     * @return snapshot identifier (file name)
     */
    String writeSnapshot(StoreSnapshot snapshot);

    /** Load the latest snapshot, or null when none was written yet. */
    LoadedSnapshot loadLatest();

    record LoadedSnapshot(String id, StoreSnapshot data) {}
}
