package io.graphlite.storage;

import java.util.function.Function;

/**
 * Transactional store of the four append-only record sets: object versions,
 * branches with their lineage closure, and merge provenance edges.
 */
public interface RecordStore extends AutoCloseable {

    /**
     * Current view for the calling thread: the open transaction's staged view
     * when called inside {@link #inTransaction}, the committed state otherwise.
     */
    StoreView view();

    /**
     * Run {@code work} inside a transaction.
     * <p>
     * Nested calls on the same thread join the outer transaction. The
     * outermost call commits every staged mutation as one durable record, or
     * nothing if {@code work} throws; the exception propagates unchanged.
     */
    <T> T inTransaction(Function<Transaction, T> work);

    @Override
    void close();
}
