package io.graphlite.storage;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Unit of durability: all mutations of one committed transaction.
 * A record is appended to the log as a single framed entry, so recovery
 * sees either every mutation of a transaction or none of them.
 *
 * @param seq         strictly increasing commit sequence number
 * @param committedAt commit wall-clock time (informational)
 * @param mutations   inserts in staging order
 */
public record TxRecord(long seq, Instant committedAt, List<Mutation> mutations) {
    public TxRecord {
        if (seq <= 0) throw new IllegalArgumentException("seq must be > 0");
        Objects.requireNonNull(committedAt, "committedAt");
        mutations = List.copyOf(mutations);
    }
}
