package io.graphlite.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static io.graphlite.storage.Records.rootBranch;
import static io.graphlite.storage.Records.version;
import static java.nio.file.StandardOpenOption.APPEND;
import static org.junit.jupiter.api.Assertions.*;

class FileWalTornTailTest {

    @TempDir Path dataDir;

    private static byte[] record(long seq, Mutation... mutations) {
        return RecordCodec.encode(new TxRecord(seq, Instant.EPOCH, List.of(mutations)));
    }

    @Test
    void replay_ignores_truncated_tail_and_applies_all_prior_records() throws Exception {
        Path walDir = dataDir.resolve("wal");
        var wal = new FileWal(walDir, 1L << 60); // huge rotate threshold so single segment
        wal.append(record(1, rootBranch("main")));
        wal.append(record(2, version("v1", "c1", "main", 1, "A")));
        // third record only partially written (simulated crash mid-append)
        byte[] r3 = record(3, version("v2", "c1", "main", 2, "B"));
        Path seg = walDir.resolve(FileWal.segmentName(1));
        try (OutputStream out = Files.newOutputStream(seg, APPEND)) {
            out.write(r3, 0, r3.length - 5);
        }
        wal.close();

        try (var store = DurableStore.open(dataDir, 1L << 60, 1_000)) {
            assertEquals(2, store.lastSeq());
            assertEquals("v1", store.view().headOnBranch("main", "c1").orElseThrow().id());
            assertTrue(store.view().version("v2").isEmpty());
        }
    }

    @Test
    void records_appended_after_a_torn_tail_are_replayed() throws Exception {
        Path walDir = dataDir.resolve("wal");
        var wal = new FileWal(walDir, 1L << 60);
        wal.append(record(1, rootBranch("main")));
        byte[] torn = record(2, version("lost", "c1", "main", 1, "A"));
        try (OutputStream out = Files.newOutputStream(walDir.resolve(FileWal.segmentName(1)), APPEND)) {
            out.write(torn, 0, 7);
        }
        wal.close();

        try (var store = DurableStore.open(dataDir, 1L << 60, 1_000)) {
            store.inTransaction(tx -> { tx.stage(version("v1", "c1", "main", 1, "A")); return null; });
        }
        try (var store = DurableStore.open(dataDir, 1L << 60, 1_000)) {
            assertEquals(2, store.lastSeq());
            assertEquals("v1", store.view().headOnBranch("main", "c1").orElseThrow().id());
        }
    }

    @Test
    void reader_walks_rotated_segments_in_order() {
        Path walDir = dataDir.resolve("wal");
        try (var wal = new FileWal(walDir, 1)) { // rotate after every record
            for (long seq = 1; seq <= 3; seq++) {
                wal.append(record(seq, rootBranch("b" + seq)));
                wal.rotateIfNeeded();
            }
        }
        try (var wal = new FileWal(walDir, 1); var r = wal.openReader()) {
            long expected = 1;
            for (byte[] p; (p = r.next()) != null; expected++) {
                assertEquals(expected, RecordCodec.decode(p).seq());
            }
            assertEquals(4, expected);
        }
    }
}
