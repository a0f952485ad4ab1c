package io.graphlite.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import io.graphlite.core.error.StorageException;

import static io.graphlite.storage.Records.rootBranch;
import static io.graphlite.storage.Records.version;
import static org.junit.jupiter.api.Assertions.*;

class DurableStoreTransactionTest {

    @TempDir Path dataDir;

    @Test
    void failed_transaction_leaves_no_trace() {
        try (var store = DurableStore.open(dataDir, 1L << 60, 1_000)) {
            store.inTransaction(tx -> { tx.stage(rootBranch("main")); return null; });

            List<String> fired = new ArrayList<>();
            var boom = assertThrows(IllegalStateException.class, () -> store.inTransaction(tx -> {
                tx.stage(version("v1", "c1", "main", 1, "A"));
                tx.afterCommit(() -> fired.add("v1"));
                throw new IllegalStateException("boom");
            }));
            assertEquals("boom", boom.getMessage());

            assertTrue(store.view().version("v1").isEmpty());
            assertEquals(1, store.lastSeq());
            assertTrue(fired.isEmpty());
        }
        try (var reopened = DurableStore.open(dataDir, 1L << 60, 1_000)) {
            assertTrue(reopened.view().version("v1").isEmpty());
        }
    }

    @Test
    void nested_calls_join_the_outer_transaction() {
        try (var store = DurableStore.open(dataDir, 1L << 60, 1_000)) {
            store.inTransaction(outer -> {
                outer.stage(rootBranch("main"));
                store.inTransaction(inner -> {
                    assertSame(outer, inner);
                    inner.stage(version("v1", "c1", "main", 1, "A"));
                    return null;
                });
                // staged rows are visible to the transaction itself, not to others
                assertTrue(store.view().version("v1").isPresent());
                return null;
            });
            assertEquals(1, store.lastSeq());
            assertTrue(store.view().version("v1").isPresent());
        }
    }

    @Test
    void staged_view_layers_new_versions_over_committed_ones() {
        try (var store = DurableStore.open(dataDir, 1L << 60, 1_000)) {
            store.inTransaction(tx -> {
                tx.stage(rootBranch("main"));
                tx.stage(version("v1", "c1", "main", 1, "A"));
                return null;
            });
            store.inTransaction(tx -> {
                tx.stage(version("v2", "c1", "main", 2, "B"));
                StoreView view = tx.view();
                assertEquals("v2", view.headOnBranch("main", "c1").orElseThrow().id());
                assertEquals(2, view.maxVersion("c1"));
                assertEquals(List.of("v1", "v2"), view.versionsOf("c1").stream().map(v -> v.id()).toList());
                assertEquals(1, store.lastSeq());
                return null;
            });
        }
    }

    @Test
    void after_commit_callbacks_run_once_committed_and_failures_are_contained() {
        try (var store = DurableStore.open(dataDir, 1L << 60, 1_000)) {
            List<Long> seen = new ArrayList<>();
            String result = store.inTransaction(tx -> {
                tx.stage(rootBranch("main"));
                tx.afterCommit(() -> { throw new RuntimeException("listener down"); });
                tx.afterCommit(() -> seen.add(store.lastSeq()));
                return "ok";
            });
            assertEquals("ok", result);
            assertEquals(List.of(1L), seen);
        }
    }

    @Test
    void empty_transaction_writes_nothing() {
        try (var store = DurableStore.open(dataDir, 1L << 60, 1_000)) {
            int result = store.inTransaction(tx -> 7);
            assertEquals(7, result);
            assertEquals(0, store.lastSeq());
        }
    }

    @Test
    void snapshot_failure_does_not_fail_a_committed_transaction() {
        AtomicInteger attempts = new AtomicInteger();
        Snapshotter failing = new Snapshotter() {
            @Override
            public String writeSnapshot(StoreSnapshot snapshot) {
                attempts.incrementAndGet();
                throw new StorageException("disk full");
            }

            @Override
            public LoadedSnapshot loadLatest() {
                return null;
            }
        };
        Path walDir = dataDir.resolve("wal");
        try (var store = new DurableStore(new FileWal(walDir, 1L << 60), failing, new SnapshotPolicy(2))) {
            List<String> fired = new ArrayList<>();
            store.inTransaction(tx -> {
                tx.stage(rootBranch("main"));
                return null;
            });
            String result = store.inTransaction(tx -> {
                tx.stage(version("v1", "c1", "main", 1, "A"));
                tx.afterCommit(() -> fired.add("v1"));
                return "ok";
            });
            assertEquals("ok", result);
            assertEquals(List.of("v1"), fired);
            assertEquals(1, attempts.get());

            // the failed window is not retried on the very next commit
            store.inTransaction(tx -> {
                tx.stage(version("v2", "c1", "main", 2, "B"));
                return null;
            });
            assertEquals(1, attempts.get());
            assertEquals(3, store.lastSeq());
        }
        try (var reopened = DurableStore.open(dataDir, 1L << 60, 1_000)) {
            assertTrue(reopened.view().version("v2").isPresent());
        }
    }
}
