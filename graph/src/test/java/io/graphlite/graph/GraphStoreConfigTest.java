package io.graphlite.graph;

import io.graphlite.core.diff.DiffOptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class GraphStoreConfigTest {

    @TempDir Path dir;

    @Test
    void loads_json_file_and_fills_defaults() throws Exception {
        Path file = dir.resolve("graph.json");
        Files.writeString(file, """
                {
                  "dataDir": "data",
                  "snapshotEveryTx": 10,
                  "diff": { "stringTruncateThreshold": 32, "floatTolerance": 0.001 },
                  "comment": "ignored"
                }
                """);

        GraphStoreConfig cfg = GraphStoreConfig.fromJsonFile(file);

        assertEquals(dir.toAbsolutePath().resolve("data"), cfg.dataDir());
        assertEquals(GraphStoreConfig.DEFAULT_WAL_ROTATE_BYTES, cfg.walRotateBytes());
        assertEquals(10, cfg.snapshotEveryTx());
        assertEquals(32, cfg.diffOptions().stringTruncateThreshold());
        assertEquals(0.001, cfg.diffOptions().floatTolerance());
        assertEquals(DiffOptions.defaults().maxChangeSummaryBytes(), cfg.diffOptions().maxChangeSummaryBytes());
    }

    @Test
    void missing_data_dir_or_bad_file_is_rejected() throws Exception {
        Path file = dir.resolve("graph.json");
        Files.writeString(file, "{\"snapshotEveryTx\": 10}");
        assertThrows(IllegalArgumentException.class, () -> GraphStoreConfig.fromJsonFile(file));
        assertThrows(IllegalArgumentException.class, () -> GraphStoreConfig.fromJsonFile(dir.resolve("absent.json")));
    }

    @Test
    void invalid_values_are_rejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new GraphStoreConfig(dir, 0, 1, DiffOptions.defaults()));
        assertThrows(IllegalArgumentException.class,
                () -> GraphStoreConfig.defaults(dir).withSnapshotEveryTx(0));
    }

    @Test
    void store_honours_snapshot_interval() throws Exception {
        var cfg = GraphStoreConfig.defaults(dir.resolve("store")).withSnapshotEveryTx(2);
        try (GraphStore graph = GraphStore.open(cfg)) {
            graph.branches().createBranch(Fixtures.ORG, Fixtures.PROJECT, "main", null);
            graph.branches().createBranch(Fixtures.ORG, Fixtures.PROJECT, "dev", null);
        }
        try (var files = Files.list(dir.resolve("store").resolve("snapshots"))) {
            assertEquals(1, files.filter(p -> p.toString().endsWith(".json")).count());
        }
        try (GraphStore graph = GraphStore.open(cfg)) {
            assertEquals(2, graph.branches().listBranches(Fixtures.PROJECT).size());
        }
    }
}
