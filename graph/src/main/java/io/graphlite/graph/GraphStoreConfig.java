package io.graphlite.graph;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.graphlite.core.diff.DiffOptions;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Store configuration.
 *
 * @param dataDir          root of the log ({@code wal/}) and snapshot ({@code snapshots/}) directories
 * @param walRotateBytes   log segment size that triggers rotation
 * @param snapshotEveryTx  commits between two full snapshots
 * @param diffOptions      truncation thresholds, summary cap and float tolerance
 */
public record GraphStoreConfig(
        Path dataDir,
        long walRotateBytes,
        int snapshotEveryTx,
        DiffOptions diffOptions
) {
    public static final long DEFAULT_WAL_ROTATE_BYTES = 64L * 1024 * 1024;
    public static final int DEFAULT_SNAPSHOT_EVERY_TX = 50_000;

    public GraphStoreConfig {
        Objects.requireNonNull(dataDir, "dataDir");
        Objects.requireNonNull(diffOptions, "diffOptions");
        if (walRotateBytes <= 0) throw new IllegalArgumentException("walRotateBytes must be > 0");
        if (snapshotEveryTx <= 0) throw new IllegalArgumentException("snapshotEveryTx must be > 0");
    }

    public static GraphStoreConfig defaults(Path dataDir) {
        return new GraphStoreConfig(dataDir, DEFAULT_WAL_ROTATE_BYTES, DEFAULT_SNAPSHOT_EVERY_TX, DiffOptions.defaults());
    }

    public GraphStoreConfig withDiffOptions(DiffOptions options) {
        return new GraphStoreConfig(dataDir, walRotateBytes, snapshotEveryTx, options);
    }

    public GraphStoreConfig withSnapshotEveryTx(int everyTx) {
        return new GraphStoreConfig(dataDir, walRotateBytes, everyTx, diffOptions);
    }

    /**
     * Load from a JSON file. Missing fields take their defaults; a relative
     * {@code dataDir} is resolved against the file's directory.
     */
    public static GraphStoreConfig fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        try {
            JsonConfig cfg = mapper.readValue(path.toFile(), JsonConfig.class);
            if (cfg.dataDir == null || cfg.dataDir.isBlank())
                throw new IllegalArgumentException("dataDir is required in " + path);

            Path base = path.toAbsolutePath().getParent();
            Path dataDir = base.resolve(cfg.dataDir);

            DiffOptions d = DiffOptions.defaults();
            if (cfg.diff != null) {
                if (cfg.diff.stringTruncateThreshold != null) d = d.withStringTruncateThreshold(cfg.diff.stringTruncateThreshold);
                if (cfg.diff.objectTruncateThreshold != null) d = d.withObjectTruncateThreshold(cfg.diff.objectTruncateThreshold);
                if (cfg.diff.maxChangeSummaryBytes != null) d = d.withMaxChangeSummaryBytes(cfg.diff.maxChangeSummaryBytes);
                if (cfg.diff.floatTolerance != null) d = d.withFloatTolerance(cfg.diff.floatTolerance);
            }

            return new GraphStoreConfig(
                    dataDir,
                    cfg.walRotateBytes != null ? cfg.walRotateBytes : DEFAULT_WAL_ROTATE_BYTES,
                    cfg.snapshotEveryTx != null ? cfg.snapshotEveryTx : DEFAULT_SNAPSHOT_EVERY_TX,
                    d
            );
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to load GraphStoreConfig from " + path, e);
        }
    }

    /** JSON shape of the config file. */
    static final class JsonConfig {
        public String dataDir;
        public Long walRotateBytes;
        public Integer snapshotEveryTx;
        public JsonDiff diff;
    }

    static final class JsonDiff {
        public Integer stringTruncateThreshold;
        public Integer objectTruncateThreshold;
        public Integer maxChangeSummaryBytes;
        public Double floatTolerance;
    }
}
