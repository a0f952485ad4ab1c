package io.graphlite.storage;

import io.graphlite.core.error.StorageException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.logging.Logger;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;

/**
 * JSON snapshot implementation backed by a single file per snapshot.
 * <p>
 * File name: {@code snapshot-<lastSeq, 20 digits>.json}, so lexical order is
 * sequence order. Content: Jackson JSON of a {@link StoreSnapshot}.
 * <p>
 * Atomicity:
 *   - We write to "snapshot-&lt;seq&gt;.json.tmp" first and fsync it,
 *   - then move to "snapshot-&lt;seq&gt;.json" using ATOMIC_MOVE.
 * Leftover .tmp files from a crash are ignored by {@link #loadLatest()}.
 */
public final class FileSnapshotter implements Snapshotter {
    private static final Logger log = Logger.getLogger(FileSnapshotter.class.getName());

    private static final String PREFIX = "snapshot-";
    private static final String SUFFIX = ".json";

    private final Path dir;

    public FileSnapshotter(Path dir) {
        this.dir = dir;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new StorageException("Cannot create snapshot dir " + dir, e);
        }
    }

    static String snapshotName(long seq) {
        return PREFIX + String.format("%020d", seq) + SUFFIX;
    }

    @Override
    public String writeSnapshot(StoreSnapshot snapshot) {
        String name = snapshotName(snapshot.lastSeq());
        Path tmp = dir.resolve(name + ".tmp");
        Path dst = dir.resolve(name);

        try (FileChannel ch = FileChannel.open(tmp, StandardOpenOption.CREATE,
                StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
            ByteBuffer buf = ByteBuffer.wrap(StorageJson.mapper().writeValueAsBytes(snapshot));
            while (buf.hasRemaining()) ch.write(buf);
            ch.force(true); // content must be on disk before the rename publishes it
        } catch (IOException e) {
            throw new StorageException("Cannot write snapshot " + tmp, e);
        }

        try {
            Files.move(tmp, dst, ATOMIC_MOVE);
        } catch (IOException e) {
            throw new StorageException("Cannot publish snapshot " + dst, e);
        }

        log.info(() -> "Wrote snapshot " + name + " (" + snapshot.versions().size() + " versions, "
                + snapshot.branches().size() + " branches)");
        return name;
    }

    @Override
    public LoadedSnapshot loadLatest() {
        Path snap;
        try (Stream<Path> files = Files.list(dir)) {
            snap = files
                    .filter(p -> {
                        String n = p.getFileName().toString();
                        return n.startsWith(PREFIX) && n.endsWith(SUFFIX);
                    })
                    .sorted()
                    .reduce((a, b) -> b)
                    .orElse(null);
        } catch (IOException e) {
            throw new StorageException("Cannot list snapshot dir " + dir, e);
        }
        if (snap == null) return null;

        try (InputStream in = Files.newInputStream(snap)) {
            StoreSnapshot data = StorageJson.mapper().readValue(in, StoreSnapshot.class);
            return new LoadedSnapshot(snap.getFileName().toString(), data);
        } catch (IOException e) {
            throw new StorageException("Cannot read snapshot " + snap, e);
        }
    }
}
