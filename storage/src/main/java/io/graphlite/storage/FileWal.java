package io.graphlite.storage;

import io.graphlite.core.error.StorageException;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

import static java.nio.file.StandardOpenOption.*;

/**
 * File-backed WAL that appends header+payload records to segment files.
 * <p>
 * Properties:
 *  - On construction, it:
 *      - creates the directory if needed,
 *      - finds the newest segment ("00000001.log", "00000002.log", ...),
 *      - opens it for append.
 * <p>
 *  - append():
 *      - writes the bytes,
 *      - calls force(true) to fsync data and metadata,
 *      - tracks bytes written this segment.
 * <p>
 *  - rotateIfNeeded():
 *      - when written bytes >= rotateBytes, closes current segment and opens
 *        a new one with incremented index, resetting the counter.
 * <p>
 *  - Reader:
 *      - walks segments in name order,
 *      - validates magic/version/length and CRC of every record,
 *      - stops at the first truncated header/payload or bad CRC.
 */
public class FileWal implements Wal {
    private static final Logger log = Logger.getLogger(FileWal.class.getName());

    private final Path dir;
    private final long rotateBytes;
    private FileChannel ch;
    private Path current;
    private long writtenInSegment = 0;

    public FileWal(Path dir, long rotateBytes) {
        if (rotateBytes <= 0) throw new IllegalArgumentException("rotateBytes must be > 0");
        this.dir = dir;
        this.rotateBytes = rotateBytes;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new StorageException("Cannot create WAL directory " + dir, e);
        }
        openNewestOrCreate();
    }

    @Override
    public synchronized void append(byte[] serializedRecord) {
        try {
            ByteBuffer buf = ByteBuffer.wrap(serializedRecord);
            while (buf.hasRemaining()) ch.write(buf);
            ch.force(true); // fsync: metadata too, so a freshly rotated file is durable
            writtenInSegment += serializedRecord.length;
        } catch (IOException e) {
            throw new StorageException("WAL append failed", e);
        }
    }

    @Override
    public synchronized void rotateIfNeeded() {
        if (writtenInSegment < rotateBytes) return;
        try {
            ch.close();
            int index = Integer.parseInt(current.getFileName().toString().replace(".log", ""));
            current = dir.resolve(segmentName(index + 1));
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            writtenInSegment = 0;
            log.fine(() -> "Rotated WAL to " + current.getFileName());
        } catch (IOException e) {
            throw new StorageException("WAL rotation failed", e);
        }
    }

    @Override
    public WalReader openReader() { return new Reader(segments(dir)); }

    @Override
    public synchronized void close() {
        if (ch == null) return;
        try {
            ch.close();
        } catch (IOException e) {
            throw new StorageException("WAL close failed", e);
        }
    }

    static String segmentName(int index) {
        return String.format("%08d.log", index);
    }

    private static List<Path> segments(Path dir) {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(".log"))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new StorageException("Cannot list WAL segments in " + dir, e);
        }
    }

    /**
     * On startup:
     *  - If there are existing segments, open the newest one and position at the end.
     *  - If none, create "00000001.log".
     */
    private void openNewestOrCreate() {
        List<Path> existing = segments(dir);
        current = existing.isEmpty() ? dir.resolve(segmentName(1)) : existing.get(existing.size() - 1);
        try {
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            long size = ch.size();
            long valid = validLength(ch);
            if (valid < size) {
                // Appending behind a torn record would hide every later record from the reader.
                log.warning(() -> "Truncating torn WAL tail of " + current.getFileName()
                        + " from " + size + " to " + valid + " bytes");
                ch.truncate(valid);
                ch.force(true);
            }
            writtenInSegment = valid;
            ch.position(writtenInSegment);
        } catch (IOException e) {
            throw new StorageException("Cannot open WAL segment " + current, e);
        }
    }

    /** Offset just past the last intact record of a segment. */
    private static long validLength(FileChannel ch) throws IOException {
        long pos = 0;
        long size = ch.size();
        ByteBuffer hdr = ByteBuffer.allocate(RecordCodec.HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
        while (pos + RecordCodec.HEADER_BYTES <= size) {
            hdr.clear();
            if (readFully(ch, hdr, pos) < RecordCodec.HEADER_BYTES) break;
            hdr.flip();
            short magic = hdr.getShort();
            byte ver = hdr.get();
            int len = hdr.getInt();
            int crc = hdr.getInt();
            if (magic != RecordCodec.MAGIC || ver != RecordCodec.VERSION || len < 0) break;
            if (pos + RecordCodec.HEADER_BYTES + len > size) break;
            ByteBuffer payload = ByteBuffer.allocate(len);
            if (readFully(ch, payload, pos + RecordCodec.HEADER_BYTES) < len) break;
            if (RecordCodec.crc32(payload.array()) != crc) break;
            pos += RecordCodec.HEADER_BYTES + (long) len;
        }
        return pos;
    }

    /** Positional read until the buffer is full or EOF; returns the bytes read. */
    private static int readFully(FileChannel ch, ByteBuffer buf, long pos) throws IOException {
        int total = 0;
        while (buf.hasRemaining()) {
            int n = ch.read(buf, pos + total);
            if (n < 0) break;
            total += n;
        }
        return total;
    }

    /**
     * Sequential reader over all segments used during recovery.
     * A damaged record ends the scan: nothing after it is trusted.
     */
    private static final class Reader implements WalReader {
        private final List<Path> segments;
        private int segmentIndex = -1;
        private FileChannel ch;
        private long pos = 0;
        private boolean stopped = false;

        Reader(List<Path> segments) {
            this.segments = segments;
        }

        @Override
        public byte[] next() {
            if (stopped) return null;
            try {
                while (true) {
                    if (ch == null && !openNextSegment()) return null;

                    ByteBuffer hdr = ByteBuffer.allocate(RecordCodec.HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
                    int read = readFully(ch, hdr, pos);
                    if (read <= 0) {
                        // clean end of this segment, move on
                        closeSegment();
                        continue;
                    }
                    if (read < RecordCodec.HEADER_BYTES) return stop("truncated header");

                    hdr.flip();
                    short magic = hdr.getShort();
                    byte ver = hdr.get();
                    int len = hdr.getInt();
                    int crc = hdr.getInt();
                    if (magic != RecordCodec.MAGIC || ver != RecordCodec.VERSION || len < 0) return stop("bad header");

                    ByteBuffer payload = ByteBuffer.allocate(len);
                    int r2 = readFully(ch, payload, pos + RecordCodec.HEADER_BYTES);
                    if (r2 < len) return stop("truncated payload");
                    byte[] bytes = payload.array();
                    if (RecordCodec.crc32(bytes) != crc) return stop("bad crc");

                    pos += RecordCodec.HEADER_BYTES + (long) len;
                    return bytes;
                }
            } catch (IOException e) {
                throw new StorageException("WAL read failed", e);
            }
        }

        private boolean openNextSegment() throws IOException {
            segmentIndex++;
            if (segmentIndex >= segments.size()) return false;
            ch = FileChannel.open(segments.get(segmentIndex), READ);
            pos = 0;
            return true;
        }

        private void closeSegment() throws IOException {
            ch.close();
            ch = null;
        }

        private byte[] stop(String reason) {
            log.log(Level.WARNING, "Ignoring WAL tail in {0} at offset {1}: {2}",
                    new Object[]{segments.get(segmentIndex).getFileName(), pos, reason});
            stopped = true;
            return null;
        }

        @Override
        public void close() {
            if (ch == null) return;
            try {
                closeSegment();
            } catch (IOException e) {
                throw new StorageException("WAL reader close failed", e);
            }
        }
    }
}
