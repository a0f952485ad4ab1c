package io.graphlite.storage;

import io.graphlite.core.error.StorageException;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.zip.CRC32;

/**
 * Binary framing for log records.
 * <p>
 * On-disk layout:
 * <p>
 *   [HEADER (11 bytes, little-endian)]
 *     - magic   (2B)  = 0x6A1E  (helps detect garbage)
 *     - version (1B)  = 1       (for future upgrades)
 *     - length  (4B)  = payload length in bytes
 *     - crc32   (4B)  = CRC32(payload)
 * <p>
 *   [PAYLOAD (length bytes)]
 *     - UTF-8 JSON of a {@link TxRecord}
 * <p>
 * The header is validated by magic/version/length and CRC when reading.
 */
final class RecordCodec {
    static final short MAGIC = (short) 0x6A1E;
    static final byte VERSION = 1;
    static final int HEADER_BYTES = 2 + 1 + 4 + 4;

    private RecordCodec() {}

    /** Encode a transaction into header+payload bytes ready for append. */
    static byte[] encode(TxRecord record) {
        byte[] payload;
        try {
            payload = StorageJson.mapper().writeValueAsBytes(record);
        } catch (IOException e) {
            throw new StorageException("Cannot encode tx " + record.seq(), e);
        }
        ByteBuffer out = ByteBuffer.allocate(HEADER_BYTES + payload.length).order(ByteOrder.LITTLE_ENDIAN);
        out.putShort(MAGIC).put(VERSION).putInt(payload.length).putInt(crc32(payload));
        out.put(payload);
        return out.array();
    }

    /** Decode a full payload (not including header). */
    static TxRecord decode(byte[] payload) {
        try {
            return StorageJson.mapper().readValue(payload, TxRecord.class);
        } catch (IOException e) {
            throw new StorageException("Cannot decode log payload of " + payload.length + " bytes", e);
        }
    }

    static int crc32(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, bytes.length);
        return (int) crc.getValue();
    }
}
