package io.graphlite.storage;

import io.graphlite.core.error.StorageException;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static io.graphlite.storage.Records.rootBranch;
import static io.graphlite.storage.Records.version;
import static org.junit.jupiter.api.Assertions.*;

class RecordCodecTest {

    @Test
    void header_describes_payload() {
        byte[] bytes = RecordCodec.encode(new TxRecord(9, Instant.EPOCH, List.of(rootBranch("main"))));
        ByteBuffer header = ByteBuffer.wrap(bytes, 0, RecordCodec.HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
        assertEquals(RecordCodec.MAGIC, header.getShort());
        assertEquals(RecordCodec.VERSION, header.get());
        int len = header.getInt();
        assertEquals(bytes.length - RecordCodec.HEADER_BYTES, len);
        byte[] payload = Arrays.copyOfRange(bytes, RecordCodec.HEADER_BYTES, bytes.length);
        assertEquals(RecordCodec.crc32(payload), header.getInt());
    }

    @Test
    void payload_keeps_mutation_kinds_and_property_trees() {
        var tx = new TxRecord(3, Instant.parse("2024-05-01T10:00:00Z"),
                List.of(rootBranch("main"), version("v1", "c1", "main", 1, "A")));
        byte[] bytes = RecordCodec.encode(tx);
        TxRecord back = RecordCodec.decode(Arrays.copyOfRange(bytes, RecordCodec.HEADER_BYTES, bytes.length));

        assertEquals(3, back.seq());
        assertEquals(tx.committedAt(), back.committedAt());
        assertInstanceOf(Mutation.PutBranch.class, back.mutations().get(0));
        var v = ((Mutation.PutVersion) back.mutations().get(1)).version();
        assertEquals("A", v.properties().get("title").asText());
        assertEquals(List.of("a", "b"), v.labels());
    }

    @Test
    void garbage_payload_is_a_storage_error() {
        assertThrows(StorageException.class, () -> RecordCodec.decode("{not json".getBytes()));
    }
}
