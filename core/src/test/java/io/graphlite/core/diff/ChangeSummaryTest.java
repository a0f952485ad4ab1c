package io.graphlite.core.diff;

import io.graphlite.core.Json;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChangeSummaryTest {

    private static ChangeSummary withPaths(String... paths) {
        return new ChangeSummary(null, null, null, List.of(paths), null);
    }

    @Test
    void shared_path_overlaps() {
        assertTrue(withPaths("/a", "/b").overlaps(withPaths("/b", "/c")));
        assertFalse(withPaths("/a", "/b").overlaps(withPaths("/c", "/d")));
    }

    @Test
    void ancestor_path_overlaps_descendant_but_not_sibling_with_common_prefix() {
        assertTrue(ChangeSummary.overlaps(List.of("/a"), List.of("/a/b")));
        assertTrue(ChangeSummary.overlaps(List.of("/a/b/c"), List.of("/a")));
        assertFalse(ChangeSummary.overlaps(List.of("/a"), List.of("/ab")));
        assertEquals(List.of("/a", "/a/b"), ChangeSummary.overlappingPaths(List.of("/a", "/z"), List.of("/a/b")));
    }

    @Test
    void null_or_empty_never_overlaps() {
        assertFalse(withPaths("/a").overlaps(null));
        assertFalse(ChangeSummary.overlaps(null, List.of("/a")));
        assertFalse(ChangeSummary.empty().overlaps(withPaths("/a")));
        assertTrue(ChangeSummary.empty().isNoOp());
    }

    @Test
    void survives_json_round_trip_through_jackson() throws Exception {
        var engine = new DiffEngine();
        var before = (com.fasterxml.jackson.databind.node.ObjectNode) Json.mapper().readTree("{\"a\":1,\"gone\":null}");
        var after = (com.fasterxml.jackson.databind.node.ObjectNode) Json.mapper().readTree("{\"a\":2,\"b\":[1]}");
        var summary = engine.diff(before, after);

        var text = Json.mapper().writeValueAsString(summary);
        var back = Json.mapper().readValue(text, ChangeSummary.class);

        assertEquals(summary.paths(), back.paths());
        assertEquals(summary.meta(), back.meta());
        assertEquals(2, back.updated().get("/a").to().intValue());
        assertTrue(back.removed().contains("/gone"));
    }
}
