package io.graphlite.graph;

import io.graphlite.core.Branch;
import io.graphlite.core.ObjectVersion;
import io.graphlite.core.error.ConflictException;
import io.graphlite.core.error.NotFoundException;
import io.graphlite.core.error.ValidationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static io.graphlite.graph.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class ObjectStoreTest {

    @TempDir Path dataDir;

    private GraphStore graph;
    private ObjectStore objects;
    private Branch main;

    @BeforeEach
    void setUp() {
        graph = GraphStore.open(GraphStoreConfig.defaults(dataDir), (type, p) ->
                p.has("forbidden") ? List.of("forbidden is not allowed") : List.of());
        objects = graph.objects();
        main = graph.branches().createBranch(ORG, PROJECT, "main", null);
    }

    @AfterEach
    void tearDown() {
        graph.close();
    }

    @Test
    void write_creates_version_one_with_hash_and_summary() {
        ObjectVersion v = objects.write(doc(main.id(), "k1", props("title", "A"), "z", "a", "z"));

        assertEquals(1, v.version());
        assertNull(v.supersedesId());
        assertEquals(64, v.contentHash().length());
        assertEquals(List.of("/title"), v.changeSummary().paths());
        assertEquals(List.of("a", "z"), v.labels());
        assertEquals(v, objects.get(v.id()));
    }

    @Test
    void duplicate_live_key_on_branch_is_a_conflict() {
        objects.write(doc(main.id(), "k1", props("title", "A")));
        assertThrows(ConflictException.class, () -> objects.write(doc(main.id(), "k1", props("title", "B"))));
        // keyless objects never collide
        objects.write(doc(main.id(), null, props("title", "A")));
        objects.write(doc(main.id(), null, props("title", "A")));
    }

    @Test
    void unknown_branch_is_not_found() {
        assertThrows(NotFoundException.class, () -> objects.write(doc("nope", "k1", props("title", "A"))));
    }

    @Test
    void patch_is_shallow_and_null_removes_a_key() {
        ObjectVersion v1 = objects.write(doc(main.id(), "k1", props("title", "A", "body", "x", "tags", props("a", 1))));
        ObjectVersion v2 = objects.patch(v1.id(), new PatchRequest(props("title", "B", "body", null), List.of("new"), false));

        assertEquals(2, v2.version());
        assertEquals(v1.id(), v2.supersedesId());
        assertEquals("B", v2.properties().get("title").asText());
        assertFalse(v2.properties().has("body"));
        assertEquals(1, v2.properties().get("tags").get("a").asInt());
        assertEquals(List.of("/body", "/title"), v2.changeSummary().paths());
        assertEquals(List.of("new"), v2.labels());
    }

    @Test
    void labels_can_be_replaced() {
        ObjectVersion v1 = objects.write(doc(main.id(), "k1", props("title", "A"), "a", "b"));
        ObjectVersion v2 = objects.patch(v1.id(), new PatchRequest(null, List.of("c"), true));
        assertEquals(List.of("c"), v2.labels());
        assertEquals(v1.contentHash(), v2.contentHash());
    }

    @Test
    void no_op_patch_returns_current_head_without_writing() {
        ObjectVersion v1 = objects.write(doc(main.id(), "k1", props("title", "A"), "a"));
        ObjectVersion same = objects.patch(v1.id(), new PatchRequest(props("title", "A"), List.of("a"), false));
        assertEquals(v1.id(), same.id());
        assertEquals(1, objects.history(v1.id(), 10, null).items().size());
    }

    @Test
    void patching_a_superseded_version_is_a_conflict() {
        ObjectVersion v1 = objects.write(doc(main.id(), "k1", props("title", "A")));
        objects.patch(v1.id(), PatchRequest.of(props("title", "B")));
        assertThrows(ConflictException.class, () -> objects.patch(v1.id(), PatchRequest.of(props("title", "C"))));
    }

    @Test
    void patch_on_child_branch_copies_on_write() {
        ObjectVersion v1 = objects.write(doc(main.id(), "k1", props("title", "A")));
        Branch feature = graph.branches().createBranch(ORG, PROJECT, "feature", main.id());

        ObjectVersion v2 = objects.patch(feature.id(), v1.id(), PatchRequest.of(props("body", "x")));

        assertEquals(feature.id(), v2.branchId());
        assertEquals(v1.id(), v2.supersedesId());
        assertEquals(v1.id(), graph.lineage().resolve(main.id(), v1.canonicalId()).orElseThrow().id());
        assertEquals(v2.id(), graph.lineage().resolve(feature.id(), v1.canonicalId()).orElseThrow().id());
    }

    @Test
    void validation_failure_persists_nothing() {
        var e = assertThrows(ValidationException.class,
                () -> objects.write(doc(main.id(), "k1", props("forbidden", true))));
        assertEquals("Doc", e.type());
        assertEquals(List.of("forbidden is not allowed"), e.errors());
        assertTrue(graph.lineage().visibleCanonicalIds(main.id()).isEmpty());

        ObjectVersion v1 = objects.write(doc(main.id(), "k1", props("title", "A")));
        assertThrows(ValidationException.class, () -> objects.patch(v1.id(), PatchRequest.of(props("forbidden", 1))));
        assertEquals(v1.id(), graph.lineage().resolve(main.id(), v1.canonicalId()).orElseThrow().id());
    }

    @Test
    void soft_delete_then_restore() {
        ObjectVersion v1 = objects.write(doc(main.id(), "k1", props("title", "A")));
        ObjectVersion tomb = objects.softDelete(v1.id());

        assertTrue(tomb.deleted());
        assertEquals(2, tomb.version());
        assertTrue(graph.lineage().resolve(main.id(), v1.canonicalId()).isEmpty());
        assertThrows(ConflictException.class, () -> objects.softDelete(tomb.id()));
        assertThrows(NotFoundException.class, () -> objects.patch(tomb.id(), PatchRequest.of(props("title", "B"))));

        // the key is free again while deleted
        ObjectVersion other = objects.write(doc(main.id(), "k2", props("title", "other")));
        assertNotEquals(v1.canonicalId(), other.canonicalId());

        ObjectVersion restored = objects.restore(tomb.id());
        assertFalse(restored.deleted());
        assertEquals(3, restored.version());
        assertEquals("A", restored.properties().get("title").asText());
        assertThrows(ConflictException.class, () -> objects.restore(restored.id()));
    }

    @Test
    void restore_fails_when_the_key_was_reused() {
        ObjectVersion v1 = objects.write(doc(main.id(), "k1", props("title", "A")));
        ObjectVersion tomb = objects.softDelete(v1.id());
        objects.write(doc(main.id(), "k1", props("title", "again")));
        assertThrows(ConflictException.class, () -> objects.restore(tomb.id()));
    }

    @Test
    void history_is_newest_first_and_paginated() {
        ObjectVersion head = objects.write(doc(main.id(), "k1", props("n", 0)));
        for (int i = 1; i < 5; i++) head = objects.patch(head.id(), PatchRequest.of(props("n", i)));

        HistoryPage p1 = objects.history(head.id(), 2, null);
        assertEquals(List.of(5L, 4L), p1.items().stream().map(ObjectVersion::version).toList());
        HistoryPage p2 = objects.history(head.id(), 2, p1.nextCursor());
        assertEquals(List.of(3L, 2L), p2.items().stream().map(ObjectVersion::version).toList());
        HistoryPage p3 = objects.history(head.id(), 2, p2.nextCursor());
        assertEquals(List.of(1L), p3.items().stream().map(ObjectVersion::version).toList());
        assertNull(p3.nextCursor());
    }

    @Test
    void listeners_see_committed_changes_and_failures_are_contained() {
        List<ObjectChangedEvent> events = new ArrayList<>();
        objects.addListener(e -> { throw new IllegalStateException("down"); });
        objects.addListener(events::add);

        ObjectVersion v1 = objects.write(doc(main.id(), "k1", props("title", "A")));
        ObjectVersion v2 = objects.patch(v1.id(), PatchRequest.of(props("body", "x")));
        assertThrows(ValidationException.class, () -> objects.patch(v2.id(), PatchRequest.of(props("forbidden", 1))));

        assertEquals(2, events.size());
        assertEquals(ChangeKind.CREATED, events.get(0).kind());
        assertEquals(ChangeKind.UPDATED, events.get(1).kind());
        assertEquals(List.of("/body"), events.get(1).changedPaths());
        assertEquals(v2.id(), events.get(1).objectId());
    }

    @Test
    void state_survives_reopen() {
        ObjectVersion v1 = objects.write(doc(main.id(), "k1", props("title", "A")));
        ObjectVersion v2 = objects.patch(v1.id(), PatchRequest.of(props("title", "B")));
        graph.close();

        graph = GraphStore.open(GraphStoreConfig.defaults(dataDir));
        assertEquals(v2.id(), graph.lineage().resolve(main.id(), v1.canonicalId()).orElseThrow().id());
        assertEquals("main", graph.branches().getBranch(main.id()).name());
        assertEquals(v2.changeSummary(), graph.objects().get(v2.id()).changeSummary());
    }

    @Test
    void patch_that_only_rewrites_a_number_in_another_form_writes_nothing() {
        ObjectVersion v1 = objects.write(doc(main.id(), "k1", props("n", 1)));
        ObjectVersion same = objects.patch(v1.id(), PatchRequest.of(props("n", 1.0)));

        assertEquals(v1.id(), same.id());
        assertEquals(1, objects.history(v1.id(), 10, null).items().size());
    }
}
