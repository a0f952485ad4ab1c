package io.graphlite.graph.merge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.graphlite.core.Json;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TreePathsTest {

    private static ObjectNode parse(String json) throws Exception {
        return (ObjectNode) Json.mapper().readTree(json);
    }

    private static JsonNode value(String json) throws Exception {
        return Json.mapper().readTree(json);
    }

    @Test
    void set_creates_missing_parents_and_handles_escaped_segments() throws Exception {
        ObjectNode root = parse("{\"a\":1}");
        TreePaths.set(root, "/b/c", value("2"));
        TreePaths.set(root, "/x~1y/m~0n", value("\"v\""));
        assertEquals(parse("{\"a\":1,\"b\":{\"c\":2},\"x/y\":{\"m~n\":\"v\"}}"), root);
    }

    @Test
    void set_in_arrays_replaces_appends_and_pads() throws Exception {
        ObjectNode root = parse("{\"list\":[1,2]}");
        TreePaths.set(root, "/list/0", value("9"));
        TreePaths.set(root, "/list/2", value("3"));
        TreePaths.set(root, "/list/4", value("5"));
        assertEquals(parse("{\"list\":[9,2,3,null,5]}"), root);
    }

    @Test
    void remove_ignores_missing_nodes() throws Exception {
        ObjectNode root = parse("{\"a\":{\"b\":1},\"list\":[1,2,3]}");
        TreePaths.remove(root, "/a/b");
        TreePaths.remove(root, "/list/2");
        TreePaths.remove(root, "/nope/deeper");
        TreePaths.remove(root, "/list/7");
        assertEquals(parse("{\"a\":{},\"list\":[1,2]}"), root);
    }

    @Test
    void pointer_order_is_numeric_for_indices() {
        List<String> paths = new ArrayList<>(List.of("/a/10", "/a/9", "/a", "/b", "/a/x"));
        paths.sort(TreePaths.POINTER_ORDER);
        assertEquals(List.of("/a", "/a/9", "/a/10", "/a/x", "/b"), paths);
    }

    @Test
    void root_pointer_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> TreePaths.set(Json.emptyObject(), "", Json.emptyObject()));
        assertThrows(IllegalArgumentException.class, () -> TreePaths.remove(Json.emptyObject(), ""));
    }
}
