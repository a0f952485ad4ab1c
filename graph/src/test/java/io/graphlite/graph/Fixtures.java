package io.graphlite.graph;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.graphlite.core.Json;

import java.util.List;

/** Shorthands for building requests in tests. */
public final class Fixtures {
    public static final String ORG = "org-1";
    public static final String PROJECT = "proj-1";

    private Fixtures() {}

    /** {@code props("title", "A", "body", "x")} */
    public static ObjectNode props(Object... kv) {
        ObjectNode n = Json.emptyObject();
        for (int i = 0; i < kv.length; i += 2) {
            String k = (String) kv[i];
            Object v = kv[i + 1];
            if (v == null) n.putNull(k);
            else if (v instanceof Integer) n.put(k, (Integer) v);
            else if (v instanceof Double) n.put(k, (Double) v);
            else if (v instanceof Boolean) n.put(k, (Boolean) v);
            else if (v instanceof ObjectNode) n.set(k, (ObjectNode) v);
            else n.put(k, v.toString());
        }
        return n;
    }

    public static WriteRequest doc(String branchId, String key, ObjectNode properties, String... labels) {
        return new WriteRequest(ORG, PROJECT, branchId, "Doc", key, properties, List.of(labels));
    }
}
