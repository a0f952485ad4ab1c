package io.graphlite.graph.merge;

import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Point edits of a property tree addressed by JSON Pointer.
 * <p>
 * Array segments are positional. Setting one past the end appends, further
 * out pads with nulls. Missing intermediate containers are created as objects.
 */
final class TreePaths {

    /** Segment-wise order; numeric segments compare as numbers so "/a/10" sorts after "/a/9". */
    static final Comparator<String> POINTER_ORDER = TreePaths::compare;

    private TreePaths() {}

    static void set(ObjectNode root, String pointer, JsonNode value) {
        List<String> segs = segments(pointer);
        if (segs.isEmpty()) throw new IllegalArgumentException("cannot replace the root object");

        JsonNode parent = root;
        for (int i = 0; i < segs.size() - 1; i++) {
            parent = child(parent, segs.get(i));
        }
        String last = segs.get(segs.size() - 1);
        if (parent.isArray()) {
            ArrayNode arr = (ArrayNode) parent;
            int idx = index(last);
            if (idx >= 0) {
                while (arr.size() < idx) arr.addNull();
                if (idx < arr.size()) arr.set(idx, value);
                else arr.add(value);
                return;
            }
        }
        ((ObjectNode) parent).set(last, value);
    }

    /** Remove the node at the pointer; a missing node is ignored. */
    static void remove(ObjectNode root, String pointer) {
        JsonPointer ptr = JsonPointer.compile(pointer);
        if (ptr.matches()) throw new IllegalArgumentException("cannot remove the root object");
        JsonNode parent = root.at(ptr.head());
        String last = ptr.last().getMatchingProperty();
        if (parent.isObject()) {
            ((ObjectNode) parent).remove(last);
        } else if (parent.isArray()) {
            int idx = index(last);
            if (idx >= 0 && idx < parent.size()) ((ArrayNode) parent).remove(idx);
        }
    }

    /**
     * Step into {@code seg}, creating or replacing the child with an object
     * when it is missing or not a container.
     */
    private static JsonNode child(JsonNode parent, String seg) {
        if (parent.isArray()) {
            ArrayNode arr = (ArrayNode) parent;
            int idx = index(seg);
            if (idx < 0) throw new IllegalArgumentException("non-numeric segment '" + seg + "' into an array");
            while (arr.size() <= idx) arr.addNull();
            JsonNode c = arr.get(idx);
            if (c.isContainerNode()) return c;
            ObjectNode fresh = JsonNodeFactory.instance.objectNode();
            arr.set(idx, fresh);
            return fresh;
        }
        ObjectNode obj = (ObjectNode) parent;
        JsonNode c = obj.get(seg);
        if (c != null && c.isContainerNode()) return c;
        return obj.putObject(seg);
    }

    static List<String> segments(String pointer) {
        List<String> out = new ArrayList<>();
        for (JsonPointer p = JsonPointer.compile(pointer); !p.matches(); p = p.tail()) {
            out.add(p.getMatchingProperty());
        }
        return out;
    }

    private static int index(String seg) {
        if (seg.isEmpty() || seg.length() > 9) return -1;
        for (int i = 0; i < seg.length(); i++) {
            if (!Character.isDigit(seg.charAt(i))) return -1;
        }
        if (seg.length() > 1 && seg.charAt(0) == '0') return -1;
        return Integer.parseInt(seg);
    }

    private static int compare(String a, String b) {
        List<String> sa = segments(a);
        List<String> sb = segments(b);
        for (int i = 0; i < Math.min(sa.size(), sb.size()); i++) {
            String x = sa.get(i);
            String y = sb.get(i);
            int ix = index(x);
            int iy = index(y);
            int c = (ix >= 0 && iy >= 0) ? Integer.compare(ix, iy) : x.compareTo(y);
            if (c != 0) return c;
        }
        return Integer.compare(sa.size(), sb.size());
    }
}
