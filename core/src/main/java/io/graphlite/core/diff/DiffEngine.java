package io.graphlite.core.diff;

import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.graphlite.core.Json;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Structured diff between two property trees.
 * <p>
 * Algorithm:
 *  - Normalize both sides (null / missing -> empty object).
 *  - If content hashes are equal, return an empty summary (no-op).
 *  - Walk both trees together:
 *      - objects: union of field names; one-sided fields are added/removed,
 *        shared fields recurse,
 *      - arrays: positional, extra tail elements are added/removed,
 *      - anything else (including a type change) is a leaf compared by value.
 *  - Containers larger than {@code objectTruncateThreshold} are compared as a
 *    single leaf so huge blobs produce one path instead of thousands.
 *  - Stored values are summarized: long strings and large containers become
 *    {@code {"truncated":true,"hash":...}} stubs.
 *  - If the serialized details still exceed {@code maxChangeSummaryBytes},
 *    they are dropped and only the paths survive.
 * <p>
 * The engine is stateless and thread safe.
 */
public final class DiffEngine {
    private final DiffOptions options;

    public DiffEngine() {
        this(DiffOptions.defaults());
    }

    public DiffEngine(DiffOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    public DiffOptions options() { return options; }

    public String contentHash(JsonNode tree) {
        return ContentHasher.contentHash(tree);
    }

    public ChangeSummary diff(JsonNode before, JsonNode after) {
        JsonNode b = normalize(before);
        JsonNode a = normalize(after);
        int bytesBefore = Json.sizeOf(b);
        int bytesAfter = Json.sizeOf(a);

        if (contentHash(b).equals(contentHash(a))) {
            return new ChangeSummary(Map.of(), List.of(), Map.of(), List.of(),
                    new ChangeSummary.Meta(0, 0, 0, bytesBefore, bytesAfter, false));
        }

        var acc = new Accumulator();
        walk(JsonPointer.empty(), b, a, acc, true);

        var paths = new TreeSet<String>();
        paths.addAll(acc.added.keySet());
        paths.addAll(acc.removed);
        paths.addAll(acc.updated.keySet());

        boolean elided = detailBytes(acc) > options.maxChangeSummaryBytes();
        var meta = new ChangeSummary.Meta(acc.added.size(), acc.removed.size(), acc.updated.size(),
                bytesBefore, bytesAfter, elided);
        if (elided) {
            return new ChangeSummary(null, null, null, new ArrayList<>(paths), meta);
        }
        return new ChangeSummary(acc.added, acc.removed, acc.updated, new ArrayList<>(paths), meta);
    }

    /** Convenience: the sorted list of changed paths only. */
    public List<String> changedPaths(JsonNode before, JsonNode after) {
        return diff(before, after).paths();
    }

    private void walk(JsonPointer path, JsonNode before, JsonNode after, Accumulator acc, boolean root) {
        if (!root && (oversized(before) || oversized(after))) {
            if (!Json.canonicalize(before).equals(Json.canonicalize(after))) {
                acc.updated.put(path.toString(), new ChangeSummary.Update(summarize(before), summarize(after)));
            }
            return;
        }

        if (before.isObject() && after.isObject()) {
            var names = new TreeSet<String>();
            for (Iterator<String> it = before.fieldNames(); it.hasNext(); ) names.add(it.next());
            for (Iterator<String> it = after.fieldNames(); it.hasNext(); ) names.add(it.next());
            for (String name : names) {
                JsonPointer child = path.appendProperty(name);
                JsonNode bv = before.get(name);
                JsonNode av = after.get(name);
                if (bv == null) acc.added.put(child.toString(), summarize(av));
                else if (av == null) acc.removed.add(child.toString());
                else walk(child, bv, av, acc, false);
            }
            return;
        }

        if (before.isArray() && after.isArray()) {
            int common = Math.min(before.size(), after.size());
            for (int i = 0; i < common; i++) {
                walk(path.appendIndex(i), before.get(i), after.get(i), acc, false);
            }
            for (int i = common; i < after.size(); i++) {
                acc.added.put(path.appendIndex(i).toString(), summarize(after.get(i)));
            }
            for (int i = common; i < before.size(); i++) {
                acc.removed.add(path.appendIndex(i).toString());
            }
            return;
        }

        if (!leafEquals(before, after)) {
            acc.updated.put(path.toString(), new ChangeSummary.Update(summarize(before), summarize(after)));
        }
    }

    private boolean leafEquals(JsonNode before, JsonNode after) {
        if (before.isNumber() && after.isNumber()) {
            if (options.floatTolerance() > 0) {
                return Math.abs(before.doubleValue() - after.doubleValue()) <= options.floatTolerance();
            }
            // 1 and 1.0 are the same number.
            return before.decimalValue().compareTo(after.decimalValue()) == 0;
        }
        if (before.isContainerNode() || after.isContainerNode()) {
            return Json.canonicalize(before).equals(Json.canonicalize(after));
        }
        return before.equals(after);
    }

    private boolean oversized(JsonNode node) {
        return node.isContainerNode() && Json.sizeOf(node) > options.objectTruncateThreshold();
    }

    /** Value to store in the summary: verbatim, or a hash stub for oversized values. */
    JsonNode summarize(JsonNode node) {
        if (node.isTextual() && node.textValue().length() > options.stringTruncateThreshold()) {
            return stub(node, node.textValue().length());
        }
        if (node.isContainerNode()) {
            int size = Json.sizeOf(node);
            if (size > options.objectTruncateThreshold()) return stub(node, size);
        }
        return node.deepCopy();
    }

    private static JsonNode stub(JsonNode node, int length) {
        ObjectNode s = JsonNodeFactory.instance.objectNode();
        s.put("truncated", true);
        s.put("hash", ContentHasher.sha256Hex(Json.canonicalBytes(node)));
        s.put("length", length);
        return s;
    }

    private static JsonNode normalize(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return Json.emptyObject();
        return node;
    }

    private static int detailBytes(Accumulator acc) {
        ObjectNode details = JsonNodeFactory.instance.objectNode();
        ObjectNode added = details.putObject("added");
        acc.added.forEach(added::set);
        var removed = details.putArray("removed");
        acc.removed.forEach(removed::add);
        ObjectNode updated = details.putObject("updated");
        acc.updated.forEach((p, u) -> {
            ObjectNode e = updated.putObject(p);
            e.set("from", u.from());
            e.set("to", u.to());
        });
        return Json.sizeOf(details);
    }

    private static final class Accumulator {
        final Map<String, JsonNode> added = new LinkedHashMap<>();
        final List<String> removed = new ArrayList<>();
        final Map<String, ChangeSummary.Update> updated = new LinkedHashMap<>();
    }
}
