package io.graphlite.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Shared Jackson plumbing for property trees.
 * <p>
 * Property trees are plain Jackson {@link ObjectNode}s. Two trees with the same
 * fields in a different insertion order are the same content, so anything that
 * hashes or measures a tree goes through {@link #canonicalize(JsonNode)} first.
 */
public final class Json {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private Json() {
        // utility
    }

    public static ObjectMapper mapper() { return MAPPER; }

    public static ObjectNode emptyObject() { return JsonNodeFactory.instance.objectNode(); }

    /**
     * Normalize a properties tree: null / missing become an empty object,
     * anything else is deep-copied so callers can never alias stored state.
     */
    public static ObjectNode copyProperties(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return emptyObject();
        if (!node.isObject())
            throw new IllegalArgumentException("properties must be a JSON object, got " + node.getNodeType());
        return ((ObjectNode) node).deepCopy();
    }

    /** Deep copy with object fields sorted by name at every level. */
    public static JsonNode canonicalize(JsonNode node) {
        if (node == null) return JsonNodeFactory.instance.nullNode();
        if (node.isObject()) {
            List<String> names = new ArrayList<>();
            for (Iterator<String> it = node.fieldNames(); it.hasNext(); ) names.add(it.next());
            names.sort(null);
            ObjectNode out = JsonNodeFactory.instance.objectNode();
            for (String name : names) out.set(name, canonicalize(node.get(name)));
            return out;
        }
        if (node.isArray()) {
            ArrayNode out = JsonNodeFactory.instance.arrayNode(node.size());
            for (JsonNode child : node) out.add(canonicalize(child));
            return out;
        }
        if (node.isNumber()) return canonicalNumber(node);
        return node;
    }

    /** 1, 1.0 and 1.00 share one form, matching how the diff compares numbers. */
    private static JsonNode canonicalNumber(JsonNode node) {
        if (node.isFloatingPointNumber() && !Double.isFinite(node.doubleValue())) return node;
        return JsonNodeFactory.instance.numberNode(node.decimalValue().stripTrailingZeros());
    }

    /** UTF-8 bytes of the canonical form. Stable across field insertion order. */
    public static byte[] canonicalBytes(JsonNode node) {
        try {
            return MAPPER.writeValueAsBytes(canonicalize(node));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize property tree", e);
        }
    }

    /** Serialized size in bytes, used for truncation and summary caps. */
    public static int sizeOf(JsonNode node) {
        return canonicalBytes(node).length;
    }
}
