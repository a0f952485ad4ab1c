package io.graphlite.core.diff;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Path-addressed difference between two property trees.
 * <p>
 * Paths are RFC 6901 JSON Pointers ("/title", "/tags/0", "/a~1b").
 * {@code paths} is always present; {@code added}, {@code removed} and
 * {@code updated} are null when the details were elided to respect the
 * configured size cap.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChangeSummary(
        Map<String, JsonNode> added,
        List<String> removed,
        Map<String, Update> updated,
        List<String> paths,
        Meta meta
) {
    private static final ChangeSummary EMPTY = new ChangeSummary(Map.of(), List.of(), Map.of(), List.of(),
            new Meta(0, 0, 0, 0, 0, false));

    public ChangeSummary {
        added = added == null ? null : Collections.unmodifiableMap(new TreeMap<>(added));
        removed = removed == null ? null : List.copyOf(removed);
        updated = updated == null ? null : Collections.unmodifiableMap(new TreeMap<>(updated));
        paths = paths == null ? List.of() : List.copyOf(new TreeSet<>(paths));
        meta = meta == null ? EMPTY.meta : meta;
    }

    /** Old and new value of an updated leaf. Either side may be a truncation stub. */
    public record Update(JsonNode from, JsonNode to) {}

    /** Counters and sizes; {@code elided} means details were dropped. */
    public record Meta(int added, int removed, int updated, int bytesBefore, int bytesAfter, boolean elided) {}

    public static ChangeSummary empty() { return EMPTY; }

    /** True when nothing changed. */
    @JsonIgnore
    public boolean isNoOp() { return paths.isEmpty(); }

    public boolean overlaps(ChangeSummary other) {
        return other != null && overlaps(paths, other.paths);
    }

    /**
     * Two path sets overlap if they share a path or one path is an ancestor
     * of the other ("/a" overlaps "/a/b" but not "/ab").
     */
    public static boolean overlaps(Collection<String> left, Collection<String> right) {
        return !overlappingPaths(left, right).isEmpty();
    }

    /** Paths from either side that collide with some path on the other side. */
    public static List<String> overlappingPaths(Collection<String> left, Collection<String> right) {
        if (left == null || right == null || left.isEmpty() || right.isEmpty()) return List.of();
        var out = new TreeSet<String>();
        for (String l : left) {
            for (String r : right) {
                if (related(l, r)) {
                    out.add(l);
                    out.add(r);
                }
            }
        }
        return new ArrayList<>(out);
    }

    static boolean related(String a, String b) {
        return a.equals(b) || isAncestor(a, b) || isAncestor(b, a);
    }

    // Escaped segments never contain a raw '/', so a '/'-terminated prefix is a segment prefix.
    private static boolean isAncestor(String ancestor, String path) {
        return ancestor.isEmpty() || path.startsWith(ancestor + "/");
    }
}
