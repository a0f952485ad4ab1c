package io.graphlite.graph;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.graphlite.core.Json;

import java.util.List;

/**
 * Shallow update of an object.
 *
 * @param properties    top-level keys replace the current ones; a JSON null removes the key
 * @param labels        unioned with the current labels, or replacing them when {@code replaceLabels}
 * @param replaceLabels see {@code labels}
 */
public record PatchRequest(ObjectNode properties, List<String> labels, boolean replaceLabels) {
    public PatchRequest {
        properties = Json.copyProperties(properties);
        labels = labels == null ? List.of() : List.copyOf(labels);
    }

    public static PatchRequest of(ObjectNode properties) {
        return new PatchRequest(properties, List.of(), false);
    }
}
