package io.graphlite.graph;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.graphlite.core.Json;

import java.util.List;
import java.util.Objects;

/**
 * Create a new canonical object at version 1.
 * {@code key} is optional; keyless objects never collide.
 */
public record WriteRequest(
        String organizationId,
        String projectId,
        String branchId,
        String type,
        String key,
        ObjectNode properties,
        List<String> labels
) {
    public WriteRequest {
        Objects.requireNonNull(projectId, "projectId");
        Objects.requireNonNull(branchId, "branchId");
        Objects.requireNonNull(type, "type");
        if (type.isBlank()) throw new IllegalArgumentException("type must not be blank");
        properties = Json.copyProperties(properties);
        labels = labels == null ? List.of() : List.copyOf(labels);
    }
}
