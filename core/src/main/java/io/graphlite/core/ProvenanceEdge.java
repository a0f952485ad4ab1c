package io.graphlite.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Audit link explaining that {@code parentVersionId} contributed to the merged
 * version {@code childVersionId}. Append-only; unique on (child, parent, role).
 */
public record ProvenanceEdge(
        String childVersionId,
        String parentVersionId,
        ProvenanceRole role,
        Instant createdAt
) {
    public ProvenanceEdge {
        Objects.requireNonNull(childVersionId, "childVersionId");
        Objects.requireNonNull(parentVersionId, "parentVersionId");
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(createdAt, "createdAt");
    }
}
