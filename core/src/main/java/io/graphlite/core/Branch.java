package io.graphlite.core;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.Objects;

/**
 * A named line of development inside a project.
 * A root branch has no parent.
 */
public record Branch(
        String id,
        String name,
        String organizationId,
        String projectId,
        String parentBranchId,
        Instant createdAt
) {
    public Branch {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(createdAt, "createdAt");
        if (name.isBlank()) throw new IllegalArgumentException("name must not be blank");
    }

    @JsonIgnore
    public boolean isRoot() { return parentBranchId == null; }
}
