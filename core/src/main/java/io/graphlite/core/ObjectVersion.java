package io.graphlite.core;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.graphlite.core.diff.ChangeSummary;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Immutable row describing one version of a canonical object on one branch.
 * <p>
 * Fields:
 *  - canonicalId:   logical identity shared by every version of the object.
 *  - version:       monotonic per canonicalId across all branches.
 *  - supersedesId:  predecessor version (may live on an ancestor branch), null for v1.
 *  - contentHash:   hex SHA-256 of the canonical properties tree.
 *  - changeSummary: path-addressed diff against the predecessor, computed at write time.
 *  - deletedAt:     non-null on tombstone versions.
 * <p>
 * Invariants:
 *  - A row is never mutated; changes insert version N+1.
 *  - The properties tree is copied on input and output.
 *  - Labels are kept sorted and de-duplicated.
 */
@JsonAutoDetect(
        fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public final class ObjectVersion {
    private final String id;
    private final String canonicalId;
    private final String branchId;
    private final String organizationId;
    private final String projectId;
    private final String type;
    private final String key;
    private final ObjectNode properties;
    private final List<String> labels;
    private final long version;
    private final String supersedesId;
    private final String contentHash;
    private final ChangeSummary changeSummary;
    private final Instant createdAt;
    private final Instant deletedAt;

    @JsonCreator
    public ObjectVersion(
            @JsonProperty("id") String id,
            @JsonProperty("canonicalId") String canonicalId,
            @JsonProperty("branchId") String branchId,
            @JsonProperty("organizationId") String organizationId,
            @JsonProperty("projectId") String projectId,
            @JsonProperty("type") String type,
            @JsonProperty("key") String key,
            @JsonProperty("properties") ObjectNode properties,
            @JsonProperty("labels") List<String> labels,
            @JsonProperty("version") long version,
            @JsonProperty("supersedesId") String supersedesId,
            @JsonProperty("contentHash") String contentHash,
            @JsonProperty("changeSummary") ChangeSummary changeSummary,
            @JsonProperty("createdAt") Instant createdAt,
            @JsonProperty("deletedAt") Instant deletedAt
    ) {
        this.id = Objects.requireNonNull(id, "id");
        this.canonicalId = Objects.requireNonNull(canonicalId, "canonicalId");
        this.branchId = Objects.requireNonNull(branchId, "branchId");
        this.organizationId = organizationId;
        this.projectId = projectId;
        this.type = Objects.requireNonNull(type, "type");
        this.key = key;
        this.properties = Json.copyProperties(properties);
        this.labels = labels == null ? List.of() : List.copyOf(new TreeSet<>(labels));
        if (version < 1) throw new IllegalArgumentException("version must be >= 1");
        this.version = version;
        this.supersedesId = supersedesId;
        this.contentHash = Objects.requireNonNull(contentHash, "contentHash");
        this.changeSummary = changeSummary == null ? ChangeSummary.empty() : changeSummary;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.deletedAt = deletedAt;
    }

    public String id() { return id; }

    public String canonicalId() { return canonicalId; }

    public String branchId() { return branchId; }

    public String organizationId() { return organizationId; }

    public String projectId() { return projectId; }

    public String type() { return type; }

    public String key() { return key; }

    /** Deep copy; mutate freely. */
    public ObjectNode properties() { return properties.deepCopy(); }

    public List<String> labels() { return labels; }

    public long version() { return version; }

    public String supersedesId() { return supersedesId; }

    public String contentHash() { return contentHash; }

    public ChangeSummary changeSummary() { return changeSummary; }

    public Instant createdAt() { return createdAt; }

    public Instant deletedAt() { return deletedAt; }

    public boolean deleted() { return deletedAt != null; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ObjectVersion)) return false;
        return id.equals(((ObjectVersion) o).id);
    }

    @Override
    public int hashCode() { return id.hashCode(); }

    @Override
    public String toString() {
        return "ObjectVersion{" + type + "/" + key + " v" + version + " @" + branchId
                + (deleted() ? " deleted" : "") + ", id=" + id + "}";
    }
}
