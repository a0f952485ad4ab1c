package io.graphlite.storage;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import io.graphlite.core.Branch;
import io.graphlite.core.LineageEdge;
import io.graphlite.core.ObjectVersion;
import io.graphlite.core.ProvenanceEdge;

import java.util.List;
import java.util.Objects;

/**
 * One row appended to one of the four record sets.
 * <p>
 * Every mutation is an insert: versions, branches (with their lineage closure)
 * and provenance edges are never updated or removed once committed.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Mutation.PutVersion.class, name = "version"),
        @JsonSubTypes.Type(value = Mutation.PutBranch.class, name = "branch"),
        @JsonSubTypes.Type(value = Mutation.PutProvenance.class, name = "provenance")
})
public interface Mutation {

    record PutVersion(ObjectVersion version) implements Mutation {
        public PutVersion {
            Objects.requireNonNull(version, "version");
        }
    }

    record PutBranch(Branch branch, List<LineageEdge> lineage) implements Mutation {
        public PutBranch {
            Objects.requireNonNull(branch, "branch");
            lineage = List.copyOf(lineage);
        }
    }

    record PutProvenance(ProvenanceEdge edge) implements Mutation {
        public PutProvenance {
            Objects.requireNonNull(edge, "edge");
        }
    }
}
