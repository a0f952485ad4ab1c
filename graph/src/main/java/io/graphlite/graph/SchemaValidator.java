package io.graphlite.graph;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Hook into the schema registry. Called with the final properties of every
 * version about to be written (creates, patches, merged versions).
 */
@FunctionalInterface
public interface SchemaValidator {

    /** Accepts everything. */
    SchemaValidator NONE = (type, properties) -> List.of();

    /**
     * @return validation errors; empty when the properties are acceptable
     */
    List<String> validate(String type, ObjectNode properties);
}
