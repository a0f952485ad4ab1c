package io.graphlite.core.error;

import java.util.List;

/**
 * Schema registry rejected the properties of an object.
 * The write is aborted before any row is persisted.
 */
public class ValidationException extends GraphStoreException {
    private final String type;
    private final List<String> errors;

    public ValidationException(String type, List<String> errors) {
        super("object_schema_validation_failed: type=" + type + " errors=" + errors);
        this.type = type;
        this.errors = List.copyOf(errors);
    }

    public String type() { return type; }

    public List<String> errors() { return errors; }
}
