package io.graphlite.core.error;

/** Unknown branch or object reference. */
public class NotFoundException extends GraphStoreException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException branch(String branchId) {
        return new NotFoundException("branch_not_found: " + branchId);
    }

    public static NotFoundException object(String objectId) {
        return new NotFoundException("object_not_found: " + objectId);
    }
}
