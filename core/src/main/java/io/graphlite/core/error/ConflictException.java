package io.graphlite.core.error;

/**
 * Optimistic-concurrency violation or duplicate identity.
 * <p>
 * Raised when:
 *  - a patch targets a version that is no longer the visible head,
 *  - a create reuses a (type, key) that is already live on the branch,
 *  - a delete/restore finds the object in the wrong state,
 *  - a branch name is already taken in the project.
 */
public class ConflictException extends GraphStoreException {

    public ConflictException(String message) {
        super(message);
    }
}
