package io.graphlite.core.error;

/**
 * Root of the failures that abort a store operation.
 * <p>
 * Every subclass rolls back the enclosing transaction: nothing staged by the
 * failing operation reaches the log. Merge conflicts are not failures and are
 * never reported through this hierarchy.
 */
public abstract class GraphStoreException extends RuntimeException {

    protected GraphStoreException(String message) {
        super(message);
    }

    protected GraphStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
