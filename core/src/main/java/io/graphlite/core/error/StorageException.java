package io.graphlite.core.error;

/** I/O failure of the record log or the snapshot files. */
public class StorageException extends GraphStoreException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    public StorageException(String message) {
        super(message);
    }
}
