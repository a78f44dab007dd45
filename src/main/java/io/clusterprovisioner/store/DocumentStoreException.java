package io.clusterprovisioner.store;

/**
 * Base exception for document store failures (I/O, serialization, timeouts).
 */
public class DocumentStoreException extends Exception {

    public DocumentStoreException(String message) {
        super(message);
    }

    public DocumentStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
