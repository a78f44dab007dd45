package io.clusterprovisioner.store;

/**
 * Thrown when a document is absent, or when a dequeue finds nothing eligible.
 */
public class DocumentNotFoundException extends DocumentStoreException {

    public DocumentNotFoundException(String message) {
        super(message);
    }
}
