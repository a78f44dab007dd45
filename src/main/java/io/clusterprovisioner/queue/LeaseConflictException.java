package io.clusterprovisioner.queue;

import io.clusterprovisioner.store.DocumentStoreException;

/**
 * Thrown when a worker lost a dequeue race, or when it no longer holds the
 * lease on a document it is trying to modify.
 */
public class LeaseConflictException extends DocumentStoreException {

    public LeaseConflictException(String message) {
        super(message);
    }

    public LeaseConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
