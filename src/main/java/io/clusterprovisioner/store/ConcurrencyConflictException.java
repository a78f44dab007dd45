package io.clusterprovisioner.store;

/**
 * Thrown when a conditional write presents a stale concurrency token,
 * or when a create finds the key already taken.
 */
public class ConcurrencyConflictException extends DocumentStoreException {

    public ConcurrencyConflictException(String message) {
        super(message);
    }
}
