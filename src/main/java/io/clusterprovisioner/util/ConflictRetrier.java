package io.clusterprovisioner.util;

import io.clusterprovisioner.store.ConcurrencyConflictException;
import io.clusterprovisioner.store.DocumentStoreException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

import static io.clusterprovisioner.config.Constants.CONFLICT_RETRY_BACKOFF_MILLIS;
import static io.clusterprovisioner.config.Constants.CONFLICT_RETRY_MAX_ATTEMPTS;

/**
 * Re-runs a read-modify-write cycle when its conditional write loses to a
 * concurrent writer. Each attempt must re-read the document.
 * Only {@link ConcurrencyConflictException} is retried; the last one is rethrown.
 */
@Slf4j
public class ConflictRetrier {

    private final int maxAttempts;
    private final Duration backoff;

    public ConflictRetrier() {
        this(CONFLICT_RETRY_MAX_ATTEMPTS, Duration.ofMillis(CONFLICT_RETRY_BACKOFF_MILLIS));
    }

    public ConflictRetrier(int maxAttempts, Duration backoff) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
    }

    @FunctionalInterface
    public interface Attempt<T> {
        T run() throws DocumentStoreException;
    }

    public <T> T retryOnConflict(Attempt<T> attempt) throws DocumentStoreException {
        for (int i = 1; ; i++) {
            try {
                return attempt.run();
            } catch (ConcurrencyConflictException e) {
                if (i >= maxAttempts) {
                    log.debug("Giving up after {} conflicting attempts: {}", i, e.getMessage());
                    throw e;
                }
                log.debug("Conflict on attempt {}/{}, retrying: {}", i, maxAttempts, e.getMessage());
                pause(i);
            }
        }
    }

    // linear backoff
    private void pause(int attempt) throws DocumentStoreException {
        long millis = backoff.toMillis() * attempt;
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DocumentStoreException("Interrupted while retrying after conflict", e);
        }
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
