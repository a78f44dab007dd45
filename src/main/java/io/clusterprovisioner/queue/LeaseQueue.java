package io.clusterprovisioner.queue;

import io.clusterprovisioner.models.ClusterDocument;
import io.clusterprovisioner.store.ConcurrencyConflictException;
import io.clusterprovisioner.store.DocumentNotFoundException;
import io.clusterprovisioner.store.DocumentStore;
import io.clusterprovisioner.store.DocumentStoreException;
import io.clusterprovisioner.util.ConflictRetrier;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Work queue over the document store. A document is claimed by writing a
 * lease (owner + expiry) into it under the store's compare-and-swap, so no
 * separate lock service is needed. Leases expire on their own; a crashed
 * worker's documents become eligible again once the expiry passes.
 */
@Slf4j
public class LeaseQueue {

    private static final Comparator<ClusterDocument> DEQUEUE_ORDER =
        Comparator.comparingInt(ClusterDocument::getDequeues)
            .thenComparing(ClusterDocument::getKey);

    private final DocumentStore store;
    @Getter
    private final String owner;
    @Getter
    private final Duration leaseTtl;
    private final Clock clock;
    private final ConflictRetrier retrier;

    public LeaseQueue(DocumentStore store, String owner, Duration leaseTtl, Clock clock, ConflictRetrier retrier) {
        if (owner == null || owner.isBlank()) {
            throw new IllegalArgumentException("lease owner must not be blank");
        }
        this.store = store;
        this.owner = owner;
        this.leaseTtl = leaseTtl;
        this.clock = clock;
        this.retrier = retrier;
        log.info("LeaseQueue initialized (owner: {}, lease ttl: {}s)", owner, leaseTtl.toSeconds());
    }

    // =================================================================
    // CLAIMING
    // =================================================================

    /**
     * Claim one eligible document.
     *
     * @return the claimed document, leased to this owner, with its new token
     * @throws DocumentNotFoundException if no document is eligible
     * @throws LeaseConflictException if another worker claimed the chosen document first
     */
    public ClusterDocument dequeue() throws DocumentStoreException {
        Instant now = clock.instant();
        List<ClusterDocument> candidates = store.list().stream()
            .filter(document -> isEligible(document, now))
            .sorted(DEQUEUE_ORDER)
            .collect(Collectors.toList());

        if (candidates.isEmpty()) {
            throw new DocumentNotFoundException("No eligible documents");
        }

        ClusterDocument document = candidates.get(0);
        if (document.getLeaseOwner() != null) {
            log.info("Reclaiming document {} from expired lease of {}", document.getKey(), document.getLeaseOwner());
        }
        document.setLeaseOwner(owner);
        document.setLeaseExpiry(now.plus(leaseTtl));
        document.setDequeues(document.getDequeues() + 1);

        try {
            ClusterDocument claimed = store.write(document);
            log.info("Dequeued document {} (dequeues: {})", claimed.getKey(), claimed.getDequeues());
            return claimed;
        } catch (ConcurrencyConflictException | DocumentNotFoundException e) {
            throw new LeaseConflictException("Lost dequeue race for document " + document.getKey(), e);
        }
    }

    /**
     * Not terminal, not under a live lease, and past any retry-after instant.
     */
    boolean isEligible(ClusterDocument document, Instant now) {
        if (document.provisioningState() == null || document.provisioningState().isTerminal()) {
            return false;
        }
        if (document.isLeaseLive(now)) {
            return false;
        }
        return document.getRetryAfter() == null || !document.getRetryAfter().isAfter(now);
    }

    // =================================================================
    // READS AND LEASED WRITES
    // =================================================================

    public ClusterDocument get(String key) throws DocumentStoreException {
        return store.get(key);
    }

    /**
     * Conditional write of a document this owner holds the lease on.
     */
    public ClusterDocument write(ClusterDocument document) throws DocumentStoreException {
        requireLease(document);
        try {
            return store.write(document);
        } catch (DocumentNotFoundException e) {
            throw new LeaseConflictException("Document " + document.getKey() + " disappeared while leased", e);
        }
    }

    /**
     * Read, check the lease, mutate and write, re-reading on conflicting writes.
     *
     * @throws LeaseConflictException if this owner no longer holds a live lease
     */
    public ClusterDocument patchWithLease(String key, DocumentMutator mutator) throws DocumentStoreException {
        return retrier.retryOnConflict(() -> {
            ClusterDocument document = readLeased(key);
            mutator.mutate(document);
            return store.write(document);
        });
    }

    public ClusterDocument renewLease(String key) throws DocumentStoreException {
        ClusterDocument renewed = patchWithLease(key, document -> document.setLeaseExpiry(clock.instant().plus(leaseTtl)));
        log.debug("Renewed lease on {} until {}", renewed.getKey(), renewed.getLeaseExpiry());
        return renewed;
    }

    // =================================================================
    // RELEASE AND DELETE
    // =================================================================

    public void release(String key) throws DocumentStoreException {
        release(key, null);
    }

    /**
     * Clear this owner's lease. With a retry delay the document is held back
     * from dequeue until the delay has passed. Does nothing when another
     * owner holds the lease or the document is gone.
     */
    public void release(String key, Duration retryDelay) throws DocumentStoreException {
        retrier.retryOnConflict(() -> {
            ClusterDocument document;
            try {
                document = store.get(key);
            } catch (DocumentNotFoundException e) {
                log.debug("Document {} already gone, nothing to release", key);
                return null;
            }
            if (!owner.equals(document.getLeaseOwner())) {
                log.warn("Not releasing document {}: lease is held by {}", key, document.getLeaseOwner());
                return null;
            }
            document.setLeaseOwner(null);
            document.setLeaseExpiry(null);
            document.setRetryAfter(retryDelay != null ? clock.instant().plus(retryDelay) : null);
            store.write(document);
            log.info("Released document {}{}", key, retryDelay != null ? " (retry after " + retryDelay.toSeconds() + "s)" : "");
            return null;
        });
    }

    /**
     * Conditional delete of a document this owner holds the lease on.
     */
    public void deleteWithLease(String key) throws DocumentStoreException {
        retrier.retryOnConflict(() -> {
            ClusterDocument document = readLeased(key);
            store.delete(document);
            log.info("Deleted document {}", key);
            return null;
        });
    }

    // =================================================================
    // HELPERS
    // =================================================================

    private ClusterDocument readLeased(String key) throws DocumentStoreException {
        ClusterDocument document;
        try {
            document = store.get(key);
        } catch (DocumentNotFoundException e) {
            throw new LeaseConflictException("Document " + key + " disappeared while leased", e);
        }
        requireLease(document);
        return document;
    }

    private void requireLease(ClusterDocument document) throws LeaseConflictException {
        if (!document.isLeasedBy(owner, clock.instant())) {
            throw new LeaseConflictException("Lease on document " + document.getKey() + " is not held by " + owner
                + " (owner: " + document.getLeaseOwner() + ", expiry: " + document.getLeaseExpiry() + ")");
        }
    }
}
