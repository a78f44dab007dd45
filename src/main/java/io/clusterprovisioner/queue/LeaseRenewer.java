package io.clusterprovisioner.queue;

import io.clusterprovisioner.store.DocumentNotFoundException;
import io.clusterprovisioner.store.DocumentStoreException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodically extends the lease on one document while its pipeline runs.
 * When the lease turns out to be lost the callback fires once and renewal stops.
 */
@Slf4j
public class LeaseRenewer implements AutoCloseable {

    private final LeaseQueue queue;
    private final String key;
    private final Duration interval;
    private final Runnable onLeaseLost;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean lost = new AtomicBoolean(false);
    private volatile ScheduledFuture<?> renewal;

    public LeaseRenewer(LeaseQueue queue, String key, Duration interval,
                        Runnable onLeaseLost, ScheduledExecutorService scheduler) {
        this.queue = queue;
        this.key = key;
        this.interval = interval;
        this.onLeaseLost = onLeaseLost;
        this.scheduler = scheduler;
    }

    public LeaseRenewer start() {
        long millis = interval.toMillis();
        renewal = scheduler.scheduleAtFixedRate(this::renew, millis, millis, TimeUnit.MILLISECONDS);
        log.debug("Started lease renewal for {} every {}ms", key, millis);
        return this;
    }

    void renew() {
        if (lost.get()) {
            return;
        }
        try {
            queue.renewLease(key);
        } catch (LeaseConflictException | DocumentNotFoundException e) {
            if (lost.compareAndSet(false, true)) {
                log.warn("Lease lost for document {}, cancelling run: {}", key, e.getMessage());
                stopRenewal();
                onLeaseLost.run();
            }
        } catch (DocumentStoreException e) {
            // transient; the next tick retries while the lease has not expired
            log.warn("Failed to renew lease for document {}: {}", key, e.getMessage());
        }
    }

    public boolean isLeaseLost() {
        return lost.get();
    }

    private void stopRenewal() {
        ScheduledFuture<?> current = renewal;
        if (current != null) {
            current.cancel(false);
        }
    }

    @Override
    public void close() {
        stopRenewal();
        log.debug("Stopped lease renewal for {}", key);
    }
}
