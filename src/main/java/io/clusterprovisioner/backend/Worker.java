package io.clusterprovisioner.backend;

import io.clusterprovisioner.diagnostics.ClusterInspector;
import io.clusterprovisioner.diagnostics.DiagnosticsCollector;
import io.clusterprovisioner.enums.ProvisioningState;
import io.clusterprovisioner.models.ClusterDocument;
import io.clusterprovisioner.models.ClusterProperties;
import io.clusterprovisioner.queue.LeaseConflictException;
import io.clusterprovisioner.queue.LeaseQueue;
import io.clusterprovisioner.queue.LeaseRenewer;
import io.clusterprovisioner.steps.RunContext;
import io.clusterprovisioner.steps.Step;
import io.clusterprovisioner.steps.StepRunner;
import io.clusterprovisioner.store.DocumentNotFoundException;
import io.clusterprovisioner.store.DocumentStoreException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Claims cluster documents one at a time and drives each through its pipeline.
 * <p>
 * {@link #stop()} keeps the worker from claiming more documents but lets a
 * running pipeline finish; {@link #cancelInFlight()} cancels that pipeline.
 */
@Slf4j
public class Worker implements Runnable {

    static final String MDC_CLUSTER_KEY = "clusterKey";

    @Getter
    private final String name;
    private final BackendContext context;
    private final LeaseQueue queue;
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private volatile RunContext inFlight;

    public Worker(String name, BackendContext context) {
        this.name = name;
        this.context = context;
        this.queue = context.getQueue();
    }

    @Override
    public void run() {
        log.info("Worker {} started", name);
        while (!isStopping()) {
            try {
                ClusterDocument document = queue.dequeue();
                handle(document);
            } catch (LeaseConflictException e) {
                log.debug("Worker {} lost a dequeue race: {}", name, e.getMessage());
            } catch (DocumentNotFoundException e) {
                awaitPollInterval();
            } catch (DocumentStoreException e) {
                log.warn("Worker {} failed to dequeue: {}", name, e.getMessage());
                awaitPollInterval();
            } catch (RuntimeException e) {
                log.error("Worker {} hit an unexpected error", name, e);
                awaitPollInterval();
            }
        }
        log.info("Worker {} stopped", name);
    }

    public void stop() {
        stopSignal.countDown();
    }

    public boolean isStopping() {
        return stopSignal.getCount() == 0;
    }

    /**
     * Cancel the pipeline currently running on this worker, if any.
     */
    public void cancelInFlight() {
        RunContext current = inFlight;
        if (current != null) {
            log.warn("Worker {} cancelling in-flight run", name);
            current.cancel("worker shutting down");
        }
    }

    private void awaitPollInterval() {
        try {
            stopSignal.await(context.getPollInterval().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Worker {} interrupted, stopping", name);
            stop();
        }
    }

    // =================================================================
    // DOCUMENT PROCESSING
    // =================================================================

    void handle(ClusterDocument document) {
        String key = document.getKey();
        MDC.put(MDC_CLUSTER_KEY, key);
        try {
            process(document);
        } catch (Exception e) {
            log.error("Unexpected error processing document {}: {}", key, e.getMessage(), e);
            releaseAfterError(key);
        } finally {
            MDC.remove(MDC_CLUSTER_KEY);
        }
    }

    private void process(ClusterDocument document) throws Exception {
        String key = document.getKey();
        ProvisioningState state = document.provisioningState();

        if (document.getDequeues() > context.getMaxDequeueCount()) {
            String message = "dequeued " + document.getDequeues() + " times, failing";
            log.warn("Document {} {}", key, message);
            queue.patchWithLease(key, doc -> markFailed(doc.getCluster().getProperties(), state, message));
            queue.release(key);
            return;
        }

        ClusterInspector inspector = context.getInspectorFactory().forCluster(document.getCluster());
        ClusterManager manager = new ClusterManager(queue, document, context.getCloudClient(), inspector, context.getBuildInfo());
        List<Step> steps = context.getPipelineFactory().buildPipeline(state, manager);
        DiagnosticsCollector diagnostics = new DiagnosticsCollector(inspector, context.getDiagnosticsExecutor(), context.getProbeTimeout());
        StepRunner runner = new StepRunner(diagnostics, context.getMetricsEmitter(), context.getClock());

        RunContext run = RunContext.background(context.getClock());
        Exception failure = null;
        boolean leaseLost;
        inFlight = run;
        try (LeaseRenewer renewer = new LeaseRenewer(queue, key, context.getLeaseRenewInterval(),
                () -> run.cancel("lease lost"), context.getLeaseRenewScheduler()).start()) {
            log.info("Processing document {} in state {} ({} steps)", key, state, steps.size());
            try {
                runner.run(run, steps);
            } catch (Exception e) {
                failure = e;
            }
            leaseLost = renewer.isLeaseLost();
        } finally {
            inFlight = null;
        }

        if (leaseLost) {
            log.warn("Lease on document {} was lost during the run, leaving it to the new owner", key);
            return;
        }
        boolean interrupted = failure instanceof InterruptedException;
        try {
            if ((failure instanceof CancellationException || interrupted) && (isStopping() || run.isCancelled())) {
                log.warn("Run of document {} cancelled by shutdown, releasing it for another worker", key);
                queue.release(key);
                return;
            }

            if (failure == null) {
                complete(key, state);
            } else {
                String message = failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
                queue.patchWithLease(key, doc -> markFailed(doc.getCluster().getProperties(), state, message));
                log.info("Document {} failed in state {}: {}", key, state, message);
            }
            queue.release(key);
        } finally {
            // restored only after the store calls, which would fail on a set flag
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void complete(String key, ProvisioningState state) throws DocumentStoreException {
        if (state == ProvisioningState.DELETING) {
            queue.deleteWithLease(key);
            log.info("✓ Document {} deleted", key);
            return;
        }
        queue.patchWithLease(key, doc -> {
            ClusterProperties properties = doc.getCluster().getProperties();
            properties.setProvisioningState(ProvisioningState.SUCCEEDED);
            properties.setFailedProvisioningState(null);
            properties.setLastError(null);
            doc.setDequeues(0);
        });
        log.info("✓ Document {} succeeded after {}", key, state);
    }

    private static void markFailed(ClusterProperties properties, ProvisioningState state, String message) {
        properties.setProvisioningState(ProvisioningState.FAILED);
        properties.setFailedProvisioningState(state);
        properties.setLastError(message);
    }

    private void releaseAfterError(String key) {
        try {
            queue.release(key, context.getRetryBackoff());
        } catch (DocumentStoreException e) {
            // the lease expires on its own
            log.error("Failed to release document {} after error: {}", key, e.getMessage());
        }
    }
}
