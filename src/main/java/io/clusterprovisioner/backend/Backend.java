package io.clusterprovisioner.backend;

import io.clusterprovisioner.config.ProvisionerConfig;
import io.clusterprovisioner.diagnostics.ClusterInspectorFactory;
import io.clusterprovisioner.metrics.MetricsEmitter;
import io.clusterprovisioner.queue.LeaseQueue;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the pool of workers of this process.
 * <p>
 * Shutdown order:
 * 1. Stop all workers (no new dequeues, in-flight runs continue)
 * 2. Wait up to the shutdown timeout for in-flight runs
 * 3. Cancel whatever is still running and force termination
 * 4. Stop the lease renewal and diagnostics executors
 */
@Slf4j
@Component
public class Backend {

    private static final int DIAGNOSTICS_POOL_SIZE = 4;
    private static final int RENEW_POOL_SIZE = 2;
    private static final int FORCED_SHUTDOWN_WAIT_SECONDS = 5;

    private final BackendContext context;
    private final int workerCount;
    private final Duration shutdownTimeout;

    private final ExecutorService workerPool;
    private final ScheduledExecutorService leaseRenewScheduler;
    private final ExecutorService diagnosticsExecutor;
    private final List<Worker> workers = Collections.synchronizedList(new ArrayList<>());

    @Autowired
    public Backend(
            LeaseQueue queue,
            PipelineFactory pipelineFactory,
            CloudResourceClient cloudClient,
            ClusterInspectorFactory inspectorFactory,
            MetricsEmitter metricsEmitter,
            BuildInfo buildInfo,
            Clock clock,
            ProvisionerConfig config) {

        this.workerCount = config.getWorkerCount();
        this.shutdownTimeout = Duration.ofSeconds(config.getShutdownTimeoutSeconds());

        this.workerPool = Executors.newFixedThreadPool(workerCount, namedThreadFactory("backend-worker-", false));
        this.leaseRenewScheduler = Executors.newScheduledThreadPool(RENEW_POOL_SIZE, namedThreadFactory("lease-renewer-", true));
        this.diagnosticsExecutor = Executors.newFixedThreadPool(DIAGNOSTICS_POOL_SIZE, namedThreadFactory("diagnostics-", true));

        this.context = BackendContext.builder()
            .queue(queue)
            .pipelineFactory(pipelineFactory)
            .cloudClient(cloudClient)
            .inspectorFactory(inspectorFactory)
            .metricsEmitter(metricsEmitter)
            .buildInfo(buildInfo)
            .clock(clock)
            .leaseRenewScheduler(leaseRenewScheduler)
            .diagnosticsExecutor(diagnosticsExecutor)
            .pollInterval(Duration.ofMillis(config.getPollIntervalMillis()))
            .leaseRenewInterval(Duration.ofSeconds(config.getLeaseRenewIntervalSeconds()))
            .maxDequeueCount(config.getMaxDequeueCount())
            .retryBackoff(Duration.ofSeconds(config.getRetryBackoffSeconds()))
            .probeTimeout(Duration.ofSeconds(config.getProbeTimeoutSeconds()))
            .build();

        log.info("Backend initialized: owner={}, workers={}", queue.getOwner(), workerCount);
    }

    @PostConstruct
    public void start() {
        log.info("========================================");
        log.info("Starting Backend with {} worker(s)", workerCount);
        log.info("========================================");

        for (int i = 0; i < workerCount; i++) {
            Worker worker = new Worker("worker-" + i, context);
            workers.add(worker);
            workerPool.execute(worker);
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("========================================");
        log.info("Shutting down Backend");
        log.info("========================================");

        try {
            // Step 1: no worker claims another document from here on
            workers.forEach(Worker::stop);
            workerPool.shutdown();

            // Step 2: let in-flight pipelines finish
            if (!workerPool.awaitTermination(shutdownTimeout.toSeconds(), TimeUnit.SECONDS)) {
                // Step 3: cancel what is left
                log.warn("Workers did not finish within {}s, cancelling in-flight runs", shutdownTimeout.toSeconds());
                workers.forEach(Worker::cancelInFlight);
                workerPool.shutdownNow();
                if (!workerPool.awaitTermination(FORCED_SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                    log.error("Workers did not terminate after cancellation");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while waiting for workers, forcing shutdown");
            workers.forEach(Worker::cancelInFlight);
            workerPool.shutdownNow();
        } finally {
            // Step 4
            leaseRenewScheduler.shutdownNow();
            diagnosticsExecutor.shutdownNow();
        }

        log.info("✓ Backend shutdown complete");
    }

    List<Worker> getWorkers() {
        return new ArrayList<>(workers);
    }

    BackendContext getContext() {
        return context;
    }

    private static ThreadFactory namedThreadFactory(String prefix, boolean daemon) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r);
            t.setName(prefix + counter.getAndIncrement());
            t.setDaemon(daemon);
            return t;
        };
    }
}
