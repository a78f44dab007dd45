package io.clusterprovisioner.diagnostics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectWriter;
import io.clusterprovisioner.models.ClusterOperatorStatus;
import io.clusterprovisioner.models.ClusterVersionInfo;
import io.clusterprovisioner.models.DiagnosticsSnapshot;
import io.clusterprovisioner.models.IngressControllerStatus;
import io.clusterprovisioner.models.NodeStatus;
import io.clusterprovisioner.util.JsonUtils;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Gathers a best-effort snapshot of a cluster after a step failed and logs it.
 * <p>
 * The four probes run in parallel on the given executor. All of them share one
 * deadline, the probe timeout from the start of collection, and each fails
 * independently of the others. A probe still running at the deadline is interrupted. Results are logged in a
 * fixed order once all probes finished: clusterVersion, nodes, clusterOperators,
 * ingressControllers. Collection never throws.
 */
@Slf4j
public class DiagnosticsCollector {

    static final String PROBE_CLUSTER_VERSION = "clusterVersion";
    static final String PROBE_NODES = "nodes";
    static final String PROBE_CLUSTER_OPERATORS = "clusterOperators";
    static final String PROBE_INGRESS_CONTROLLERS = "ingressControllers";

    private final ClusterInspector inspector;
    private final Executor executor;
    private final Duration probeTimeout;
    private final ObjectWriter prettyWriter;

    public DiagnosticsCollector(ClusterInspector inspector, Executor executor, Duration probeTimeout) {
        this.inspector = inspector;
        this.executor = executor;
        this.probeTimeout = probeTimeout;
        this.prettyWriter = JsonUtils.newObjectMapper().writerWithDefaultPrettyPrinter();
    }

    public DiagnosticsSnapshot collect() {
        Probe<ClusterVersionInfo> clusterVersion = probe(inspector::getClusterVersion);
        Probe<List<NodeStatus>> nodes = probe(inspector::listNodes);
        Probe<List<ClusterOperatorStatus>> clusterOperators = probe(inspector::listClusterOperators);
        Probe<List<IngressControllerStatus>> ingressControllers = probe(inspector::listIngressControllers);

        // one deadline shared by all probes
        long deadlineNanos = System.nanoTime() + probeTimeout.toNanos();
        DiagnosticsSnapshot snapshot = new DiagnosticsSnapshot();
        snapshot.setClusterVersion(report(PROBE_CLUSTER_VERSION, clusterVersion, deadlineNanos, snapshot));
        snapshot.setNodes(report(PROBE_NODES, nodes, deadlineNanos, snapshot));
        snapshot.setClusterOperators(report(PROBE_CLUSTER_OPERATORS, clusterOperators, deadlineNanos, snapshot));
        snapshot.setIngressControllers(report(PROBE_INGRESS_CONTROLLERS, ingressControllers, deadlineNanos, snapshot));
        return snapshot;
    }

    private <T> Probe<T> probe(Callable<T> call) {
        Probe<T> probe = new Probe<>();
        try {
            probe.future = CompletableFuture.supplyAsync(() -> probe.run(call), executor);
        } catch (RuntimeException e) {
            // executor rejected the probe
            probe.future = CompletableFuture.failedFuture(e);
        }
        return probe;
    }

    /**
     * Wait for one probe until the shared deadline and log its outcome. A failed
     * probe logs the failure at ERROR followed by a null marker at INFO.
     */
    private <T> T report(String name, Probe<T> probe, long deadlineNanos, DiagnosticsSnapshot snapshot) {
        T value;
        String rendered;
        try {
            long remainingNanos = Math.max(0L, deadlineNanos - System.nanoTime());
            value = probe.future.get(remainingNanos, TimeUnit.NANOSECONDS);
            rendered = render(value);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failed(name, "interrupted while waiting for probe", snapshot, probe);
        } catch (TimeoutException e) {
            return failed(name, "timed out after " + probeTimeout.toMillis() + "ms", snapshot, probe);
        } catch (ExecutionException e) {
            return failed(name, describe(e.getCause()), snapshot, probe);
        } catch (JsonProcessingException e) {
            return failed(name, "could not render result: " + e.getOriginalMessage(), snapshot, probe);
        }
        log.info("{}: {}", name, rendered);
        return value;
    }

    private <T> T failed(String name, String reason, DiagnosticsSnapshot snapshot, Probe<T> probe) {
        probe.abort();
        snapshot.getFailures().put(name, reason);
        log.error("failed to collect {}: {}", name, reason);
        log.info("{}: null", name);
        return null;
    }

    private String render(Object value) throws JsonProcessingException {
        if (value == null) {
            return "null";
        }
        if (value instanceof Collection && ((Collection<?>) value).isEmpty()) {
            return "null";
        }
        return prettyWriter.writeValueAsString(value);
    }

    private static String describe(Throwable cause) {
        Throwable root = cause instanceof CompletionException && cause.getCause() != null ? cause.getCause() : cause;
        if (root == null) {
            return "unknown error";
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }

    /**
     * One probe call and the pool thread running it, so a probe that outlives
     * the deadline can be interrupted instead of holding the thread.
     */
    private static final class Probe<T> {
        private CompletableFuture<T> future;
        private Thread runner;
        private boolean aborted;

        private T run(Callable<T> call) {
            synchronized (this) {
                if (aborted) {
                    throw new CancellationException("probe aborted before it started");
                }
                runner = Thread.currentThread();
            }
            try {
                return call.call();
            } catch (Exception e) {
                throw new CompletionException(e);
            } finally {
                synchronized (this) {
                    runner = null;
                }
            }
        }

        private synchronized void abort() {
            aborted = true;
            future.cancel(true);
            if (runner != null) {
                runner.interrupt();
            }
        }
    }
}
