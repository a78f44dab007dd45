package io.clusterprovisioner.backend;

import io.clusterprovisioner.diagnostics.ClusterInspectorFactory;
import io.clusterprovisioner.metrics.MetricsEmitter;
import io.clusterprovisioner.queue.LeaseQueue;
import lombok.Builder;
import lombok.Getter;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Shared collaborators and settings handed to every worker of one process.
 * Cluster-specific state lives in the {@link ClusterManager} built per run.
 */
@Getter
@Builder
public class BackendContext {

    private final LeaseQueue queue;
    private final PipelineFactory pipelineFactory;
    private final CloudResourceClient cloudClient;
    private final ClusterInspectorFactory inspectorFactory;
    private final MetricsEmitter metricsEmitter;
    private final BuildInfo buildInfo;
    private final Clock clock;
    private final ScheduledExecutorService leaseRenewScheduler;
    private final Executor diagnosticsExecutor;

    private final Duration pollInterval;
    private final Duration leaseRenewInterval;
    private final int maxDequeueCount;
    private final Duration retryBackoff;
    private final Duration probeTimeout;
}
