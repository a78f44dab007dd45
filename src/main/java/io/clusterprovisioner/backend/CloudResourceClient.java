package io.clusterprovisioner.backend;

import io.clusterprovisioner.models.ManagedCluster;
import io.clusterprovisioner.steps.RunContext;

/**
 * Cloud-side operations invoked by pipeline steps. Every operation must be
 * idempotent: a rerun after a partial failure converges on the same result.
 * <p>
 * Long-running operations must watch {@code ctx} and stop with a
 * {@link java.util.concurrent.CancellationException} once it is cancelled,
 * which happens on lease loss and on forced shutdown.
 */
public interface CloudResourceClient {

    void ensureResourceGroup(RunContext ctx, ManagedCluster cluster) throws Exception;

    void ensureNetwork(RunContext ctx, ManagedCluster cluster) throws Exception;

    void ensureIdentity(RunContext ctx, ManagedCluster cluster) throws Exception;

    void deployControlPlane(RunContext ctx, ManagedCluster cluster) throws Exception;

    void deployWorkers(RunContext ctx, ManagedCluster cluster) throws Exception;

    void upgradeControlPlane(RunContext ctx, ManagedCluster cluster) throws Exception;

    void upgradeWorkers(RunContext ctx, ManagedCluster cluster) throws Exception;

    void deleteWorkers(RunContext ctx, ManagedCluster cluster) throws Exception;

    void deleteControlPlane(RunContext ctx, ManagedCluster cluster) throws Exception;

    void deleteIdentity(RunContext ctx, ManagedCluster cluster) throws Exception;

    void deleteNetwork(RunContext ctx, ManagedCluster cluster) throws Exception;

    void deleteResourceGroup(RunContext ctx, ManagedCluster cluster) throws Exception;
}
