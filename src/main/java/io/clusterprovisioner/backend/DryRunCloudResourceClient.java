package io.clusterprovisioner.backend;

import io.clusterprovisioner.models.ManagedCluster;
import io.clusterprovisioner.steps.RunContext;
import lombok.extern.slf4j.Slf4j;

/**
 * Cloud client used when no real one is configured. Logs each call and changes nothing.
 * A cancelled run scope fails the call before anything is logged.
 */
@Slf4j
public class DryRunCloudResourceClient implements CloudResourceClient {

    @Override
    public void ensureResourceGroup(RunContext ctx, ManagedCluster cluster) {
        logCall("ensureResourceGroup", ctx, cluster);
    }

    @Override
    public void ensureNetwork(RunContext ctx, ManagedCluster cluster) {
        logCall("ensureNetwork", ctx, cluster);
    }

    @Override
    public void ensureIdentity(RunContext ctx, ManagedCluster cluster) {
        logCall("ensureIdentity", ctx, cluster);
    }

    @Override
    public void deployControlPlane(RunContext ctx, ManagedCluster cluster) {
        logCall("deployControlPlane", ctx, cluster);
    }

    @Override
    public void deployWorkers(RunContext ctx, ManagedCluster cluster) {
        logCall("deployWorkers", ctx, cluster);
    }

    @Override
    public void upgradeControlPlane(RunContext ctx, ManagedCluster cluster) {
        logCall("upgradeControlPlane", ctx, cluster);
    }

    @Override
    public void upgradeWorkers(RunContext ctx, ManagedCluster cluster) {
        logCall("upgradeWorkers", ctx, cluster);
    }

    @Override
    public void deleteWorkers(RunContext ctx, ManagedCluster cluster) {
        logCall("deleteWorkers", ctx, cluster);
    }

    @Override
    public void deleteControlPlane(RunContext ctx, ManagedCluster cluster) {
        logCall("deleteControlPlane", ctx, cluster);
    }

    @Override
    public void deleteIdentity(RunContext ctx, ManagedCluster cluster) {
        logCall("deleteIdentity", ctx, cluster);
    }

    @Override
    public void deleteNetwork(RunContext ctx, ManagedCluster cluster) {
        logCall("deleteNetwork", ctx, cluster);
    }

    @Override
    public void deleteResourceGroup(RunContext ctx, ManagedCluster cluster) {
        logCall("deleteResourceGroup", ctx, cluster);
    }

    private void logCall(String operation, RunContext ctx, ManagedCluster cluster) {
        ctx.throwIfCancelled();
        log.info("[dry-run] {} for cluster {} in {}", operation, cluster.getId(), cluster.getLocation());
    }
}
