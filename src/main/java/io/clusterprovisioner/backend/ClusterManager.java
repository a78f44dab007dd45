package io.clusterprovisioner.backend;

import io.clusterprovisioner.diagnostics.ClusterInspector;
import io.clusterprovisioner.models.ClusterDocument;
import io.clusterprovisioner.models.ClusterOperatorStatus;
import io.clusterprovisioner.models.ClusterVersionInfo;
import io.clusterprovisioner.models.ManagedCluster;
import io.clusterprovisioner.models.NodeStatus;
import io.clusterprovisioner.queue.LeaseQueue;
import io.clusterprovisioner.steps.RunContext;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Step bodies for one leased cluster document. Action methods delegate to the
 * cloud client with the run scope; condition methods ask the cluster itself through the inspector.
 * Document writes go through the lease queue so a lost lease fails the step.
 */
@Slf4j
public class ClusterManager {

    private final LeaseQueue queue;
    private final CloudResourceClient cloud;
    private final ClusterInspector inspector;
    private final BuildInfo buildInfo;
    private volatile ClusterDocument document;

    public ClusterManager(LeaseQueue queue, ClusterDocument document, CloudResourceClient cloud,
                          ClusterInspector inspector, BuildInfo buildInfo) {
        this.queue = queue;
        this.document = document;
        this.cloud = cloud;
        this.inspector = inspector;
        this.buildInfo = buildInfo;
    }

    public ClusterDocument getDocument() {
        return document;
    }

    private ManagedCluster cluster() {
        return document.getCluster();
    }

    // =================================================================
    // DOCUMENT STEPS
    // =================================================================

    public void updateProvisionedBy(RunContext ctx) throws Exception {
        String commit = buildInfo.getCommit();
        document = queue.patchWithLease(document.getKey(),
            doc -> doc.getCluster().getProperties().setProvisionedBy(commit));
        log.info("Cluster {} provisioned by {}", document.getKey(), commit);
    }

    // =================================================================
    // CLOUD STEPS
    // =================================================================

    public void ensureResourceGroup(RunContext ctx) throws Exception {
        cloud.ensureResourceGroup(ctx, cluster());
    }

    public void ensureNetwork(RunContext ctx) throws Exception {
        cloud.ensureNetwork(ctx, cluster());
    }

    public void ensureIdentity(RunContext ctx) throws Exception {
        cloud.ensureIdentity(ctx, cluster());
    }

    public void deployControlPlane(RunContext ctx) throws Exception {
        cloud.deployControlPlane(ctx, cluster());
    }

    public void deployWorkers(RunContext ctx) throws Exception {
        cloud.deployWorkers(ctx, cluster());
    }

    public void upgradeControlPlane(RunContext ctx) throws Exception {
        cloud.upgradeControlPlane(ctx, cluster());
    }

    public void upgradeWorkers(RunContext ctx) throws Exception {
        cloud.upgradeWorkers(ctx, cluster());
    }

    public void deleteWorkers(RunContext ctx) throws Exception {
        cloud.deleteWorkers(ctx, cluster());
    }

    public void deleteControlPlane(RunContext ctx) throws Exception {
        cloud.deleteControlPlane(ctx, cluster());
    }

    public void deleteIdentity(RunContext ctx) throws Exception {
        cloud.deleteIdentity(ctx, cluster());
    }

    public void deleteNetwork(RunContext ctx) throws Exception {
        cloud.deleteNetwork(ctx, cluster());
    }

    public void deleteResourceGroup(RunContext ctx) throws Exception {
        cloud.deleteResourceGroup(ctx, cluster());
    }

    // =================================================================
    // CONDITIONS
    // =================================================================

    /**
     * The API server answers with a version. Connection failures count as not ready.
     */
    public boolean apiServerReady(RunContext ctx) {
        try {
            ClusterVersionInfo version = inspector.getClusterVersion();
            return version != null && version.getVersion() != null;
        } catch (Exception e) {
            log.info("API server of {} not reachable yet: {}", document.getKey(), e.getMessage());
            return false;
        }
    }

    /**
     * Every node is ready and at least the requested number of workers joined.
     */
    public boolean nodesReady(RunContext ctx) throws Exception {
        List<NodeStatus> nodes = inspector.listNodes();
        if (nodes == null || nodes.isEmpty()) {
            return false;
        }
        long readyWorkers = nodes.stream()
            .filter(node -> NodeStatus.ROLE_WORKER.equals(node.getRole()) && node.isReady())
            .count();
        boolean allReady = nodes.stream().allMatch(NodeStatus::isReady);
        int wanted = cluster().getProperties().getWorkerCount();
        log.debug("Cluster {}: {}/{} workers ready, all nodes ready: {}", document.getKey(), readyWorkers, wanted, allReady);
        return allReady && readyWorkers >= wanted;
    }

    public boolean clusterOperatorsAvailable(RunContext ctx) throws Exception {
        List<ClusterOperatorStatus> operators = inspector.listClusterOperators();
        if (operators == null || operators.isEmpty()) {
            return false;
        }
        return operators.stream().allMatch(operator -> operator.isAvailable() && !operator.isDegraded());
    }
}
