package io.clusterprovisioner.diagnostics;

import io.clusterprovisioner.models.ClusterOperatorStatus;
import io.clusterprovisioner.models.ClusterVersionInfo;
import io.clusterprovisioner.models.IngressControllerStatus;
import io.clusterprovisioner.models.ManagedCluster;
import io.clusterprovisioner.models.NodeStatus;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Inspector factory used when no real in-cluster client is wired in.
 * Reports every cluster as healthy and sized as requested.
 */
@Slf4j
public class DryRunClusterInspectorFactory implements ClusterInspectorFactory {

    static final int CONTROL_PLANE_NODES = 3;
    static final List<String> OPERATORS = List.of("kube-apiserver", "etcd", "network", "dns", "ingress");

    @Override
    public ClusterInspector forCluster(ManagedCluster cluster) {
        log.debug("Using dry-run inspector for cluster {}", cluster.getId());
        return new DryRunClusterInspector(cluster);
    }

    private static final class DryRunClusterInspector implements ClusterInspector {

        private final ManagedCluster cluster;

        private DryRunClusterInspector(ManagedCluster cluster) {
            this.cluster = cluster;
        }

        @Override
        public ClusterVersionInfo getClusterVersion() {
            String version = cluster.getProperties() != null ? cluster.getProperties().getKubernetesVersion() : null;
            return new ClusterVersionInfo(version, version, false);
        }

        @Override
        public List<NodeStatus> listNodes() {
            String name = cluster.getName() != null ? cluster.getName() : "cluster";
            List<NodeStatus> nodes = new ArrayList<>();
            for (int i = 0; i < CONTROL_PLANE_NODES; i++) {
                nodes.add(new NodeStatus(name + "-master-" + i, NodeStatus.ROLE_MASTER, true));
            }
            int workers = cluster.getProperties() != null ? cluster.getProperties().getWorkerCount() : 0;
            for (int i = 0; i < workers; i++) {
                nodes.add(new NodeStatus(name + "-worker-" + i, NodeStatus.ROLE_WORKER, true));
            }
            return nodes;
        }

        @Override
        public List<ClusterOperatorStatus> listClusterOperators() {
            List<ClusterOperatorStatus> operators = new ArrayList<>();
            for (String operator : OPERATORS) {
                operators.add(new ClusterOperatorStatus(operator, true, false, null));
            }
            return operators;
        }

        @Override
        public List<IngressControllerStatus> listIngressControllers() {
            String domain = "apps." + (cluster.getName() != null ? cluster.getName() : "cluster") + ".example";
            return List.of(new IngressControllerStatus("default", domain, true));
        }
    }
}
