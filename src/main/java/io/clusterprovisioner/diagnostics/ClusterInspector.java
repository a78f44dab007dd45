package io.clusterprovisioner.diagnostics;

import io.clusterprovisioner.models.ClusterOperatorStatus;
import io.clusterprovisioner.models.ClusterVersionInfo;
import io.clusterprovisioner.models.IngressControllerStatus;
import io.clusterprovisioner.models.NodeStatus;

import java.util.List;

/**
 * Read access to the in-cluster API of one managed cluster.
 * Implementations talk to the cluster's API server and may fail at any time
 * while the cluster is being built.
 */
public interface ClusterInspector {

    ClusterVersionInfo getClusterVersion() throws Exception;

    List<NodeStatus> listNodes() throws Exception;

    List<ClusterOperatorStatus> listClusterOperators() throws Exception;

    List<IngressControllerStatus> listIngressControllers() throws Exception;
}
