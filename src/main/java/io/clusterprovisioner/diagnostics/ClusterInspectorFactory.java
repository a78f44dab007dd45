package io.clusterprovisioner.diagnostics;

import io.clusterprovisioner.models.ManagedCluster;

/**
 * Builds a {@link ClusterInspector} bound to one cluster.
 */
public interface ClusterInspectorFactory {

    ClusterInspector forCluster(ManagedCluster cluster) throws Exception;
}
