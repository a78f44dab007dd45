package io.clusterprovisioner.backend;

import io.clusterprovisioner.enums.ProvisioningState;
import io.clusterprovisioner.steps.Step;

import java.util.List;

/**
 * Maps the provisioning state of a claimed document to the steps that advance it.
 */
public interface PipelineFactory {

    /**
     * @throws IllegalStateException if no pipeline exists for the state
     */
    List<Step> buildPipeline(ProvisioningState state, ClusterManager manager);
}
