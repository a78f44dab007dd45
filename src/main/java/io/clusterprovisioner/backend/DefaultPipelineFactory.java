package io.clusterprovisioner.backend;

import io.clusterprovisioner.enums.ProvisioningState;
import io.clusterprovisioner.steps.Step;
import io.clusterprovisioner.steps.StepCondition;
import io.clusterprovisioner.steps.Steps;

import java.time.Duration;
import java.util.List;

/**
 * Create, update and delete pipelines.
 */
public class DefaultPipelineFactory implements PipelineFactory {

    private final Duration conditionPollInterval;
    private final Duration conditionTimeout;

    public DefaultPipelineFactory(Duration conditionPollInterval, Duration conditionTimeout) {
        this.conditionPollInterval = conditionPollInterval;
        this.conditionTimeout = conditionTimeout;
    }

    @Override
    public List<Step> buildPipeline(ProvisioningState state, ClusterManager m) {
        if (state == null) {
            throw new IllegalStateException("Document has no provisioning state");
        }
        switch (state) {
            case CREATING:
                return List.of(
                    Steps.action("updateProvisionedBy", m::updateProvisionedBy),
                    Steps.action("ensureResourceGroup", m::ensureResourceGroup),
                    Steps.action("ensureNetwork", m::ensureNetwork),
                    Steps.action("ensureIdentity", m::ensureIdentity),
                    Steps.action("deployControlPlane", m::deployControlPlane),
                    condition("apiServerReady", m::apiServerReady),
                    Steps.action("deployWorkers", m::deployWorkers),
                    condition("nodesReady", m::nodesReady),
                    condition("clusterOperatorsAvailable", m::clusterOperatorsAvailable));
            case UPDATING:
                return List.of(
                    Steps.action("updateProvisionedBy", m::updateProvisionedBy),
                    Steps.action("upgradeControlPlane", m::upgradeControlPlane),
                    condition("apiServerReady", m::apiServerReady),
                    Steps.action("upgradeWorkers", m::upgradeWorkers),
                    condition("nodesReady", m::nodesReady),
                    condition("clusterOperatorsAvailable", m::clusterOperatorsAvailable));
            case DELETING:
                return List.of(
                    Steps.action("deleteWorkers", m::deleteWorkers),
                    Steps.action("deleteControlPlane", m::deleteControlPlane),
                    Steps.action("deleteIdentity", m::deleteIdentity),
                    Steps.action("deleteNetwork", m::deleteNetwork),
                    Steps.action("deleteResourceGroup", m::deleteResourceGroup));
            default:
                throw new IllegalStateException("No pipeline for provisioning state " + state);
        }
    }

    private Step condition(String name, StepCondition condition) {
        return Steps.condition(name, condition, conditionPollInterval, conditionTimeout);
    }
}
