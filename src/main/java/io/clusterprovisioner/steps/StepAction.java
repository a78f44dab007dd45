package io.clusterprovisioner.steps;

@FunctionalInterface
public interface StepAction {
    void run(RunContext ctx) throws Exception;
}
