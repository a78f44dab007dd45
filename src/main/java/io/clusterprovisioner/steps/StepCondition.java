package io.clusterprovisioner.steps;

@FunctionalInterface
public interface StepCondition {
    boolean check(RunContext ctx) throws Exception;
}
