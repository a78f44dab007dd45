package io.clusterprovisioner.steps;

/**
 * Named, idempotent unit of pipeline work.
 */
public interface Step {

    String getName();

    void run(RunContext ctx) throws Exception;
}
