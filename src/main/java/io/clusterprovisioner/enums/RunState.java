package io.clusterprovisioner.enums;

/**
 * Lifecycle of a single pipeline run.
 */
public enum RunState {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED
}
