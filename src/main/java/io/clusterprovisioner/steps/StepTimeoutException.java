package io.clusterprovisioner.steps;

import lombok.Getter;

import java.time.Duration;

/**
 * Thrown when a condition step is still unmet at its deadline.
 */
@Getter
public class StepTimeoutException extends Exception {

    private final String stepName;
    private final Duration timeout;

    public StepTimeoutException(String stepName, Duration timeout) {
        super("condition [" + stepName + "] not met within " + timeout.toSeconds() + "s");
        this.stepName = stepName;
        this.timeout = timeout;
    }
}
