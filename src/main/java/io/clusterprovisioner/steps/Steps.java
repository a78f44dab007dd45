package io.clusterprovisioner.steps;

import java.time.Duration;

/**
 * Factory methods for pipeline steps. Every step is registered under an explicit name.
 */
public final class Steps {

    private Steps() {
        // Utility class
    }

    public static Step action(String name, StepAction action) {
        return new ActionStep(requireName(name), action);
    }

    public static Step condition(String name, StepCondition condition, Duration pollInterval, Duration timeout) {
        return new ConditionStep(requireName(name), condition, pollInterval, timeout);
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("step name must not be blank");
        }
        return name;
    }
}
