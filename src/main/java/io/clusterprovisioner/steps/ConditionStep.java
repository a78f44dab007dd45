package io.clusterprovisioner.steps;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Polls a condition until it holds. The first check happens immediately,
 * later ones every poll interval, until the step's own timeout expires.
 * An exception from the condition ends polling and becomes the step error.
 */
@Slf4j
@Getter
public class ConditionStep implements Step {

    private final String name;
    private final StepCondition condition;
    private final Duration pollInterval;
    private final Duration timeout;

    public ConditionStep(String name, StepCondition condition, Duration pollInterval, Duration timeout) {
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("poll interval must be positive for condition " + name);
        }
        this.name = name;
        this.condition = condition;
        this.pollInterval = pollInterval;
        this.timeout = timeout;
    }

    @Override
    public void run(RunContext ctx) throws Exception {
        try (RunContext scope = ctx.withTimeout(timeout)) {
            while (true) {
                scope.throwIfCancelled();
                if (condition.check(scope)) {
                    return;
                }
                if (scope.isDeadlineExceeded()) {
                    throw new StepTimeoutException(name, timeout);
                }
                log.debug("condition [{}] not met, polling again in {}ms", name, pollInterval.toMillis());
                Duration remaining = scope.remaining();
                scope.sleep(remaining != null && remaining.compareTo(pollInterval) < 0 ? remaining : pollInterval);
            }
        }
    }

    @Override
    public String toString() {
        return "[Condition " + name + ", timeout " + timeout + "]";
    }
}
