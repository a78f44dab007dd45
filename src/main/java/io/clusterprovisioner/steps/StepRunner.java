package io.clusterprovisioner.steps;

import io.clusterprovisioner.diagnostics.DiagnosticsCollector;
import io.clusterprovisioner.enums.RunState;
import io.clusterprovisioner.metrics.MetricsEmitter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;

import static io.clusterprovisioner.metrics.MetricsConstants.INSTALL_TIME_METRIC_NAME;

/**
 * Runs a pipeline of steps in order for one cluster.
 * <p>
 * The first failing step ends the run: its error is logged, diagnostics are
 * collected and the same exception is rethrown. Completed steps are not
 * rolled back and nothing is retried here. A fully successful run emits one
 * install-time gauge in whole seconds.
 * <p>
 * A runner is good for one run; its state is readable from other threads.
 */
@Slf4j
public class StepRunner {

    private final DiagnosticsCollector diagnostics;
    private final MetricsEmitter metrics;
    private final Clock clock;
    private volatile RunState state = RunState.PENDING;

    /**
     * @param diagnostics collector run after a step failure, may be null
     * @param metrics emitter for the install-time gauge, may be null
     */
    public StepRunner(DiagnosticsCollector diagnostics, MetricsEmitter metrics, Clock clock) {
        this.diagnostics = diagnostics;
        this.metrics = metrics;
        this.clock = clock;
    }

    public void run(RunContext ctx, List<Step> steps) throws Exception {
        if (state != RunState.PENDING) {
            throw new IllegalStateException("StepRunner already used, state " + state);
        }
        state = RunState.RUNNING;
        Instant start = clock.instant();

        for (Step step : steps) {
            log.info("running step [{}]", step.getName());
            try {
                ctx.throwIfCancelled();
                step.run(ctx);
            } catch (Exception e) {
                log.error("step [{}] encountered error: {}", step.getName(), describe(e));
                collectDiagnostics();
                state = RunState.FAILED;
                throw e;
            }
        }

        long elapsedSeconds = Duration.between(start, clock.instant()).getSeconds();
        state = RunState.SUCCEEDED;
        if (metrics != null) {
            try {
                metrics.emitGauge(INSTALL_TIME_METRIC_NAME, elapsedSeconds, new HashMap<>());
            } catch (RuntimeException e) {
                log.warn("failed to emit {}: {}", INSTALL_TIME_METRIC_NAME, e.getMessage());
            }
        }
        log.info("pipeline of {} steps succeeded in {}s", steps.size(), elapsedSeconds);
    }

    public RunState getState() {
        return state;
    }

    private void collectDiagnostics() {
        if (diagnostics == null) {
            return;
        }
        try {
            diagnostics.collect();
        } catch (RuntimeException e) {
            log.error("diagnostics collection failed: {}", e.getMessage(), e);
        }
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
