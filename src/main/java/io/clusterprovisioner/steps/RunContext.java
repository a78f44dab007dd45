package io.clusterprovisioner.steps;

import lombok.Getter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cancellation and deadline scope handed to every step of a run.
 * Cancelling a scope cancels all of its children. A child may carry a
 * deadline of its own, never later than its parent's.
 */
public class RunContext implements AutoCloseable {

    private final RunContext parent;
    @Getter
    private final Clock clock;
    @Getter
    private final Instant deadline;
    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final List<RunContext> children = new CopyOnWriteArrayList<>();
    private volatile String cancelReason;

    private RunContext(RunContext parent, Clock clock, Instant deadline) {
        this.parent = parent;
        this.clock = clock;
        this.deadline = deadline;
    }

    /**
     * Root scope without a deadline.
     */
    public static RunContext background(Clock clock) {
        return new RunContext(null, clock, null);
    }

    /**
     * Child scope that expires after {@code timeout}, or at this scope's deadline if that comes first.
     * Close it when done so the parent forgets it.
     */
    public RunContext withTimeout(Duration timeout) {
        Instant childDeadline = clock.instant().plus(timeout);
        if (deadline != null && deadline.isBefore(childDeadline)) {
            childDeadline = deadline;
        }
        RunContext child = new RunContext(this, clock, childDeadline);
        children.add(child);
        if (isCancelled()) {
            child.cancel(cancelReason);
        }
        return child;
    }

    public void cancel() {
        cancel("run cancelled");
    }

    public void cancel(String reason) {
        if (cancelled.getCount() > 0) {
            cancelReason = reason;
            cancelled.countDown();
        }
        for (RunContext child : children) {
            child.cancel(reason);
        }
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0 || (parent != null && parent.isCancelled());
    }

    public boolean isDeadlineExceeded() {
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    /**
     * Time left until the deadline, or null when there is none.
     */
    public Duration remaining() {
        if (deadline == null) {
            return null;
        }
        Duration left = Duration.between(clock.instant(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancellationException(cancelReason != null ? cancelReason : "run cancelled");
        }
    }

    /**
     * Sleep for {@code duration}, returning early when the scope is cancelled.
     *
     * @throws CancellationException if the scope was cancelled before or during the sleep
     */
    public void sleep(Duration duration) throws InterruptedException {
        throwIfCancelled();
        if (!duration.isNegative() && !duration.isZero()) {
            cancelled.await(duration.toMillis(), TimeUnit.MILLISECONDS);
        }
        throwIfCancelled();
    }

    @Override
    public void close() {
        if (parent != null) {
            parent.children.remove(this);
        }
    }
}
