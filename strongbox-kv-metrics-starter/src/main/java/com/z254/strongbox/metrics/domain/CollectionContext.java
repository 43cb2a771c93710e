package com.z254.strongbox.metrics.domain;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation and deadline signal shared by everything that runs within one tick.
 * <p>
 * Passed to every port call so that adapters performing I/O can bail out promptly.
 * Instances are thread-safe; a context can be cancelled from any thread.
 */
public final class CollectionContext {

    private final Clock clock;
    private final Instant deadline;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private CollectionContext(Clock clock, Instant deadline) {
        this.clock = clock;
        this.deadline = deadline;
    }

    /**
     * A context that never expires on its own.
     */
    public static CollectionContext unbounded() {
        return new CollectionContext(Clock.systemUTC(), Instant.MAX);
    }

    public static CollectionContext withTimeout(Duration timeout) {
        return withTimeout(timeout, Clock.systemUTC());
    }

    public static CollectionContext withTimeout(Duration timeout, Clock clock) {
        return new CollectionContext(clock, clock.instant().plus(timeout));
    }

    public Instant getDeadline() {
        return deadline;
    }

    public void cancel() {
        cancelled.set(true);
    }

    /**
     * True once cancelled explicitly or once the deadline has passed.
     */
    public boolean isDone() {
        return cancelled.get() || !clock.instant().isBefore(deadline);
    }

    /**
     * Time left before the deadline, never negative.
     */
    public Duration remaining() {
        if (cancelled.get()) {
            return Duration.ZERO;
        }
        if (Instant.MAX.equals(deadline)) {
            return Duration.ofMillis(Long.MAX_VALUE);
        }
        Duration left = Duration.between(clock.instant(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    /**
     * @throws CollectionCancelledException if the tick is over or the calling thread
     *                                      was interrupted
     */
    public void ensureActive() {
        if (Thread.currentThread().isInterrupted()) {
            throw new CollectionCancelledException("Collection thread interrupted");
        }
        if (cancelled.get()) {
            throw new CollectionCancelledException("Collection cancelled");
        }
        if (!clock.instant().isBefore(deadline)) {
            throw new CollectionCancelledException("Collection deadline " + deadline + " exceeded");
        }
    }
}
