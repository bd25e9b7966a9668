package io.indexer.core;

import io.indexer.core.error.CancelledException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation and deadline carried through store reads, index writes and query scans.
 * Long loops call {@link #checkActive()} between iterations.
 */
public final class OperationContext {
    private static final OperationContext BACKGROUND = new OperationContext(null, null, Clock.systemUTC());

    private final OperationContext parent;
    private final Instant deadline;
    private final Clock clock;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    private OperationContext(OperationContext parent, Instant deadline, Clock clock) {
        this.parent = parent;
        this.deadline = deadline;
        this.clock = clock;
    }

    /** Never cancelled, no deadline. */
    public static OperationContext background() {
        return BACKGROUND;
    }

    public static OperationContext cancellable() {
        return new OperationContext(null, null, Clock.systemUTC());
    }

    public static OperationContext withTimeout(Duration timeout) {
        return withTimeout(timeout, Clock.systemUTC());
    }

    static OperationContext withTimeout(Duration timeout, Clock clock) {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be non-negative");
        }
        return new OperationContext(null, clock.instant().plus(timeout), clock);
    }

    /** Child context that is cancelled when this one is, with an optional tighter deadline. */
    public OperationContext child(Duration timeout) {
        Instant childDeadline = timeout == null ? deadline : clock.instant().plus(timeout);
        if (deadline != null && childDeadline != null && deadline.isBefore(childDeadline)) {
            childDeadline = deadline;
        }
        return new OperationContext(this, childDeadline, clock);
    }

    public void cancel() {
        if (this == BACKGROUND) {
            throw new UnsupportedOperationException("background context cannot be cancelled");
        }
        cancelled.set(true);
    }

    public boolean isCancelled() {
        if (cancelled.get()) {
            return true;
        }
        if (deadline != null && !clock.instant().isBefore(deadline)) {
            return true;
        }
        return parent != null && parent.isCancelled();
    }

    public void checkActive() {
        if (isCancelled()) {
            throw new CancelledException(cancelled.get() || (parent != null && parent.cancelled.get())
                    ? "operation cancelled"
                    : "deadline exceeded");
        }
    }
}
