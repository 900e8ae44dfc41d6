package com.nayem.tenancy.saga;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag with an optional deadline.
 * <p>
 * Sagas check the signal before every forward step and hand it to every
 * provider and store call a forward step makes, so a blocking call can stop
 * at the deadline. Compensation never observes a caller's signal; it runs on
 * {@link #none()}.
 * </p>
 */
public final class CancellationSignal {

    private static final CancellationSignal NONE = new CancellationSignal(null, Clock.systemUTC(), false);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final Instant deadline;
    private final Clock clock;
    private final boolean cancellable;

    private CancellationSignal(Instant deadline, Clock clock, boolean cancellable) {
        this.deadline = deadline;
        this.clock = clock;
        this.cancellable = cancellable;
    }

    /**
     * A signal that is never cancelled.
     */
    public static CancellationSignal none() {
        return NONE;
    }

    /**
     * A signal cancelled only by {@link #cancel()}.
     */
    public static CancellationSignal create() {
        return new CancellationSignal(null, Clock.systemUTC(), true);
    }

    /**
     * A signal that also counts as cancelled once {@code clock} reaches {@code deadline}.
     */
    public static CancellationSignal withDeadline(Instant deadline, Clock clock) {
        return new CancellationSignal(deadline, clock, true);
    }

    public void cancel() {
        if (cancellable) {
            cancelled.set(true);
        }
    }

    public boolean isCancelled() {
        if (cancelled.get()) {
            return true;
        }
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    /**
     * Time left until the deadline, for clients that map it onto a request or
     * statement timeout. Empty when the signal has no deadline.
     */
    public Optional<Duration> remaining() {
        if (deadline == null) {
            return Optional.empty();
        }
        Duration left = Duration.between(clock.instant(), deadline);
        return Optional.of(left.isNegative() ? Duration.ZERO : left);
    }

    /**
     * @throws CancellationException if the signal was cancelled or its deadline passed
     */
    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new CancellationException("Operation was cancelled");
        }
        if (deadline != null && !clock.instant().isBefore(deadline)) {
            throw new CancellationException("Deadline " + deadline + " exceeded");
        }
    }
}
