package com.questrail.screenlink.protocol.mirror.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicScheduler
 * =============================================================================
 * Scheduler surface for periodic operational work (feedback sampling).
 *
 * <h2>Binding invariant</h2>
 * Deadlines are monotonic ticks or durations, never wall-clock instants.
 */
public interface MonotonicScheduler
{
    /**
     * Runs {@code task} once at or after {@code deadlineNanos}.
     *
     * @param deadlineNanos deadline on the {@link MonotonicClock} timeline
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Runs {@code task} once after {@code delay}, measured on {@code clock}.
     */
    default Cancellable scheduleAfter(Duration delay, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");

        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }

        return scheduleAtNanos(clock.nowNanos() + delay.toNanos(), task);
    }

    /**
     * Runs {@code task} every {@code period}, first after one period. Each run
     * is scheduled from the deadline of the previous one, so a slow run does
     * not push later runs back. Cancelling the returned handle stops the chain.
     */
    default Cancellable scheduleEvery(Duration period, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(period, "period");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");

        if (period.isNegative() || period.isZero()) {
            throw new IllegalArgumentException("period must be > 0");
        }

        PeriodicTask periodic = new PeriodicTask(this, period.toNanos(), task);
        periodic.arm(clock.nowNanos() + period.toNanos());
        return periodic;
    }
}
