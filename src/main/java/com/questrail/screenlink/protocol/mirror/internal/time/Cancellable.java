package com.questrail.screenlink.protocol.mirror.internal.time;

/**
 * Cancellation handle for a task handed to a {@link MonotonicScheduler}.
 */
public interface Cancellable
{
    /**
     * @return {@code true} if the task will not run (or run again) because of
     *         this call; {@code false} if it already ran or was cancelled
     */
    boolean cancel();
}
