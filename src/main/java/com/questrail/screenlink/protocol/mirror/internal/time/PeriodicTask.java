package com.questrail.screenlink.protocol.mirror.internal.time;

/**
 * Self-rescheduling task behind {@link MonotonicScheduler#scheduleEvery}.
 */
final class PeriodicTask implements Cancellable
{
    private final MonotonicScheduler scheduler;
    private final long periodNanos;
    private final Runnable task;

    private volatile boolean cancelled;
    private volatile Cancellable pending;

    PeriodicTask(MonotonicScheduler scheduler, long periodNanos, Runnable task)
    {
        this.scheduler = scheduler;
        this.periodNanos = periodNanos;
        this.task = task;
    }

    void arm(long deadlineNanos)
    {
        pending = scheduler.scheduleAtNanos(deadlineNanos, () -> fire(deadlineNanos));
        if (cancelled) {
            pending.cancel();
        }
    }

    private void fire(long deadlineNanos)
    {
        if (cancelled) {
            return;
        }
        try {
            task.run();
        }
        finally {
            if (!cancelled) {
                arm(deadlineNanos + periodNanos);
            }
        }
    }

    @Override
    public boolean cancel()
    {
        if (cancelled) {
            return false;
        }
        cancelled = true;
        Cancellable p = pending;
        if (p != null) {
            p.cancel();
        }
        return true;
    }
}
