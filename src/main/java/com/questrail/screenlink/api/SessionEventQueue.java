package com.questrail.screenlink.api;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * SessionEventQueue
 * -----------------------------------------------------------------------------
 * Channel between the session's workers and the caller's context.
 *
 * <p>Producers never block. Consumers choose between polling with a timeout,
 * blocking until the next event, or draining everything currently queued.</p>
 */
public final class SessionEventQueue
{
    private final LinkedBlockingQueue<SessionEvent> queue = new LinkedBlockingQueue<>();

    /**
     * Publishes an event. Called by the session only.
     */
    public void publish(SessionEvent event)
    {
        queue.add(Objects.requireNonNull(event, "event"));
    }

    /**
     * Waits up to {@code timeout} for the next event.
     */
    public Optional<SessionEvent> poll(Duration timeout) throws InterruptedException
    {
        Objects.requireNonNull(timeout, "timeout");
        return Optional.ofNullable(queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS));
    }

    /**
     * Blocks until the next event is available.
     */
    public SessionEvent take() throws InterruptedException
    {
        return queue.take();
    }

    /**
     * Removes and returns every event currently queued, oldest first.
     */
    public List<SessionEvent> drain()
    {
        List<SessionEvent> out = new ArrayList<>();
        queue.drainTo(out);
        return out;
    }

    public int size()
    {
        return queue.size();
    }
}
