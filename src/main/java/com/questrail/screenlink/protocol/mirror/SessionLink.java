package com.questrail.screenlink.protocol.mirror;

import com.questrail.screenlink.api.TransportKind;
import com.questrail.screenlink.protocol.mirror.codec.MirrorFrameDecoder;
import com.questrail.screenlink.protocol.mirror.internal.session.SessionFeedbackCounters;
import com.questrail.screenlink.protocol.mirror.transport.Transport;

import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * SessionLink
 * -----------------------------------------------------------------------------
 * Resources owned by one connect attempt (one epoch): the carrier, the
 * stream decoder, the bounded sender worker and the feedback counters.
 *
 * <p>A link is created when a connect wins, and closed exactly once when its
 * session ends for any reason. Closing shuts the sender down (queued frames
 * are discarded) and closes the carrier, which unblocks the connect worker
 * and the receive loop.</p>
 */
final class SessionLink
{
    private final long epoch;
    private final TransportKind kind;
    private final String target;

    private final ThreadPoolExecutor sender;
    private final MirrorFrameDecoder decoder;
    private final SessionFeedbackCounters counters = new SessionFeedbackCounters();
    private final AtomicLong lastSampleNanos;

    private final Object timestampLock = new Object();
    private boolean videoSent;
    private long lastVideoTimestamp;

    private volatile Transport transport;
    private boolean closed;

    SessionLink(long epoch,
                TransportKind kind,
                String target,
                MirrorFrameDecoder decoder,
                int sendQueueCapacity,
                long nowNanos)
    {
        this.epoch = epoch;
        this.kind = Objects.requireNonNull(kind, "kind");
        this.target = Objects.requireNonNull(target, "target");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.lastSampleNanos = new AtomicLong(nowNanos);

        this.sender = new ThreadPoolExecutor(
                1, 1,
                0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(sendQueueCapacity),
                r -> {
                    Thread t = new Thread(r, "screenlink-sender-" + epoch);
                    t.setDaemon(true);
                    return t;
                },
                new ThreadPoolExecutor.AbortPolicy());
    }

    long epoch()
    {
        return epoch;
    }

    TransportKind kind()
    {
        return kind;
    }

    String target()
    {
        return target;
    }

    ThreadPoolExecutor sender()
    {
        return sender;
    }

    /** Owned by the receive loop only. */
    MirrorFrameDecoder decoder()
    {
        return decoder;
    }

    SessionFeedbackCounters counters()
    {
        return counters;
    }

    Transport transport()
    {
        return transport;
    }

    /**
     * Hands the carrier to this link.
     *
     * @return {@code false} if the link was closed first; the caller then owns
     *         and must close {@code t}
     */
    synchronized boolean attach(Transport t)
    {
        if (closed) {
            return false;
        }
        transport = Objects.requireNonNull(t, "transport");
        return true;
    }

    synchronized boolean isClosed()
    {
        return closed;
    }

    /**
     * Rejects a video timestamp lower than the previous one of this session.
     */
    void checkVideoTimestamp(long timestampMicros)
    {
        synchronized (timestampLock) {
            if (videoSent && timestampMicros < lastVideoTimestamp) {
                throw new IllegalArgumentException("video timestamp " + timestampMicros
                        + " precedes previous timestamp " + lastVideoTimestamp);
            }
            videoSent = true;
            lastVideoTimestamp = timestampMicros;
        }
    }

    int sendBacklog()
    {
        return sender.getQueue().size();
    }

    /** Starts a new feedback window at {@code nowNanos}; returns where the previous one began. */
    long restartFeedbackWindow(long nowNanos)
    {
        return lastSampleNanos.getAndSet(nowNanos);
    }

    void close()
    {
        final Transport t;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            t = transport;
        }

        sender.shutdownNow();
        if (t != null) {
            t.close();
        }
    }
}
