package com.questrail.screenlink.protocol.mirror.internal.session;

import com.questrail.screenlink.protocol.mirror.internal.bitrate.TransportFeedback;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-session delivery counters, written by the sender and receive workers
 * and drained once per bitrate evaluation window.
 */
public final class SessionFeedbackCounters {

    private final AtomicLong droppedFrames = new AtomicLong();
    private final AtomicInteger authFailures = new AtomicInteger();
    private final AtomicLong bytesSent = new AtomicLong();

    public void recordDroppedFrame() {
        droppedFrames.incrementAndGet();
    }

    public void recordAuthFailure() {
        authFailures.incrementAndGet();
    }

    public void recordBytesSent(int n) {
        bytesSent.addAndGet(n);
    }

    /**
     * Returns the current window and starts a new one.
     */
    public TransportFeedback sampleAndReset(int sendBacklog, Duration window) {
        return new TransportFeedback(
                sendBacklog,
                droppedFrames.getAndSet(0),
                authFailures.getAndSet(0),
                bytesSent.getAndSet(0),
                window);
    }
}
