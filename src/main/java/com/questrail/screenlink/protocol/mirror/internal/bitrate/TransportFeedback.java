package com.questrail.screenlink.protocol.mirror.internal.bitrate;

import java.time.Duration;
import java.util.Objects;

/**
 * Delivery indicators gathered by the session over one evaluation window.
 *
 * @param sendBacklog   frames waiting in the outbound queue when sampled
 * @param droppedFrames outbound frames dropped during the window
 * @param authFailures  inbound frames that failed authentication during the window
 * @param bytesSent     bytes written to the carrier during the window
 * @param window        length of the window the counters cover
 */
public record TransportFeedback(
        int sendBacklog,
        long droppedFrames,
        int authFailures,
        long bytesSent,
        Duration window
) {
    public TransportFeedback {
        Objects.requireNonNull(window, "window");
        if (sendBacklog < 0 || droppedFrames < 0 || authFailures < 0 || bytesSent < 0) {
            throw new IllegalArgumentException("feedback counters must be non-negative");
        }
    }

    /** Measured throughput over the window, in bits per second. */
    public long throughputBitsPerSecond() {
        long nanos = window.toNanos();
        if (nanos <= 0) {
            return 0;
        }
        return (long) (bytesSent * 8.0 * 1_000_000_000L / nanos);
    }
}
