package com.questrail.screenlink.protocol.mirror.observability;

import java.time.Instant;

/**
 * Record representing a frame discarded without ending the session.
 */
public record FrameDropEvent(
    Instant timestamp,
    long epoch,
    Reason reason,
    String detail
) {
    public enum Reason {
        /** Inbound bytes violated the wire format. */
        MALFORMED,
        /** Inbound video failed authentication. */
        AUTH_FAILED,
        /** Outbound queue was full. */
        QUEUE_FULL
    }
}
