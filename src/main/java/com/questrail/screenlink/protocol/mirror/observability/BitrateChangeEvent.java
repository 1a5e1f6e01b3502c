package com.questrail.screenlink.protocol.mirror.observability;

import com.questrail.screenlink.protocol.mirror.internal.bitrate.TransportFeedback;

import java.time.Instant;

/**
 * Record representing a new encoder target chosen by the bitrate controller.
 */
public record BitrateChangeEvent(
    Instant timestamp,
    int previousBitsPerSecond,
    int newBitsPerSecond,
    TransportFeedback feedback
) {
    public boolean isDecrease() {
        return newBitsPerSecond < previousBitsPerSecond;
    }
}
