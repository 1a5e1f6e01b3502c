package com.questrail.screenlink.protocol.mirror.internal.bitrate;

import java.util.Optional;

/**
 * Supplies one window of delivery feedback and starts the next window.
 */
@FunctionalInterface
public interface FeedbackSource
{
    /**
     * @return the counters accumulated since the previous call, or empty when
     *         no session is carrying video
     */
    Optional<TransportFeedback> sampleAndReset();
}
