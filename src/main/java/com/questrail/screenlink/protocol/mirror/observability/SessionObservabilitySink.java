package com.questrail.screenlink.protocol.mirror.observability;

/**
 * Main interface for receiving mirroring observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Sinks are called from session worker threads and must not block.</p>
 */
public interface SessionObservabilitySink {
    /**
     * Called when the session moves between lifecycle states.
     */
    void onStateTransition(SessionStateTransitionEvent event);

    /**
     * Called on carrier lifecycle steps.
     */
    void onTransportEvent(TransportObservabilityEvent event);

    /**
     * Called when a frame is discarded but the session continues.
     */
    void onFrameDropped(FrameDropEvent event);

    /**
     * Called when the bitrate controller emits a new target.
     */
    void onBitrateChange(BitrateChangeEvent event);

    /**
     * Called when an error ends a session or an internal task fails.
     */
    void onError(SessionErrorEvent event);
}
