package com.questrail.screenlink.protocol.mirror.observability;

/**
 * No-op implementation of SessionObservabilitySink.
 */
public final class NullObservabilitySink implements SessionObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(SessionStateTransitionEvent event) {}

    @Override
    public void onTransportEvent(TransportObservabilityEvent event) {}

    @Override
    public void onFrameDropped(FrameDropEvent event) {}

    @Override
    public void onBitrateChange(BitrateChangeEvent event) {}

    @Override
    public void onError(SessionErrorEvent event) {}
}
