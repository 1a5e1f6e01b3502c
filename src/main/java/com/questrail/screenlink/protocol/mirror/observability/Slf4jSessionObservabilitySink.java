package com.questrail.screenlink.protocol.mirror.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of SessionObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jSessionObservabilitySink implements SessionObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jSessionObservabilitySink.class);

    @Override
    public void onStateTransition(SessionStateTransitionEvent event) {
        if (event.cause() != null) {
            log.info("Session #{}: {} -> {} ({})", event.epoch(), event.from(), event.to(), event.cause());
        }
        else {
            log.info("Session #{}: {} -> {}", event.epoch(), event.from(), event.to());
        }
    }

    @Override
    public void onTransportEvent(TransportObservabilityEvent event) {
        log.info("Session #{} {} {}: {}", event.epoch(), event.transportKind(), event.target(), event.description());
    }

    @Override
    public void onFrameDropped(FrameDropEvent event) {
        if (event.reason() == FrameDropEvent.Reason.AUTH_FAILED) {
            log.warn("Session #{}: dropped frame ({}): {}", event.epoch(), event.reason(), event.detail());
        }
        else {
            log.debug("Session #{}: dropped frame ({}): {}", event.epoch(), event.reason(), event.detail());
        }
    }

    @Override
    public void onBitrateChange(BitrateChangeEvent event) {
        log.info("Target bitrate {} -> {} bps ({})",
            event.previousBitsPerSecond(), event.newBitsPerSecond(), event.feedback());
    }

    @Override
    public void onError(SessionErrorEvent event) {
        log.error("Session #{} {}: {}", event.epoch(), event.kind(), event.message(), event.cause());
    }
}
