package com.questrail.screenlink.protocol.mirror.observability;

import com.questrail.screenlink.api.TransportKind;

import java.time.Instant;

/**
 * Record representing a carrier lifecycle step (connect started, link up,
 * carrier closed).
 */
public record TransportObservabilityEvent(
    Instant timestamp,
    long epoch,
    TransportKind transportKind,
    String target,
    String description
) {
}
