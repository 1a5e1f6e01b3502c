package com.questrail.screenlink.protocol.mirror.observability;

import com.questrail.screenlink.api.ErrorKind;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the mirroring stack.
 */
public record SessionErrorEvent(
    Instant timestamp,
    long epoch,
    ErrorKind kind,
    String message,
    Throwable cause
) {
}
