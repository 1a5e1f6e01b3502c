package com.questrail.screenlink.protocol.mirror.observability;

import com.questrail.screenlink.api.SessionState;

import java.time.Instant;

/**
 * Record representing a lifecycle transition of the mirroring session.
 *
 * @param cause human-readable cause for failure transitions; {@code null} otherwise
 */
public record SessionStateTransitionEvent(
    Instant timestamp,
    long epoch,
    SessionState from,
    SessionState to,
    String cause
) {
    public boolean isFailure() {
        return to == SessionState.ERROR;
    }
}
