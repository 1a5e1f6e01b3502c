package com.questrail.screenlink.protocol.mirror.internal.session;

import com.questrail.screenlink.api.SessionState;
import com.questrail.screenlink.api.TransportKind;

import java.util.Objects;

/**
 * SessionSnapshot
 * -----------------------------------------------------------------------------
 * Immutable snapshot of the session's lifecycle state.
 *
 * <h2>Role in the architecture</h2>
 * This is the single piece of mutable shared state in the session, held in an
 * {@code AtomicReference} and replaced wholesale on every transition. It is:
 * <ul>
 *   <li>Pure data (no behavior beyond deriving the next snapshot)</li>
 *   <li>Immutable</li>
 *   <li>Stamped with the epoch of the connect attempt it describes</li>
 * </ul>
 *
 * <p>The epoch only ever grows, by one per accepted connect. A worker that
 * belongs to epoch {@code n} may only transition a snapshot whose epoch is
 * still {@code n}.</p>
 *
 * @param transportKind carrier of the current or last session; {@code null} before the first connect
 * @param target        target of the current or last session; {@code null} before the first connect
 * @param cause         failure cause while in {@link SessionState#ERROR}; {@code null} otherwise
 */
public record SessionSnapshot(
        long epoch,
        SessionState state,
        TransportKind transportKind,
        String target,
        String cause
) {
    public SessionSnapshot {
        Objects.requireNonNull(state, "state");
        if (epoch < 0) {
            throw new IllegalArgumentException("epoch must be >= 0");
        }
        if (state == SessionState.ERROR) {
            Objects.requireNonNull(cause, "cause");
        }
    }

    // ---------------------------------------------------------------------
    // Factory helpers
    // ---------------------------------------------------------------------

    public static SessionSnapshot initial() {
        return new SessionSnapshot(0L, SessionState.DISCONNECTED, null, null, null);
    }

    /** Opens the next epoch. */
    public SessionSnapshot connecting(TransportKind kind, String newTarget) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(newTarget, "newTarget");
        return new SessionSnapshot(epoch + 1, SessionState.CONNECTING, kind, newTarget, null);
    }

    public SessionSnapshot connected() {
        return new SessionSnapshot(epoch, SessionState.CONNECTED, transportKind, target, null);
    }

    public SessionSnapshot failed(String failureCause) {
        return new SessionSnapshot(epoch, SessionState.ERROR, transportKind, target, failureCause);
    }

    public SessionSnapshot disconnected() {
        return new SessionSnapshot(epoch, SessionState.DISCONNECTED, transportKind, target, null);
    }

    public boolean isActive() {
        return state.isActive();
    }

    /** {@code true} if this snapshot still describes the session opened at {@code workerEpoch}. */
    public boolean isCurrent(long workerEpoch) {
        return epoch == workerEpoch && state.isActive();
    }
}
