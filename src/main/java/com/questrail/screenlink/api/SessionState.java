package com.questrail.screenlink.api;

/**
 * SessionState
 * -----------------------------------------------------------------------------
 * Lifecycle state of the single mirroring session.
 *
 * <pre>
 *   DISCONNECTED ──connect──▶ CONNECTING ──handshake ok──▶ CONNECTED
 *        ▲                        │                            │
 *        │                        └──── failure ───▶ ERROR ◀───┤ I/O failure
 *        └──────── disconnect / reset (any state) ─────────────┘ peer close
 * </pre>
 *
 * <p>{@code ERROR} never retries on its own. A caller may issue a new connect
 * from {@code DISCONNECTED} or {@code ERROR}, or call reset to return to
 * {@code DISCONNECTED}.</p>
 */
public enum SessionState
{
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    ERROR;

    /**
     * Returns {@code true} if a session in this state owns (or is acquiring) a
     * carrier. A connect request is rejected in any active state.
     */
    public boolean isActive()
    {
        return this == CONNECTING || this == CONNECTED;
    }
}
