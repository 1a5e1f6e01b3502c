package com.questrail.screenlink.api;

/**
 * ErrorKind
 * -----------------------------------------------------------------------------
 * Closed taxonomy of failures the mirroring core can report.
 *
 * <h2>Propagation classes</h2>
 * <ul>
 *   <li><b>Locally recovered</b>: {@link #MALFORMED} and a single
 *       {@link #AUTH_FAILED}. The offending frame is dropped and the session
 *       continues.</li>
 *   <li><b>Fatal to the session</b>: {@link #CONNECT_TIMEOUT},
 *       {@link #CONNECT_REFUSED}, {@link #PAIRING_REQUIRED},
 *       {@link #PEER_CLOSED}, {@link #IO_ERROR}, and repeated
 *       {@link #AUTH_FAILED}. Reported once through the session event queue;
 *       never retried by the core.</li>
 *   <li><b>API misuse</b>: {@link #ALREADY_ACTIVE}. Raised synchronously to the
 *       caller; no state change.</li>
 * </ul>
 */
public enum ErrorKind
{
    CONNECT_TIMEOUT,
    CONNECT_REFUSED,
    PAIRING_REQUIRED,

    /** Orderly close by the remote end. Distinct from {@link #IO_ERROR}. */
    PEER_CLOSED,

    IO_ERROR,

    /** Protocol violation on the wire. */
    MALFORMED,

    /** GCM tag mismatch or truncated ciphertext. */
    AUTH_FAILED,

    ALREADY_ACTIVE;

    /**
     * Returns {@code true} if an error of this kind ends the current session.
     *
     * <p>{@link #AUTH_FAILED} is not fatal on its own; escalation after repeated
     * failures is a session policy, not a property of the kind.</p>
     */
    public boolean isFatal()
    {
        return switch (this) {
            case MALFORMED, AUTH_FAILED, ALREADY_ACTIVE -> false;
            default -> true;
        };
    }
}
