package com.questrail.screenlink.api;

/**
 * Thrown synchronously by a connect request while a session is already
 * {@link SessionState#CONNECTING} or {@link SessionState#CONNECTED}.
 *
 * <p>The request is rejected, not queued, and the existing session is left
 * untouched.</p>
 */
public final class SessionAlreadyActiveException extends MirrorException
{
    private final SessionState observedState;

    public SessionAlreadyActiveException(SessionState observedState)
    {
        super(ErrorKind.ALREADY_ACTIVE, "Session already active (state " + observedState + ")");
        this.observedState = observedState;
    }

    public SessionState observedState()
    {
        return observedState;
    }
}
