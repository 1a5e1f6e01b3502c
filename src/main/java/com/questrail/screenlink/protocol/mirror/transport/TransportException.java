package com.questrail.screenlink.protocol.mirror.transport;

import com.questrail.screenlink.api.ErrorKind;

import java.io.IOException;
import java.util.Objects;

/**
 * Carrier I/O failure, classified for the session.
 */
public final class TransportException extends IOException
{
    private final ErrorKind kind;

    public TransportException(ErrorKind kind, String message)
    {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public TransportException(ErrorKind kind, String message, Throwable cause)
    {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind kind()
    {
        return kind;
    }
}
