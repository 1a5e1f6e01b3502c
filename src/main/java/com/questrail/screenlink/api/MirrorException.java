package com.questrail.screenlink.api;

import java.util.Objects;

/**
 * Base unchecked exception for failures raised by the mirroring core to its
 * callers. Every instance carries the {@link ErrorKind} that classifies it.
 */
public class MirrorException extends RuntimeException
{
    private final ErrorKind kind;

    public MirrorException(ErrorKind kind, String message)
    {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public MirrorException(ErrorKind kind, String message, Throwable cause)
    {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind kind()
    {
        return kind;
    }
}
