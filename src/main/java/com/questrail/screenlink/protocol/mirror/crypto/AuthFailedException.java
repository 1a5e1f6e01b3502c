package com.questrail.screenlink.protocol.mirror.crypto;

import com.questrail.screenlink.api.ErrorKind;
import com.questrail.screenlink.api.MirrorException;

/**
 * A sealed payload failed authentication: the tag did not verify or the input
 * was too short to carry a nonce and tag.
 */
public final class AuthFailedException extends MirrorException
{
    public AuthFailedException(String message)
    {
        super(ErrorKind.AUTH_FAILED, message);
    }

    public AuthFailedException(String message, Throwable cause)
    {
        super(ErrorKind.AUTH_FAILED, message, cause);
    }
}
