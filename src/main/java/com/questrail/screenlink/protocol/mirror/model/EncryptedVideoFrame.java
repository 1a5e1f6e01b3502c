package com.questrail.screenlink.protocol.mirror.model;

import com.questrail.screenlink.protocol.mirror.crypto.CryptoEngine;

import java.util.Arrays;
import java.util.Objects;

/**
 * EncryptedVideoFrame
 * -----------------------------------------------------------------------------
 * A video frame as it travels on the wire: clear metadata plus the sealed
 * payload {@code nonce || ciphertext || tag}.
 *
 * <p>The frame header's size field is the length of {@link #sealedPayload()}.
 * Flags and timestamp are not secret and are never interpreted here.</p>
 */
public record EncryptedVideoFrame(int flags, long timestampMicros, byte[] sealedPayload) implements MirrorFrame
{
    public EncryptedVideoFrame
    {
        Objects.requireNonNull(sealedPayload, "sealedPayload");
        if (sealedPayload.length < CryptoEngine.NONCE_LENGTH) {
            throw new IllegalArgumentException("sealed payload shorter than nonce: " + sealedPayload.length);
        }
    }

    @Override
    public FrameType type()
    {
        return FrameType.VIDEO;
    }

    /** Payload length as written in the frame header. */
    public int size()
    {
        return sealedPayload.length;
    }

    public byte[] nonce()
    {
        return Arrays.copyOfRange(sealedPayload, 0, CryptoEngine.NONCE_LENGTH);
    }

    /** Ciphertext followed by the authentication tag. */
    public byte[] ciphertext()
    {
        return Arrays.copyOfRange(sealedPayload, CryptoEngine.NONCE_LENGTH, sealedPayload.length);
    }

    @Override
    public String toString()
    {
        return "EncryptedVideoFrame[size=" + sealedPayload.length
                + ", flags=0x" + Integer.toHexString(flags)
                + ", timestampMicros=" + timestampMicros + "]";
    }
}
