package com.questrail.screenlink.api;

import java.util.Objects;

/**
 * VideoFrame
 * -----------------------------------------------------------------------------
 * One encoded video frame as exchanged with the encoder and decoder
 * collaborators: plaintext payload plus the metadata that travels in the
 * clear frame header.
 *
 * <p>The payload array is not copied. Producers hand ownership to the core
 * and consumers receive an array nobody else references.</p>
 *
 * @param payload          encoded (plaintext) frame bytes
 * @param flags            opaque encoder flags, e.g. a key-frame marker
 * @param timestampMicros  presentation timestamp in microseconds
 */
public record VideoFrame(byte[] payload, int flags, long timestampMicros)
{
    public VideoFrame
    {
        Objects.requireNonNull(payload, "payload");
    }

    public int size()
    {
        return payload.length;
    }

    @Override
    public String toString()
    {
        return "VideoFrame[size=" + payload.length
                + ", flags=0x" + Integer.toHexString(flags)
                + ", timestampMicros=" + timestampMicros + "]";
    }
}
