package com.questrail.screenlink.protocol.mirror.model;

import java.util.Optional;

/**
 * FrameType
 * -----------------------------------------------------------------------------
 * One-byte tag that opens every frame on the wire. The tag lets a single
 * receive loop demultiplex video and input deterministically.
 */
public enum FrameType
{
    VIDEO((byte) 0x01),
    INPUT((byte) 0x02);

    private final byte tag;

    FrameType(byte tag)
    {
        this.tag = tag;
    }

    public byte tag()
    {
        return tag;
    }

    public static Optional<FrameType> fromTag(int tag)
    {
        for (FrameType type : values()) {
            if ((type.tag & 0xFF) == (tag & 0xFF)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
