package com.questrail.screenlink.protocol.mirror.internal.bitrate;

/**
 * An encoder bitrate chosen by the {@link BitrateController}.
 */
public record TargetBitrate(int bitsPerSecond)
{
    public TargetBitrate
    {
        if (bitsPerSecond <= 0) {
            throw new IllegalArgumentException("bitsPerSecond must be positive: " + bitsPerSecond);
        }
    }
}
