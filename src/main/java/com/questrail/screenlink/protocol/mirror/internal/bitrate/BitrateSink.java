package com.questrail.screenlink.protocol.mirror.internal.bitrate;

/**
 * Encoder-side receiver of bitrate targets.
 */
@FunctionalInterface
public interface BitrateSink
{
    void applyTargetBitrate(TargetBitrate target);
}
