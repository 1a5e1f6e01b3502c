package com.questrail.screenlink.protocol.mirror.model;

/**
 * MirrorFrame
 * -----------------------------------------------------------------------------
 * Post-wire representation of one demultiplexed frame.
 *
 * <p>A {@code MirrorFrame} exists only after the codec has validated the frame
 * structure. It carries no byte-level artifacts (tags, length fields) and no
 * plaintext video; decryption happens above the codec.</p>
 */
public sealed interface MirrorFrame permits EncryptedVideoFrame, InputFrame
{
    FrameType type();
}
