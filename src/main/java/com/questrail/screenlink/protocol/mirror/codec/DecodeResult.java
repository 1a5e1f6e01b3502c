package com.questrail.screenlink.protocol.mirror.codec;

import com.questrail.screenlink.protocol.mirror.model.MirrorFrame;

import java.util.Objects;

/**
 * DecodeResult
 * -----------------------------------------------------------------------------
 * Outcome of one {@link MirrorFrameDecoder#decodeNext()} call.
 *
 * <ul>
 *   <li>{@link Decoded}: exactly one complete frame was consumed</li>
 *   <li>{@link NeedMoreData}: the buffered bytes do not yet hold a full frame;
 *       nothing was consumed</li>
 *   <li>{@link Malformed}: the bytes at the head of the buffer violate the
 *       wire format; the offending bytes were discarded and decoding may
 *       continue</li>
 * </ul>
 */
public sealed interface DecodeResult
        permits DecodeResult.Decoded, DecodeResult.NeedMoreData, DecodeResult.Malformed
{
    record Decoded(MirrorFrame frame) implements DecodeResult
    {
        public Decoded
        {
            Objects.requireNonNull(frame, "frame");
        }
    }

    enum NeedMoreData implements DecodeResult
    {
        INSTANCE
    }

    record Malformed(String reason) implements DecodeResult
    {
        public Malformed
        {
            Objects.requireNonNull(reason, "reason");
        }
    }
}
