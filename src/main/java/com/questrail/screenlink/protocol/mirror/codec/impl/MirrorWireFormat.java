package com.questrail.screenlink.protocol.mirror.codec.impl;

import com.questrail.screenlink.protocol.mirror.crypto.CryptoEngine;

/**
 * MirrorWireFormat
 * -----------------------------------------------------------------------------
 * Fixed offsets and bounds of the mirroring frame layout.
 *
 * <pre>
 *   Video: [tag:1][size:4][flags:4][timestampMicros:8][nonce:12][ciphertext+tag:size-12]
 *   Input: [tag:1][nameLen:1][name:nameLen][code:4][value:4]
 * </pre>
 *
 * <p>All multi-byte integers are big-endian; {@code value} is an IEEE-754
 * single in big-endian byte order.</p>
 */
public final class MirrorWireFormat
{
    /** Tag byte plus the video header that precedes the sealed payload. */
    public static final int VIDEO_HEADER_LENGTH = 1 + 4 + 4 + 8;

    /** Smallest legal video {@code size}: a nonce with no ciphertext. */
    public static final int MIN_VIDEO_PAYLOAD = CryptoEngine.NONCE_LENGTH;

    /** Default upper bound on a video {@code size} field (16 MiB). */
    public static final int DEFAULT_MAX_VIDEO_PAYLOAD = 16 * 1024 * 1024;

    /** Tag byte plus the name length byte. */
    public static final int INPUT_PREFIX_LENGTH = 2;

    /** Code and value following the kind name. */
    public static final int INPUT_SUFFIX_LENGTH = 4 + 4;

    /** Value written for a touchpad sample whose contact was released. */
    public static final float TOUCHPAD_RELEASED = -1.0f;

    private MirrorWireFormat() {}

    static int readInt(byte[] b, int off)
    {
        return ((b[off] & 0xFF) << 24)
                | ((b[off + 1] & 0xFF) << 16)
                | ((b[off + 2] & 0xFF) << 8)
                | (b[off + 3] & 0xFF);
    }

    static long readUnsignedInt(byte[] b, int off)
    {
        return readInt(b, off) & 0xFFFF_FFFFL;
    }

    static long readLong(byte[] b, int off)
    {
        return ((long) readInt(b, off) << 32) | readUnsignedInt(b, off + 4);
    }
}
