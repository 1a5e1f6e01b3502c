package com.questrail.screenlink.protocol.mirror.codec;

import com.questrail.screenlink.api.InputEvent;
import com.questrail.screenlink.protocol.mirror.model.EncryptedVideoFrame;
import com.questrail.screenlink.protocol.mirror.model.InputFrame;
import com.questrail.screenlink.protocol.mirror.model.MirrorFrame;

/**
 * MirrorFrameEncoder
 * -----------------------------------------------------------------------------
 * Byte-level encoder for the mirroring wire format.
 *
 * <p><strong>Layering note:</strong> this encoder does not encrypt. Video
 * payloads reach it already sealed by the crypto engine; it only prepends the
 * type tag and the fixed header.</p>
 */
public interface MirrorFrameEncoder
{
    /**
     * Encodes a video frame.
     *
     * @param sealedPayload   {@code nonce || ciphertext || tag}
     * @param flags           opaque encoder flags
     * @param timestampMicros presentation timestamp
     * @return wire-ready bytes
     */
    byte[] encodeVideoFrame(byte[] sealedPayload, int flags, long timestampMicros);

    /**
     * Encodes a controller sample.
     */
    byte[] encodeInputEvent(InputEvent event);

    default byte[] encode(MirrorFrame frame)
    {
        if (frame instanceof EncryptedVideoFrame v) {
            return encodeVideoFrame(v.sealedPayload(), v.flags(), v.timestampMicros());
        }
        if (frame instanceof InputFrame i) {
            return encodeInputEvent(i.event());
        }
        throw new IllegalArgumentException("Unsupported frame: " + frame);
    }
}
