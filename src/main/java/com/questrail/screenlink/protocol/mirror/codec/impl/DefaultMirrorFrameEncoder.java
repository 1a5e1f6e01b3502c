package com.questrail.screenlink.protocol.mirror.codec.impl;

import com.questrail.screenlink.api.InputEvent;
import com.questrail.screenlink.api.InputKind;
import com.questrail.screenlink.protocol.mirror.codec.MirrorFrameEncoder;
import com.questrail.screenlink.protocol.mirror.model.FrameType;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * DefaultMirrorFrameEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link MirrorFrameEncoder}.
 *
 * <p>This is the mechanical inverse of {@link DefaultMirrorFrameDecoder}. Every
 * output buffer is allocated once at its exact final size; the layout is fixed
 * so nothing is ever resized.</p>
 */
public final class DefaultMirrorFrameEncoder implements MirrorFrameEncoder
{
    @Override
    public byte[] encodeVideoFrame(byte[] sealedPayload, int flags, long timestampMicros)
    {
        Objects.requireNonNull(sealedPayload, "sealedPayload");
        if (sealedPayload.length < MirrorWireFormat.MIN_VIDEO_PAYLOAD) {
            throw new IllegalArgumentException("sealed payload shorter than nonce: " + sealedPayload.length);
        }

        ByteBuffer out = ByteBuffer.allocate(MirrorWireFormat.VIDEO_HEADER_LENGTH + sealedPayload.length);
        out.put(FrameType.VIDEO.tag());
        out.putInt(sealedPayload.length);
        out.putInt(flags);
        out.putLong(timestampMicros);
        out.put(sealedPayload);
        return out.array();
    }

    @Override
    public byte[] encodeInputEvent(InputEvent event)
    {
        Objects.requireNonNull(event, "event");

        final byte[] name = event.kind().wireName().getBytes(StandardCharsets.US_ASCII);
        final float value = (event.kind() == InputKind.TOUCHPAD && !event.active())
                ? MirrorWireFormat.TOUCHPAD_RELEASED
                : event.value();

        ByteBuffer out = ByteBuffer.allocate(
                MirrorWireFormat.INPUT_PREFIX_LENGTH + name.length + MirrorWireFormat.INPUT_SUFFIX_LENGTH);
        out.put(FrameType.INPUT.tag());
        out.put((byte) name.length);
        out.put(name);
        out.putInt(event.code());
        out.putFloat(value);
        return out.array();
    }
}
