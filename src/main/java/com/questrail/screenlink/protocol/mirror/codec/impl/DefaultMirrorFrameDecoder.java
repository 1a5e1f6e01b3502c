package com.questrail.screenlink.protocol.mirror.codec.impl;

import com.questrail.screenlink.api.InputEvent;
import com.questrail.screenlink.api.InputKind;
import com.questrail.screenlink.protocol.mirror.codec.DecodeResult;
import com.questrail.screenlink.protocol.mirror.codec.MirrorFrameDecoder;
import com.questrail.screenlink.protocol.mirror.model.EncryptedVideoFrame;
import com.questrail.screenlink.protocol.mirror.model.FrameType;
import com.questrail.screenlink.protocol.mirror.model.InputFrame;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * DefaultMirrorFrameDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link MirrorFrameDecoder}.
 *
 * <p>Each call to {@link #decodeNext()} performs the following steps, in order:</p>
 * <ol>
 *   <li>Tag demultiplexing (unknown tag bytes are discarded as one run)</li>
 *   <li>Header completeness check</li>
 *   <li>Length bound check, before any payload is buffered</li>
 *   <li>Payload completeness check</li>
 *   <li>Structural parsing into a {@link com.questrail.screenlink.protocol.mirror.model.MirrorFrame}</li>
 * </ol>
 *
 * <h2>Oversized frames</h2>
 * A video header announcing a size outside {@code [12, maxVideoPayload]} is
 * reported as {@link DecodeResult.Malformed} and the announced payload is then
 * discarded as it arrives, without ever being stored. This keeps memory bounded
 * and leaves the stream aligned on the next frame.
 *
 * <h2>Thread Safety</h2>
 * Not thread-safe. Owned by a single receive loop.
 */
public final class DefaultMirrorFrameDecoder implements MirrorFrameDecoder
{
    private static final int INITIAL_CAPACITY = 8 * 1024;

    private final int maxVideoPayload;

    private byte[] buffer = new byte[INITIAL_CAPACITY];
    private int start;
    private int end;

    /** Bytes of a rejected payload still to be dropped from the stream. */
    private long skipRemaining;

    public DefaultMirrorFrameDecoder()
    {
        this(MirrorWireFormat.DEFAULT_MAX_VIDEO_PAYLOAD);
    }

    public DefaultMirrorFrameDecoder(int maxVideoPayload)
    {
        if (maxVideoPayload < MirrorWireFormat.MIN_VIDEO_PAYLOAD) {
            throw new IllegalArgumentException("maxVideoPayload must be >= "
                    + MirrorWireFormat.MIN_VIDEO_PAYLOAD + ": " + maxVideoPayload);
        }
        this.maxVideoPayload = maxVideoPayload;
    }

    @Override
    public void append(byte[] chunk, int offset, int length)
    {
        Objects.requireNonNull(chunk, "chunk");
        Objects.checkFromIndexSize(offset, length, chunk.length);

        if (skipRemaining > 0) {
            int skipped = (int) Math.min(skipRemaining, length);
            skipRemaining -= skipped;
            offset += skipped;
            length -= skipped;
        }
        if (length == 0) {
            return;
        }

        ensureWritable(length);
        System.arraycopy(chunk, offset, buffer, end, length);
        end += length;
    }

    @Override
    public DecodeResult decodeNext()
    {
        if (available() == 0) {
            return DecodeResult.NeedMoreData.INSTANCE;
        }

        final int tag = buffer[start] & 0xFF;
        final Optional<FrameType> type = FrameType.fromTag(tag);
        if (type.isEmpty()) {
            return discardUnknownTags();
        }

        return switch (type.get()) {
            case VIDEO -> decodeVideo();
            case INPUT -> decodeInput();
        };
    }

    @Override
    public int bufferedBytes()
    {
        return available();
    }

    @Override
    public void reset()
    {
        start = 0;
        end = 0;
        skipRemaining = 0;
        if (buffer.length > INITIAL_CAPACITY) {
            buffer = new byte[INITIAL_CAPACITY];
        }
    }

    // -------------------------------------------------------------------------
    // Frame bodies
    // -------------------------------------------------------------------------

    private DecodeResult decodeVideo()
    {
        if (available() < MirrorWireFormat.VIDEO_HEADER_LENGTH) {
            return DecodeResult.NeedMoreData.INSTANCE;
        }

        final long size = MirrorWireFormat.readUnsignedInt(buffer, start + 1);
        if (size < MirrorWireFormat.MIN_VIDEO_PAYLOAD || size > maxVideoPayload) {
            consume(MirrorWireFormat.VIDEO_HEADER_LENGTH);
            skip(size);
            return new DecodeResult.Malformed("video size " + size + " outside ["
                    + MirrorWireFormat.MIN_VIDEO_PAYLOAD + ", " + maxVideoPayload + "]");
        }

        final int total = MirrorWireFormat.VIDEO_HEADER_LENGTH + (int) size;
        if (available() < total) {
            // Header is trusted now; reserve room for the whole frame once.
            ensureWritable(total - available());
            return DecodeResult.NeedMoreData.INSTANCE;
        }

        final int flags = MirrorWireFormat.readInt(buffer, start + 5);
        final long timestampMicros = MirrorWireFormat.readLong(buffer, start + 9);
        final int payloadStart = start + MirrorWireFormat.VIDEO_HEADER_LENGTH;
        final byte[] sealed = Arrays.copyOfRange(buffer, payloadStart, payloadStart + (int) size);
        consume(total);

        return new DecodeResult.Decoded(new EncryptedVideoFrame(flags, timestampMicros, sealed));
    }

    private DecodeResult decodeInput()
    {
        if (available() < MirrorWireFormat.INPUT_PREFIX_LENGTH) {
            return DecodeResult.NeedMoreData.INSTANCE;
        }

        final int nameLength = buffer[start + 1] & 0xFF;
        if (nameLength == 0) {
            consume(MirrorWireFormat.INPUT_PREFIX_LENGTH);
            return new DecodeResult.Malformed("input frame with empty kind name");
        }

        final int total = MirrorWireFormat.INPUT_PREFIX_LENGTH + nameLength + MirrorWireFormat.INPUT_SUFFIX_LENGTH;
        if (available() < total) {
            return DecodeResult.NeedMoreData.INSTANCE;
        }

        final int nameStart = start + MirrorWireFormat.INPUT_PREFIX_LENGTH;
        for (int i = nameStart; i < nameStart + nameLength; i++) {
            if ((buffer[i] & 0x80) != 0) {
                consume(total);
                return new DecodeResult.Malformed("non-ASCII byte in input kind name");
            }
        }

        final String name = new String(buffer, nameStart, nameLength, StandardCharsets.US_ASCII);
        final int code = MirrorWireFormat.readInt(buffer, nameStart + nameLength);
        final float value = Float.intBitsToFloat(MirrorWireFormat.readInt(buffer, nameStart + nameLength + 4));
        consume(total);

        final Optional<InputKind> kind = InputKind.fromWireName(name);
        if (kind.isEmpty()) {
            return new DecodeResult.Malformed("unknown input kind '" + name + "'");
        }

        try {
            return new DecodeResult.Decoded(new InputFrame(toEvent(kind.get(), code, value)));
        }
        catch (IllegalArgumentException e) {
            return new DecodeResult.Malformed("invalid " + name + " sample: " + e.getMessage());
        }
    }

    private static InputEvent toEvent(InputKind kind, int code, float value)
    {
        if (kind == InputKind.TOUCHPAD) {
            return value == MirrorWireFormat.TOUCHPAD_RELEASED
                    ? InputEvent.touchReleased(code)
                    : InputEvent.touch(code, value);
        }
        return new InputEvent(kind, code, value, true);
    }

    private DecodeResult discardUnknownTags()
    {
        final int first = buffer[start] & 0xFF;
        int n = 0;
        while (n < available() && FrameType.fromTag(buffer[start + n]).isEmpty()) {
            n++;
        }
        consume(n);
        return new DecodeResult.Malformed(n == 1
                ? String.format("unknown frame tag 0x%02X", first)
                : String.format("%d unknown tag bytes starting with 0x%02X", n, first));
    }

    // -------------------------------------------------------------------------
    // Buffer management
    // -------------------------------------------------------------------------

    private int available()
    {
        return end - start;
    }

    private void consume(int n)
    {
        start += n;
        if (start == end) {
            start = 0;
            end = 0;
        }
    }

    /** Drops {@code n} bytes, taking what is buffered now and the rest on later appends. */
    private void skip(long n)
    {
        final int buffered = (int) Math.min(n, available());
        consume(buffered);
        skipRemaining = n - buffered;
    }

    private void ensureWritable(int n)
    {
        if (buffer.length - end >= n) {
            return;
        }

        final int live = available();
        final int required = live + n;
        if (required <= buffer.length) {
            System.arraycopy(buffer, start, buffer, 0, live);
        }
        else {
            final int capacity = Math.max(required, Math.min(buffer.length * 2, Integer.MAX_VALUE - 8));
            byte[] grown = new byte[capacity];
            System.arraycopy(buffer, start, grown, 0, live);
            buffer = grown;
        }
        start = 0;
        end = live;
    }
}
