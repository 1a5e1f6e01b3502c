package com.questrail.screenlink.protocol.mirror.codec;

/**
 * MirrorFrameDecoder
 * -----------------------------------------------------------------------------
 * Incremental, byte-level decoder for the mirroring wire format.
 *
 * <p>Stream carriers (TCP, RFCOMM) preserve no message boundaries. The decoder
 * therefore owns an accumulation buffer: the receive loop appends whatever
 * chunk the carrier produced and then calls {@link #decodeNext()} until it
 * reports {@link DecodeResult.NeedMoreData}.</p>
 *
 * <p>The decoder is responsible only for:</p>
 * <ul>
 *   <li>Demultiplexing frames by their type tag</li>
 *   <li>Validating structure and length bounds</li>
 *   <li>Discarding malformed bytes so decoding can continue</li>
 * </ul>
 *
 * <p>The decoder is <strong>not</strong> responsible for decryption, for
 * dispatching frames, or for deciding whether a malformed frame is fatal.</p>
 *
 * <p>Implementations are not thread-safe; each session's receive loop owns one
 * instance.</p>
 */
public interface MirrorFrameDecoder
{
    /**
     * Appends bytes received from the carrier.
     */
    void append(byte[] chunk, int offset, int length);

    default void append(byte[] chunk)
    {
        append(chunk, 0, chunk.length);
    }

    /**
     * Attempts to take exactly one frame off the head of the buffer.
     *
     * <p>Decoding is resumable: the same frame split across any sequence of
     * {@link #append} calls decodes identically.</p>
     */
    DecodeResult decodeNext();

    /** Number of bytes currently held and not yet decoded. */
    int bufferedBytes();

    /** Drops all buffered state. */
    void reset();
}
