package com.questrail.screenlink.protocol.mirror.transport;

import com.questrail.screenlink.api.TransportKind;

/**
 * Transport
 * -----------------------------------------------------------------------------
 * Minimal port for a reliable, ordered byte-stream carrier.
 *
 * <p>The session owns exactly one {@code Transport} per connect attempt and
 * drives it from three threads: the connect worker calls {@link #connect},
 * the receive loop calls {@link #receive}, and the sender worker calls
 * {@link #send}. {@link #close()} may be called from any thread at any time.</p>
 *
 * <p>Implementations may be backed by Netty, a platform Bluetooth stack, or a
 * test double. They MUST NOT:</p>
 * <ul>
 *   <li>interpret frames</li>
 *   <li>retry failed connects</li>
 *   <li>impose a read timeout on an established link</li>
 * </ul>
 */
public interface Transport extends AutoCloseable
{
    TransportKind kind();

    /**
     * Establishes the link. Blocks until connected, failed, or closed.
     *
     * @param target carrier-specific address
     * @throws TransportException classified as {@code CONNECT_TIMEOUT},
     *         {@code CONNECT_REFUSED}, {@code PAIRING_REQUIRED} or
     *         {@code IO_ERROR}
     */
    void connect(String target) throws TransportException;

    /**
     * Writes all of {@code data}. Blocks until written or failed.
     */
    void send(byte[] data) throws TransportException;

    /**
     * Blocks until at least one byte is available and returns what arrived.
     *
     * @return a non-empty chunk
     * @throws TransportException {@code PEER_CLOSED} on orderly end of stream,
     *         {@code IO_ERROR} on failure or after local close
     */
    byte[] receive() throws TransportException;

    /**
     * Releases the carrier. Idempotent. Any thread blocked in
     * {@link #connect}, {@link #send} or {@link #receive} returns promptly with
     * a {@link TransportException}.
     */
    @Override
    void close();
}
