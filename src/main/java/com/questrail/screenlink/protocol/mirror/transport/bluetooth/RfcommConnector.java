package com.questrail.screenlink.protocol.mirror.transport.bluetooth;

import java.io.IOException;
import java.time.Duration;
import java.util.UUID;

/**
 * RfcommConnector
 * -----------------------------------------------------------------------------
 * Platform port onto the local Bluetooth stack.
 *
 * <p>The mirroring core does not discover or pair devices. It asks the
 * platform whether a peer is already bonded and, if so, opens a client
 * channel to the peer's service record.</p>
 *
 * <p>Implementations report a connect timeout as
 * {@link java.net.SocketTimeoutException} and a peer that rejects the service
 * as {@link java.net.ConnectException}; any other {@link IOException} is
 * treated as a generic I/O failure.</p>
 */
public interface RfcommConnector
{
    /** {@code false} if the host has no usable Bluetooth adapter. */
    boolean isAdapterAvailable();

    boolean isBonded(String deviceAddress);

    /**
     * Opens a client channel. Blocks until connected, failed, or
     * {@code timeout} has elapsed.
     */
    RfcommChannel open(String deviceAddress, UUID serviceUuid, Duration timeout) throws IOException;
}
