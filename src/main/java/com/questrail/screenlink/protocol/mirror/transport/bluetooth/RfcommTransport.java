package com.questrail.screenlink.protocol.mirror.transport.bluetooth;

import com.questrail.screenlink.api.ErrorKind;
import com.questrail.screenlink.api.TransportKind;
import com.questrail.screenlink.protocol.mirror.config.TransportConfig;
import com.questrail.screenlink.protocol.mirror.transport.Transport;
import com.questrail.screenlink.protocol.mirror.transport.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * RfcommTransport
 * =============================================================================
 * Bluetooth implementation of the {@link Transport} port.
 *
 * <h2>Architectural Role</h2>
 * A <strong>pure transport adapter</strong> over a {@link RfcommConnector}.
 * Targets are device addresses. The peer must already be bonded; an unbonded
 * peer is reported as {@link ErrorKind#PAIRING_REQUIRED} without attempting
 * a connection.
 *
 * <h2>Blocking model</h2>
 * Reads block on the channel's input stream in chunks of at most
 * {@link TransportConfig#receiveBufferSize()} bytes. {@link #close()} closes
 * the channel, which unblocks the reader, and interrupts a thread still
 * inside {@link RfcommConnector#open}.
 */
public final class RfcommTransport implements Transport
{
    private static final Logger log = LoggerFactory.getLogger(RfcommTransport.class);

    private final RfcommConnector connector;
    private final TransportConfig config;

    private final AtomicBoolean closed = new AtomicBoolean();
    private final Object writeLock = new Object();

    private volatile Thread connectingThread;
    private volatile RfcommChannel channel;
    private volatile InputStream in;
    private volatile OutputStream out;

    private final byte[] readBuffer;

    public RfcommTransport(RfcommConnector connector, TransportConfig config)
    {
        this.connector = Objects.requireNonNull(connector, "connector");
        this.config = Objects.requireNonNull(config, "config");
        this.readBuffer = new byte[config.receiveBufferSize()];
    }

    @Override
    public TransportKind kind()
    {
        return TransportKind.BLUETOOTH;
    }

    @Override
    public void connect(String target) throws TransportException
    {
        Objects.requireNonNull(target, "target");
        if (closed.get()) {
            throw new TransportException(ErrorKind.IO_ERROR, "transport closed");
        }
        if (!connector.isAdapterAvailable()) {
            throw new TransportException(ErrorKind.IO_ERROR, "Bluetooth not available");
        }
        if (!connector.isBonded(target)) {
            throw new TransportException(ErrorKind.PAIRING_REQUIRED, "device " + target + " is not paired");
        }

        final RfcommChannel opened;
        connectingThread = Thread.currentThread();
        try {
            opened = connector.open(target, config.bluetoothServiceUuid(), config.bluetoothConnectTimeout());
        }
        catch (SocketTimeoutException e) {
            throw new TransportException(ErrorKind.CONNECT_TIMEOUT, "RFCOMM connect to " + target + " timed out", e);
        }
        catch (ConnectException e) {
            throw new TransportException(ErrorKind.CONNECT_REFUSED,
                    "RFCOMM connect to " + target + " refused: " + e.getMessage(), e);
        }
        catch (IOException e) {
            if (closed.get()) {
                throw new TransportException(ErrorKind.IO_ERROR, "transport closed during connect", e);
            }
            throw new TransportException(ErrorKind.IO_ERROR,
                    "RFCOMM connect to " + target + " failed: " + e.getMessage(), e);
        }
        finally {
            connectingThread = null;
            // Clear an interrupt raised by close() so it does not leak into the worker.
            if (closed.get()) {
                Thread.interrupted();
            }
        }

        try {
            in = opened.inputStream();
            out = opened.outputStream();
        }
        catch (IOException e) {
            closeQuietly(opened);
            throw new TransportException(ErrorKind.IO_ERROR, "RFCOMM streams unavailable: " + e.getMessage(), e);
        }

        channel = opened;
        if (closed.get()) {
            closeQuietly(opened);
            throw new TransportException(ErrorKind.IO_ERROR, "transport closed during connect");
        }
    }

    @Override
    public void send(byte[] data) throws TransportException
    {
        Objects.requireNonNull(data, "data");
        OutputStream os = out;
        if (os == null || closed.get()) {
            throw new TransportException(ErrorKind.IO_ERROR, "transport not connected");
        }

        synchronized (writeLock) {
            try {
                os.write(data);
                os.flush();
            }
            catch (IOException e) {
                throw new TransportException(ErrorKind.IO_ERROR, "RFCOMM send failed: " + e.getMessage(), e);
            }
        }
    }

    @Override
    public byte[] receive() throws TransportException
    {
        InputStream is = in;
        if (is == null || closed.get()) {
            throw new TransportException(ErrorKind.IO_ERROR, "transport not connected");
        }

        final int n;
        try {
            n = is.read(readBuffer);
        }
        catch (IOException e) {
            if (closed.get()) {
                throw new TransportException(ErrorKind.IO_ERROR, "transport closed", e);
            }
            throw new TransportException(ErrorKind.IO_ERROR, "RFCOMM receive failed: " + e.getMessage(), e);
        }

        if (n < 0) {
            if (closed.get()) {
                throw new TransportException(ErrorKind.IO_ERROR, "transport closed");
            }
            throw new TransportException(ErrorKind.PEER_CLOSED, "peer closed the RFCOMM channel");
        }
        return Arrays.copyOf(readBuffer, n);
    }

    @Override
    public void close()
    {
        if (!closed.compareAndSet(false, true)) {
            return;
        }

        Thread t = connectingThread;
        if (t != null) {
            t.interrupt();
        }

        RfcommChannel ch = channel;
        if (ch != null) {
            closeQuietly(ch);
        }
    }

    private static void closeQuietly(RfcommChannel ch)
    {
        try {
            ch.close();
        }
        catch (IOException e) {
            log.debug("RFCOMM channel close failed: {}", e.getMessage(), e);
        }
    }
}
