package com.questrail.screenlink.protocol.mirror.transport.bluetooth;

import com.questrail.screenlink.api.ErrorKind;
import com.questrail.screenlink.protocol.mirror.config.TransportConfig;
import com.questrail.screenlink.protocol.mirror.transport.TransportException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Arrays;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RfcommTransportTest
 * -----------------------------------------------------------------------------
 * {@link RfcommTransport} over an in-process connector and channel.
 */
final class RfcommTransportTest
{
    private static final String DEVICE = "00:1A:7D:DA:71:13";

    private final FakeConnector connector = new FakeConnector();
    private final RfcommTransport transport = new RfcommTransport(connector, TransportConfig.defaults());

    @Test
    void missingAdapterIsIoError()
    {
        connector.adapter = false;
        TransportException e = assertThrows(TransportException.class, () -> transport.connect(DEVICE));
        assertEquals(ErrorKind.IO_ERROR, e.kind());
        assertEquals("Bluetooth not available", e.getMessage());
    }

    @Test
    void unpairedDeviceRequiresPairing()
    {
        connector.bonded = false;
        TransportException e = assertThrows(TransportException.class, () -> transport.connect(DEVICE));
        assertEquals(ErrorKind.PAIRING_REQUIRED, e.kind());
    }

    @Test
    void connectorFailuresAreClassified()
    {
        connector.failure = new SocketTimeoutException("no answer");
        assertEquals(ErrorKind.CONNECT_TIMEOUT,
                assertThrows(TransportException.class, () -> transport.connect(DEVICE)).kind());

        RfcommTransport second = new RfcommTransport(connector, TransportConfig.defaults());
        connector.failure = new ConnectException("service not found");
        assertEquals(ErrorKind.CONNECT_REFUSED,
                assertThrows(TransportException.class, () -> second.connect(DEVICE)).kind());

        RfcommTransport third = new RfcommTransport(connector, TransportConfig.defaults());
        connector.failure = new IOException("adapter reset");
        assertEquals(ErrorKind.IO_ERROR,
                assertThrows(TransportException.class, () -> third.connect(DEVICE)).kind());
    }

    @Test
    void connectUsesConfiguredServiceAndTimeout() throws Exception
    {
        transport.connect(DEVICE);

        assertEquals(DEVICE, connector.openedAddress);
        assertEquals(TransportConfig.SPP_UUID, connector.openedUuid);
        assertEquals(Duration.ofSeconds(10), connector.openedTimeout);
    }

    @Test
    void bytesFlowBothWays() throws Exception
    {
        transport.connect(DEVICE);

        transport.send(new byte[] { 1, 2, 3 });
        assertArrayEquals(new byte[] { 1, 2, 3 }, connector.channel.written.toByteArray());

        connector.channel.peerWrite(new byte[] { 4, 5 });
        assertArrayEquals(new byte[] { 4, 5 }, transport.receive());
    }

    @Test
    void peerCloseIsReported() throws Exception
    {
        transport.connect(DEVICE);
        connector.channel.peerClose();

        assertEquals(ErrorKind.PEER_CLOSED, assertThrows(TransportException.class, transport::receive).kind());
    }

    @Test
    void localCloseUnblocksReceive() throws Exception
    {
        transport.connect(DEVICE);
        CompletableFuture<ErrorKind> reader = CompletableFuture.supplyAsync(() -> {
            try {
                transport.receive();
                return null;
            }
            catch (TransportException e) {
                return e.kind();
            }
        });

        Thread.sleep(50);
        transport.close();

        assertEquals(ErrorKind.IO_ERROR, reader.get(5, TimeUnit.SECONDS));
        assertTrue(connector.channel.closed);
    }

    @Test
    void closeInterruptsPendingConnect() throws Exception
    {
        connector.hold = new CountDownLatch(1);
        CompletableFuture<ErrorKind> connecting = CompletableFuture.supplyAsync(() -> {
            try {
                transport.connect(DEVICE);
                return null;
            }
            catch (TransportException e) {
                return e.kind();
            }
        });

        assertTrue(connector.entered.await(5, TimeUnit.SECONDS));
        transport.close();

        assertEquals(ErrorKind.IO_ERROR, connecting.get(5, TimeUnit.SECONDS));
    }

    // -------------------------------------------------------------------------
    // Fakes
    // -------------------------------------------------------------------------

    private static final class FakeConnector implements RfcommConnector
    {
        volatile boolean adapter = true;
        volatile boolean bonded = true;
        volatile IOException failure;
        volatile CountDownLatch hold;
        final CountDownLatch entered = new CountDownLatch(1);

        volatile String openedAddress;
        volatile UUID openedUuid;
        volatile Duration openedTimeout;
        volatile PipeChannel channel;

        @Override
        public boolean isAdapterAvailable()
        {
            return adapter;
        }

        @Override
        public boolean isBonded(String deviceAddress)
        {
            return bonded;
        }

        @Override
        public RfcommChannel open(String deviceAddress, UUID serviceUuid, Duration timeout) throws IOException
        {
            entered.countDown();
            CountDownLatch h = hold;
            if (h != null) {
                try {
                    h.await();
                }
                catch (InterruptedException e) {
                    throw new InterruptedIOException("connect interrupted");
                }
            }
            if (failure != null) {
                throw failure;
            }
            openedAddress = deviceAddress;
            openedUuid = serviceUuid;
            openedTimeout = timeout;
            channel = new PipeChannel();
            return channel;
        }
    }

    /** Channel whose inbound side is fed by the test; closing it unblocks a pending read. */
    private static final class PipeChannel implements RfcommChannel
    {
        private static final byte[] END = new byte[0];
        private static final byte[] CLOSED = new byte[0];

        final LinkedBlockingDeque<byte[]> inbound = new LinkedBlockingDeque<>();
        final ByteArrayOutputStream written = new ByteArrayOutputStream();
        volatile boolean closed;

        private final InputStream in = new InputStream()
        {
            @Override
            public int read() throws IOException
            {
                byte[] one = new byte[1];
                return read(one, 0, 1) < 0 ? -1 : one[0] & 0xFF;
            }

            @Override
            public int read(byte[] b, int off, int len) throws IOException
            {
                final byte[] chunk;
                try {
                    chunk = inbound.takeFirst();
                }
                catch (InterruptedException e) {
                    throw new InterruptedIOException();
                }
                if (chunk == CLOSED) {
                    inbound.addFirst(CLOSED);
                    throw new IOException("channel closed");
                }
                if (chunk == END) {
                    inbound.addFirst(END);
                    return -1;
                }
                int n = Math.min(len, chunk.length);
                System.arraycopy(chunk, 0, b, off, n);
                if (n < chunk.length) {
                    inbound.addFirst(Arrays.copyOfRange(chunk, n, chunk.length));
                }
                return n;
            }
        };

        void peerWrite(byte[] data)
        {
            inbound.addLast(data.clone());
        }

        void peerClose()
        {
            inbound.addLast(END);
        }

        @Override
        public InputStream inputStream()
        {
            return in;
        }

        @Override
        public OutputStream outputStream()
        {
            return written;
        }

        @Override
        public void close()
        {
            closed = true;
            inbound.addFirst(CLOSED);
        }
    }
}
