package com.questrail.screenlink.protocol.mirror.transport.bluetooth;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * An open RFCOMM stream as handed out by the platform Bluetooth stack.
 *
 * <p>{@link #close()} must unblock a thread reading from {@link #inputStream()}.</p>
 */
public interface RfcommChannel extends Closeable
{
    InputStream inputStream() throws IOException;

    OutputStream outputStream() throws IOException;
}
