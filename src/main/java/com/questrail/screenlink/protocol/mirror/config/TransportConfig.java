package com.questrail.screenlink.protocol.mirror.config;

import java.time.Duration;
import java.util.Objects;
import java.util.UUID;

/**
 * Carrier-level settings shared by the socket and RFCOMM transports.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>socketPort</b>: port used when a socket target names no port
 *       (9295).</li>
 *   <li><b>socketConnectTimeout</b>: TCP connect timeout (5 s).</li>
 *   <li><b>bluetoothConnectTimeout</b>: RFCOMM connect timeout handed to the
 *       platform connector (10 s).</li>
 *   <li><b>bluetoothServiceUuid</b>: SPP service record UUID.</li>
 *   <li><b>receiveBufferSize</b>: largest chunk a single {@code receive()}
 *       returns (64 KiB).</li>
 * </ul>
 *
 * <p>There is no steady-state read timeout: an idle link is not
 * a failed link.</p>
 */
public record TransportConfig(
        int socketPort,
        Duration socketConnectTimeout,
        Duration bluetoothConnectTimeout,
        UUID bluetoothServiceUuid,
        int receiveBufferSize
) {
    public static final int DEFAULT_SOCKET_PORT = 9295;

    public static final UUID SPP_UUID = UUID.fromString("00001101-0000-1000-8000-00805F9B34FB");

    public static final int DEFAULT_RECEIVE_BUFFER_SIZE = 64 * 1024;

    public TransportConfig {
        Objects.requireNonNull(socketConnectTimeout, "socketConnectTimeout");
        Objects.requireNonNull(bluetoothConnectTimeout, "bluetoothConnectTimeout");
        Objects.requireNonNull(bluetoothServiceUuid, "bluetoothServiceUuid");

        if (socketPort < 1 || socketPort > 0xFFFF) {
            throw new IllegalArgumentException("socketPort out of range: " + socketPort);
        }
        if (socketConnectTimeout.isNegative() || socketConnectTimeout.isZero()) {
            throw new IllegalArgumentException("socketConnectTimeout must be positive");
        }
        if (bluetoothConnectTimeout.isNegative() || bluetoothConnectTimeout.isZero()) {
            throw new IllegalArgumentException("bluetoothConnectTimeout must be positive");
        }
        if (receiveBufferSize <= 0) {
            throw new IllegalArgumentException("receiveBufferSize must be positive");
        }
    }

    public static TransportConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int socketPort = DEFAULT_SOCKET_PORT;
        private Duration socketConnectTimeout = Duration.ofSeconds(5);
        private Duration bluetoothConnectTimeout = Duration.ofSeconds(10);
        private UUID bluetoothServiceUuid = SPP_UUID;
        private int receiveBufferSize = DEFAULT_RECEIVE_BUFFER_SIZE;

        public Builder withSocketPort(int socketPort) {
            this.socketPort = socketPort;
            return this;
        }

        public Builder withSocketConnectTimeout(Duration timeout) {
            this.socketConnectTimeout = timeout;
            return this;
        }

        public Builder withBluetoothConnectTimeout(Duration timeout) {
            this.bluetoothConnectTimeout = timeout;
            return this;
        }

        public Builder withBluetoothServiceUuid(UUID uuid) {
            this.bluetoothServiceUuid = uuid;
            return this;
        }

        public Builder withReceiveBufferSize(int receiveBufferSize) {
            this.receiveBufferSize = receiveBufferSize;
            return this;
        }

        public TransportConfig build() {
            return new TransportConfig(socketPort, socketConnectTimeout, bluetoothConnectTimeout,
                    bluetoothServiceUuid, receiveBufferSize);
        }
    }
}
