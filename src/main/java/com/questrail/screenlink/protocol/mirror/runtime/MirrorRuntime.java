package com.questrail.screenlink.protocol.mirror.runtime;

import com.questrail.screenlink.api.MirrorSession;
import com.questrail.screenlink.api.TransportKind;
import com.questrail.screenlink.protocol.mirror.MirrorSessionController;
import com.questrail.screenlink.protocol.mirror.config.MirrorConfig;
import com.questrail.screenlink.protocol.mirror.crypto.CryptoEngine;
import com.questrail.screenlink.protocol.mirror.crypto.JcaSecureKeyStore;
import com.questrail.screenlink.protocol.mirror.crypto.SecureKeyStore;
import com.questrail.screenlink.protocol.mirror.internal.bitrate.AdaptiveBitrateDriver;
import com.questrail.screenlink.protocol.mirror.internal.bitrate.BitrateController;
import com.questrail.screenlink.protocol.mirror.internal.bitrate.BitrateSink;
import com.questrail.screenlink.protocol.mirror.internal.input.InputForwarder;
import com.questrail.screenlink.protocol.mirror.internal.input.InputStateFilter;
import com.questrail.screenlink.protocol.mirror.internal.time.MonotonicClock;
import com.questrail.screenlink.protocol.mirror.internal.time.MonotonicScheduler;
import com.questrail.screenlink.protocol.mirror.internal.time.ScheduledExecutorScheduler;
import com.questrail.screenlink.protocol.mirror.internal.time.SystemMonotonicClock;
import com.questrail.screenlink.protocol.mirror.internal.time.SystemWallClock;
import com.questrail.screenlink.protocol.mirror.observability.SessionObservabilitySink;
import com.questrail.screenlink.protocol.mirror.observability.Slf4jSessionObservabilitySink;
import com.questrail.screenlink.protocol.mirror.transport.TransportFactory;
import com.questrail.screenlink.protocol.mirror.transport.bluetooth.RfcommConnector;
import com.questrail.screenlink.protocol.mirror.transport.bluetooth.RfcommTransport;
import com.questrail.screenlink.protocol.mirror.transport.socket.SocketTarget;
import com.questrail.screenlink.protocol.mirror.transport.socket.netty.NettySocketTransport;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * MirrorRuntime
 * =============================================================================
 * Composition root and lifecycle owner for one screen-mirroring endpoint.
 *
 * <p>Wires the key store, crypto engine, carriers, session controller,
 * adaptive bitrate loop and input forwarder. Exactly one session controller
 * exists per runtime; build one runtime per process.</p>
 *
 * <pre>
 *   MirrorRuntime runtime = MirrorRuntime.builder()
 *           .withConfig(MirrorConfig.load())
 *           .withBitrateSink(target -> encoder.setBitrate(target.bitsPerSecond()))
 *           .build();
 *   runtime.start();
 *   runtime.connectWifi("192.168.1.20", 9295);
 *   ...
 *   runtime.release();
 * </pre>
 */
public final class MirrorRuntime {
    private final MirrorConfig config;
    private final MirrorSessionController session;
    private final AdaptiveBitrateDriver bitrateDriver;
    private final BitrateController bitrateController;
    private final InputForwarder inputForwarder;
    private final ScheduledExecutorService schedulerExecutor;

    private MirrorRuntime(
            MirrorConfig config,
            MirrorSessionController session,
            AdaptiveBitrateDriver bitrateDriver,
            BitrateController bitrateController,
            InputForwarder inputForwarder,
            ScheduledExecutorService schedulerExecutor) {
        this.config = config;
        this.session = session;
        this.bitrateDriver = bitrateDriver;
        this.bitrateController = bitrateController;
        this.inputForwarder = inputForwarder;
        this.schedulerExecutor = schedulerExecutor;
    }

    /** Starts the adaptive bitrate loop. */
    public void start() {
        bitrateDriver.start();
    }

    public long connectWifi(String host, int port) {
        return session.connect(TransportKind.WIFI_SOCKET, new SocketTarget(host, port).toString());
    }

    /** Connects on the configured default port. */
    public long connectWifi(String host) {
        return connectWifi(host, config.transport().socketPort());
    }

    public long connectBluetooth(String deviceAddress) {
        return session.connect(TransportKind.BLUETOOTH, deviceAddress);
    }

    public MirrorSession session() {
        return session;
    }

    public InputForwarder input() {
        return inputForwarder;
    }

    public BitrateController bitrate() {
        return bitrateController;
    }

    public MirrorConfig config() {
        return config;
    }

    /**
     * Ends any session and stops every worker this runtime owns. The runtime
     * cannot be restarted afterwards.
     */
    public void release() {
        session.disconnect();
        bitrateDriver.stop();
        inputForwarder.clear();
        bitrateController.reset();

        schedulerExecutor.shutdown();
        try {
            if (!schedulerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                schedulerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            schedulerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private MirrorConfig config = MirrorConfig.defaults();
        private SecureKeyStore keyStore;
        private char[] keyStorePassword;
        private RfcommConnector rfcommConnector;
        private TransportFactory transports;
        private BitrateSink bitrateSink;
        private SessionObservabilitySink observabilitySink = new Slf4jSessionObservabilitySink();
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;

        public Builder withConfig(MirrorConfig config) {
            this.config = config;
            return this;
        }

        /** Overrides the key store derived from the configuration. */
        public Builder withKeyStore(SecureKeyStore keyStore) {
            this.keyStore = keyStore;
            return this;
        }

        /** Password for the configured keystore file. */
        public Builder withKeyStorePassword(char[] password) {
            this.keyStorePassword = password;
            return this;
        }

        /** Enables the Bluetooth carrier. */
        public Builder withRfcommConnector(RfcommConnector connector) {
            this.rfcommConnector = connector;
            return this;
        }

        /** Replaces the carrier registry built from the configuration. */
        public Builder withTransports(TransportFactory transports) {
            this.transports = transports;
            return this;
        }

        public Builder withBitrateSink(BitrateSink sink) {
            this.bitrateSink = sink;
            return this;
        }

        public Builder withObservabilitySink(SessionObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public MirrorRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(bitrateSink, "bitrateSink");

            // 1. Key material
            SecureKeyStore store = keyStore != null ? keyStore : keyStoreFromConfig();
            CryptoEngine crypto = new CryptoEngine(store, config.keyAlias());

            // 2. Carriers
            TransportFactory factory = transports != null ? transports : transportsFromConfig();

            // 3. Session
            MirrorSessionController session = MirrorSessionController.builder()
                    .transports(factory)
                    .crypto(crypto)
                    .policy(config.session())
                    .clock(clock)
                    .wallClock(SystemWallClock.INSTANCE)
                    .observabilitySink(observabilitySink)
                    .build();

            // 4. Adaptive bitrate loop, fed by the session's counters
            ScheduledExecutorService schedulerExec = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "screenlink-bitrate");
                t.setDaemon(true);
                return t;
            });
            MonotonicScheduler scheduler = new ScheduledExecutorScheduler(schedulerExec, clock);
            BitrateController bitrateController = new BitrateController(config.bitrate(), clock);
            AdaptiveBitrateDriver driver = new AdaptiveBitrateDriver(
                    bitrateController,
                    session,
                    bitrateSink,
                    scheduler,
                    clock,
                    SystemWallClock.INSTANCE,
                    observabilitySink);

            // 5. Input path
            InputForwarder forwarder = new InputForwarder(new InputStateFilter(config.deadZoneThreshold()), session);

            return new MirrorRuntime(config, session, driver, bitrateController, forwarder, schedulerExec);
        }

        private SecureKeyStore keyStoreFromConfig() {
            if (config.keyStorePath().isEmpty()) {
                return JcaSecureKeyStore.inMemory();
            }
            Objects.requireNonNull(keyStorePassword, "keyStorePassword");
            return JcaSecureKeyStore.persistent(config.keyStorePath().get(), keyStorePassword);
        }

        private TransportFactory transportsFromConfig() {
            TransportFactory.Builder b = TransportFactory.builder()
                    .register(TransportKind.WIFI_SOCKET, () -> new NettySocketTransport(config.transport()));
            if (rfcommConnector != null) {
                b.register(TransportKind.BLUETOOTH, () -> new RfcommTransport(rfcommConnector, config.transport()));
            }
            return b.build();
        }
    }
}
