package com.questrail.screenlink.protocol.mirror.config;

import com.questrail.screenlink.protocol.mirror.crypto.CryptoEngine;
import com.questrail.screenlink.protocol.mirror.internal.bitrate.BitratePolicy;
import com.questrail.screenlink.protocol.mirror.internal.input.InputStateFilter;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.UUID;
import java.util.function.Function;

/**
 * Aggregated configuration for the screen-mirroring runtime.
 *
 * <p>{@code keyStorePath} is empty when the session key should live in memory
 * only.</p>
 */
public record MirrorConfig(
        TransportConfig transport,
        SessionPolicy session,
        BitratePolicy bitrate,
        float deadZoneThreshold,
        Optional<Path> keyStorePath,
        String keyAlias
) {
    /** Classpath resource read by {@link #load()}. */
    public static final String DEFAULT_RESOURCE = "screenlink.properties";

    public MirrorConfig {
        Objects.requireNonNull(transport, "transport");
        Objects.requireNonNull(session, "session");
        Objects.requireNonNull(bitrate, "bitrate");
        Objects.requireNonNull(keyStorePath, "keyStorePath");
        Objects.requireNonNull(keyAlias, "keyAlias");

        if (!(deadZoneThreshold >= 0.0f && deadZoneThreshold < 1.0f)) {
            throw new IllegalArgumentException("deadZoneThreshold must be in [0, 1): " + deadZoneThreshold);
        }
        if (keyAlias.isBlank()) {
            throw new IllegalArgumentException("keyAlias must not be blank");
        }
    }

    public static MirrorConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads {@value #DEFAULT_RESOURCE} from the classpath, falling back to
     * {@link #defaults()} when it is absent.
     */
    public static MirrorConfig load() {
        ClassLoader loader = MirrorConfig.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                return defaults();
            }
            Properties props = new Properties();
            props.load(in);
            return fromProperties(props);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read " + DEFAULT_RESOURCE, e);
        }
    }

    /**
     * Builds a configuration from {@code screenlink.*} keys. Missing keys keep
     * their defaults; malformed values are rejected with
     * {@link IllegalArgumentException} naming the key.
     */
    public static MirrorConfig fromProperties(Properties props) {
        Objects.requireNonNull(props, "props");
        PropertyReader p = new PropertyReader(props);

        TransportConfig defaultsT = TransportConfig.defaults();
        TransportConfig transport = TransportConfig.builder()
                .withSocketPort(p.integer("screenlink.socket.port", defaultsT.socketPort()))
                .withSocketConnectTimeout(p.millis("screenlink.socket.connectTimeoutMillis",
                        defaultsT.socketConnectTimeout()))
                .withBluetoothConnectTimeout(p.millis("screenlink.bluetooth.connectTimeoutMillis",
                        defaultsT.bluetoothConnectTimeout()))
                .withBluetoothServiceUuid(p.uuid("screenlink.bluetooth.serviceUuid",
                        defaultsT.bluetoothServiceUuid()))
                .withReceiveBufferSize(p.integer("screenlink.transport.receiveBufferSize",
                        defaultsT.receiveBufferSize()))
                .build();

        SessionPolicy defaultsS = SessionPolicy.defaults();
        SessionPolicy session = new SessionPolicy(
                p.integer("screenlink.session.sendQueueCapacity", defaultsS.sendQueueCapacity()),
                p.integer("screenlink.session.maxConsecutiveAuthFailures", defaultsS.maxConsecutiveAuthFailures()),
                p.integer("screenlink.session.maxVideoPayload", defaultsS.maxVideoPayload()));

        BitratePolicy defaultsB = BitratePolicy.defaults();
        BitratePolicy bitrate = BitratePolicy.builder()
                .withMinBitrate(p.integer("screenlink.bitrate.min", defaultsB.minBitrate()))
                .withMaxBitrate(p.integer("screenlink.bitrate.max", defaultsB.maxBitrate()))
                .withDecreaseFactor(p.decimal("screenlink.bitrate.decreaseFactor", defaultsB.decreaseFactor()))
                .withIncreaseStep(p.integer("screenlink.bitrate.increaseStep", defaultsB.increaseStep()))
                .withEvaluationWindow(p.millis("screenlink.bitrate.windowMillis", defaultsB.evaluationWindow()))
                .withDropThreshold(p.integer("screenlink.bitrate.dropThreshold", defaultsB.dropThreshold()))
                .withBacklogThreshold(p.integer("screenlink.bitrate.backlogThreshold", defaultsB.backlogThreshold()))
                .withBacklogWindows(p.integer("screenlink.bitrate.backlogWindows", defaultsB.backlogWindows()))
                .withCleanWindowsBeforeIncrease(p.integer("screenlink.bitrate.cleanWindows",
                        defaultsB.cleanWindowsBeforeIncrease()))
                .build();

        return builder()
                .withTransport(transport)
                .withSession(session)
                .withBitrate(bitrate)
                .withDeadZoneThreshold((float) p.decimal("screenlink.input.deadZone",
                        InputStateFilter.DEFAULT_DEAD_ZONE))
                .withKeyStorePath(p.text("screenlink.keystore.path").map(Path::of).orElse(null))
                .withKeyAlias(p.text("screenlink.keystore.alias").orElse(CryptoEngine.DEFAULT_KEY_ALIAS))
                .build();
    }

    public static final class Builder {
        private TransportConfig transport = TransportConfig.defaults();
        private SessionPolicy session = SessionPolicy.defaults();
        private BitratePolicy bitrate = BitratePolicy.defaults();
        private float deadZoneThreshold = InputStateFilter.DEFAULT_DEAD_ZONE;
        private Path keyStorePath;
        private String keyAlias = CryptoEngine.DEFAULT_KEY_ALIAS;

        public Builder withTransport(TransportConfig transport) {
            this.transport = transport;
            return this;
        }

        public Builder withSession(SessionPolicy session) {
            this.session = session;
            return this;
        }

        public Builder withBitrate(BitratePolicy bitrate) {
            this.bitrate = bitrate;
            return this;
        }

        public Builder withDeadZoneThreshold(float threshold) {
            this.deadZoneThreshold = threshold;
            return this;
        }

        /** {@code null} keeps the key in memory only. */
        public Builder withKeyStorePath(Path path) {
            this.keyStorePath = path;
            return this;
        }

        public Builder withKeyAlias(String alias) {
            this.keyAlias = alias;
            return this;
        }

        public MirrorConfig build() {
            return new MirrorConfig(transport, session, bitrate, deadZoneThreshold,
                    Optional.ofNullable(keyStorePath), keyAlias);
        }
    }

    private static final class PropertyReader {
        private final Properties props;

        PropertyReader(Properties props) {
            this.props = props;
        }

        Optional<String> text(String key) {
            String value = props.getProperty(key);
            if (value == null || value.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(value.trim());
        }

        int integer(String key, int fallback) {
            return text(key).map(v -> parse(key, v, Integer::parseInt)).orElse(fallback);
        }

        double decimal(String key, double fallback) {
            return text(key).map(v -> parse(key, v, Double::parseDouble)).orElse(fallback);
        }

        Duration millis(String key, Duration fallback) {
            return text(key).map(v -> Duration.ofMillis(parse(key, v, Long::parseLong))).orElse(fallback);
        }

        UUID uuid(String key, UUID fallback) {
            return text(key).map(v -> parse(key, v, UUID::fromString)).orElse(fallback);
        }

        private static <T> T parse(String key, String value, Function<String, T> parser) {
            try {
                return parser.apply(value);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid value for " + key + ": '" + value + "'", e);
            }
        }
    }
}
