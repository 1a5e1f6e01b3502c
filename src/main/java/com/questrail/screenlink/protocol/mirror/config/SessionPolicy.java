package com.questrail.screenlink.protocol.mirror.config;

import com.questrail.screenlink.protocol.mirror.codec.impl.MirrorWireFormat;
import com.questrail.screenlink.protocol.mirror.crypto.CryptoEngine;

/**
 * SessionPolicy
 * -----------------------------------------------------------------------------
 * Operational limits of one mirroring session.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>sendQueueCapacity</b>: outbound frames that may wait for the
 *       sender worker; beyond this frames are dropped and counted (64).</li>
 *   <li><b>maxConsecutiveAuthFailures</b>: inbound authentication failures
 *       in a row that end the session (3).</li>
 *   <li><b>maxVideoPayload</b>: largest video {@code size} field, sent or
 *       accepted (16 MiB). The sealed form adds a 12-byte nonce and a 16-byte
 *       tag, so the largest plaintext is {@code maxVideoPayload - 28}.</li>
 * </ul>
 */
public record SessionPolicy(
        int sendQueueCapacity,
        int maxConsecutiveAuthFailures,
        int maxVideoPayload
) {
    public SessionPolicy {
        if (sendQueueCapacity < 1) {
            throw new IllegalArgumentException("sendQueueCapacity must be >= 1");
        }
        if (maxConsecutiveAuthFailures < 1) {
            throw new IllegalArgumentException("maxConsecutiveAuthFailures must be >= 1");
        }
        if (maxVideoPayload <= CryptoEngine.SEALED_OVERHEAD) {
            throw new IllegalArgumentException("maxVideoPayload must be > " + CryptoEngine.SEALED_OVERHEAD);
        }
    }

    public static SessionPolicy defaults() {
        return new SessionPolicy(64, 3, MirrorWireFormat.DEFAULT_MAX_VIDEO_PAYLOAD);
    }

    /**
     * Largest video plaintext whose sealed form still fits in
     * {@code maxVideoPayload}: the bound less the nonce and the tag.
     */
    public int maxVideoPlaintext() {
        return maxVideoPayload - CryptoEngine.SEALED_OVERHEAD;
    }

    public SessionPolicy withSendQueueCapacity(int capacity) {
        return new SessionPolicy(capacity, maxConsecutiveAuthFailures, maxVideoPayload);
    }

    public SessionPolicy withMaxConsecutiveAuthFailures(int limit) {
        return new SessionPolicy(sendQueueCapacity, limit, maxVideoPayload);
    }

    public SessionPolicy withMaxVideoPayload(int max) {
        return new SessionPolicy(sendQueueCapacity, maxConsecutiveAuthFailures, max);
    }
}
