package com.questrail.screenlink.protocol.mirror.crypto;

import java.util.Objects;

/**
 * Opaque reference to a key held by a {@link SecureKeyStore}. Key material
 * never leaves the store.
 */
public record KeyHandle(String alias)
{
    public KeyHandle
    {
        Objects.requireNonNull(alias, "alias");
        if (alias.isBlank()) {
            throw new IllegalArgumentException("alias must not be blank");
        }
    }
}
