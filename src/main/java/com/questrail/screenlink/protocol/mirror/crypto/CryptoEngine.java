package com.questrail.screenlink.protocol.mirror.crypto;

import java.util.Arrays;
import java.util.Objects;

/**
 * CryptoEngine
 * -----------------------------------------------------------------------------
 * Encrypt-before-send and decrypt-after-receive for video payloads.
 *
 * <h2>Construction</h2>
 * {@code AES-256-GCM}, a fresh random 96-bit nonce per call and a 128-bit tag.
 * The sealed form on the wire is {@code nonce || ciphertext || tag}.
 *
 * <h2>Key custody</h2>
 * The engine resolves its key handle once, at construction, through the
 * injected {@link SecureKeyStore}, and then shares it read-only between the
 * sender and receive threads.
 */
public final class CryptoEngine
{
    public static final String DEFAULT_KEY_ALIAS = "psphone_encryption_key";

    public static final int NONCE_LENGTH = 12;

    public static final int TAG_LENGTH = 16;

    /** Bytes a seal adds to its plaintext. */
    public static final int SEALED_OVERHEAD = NONCE_LENGTH + TAG_LENGTH;

    private final SecureKeyStore keyStore;
    private final KeyHandle key;

    public CryptoEngine(SecureKeyStore keyStore)
    {
        this(keyStore, DEFAULT_KEY_ALIAS);
    }

    public CryptoEngine(SecureKeyStore keyStore, String keyAlias)
    {
        this.keyStore = Objects.requireNonNull(keyStore, "keyStore");
        this.key = Objects.requireNonNull(keyStore.ensureKeyExists(keyAlias), "key handle");
    }

    public SealedPayload encrypt(byte[] plaintext)
    {
        Objects.requireNonNull(plaintext, "plaintext");
        return keyStore.encrypt(key, plaintext);
    }

    /**
     * @throws AuthFailedException on tag mismatch or truncated input
     */
    public byte[] decrypt(byte[] nonce, byte[] ciphertext)
    {
        Objects.requireNonNull(nonce, "nonce");
        Objects.requireNonNull(ciphertext, "ciphertext");
        if (nonce.length != NONCE_LENGTH) {
            throw new AuthFailedException("nonce must be " + NONCE_LENGTH + " bytes, got " + nonce.length);
        }
        if (ciphertext.length < TAG_LENGTH) {
            throw new AuthFailedException("ciphertext shorter than authentication tag: " + ciphertext.length);
        }
        return keyStore.decrypt(key, nonce, ciphertext);
    }

    /**
     * Opens the wire form {@code nonce || ciphertext || tag}.
     *
     * @throws AuthFailedException on tag mismatch or truncated input
     */
    public byte[] decrypt(byte[] sealed)
    {
        Objects.requireNonNull(sealed, "sealed");
        if (sealed.length < NONCE_LENGTH + TAG_LENGTH) {
            throw new AuthFailedException("sealed payload truncated: " + sealed.length + " bytes");
        }
        return decrypt(Arrays.copyOfRange(sealed, 0, NONCE_LENGTH),
                Arrays.copyOfRange(sealed, NONCE_LENGTH, sealed.length));
    }
}
