package com.questrail.screenlink.protocol.mirror.crypto;

/**
 * SecureKeyStore
 * -----------------------------------------------------------------------------
 * Platform port onto a store that holds the session key and performs AES-GCM
 * with it.
 *
 * <p>The core never sees key bytes. It obtains a {@link KeyHandle} once and
 * passes it back on every operation, which lets a hardware-backed store keep
 * the key non-exportable.</p>
 *
 * <p>Implementations must be safe for concurrent use: the sender worker
 * encrypts while the receive loop decrypts.</p>
 */
public interface SecureKeyStore
{
    /**
     * Returns a handle to the AES-256 key under {@code alias}, generating and
     * persisting it first if it does not exist. Keys are never rotated.
     */
    KeyHandle ensureKeyExists(String alias);

    /**
     * Seals {@code plaintext} under a fresh random 96-bit nonce with a
     * 128-bit tag.
     */
    SealedPayload encrypt(KeyHandle key, byte[] plaintext);

    /**
     * Opens a sealed payload.
     *
     * @throws AuthFailedException if the tag does not verify or the input is truncated
     */
    byte[] decrypt(KeyHandle key, byte[] nonce, byte[] ciphertext);
}
