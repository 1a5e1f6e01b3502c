package com.questrail.screenlink.protocol.mirror.crypto;

import java.util.Objects;

/**
 * Output of one AES-GCM seal: the nonce and the ciphertext with its
 * authentication tag appended.
 */
public record SealedPayload(byte[] nonce, byte[] ciphertext)
{
    public SealedPayload
    {
        Objects.requireNonNull(nonce, "nonce");
        Objects.requireNonNull(ciphertext, "ciphertext");
        if (nonce.length != CryptoEngine.NONCE_LENGTH) {
            throw new IllegalArgumentException("nonce must be " + CryptoEngine.NONCE_LENGTH + " bytes: " + nonce.length);
        }
    }

    /** {@code nonce || ciphertext || tag}, the form carried in a video frame. */
    public byte[] toWire()
    {
        byte[] out = new byte[nonce.length + ciphertext.length];
        System.arraycopy(nonce, 0, out, 0, nonce.length);
        System.arraycopy(ciphertext, 0, out, nonce.length, ciphertext.length);
        return out;
    }
}
