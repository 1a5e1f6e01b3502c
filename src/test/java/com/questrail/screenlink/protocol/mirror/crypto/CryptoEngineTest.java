package com.questrail.screenlink.protocol.mirror.crypto;

import com.questrail.screenlink.api.ErrorKind;
import com.questrail.screenlink.protocol.mirror.codec.DecodeResult;
import com.questrail.screenlink.protocol.mirror.codec.impl.DefaultMirrorFrameDecoder;
import com.questrail.screenlink.protocol.mirror.codec.impl.DefaultMirrorFrameEncoder;
import com.questrail.screenlink.protocol.mirror.model.EncryptedVideoFrame;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

final class CryptoEngineTest
{
    private final CryptoEngine crypto = new CryptoEngine(JcaSecureKeyStore.inMemory());

    @Test
    void sealedPayloadCarriesNonceAndTag()
    {
        byte[] plaintext = new byte[1000];
        new Random(42).nextBytes(plaintext);

        SealedPayload sealed = crypto.encrypt(plaintext);

        assertEquals(CryptoEngine.NONCE_LENGTH, sealed.nonce().length);
        assertEquals(plaintext.length + CryptoEngine.TAG_LENGTH, sealed.ciphertext().length);
        assertEquals(12 + 1000 + 16, sealed.toWire().length);
        assertArrayEquals(plaintext, crypto.decrypt(sealed.toWire()));
    }

    @Test
    void videoFrameSurvivesEncodeDecodeAndDecrypt()
    {
        byte[] plaintext = new byte[1000];
        new Random(7).nextBytes(plaintext);

        SealedPayload sealed = crypto.encrypt(plaintext);
        byte[] wire = new DefaultMirrorFrameEncoder().encodeVideoFrame(sealed.toWire(), 1, 123_456L);

        DefaultMirrorFrameDecoder decoder = new DefaultMirrorFrameDecoder();
        decoder.append(wire);
        DecodeResult result = decoder.decodeNext();

        EncryptedVideoFrame frame = (EncryptedVideoFrame) ((DecodeResult.Decoded) result).frame();
        assertEquals(1, frame.flags());
        assertEquals(123_456L, frame.timestampMicros());
        assertArrayEquals(plaintext, crypto.decrypt(frame.nonce(), frame.ciphertext()));
    }

    @Test
    void largestPlaintextFitsDecoderBound()
    {
        int bound = 4096;
        byte[] plaintext = new byte[bound - CryptoEngine.SEALED_OVERHEAD];
        new Random(11).nextBytes(plaintext);

        byte[] wire = new DefaultMirrorFrameEncoder().encodeVideoFrame(crypto.encrypt(plaintext).toWire(), 0, 1L);
        DefaultMirrorFrameDecoder decoder = new DefaultMirrorFrameDecoder(bound);
        decoder.append(wire);

        DecodeResult.Decoded decoded = assertInstanceOf(DecodeResult.Decoded.class, decoder.decodeNext());
        EncryptedVideoFrame frame = (EncryptedVideoFrame) decoded.frame();
        assertEquals(bound, frame.size());
        assertArrayEquals(plaintext, crypto.decrypt(frame.sealedPayload()));
    }

    @Test
    void oneByteOverPlaintextBoundIsMalformedAtPeer()
    {
        int bound = 4096;
        byte[] sealed = crypto.encrypt(new byte[bound - CryptoEngine.SEALED_OVERHEAD + 1]).toWire();

        DefaultMirrorFrameDecoder decoder = new DefaultMirrorFrameDecoder(bound);
        decoder.append(new DefaultMirrorFrameEncoder().encodeVideoFrame(sealed, 0, 1L));

        assertInstanceOf(DecodeResult.Malformed.class, decoder.decodeNext());
    }

    @Test
    void nonceIsFreshPerCall()
    {
        byte[] plaintext = "same".getBytes();
        SealedPayload a = crypto.encrypt(plaintext);
        SealedPayload b = crypto.encrypt(plaintext);

        assertFalse(Arrays.equals(a.nonce(), b.nonce()));
    }

    @Test
    void flippedCiphertextBitFailsAuthentication()
    {
        byte[] wire = crypto.encrypt(new byte[64]).toWire();
        wire[CryptoEngine.NONCE_LENGTH + 3] ^= 0x01;

        AuthFailedException e = assertThrows(AuthFailedException.class, () -> crypto.decrypt(wire));
        assertEquals(ErrorKind.AUTH_FAILED, e.kind());
    }

    @Test
    void flippedNonceBitFailsAuthentication()
    {
        byte[] wire = crypto.encrypt(new byte[8]).toWire();
        wire[0] ^= (byte) 0x80;

        assertThrows(AuthFailedException.class, () -> crypto.decrypt(wire));
    }

    @Test
    void truncatedInputFailsAuthentication()
    {
        assertThrows(AuthFailedException.class, () -> crypto.decrypt(new byte[CryptoEngine.NONCE_LENGTH + 15]));
        assertThrows(AuthFailedException.class, () -> crypto.decrypt(new byte[11], new byte[16]));
    }

    @Test
    void otherKeyCannotOpenPayload()
    {
        CryptoEngine other = new CryptoEngine(JcaSecureKeyStore.inMemory());
        byte[] wire = crypto.encrypt(new byte[32]).toWire();

        assertThrows(AuthFailedException.class, () -> other.decrypt(wire));
    }

    @Test
    void emptyPlaintextIsSealed()
    {
        byte[] wire = crypto.encrypt(new byte[0]).toWire();
        assertEquals(CryptoEngine.NONCE_LENGTH + CryptoEngine.TAG_LENGTH, wire.length);
        assertArrayEquals(new byte[0], crypto.decrypt(wire));
    }
}
