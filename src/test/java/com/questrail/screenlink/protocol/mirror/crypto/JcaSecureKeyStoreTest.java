package com.questrail.screenlink.protocol.mirror.crypto;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

final class JcaSecureKeyStoreTest
{
    private static final char[] PASSWORD = "changeit".toCharArray();

    @TempDir
    Path dir;

    @Test
    void keyIsPersistedAndReloaded()
    {
        Path file = dir.resolve("keys").resolve("screenlink.p12");

        CryptoEngine first = new CryptoEngine(JcaSecureKeyStore.persistent(file, PASSWORD));
        byte[] wire = first.encrypt("frame".getBytes()).toWire();
        assertTrue(Files.exists(file));

        CryptoEngine second = new CryptoEngine(JcaSecureKeyStore.persistent(file, PASSWORD));
        assertArrayEquals("frame".getBytes(), second.decrypt(wire));
    }

    @Test
    void ensureKeyExistsIsIdempotent()
    {
        JcaSecureKeyStore store = JcaSecureKeyStore.inMemory();
        KeyHandle a = store.ensureKeyExists("alias");
        SealedPayload sealed = store.encrypt(a, new byte[] { 1, 2, 3 });

        KeyHandle b = store.ensureKeyExists("alias");
        assertEquals(a, b);
        assertArrayEquals(new byte[] { 1, 2, 3 }, store.decrypt(b, sealed.nonce(), sealed.ciphertext()));
    }

    @Test
    void aliasesHoldIndependentKeys()
    {
        JcaSecureKeyStore store = JcaSecureKeyStore.inMemory();
        CryptoEngine a = new CryptoEngine(store, "a");
        CryptoEngine b = new CryptoEngine(store, "b");

        byte[] wire = a.encrypt(new byte[16]).toWire();
        assertThrows(AuthFailedException.class, () -> b.decrypt(wire));
    }

    @Test
    void unknownHandleIsRejected()
    {
        JcaSecureKeyStore store = JcaSecureKeyStore.inMemory();
        assertThrows(IllegalStateException.class, () -> store.encrypt(new KeyHandle("missing"), new byte[1]));
    }
}
