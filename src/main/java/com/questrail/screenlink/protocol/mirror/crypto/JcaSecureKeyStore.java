package com.questrail.screenlink.protocol.mirror.crypto;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.KeyGenerator;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.GeneralSecurityException;
import java.security.Key;
import java.security.KeyStore;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * JcaSecureKeyStore
 * -----------------------------------------------------------------------------
 * {@link SecureKeyStore} backed by the Java Cryptography Architecture.
 *
 * <p>Keys live in a PKCS12 keystore. With a backing file the key is generated
 * once, written atomically, and reloaded on later runs; {@link #inMemory()}
 * keeps the keystore in process memory only.</p>
 *
 * <p>Each operation uses its own {@link Cipher} instance, so encryption and
 * decryption may run concurrently.</p>
 */
public final class JcaSecureKeyStore implements SecureKeyStore
{
    private static final String KEYSTORE_TYPE = "PKCS12";
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int KEY_SIZE_BITS = 256;
    private static final int TAG_LENGTH_BITS = CryptoEngine.TAG_LENGTH * 8;

    private final Optional<Path> file;
    private final char[] password;
    private final SecureRandom random;

    private final Map<String, SecretKey> loaded = new ConcurrentHashMap<>();
    private KeyStore keyStore;

    private JcaSecureKeyStore(Optional<Path> file, char[] password, SecureRandom random)
    {
        this.file = file;
        this.password = password.clone();
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * A store persisted to {@code file}, protected by {@code password}.
     */
    public static JcaSecureKeyStore persistent(Path file, char[] password)
    {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(password, "password");
        return new JcaSecureKeyStore(Optional.of(file), password, new SecureRandom());
    }

    /**
     * A store whose key lives only as long as this object.
     */
    public static JcaSecureKeyStore inMemory()
    {
        // The keystore is never written out; a throwaway password satisfies PKCS12 entry protection.
        return new JcaSecureKeyStore(Optional.empty(), UUID.randomUUID().toString().toCharArray(), new SecureRandom());
    }

    @Override
    public synchronized KeyHandle ensureKeyExists(String alias)
    {
        KeyHandle handle = new KeyHandle(alias);
        if (loaded.containsKey(alias)) {
            return handle;
        }

        try {
            KeyStore ks = keyStore();
            Key existing = ks.getKey(alias, password);
            if (existing instanceof SecretKey secret) {
                loaded.put(alias, secret);
                return handle;
            }

            KeyGenerator generator = KeyGenerator.getInstance("AES");
            generator.init(KEY_SIZE_BITS, random);
            SecretKey generated = generator.generateKey();

            ks.setEntry(alias, new KeyStore.SecretKeyEntry(generated), new KeyStore.PasswordProtection(password));
            persist(ks);
            loaded.put(alias, generated);
            return handle;
        }
        catch (GeneralSecurityException e) {
            throw new IllegalStateException("Unable to provision key '" + alias + "'", e);
        }
    }

    @Override
    public SealedPayload encrypt(KeyHandle key, byte[] plaintext)
    {
        Objects.requireNonNull(plaintext, "plaintext");
        SecretKey secret = resolve(key);

        byte[] nonce = new byte[CryptoEngine.NONCE_LENGTH];
        random.nextBytes(nonce);

        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, secret, new GCMParameterSpec(TAG_LENGTH_BITS, nonce));
            return new SealedPayload(nonce, cipher.doFinal(plaintext));
        }
        catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM encryption unavailable", e);
        }
    }

    @Override
    public byte[] decrypt(KeyHandle key, byte[] nonce, byte[] ciphertext)
    {
        Objects.requireNonNull(nonce, "nonce");
        Objects.requireNonNull(ciphertext, "ciphertext");
        SecretKey secret = resolve(key);

        if (nonce.length != CryptoEngine.NONCE_LENGTH) {
            throw new AuthFailedException("nonce must be " + CryptoEngine.NONCE_LENGTH + " bytes, got " + nonce.length);
        }
        if (ciphertext.length < CryptoEngine.TAG_LENGTH) {
            throw new AuthFailedException("ciphertext shorter than authentication tag: " + ciphertext.length);
        }

        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, secret, new GCMParameterSpec(TAG_LENGTH_BITS, nonce));
            return cipher.doFinal(ciphertext);
        }
        catch (AEADBadTagException e) {
            throw new AuthFailedException("authentication tag mismatch", e);
        }
        catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM decryption unavailable", e);
        }
    }

    private SecretKey resolve(KeyHandle key)
    {
        Objects.requireNonNull(key, "key");
        SecretKey secret = loaded.get(key.alias());
        if (secret == null) {
            throw new IllegalStateException("Unknown key handle '" + key.alias() + "'; call ensureKeyExists first");
        }
        return secret;
    }

    private KeyStore keyStore() throws GeneralSecurityException
    {
        if (keyStore != null) {
            return keyStore;
        }

        KeyStore ks = KeyStore.getInstance(KEYSTORE_TYPE);
        try {
            if (file.isPresent() && Files.exists(file.get())) {
                try (InputStream in = Files.newInputStream(file.get())) {
                    ks.load(in, password);
                }
            }
            else {
                ks.load(null, password);
            }
        }
        catch (IOException e) {
            throw new UncheckedIOException("Unable to load keystore " + file.map(Path::toString).orElse("(memory)"), e);
        }
        keyStore = ks;
        return ks;
    }

    private void persist(KeyStore ks) throws GeneralSecurityException
    {
        if (file.isEmpty()) {
            return;
        }

        Path target = file.get();
        try {
            Path dir = target.toAbsolutePath().getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }
            Path tmp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
            try (OutputStream out = Files.newOutputStream(tmp)) {
                ks.store(out, password);
            }
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        }
        catch (IOException e) {
            throw new UncheckedIOException("Unable to write keystore " + target, e);
        }
    }

    @Override
    public String toString()
    {
        return "JcaSecureKeyStore[" + file.map(Path::toString).orElse("memory")
                + ", aliases=" + Arrays.toString(loaded.keySet().toArray()) + "]";
    }
}
