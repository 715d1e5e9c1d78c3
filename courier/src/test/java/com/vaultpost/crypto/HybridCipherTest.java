package com.vaultpost.crypto;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.PublicKey;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

/**
 * Pure unit tests for the hybrid envelope and passphrase sealing.
 *
 * No Spring context and no database. RSA key generation is slow, so the pairs
 * are generated once for the class.
 */
class HybridCipherTest {

    private static final HybridCipher cipher = new HybridCipher();

    private static KeyPair bob;
    private static KeyPair mallory;

    @BeforeAll
    static void generateKeys() throws Exception {
        bob = cipher.generateKeyPair(2048);
        mallory = cipher.generateKeyPair(2048);
    }

    // ── Envelope ─────────────────────────────────────────────────────────────

    @Test
    void envelopeRoundTrip() throws Exception {
        byte[] plaintext = "Meet at the usual place, 9pm".getBytes(StandardCharsets.UTF_8);

        EncryptedEnvelope envelope = cipher.encrypt(plaintext, bob.getPublic());

        assertEquals(HybridCipher.IV_SIZE, envelope.iv().length, "IV must be 12 bytes");
        assertEquals(256, envelope.encryptedKey().length, "RSA-2048 wraps to a 256-byte block");
        assertArrayEquals(plaintext, cipher.decrypt(envelope, bob.getPrivate()));
    }

    @Test
    void emptyPlaintextEncryptsToEmptyContent() throws Exception {
        EncryptedEnvelope envelope = cipher.encrypt(new byte[0], bob.getPublic());

        assertEquals(0, envelope.encryptedContent().length, "Empty content must stay empty");
        assertEquals(0, cipher.decrypt(envelope, bob.getPrivate()).length);
    }

    @Test
    void strippedContentOpensAsEmptyWithoutAuthentication() throws Exception {
        EncryptedEnvelope envelope = cipher.encrypt("not empty".getBytes(StandardCharsets.UTF_8), bob.getPublic());
        EncryptedEnvelope stripped = new EncryptedEnvelope(new byte[0], envelope.encryptedKey(), envelope.iv());

        // empty content carries no tag, so there is nothing to verify
        assertEquals(0, cipher.decrypt(stripped, bob.getPrivate()).length);
    }

    @Test
    void oneMebibyteSurvivesWithoutTruncation() throws Exception {
        byte[] plaintext = new byte[1024 * 1024];
        for (int i = 0; i < plaintext.length; i++) {
            plaintext[i] = (byte) (i * 31);
        }

        EncryptedEnvelope envelope = cipher.encrypt(plaintext, bob.getPublic());

        assertEquals(plaintext.length + 16, envelope.encryptedContent().length, "GCM adds a 16-byte tag");
        assertArrayEquals(plaintext, cipher.decrypt(envelope, bob.getPrivate()));
    }

    @Test
    void concurrentEncryptionsUseFreshIvAndSessionKey() throws Exception {
        byte[] plaintext = "same content".getBytes(StandardCharsets.UTF_8);

        List<CompletableFuture<EncryptedEnvelope>> futures = List.of(
                CompletableFuture.supplyAsync(() -> encryptUnchecked(plaintext, bob.getPublic())),
                CompletableFuture.supplyAsync(() -> encryptUnchecked(plaintext, bob.getPublic())));
        EncryptedEnvelope first = futures.get(0).get();
        EncryptedEnvelope second = futures.get(1).get();

        assertFalse(Arrays.equals(first.iv(), second.iv()), "IVs must never repeat");
        assertFalse(Arrays.equals(first.encryptedKey(), second.encryptedKey()), "Session keys must be fresh");
        assertFalse(Arrays.equals(first.encryptedContent(), second.encryptedContent()));
    }

    @Test
    void tamperedContentIsRejected() throws Exception {
        EncryptedEnvelope envelope = cipher.encrypt("transfer 10".getBytes(StandardCharsets.UTF_8), bob.getPublic());
        byte[] content = envelope.encryptedContent().clone();
        content[0] ^= 0x01;

        EncryptedEnvelope tampered = new EncryptedEnvelope(content, envelope.encryptedKey(), envelope.iv());

        assertThrows(GeneralSecurityException.class, () -> cipher.decrypt(tampered, bob.getPrivate()),
                "GCM tag check must fail on a flipped bit");
    }

    @Test
    void wrongPrivateKeyCannotUnwrap() throws Exception {
        EncryptedEnvelope envelope = cipher.encrypt("for bob only".getBytes(StandardCharsets.UTF_8), bob.getPublic());

        assertThrows(GeneralSecurityException.class, () -> cipher.decrypt(envelope, mallory.getPrivate()));
    }

    @Test
    void malformedIvIsRejected() throws Exception {
        EncryptedEnvelope envelope = cipher.encrypt("hi".getBytes(StandardCharsets.UTF_8), bob.getPublic());
        EncryptedEnvelope shortIv = new EncryptedEnvelope(envelope.encryptedContent(), envelope.encryptedKey(),
                Arrays.copyOf(envelope.iv(), 8));

        assertThrows(GeneralSecurityException.class, () -> cipher.decrypt(shortIv, bob.getPrivate()));
    }

    // ── Key encoding ─────────────────────────────────────────────────────────

    @Test
    void publicKeySurvivesBase64Encoding() throws Exception {
        String encoded = cipher.encodePublicKey(bob.getPublic());

        PublicKey decoded = cipher.decodePublicKey(encoded);

        assertArrayEquals(bob.getPublic().getEncoded(), decoded.getEncoded());
    }

    @Test
    void garbagePublicKeyIsRejected() {
        assertThrows(GeneralSecurityException.class, () -> cipher.decodePublicKey("not base64 at all!"));
        assertThrows(GeneralSecurityException.class, () -> cipher.decodePublicKey("AAAA"));
    }

    // ── Passphrase sealing ───────────────────────────────────────────────────

    @Test
    void passphraseSealOpensWithSamePassphraseOnly() throws Exception {
        byte[] secret = "key material".getBytes(StandardCharsets.UTF_8);

        KeyBackupEnvelope sealed = cipher.sealWithPassphrase(secret, "correct horse".toCharArray(), 1000);

        assertEquals(HybridCipher.SALT_SIZE, sealed.salt().length);
        assertArrayEquals(secret, cipher.openWithPassphrase(sealed, "correct horse".toCharArray(), 1000));
        assertThrows(GeneralSecurityException.class,
                () -> cipher.openWithPassphrase(sealed, "battery staple".toCharArray(), 1000));
    }

    private static EncryptedEnvelope encryptUnchecked(byte[] plaintext, PublicKey key) {
        try {
            return cipher.encrypt(plaintext, key);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(e);
        }
    }
}
