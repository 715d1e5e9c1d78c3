package com.vaultpost.keys;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vaultpost.config.CryptoProperties;
import com.vaultpost.crypto.EncryptedEnvelope;
import com.vaultpost.crypto.HybridCipher;
import com.vaultpost.crypto.KeyBackupException;
import com.vaultpost.crypto.KeyPairRecord;
import com.vaultpost.crypto.MessageDecryptionException;
import com.vaultpost.crypto.MessageEncryptionException;
import com.vaultpost.crypto.PublicKeyImportException;
import com.vaultpost.support.MutableClock;
import com.vaultpost.support.TestDatabase;

import reactor.test.StepVerifier;

/**
 * KeyManager against a private in-memory key store.
 */
class KeyManagerTest {

    private TestDatabase db;
    private MutableClock clock;
    private HybridCipher cipher;
    private KeyManager keyManager;

    @BeforeEach
    void setup() {
        db = TestDatabase.create();
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        cipher = new HybridCipher();
        keyManager = newManager();
    }

    @AfterEach
    void teardown() {
        db.drop();
    }

    private KeyManager newManager() {
        CryptoProperties properties = new CryptoProperties();
        properties.setPbkdf2Iterations(1000);
        return new KeyManager(db.keyStore(), cipher, new ObjectMapper(), properties, clock);
    }

    // ── Key pairs ────────────────────────────────────────────────────────────

    @Test
    void exportedPublicKeyImportsBack() {
        String exported = keyManager.exportPublicKey("bob").block();

        assertNotNull(exported);
        StepVerifier.create(keyManager.importPublicKey(exported))
                .assertNext(key -> assertEquals("RSA", key.getAlgorithm()))
                .verifyComplete();
    }

    @Test
    void malformedPublicKeyFailsImport() {
        StepVerifier.create(keyManager.importPublicKey("definitely-not-a-key"))
                .expectError(PublicKeyImportException.class)
                .verify();
        StepVerifier.create(keyManager.importPublicKey("  "))
                .expectError(PublicKeyImportException.class)
                .verify();
    }

    @Test
    void keyPairIsPersistedAcrossManagers() {
        KeyPairRecord generated = keyManager.generateKeyPair("bob").block();

        KeyPairRecord loaded = newManager().findKeyPair("bob").block();

        assertNotNull(loaded, "A fresh manager must find the stored pair");
        assertArrayEquals(generated.publicKey().getEncoded(), loaded.publicKey().getEncoded());
        assertArrayEquals(generated.privateKey().getEncoded(), loaded.privateKey().getEncoded());
    }

    @Test
    void findKeyPairNeverGenerates() {
        StepVerifier.create(keyManager.findKeyPair("nobody")).verifyComplete();
    }

    // ── Messages ─────────────────────────────────────────────────────────────

    @Test
    void messageRoundTripThroughManager() {
        String bobKey = keyManager.exportPublicKey("bob").block();

        EncryptedEnvelope envelope = keyManager.encryptMessage("hello bob", bobKey, "alice").block();

        StepVerifier.create(keyManager.decryptMessage(envelope, "bob"))
                .expectNext("hello bob")
                .verifyComplete();
    }

    @Test
    void emptyMessageRoundTrips() {
        String bobKey = keyManager.exportPublicKey("bob").block();

        EncryptedEnvelope envelope = keyManager.encryptMessage("", bobKey, "alice").block();

        assertEquals(0, envelope.encryptedContent().length);
        StepVerifier.create(keyManager.decryptMessage(envelope, "bob"))
                .expectNext("")
                .verifyComplete();
    }

    @Test
    void encryptionWithBadRecipientKeyFails() {
        StepVerifier.create(keyManager.encryptMessage("hi", "bogus", "alice"))
                .expectError(MessageEncryptionException.class)
                .verify();
    }

    @Test
    void decryptionWithoutKeyPairFails() {
        String bobKey = keyManager.exportPublicKey("bob").block();
        EncryptedEnvelope envelope = keyManager.encryptMessage("hello", bobKey, "alice").block();

        StepVerifier.create(keyManager.decryptMessage(envelope, "carol"))
                .expectError(MessageDecryptionException.class)
                .verify();
    }

    @Test
    void integrityCheckNeverThrows() {
        String bobKey = keyManager.exportPublicKey("bob").block();
        EncryptedEnvelope envelope = keyManager.encryptMessage("original", bobKey, "alice").block();
        byte[] content = envelope.encryptedContent().clone();
        content[content.length - 1] ^= 0x10;
        EncryptedEnvelope tampered = new EncryptedEnvelope(content, envelope.encryptedKey(), envelope.iv());

        StepVerifier.create(keyManager.verifyMessageIntegrity("original", envelope, "bob"))
                .expectNext(true).verifyComplete();
        StepVerifier.create(keyManager.verifyMessageIntegrity("changed", envelope, "bob"))
                .expectNext(false).verifyComplete();
        StepVerifier.create(keyManager.verifyMessageIntegrity("original", tampered, "bob"))
                .expectNext(false).verifyComplete();
        StepVerifier.create(keyManager.verifyMessageIntegrity("original", envelope, "nobody"))
                .expectNext(false).verifyComplete();
    }

    // ── Conversations ────────────────────────────────────────────────────────

    @Test
    void encryptionInfoDescribesTheScheme() {
        EncryptionInfo info = keyManager.generateEncryptionInfo("conv-1");

        assertEquals("RSA-OAEP+AES-GCM", info.algorithm());
        assertEquals("conv-1_" + clock.millis(), info.keyId());
        assertEquals(1, info.version());
        assertEquals(2048, info.metadata().rsaKeySize());
        assertEquals(256, info.metadata().aesKeySize());
        assertEquals(12, info.metadata().ivSize());
    }

    @Test
    void keyIdsNeverCollideWithinOneMillisecond() {
        String first = keyManager.generateEncryptionInfo("conv-1").keyId();
        String second = keyManager.generateEncryptionInfo("conv-1").keyId();

        assertNotEquals(first, second, "Clock did not move, ids must still differ");
    }

    @Test
    void conversationStatusListsMissingKeys() {
        String carolKey = cipher.encodePublicKey(keyManager.generateKeyPair("carol").block().publicKey());
        keyManager.storePublicKey("carol", carolKey).block();

        StepVerifier.create(keyManager.getConversationEncryptionStatus("conv-1", List.of("carol", "dave")))
                .assertNext(status -> {
                    assertEquals(List.of("dave"), status.missingKeys());
                    assertFalse(status.readyForEncryption());
                    assertEquals(status.readyForEncryption(), status.encrypted());
                })
                .verifyComplete();

        StepVerifier.create(keyManager.getConversationEncryptionStatus("conv-1", List.of("carol")))
                .assertNext(status -> {
                    assertTrue(status.readyForEncryption());
                    assertTrue(status.encrypted());
                })
                .verifyComplete();
    }

    @Test
    void initializingConversationCreatesOwnKeyPair() {
        StepVerifier.create(keyManager.initializeConversationEncryption("conv-1", List.of(), "alice"))
                .expectNext(true)
                .verifyComplete();

        StepVerifier.create(keyManager.findKeyPair("alice"))
                .assertNext(pair -> assertEquals("alice", pair.userId()))
                .verifyComplete();
    }

    @Test
    void storePublicKeyRejectsGarbage() {
        StepVerifier.create(keyManager.storePublicKey("eve", "garbage"))
                .expectError(PublicKeyImportException.class)
                .verify();
        StepVerifier.create(keyManager.getStoredPublicKey("eve")).verifyComplete();
    }

    // ── Rotation ─────────────────────────────────────────────────────────────

    @Test
    void rotationIsForwardOnly() throws Exception {
        KeyPairRecord before = keyManager.getKeyPair("bob").block();
        String oldKeyId = keyManager.generateEncryptionInfo("conv-1").keyId();
        EncryptedEnvelope oldMessage = keyManager.encryptMessage("before rotation",
                cipher.encodePublicKey(before.publicKey()), "alice").block();

        clock.advance(Duration.ofSeconds(1));
        StepVerifier.create(keyManager.rotateKeys("bob")).expectNext(true).verifyComplete();

        String newKeyId = keyManager.generateEncryptionInfo("conv-1").keyId();
        assertNotEquals(oldKeyId, newKeyId);

        String newPublicKey = keyManager.exportPublicKey("bob").block();
        assertNotEquals(cipher.encodePublicKey(before.publicKey()), newPublicKey);

        // the manager only knows the new pair now
        StepVerifier.create(keyManager.decryptMessage(oldMessage, "bob"))
                .expectError(MessageDecryptionException.class)
                .verify();
        // whoever kept the old private key can still read it
        assertEquals("before rotation", new String(cipher.decrypt(oldMessage, before.privateKey()), StandardCharsets.UTF_8));

        EncryptedEnvelope newMessage = keyManager.encryptMessage("after rotation", newPublicKey, "alice").block();
        StepVerifier.create(keyManager.decryptMessage(newMessage, "bob"))
                .expectNext("after rotation")
                .verifyComplete();
    }

    // ── Backup ───────────────────────────────────────────────────────────────

    @Test
    void backupRestoresAfterLogout() {
        String bobKey = keyManager.exportPublicKey("bob").block();
        EncryptedEnvelope envelope = keyManager.encryptMessage("kept safe", bobKey, "alice").block();
        String backup = keyManager.backupKeys("bob", "hunter2").block();

        keyManager.clearAllKeys().block();
        StepVerifier.create(keyManager.findKeyPair("bob")).verifyComplete();

        StepVerifier.create(keyManager.restoreKeys(backup, "hunter2")).expectNext(true).verifyComplete();
        StepVerifier.create(keyManager.decryptMessage(envelope, "bob"))
                .expectNext("kept safe")
                .verifyComplete();
    }

    @Test
    void restoreReportsFailureInsteadOfThrowing() {
        keyManager.generateKeyPair("bob").block();
        String backup = keyManager.backupKeys("bob", "hunter2").block();

        StepVerifier.create(keyManager.restoreKeys(backup, "wrong")).expectNext(false).verifyComplete();
        StepVerifier.create(keyManager.restoreKeys("%%% not base64", "hunter2")).expectNext(false).verifyComplete();
        StepVerifier.create(keyManager.restoreKeys(null, "hunter2")).expectNext(false).verifyComplete();
    }

    @Test
    void backupWithoutKeyPairFails() {
        StepVerifier.create(keyManager.backupKeys("nobody", "pw"))
                .expectError(KeyBackupException.class)
                .verify();
    }

    // ── Exchange and logout ──────────────────────────────────────────────────

    @Test
    void exchangeReturnsOwnPublicKey() {
        StepVerifier.create(keyManager.exchangeKeys("alice", "bob"))
                .assertNext(result -> {
                    assertTrue(result.success());
                    assertNotNull(result.publicKey());
                })
                .verifyComplete();
    }

    @Test
    void clearAllKeysIsIdempotent() {
        keyManager.generateKeyPair("alice").block();

        keyManager.clearAllKeys().block();
        keyManager.clearAllKeys().block();

        StepVerifier.create(keyManager.findKeyPair("alice")).verifyComplete();
        StepVerifier.create(newManager().findKeyPair("alice")).verifyComplete();
    }
}
