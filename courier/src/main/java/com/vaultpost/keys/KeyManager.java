package com.vaultpost.keys;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vaultpost.config.CryptoProperties;
import com.vaultpost.crypto.CryptoException;
import com.vaultpost.crypto.EncryptedEnvelope;
import com.vaultpost.crypto.HybridCipher;
import com.vaultpost.crypto.KeyBackupEnvelope;
import com.vaultpost.crypto.KeyBackupException;
import com.vaultpost.crypto.KeyGenerationException;
import com.vaultpost.crypto.KeyPairRecord;
import com.vaultpost.crypto.MessageDecryptionException;
import com.vaultpost.crypto.MessageEncryptionException;
import com.vaultpost.crypto.PublicKeyImportException;
import com.vaultpost.store.KeyStore;
import com.vaultpost.store.StoredKeyPair;

import jakarta.annotation.PreDestroy;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Owns the local users' RSA key pairs and the public keys of their peers.
 *
 * <p>Key pairs are persisted through {@link KeyStore} and cached in memory; the
 * cache is authoritative once loaded. Every RSA, AES and PBKDF2 operation runs on
 * {@link Schedulers#boundedElastic()} so callers on event-loop threads never block.
 *
 * <p><strong>Rotation contract:</strong> {@link #rotateKeys} replaces the active pair.
 * Envelopes sealed for the previous public key can no longer be opened through this
 * manager; whoever needs them must hold on to the old private key.
 */
@Service
public class KeyManager {

    private static final Logger log = LoggerFactory.getLogger(KeyManager.class);

    private static final int INFO_VERSION = 1;

    private final KeyStore keyStore;
    private final HybridCipher cipher;
    private final ObjectMapper objectMapper;
    private final CryptoProperties properties;
    private final Clock clock;

    private final Map<String, KeyPairRecord> keyPairs = new ConcurrentHashMap<>();
    private final AtomicLong lastKeyIdMillis = new AtomicLong();

    public KeyManager(KeyStore keyStore, HybridCipher cipher, ObjectMapper objectMapper,
            CryptoProperties properties, Clock clock) {
        this.keyStore = keyStore;
        this.cipher = cipher;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    // ── Key pairs ────────────────────────────────────────────────────────────

    /** Generates, persists and activates a fresh key pair for the user. */
    public Mono<KeyPairRecord> generateKeyPair(String userId) {
        return Mono.fromCallable(() -> cipher.generateKeyPair(properties.getRsaKeySize()))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(e -> new KeyGenerationException("Key pair generation failed for " + userId, e))
                .map(pair -> new KeyPairRecord(userId, pair.getPublic(), pair.getPrivate(), clock.instant()))
                .flatMap(this::install)
                .doOnNext(record -> log.info("Generated key pair for {}", userId));
    }

    /** Active key pair, loaded from the store or generated on first use. */
    public Mono<KeyPairRecord> getKeyPair(String userId) {
        return findKeyPair(userId).switchIfEmpty(Mono.defer(() -> generateKeyPair(userId)));
    }

    /** Active key pair if one exists; never generates. */
    public Mono<KeyPairRecord> findKeyPair(String userId) {
        KeyPairRecord cached = keyPairs.get(userId);
        if (cached != null) {
            return Mono.just(cached);
        }
        return keyStore.findKeyPair(userId)
                .flatMap(stored -> Mono.fromCallable(() -> decode(stored)))
                .doOnNext(record -> keyPairs.put(userId, record));
    }

    public Mono<String> exportPublicKey(String userId) {
        return getKeyPair(userId).map(record -> cipher.encodePublicKey(record.publicKey()));
    }

    public Mono<PublicKey> importPublicKey(String base64Key) {
        if (base64Key == null || base64Key.isBlank()) {
            return Mono.error(new PublicKeyImportException("Public key is empty"));
        }
        return Mono.fromCallable(() -> cipher.decodePublicKey(base64Key.trim()))
                .onErrorMap(e -> new PublicKeyImportException("Public key is not a valid SPKI RSA key", e));
    }

    /** Replaces the user's key pair. Emits false instead of an error when generation fails. */
    public Mono<Boolean> rotateKeys(String userId) {
        return generateKeyPair(userId)
                .doOnNext(record -> log.info("Rotated key pair for {}", userId))
                .thenReturn(true)
                .onErrorResume(e -> {
                    log.warn("Key rotation failed for {}: {}", userId, e.getMessage());
                    return Mono.just(false);
                });
    }

    // ── Peer public keys ─────────────────────────────────────────────────────

    /** Validates and stores a peer's public key. */
    public Mono<Void> storePublicKey(String userId, String base64Key) {
        return importPublicKey(base64Key)
                .flatMap(key -> keyStore.savePublicKey(new PublicKeyRecord(userId, base64Key.trim(), clock.instant())));
    }

    public Mono<String> getStoredPublicKey(String userId) {
        return keyStore.findPublicKey(userId).map(PublicKeyRecord::publicKey);
    }

    public Mono<KeyExchangeResult> exchangeKeys(String selfId, String otherId) {
        return exportPublicKey(selfId)
                .map(KeyExchangeResult::success)
                .doOnNext(result -> log.debug("Prepared key exchange from {} to {}", selfId, otherId))
                .onErrorResume(e -> {
                    log.warn("Key exchange from {} to {} failed: {}", selfId, otherId, e.getMessage());
                    return Mono.just(KeyExchangeResult.failure());
                });
    }

    // ── Messages ─────────────────────────────────────────────────────────────

    public Mono<EncryptedEnvelope> encryptMessage(String content, String recipientPublicKey, String senderId) {
        return Mono.fromCallable(() -> {
                    PublicKey recipient = cipher.decodePublicKey(recipientPublicKey);
                    return cipher.encrypt(content.getBytes(StandardCharsets.UTF_8), recipient);
                })
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(e -> new MessageEncryptionException("Message encryption failed for sender " + senderId, e));
    }

    public Mono<String> decryptMessage(EncryptedEnvelope envelope, String recipientId) {
        return findKeyPair(recipientId)
                .switchIfEmpty(Mono.error(() -> new MessageDecryptionException("No key pair for " + recipientId)))
                .flatMap(record -> Mono.fromCallable(() -> cipher.decrypt(envelope, record.privateKey()))
                        .subscribeOn(Schedulers.boundedElastic()))
                .map(plaintext -> new String(plaintext, StandardCharsets.UTF_8))
                .onErrorMap(e -> !(e instanceof MessageDecryptionException),
                        e -> new MessageDecryptionException("Message decryption failed for " + recipientId, e));
    }

    /** True only when the envelope decrypts for the recipient to exactly {@code original}. */
    public Mono<Boolean> verifyMessageIntegrity(String original, EncryptedEnvelope envelope, String recipientId) {
        return decryptMessage(envelope, recipientId)
                .map(plaintext -> plaintext.equals(original))
                .onErrorReturn(false)
                .defaultIfEmpty(false);
    }

    // ── Conversations ────────────────────────────────────────────────────────

    /**
     * Key ids are {@code <conversationId>_<epochMillis>}; the millisecond part is strictly
     * increasing across calls on this manager.
     */
    public EncryptionInfo generateEncryptionInfo(String conversationId) {
        long now = clock.millis();
        long millis = lastKeyIdMillis.updateAndGet(last -> Math.max(now, last + 1));
        Instant createdAt = Instant.ofEpochMilli(millis);
        return new EncryptionInfo(HybridCipher.ALGORITHM, conversationId + "_" + millis, INFO_VERSION,
                new EncryptionInfo.Metadata(properties.getRsaKeySize(), HybridCipher.AES_KEY_SIZE,
                        HybridCipher.IV_SIZE, createdAt));
    }

    public Mono<ConversationEncryptionStatus> getConversationEncryptionStatus(String conversationId,
            List<String> participants) {
        return Flux.fromIterable(participants)
                .filterWhen(participant -> keyStore.findPublicKey(participant).hasElement().map(found -> !found))
                .collectList()
                .map(ConversationEncryptionStatus::of)
                .doOnNext(status -> log.debug("Conversation {} missing keys: {}", conversationId, status.missingKeys()));
    }

    /** Makes sure the current user has a key pair, then reports whether the conversation can be encrypted. */
    public Mono<Boolean> initializeConversationEncryption(String conversationId, List<String> participants,
            String currentUserId) {
        return getKeyPair(currentUserId)
                .then(getConversationEncryptionStatus(conversationId, participants))
                .map(ConversationEncryptionStatus::readyForEncryption)
                .onErrorResume(e -> {
                    log.warn("Could not initialize encryption for conversation {}: {}", conversationId, e.getMessage());
                    return Mono.just(false);
                });
    }

    // ── Backup ───────────────────────────────────────────────────────────────

    /** Seals the user's key pair under a passphrase; the result is base64 of the sealed JSON. */
    public Mono<String> backupKeys(String userId, String passphrase) {
        return findKeyPair(userId)
                .switchIfEmpty(Mono.error(() -> new KeyBackupException("No key pair to back up for " + userId)))
                .flatMap(record -> Mono.fromCallable(() -> seal(record, passphrase))
                        .subscribeOn(Schedulers.boundedElastic()))
                .onErrorMap(e -> !(e instanceof KeyBackupException),
                        e -> new KeyBackupException("Key backup failed for " + userId, e))
                .doOnNext(backup -> log.info("Backed up key pair for {}", userId));
    }

    /** Installs the key pair held in a backup. Emits false on a wrong passphrase or malformed data. */
    public Mono<Boolean> restoreKeys(String backupData, String passphrase) {
        return Mono.fromCallable(() -> open(backupData, passphrase))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(this::install)
                .doOnNext(record -> log.info("Restored key pair for {}", record.userId()))
                .thenReturn(true)
                .onErrorResume(e -> {
                    log.warn("Key restore failed: {}", e.getMessage());
                    return Mono.just(false);
                });
    }

    /** Wipes stored key pairs, stored peer keys and the cache. */
    public Mono<Void> clearAllKeys() {
        return Mono.fromRunnable(keyPairs::clear)
                .then(keyStore.clear())
                .doOnSuccess(v -> log.info("Cleared all local keys"));
    }

    @PreDestroy
    public void shutdown() {
        keyPairs.clear();
    }

    // ── Internals ────────────────────────────────────────────────────────────

    private Mono<KeyPairRecord> install(KeyPairRecord record) {
        StoredKeyPair stored = new StoredKeyPair(record.userId(),
                Base64.getEncoder().encodeToString(record.publicKey().getEncoded()),
                Base64.getEncoder().encodeToString(record.privateKey().getEncoded()),
                record.createdAt());
        return keyStore.saveKeyPair(stored)
                .then(Mono.fromRunnable(() -> keyPairs.put(record.userId(), record)))
                .thenReturn(record);
    }

    private KeyPairRecord decode(StoredKeyPair stored) {
        try {
            PublicKey publicKey = cipher.decodePublicKey(stored.publicKey());
            PrivateKey privateKey = cipher.decodePrivateKey(Base64.getDecoder().decode(stored.privateKey()));
            return new KeyPairRecord(stored.userId(), publicKey, privateKey, stored.createdAt());
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new CryptoException("Stored key pair for " + stored.userId() + " is unreadable", e);
        }
    }

    private String seal(KeyPairRecord record, String passphrase) throws Exception {
        KeyBackupRecord backup = new KeyBackupRecord(record.userId(), record.publicKey().getEncoded(),
                record.privateKey().getEncoded(), record.createdAt().toString(), KeyBackupRecord.CURRENT_VERSION);
        byte[] json = objectMapper.writeValueAsBytes(backup);
        KeyBackupEnvelope sealed = cipher.sealWithPassphrase(json, passphrase.toCharArray(),
                properties.getPbkdf2Iterations());
        return Base64.getEncoder().encodeToString(objectMapper.writeValueAsBytes(sealed));
    }

    private KeyPairRecord open(String backupData, String passphrase) throws Exception {
        KeyBackupEnvelope sealed = objectMapper.readValue(Base64.getDecoder().decode(backupData.trim()),
                KeyBackupEnvelope.class);
        byte[] json = cipher.openWithPassphrase(sealed, passphrase.toCharArray(), properties.getPbkdf2Iterations());
        KeyBackupRecord backup = objectMapper.readValue(json, KeyBackupRecord.class);
        if (backup.version() != KeyBackupRecord.CURRENT_VERSION) {
            throw new KeyBackupException("Unsupported backup version " + backup.version());
        }

        PublicKey publicKey = cipher.decodePublicKey(backup.publicKey());
        PrivateKey privateKey = cipher.decodePrivateKey(backup.privateKey());
        if (!matches(new KeyPair(publicKey, privateKey))) {
            throw new KeyBackupException("Backup holds mismatched public and private keys");
        }
        return new KeyPairRecord(backup.userAddress(), publicKey, privateKey, Instant.parse(backup.createdAt()));
    }

    private static boolean matches(KeyPair pair) {
        return pair.getPublic() instanceof RSAPublicKey pub
                && pair.getPrivate() instanceof RSAPrivateKey priv
                && pub.getModulus().equals(priv.getModulus());
    }
}
