package com.vaultpost.store;

import java.time.Instant;

import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.reactive.TransactionalOperator;

import com.vaultpost.keys.PublicKeyRecord;

import reactor.core.publisher.Mono;

/**
 * Persists the local users' key pairs and the cached public keys of peers.
 * Keys are stored encoded (base64 SPKI / PKCS#8); decoding is the caller's job.
 */
@Repository
public class KeyStore extends GuardedStore {

    public KeyStore(DatabaseClient db, TransactionalOperator tx) {
        super(db, tx);
    }

    public Mono<Void> saveKeyPair(StoredKeyPair keyPair) {
        String sql = "MERGE INTO key_pairs (user_id, public_key, private_key, created_at) KEY (user_id) "
                + "VALUES (:user_id, :public_key, :private_key, :created_at)";
        return write("saveKeyPair", db.sql(sql)
                .bind("user_id", keyPair.userId())
                .bind("public_key", keyPair.publicKey())
                .bind("private_key", keyPair.privateKey())
                .bind("created_at", keyPair.createdAt().toEpochMilli())
                .fetch().rowsUpdated());
    }

    public Mono<StoredKeyPair> findKeyPair(String userId) {
        String sql = "SELECT user_id, public_key, private_key, created_at FROM key_pairs WHERE user_id = :user_id";
        return readOne("findKeyPair", db.sql(sql).bind("user_id", userId)
                .map((row, meta) -> new StoredKeyPair(
                        row.get("user_id", String.class),
                        row.get("public_key", String.class),
                        row.get("private_key", String.class),
                        Instant.ofEpochMilli(row.get("created_at", Long.class))))
                .one());
    }

    public Mono<Void> deleteKeyPair(String userId) {
        return write("deleteKeyPair", db.sql("DELETE FROM key_pairs WHERE user_id = :user_id")
                .bind("user_id", userId).fetch().rowsUpdated());
    }

    public Mono<Void> savePublicKey(PublicKeyRecord record) {
        String sql = "MERGE INTO public_keys (user_id, public_key, created_at) KEY (user_id) "
                + "VALUES (:user_id, :public_key, :created_at)";
        return write("savePublicKey", db.sql(sql)
                .bind("user_id", record.userId())
                .bind("public_key", record.publicKey())
                .bind("created_at", record.createdAt().toEpochMilli())
                .fetch().rowsUpdated());
    }

    public Mono<PublicKeyRecord> findPublicKey(String userId) {
        String sql = "SELECT user_id, public_key, created_at FROM public_keys WHERE user_id = :user_id";
        return readOne("findPublicKey", db.sql(sql).bind("user_id", userId)
                .map((row, meta) -> new PublicKeyRecord(
                        row.get("user_id", String.class),
                        row.get("public_key", String.class),
                        Instant.ofEpochMilli(row.get("created_at", Long.class))))
                .one());
    }

    public Mono<Void> deletePublicKey(String userId) {
        return write("deletePublicKey", db.sql("DELETE FROM public_keys WHERE user_id = :user_id")
                .bind("user_id", userId).fetch().rowsUpdated());
    }

    /** Wipes both key tables in one transaction. */
    public Mono<Void> clear() {
        Mono<Long> wipe = db.sql("DELETE FROM key_pairs").fetch().rowsUpdated()
                .then(db.sql("DELETE FROM public_keys").fetch().rowsUpdated());
        return atomically("clearKeys", wipe).then();
    }
}
