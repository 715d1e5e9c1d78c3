package com.vaultpost.store;

import java.time.Instant;
import java.util.function.BiFunction;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.reactive.TransactionalOperator;

import com.vaultpost.status.SyncState;
import com.vaultpost.status.SyncStatus;

import io.r2dbc.spi.Row;
import io.r2dbc.spi.RowMetadata;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/** {@code sync_status}: one row per conversation, keyed by conversation id. */
@Repository
public class SyncStatusStore extends GuardedStore {

    private static final String COLUMNS =
            "conversation_id, status, progress, pending_messages, last_sync_time, error_message, retry_count";

    private static final BiFunction<Row, RowMetadata, SyncStatus> MAPPER = (row, meta) -> new SyncStatus(
            row.get("conversation_id", String.class),
            SyncState.fromWire(row.get("status", String.class)),
            row.get("progress", Integer.class),
            row.get("pending_messages", Integer.class),
            Instant.ofEpochMilli(row.get("last_sync_time", Long.class)),
            row.get("error_message", String.class),
            row.get("retry_count", Integer.class));

    public SyncStatusStore(DatabaseClient db, TransactionalOperator tx) {
        super(db, tx);
    }

    public Mono<Void> upsert(SyncStatus status) {
        return write("upsertSyncStatus", upsertStatement(status).fetch().rowsUpdated());
    }

    /**
     * Applies a transition to the conversation's row under a row lock and returns the
     * stored result. A missing row starts from {@code initial}. When storage is
     * unavailable the transition is still computed and returned, just not persisted.
     */
    public Mono<SyncStatus> update(String conversationId, Supplier<SyncStatus> initial,
            UnaryOperator<SyncStatus> transition) {
        Mono<SyncStatus> work = db.sql("SELECT " + COLUMNS
                        + " FROM sync_status WHERE conversation_id = :conversation_id FOR UPDATE")
                .bind("conversation_id", conversationId)
                .map(MAPPER)
                .one()
                .switchIfEmpty(Mono.fromSupplier(initial))
                .map(transition)
                .flatMap(next -> upsertStatement(next).fetch().rowsUpdated().thenReturn(next));
        return atomically("updateSyncStatus", work)
                .switchIfEmpty(Mono.fromSupplier(() -> transition.apply(initial.get())));
    }

    public Mono<SyncStatus> find(String conversationId) {
        return readOne("findSyncStatus", db.sql("SELECT " + COLUMNS
                        + " FROM sync_status WHERE conversation_id = :conversation_id")
                .bind("conversation_id", conversationId)
                .map(MAPPER)
                .one());
    }

    public Flux<SyncStatus> findAll() {
        return readMany("findSyncStatuses", db.sql("SELECT " + COLUMNS + " FROM sync_status ORDER BY conversation_id")
                .map(MAPPER)
                .all());
    }

    public Flux<SyncStatus> findByState(SyncState state) {
        return readMany("findSyncStatusesByState", db.sql("SELECT " + COLUMNS
                        + " FROM sync_status WHERE status = :status ORDER BY conversation_id")
                .bind("status", state.wireName())
                .map(MAPPER)
                .all());
    }

    public Mono<Void> clear() {
        return write("clearSyncStatus", db.sql("DELETE FROM sync_status").fetch().rowsUpdated());
    }

    private DatabaseClient.GenericExecuteSpec upsertStatement(SyncStatus status) {
        DatabaseClient.GenericExecuteSpec spec = db.sql("MERGE INTO sync_status (" + COLUMNS + ") "
                        + "KEY (conversation_id) VALUES (:conversation_id, :status, :progress, :pending_messages, "
                        + ":last_sync_time, :error_message, :retry_count)")
                .bind("conversation_id", status.conversationId())
                .bind("status", status.status().wireName())
                .bind("progress", status.progress())
                .bind("pending_messages", status.pendingMessages())
                .bind("last_sync_time", status.lastSyncTime().toEpochMilli())
                .bind("retry_count", status.retryCount());
        return bindNullable(spec, "error_message", status.errorMessage(), String.class);
    }
}
