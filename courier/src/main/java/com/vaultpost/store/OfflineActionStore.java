package com.vaultpost.store;

import java.time.Instant;
import java.util.function.BiFunction;

import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.reactive.TransactionalOperator;

import com.vaultpost.queue.ActionStatus;
import com.vaultpost.queue.OfflineActionRecord;

import io.r2dbc.spi.Row;
import io.r2dbc.spi.RowMetadata;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/** {@code offline_actions}: user actions waiting for connectivity. */
@Repository
public class OfflineActionStore extends GuardedStore {

    private static final String COLUMNS = "id, action_type, data, created_at, retry_count, max_retries, status";

    private static final BiFunction<Row, RowMetadata, OfflineActionRecord> MAPPER = (row, meta) ->
            new OfflineActionRecord(
                    row.get("id", String.class),
                    row.get("action_type", String.class),
                    row.get("data", String.class),
                    Instant.ofEpochMilli(row.get("created_at", Long.class)),
                    row.get("retry_count", Integer.class),
                    row.get("max_retries", Integer.class),
                    ActionStatus.fromWire(row.get("status", String.class)));

    public OfflineActionStore(DatabaseClient db, TransactionalOperator tx) {
        super(db, tx);
    }

    public Mono<Void> insert(OfflineActionRecord action) {
        return write("insertOfflineAction", db.sql("INSERT INTO offline_actions (" + COLUMNS + ") "
                        + "VALUES (:id, :action_type, :data, :created_at, :retry_count, :max_retries, :status)")
                .bind("id", action.id())
                .bind("action_type", action.type())
                .bind("data", action.data())
                .bind("created_at", action.timestamp().toEpochMilli())
                .bind("retry_count", action.retryCount())
                .bind("max_retries", action.maxRetries())
                .bind("status", action.status().wireName())
                .fetch().rowsUpdated());
    }

    public Mono<OfflineActionRecord> findById(String id) {
        return readOne("findOfflineAction", db.sql("SELECT " + COLUMNS + " FROM offline_actions WHERE id = :id")
                .bind("id", id)
                .map(MAPPER)
                .one());
    }

    /** Pending actions, oldest first. */
    public Flux<OfflineActionRecord> findPending() {
        return readMany("findPendingOfflineActions", db.sql("SELECT " + COLUMNS
                        + " FROM offline_actions WHERE status = 'pending' ORDER BY created_at, id")
                .map(MAPPER)
                .all());
    }

    /** Moves a pending action to {@code executing}; false when it is gone or already claimed. */
    public Mono<Boolean> claim(String id) {
        return readOne("claimOfflineAction", db.sql(
                        "UPDATE offline_actions SET status = 'executing' WHERE id = :id AND status = 'pending'")
                .bind("id", id)
                .fetch().rowsUpdated()
                .map(rows -> rows == 1))
                .defaultIfEmpty(false);
    }

    public Mono<Void> release(String id, int retryCount) {
        return write("releaseOfflineAction", db.sql(
                        "UPDATE offline_actions SET status = 'pending', retry_count = :retry_count WHERE id = :id")
                .bind("id", id)
                .bind("retry_count", retryCount)
                .fetch().rowsUpdated());
    }

    public Mono<Boolean> delete(String id) {
        return readOne("deleteOfflineAction", db.sql("DELETE FROM offline_actions WHERE id = :id")
                .bind("id", id)
                .fetch().rowsUpdated()
                .map(rows -> rows > 0))
                .defaultIfEmpty(false);
    }

    public Mono<Long> resetInFlight() {
        return count("resetInFlightOfflineActions", db.sql(
                        "UPDATE offline_actions SET status = 'pending' WHERE status = 'executing'")
                .fetch().rowsUpdated());
    }

    public Mono<Long> count() {
        return count("countOfflineActions", db.sql("SELECT COUNT(*) AS n FROM offline_actions")
                .map((row, meta) -> row.get("n", Long.class))
                .one());
    }

    public Mono<Void> clear() {
        return write("clearOfflineActions", db.sql("DELETE FROM offline_actions").fetch().rowsUpdated());
    }
}
