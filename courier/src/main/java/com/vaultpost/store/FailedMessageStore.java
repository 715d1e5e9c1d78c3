package com.vaultpost.store;

import java.time.Instant;
import java.util.function.BiFunction;

import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.reactive.TransactionalOperator;

import com.vaultpost.queue.ContentType;
import com.vaultpost.queue.FailedMessage;

import io.r2dbc.spi.Row;
import io.r2dbc.spi.RowMetadata;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * {@code failed_messages}: messages the engine gave up on, kept for manual retry
 * until the retention window passes.
 */
@Repository
public class FailedMessageStore extends GuardedStore {

    private static final String COLUMNS = "id, original_message_id, conversation_id, content, content_type, "
            + "attachments, original_timestamp, failure_reason, failed_at, retry_count";

    private final AttachmentCodec attachments;

    public FailedMessageStore(DatabaseClient db, TransactionalOperator tx, AttachmentCodec attachments) {
        super(db, tx);
        this.attachments = attachments;
    }

    /**
     * Inserts the failed row and removes the original queue row in one transaction,
     * so the two never coexist. Emits false when the queue row was already gone.
     */
    public Mono<Boolean> demote(FailedMessage failed) {
        Mono<Boolean> work = db.sql("DELETE FROM message_queue WHERE id = :id")
                .bind("id", failed.originalMessageId())
                .fetch().rowsUpdated()
                .flatMap(removed -> removed == 0
                        ? Mono.just(false)
                        : insertStatement(failed).fetch().rowsUpdated().thenReturn(true));
        return atomically("demoteQueueItem", work).defaultIfEmpty(false);
    }

    public Mono<FailedMessage> findById(String id) {
        return readOne("findFailedMessage", db.sql("SELECT " + COLUMNS + " FROM failed_messages WHERE id = :id")
                .bind("id", id)
                .map(mapper())
                .one());
    }

    /** Most recent failures first. */
    public Flux<FailedMessage> findAll() {
        return readMany("findFailedMessages", db.sql("SELECT " + COLUMNS
                        + " FROM failed_messages ORDER BY failed_at DESC, id")
                .map(mapper())
                .all());
    }

    public Mono<Long> count() {
        return count("countFailedMessages", db.sql("SELECT COUNT(*) AS n FROM failed_messages")
                .map((row, meta) -> row.get("n", Long.class))
                .one());
    }

    /** Deletes failures recorded before the cutoff and returns how many went. */
    public Mono<Long> pruneOlderThan(Instant cutoff) {
        return count("pruneFailedMessages", db.sql("DELETE FROM failed_messages WHERE failed_at < :cutoff")
                .bind("cutoff", cutoff.toEpochMilli())
                .fetch().rowsUpdated());
    }

    public Mono<Void> clear() {
        return write("clearFailedMessages", db.sql("DELETE FROM failed_messages").fetch().rowsUpdated());
    }

    private DatabaseClient.GenericExecuteSpec insertStatement(FailedMessage failed) {
        DatabaseClient.GenericExecuteSpec spec = db.sql("INSERT INTO failed_messages (" + COLUMNS + ") "
                        + "VALUES (:id, :original_message_id, :conversation_id, :content, :content_type, "
                        + ":attachments, :original_timestamp, :failure_reason, :failed_at, :retry_count)")
                .bind("id", failed.id())
                .bind("original_message_id", failed.originalMessageId())
                .bind("conversation_id", failed.conversationId())
                .bind("content", failed.content())
                .bind("content_type", failed.contentType().wireName())
                .bind("original_timestamp", failed.originalTimestamp().toEpochMilli())
                .bind("failed_at", failed.timestamp().toEpochMilli())
                .bind("retry_count", failed.retryCount());
        spec = bindNullable(spec, "attachments", attachments.encode(failed.attachments()), String.class);
        return bindNullable(spec, "failure_reason", failed.failureReason(), String.class);
    }

    private BiFunction<Row, RowMetadata, FailedMessage> mapper() {
        return (row, meta) -> new FailedMessage(
                row.get("id", String.class),
                row.get("original_message_id", String.class),
                row.get("conversation_id", String.class),
                row.get("content", String.class),
                ContentType.fromWire(row.get("content_type", String.class)),
                attachments.decode(row.get("attachments", String.class)),
                Instant.ofEpochMilli(row.get("original_timestamp", Long.class)),
                row.get("failure_reason", String.class),
                Instant.ofEpochMilli(row.get("failed_at", Long.class)),
                row.get("retry_count", Integer.class));
    }
}
