package com.vaultpost.store;

import java.time.Instant;
import java.util.function.BiFunction;

import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.reactive.TransactionalOperator;

import com.vaultpost.queue.ContentType;
import com.vaultpost.queue.QueueItem;
import com.vaultpost.queue.QueueItemStatus;

import io.r2dbc.spi.Row;
import io.r2dbc.spi.RowMetadata;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * {@code message_queue}: outbound messages in creation order.
 *
 * The status column is the send claim. A row moves {@code pending -> sending}
 * only through {@link #claim(String)}, which succeeds for exactly one caller.
 */
@Repository
public class QueueItemStore extends GuardedStore {

    private static final String COLUMNS =
            "id, conversation_id, content, content_type, attachments, created_at, retry_count, status";

    private final AttachmentCodec attachments;

    public QueueItemStore(DatabaseClient db, TransactionalOperator tx, AttachmentCodec attachments) {
        super(db, tx);
        this.attachments = attachments;
    }

    public Mono<Void> insert(QueueItem item) {
        return write("insertQueueItem", insertStatement(item).fetch().rowsUpdated());
    }

    public Mono<QueueItem> findById(String id) {
        return readOne("findQueueItem", db.sql("SELECT " + COLUMNS + " FROM message_queue WHERE id = :id")
                .bind("id", id)
                .map(mapper())
                .one());
    }

    /** Pending items across all conversations, oldest first. */
    public Flux<QueueItem> findPending() {
        return readMany("findPendingQueueItems", db.sql("SELECT " + COLUMNS
                        + " FROM message_queue WHERE status = 'pending' ORDER BY created_at, id")
                .map(mapper())
                .all());
    }

    /** Every queued item of one conversation, pending or in flight, oldest first. */
    public Flux<QueueItem> findByConversation(String conversationId) {
        return readMany("findQueueItemsByConversation", db.sql("SELECT " + COLUMNS
                        + " FROM message_queue WHERE conversation_id = :conversation_id ORDER BY created_at, id")
                .bind("conversation_id", conversationId)
                .map(mapper())
                .all());
    }

    /** Conversations that still have queued items. */
    public Flux<String> findConversationIds() {
        return readMany("findQueuedConversations", db.sql(
                        "SELECT DISTINCT conversation_id FROM message_queue ORDER BY conversation_id")
                .map((row, meta) -> row.get("conversation_id", String.class))
                .all());
    }

    /** Moves a pending item to {@code sending}; false when it is gone or already claimed. */
    public Mono<Boolean> claim(String id) {
        return readOne("claimQueueItem", db.sql(
                        "UPDATE message_queue SET status = 'sending' WHERE id = :id AND status = 'pending'")
                .bind("id", id)
                .fetch().rowsUpdated()
                .map(rows -> rows == 1))
                .defaultIfEmpty(false);
    }

    /** Releases a claim after a retryable failure. */
    public Mono<Void> release(String id, int retryCount) {
        return write("releaseQueueItem", db.sql(
                        "UPDATE message_queue SET status = 'pending', retry_count = :retry_count WHERE id = :id")
                .bind("id", id)
                .bind("retry_count", retryCount)
                .fetch().rowsUpdated());
    }

    /** Returns true when the row existed. */
    public Mono<Boolean> delete(String id) {
        return readOne("deleteQueueItem", db.sql("DELETE FROM message_queue WHERE id = :id")
                .bind("id", id)
                .fetch().rowsUpdated()
                .map(rows -> rows > 0))
                .defaultIfEmpty(false);
    }

    /** Puts every in-flight item back to pending; used on startup after an unclean stop. */
    public Mono<Long> resetInFlight() {
        return count("resetInFlightQueueItems", db.sql(
                        "UPDATE message_queue SET status = 'pending' WHERE status = 'sending'")
                .fetch().rowsUpdated());
    }

    /** Re-queues a failed message and drops its failed row in one transaction. */
    public Mono<Boolean> reviveFailed(String failedId, QueueItem item) {
        Mono<Boolean> work = db.sql("DELETE FROM failed_messages WHERE id = :id")
                .bind("id", failedId)
                .fetch().rowsUpdated()
                .flatMap(removed -> removed == 0
                        ? Mono.just(false)
                        : insertStatement(item).fetch().rowsUpdated().thenReturn(true));
        return atomically("reviveFailedMessage", work).defaultIfEmpty(false);
    }

    public Mono<Long> countByStatus(QueueItemStatus status) {
        return count("countQueueItems", db.sql("SELECT COUNT(*) AS n FROM message_queue WHERE status = :status")
                .bind("status", status.wireName())
                .map((row, meta) -> row.get("n", Long.class))
                .one());
    }

    public Mono<Long> countByConversation(String conversationId) {
        return count("countConversationQueue", db.sql(
                        "SELECT COUNT(*) AS n FROM message_queue WHERE conversation_id = :conversation_id")
                .bind("conversation_id", conversationId)
                .map((row, meta) -> row.get("n", Long.class))
                .one());
    }

    public Mono<Void> clear() {
        return write("clearQueueItems", db.sql("DELETE FROM message_queue").fetch().rowsUpdated());
    }

    private DatabaseClient.GenericExecuteSpec insertStatement(QueueItem item) {
        DatabaseClient.GenericExecuteSpec spec = db.sql("INSERT INTO message_queue (" + COLUMNS + ") "
                        + "VALUES (:id, :conversation_id, :content, :content_type, :attachments, :created_at, "
                        + ":retry_count, :status)")
                .bind("id", item.id())
                .bind("conversation_id", item.conversationId())
                .bind("content", item.content())
                .bind("content_type", item.contentType().wireName())
                .bind("created_at", item.timestamp().toEpochMilli())
                .bind("retry_count", item.retryCount())
                .bind("status", item.status().wireName());
        return bindNullable(spec, "attachments", attachments.encode(item.attachments()), String.class);
    }

    private BiFunction<Row, RowMetadata, QueueItem> mapper() {
        return (row, meta) -> new QueueItem(
                row.get("id", String.class),
                row.get("conversation_id", String.class),
                row.get("content", String.class),
                ContentType.fromWire(row.get("content_type", String.class)),
                attachments.decode(row.get("attachments", String.class)),
                Instant.ofEpochMilli(row.get("created_at", Long.class)),
                row.get("retry_count", Integer.class),
                QueueItemStatus.fromWire(row.get("status", String.class)));
    }
}
