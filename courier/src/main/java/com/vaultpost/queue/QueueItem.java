package com.vaultpost.queue;

import java.time.Instant;
import java.util.List;

/**
 * Outbound message waiting in the local queue.
 *
 * @param content     opaque payload, normally the JSON form of an encrypted envelope
 * @param attachments attachment references, never null
 * @param timestamp   creation time; strictly increasing per engine, so it also orders the queue
 */
public record QueueItem(
        String id,
        String conversationId,
        String content,
        ContentType contentType,
        List<String> attachments,
        Instant timestamp,
        int retryCount,
        QueueItemStatus status) {

    public QueueItem {
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }

    public QueueItem withStatus(QueueItemStatus newStatus) {
        return new QueueItem(id, conversationId, content, contentType, attachments, timestamp, retryCount, newStatus);
    }

    public QueueItem withRetryCount(int newRetryCount) {
        return new QueueItem(id, conversationId, content, contentType, attachments, timestamp, newRetryCount, status);
    }
}
