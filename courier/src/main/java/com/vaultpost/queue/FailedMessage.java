package com.vaultpost.queue;

import java.time.Instant;
import java.util.List;

/**
 * A message that exhausted its retries or was rejected by the server.
 *
 * @param timestamp when the message was demoted; drives retention pruning
 */
public record FailedMessage(
        String id,
        String originalMessageId,
        String conversationId,
        String content,
        ContentType contentType,
        List<String> attachments,
        Instant originalTimestamp,
        String failureReason,
        Instant timestamp,
        int retryCount) {

    public FailedMessage {
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }

    public static FailedMessage demote(String id, QueueItem item, String reason, Instant failedAt) {
        return new FailedMessage(id, item.id(), item.conversationId(), item.content(), item.contentType(),
                item.attachments(), item.timestamp(), reason, failedAt, item.retryCount());
    }
}
