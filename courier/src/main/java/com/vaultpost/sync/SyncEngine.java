package com.vaultpost.sync;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vaultpost.config.SyncProperties;
import com.vaultpost.crypto.EncryptedEnvelope;
import com.vaultpost.queue.ActionStatus;
import com.vaultpost.queue.ContentType;
import com.vaultpost.queue.FailedMessage;
import com.vaultpost.queue.OfflineActionRecord;
import com.vaultpost.queue.QueueItem;
import com.vaultpost.queue.QueueItemStatus;
import com.vaultpost.queue.QueueStats;
import com.vaultpost.status.SyncStatusMonitor;
import com.vaultpost.store.FailedMessageStore;
import com.vaultpost.store.OfflineActionStore;
import com.vaultpost.store.QueueItemStore;

import jakarta.annotation.PreDestroy;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * Drains the local queue into the remote message service.
 *
 * <p><strong>Item lifecycle:</strong> {@code pending -> sending -> removed}, or back to
 * {@code pending} with a retry timer, or demoted to {@code failed_messages}. The move to
 * {@code sending} is a conditional update, so a sync pass and a retry timer that race
 * for the same item never both transmit it. Offline actions follow the same cycle with
 * {@code executing} as the claimed state and are dropped instead of demoted.
 *
 * <p>Only one full sync pass runs at a time. Queue and action calls never signal
 * transmission failures; outcomes show up in the tables and in {@link SyncStatusMonitor}.
 */
@Service
public class SyncEngine {

    private static final Logger log = LoggerFactory.getLogger(SyncEngine.class);

    private final QueueItemStore queueItems;
    private final OfflineActionStore actions;
    private final FailedMessageStore failedMessages;
    private final SyncStatusMonitor monitor;
    private final MessageTransport transport;
    private final ObjectMapper objectMapper;
    private final SyncProperties properties;
    private final Clock clock;
    private final Scheduler scheduler;

    private final RetryPolicy retryPolicy;
    private final RetryScheduler retries;

    private final AtomicBoolean online;
    private final AtomicBoolean syncInProgress = new AtomicBoolean();
    private final AtomicLong lastTimestamp = new AtomicLong();

    private volatile Instant lastSyncAttempt;
    private volatile Disposable periodicSync;

    public SyncEngine(QueueItemStore queueItems, OfflineActionStore actions, FailedMessageStore failedMessages,
            SyncStatusMonitor monitor, MessageTransport transport, ObjectMapper objectMapper,
            SyncProperties properties, Clock clock, Scheduler scheduler) {
        this.queueItems = queueItems;
        this.actions = actions;
        this.failedMessages = failedMessages;
        this.monitor = monitor;
        this.transport = transport;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
        this.scheduler = scheduler;
        this.retryPolicy = RetryPolicy.from(properties);
        this.retries = new RetryScheduler(scheduler);
        this.online = new AtomicBoolean(properties.isStartOnline());
    }

    // ── Lifecycle ────────────────────────────────────────────────────────────

    @EventListener(ApplicationReadyEvent.class)
    public void init() {
        recoverInFlight()
                .then(Mono.fromRunnable(this::startPeriodicSync))
                .then(syncPendingMessages())
                .onErrorResume(e -> {
                    log.error("Sync engine startup failed: {}", e.getMessage(), e);
                    return Mono.empty();
                })
                .subscribe();
    }

    @PreDestroy
    public synchronized void shutdown() {
        if (periodicSync != null && !periodicSync.isDisposed()) {
            periodicSync.dispose();
        }
        retries.cancelAll();
        log.info("Sync engine stopped");
    }

    /**
     * Puts items left {@code sending}/{@code executing} by an unclean stop back to pending.
     *
     * @return number of rows reset
     */
    public Mono<Long> recoverInFlight() {
        return Mono.zip(queueItems.resetInFlight(), actions.resetInFlight())
                .map(reset -> reset.getT1() + reset.getT2())
                .doOnNext(reset -> {
                    if (reset > 0) {
                        log.info("Recovered {} interrupted queue entries", reset);
                    }
                });
    }

    private synchronized void startPeriodicSync() {
        if (periodicSync != null && !periodicSync.isDisposed()) {
            return;
        }
        Duration interval = properties.getSyncInterval();
        periodicSync = Flux.interval(interval, interval, scheduler)
                .onBackpressureDrop()
                .filter(tick -> online.get() && !syncInProgress.get())
                .concatMap(tick -> syncPendingMessages())
                .onErrorContinue((err, o) -> log.warn("Periodic sync failed: {}", err.getMessage(), err))
                .subscribe();
        log.info("Periodic sync every {}", interval);
    }

    // ── Queueing ─────────────────────────────────────────────────────────────

    public Mono<String> queueMessage(String conversationId, String content, ContentType contentType) {
        return queueMessage(conversationId, content, contentType, List.of());
    }

    /**
     * Persists a message and, when online, starts sending it. Emits the item id once the
     * row is stored; the send outcome is reported only through the tables and the monitor.
     */
    public Mono<String> queueMessage(String conversationId, String content, ContentType contentType,
            List<String> attachments) {
        if (conversationId == null || content == null || contentType == null) {
            return Mono.error(new IllegalArgumentException("conversationId, content and contentType are required"));
        }
        boolean sendNow = online.get();
        QueueItem item = new QueueItem(newId(), conversationId, content, contentType, attachments, nextTimestamp(),
                0, sendNow ? QueueItemStatus.SENDING : QueueItemStatus.PENDING);
        return queueItems.insert(item)
                .then(announce(conversationId, sendNow))
                .then(Mono.fromRunnable(() -> {
                    log.debug("Queued message {} for conversation {}", item.id(), conversationId);
                    if (sendNow) {
                        launch(transmit(item), item.id());
                    }
                }))
                .thenReturn(item.id());
    }

    /** Queues an envelope in its JSON wire form. */
    public Mono<String> queueEncryptedMessage(String conversationId, EncryptedEnvelope envelope,
            ContentType contentType) {
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(envelope))
                .flatMap(json -> queueMessage(conversationId, json, contentType));
    }

    public Mono<String> queueOfflineAction(OfflineActionPayload action) {
        return queueOfflineAction(action, properties.getDefaultActionMaxRetries());
    }

    public Mono<String> queueOfflineAction(OfflineActionPayload action, int maxRetries) {
        if (action == null) {
            return Mono.error(new IllegalArgumentException("action is required"));
        }
        boolean runNow = online.get();
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(action))
                .map(data -> new OfflineActionRecord(newId(), action.type().tag(), data, nextTimestamp(), 0,
                        Math.max(maxRetries, 1), runNow ? ActionStatus.EXECUTING : ActionStatus.PENDING))
                .flatMap(record -> actions.insert(record)
                        .then(Mono.fromRunnable(() -> {
                            log.debug("Queued {} action {}", record.type(), record.id());
                            if (runNow) {
                                launch(execute(record, action), record.id());
                            }
                        }))
                        .thenReturn(record.id()));
    }

    // ── Connectivity ─────────────────────────────────────────────────────────

    /**
     * Reports a connectivity change. Going online runs a sync pass; going offline marks
     * every conversation with queued messages as offline. In-flight sends are left to
     * fail on their own and re-queue.
     */
    public Mono<Void> setOnline(boolean nowOnline) {
        boolean wasOnline = online.getAndSet(nowOnline);
        if (nowOnline) {
            if (!wasOnline) {
                log.info("Connectivity restored, starting sync");
            }
            return syncPendingMessages();
        }
        if (wasOnline) {
            log.info("Connectivity lost, queueing locally");
        }
        return queueItems.findConversationIds()
                .concatMap(conversationId -> queueItems.countByConversation(conversationId)
                        .flatMap(pending -> monitor.markOffline(conversationId, pending.intValue())))
                .then();
    }

    public boolean isOnline() {
        return online.get();
    }

    public NetworkStatus getNetworkStatus() {
        return new NetworkStatus(online.get(), syncInProgress.get(), lastSyncAttempt);
    }

    // ── Sync passes ──────────────────────────────────────────────────────────

    /**
     * One full pass: pending messages in FIFO order, then pending actions, then pruning of
     * old failed messages. A no-op when offline or when another pass is running.
     */
    public Mono<Void> syncPendingMessages() {
        return Mono.defer(() -> {
            if (!online.get()) {
                log.debug("Skipping sync pass while offline");
                return Mono.empty();
            }
            if (!syncInProgress.compareAndSet(false, true)) {
                log.debug("Sync pass already running");
                return Mono.empty();
            }
            lastSyncAttempt = clock.instant();
            return drainMessages()
                    .then(drainActions())
                    .then(pruneFailedMessages())
                    .doOnSuccess(v -> log.debug("Sync pass finished"))
                    .onErrorResume(e -> {
                        log.error("Sync pass failed: {}", e.getMessage(), e);
                        return Mono.empty();
                    })
                    .doFinally(signal -> syncInProgress.set(false));
        });
    }

    public Mono<Void> forceSync() {
        return syncPendingMessages();
    }

    /** Re-arms errored conversations through the monitor, then runs a pass. */
    public Mono<List<String>> retryFailedSyncs() {
        return monitor.retryFailedSyncs()
                .flatMap(ids -> syncPendingMessages().thenReturn(ids));
    }

    private Mono<Void> drainMessages() {
        return queueItems.findPending()
                .collectList()
                .flatMapMany(items -> Flux.fromIterable(groupByConversation(items).entrySet()))
                .concatMap(group -> drainConversation(group.getKey(), group.getValue()))
                .then();
    }

    private Mono<Void> drainConversation(String conversationId, List<QueueItem> items) {
        AtomicInteger done = new AtomicInteger();
        return monitor.setSyncing(conversationId, items.size())
                .thenMany(Flux.fromIterable(items))
                .takeWhile(item -> online.get())
                .concatMap(item -> claimAndTransmit(item.id())
                        .then(Mono.defer(() -> monitor.updateProgress(conversationId,
                                done.incrementAndGet() * 100 / items.size()))))
                .then();
    }

    private Mono<Void> drainActions() {
        return actions.findPending()
                .takeWhile(action -> online.get())
                .concatMap(action -> claimAndExecute(action.id()))
                .then();
    }

    private Mono<Void> pruneFailedMessages() {
        Instant cutoff = clock.instant().minus(properties.getFailedRetention());
        return failedMessages.pruneOlderThan(cutoff)
                .doOnNext(pruned -> {
                    if (pruned > 0) {
                        log.info("Pruned {} failed messages older than {}", pruned, cutoff);
                    }
                })
                .then();
    }

    private static Map<String, List<QueueItem>> groupByConversation(List<QueueItem> items) {
        Map<String, List<QueueItem>> groups = new LinkedHashMap<>();
        for (QueueItem item : items) {
            groups.computeIfAbsent(item.conversationId(), id -> new ArrayList<>()).add(item);
        }
        return groups;
    }

    // ── Messages ─────────────────────────────────────────────────────────────

    /** Transmits the item only if it is still queued and pending. */
    private Mono<Void> claimAndTransmit(String id) {
        return queueItems.claim(id)
                .filter(Boolean::booleanValue)
                .flatMap(claimed -> queueItems.findById(id))
                .flatMap(this::transmit);
    }

    private Mono<Void> transmit(QueueItem item) {
        return Mono.defer(() -> transport.send(item))
                .map(outcome -> outcome.isDelivered()
                        ? Optional.<TransmissionFailure>empty()
                        : Optional.of(TransmissionFailure.ofStatus(outcome.statusCode())))
                .onErrorResume(e -> Mono.just(Optional.of(TransmissionFailure.ofError(e))))
                .defaultIfEmpty(Optional.of(new TransmissionFailure(FailureKind.RETRYABLE_NETWORK,
                        "Transport completed without a response")))
                .flatMap(failure -> failure.isPresent()
                        ? onSendFailure(item, failure.get())
                        : onDelivered(item));
    }

    private Mono<Void> onDelivered(QueueItem item) {
        retries.cancel(item.id());
        String conversationId = item.conversationId();
        return queueItems.delete(item.id())
                .then(queueItems.countByConversation(conversationId))
                .flatMap(remaining -> remaining == 0
                        ? monitor.markSynced(conversationId)
                        : monitor.setSyncing(conversationId, remaining.intValue()))
                .doOnSuccess(status -> log.debug("Delivered message {}", item.id()))
                .then();
    }

    private Mono<Void> onSendFailure(QueueItem item, TransmissionFailure failure) {
        int retryCount = item.retryCount() + 1;
        if (!failure.kind().isRetryable() || retryPolicy.isExhausted(retryCount)) {
            return demote(item.withRetryCount(retryCount), failure.reason());
        }
        Duration delay = retryPolicy.delayFor(retryCount);
        log.warn("Send of message {} failed ({}), attempt {} of {}, retrying in {} ms",
                item.id(), failure.reason(), retryCount, retryPolicy.maxRetries(), delay.toMillis());
        return queueItems.release(item.id(), retryCount)
                .then(monitor.markError(item.conversationId(), failure.reason()))
                .then(Mono.fromRunnable(() -> retries.schedule(item.id(), delay,
                        () -> launch(retryMessage(item.id()), item.id()))));
    }

    private Mono<Void> retryMessage(String id) {
        if (!online.get()) {
            log.debug("Retry of {} deferred until connectivity returns", id);
            return Mono.empty();
        }
        return claimAndTransmit(id);
    }

    private Mono<Void> demote(QueueItem item, String reason) {
        retries.cancel(item.id());
        FailedMessage failed = FailedMessage.demote(newId(), item, reason, clock.instant());
        return failedMessages.demote(failed)
                .flatMap(moved -> {
                    if (!moved) {
                        return requeueAfterFailedDemotion(item);
                    }
                    log.info("Message {} failed after {} attempts and was moved to failed messages: {}",
                            item.id(), item.retryCount(), reason);
                    return monitor.markError(item.conversationId(), "Message delivery failed: " + reason).then();
                })
                .then();
    }

    /**
     * A demotion that did not go through leaves the item claimed. If the row is still there,
     * it goes back to pending so the next sync pass tries again; if it is gone there is
     * nothing left to do.
     */
    private Mono<Void> requeueAfterFailedDemotion(QueueItem item) {
        return queueItems.findById(item.id())
                .flatMap(stillQueued -> {
                    log.error("Could not move message {} to failed messages, returning it to the queue",
                            item.id());
                    return queueItems.release(item.id(), item.retryCount());
                });
    }

    /**
     * Re-queues a failed message as a new pending item with a fresh retry budget and
     * sends it right away when online. Emits false when no such failed message exists.
     */
    public Mono<Boolean> retryFailedMessage(String failedId) {
        return failedMessages.findById(failedId)
                .flatMap(failed -> {
                    QueueItem item = new QueueItem(newId(), failed.conversationId(), failed.content(),
                            failed.contentType(), failed.attachments(), nextTimestamp(), 0, QueueItemStatus.PENDING);
                    return queueItems.reviveFailed(failedId, item)
                            .doOnNext(revived -> {
                                if (revived) {
                                    log.info("Failed message {} re-queued as {}", failedId, item.id());
                                    if (online.get()) {
                                        launch(claimAndTransmit(item.id()), item.id());
                                    }
                                }
                            });
                })
                .defaultIfEmpty(false);
    }

    // ── Offline actions ──────────────────────────────────────────────────────

    private Mono<Void> claimAndExecute(String id) {
        return actions.claim(id)
                .filter(Boolean::booleanValue)
                .flatMap(claimed -> actions.findById(id))
                .flatMap(record -> decode(record)
                        .map(payload -> execute(record, payload))
                        .orElseGet(() -> onActionFailure(record,
                                TransmissionFailure.rejected("Unknown action type " + record.type()))));
    }

    private Optional<OfflineActionPayload> decode(OfflineActionRecord record) {
        Optional<ActionType> type = ActionType.fromTag(record.type());
        if (type.isEmpty()) {
            log.error("Offline action {} has unknown type {}", record.id(), record.type());
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(record.data(), type.get().payloadType()));
        } catch (JsonProcessingException e) {
            log.error("Offline action {} has an unreadable {} payload: {}", record.id(), record.type(),
                    e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private Mono<Void> execute(OfflineActionRecord record, OfflineActionPayload payload) {
        return Mono.defer(() -> transport.execute(payload))
                .map(outcome -> outcome.isDelivered()
                        ? Optional.<TransmissionFailure>empty()
                        : Optional.of(TransmissionFailure.ofStatus(outcome.statusCode())))
                .onErrorResume(e -> Mono.just(Optional.of(TransmissionFailure.ofError(e))))
                .defaultIfEmpty(Optional.of(new TransmissionFailure(FailureKind.RETRYABLE_NETWORK,
                        "Transport completed without a response")))
                .flatMap(failure -> failure.isPresent()
                        ? onActionFailure(record, failure.get())
                        : onActionDone(record));
    }

    private Mono<Void> onActionDone(OfflineActionRecord record) {
        retries.cancel(record.id());
        return actions.delete(record.id())
                .doOnNext(deleted -> log.debug("Executed {} action {}", record.type(), record.id()))
                .then();
    }

    private Mono<Void> onActionFailure(OfflineActionRecord record, TransmissionFailure failure) {
        int retryCount = record.retryCount() + 1;
        if (!failure.kind().isRetryable() || retryCount >= record.maxRetries()) {
            retries.cancel(record.id());
            log.error("Dropping {} action {} after {} attempts: {}", record.type(), record.id(), retryCount,
                    failure.reason());
            return actions.delete(record.id()).then();
        }
        Duration delay = retryPolicy.delayFor(retryCount);
        log.warn("{} action {} failed ({}), retrying in {} ms", record.type(), record.id(), failure.reason(),
                delay.toMillis());
        return actions.release(record.id(), retryCount)
                .then(Mono.fromRunnable(() -> retries.schedule(record.id(), delay,
                        () -> launch(retryAction(record.id()), record.id()))));
    }

    private Mono<Void> retryAction(String id) {
        if (!online.get()) {
            return Mono.empty();
        }
        return claimAndExecute(id);
    }

    // ── Queries and housekeeping ─────────────────────────────────────────────

    public Flux<QueueItem> getPendingMessages(String conversationId) {
        return queueItems.findByConversation(conversationId);
    }

    public Flux<FailedMessage> getFailedMessages() {
        return failedMessages.findAll();
    }

    public Mono<QueueStats> getQueueStats() {
        return Mono.zip(queueItems.countByStatus(QueueItemStatus.PENDING),
                        queueItems.countByStatus(QueueItemStatus.SENDING),
                        failedMessages.count(),
                        actions.count())
                .map(counts -> new QueueStats(counts.getT1(), counts.getT2(), counts.getT3(), counts.getT4()));
    }

    /** Cancels every retry timer and empties the queue, action, failed and status tables. */
    public Mono<Void> clearAllQueues() {
        return Mono.fromRunnable(retries::cancelAll)
                .then(queueItems.clear())
                .then(actions.clear())
                .then(failedMessages.clear())
                .then(monitor.clear())
                .doOnSuccess(v -> log.info("Cleared all local queues"));
    }

    int scheduledRetries() {
        return retries.size();
    }

    // ── Internals ────────────────────────────────────────────────────────────

    /** Announces a freshly queued message to the monitor. */
    private Mono<Void> announce(String conversationId, boolean sendNow) {
        return queueItems.countByConversation(conversationId)
                .flatMap(pending -> sendNow
                        ? monitor.setSyncing(conversationId, pending.intValue())
                        : monitor.markOffline(conversationId, pending.intValue()))
                .then();
    }

    private void launch(Mono<Void> work, String id) {
        work.onErrorResume(e -> {
                    log.error("Background delivery of {} failed: {}", id, e.getMessage(), e);
                    return Mono.empty();
                })
                .subscribe();
    }

    /** Strictly increasing creation times, so FIFO order never depends on clock resolution. */
    private Instant nextTimestamp() {
        long now = clock.millis();
        return Instant.ofEpochMilli(lastTimestamp.updateAndGet(last -> Math.max(now, last + 1)));
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }
}
