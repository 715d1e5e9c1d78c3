package com.vaultpost.status;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import com.vaultpost.config.StatusProperties;
import com.vaultpost.store.SyncStatusStore;

import jakarta.annotation.PreDestroy;
import reactor.core.Disposable;
import reactor.core.publisher.BufferOverflowStrategy;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

/**
 * Per-conversation sync state, persisted in {@code sync_status} and published to subscribers.
 *
 * <p>Every transition stores the new snapshot and then emits it on {@link #updates()}.
 * Subscribers each get a bounded buffer; a subscriber that falls behind loses its
 * oldest snapshots, never blocks the monitor.
 *
 * <p>A health check runs every {@code vaultpost.status.health-check-interval} and moves
 * conversations that have been {@code syncing} for longer than the stall timeout to
 * {@code error}.
 */
@Service
public class SyncStatusMonitor {

    private static final Logger log = LoggerFactory.getLogger(SyncStatusMonitor.class);

    static final String STALLED_MESSAGE = "Sync stalled (timeout)";

    /** Width of {@code sync_status.error_message}. */
    static final int MAX_ERROR_LENGTH = 1024;

    private static final Duration TIME_PER_PENDING_MESSAGE = Duration.ofSeconds(1);

    private final SyncStatusStore store;
    private final StatusProperties properties;
    private final Clock clock;
    private final Scheduler scheduler;

    private final Sinks.Many<SyncStatus> sink = Sinks.many().multicast().directBestEffort();

    private volatile Disposable healthCheck;

    public SyncStatusMonitor(SyncStatusStore store, StatusProperties properties, Clock clock, Scheduler scheduler) {
        this.store = store;
        this.properties = properties;
        this.clock = clock;
        this.scheduler = scheduler;
    }

    // ── Lifecycle ────────────────────────────────────────────────────────────

    @EventListener(ApplicationReadyEvent.class)
    public synchronized void init() {
        if (healthCheck != null && !healthCheck.isDisposed()) {
            return;
        }
        Duration interval = properties.getHealthCheckInterval();
        healthCheck = Flux.interval(interval, interval, scheduler)
                .onBackpressureDrop()
                .concatMap(tick -> runHealthCheck())
                .onErrorContinue((err, o) -> log.warn("Sync health check failed: {}", err.getMessage(), err))
                .subscribe();
        log.info("Sync status monitor started, health check every {}", interval);
    }

    @PreDestroy
    public synchronized void shutdown() {
        if (healthCheck != null && !healthCheck.isDisposed()) {
            healthCheck.dispose();
        }
        sink.tryEmitComplete();
    }

    // ── Transitions ──────────────────────────────────────────────────────────

    /** Enters {@code syncing} with the given backlog; clears any previous error. */
    public Mono<SyncStatus> setSyncing(String conversationId, int pendingMessages) {
        return transition(conversationId, current -> new SyncStatus(conversationId, SyncState.SYNCING,
                0, Math.max(pendingMessages, 0), clock.instant(), null, current.retryCount()));
    }

    public Mono<SyncStatus> updateProgress(String conversationId, int progress) {
        int clamped = Math.max(0, Math.min(100, progress));
        return transition(conversationId, current -> new SyncStatus(conversationId, current.status(),
                clamped, current.pendingMessages(), clock.instant(), current.errorMessage(), current.retryCount()));
    }

    public Mono<SyncStatus> markSynced(String conversationId) {
        return transition(conversationId, current -> new SyncStatus(conversationId, SyncState.SYNCED,
                100, 0, clock.instant(), null, 0));
    }

    public Mono<SyncStatus> markError(String conversationId, String errorMessage) {
        String stored = errorMessage != null && errorMessage.length() > MAX_ERROR_LENGTH
                ? errorMessage.substring(0, MAX_ERROR_LENGTH)
                : errorMessage;
        return transition(conversationId, current -> new SyncStatus(conversationId, SyncState.ERROR,
                current.progress(), current.pendingMessages(), clock.instant(), stored,
                current.retryCount() + 1));
    }

    public Mono<SyncStatus> markOffline(String conversationId) {
        return transition(conversationId, current -> new SyncStatus(conversationId, SyncState.OFFLINE,
                current.progress(), current.pendingMessages(), clock.instant(), current.errorMessage(),
                current.retryCount()));
    }

    /** Goes offline and records the conversation's current backlog. */
    public Mono<SyncStatus> markOffline(String conversationId, int pendingMessages) {
        return transition(conversationId, current -> new SyncStatus(conversationId, SyncState.OFFLINE,
                current.progress(), Math.max(pendingMessages, 0), clock.instant(), current.errorMessage(),
                current.retryCount()));
    }

    // ── Queries ──────────────────────────────────────────────────────────────

    public Mono<SyncStatus> getStatus(String conversationId) {
        return store.find(conversationId);
    }

    public Flux<SyncStatus> getAllStatuses() {
        return store.findAll();
    }

    public Mono<QueueHealth> getQueueHealth() {
        return store.findAll().collectList().map(SyncStatusMonitor::aggregate);
    }

    // ── Recovery ─────────────────────────────────────────────────────────────

    /**
     * Re-arms errored conversations that have not used up their retries by moving them
     * back to {@code syncing}. Nothing is transmitted here; the caller runs the sync.
     *
     * @return ids of the re-armed conversations
     */
    public Mono<List<String>> retryFailedSyncs() {
        return store.findByState(SyncState.ERROR)
                .filter(status -> status.retryCount() < properties.getMaxSyncRetries())
                .concatMap(status -> setSyncing(status.conversationId(), status.pendingMessages()))
                .map(SyncStatus::conversationId)
                .collectList()
                .doOnNext(ids -> {
                    if (!ids.isEmpty()) {
                        log.info("Re-armed {} errored conversations", ids.size());
                    }
                });
    }

    /**
     * One pass of the stall detector.
     *
     * @return number of conversations moved to {@code error}
     */
    public Mono<Long> runHealthCheck() {
        Instant cutoff = clock.instant().minus(properties.getStallTimeout());
        return store.findByState(SyncState.SYNCING)
                .filter(status -> status.lastSyncTime().isBefore(cutoff))
                .concatMap(status -> {
                    log.warn("Conversation {} stalled while syncing since {}", status.conversationId(),
                            status.lastSyncTime());
                    return markError(status.conversationId(), STALLED_MESSAGE);
                })
                .count();
    }

    public Mono<Void> clear() {
        return store.clear();
    }

    // ── Publish / subscribe ──────────────────────────────────────────────────

    /** Live status snapshots; only transitions after subscription are delivered. */
    public Flux<SyncStatus> updates() {
        return sink.asFlux().onBackpressureBuffer(properties.getEventBufferSize(),
                dropped -> log.debug("Dropped status snapshot for {}", dropped.conversationId()),
                BufferOverflowStrategy.DROP_OLDEST);
    }

    /** Registers a listener; dispose the returned handle to unsubscribe. */
    public Disposable subscribe(Consumer<SyncStatus> listener) {
        Objects.requireNonNull(listener, "listener");
        return updates().subscribe(listener,
                e -> log.warn("Status listener terminated: {}", e.getMessage()));
    }

    // ── Internals ────────────────────────────────────────────────────────────

    private Mono<SyncStatus> transition(String conversationId, UnaryOperator<SyncStatus> change) {
        return store.update(conversationId, () -> SyncStatus.initial(conversationId, clock.instant()), change)
                .doOnNext(this::publish);
    }

    private void publish(SyncStatus status) {
        log.debug("Conversation {} is {} ({} pending)", status.conversationId(), status.status().wireName(),
                status.pendingMessages());
        sink.emitNext(status, Sinks.EmitFailureHandler.busyLooping(Duration.ofMillis(100)));
    }

    static QueueHealth aggregate(List<SyncStatus> statuses) {
        long totalPending = statuses.stream().mapToLong(SyncStatus::pendingMessages).sum();
        long failed = statuses.stream().filter(s -> s.status() == SyncState.ERROR).count();
        long inProgress = statuses.stream().filter(s -> s.status() == SyncState.SYNCING).count();
        Instant oldestPending = statuses.stream()
                .filter(s -> s.pendingMessages() > 0)
                .map(SyncStatus::lastSyncTime)
                .min(Comparator.naturalOrder())
                .orElse(null);
        return new QueueHealth(totalPending, failed, inProgress, oldestPending,
                TIME_PER_PENDING_MESSAGE.multipliedBy(totalPending));
    }
}
