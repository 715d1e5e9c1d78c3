package com.vaultpost.sync;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import com.vaultpost.queue.FailedMessage;
import com.vaultpost.queue.QueueStats;
import com.vaultpost.status.QueueHealth;
import com.vaultpost.status.SyncStatus;
import com.vaultpost.status.SyncStatusMonitor;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Local surface for the UI: queue statistics, sync health and a live status stream.
 */
@RestController
@RequestMapping("/api/sync")
public class SyncController {

    private final SyncEngine syncEngine;
    private final SyncStatusMonitor monitor;

    public SyncController(SyncEngine syncEngine, SyncStatusMonitor monitor) {
        this.syncEngine = syncEngine;
        this.monitor = monitor;
    }

    @GetMapping("/stats")
    public Mono<QueueStats> getStats() {
        return syncEngine.getQueueStats();
    }

    @GetMapping("/health")
    public Mono<QueueHealth> getHealth() {
        return monitor.getQueueHealth();
    }

    @GetMapping("/network")
    public NetworkStatus getNetworkStatus() {
        return syncEngine.getNetworkStatus();
    }

    /** Connectivity report from the device; going online starts a sync pass. */
    @PutMapping("/network")
    public Mono<NetworkStatus> setNetworkStatus(@RequestBody ConnectivityUpdate update) {
        return syncEngine.setOnline(update.online())
                .then(Mono.fromSupplier(syncEngine::getNetworkStatus));
    }

    @GetMapping("/status/{conversationId}")
    public Mono<SyncStatus> getStatus(@PathVariable String conversationId) {
        return monitor.getStatus(conversationId)
                .switchIfEmpty(Mono.error(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "No sync status for " + conversationId)));
    }

    /** Server-sent stream of status snapshots, one per transition. */
    @GetMapping(value = "/status", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<SyncStatus> streamStatus() {
        return monitor.updates();
    }

    @GetMapping("/failed")
    public Flux<FailedMessage> getFailedMessages() {
        return syncEngine.getFailedMessages();
    }

    @PostMapping("/failed/{id}/retry")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Mono<Void> retryFailedMessage(@PathVariable String id) {
        return syncEngine.retryFailedMessage(id)
                .flatMap(found -> found
                        ? Mono.<Void>empty()
                        : Mono.error(new ResponseStatusException(HttpStatus.NOT_FOUND, "No failed message " + id)));
    }

    @PostMapping("/force")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Mono<Void> forceSync() {
        return syncEngine.forceSync();
    }
}
