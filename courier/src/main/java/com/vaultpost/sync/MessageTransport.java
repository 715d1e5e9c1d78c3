package com.vaultpost.sync;

import com.vaultpost.queue.QueueItem;

import reactor.core.publisher.Mono;

/**
 * Remote side of the queue. An error signal means the request never got an HTTP
 * answer; every answered request is an outcome, successful or not.
 */
public interface MessageTransport {

    Mono<DeliveryOutcome> send(QueueItem item);

    Mono<DeliveryOutcome> execute(OfflineActionPayload action);
}
