package com.vaultpost.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;

import com.vaultpost.config.TransportProperties;
import com.vaultpost.queue.QueueItem;

import reactor.core.publisher.Mono;

/**
 * {@link MessageTransport} over the remote message service's REST API.
 * Response bodies are discarded; only the status code matters to the engine.
 */
public class WebClientMessageTransport implements MessageTransport {

    private static final Logger log = LoggerFactory.getLogger(WebClientMessageTransport.class);

    private final WebClient webClient;
    private final TransportProperties properties;

    public WebClientMessageTransport(WebClient.Builder builder, TransportProperties properties) {
        this.properties = properties;
        WebClient.Builder configured = builder.clone().baseUrl(properties.getBaseUrl());
        if (properties.getAuthToken() != null && !properties.getAuthToken().isBlank()) {
            configured.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getAuthToken());
        }
        this.webClient = configured.build();
    }

    @Override
    public Mono<DeliveryOutcome> send(QueueItem item) {
        SendMessageRequest body = new SendMessageRequest(item.content(), item.contentType().wireName(), item.id(),
                item.attachments());
        return outcome(webClient.post()
                .uri("/api/conversations/{id}/messages", item.conversationId())
                .bodyValue(body), "send " + item.id());
    }

    @Override
    public Mono<DeliveryOutcome> execute(OfflineActionPayload action) {
        WebClient.RequestHeadersSpec<?> request;
        if (action instanceof OfflineActionPayload.MarkRead markRead) {
            request = webClient.put().uri("/api/conversations/{id}/read", markRead.conversationId());
        } else if (action instanceof OfflineActionPayload.DeleteMessage delete) {
            request = webClient.delete().uri("/api/messages/{id}", delete.messageId());
        } else if (action instanceof OfflineActionPayload.LeaveConversation leave) {
            request = webClient.post().uri("/api/conversations/{id}/leave", leave.conversationId());
        } else {
            return Mono.error(new IllegalArgumentException("Unsupported action " + action));
        }
        return outcome(request, action.type().tag());
    }

    private Mono<DeliveryOutcome> outcome(WebClient.RequestHeadersSpec<?> request, String label) {
        return request.exchangeToMono(response -> response.releaseBody()
                        .thenReturn(DeliveryOutcome.ofStatus(response.statusCode().value())))
                .timeout(properties.getRequestTimeout())
                .doOnNext(outcome -> log.debug("{} answered {}", label, outcome.statusCode()));
    }
}
