package com.vaultpost.sync;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;

import com.vaultpost.config.TransportProperties;
import com.vaultpost.queue.ContentType;
import com.vaultpost.queue.QueueItem;
import com.vaultpost.queue.QueueItemStatus;

import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

/**
 * Request shapes and outcome mapping of the WebClient transport, with a stub exchange function
 * standing in for the network.
 */
class WebClientMessageTransportTest {

    private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();

    private WebClientMessageTransport transport(HttpStatus answer, String token) {
        ExchangeFunction exchange = request -> {
            requests.add(request);
            return Mono.just(ClientResponse.create(answer).build());
        };
        return transport(exchange, token, Duration.ofSeconds(5));
    }

    private static WebClientMessageTransport transport(ExchangeFunction exchange, String token, Duration timeout) {
        TransportProperties properties = new TransportProperties();
        properties.setBaseUrl("http://messages.test");
        properties.setAuthToken(token);
        properties.setRequestTimeout(timeout);
        return new WebClientMessageTransport(WebClient.builder().exchangeFunction(exchange), properties);
    }

    private static QueueItem item() {
        return new QueueItem("q-1", "conv-1", "hello", ContentType.TEXT, List.of(), Instant.EPOCH, 0,
                QueueItemStatus.SENDING);
    }

    // ── Messages ─────────────────────────────────────────────────────────────

    @Test
    void sendPostsToConversationWithBearerToken() {
        StepVerifier.create(transport(HttpStatus.CREATED, "secret").send(item()))
                .assertNext(outcome -> assertTrue(outcome.isDelivered()))
                .verifyComplete();

        ClientRequest request = requests.get(0);
        assertEquals(HttpMethod.POST, request.method());
        assertEquals("/api/conversations/conv-1/messages", request.url().getPath());
        assertEquals("Bearer secret", request.headers().getFirst(HttpHeaders.AUTHORIZATION));
    }

    @Test
    void blankTokenSendsNoAuthorization() {
        transport(HttpStatus.OK, " ").send(item()).block();

        assertNull(requests.get(0).headers().getFirst(HttpHeaders.AUTHORIZATION));
    }

    @Test
    void errorStatusIsAnOutcomeNotAnError() {
        StepVerifier.create(transport(HttpStatus.SERVICE_UNAVAILABLE, null).send(item()))
                .assertNext(outcome -> {
                    assertFalse(outcome.isDelivered());
                    assertEquals(503, outcome.statusCode());
                })
                .verifyComplete();
    }

    @Test
    void slowServerTimesOut() {
        WebClientMessageTransport slow = transport(request -> Mono.never(), null, Duration.ofMillis(50));

        StepVerifier.create(slow.send(item()))
                .expectError(TimeoutException.class)
                .verify(Duration.ofSeconds(5));
    }

    // ── Actions ──────────────────────────────────────────────────────────────

    @Test
    void actionsMapToTheirEndpoints() {
        WebClientMessageTransport transport = transport(HttpStatus.NO_CONTENT, null);

        transport.execute(new OfflineActionPayload.MarkRead("conv-1")).block();
        transport.execute(new OfflineActionPayload.DeleteMessage("m-9")).block();
        transport.execute(new OfflineActionPayload.LeaveConversation("conv-2")).block();

        assertEquals(HttpMethod.PUT, requests.get(0).method());
        assertEquals("/api/conversations/conv-1/read", requests.get(0).url().getPath());
        assertEquals(HttpMethod.DELETE, requests.get(1).method());
        assertEquals("/api/messages/m-9", requests.get(1).url().getPath());
        assertEquals(HttpMethod.POST, requests.get(2).method());
        assertEquals("/api/conversations/conv-2/leave", requests.get(2).url().getPath());
    }
}
