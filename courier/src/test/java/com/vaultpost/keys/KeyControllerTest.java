package com.vaultpost.keys;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.reactive.server.WebTestClient;

import com.vaultpost.sync.MessageTransport;

/**
 * HTTP-layer tests for KeyController.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class KeyControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @Autowired
    private KeyManager keyManager;

    @MockitoBean
    private MessageTransport transport;

    @BeforeEach
    void resetKeys() {
        keyManager.clearAllKeys().block();
    }

    // ── GET /api/keys/{userId}/public-key ────────────────────────────────────

    @Test
    void getPublicKey_unknownUser_shouldReturn404() {
        webTestClient.get()
                .uri("/api/keys/{userId}/public-key", "nobody")
                .exchange()
                .expectStatus().isNotFound();

        assertNull(keyManager.findKeyPair("nobody").block(), "Lookup must not generate a key pair");
    }

    @Test
    void getPublicKey_localUser_shouldReturnOwnKey() {
        String exported = keyManager.exportPublicKey("alice").block();

        webTestClient.get()
                .uri("/api/keys/{userId}/public-key", "alice")
                .exchange()
                .expectStatus().isOk()
                .expectBody(PublicKeyResponse.class)
                .value(body -> {
                    assertEquals("alice", body.userId());
                    assertEquals(exported, body.publicKey());
                });
    }

    // ── PUT /api/keys/{userId}/public-key ────────────────────────────────────

    @Test
    void putPublicKey_shouldStorePeerKey() {
        String bobKey = keyManager.exportPublicKey("bob").block();
        keyManager.clearAllKeys().block();

        webTestClient.put()
                .uri("/api/keys/{userId}/public-key", "bob")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new PublicKeyResponse("bob", bobKey))
                .exchange()
                .expectStatus().isNoContent();

        assertEquals(bobKey, keyManager.getStoredPublicKey("bob").block());
        webTestClient.get()
                .uri("/api/keys/{userId}/public-key", "bob")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.publicKey").isEqualTo(bobKey);
    }

    @Test
    void putPublicKey_garbage_shouldReturn400() {
        webTestClient.put()
                .uri("/api/keys/{userId}/public-key", "eve")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("userId", "eve", "publicKey", "not-a-key"))
                .exchange()
                .expectStatus().isBadRequest();
    }
}
