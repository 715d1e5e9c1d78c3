package com.vaultpost;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vaultpost.crypto.EncryptedEnvelope;
import com.vaultpost.keys.KeyManager;
import com.vaultpost.queue.ContentType;
import com.vaultpost.queue.QueueItem;
import com.vaultpost.status.SyncState;
import com.vaultpost.status.SyncStatusMonitor;
import com.vaultpost.sync.DeliveryOutcome;
import com.vaultpost.sync.MessageTransport;
import com.vaultpost.sync.SyncEngine;

import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

/**
 * End-to-end path of one encrypted message written while offline.
 *
 * Flow tested:
 *   Sender: export recipient key → RSA-OAEP + AES-GCM envelope → queue while offline
 *   Reconnect: sync pass transmits the stored envelope JSON unchanged
 *   Recipient: parse envelope → decrypt with own private key → original text
 */
@SpringBootTest
@ActiveProfiles("test")
class E2EDeliveryTest {

    @Autowired
    private KeyManager keyManager;

    @Autowired
    private SyncEngine syncEngine;

    @Autowired
    private SyncStatusMonitor monitor;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private MessageTransport transport;

    @BeforeEach
    void resetState() {
        syncEngine.setOnline(false).block();
        syncEngine.clearAllQueues().block();
        keyManager.clearAllKeys().block();
    }

    @AfterEach
    void goOffline() {
        syncEngine.setOnline(false).block();
    }

    @Test
    void offlineEncryptedMessageIsDeliveredAndReadable() throws Exception {
        when(transport.send(any())).thenReturn(Mono.just(DeliveryOutcome.delivered()));
        String bobKey = keyManager.exportPublicKey("bob").block();

        EncryptedEnvelope envelope = keyManager.encryptMessage("meet at noon", bobKey, "alice").block();
        syncEngine.queueEncryptedMessage("conv-ab", envelope, ContentType.TEXT).block();
        assertEquals(SyncState.OFFLINE, monitor.getStatus("conv-ab").block().status());
        verify(transport, never()).send(any());

        syncEngine.setOnline(true).block();

        ArgumentCaptor<QueueItem> sent = ArgumentCaptor.forClass(QueueItem.class);
        verify(transport).send(sent.capture());
        EncryptedEnvelope received = objectMapper.readValue(sent.getValue().content(), EncryptedEnvelope.class);
        assertEquals(envelope, received);
        StepVerifier.create(keyManager.decryptMessage(received, "bob"))
                .expectNext("meet at noon")
                .verifyComplete();
        assertEquals(SyncState.SYNCED, monitor.getStatus("conv-ab").block().status());
    }

    @Test
    void wrongRecipientCannotReadDeliveredMessage() {
        String bobKey = keyManager.exportPublicKey("bob").block();
        keyManager.generateKeyPair("mallory").block();

        EncryptedEnvelope envelope = keyManager.encryptMessage("for bob only", bobKey, "alice").block();

        StepVerifier.create(keyManager.verifyMessageIntegrity("for bob only", envelope, "mallory"))
                .expectNext(false)
                .verifyComplete();
    }
}
