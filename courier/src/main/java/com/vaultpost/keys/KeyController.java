package com.vaultpost.keys;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import com.vaultpost.crypto.PublicKeyImportException;

import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/keys")
public class KeyController {

    private final KeyManager keyManager;

    public KeyController(KeyManager keyManager) {
        this.keyManager = keyManager;
    }

    /**
     * Public key lookup. A stored peer key wins; otherwise the key of a local key pair.
     * Never generates keys and never returns private material.
     */
    @GetMapping("/{userId}/public-key")
    public Mono<PublicKeyResponse> getPublicKey(@PathVariable String userId) {
        return keyManager.getStoredPublicKey(userId)
                .switchIfEmpty(Mono.defer(() -> keyManager.findKeyPair(userId)
                        .flatMap(pair -> keyManager.exportPublicKey(userId))))
                .map(key -> new PublicKeyResponse(userId, key))
                .switchIfEmpty(Mono.error(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "No public key for " + userId)));
    }

    /** Stores a peer's public key after validating it. */
    @PutMapping("/{userId}/public-key")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> putPublicKey(@PathVariable String userId, @RequestBody PublicKeyResponse body) {
        return keyManager.storePublicKey(userId, body.publicKey())
                .onErrorMap(PublicKeyImportException.class,
                        e -> new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e));
    }
}
