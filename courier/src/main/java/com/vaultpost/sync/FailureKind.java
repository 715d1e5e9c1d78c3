package com.vaultpost.sync;

import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Classification of a failed transmission. Every 4xx except 429 is definitive;
 * anything else is worth another attempt.
 */
public enum FailureKind {
    RETRYABLE_NETWORK,
    RETRYABLE_SERVER,
    NON_RETRYABLE_CLIENT;

    public boolean isRetryable() {
        return this != NON_RETRYABLE_CLIENT;
    }

    public static FailureKind ofStatus(int statusCode) {
        if (statusCode >= 400 && statusCode < 500 && statusCode != 429) {
            return NON_RETRYABLE_CLIENT;
        }
        return RETRYABLE_SERVER;
    }

    public static FailureKind ofError(Throwable error) {
        if (error instanceof WebClientResponseException response) {
            return ofStatus(response.getStatusCode().value());
        }
        return RETRYABLE_NETWORK;
    }
}
