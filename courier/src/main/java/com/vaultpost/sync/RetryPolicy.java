package com.vaultpost.sync;

import java.time.Duration;

import com.vaultpost.config.SyncProperties;

/**
 * Exponential backoff: attempt {@code n} waits {@code min(base * 2^n, max)}.
 */
public record RetryPolicy(int maxRetries, Duration baseDelay, Duration maxDelay) {

    public static RetryPolicy from(SyncProperties properties) {
        return new RetryPolicy(properties.getMaxRetries(), properties.getBaseDelay(), properties.getMaxDelay());
    }

    public Duration delayFor(int retryCount) {
        // past 2^30 the product is above any sane max delay anyway
        int exponent = Math.min(Math.max(retryCount, 0), 30);
        long millis = baseDelay.toMillis() * (1L << exponent);
        if (millis < 0 || millis > maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis(millis);
    }

    public boolean isExhausted(int retryCount) {
        return retryCount >= maxRetries;
    }
}
