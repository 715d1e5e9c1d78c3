package com.vaultpost.sync;

/**
 * HTTP-level result of one transmission. Network failures are not outcomes; they
 * arrive as errors on the transport's {@code Mono}.
 */
public record DeliveryOutcome(int statusCode) {

    public static DeliveryOutcome ofStatus(int statusCode) {
        return new DeliveryOutcome(statusCode);
    }

    public static DeliveryOutcome delivered() {
        return new DeliveryOutcome(200);
    }

    public boolean isDelivered() {
        return statusCode >= 200 && statusCode < 300;
    }
}
