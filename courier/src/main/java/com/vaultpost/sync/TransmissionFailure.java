package com.vaultpost.sync;

/** Why one transmission attempt failed, in the form stored as a failure reason. */
record TransmissionFailure(FailureKind kind, String reason) {

    /** Fits {@code failed_messages.failure_reason} with room for a prefix. */
    static final int MAX_REASON_LENGTH = 512;

    TransmissionFailure {
        if (reason != null && reason.length() > MAX_REASON_LENGTH) {
            reason = reason.substring(0, MAX_REASON_LENGTH - 3) + "...";
        }
    }

    static TransmissionFailure ofStatus(int statusCode) {
        return new TransmissionFailure(FailureKind.ofStatus(statusCode), "Server responded with HTTP " + statusCode);
    }

    static TransmissionFailure ofError(Throwable error) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new TransmissionFailure(FailureKind.ofError(error), message);
    }

    static TransmissionFailure rejected(String reason) {
        return new TransmissionFailure(FailureKind.NON_RETRYABLE_CLIENT, reason);
    }
}
