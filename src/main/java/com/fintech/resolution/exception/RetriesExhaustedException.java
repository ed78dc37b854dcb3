package com.fintech.resolution.exception;

/**
 * Thrown when a transient provider failure survived every attempt.
 * The cause is the failure of the last attempt.
 */
public class RetriesExhaustedException extends ResolutionException {

    private final String providerId;
    private final int attempts;

    public RetriesExhaustedException(String providerId, int attempts, Throwable lastFailure) {
        super(ErrorKind.RETRIES_EXHAUSTED, String.format(
                "Provider %s still failing after %d attempts: %s",
                providerId, attempts, lastFailure.getMessage()), lastFailure);
        this.providerId = providerId;
        this.attempts = attempts;
    }

    public String getProviderId() {
        return providerId;
    }

    public int getAttempts() {
        return attempts;
    }
}
