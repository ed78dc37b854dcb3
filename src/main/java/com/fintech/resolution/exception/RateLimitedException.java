package com.fintech.resolution.exception;

import java.time.Duration;

/**
 * Thrown when admission to a provider would require waiting longer than allowed.
 */
public class RateLimitedException extends ResolutionException {

    private final String providerId;
    private final Duration requiredWait;

    public RateLimitedException(String providerId, Duration requiredWait) {
        super(ErrorKind.RATE_LIMITED, String.format(
                "Rate limit reached for provider %s; next slot in %d ms", providerId, requiredWait.toMillis()));
        this.providerId = providerId;
        this.requiredWait = requiredWait;
    }

    public String getProviderId() {
        return providerId;
    }

    public Duration getRequiredWait() {
        return requiredWait;
    }
}
