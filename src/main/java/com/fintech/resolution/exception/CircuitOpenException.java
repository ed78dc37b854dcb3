package com.fintech.resolution.exception;

/**
 * Thrown instead of calling a provider whose circuit is open, or whose
 * half-open trial slot is already taken.
 */
public class CircuitOpenException extends ResolutionException {

    private final String providerId;

    public CircuitOpenException(String providerId) {
        super(ErrorKind.CIRCUIT_OPEN,
                "Provider " + providerId + " is temporarily unavailable (circuit open)");
        this.providerId = providerId;
    }

    public String getProviderId() {
        return providerId;
    }
}
