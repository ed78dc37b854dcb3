package com.fintech.resolution.exception;

/**
 * Thrown when communication with an external provider fails.
 * This could be due to network issues, timeouts, throttling or provider downtime
 * (retryable), or a request the provider rejected outright (not retryable).
 */
public class ProviderApiException extends ResolutionException {

    private final String providerName;
    private final boolean isRetryable;

    public ProviderApiException(String message, String providerName) {
        this(message, providerName, true);
    }

    public ProviderApiException(String message, String providerName, boolean isRetryable) {
        super(ErrorKind.PROVIDER_ERROR, message);
        this.providerName = providerName;
        this.isRetryable = isRetryable;
    }

    public ProviderApiException(String message, String providerName, boolean isRetryable, Throwable cause) {
        super(ErrorKind.PROVIDER_ERROR, message, cause);
        this.providerName = providerName;
        this.isRetryable = isRetryable;
    }

    public String getProviderName() {
        return providerName;
    }

    /**
     * Indicates if this error is transient and the operation can be retried.
     * Non-retryable errors include: malformed requests, authentication failures.
     */
    public boolean isRetryable() {
        return isRetryable;
    }
}
