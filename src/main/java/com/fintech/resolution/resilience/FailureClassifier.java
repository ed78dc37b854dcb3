package com.fintech.resolution.resilience;

import com.fintech.resolution.exception.ProviderApiException;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Splits outbound call failures into transient (worth retrying, counts against
 * the circuit breaker) and permanent.
 */
public final class FailureClassifier {

    private FailureClassifier() {
    }

    /**
     * Timeouts, I/O errors and provider errors flagged retryable (throttling,
     * 5xx-like) are transient. Everything else is permanent, including our own
     * rate-limit and circuit rejections.
     */
    public static boolean isTransient(Throwable failure) {
        if (failure instanceof ProviderApiException) {
            return ((ProviderApiException) failure).isRetryable();
        }
        return failure instanceof TimeoutException || failure instanceof IOException;
    }
}
