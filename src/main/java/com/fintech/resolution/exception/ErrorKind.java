package com.fintech.resolution.exception;

/**
 * Failure categories surfaced to callers.
 * <p>
 * Matching failures (bad input, stale references) and provider failures
 * (busy, down, flaky) are kept apart so the conversation layer can pick a
 * different message for each.
 */
public enum ErrorKind {
    /**
     * No identifying field populated, or a malformed amount/date.
     */
    INVALID_QUERY,

    /**
     * No candidate cleared the acceptance threshold. Returned as an outcome, not thrown.
     */
    EMPTY_RESULT,

    /**
     * A selection referenced a pending disambiguation that expired or never existed.
     */
    STALE_REFERENCE,

    /**
     * The provider's token bucket could not admit the call within the allowed wait.
     */
    RATE_LIMITED,

    /**
     * The provider's circuit is open; the call was not attempted.
     */
    CIRCUIT_OPEN,

    /**
     * A transient provider failure persisted through every retry attempt.
     */
    RETRIES_EXHAUSTED,

    /**
     * A permanent provider failure (rejected request).
     */
    PROVIDER_ERROR,

    NOT_FOUND,

    DISPUTE_ALREADY_OPEN,

    /**
     * The calling thread was interrupted while waiting on or running an outbound call.
     */
    CANCELLED
}
