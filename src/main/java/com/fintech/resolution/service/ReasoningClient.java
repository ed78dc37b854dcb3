package com.fintech.resolution.service;

import com.fintech.resolution.exception.ProviderApiException;

/**
 * Outbound seam to the language model that turns a user's message into a
 * structured query and phrases the replies.
 * <p>
 * Implementations make a single attempt per call; rate limiting, circuit
 * breaking and retries are applied by the caller.
 */
public interface ReasoningClient {

    /**
     * @throws ProviderApiException  if the provider failed; {@link ProviderApiException#isRetryable()}
     *                               tells a transient failure from a rejected request
     * @throws InterruptedException if the calling thread was interrupted while waiting for the provider
     */
    String complete(String prompt) throws InterruptedException;

    /**
     * Provider id used for the circuit breaker, rate limiter, logs and metrics.
     */
    String getProviderName();
}
