package com.fintech.resolution.resilience;

import org.springframework.retry.RetryContext;
import org.springframework.retry.policy.SimpleRetryPolicy;

/**
 * Retries only failures {@link FailureClassifier} considers transient, up to
 * {@code maxAttempts} attempts in total.
 */
public class TransientFailureRetryPolicy extends SimpleRetryPolicy {

    public TransientFailureRetryPolicy(int maxAttempts) {
        super(maxAttempts);
    }

    @Override
    public boolean canRetry(RetryContext context) {
        Throwable last = context.getLastThrowable();
        boolean retryable = last == null || FailureClassifier.isTransient(last);
        return retryable && context.getRetryCount() < getMaxAttempts();
    }
}
