package com.fintech.resolution.resilience;

import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.BackOffPolicy;
import org.springframework.retry.backoff.Sleeper;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Waits {@code baseDelay * 2^(n-1) + jitter} before retry {@code n}, with jitter
 * drawn uniformly from {@code [0, maxJitter]}.
 */
public class JitteredExponentialBackOffPolicy implements BackOffPolicy {

    /** Caps the exponent so a misconfigured attempt count cannot overflow. */
    private static final int MAX_EXPONENT = 20;

    private final long baseDelayMillis;
    private final long maxJitterMillis;
    private final Sleeper sleeper;

    public JitteredExponentialBackOffPolicy(Duration baseDelay, Duration maxJitter, Sleeper sleeper) {
        if (baseDelay.isNegative() || maxJitter.isNegative()) {
            throw new IllegalArgumentException("Backoff delays must not be negative");
        }
        this.baseDelayMillis = baseDelay.toMillis();
        this.maxJitterMillis = maxJitter.toMillis();
        this.sleeper = sleeper;
    }

    @Override
    public BackOffContext start(RetryContext context) {
        return new AttemptCounter();
    }

    @Override
    public void backOff(BackOffContext backOffContext) throws BackOffInterruptedException {
        AttemptCounter counter = (AttemptCounter) backOffContext;
        counter.retries++;
        long delay = delayBeforeRetry(counter.retries);
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackOffInterruptedException("Thread interrupted while sleeping", e);
        }
    }

    /**
     * @param retry 1 for the wait after the first failed attempt
     */
    public long delayBeforeRetry(int retry) {
        long exponential = baseDelayMillis << Math.min(Math.max(retry - 1, 0), MAX_EXPONENT);
        long jitter = maxJitterMillis == 0 ? 0 : ThreadLocalRandom.current().nextLong(maxJitterMillis + 1);
        return exponential + jitter;
    }

    private static final class AttemptCounter implements BackOffContext {
        private int retries;
    }
}
