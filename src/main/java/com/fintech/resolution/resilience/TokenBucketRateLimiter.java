package com.fintech.resolution.resilience;

import com.fintech.resolution.exception.CallCancelledException;
import com.fintech.resolution.exception.RateLimitedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.backoff.Sleeper;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Token bucket with continuous refill, one per provider.
 * <p>
 * The bucket starts full. Refill and take happen in one synchronized block of
 * constant-time arithmetic; a caller that has to wait sleeps outside the lock
 * for exactly the time until the next token and then checks again. Callers
 * whose accumulated wait would exceed {@code maxWait} fail with
 * {@link RateLimitedException} instead.
 */
@Slf4j
public class TokenBucketRateLimiter {

    private static final long NANOS_PER_MILLI = 1_000_000L;

    private final String providerId;
    private final int capacity;
    private final double tokensPerNano;
    private final Duration maxWait;
    private final Clock clock;
    private final Sleeper sleeper;

    private double tokens;
    private Instant lastRefill;

    public TokenBucketRateLimiter(String providerId, int capacity, Duration refillPeriod, Duration maxWait,
                                  Clock clock, Sleeper sleeper) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        if (refillPeriod.isZero() || refillPeriod.isNegative()) {
            throw new IllegalArgumentException("refillPeriod must be positive");
        }
        if (maxWait.isNegative()) {
            throw new IllegalArgumentException("maxWait must not be negative");
        }
        this.providerId = providerId;
        this.capacity = capacity;
        this.tokensPerNano = (double) capacity / refillPeriod.toNanos();
        this.maxWait = maxWait;
        this.clock = clock;
        this.sleeper = sleeper;
        this.tokens = capacity;
        this.lastRefill = clock.instant();
    }

    /**
     * Takes one token, waiting for refill if necessary.
     *
     * @throws RateLimitedException   if the token would not be available within {@code maxWait}
     * @throws CallCancelledException if the thread is interrupted while waiting
     */
    public void acquire() {
        long waitedNanos = 0;
        while (true) {
            long waitNanos = tryTake();
            if (waitNanos == 0) {
                return;
            }
            if (waitedNanos + waitNanos > maxWait.toNanos()) {
                log.warn("Rate limit reached for provider {}: next token in {} ms", providerId,
                        waitNanos / NANOS_PER_MILLI);
                throw new RateLimitedException(providerId, Duration.ofNanos(waitNanos));
            }
            long sleepMillis = (waitNanos + NANOS_PER_MILLI - 1) / NANOS_PER_MILLI;
            log.debug("Provider {} bucket empty, waiting {} ms", providerId, sleepMillis);
            try {
                sleeper.sleep(sleepMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CallCancelledException(providerId, e);
            }
            waitedNanos += sleepMillis * NANOS_PER_MILLI;
        }
    }

    public synchronized double availableTokens() {
        refill();
        return tokens;
    }

    public int getCapacity() {
        return capacity;
    }

    public String getProviderId() {
        return providerId;
    }

    /**
     * @return 0 if a token was taken, otherwise nanos until one will be available
     */
    private synchronized long tryTake() {
        refill();
        if (tokens >= 1.0) {
            tokens -= 1.0;
            return 0;
        }
        return Math.max(1L, (long) Math.ceil((1.0 - tokens) / tokensPerNano));
    }

    private void refill() {
        Instant now = clock.instant();
        long elapsedNanos = Duration.between(lastRefill, now).toNanos();
        if (elapsedNanos > 0) {
            tokens = Math.min(capacity, tokens + elapsedNanos * tokensPerNano);
            lastRefill = now;
        }
    }
}
