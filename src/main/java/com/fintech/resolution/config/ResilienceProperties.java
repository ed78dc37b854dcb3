package com.fintech.resolution.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Rate limit, circuit breaker and retry policy applied to every outbound provider call.
 * Each provider gets its own bucket and breaker built from these values.
 */
@ConfigurationProperties(prefix = "resolution.resilience")
@NoArgsConstructor
@Getter
@Setter
public class ResilienceProperties {

    private RateLimit rateLimit = new RateLimit();
    private CircuitBreaker circuitBreaker = new CircuitBreaker();
    private Retry retry = new Retry();

    @NoArgsConstructor
    @Getter
    @Setter
    public static class RateLimit {
        /** Bucket size, also the number of tokens refilled per refill period. Default 60. */
        private int capacity = 60;

        /** Time to refill an empty bucket completely. Default 60s. */
        private Duration refillPeriod = Duration.ofSeconds(60);

        /** Longest a caller may be suspended waiting for a token. Default 5s. */
        private Duration maxWait = Duration.ofSeconds(5);
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class CircuitBreaker {
        /** Consecutive transient failures that open the circuit. Default 5. */
        private int failureThreshold = 5;

        /** Time the circuit stays open before one trial call is let through. Default 60s. */
        private Duration openDuration = Duration.ofSeconds(60);
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Retry {
        /** Total attempts including the first call. Default 3. */
        private int maxAttempts = 3;

        /** Delay before the first retry; doubles each attempt. Default 1s. */
        private Duration baseDelay = Duration.ofSeconds(1);

        /** Upper bound of the random delay added to each backoff. Default 250ms. */
        private Duration maxJitter = Duration.ofMillis(250);
    }
}
