package com.fintech.resolution.resilience;

import com.fintech.resolution.config.ResilienceProperties;
import com.fintech.resolution.dto.ProviderHealth;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-wide per-provider resilience state: one token bucket and one circuit
 * breaker per provider id, created on first use and shared by all requests.
 */
@Slf4j
@Component
public class ProviderResilienceRegistry {

    private final ConcurrentMap<String, TokenBucketRateLimiter> rateLimiters = new ConcurrentHashMap<>();

    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final ResilienceProperties properties;
    private final Clock clock;
    private final Sleeper sleeper;
    private final RetryTemplate retryTemplate;

    public ProviderResilienceRegistry(CircuitBreakerRegistry circuitBreakerRegistry,
                                      ResilienceProperties properties,
                                      Clock clock,
                                      Sleeper sleeper) {
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.properties = properties;
        this.clock = clock;
        this.sleeper = sleeper;
        this.retryTemplate = buildRetryTemplate(properties.getRetry(), sleeper);
    }

    public TokenBucketRateLimiter rateLimiter(String providerId) {
        return rateLimiters.computeIfAbsent(providerId, id -> {
            ResilienceProperties.RateLimit limit = properties.getRateLimit();
            log.info("Creating rate limiter for provider {}: {} calls per {}", id,
                    limit.getCapacity(), limit.getRefillPeriod());
            return new TokenBucketRateLimiter(id, limit.getCapacity(), limit.getRefillPeriod(),
                    limit.getMaxWait(), clock, sleeper);
        });
    }

    public CircuitBreaker circuitBreaker(String providerId) {
        return circuitBreakerRegistry.circuitBreaker(providerId);
    }

    /**
     * Shared by all providers; retry state lives in the per-call context, not in the template.
     */
    public RetryTemplate retryTemplate() {
        return retryTemplate;
    }

    public int maxAttempts() {
        return properties.getRetry().getMaxAttempts();
    }

    public List<ProviderHealth> health() {
        List<ProviderHealth> health = new ArrayList<>();
        for (CircuitBreaker breaker : circuitBreakerRegistry.getAllCircuitBreakers()) {
            TokenBucketRateLimiter limiter = rateLimiter(breaker.getName());
            CircuitBreaker.Metrics metrics = breaker.getMetrics();
            health.add(ProviderHealth.builder()
                    .providerId(breaker.getName())
                    .circuitState(breaker.getState().name())
                    .bufferedCalls(metrics.getNumberOfBufferedCalls())
                    .failedCalls(metrics.getNumberOfFailedCalls())
                    .availableTokens(limiter.availableTokens())
                    .capacity(limiter.getCapacity())
                    .build());
        }
        return health;
    }

    static RetryTemplate buildRetryTemplate(ResilienceProperties.Retry retry, Sleeper sleeper) {
        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(new TransientFailureRetryPolicy(retry.getMaxAttempts()));
        template.setBackOffPolicy(new JitteredExponentialBackOffPolicy(
                retry.getBaseDelay(), retry.getMaxJitter(), sleeper));
        return template;
    }
}
