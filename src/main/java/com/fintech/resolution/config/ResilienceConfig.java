package com.fintech.resolution.config;

import com.fintech.resolution.resilience.FailureClassifier;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.micrometer.tagged.TaggedCircuitBreakerMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;

import java.time.Clock;

/**
 * Circuit breakers, time source and sleeper for outbound provider calls.
 * <p>
 * Breaker states:
 * - CLOSED: calls pass through; {@code failureThreshold} consecutive transient failures open it
 * - OPEN: calls fail fast until {@code openDuration} has passed
 * - HALF_OPEN: exactly one trial call; success closes, failure reopens
 */
@Configuration
@EnableConfigurationProperties({
        MatchingProperties.class,
        DisambiguationProperties.class,
        ResilienceProperties.class
})
@Slf4j
public class ResilienceConfig {

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(ResilienceProperties properties, MeterRegistry meterRegistry) {
        ResilienceProperties.CircuitBreaker breaker = properties.getCircuitBreaker();
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                // A window of N calls that must all fail: N consecutive failures
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(breaker.getFailureThreshold())
                .minimumNumberOfCalls(breaker.getFailureThreshold())
                .failureRateThreshold(100)
                .waitDurationInOpenState(breaker.getOpenDuration())
                // One trial call at a time while half-open
                .permittedNumberOfCallsInHalfOpenState(1)
                // OPEN -> HALF_OPEN happens on the next call after the wait
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                // Permanent failures mean the provider answered
                .recordException(FailureClassifier::isTransient)
                .build();

        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(config);
        registry.getEventPublisher().onEntryAdded(event ->
                event.getAddedEntry().getEventPublisher().onStateTransition(transition ->
                        log.info("Circuit for provider {} moved {}", transition.getCircuitBreakerName(),
                                transition.getStateTransition())));
        TaggedCircuitBreakerMetrics.ofCircuitBreakerRegistry(registry).bindTo(meterRegistry);
        return registry;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return new ThreadWaitSleeper();
    }
}
