package com.fintech.resolution.resilience;

import com.fintech.resolution.config.ResilienceConfig;
import com.fintech.resolution.config.ResilienceProperties;
import com.fintech.resolution.dto.ProviderHealth;
import com.fintech.resolution.support.MutableClock;
import com.fintech.resolution.support.RecordingSleeper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ProviderResilienceRegistryTest {

    private ProviderResilienceRegistry registry;

    @BeforeEach
    void setUp() {
        ResilienceProperties properties = new ResilienceProperties();
        properties.getRateLimit().setCapacity(10);
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        registry = new ProviderResilienceRegistry(
                new ResilienceConfig().circuitBreakerRegistry(properties, meterRegistry),
                properties, MutableClock.startingAt("2024-03-15T10:00:00Z"), new RecordingSleeper());
    }

    @Test
    @DisplayName("The same provider id always gets the same bucket and breaker")
    void sharedPerProvider() {
        assertThat(registry.rateLimiter("reasoning")).isSameAs(registry.rateLimiter("reasoning"));
        assertThat(registry.circuitBreaker("reasoning")).isSameAs(registry.circuitBreaker("reasoning"));
        assertThat(registry.rateLimiter("ledger")).isNotSameAs(registry.rateLimiter("reasoning"));
    }

    @Test
    @DisplayName("Health reports circuit state and remaining tokens per provider")
    void health() {
        registry.circuitBreaker("reasoning");
        registry.rateLimiter("reasoning").acquire();

        assertThat(registry.health())
                .singleElement()
                .satisfies(health -> {
                    assertThat(health.getProviderId()).isEqualTo("reasoning");
                    assertThat(health.getCircuitState()).isEqualTo("CLOSED");
                    assertThat(health.getCapacity()).isEqualTo(10);
                    assertThat(health.getAvailableTokens()).isEqualTo(9.0);
                })
                .extracting(ProviderHealth::getFailedCalls)
                .isEqualTo(0);
    }
}
