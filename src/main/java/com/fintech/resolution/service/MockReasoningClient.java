package com.fintech.resolution.service;

import com.fintech.resolution.exception.ProviderApiException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Random;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Simulated reasoning provider.
 * <p>
 * Simulates:
 * - Network latency
 * - Intermittent transient failures
 * - A full outage, switched on and off at runtime
 * <p>
 * Replies are canned; in production this would call the hosted model.
 */
@Service
@Slf4j
public class MockReasoningClient implements ReasoningClient {

    private static final String PROVIDER_NAME = "reasoning";

    private final Random random = new Random();
    private final AtomicLong calls = new AtomicLong();

    @Value("${provider.reasoning.failure-rate:0.1}")
    private double failureRate;

    @Value("${provider.reasoning.latency-ms:50}")
    private int latencyMs;

    private volatile boolean simulateOutage = false;

    @Override
    public String complete(String prompt) throws InterruptedException {
        calls.incrementAndGet();
        if (prompt == null || prompt.isBlank()) {
            throw new ProviderApiException("Prompt must not be empty", PROVIDER_NAME, false);
        }

        simulateLatency();

        if (simulateOutage) {
            throw new ProviderApiException("Reasoning provider is currently unavailable", PROVIDER_NAME, true);
        }

        // Network issues, throttling
        if (random.nextDouble() < failureRate) {
            throw new ProviderApiException("Simulated network failure while contacting provider", PROVIDER_NAME, true);
        }

        log.debug("Reasoning provider answered a prompt of {} characters", prompt.length());
        return "Acknowledged: " + prompt.trim();
    }

    private void simulateLatency() throws InterruptedException {
        if (latencyMs > 0) {
            Thread.sleep(random.nextInt(latencyMs));
        }
    }

    @Override
    public String getProviderName() {
        return PROVIDER_NAME;
    }

    /**
     * Simulate a provider outage for testing resilience.
     */
    public void setSimulateOutage(boolean outage) {
        this.simulateOutage = outage;
        log.info("Reasoning provider outage simulation set to: {}", outage);
    }

    public long getCallCount() {
        return calls.get();
    }
}
