package com.fintech.resolution.resilience;

import com.fintech.resolution.audit.AuditLogger;
import com.fintech.resolution.exception.CallCancelledException;
import com.fintech.resolution.exception.CircuitOpenException;
import com.fintech.resolution.exception.ErrorKind;
import com.fintech.resolution.exception.ProviderApiException;
import com.fintech.resolution.exception.ResolutionException;
import com.fintech.resolution.exception.RetriesExhaustedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.stereotype.Service;

import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Single entry point for every outbound provider call.
 * <p>
 * Each attempt first asks the provider's circuit breaker for permission, then
 * takes a rate-limit token, then runs the call and reports the outcome to the
 * breaker. Transient failures are retried with jittered exponential backoff.
 * A circuit or rate-limit rejection ends the call at once: it is never retried
 * and a rejected attempt consumes no token.
 */
@Service
@Slf4j
public class ResilientCallExecutor {

    private final ProviderResilienceRegistry registry;
    private final MeterRegistry meterRegistry;
    private final AuditLogger auditLogger;

    public ResilientCallExecutor(ProviderResilienceRegistry registry,
                                 MeterRegistry meterRegistry,
                                 AuditLogger auditLogger) {
        this.registry = registry;
        this.meterRegistry = meterRegistry;
        this.auditLogger = auditLogger;
    }

    /**
     * Runs {@code callable} against {@code providerId} under rate limiting, circuit
     * breaking and retry.
     *
     * @throws CircuitOpenException       if the circuit is open or its trial slot is taken
     * @throws com.fintech.resolution.exception.RateLimitedException if no token is available within the max wait
     * @throws RetriesExhaustedException  if every attempt failed transiently; the cause is the last failure
     * @throws ProviderApiException       if the provider failed permanently
     * @throws CallCancelledException     if the calling thread was interrupted
     */
    public <T> T execute(String providerId, Callable<T> callable) {
        CircuitBreaker breaker = registry.circuitBreaker(providerId);
        TokenBucketRateLimiter rateLimiter = registry.rateLimiter(providerId);
        AtomicInteger attempts = new AtomicInteger();

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            return registry.retryTemplate().execute(context -> {
                int attempt = attempts.incrementAndGet();
                if (attempt > 1) {
                    log.warn("Retrying call to provider {} (attempt {}/{}) after: {}", providerId, attempt,
                            registry.maxAttempts(), context.getLastThrowable().getMessage());
                }
                return attempt(providerId, breaker, rateLimiter, callable);
            });
        } catch (BackOffInterruptedException e) {
            throw reject(providerId, new CallCancelledException(providerId, e));
        } catch (ResolutionException e) {
            if (FailureClassifier.isTransient(e)) {
                throw reject(providerId, new RetriesExhaustedException(providerId, attempts.get(), e));
            }
            throw reject(providerId, e);
        } catch (Exception e) {
            if (FailureClassifier.isTransient(e)) {
                throw reject(providerId, new RetriesExhaustedException(providerId, attempts.get(), e));
            }
            throw reject(providerId, new ProviderApiException(
                    "Provider call failed: " + e.getMessage(), providerId, false, e));
        } finally {
            sample.stop(Timer.builder("resolution.provider.call")
                    .description("Outbound provider calls including retries")
                    .tag("provider", providerId)
                    .register(meterRegistry));
        }
    }

    private <T> T attempt(String providerId, CircuitBreaker breaker, TokenBucketRateLimiter rateLimiter,
                          Callable<T> callable) throws Exception {
        if (!breaker.tryAcquirePermission()) {
            throw new CircuitOpenException(providerId);
        }
        try {
            rateLimiter.acquire();
        } catch (RuntimeException e) {
            breaker.releasePermission();
            throw e;
        }

        long start = System.nanoTime();
        try {
            T result = callable.call();
            breaker.onSuccess(System.nanoTime() - start, TimeUnit.NANOSECONDS);
            return result;
        } catch (InterruptedException e) {
            breaker.releasePermission();
            Thread.currentThread().interrupt();
            throw new CallCancelledException(providerId, e);
        } catch (Exception e) {
            breaker.onError(System.nanoTime() - start, TimeUnit.NANOSECONDS, e);
            throw e;
        }
    }

    private ResolutionException reject(String providerId, ResolutionException failure) {
        ErrorKind kind = failure.getKind();
        log.warn("Call to provider {} failed [{}]: {}", providerId, kind, failure.getMessage());
        Counter.builder("resolution.provider.rejections")
                .description("Outbound provider calls that did not produce a result")
                .tag("provider", providerId)
                .tag("kind", kind.name())
                .register(meterRegistry)
                .increment();
        auditLogger.providerCallFailed(providerId, kind);
        return failure;
    }
}
