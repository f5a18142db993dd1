package com.phillippitts.plantdx.service.orchestration;

import com.phillippitts.plantdx.domain.ClassificationRequest;
import com.phillippitts.plantdx.domain.ProviderResult;
import com.phillippitts.plantdx.exception.ProviderCallException;
import com.phillippitts.plantdx.service.health.ProviderEvents;
import com.phillippitts.plantdx.service.metrics.DiagnosisMetricsPublisher;
import com.phillippitts.plantdx.service.provider.DiagnosisProvider;
import com.phillippitts.plantdx.service.provider.ProviderCatalog;
import com.phillippitts.plantdx.service.provider.ProviderRateLimiter;
import com.phillippitts.plantdx.service.registry.ProviderConfig;
import com.phillippitts.plantdx.service.registry.ProviderRegistry;
import com.phillippitts.plantdx.service.retry.RetryingCallExecutor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.util.Map;
import java.util.Objects;

/**
 * Runs one provider call through rate limiting and the retry executor, then reports the
 * outcome to metrics and the health tracker.
 *
 * <p>Each attempt re-acquires a rate-limit slot, so a rejected attempt backs off like any
 * other retryable failure.
 */
public class ProviderCallRunner {

    private static final Logger LOG = LogManager.getLogger(ProviderCallRunner.class);

    private final ProviderCatalog catalog;
    private final ProviderRegistry registry;
    private final RetryingCallExecutor retryExecutor;
    private final ProviderRateLimiter rateLimiter;
    private final ApplicationEventPublisher publisher;
    private final DiagnosisMetricsPublisher metrics;

    public ProviderCallRunner(ProviderCatalog catalog,
                              ProviderRegistry registry,
                              RetryingCallExecutor retryExecutor,
                              ProviderRateLimiter rateLimiter,
                              ApplicationEventPublisher publisher,
                              DiagnosisMetricsPublisher metrics) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.retryExecutor = Objects.requireNonNull(retryExecutor, "retryExecutor");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
        this.publisher = publisher;
        this.metrics = metrics == null ? DiagnosisMetricsPublisher.NOOP : metrics;
    }

    /**
     * Calls the named provider.
     *
     * @throws ProviderCallException when the provider is unavailable or fails after retries
     */
    public ProviderResult call(String providerName, ClassificationRequest request) {
        ProviderConfig config = registry.find(providerName)
                .filter(ProviderConfig::enabled)
                .orElseThrow(() -> new ProviderCallException(
                        "Provider not configured or disabled", providerName, false));
        DiagnosisProvider provider = catalog.find(providerName)
                .orElseThrow(() -> new ProviderCallException(
                        "Provider not configured or disabled", providerName, false));

        long t0 = System.nanoTime();
        try {
            ProviderResult result = retryExecutor.execute(providerName, config.timeout(), () -> {
                rateLimiter.acquire(providerName, config.rateLimitPerMinute());
                return provider.classify(request);
            });
            long elapsed = System.nanoTime() - t0;
            metrics.recordProviderSuccess(providerName, elapsed);
            ProviderEvents.publishRecovered(publisher, providerName);
            LOG.debug("{} returned {} prediction(s), confidence={}", providerName,
                    result.predictions().size(), result.confidence());
            return result;
        } catch (ProviderCallException e) {
            recordFailure(providerName, t0, e);
            throw e;
        } catch (RuntimeException e) {
            ProviderCallException wrapped = new ProviderCallException(
                    "Unexpected provider error: " + e.getMessage(), providerName, false, e);
            recordFailure(providerName, t0, wrapped);
            throw wrapped;
        }
    }

    private void recordFailure(String providerName, long t0, ProviderCallException failure) {
        metrics.recordProviderFailure(providerName, System.nanoTime() - t0, failure);
        if (!Thread.currentThread().isInterrupted()) {
            ProviderEvents.publishFailure(publisher, providerName, failure,
                    Map.of("retryable", String.valueOf(failure.isRetryable())));
        }
        LOG.warn("Provider {} failed: {}", providerName, failure.getMessage());
    }
}
