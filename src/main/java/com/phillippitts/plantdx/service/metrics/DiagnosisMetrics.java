package com.phillippitts.plantdx.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for diagnosis requests and provider calls.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Provider call latency and success/failure counts per provider</li>
 *   <li>End-to-end diagnosis latency per mode</li>
 *   <li>Fallback usage and ensemble conflicts</li>
 * </ul>
 */
@Component
public class DiagnosisMetrics {

    private static final String PROVIDER_PREFIX = "plantdx.provider";
    private static final String DIAGNOSIS_PREFIX = "plantdx.diagnosis";

    private final MeterRegistry registry;

    public DiagnosisMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records the latency of one provider call (including retries).
     *
     * @param provider      provider name
     * @param durationNanos duration in nanoseconds
     */
    public void recordProviderLatency(String provider, long durationNanos) {
        Timer.builder(PROVIDER_PREFIX + ".latency")
                .description("Time taken by a provider call including retries")
                .tag("provider", provider)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementProviderSuccess(String provider) {
        Counter.builder(PROVIDER_PREFIX + ".success")
                .description("Number of successful provider calls")
                .tag("provider", provider)
                .register(registry)
                .increment();
    }

    /**
     * @param provider provider name
     * @param reason   failure category (retryable, non_retryable, credentials, no_prediction)
     */
    public void incrementProviderFailure(String provider, String reason) {
        Counter.builder(PROVIDER_PREFIX + ".failure")
                .description("Number of failed provider calls")
                .tag("provider", provider)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordDiagnosisLatency(String mode, long durationNanos) {
        Timer.builder(DIAGNOSIS_PREFIX + ".latency")
                .description("End-to-end diagnosis time")
                .tag("mode", mode)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementDiagnosisOutcome(String mode, String outcome) {
        Counter.builder(DIAGNOSIS_PREFIX + ".outcome")
                .description("Number of diagnosis requests by outcome")
                .tag("mode", mode)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void incrementFallback(String reason) {
        Counter.builder(DIAGNOSIS_PREFIX + ".fallback")
                .description("Number of times the fallback provider was consulted")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementConflict() {
        Counter.builder(DIAGNOSIS_PREFIX + ".conflict")
                .description("Number of ensemble diagnoses with conflicting predictions")
                .register(registry)
                .increment();
    }
}
