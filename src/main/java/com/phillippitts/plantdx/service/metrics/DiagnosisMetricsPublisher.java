package com.phillippitts.plantdx.service.metrics;

import com.phillippitts.plantdx.exception.NoPredictionException;
import com.phillippitts.plantdx.exception.ProviderCallException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/**
 * Null-safe facade over {@link DiagnosisMetrics} used by the orchestration layer.
 *
 * <p>All methods tolerate a missing {@link DiagnosisMetrics}, so orchestrators and runners
 * can be built in tests without a meter registry.
 */
@Component
public final class DiagnosisMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(DiagnosisMetricsPublisher.class);

    /** No-op instance for tests and builder defaults. */
    public static final DiagnosisMetricsPublisher NOOP = new DiagnosisMetricsPublisher(null);

    private final DiagnosisMetrics metrics;

    public DiagnosisMetricsPublisher(DiagnosisMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("DiagnosisMetricsPublisher created without metrics (test mode)");
        }
    }

    public void recordProviderSuccess(String provider, long durationNanos) {
        if (metrics == null) {
            return;
        }
        metrics.recordProviderLatency(provider, durationNanos);
        metrics.incrementProviderSuccess(provider);
    }

    public void recordProviderFailure(String provider, long durationNanos, ProviderCallException failure) {
        if (metrics == null) {
            return;
        }
        metrics.recordProviderLatency(provider, durationNanos);
        metrics.incrementProviderFailure(provider, categorize(failure));
    }

    public void recordDiagnosis(String mode, long durationNanos, String outcome) {
        if (metrics == null) {
            return;
        }
        metrics.recordDiagnosisLatency(mode, durationNanos);
        metrics.incrementDiagnosisOutcome(mode, outcome);
    }

    public void recordFallback(String reason) {
        if (metrics != null) {
            metrics.incrementFallback(reason);
        }
    }

    public void recordConflict() {
        if (metrics != null) {
            metrics.incrementConflict();
        }
    }

    public boolean isEnabled() {
        return metrics != null;
    }

    static String categorize(ProviderCallException failure) {
        if (failure instanceof NoPredictionException) {
            return "no_prediction";
        }
        if (failure.isCredentialFailure()) {
            return "credentials";
        }
        return failure.isRetryable() ? "retryable" : "non_retryable";
    }
}
