package com.phillippitts.plantdx.service.diagnostics;

import com.phillippitts.plantdx.domain.Prediction;

import java.util.List;

/**
 * Outcome of an operator-triggered test call to one provider.
 *
 * @param provider         provider name
 * @param success          whether the call produced a result
 * @param confidence       overall confidence, 0 on failure
 * @param topPredictions   up to three best predictions
 * @param processingTimeMs wall-clock time of the test
 * @param healthy          provider's healthy-plant flag
 * @param error            failure message, null on success
 */
public record ProviderTestReport(
        String provider,
        boolean success,
        double confidence,
        List<Prediction> topPredictions,
        long processingTimeMs,
        boolean healthy,
        String error
) {
    public ProviderTestReport {
        topPredictions = topPredictions == null ? List.of() : List.copyOf(topPredictions);
    }

    static ProviderTestReport failure(String provider, long processingTimeMs, String error) {
        return new ProviderTestReport(provider, false, 0.0, List.of(), processingTimeMs, false, error);
    }
}
