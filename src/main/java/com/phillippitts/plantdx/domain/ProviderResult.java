package com.phillippitts.plantdx.domain;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Output of one successful provider call. Predictions are always ordered by descending
 * confidence and the overall confidence is the provider's own top confidence.
 */
public record ProviderResult(
        String provider,
        List<Prediction> predictions,
        double confidence,
        boolean healthy,
        ProviderResultMetadata metadata
) {
    private static final Comparator<Prediction> BY_CONFIDENCE_DESC =
            Comparator.comparingDouble(Prediction::confidence).reversed();

    public ProviderResult {
        Objects.requireNonNull(provider, "provider");
        Objects.requireNonNull(predictions, "predictions");
        if (predictions.isEmpty()) {
            throw new IllegalArgumentException("predictions must not be empty");
        }
        List<Prediction> sorted = new ArrayList<>(predictions);
        sorted.sort(BY_CONFIDENCE_DESC);
        predictions = List.copyOf(sorted);
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
        Objects.requireNonNull(metadata, "metadata");
    }

    /**
     * Creates a result whose overall confidence is the top prediction's confidence.
     */
    public static ProviderResult of(String provider, List<Prediction> predictions, boolean healthy,
                                    ProviderResultMetadata metadata) {
        double top = predictions.stream().mapToDouble(Prediction::confidence).max().orElse(0.0);
        return new ProviderResult(provider, predictions, top, healthy, metadata);
    }

    public Prediction topPrediction() {
        return predictions.get(0);
    }
}
