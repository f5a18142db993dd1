package com.phillippitts.plantdx.domain;

import java.util.List;
import java.util.Objects;

/**
 * Combined opinion of several providers.
 *
 * <p>Invariant: the final prediction's disease id is present in at least one contributing result.
 */
public record EnsembleResult(
        Prediction finalPrediction,
        List<ProviderResult> individualResults,
        Consensus consensus,
        EnsembleMetadata metadata
) {
    public EnsembleResult {
        Objects.requireNonNull(finalPrediction, "finalPrediction");
        Objects.requireNonNull(individualResults, "individualResults");
        if (individualResults.isEmpty()) {
            throw new IllegalArgumentException("individualResults must not be empty");
        }
        individualResults = List.copyOf(individualResults);
        String id = finalPrediction.diseaseId();
        boolean present = individualResults.stream()
                .flatMap(r -> r.predictions().stream())
                .anyMatch(p -> p.diseaseId().equals(id));
        if (!present) {
            throw new IllegalArgumentException("finalPrediction " + id + " not found in contributing results");
        }
        Objects.requireNonNull(consensus, "consensus");
        Objects.requireNonNull(metadata, "metadata");
    }
}
