package com.phillippitts.plantdx.domain;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Describes how a diagnosis was reached: which providers contributed, which failed, and the
 * consensus block when the ensemble path was used.
 *
 * @param mode                  orchestration mode used
 * @param providersUsed         providers whose results contributed
 * @param providerErrors        failures collected along the way (never dropped)
 * @param consensus             ensemble consensus, null in primary mode
 * @param totalProcessingTimeMs total wall-clock time of the request
 */
public record DiagnosisProvenance(
        DiagnosisMode mode,
        List<String> providersUsed,
        List<ProviderError> providerErrors,
        Consensus consensus,
        long totalProcessingTimeMs
) {
    public DiagnosisProvenance {
        Objects.requireNonNull(mode, "mode");
        providersUsed = providersUsed == null ? List.of() : List.copyOf(providersUsed);
        providerErrors = providerErrors == null ? List.of() : List.copyOf(providerErrors);
    }

    public Optional<Consensus> findConsensus() {
        return Optional.ofNullable(consensus);
    }
}
