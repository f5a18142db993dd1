package com.phillippitts.plantdx.domain;

import java.util.List;
import java.util.Objects;

public record EnsembleMetadata(
        List<String> modelsUsed,
        long totalProcessingTimeMs,
        int imageCount,
        String ensembleMethod
) {
    public EnsembleMetadata {
        modelsUsed = modelsUsed == null ? List.of() : List.copyOf(modelsUsed);
        Objects.requireNonNull(ensembleMethod, "ensembleMethod");
    }
}
