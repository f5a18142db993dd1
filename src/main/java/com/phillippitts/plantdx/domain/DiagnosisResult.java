package com.phillippitts.plantdx.domain;

import java.util.List;
import java.util.Objects;

/**
 * Outward-facing diagnosis record. This is the only type the rest of the platform sees.
 */
public record DiagnosisResult(
        String diseaseId,
        String diseaseName,
        double confidence,
        Severity severity,
        int affectedArea,
        List<String> symptoms,
        List<String> causes,
        List<TreatmentStep> treatments,
        List<String> preventionTips,
        String expectedRecoveryTime,
        List<String> riskFactors,
        DiagnosisProvenance provenance
) {
    public DiagnosisResult {
        Objects.requireNonNull(diseaseId, "diseaseId");
        Objects.requireNonNull(diseaseName, "diseaseName");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
        Objects.requireNonNull(severity, "severity");
        if (affectedArea < 0 || affectedArea > 100) {
            throw new IllegalArgumentException("affectedArea must be a percentage, got: " + affectedArea);
        }
        symptoms = symptoms == null ? List.of() : List.copyOf(symptoms);
        causes = causes == null ? List.of() : List.copyOf(causes);
        treatments = treatments == null ? List.of() : List.copyOf(treatments);
        preventionTips = preventionTips == null ? List.of() : List.copyOf(preventionTips);
        Objects.requireNonNull(expectedRecoveryTime, "expectedRecoveryTime");
        riskFactors = riskFactors == null ? List.of() : List.copyOf(riskFactors);
        Objects.requireNonNull(provenance, "provenance");
    }
}
