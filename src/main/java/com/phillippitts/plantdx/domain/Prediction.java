package com.phillippitts.plantdx.domain;

import java.util.List;
import java.util.Objects;

/**
 * One candidate diagnosis in the canonical shape every provider adapter produces.
 *
 * @param diseaseId     stable identifier used for consensus voting
 * @param diseaseName   display name
 * @param confidence    confidence score between 0.0 and 1.0
 * @param severity      severity, defaulted by the adapter when the provider has none
 * @param description   free-text description (empty when unknown)
 * @param treatment     treatment recommendations
 * @param symptoms      observed symptoms
 * @param causes        known causes
 * @param affectedAreas affected plant parts
 */
public record Prediction(
        String diseaseId,
        String diseaseName,
        double confidence,
        Severity severity,
        String description,
        Treatment treatment,
        List<String> symptoms,
        List<String> causes,
        List<String> affectedAreas
) {
    public Prediction {
        Objects.requireNonNull(diseaseId, "diseaseId");
        if (diseaseId.isBlank()) {
            throw new IllegalArgumentException("diseaseId must not be blank");
        }
        Objects.requireNonNull(diseaseName, "diseaseName");
        if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
        severity = severity == null ? Severity.fromConfidence(confidence) : severity;
        description = description == null ? "" : description;
        treatment = treatment == null ? Treatment.NONE : treatment;
        symptoms = symptoms == null ? List.of() : List.copyOf(symptoms);
        causes = causes == null ? List.of() : List.copyOf(causes);
        affectedAreas = affectedAreas == null ? List.of() : List.copyOf(affectedAreas);
    }

    public static Builder builder(String diseaseId, String diseaseName, double confidence) {
        return new Builder(diseaseId, diseaseName, confidence);
    }

    /**
     * Builder for predictions; unset optional fields fall back to the record defaults.
     */
    public static final class Builder {
        private final String diseaseId;
        private final String diseaseName;
        private final double confidence;
        private Severity severity;
        private String description;
        private Treatment treatment;
        private List<String> symptoms;
        private List<String> causes;
        private List<String> affectedAreas;

        private Builder(String diseaseId, String diseaseName, double confidence) {
            this.diseaseId = diseaseId;
            this.diseaseName = diseaseName;
            this.confidence = confidence;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder treatment(Treatment treatment) {
            this.treatment = treatment;
            return this;
        }

        public Builder symptoms(List<String> symptoms) {
            this.symptoms = symptoms;
            return this;
        }

        public Builder causes(List<String> causes) {
            this.causes = causes;
            return this;
        }

        public Builder affectedAreas(List<String> affectedAreas) {
            this.affectedAreas = affectedAreas;
            return this;
        }

        public Prediction build() {
            return new Prediction(diseaseId, diseaseName, confidence, severity, description,
                    treatment, symptoms, causes, affectedAreas);
        }
    }
}
