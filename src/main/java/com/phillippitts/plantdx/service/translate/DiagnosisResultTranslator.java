package com.phillippitts.plantdx.service.translate;

import com.phillippitts.plantdx.domain.DiagnosisProvenance;
import com.phillippitts.plantdx.domain.DiagnosisResult;
import com.phillippitts.plantdx.domain.EnsembleResult;
import com.phillippitts.plantdx.domain.Prediction;
import com.phillippitts.plantdx.domain.ProviderResult;
import com.phillippitts.plantdx.domain.Severity;
import com.phillippitts.plantdx.domain.Treatment;
import com.phillippitts.plantdx.domain.TreatmentStep;
import com.phillippitts.plantdx.domain.TreatmentType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Maps the chosen prediction into the outward-facing {@link DiagnosisResult}.
 *
 * <p>Pure and deterministic: the same prediction and provenance always produce the same result.
 */
@Component
public class DiagnosisResultTranslator {

    static final int DEFAULT_AFFECTED_AREA = 80;

    private static final Map<Severity, String> RECOVERY_TIME = new EnumMap<>(Map.of(
            Severity.LOW, "1-2 weeks",
            Severity.MEDIUM, "2-4 weeks",
            Severity.HIGH, "1-2 months",
            Severity.CRITICAL, "2-3 months"));

    /**
     * Translates a single provider's result (primary-with-fallback mode).
     * Confidence is the provider's overall confidence.
     */
    public DiagnosisResult translate(ProviderResult result, DiagnosisProvenance provenance) {
        Objects.requireNonNull(result, "result");
        return translate(result.topPrediction(), result.confidence(), provenance);
    }

    /**
     * Translates an ensemble result. Confidence is the consensus confidence of the final prediction.
     */
    public DiagnosisResult translate(EnsembleResult result, DiagnosisProvenance provenance) {
        Objects.requireNonNull(result, "result");
        Prediction prediction = result.finalPrediction();
        return translate(prediction, prediction.confidence(), provenance);
    }

    private DiagnosisResult translate(Prediction prediction, double confidence, DiagnosisProvenance provenance) {
        Severity severity = prediction.severity() != null
                ? prediction.severity()
                : Severity.fromConfidence(confidence);
        return new DiagnosisResult(
                prediction.diseaseId(),
                prediction.diseaseName(),
                confidence,
                severity,
                DEFAULT_AFFECTED_AREA,
                prediction.symptoms(),
                prediction.causes(),
                treatmentSteps(prediction.treatment()),
                prediction.treatment().prevention(),
                recoveryTime(severity),
                List.of(),
                provenance);
    }

    static String recoveryTime(Severity severity) {
        return RECOVERY_TIME.get(severity);
    }

    static List<TreatmentStep> treatmentSteps(Treatment treatment) {
        List<TreatmentStep> steps = new ArrayList<>(3);
        if (!treatment.chemical().isEmpty()) {
            steps.add(new TreatmentStep(TreatmentType.CHEMICAL, treatment.chemical(), "7-14 days", "Daily"));
        }
        if (!treatment.biological().isEmpty()) {
            steps.add(new TreatmentStep(TreatmentType.BIOLOGICAL, treatment.biological(), "14-21 days", "Weekly"));
        }
        if (!treatment.organic().isEmpty()) {
            steps.add(new TreatmentStep(TreatmentType.ORGANIC, treatment.organic(), "21-30 days", "Bi-weekly"));
        }
        return steps;
    }
}
