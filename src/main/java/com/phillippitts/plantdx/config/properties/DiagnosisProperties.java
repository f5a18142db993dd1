package com.phillippitts.plantdx.config.properties;

import com.phillippitts.plantdx.domain.DiagnosisMode;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for diagnosis orchestration.
 */
@Validated
@ConfigurationProperties(prefix = "diagnosis")
public class DiagnosisProperties {

    public static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.7;

    /** Global confidence threshold used by primary-with-fallback mode. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private final double confidenceThreshold;

    @NotBlank
    private final String primaryProvider;

    @NotBlank
    private final String fallbackProvider;

    @NotNull
    private final DiagnosisMode defaultMode;

    /**
     * Overall deadline for one diagnosis request in milliseconds. Pending provider calls are
     * cancelled when it expires.
     */
    @Positive
    private final long requestTimeoutMs;

    @ConstructorBinding
    public DiagnosisProperties(Double confidenceThreshold,
                               String primaryProvider,
                               String fallbackProvider,
                               DiagnosisMode defaultMode,
                               Long requestTimeoutMs) {
        this.confidenceThreshold = confidenceThreshold == null ? DEFAULT_CONFIDENCE_THRESHOLD : confidenceThreshold;
        this.primaryProvider = primaryProvider == null ? "plant_id" : primaryProvider;
        this.fallbackProvider = fallbackProvider == null ? "local_model" : fallbackProvider;
        this.defaultMode = defaultMode == null ? DiagnosisMode.PRIMARY : defaultMode;
        this.requestTimeoutMs = requestTimeoutMs == null ? 30_000L : requestTimeoutMs;
    }

    /**
     * Defaults for everything except the provider pair; handy in tests.
     */
    public DiagnosisProperties(String primaryProvider, String fallbackProvider) {
        this(null, primaryProvider, fallbackProvider, null, null);
    }

    public double getConfidenceThreshold() {
        return confidenceThreshold;
    }

    public String getPrimaryProvider() {
        return primaryProvider;
    }

    public String getFallbackProvider() {
        return fallbackProvider;
    }

    public DiagnosisMode getDefaultMode() {
        return defaultMode;
    }

    public long getRequestTimeoutMs() {
        return requestTimeoutMs;
    }
}
