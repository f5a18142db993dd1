package com.phillippitts.plantdx.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-provider settings bound from {@code diagnosis.providers.<name>.*}.
 *
 * <p>Example:
 * <pre>
 * diagnosis.providers.plant_id.api-key=${PLANT_ID_API_KEY:}
 * diagnosis.providers.plant_id.timeout-ms=30000
 * diagnosis.providers.huggingface.options.model=microsoft/plant-disease-classifier
 * </pre>
 */
@ConfigurationProperties(prefix = "diagnosis")
@Validated
public class ProviderProperties {

    @Valid
    private Map<String, ProviderSettings> providers = new LinkedHashMap<>();

    public Map<String, ProviderSettings> getProviders() {
        return providers;
    }

    public void setProviders(Map<String, ProviderSettings> providers) {
        this.providers = providers;
    }

    /**
     * Returns the settings for a provider, or defaults when it is not configured.
     */
    public ProviderSettings settingsFor(String provider) {
        ProviderSettings settings = providers.get(provider);
        return settings != null ? settings : new ProviderSettings();
    }

    /**
     * Settings of one provider.
     */
    public static class ProviderSettings {
        /** Explicit enablement; when unset the provider is enabled iff it has credentials. */
        private Boolean enabled;
        private String apiKey;
        private String apiUrl;

        @Positive
        private int timeoutMs = 10_000;

        /** Per-provider threshold; falls back to the global one when unset. */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private Double confidenceThreshold;

        /** Requests per minute, 0 means unlimited. */
        @Min(0)
        private int rateLimitPerMinute = 0;

        private Map<String, String> options = new LinkedHashMap<>();

        public Boolean getEnabled() {
            return enabled;
        }

        public void setEnabled(Boolean enabled) {
            this.enabled = enabled;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getApiUrl() {
            return apiUrl;
        }

        public void setApiUrl(String apiUrl) {
            this.apiUrl = apiUrl;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public Double getConfidenceThreshold() {
            return confidenceThreshold;
        }

        public void setConfidenceThreshold(Double confidenceThreshold) {
            this.confidenceThreshold = confidenceThreshold;
        }

        public int getRateLimitPerMinute() {
            return rateLimitPerMinute;
        }

        public void setRateLimitPerMinute(int rateLimitPerMinute) {
            this.rateLimitPerMinute = rateLimitPerMinute;
        }

        public Map<String, String> getOptions() {
            return options;
        }

        public void setOptions(Map<String, String> options) {
            this.options = options;
        }
    }
}
