package com.phillippitts.plantdx.service.registry;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Static configuration of one provider. Only {@code enabled} and {@code confidenceThreshold}
 * change at runtime, and only by swapping in a new instance through {@link ProviderRegistry}.
 *
 * @param name                provider name, e.g. {@code plant_id}
 * @param enabled             whether the orchestrator may route requests to it
 * @param apiKey              credential (may be null for the local model)
 * @param apiUrl              base URL (may be null for the local model)
 * @param timeout             per-attempt timeout
 * @param confidenceThreshold declared confidence threshold
 * @param rateLimitPerMinute  declared requests per minute, 0 means unlimited
 * @param options             free-form provider options
 */
public record ProviderConfig(
        String name,
        boolean enabled,
        String apiKey,
        String apiUrl,
        Duration timeout,
        double confidenceThreshold,
        int rateLimitPerMinute,
        Map<String, String> options
) {
    public ProviderConfig {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive for provider " + name);
        }
        if (confidenceThreshold < 0.0 || confidenceThreshold > 1.0) {
            throw new IllegalArgumentException("confidenceThreshold must be between 0.0 and 1.0, got: "
                    + confidenceThreshold);
        }
        if (rateLimitPerMinute < 0) {
            throw new IllegalArgumentException("rateLimitPerMinute must be >= 0");
        }
        options = options == null ? Map.of() : Map.copyOf(options);
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    public String option(String key, String defaultValue) {
        String value = options.get(key);
        return value == null || value.isBlank() ? defaultValue : value;
    }

    public ProviderConfig withEnabled(boolean flag) {
        return new ProviderConfig(name, flag, apiKey, apiUrl, timeout, confidenceThreshold,
                rateLimitPerMinute, options);
    }

    public ProviderConfig withConfidenceThreshold(double threshold) {
        return new ProviderConfig(name, enabled, apiKey, apiUrl, timeout, threshold,
                rateLimitPerMinute, options);
    }

    // Keeps the credential out of logs
    @Override
    public String toString() {
        return "ProviderConfig[name=" + name + ", enabled=" + enabled + ", apiUrl=" + apiUrl
                + ", hasApiKey=" + hasApiKey() + ", timeout=" + timeout.toMillis() + "ms"
                + ", confidenceThreshold=" + confidenceThreshold
                + ", rateLimitPerMinute=" + rateLimitPerMinute + "]";
    }
}
