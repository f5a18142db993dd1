package com.phillippitts.plantdx.service.diagnostics;

import com.phillippitts.plantdx.domain.DiagnosisMode;

import java.util.List;

/**
 * Snapshot of the diagnosis service configuration for operators.
 *
 * @param providers           enabled providers
 * @param primaryProvider     configured primary provider
 * @param fallbackProvider    configured fallback provider
 * @param defaultMode         mode used when callers do not choose one
 * @param confidenceThreshold global confidence threshold
 * @param localModelLoaded    whether the local classifier is loaded
 * @param maxInputBytes       largest accepted raw image
 * @param maxDimension        longest side after normalization
 */
public record ServiceInfo(
        List<ProviderInfo> providers,
        String primaryProvider,
        String fallbackProvider,
        DiagnosisMode defaultMode,
        double confidenceThreshold,
        boolean localModelLoaded,
        int maxInputBytes,
        int maxDimension
) {
    public ServiceInfo {
        providers = providers == null ? List.of() : List.copyOf(providers);
    }

    /**
     * Provider summary. The API key itself is never exposed.
     */
    public record ProviderInfo(
            String name,
            String apiUrl,
            double confidenceThreshold,
            long timeoutMs,
            boolean hasApiKey
    ) {}
}
