package com.phillippitts.plantdx.domain;

/**
 * Call metadata attached to a {@link ProviderResult}.
 *
 * @param processingTimeMs wall-clock time of the successful call
 * @param imageCount       number of images sent
 * @param modelVersion     provider model version when known (may be null)
 * @param rawResponse      raw response body kept for diagnostics (may be null)
 */
public record ProviderResultMetadata(
        long processingTimeMs,
        int imageCount,
        String modelVersion,
        String rawResponse
) {
    public ProviderResultMetadata {
        if (processingTimeMs < 0) {
            throw new IllegalArgumentException("processingTimeMs must be >= 0");
        }
        if (imageCount < 0) {
            throw new IllegalArgumentException("imageCount must be >= 0");
        }
    }
}
