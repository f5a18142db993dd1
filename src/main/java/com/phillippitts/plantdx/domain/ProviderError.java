package com.phillippitts.plantdx.domain;

import com.phillippitts.plantdx.exception.ProviderCallException;

import java.time.Instant;
import java.util.Objects;

/**
 * A collected provider failure. Errors are kept for diagnostics even when the request
 * succeeds through another provider.
 */
public record ProviderError(
        String provider,
        String message,
        boolean retryable,
        Instant timestamp
) {
    public ProviderError {
        Objects.requireNonNull(provider, "provider");
        message = message == null ? "" : message;
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    public static ProviderError from(String provider, Throwable failure) {
        if (failure instanceof ProviderCallException pce) {
            return new ProviderError(provider, pce.getMessage(), pce.isRetryable(), Instant.now());
        }
        String message = failure == null ? "unknown failure" : String.valueOf(failure.getMessage());
        return new ProviderError(provider, message, false, Instant.now());
    }
}
