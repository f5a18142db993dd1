package com.phillippitts.plantdx.service.health;

import java.time.Instant;
import java.util.Map;

/**
 * Published when a provider call fails after all retry attempts.
 *
 * @param provider   provider name
 * @param at         when the failure was observed
 * @param message    failure message
 * @param cause      underlying exception (may be null)
 * @param statusCode HTTP status when one was received, otherwise 0
 * @param context    extra diagnostic context (may be empty)
 */
public record ProviderFailureEvent(
        String provider,
        Instant at,
        String message,
        Throwable cause,
        int statusCode,
        Map<String, String> context
) {
    public ProviderFailureEvent {
        context = context == null ? Map.of() : Map.copyOf(context);
    }

    public boolean isCredentialFailure() {
        return statusCode == 401 || statusCode == 403;
    }
}
