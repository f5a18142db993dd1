package com.phillippitts.plantdx.service.health;

import com.phillippitts.plantdx.exception.ProviderCallException;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.Map;

/**
 * Utility class for publishing provider health events.
 *
 * <p>A null publisher is tolerated so components work without event publishing in tests.
 */
public final class ProviderEvents {

    private ProviderEvents() {
        // Utility class - prevent instantiation
    }

    public static void publishFailure(ApplicationEventPublisher publisher,
                                      String provider,
                                      ProviderCallException failure,
                                      Map<String, String> context) {
        if (publisher != null) {
            publisher.publishEvent(new ProviderFailureEvent(
                    provider,
                    Instant.now(),
                    failure.getMessage(),
                    failure,
                    failure.getStatusCode(),
                    context));
        }
    }

    public static void publishRecovered(ApplicationEventPublisher publisher, String provider) {
        if (publisher != null) {
            publisher.publishEvent(new ProviderRecoveredEvent(provider, Instant.now()));
        }
    }
}
