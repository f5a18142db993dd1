package com.phillippitts.plantdx.service.health;

import java.time.Instant;

/**
 * Point-in-time health of one provider.
 *
 * @param provider          provider name
 * @param state             tracked state
 * @param enabled           whether the registry currently routes requests to it
 * @param failuresInWindow  failures counted in the current sliding window
 * @param disabledUntil     end of the cooldown when disabled, otherwise null
 * @param lastError         most recent failure message, or null
 */
public record ProviderHealthReport(
        String provider,
        ProviderState state,
        boolean enabled,
        int failuresInWindow,
        Instant disabledUntil,
        String lastError
) {}
