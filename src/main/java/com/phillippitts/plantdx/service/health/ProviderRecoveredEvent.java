package com.phillippitts.plantdx.service.health;

import java.time.Instant;

/**
 * Published when a provider serves a call successfully or passes a probe.
 */
public record ProviderRecoveredEvent(String provider, Instant at) {}
