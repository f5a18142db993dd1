package com.phillippitts.plantdx.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the provider health tracker.
 */
@ConfigurationProperties(prefix = "diagnosis.health")
@Validated
public class HealthProperties {

    /** Enable/disable health tracking globally. */
    private boolean enabled = true;

    /** Sliding window for counting failures, in minutes. */
    @Positive(message = "Window minutes must be positive")
    private int windowMinutes = 10;

    /** Failures tolerated per provider within the window before it is disabled. */
    @Positive(message = "Max failures per window must be positive")
    private int maxFailuresPerWindow = 5;

    /** Minutes a disabled provider waits before it may be probed again. */
    @Positive(message = "Cooldown minutes must be positive")
    private int cooldownMinutes = 5;

    @Positive(message = "Probe interval must be positive")
    private long probeIntervalMs = 60_000;

    private boolean probeEnabled = true;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getWindowMinutes() {
        return windowMinutes;
    }

    public void setWindowMinutes(int windowMinutes) {
        this.windowMinutes = windowMinutes;
    }

    public int getMaxFailuresPerWindow() {
        return maxFailuresPerWindow;
    }

    public void setMaxFailuresPerWindow(int maxFailuresPerWindow) {
        this.maxFailuresPerWindow = maxFailuresPerWindow;
    }

    public int getCooldownMinutes() {
        return cooldownMinutes;
    }

    public void setCooldownMinutes(int cooldownMinutes) {
        this.cooldownMinutes = cooldownMinutes;
    }

    public long getProbeIntervalMs() {
        return probeIntervalMs;
    }

    public void setProbeIntervalMs(long probeIntervalMs) {
        this.probeIntervalMs = probeIntervalMs;
    }

    public boolean isProbeEnabled() {
        return probeEnabled;
    }

    public void setProbeEnabled(boolean probeEnabled) {
        this.probeEnabled = probeEnabled;
    }
}
