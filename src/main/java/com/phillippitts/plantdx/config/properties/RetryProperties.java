package com.phillippitts.plantdx.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Retry policy for provider calls.
 */
@ConfigurationProperties(prefix = "diagnosis.retry")
@Validated
public class RetryProperties {

    /** Total attempts per provider call, including the first one. */
    @Positive(message = "Max attempts must be positive")
    private int maxAttempts = 3;

    /** Delay after the first failure; doubles after every further failure. */
    @Positive(message = "Base delay must be positive")
    private long baseDelayMs = 1000;

    /** Randomizes each delay within plus or minus this fraction. 0 disables jitter. */
    @DecimalMin("0.0")
    @DecimalMax(value = "1.0", inclusive = false)
    private double jitterRatio = 0.0;

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public void setBaseDelayMs(long baseDelayMs) {
        this.baseDelayMs = baseDelayMs;
    }

    public double getJitterRatio() {
        return jitterRatio;
    }

    public void setJitterRatio(double jitterRatio) {
        this.jitterRatio = jitterRatio;
    }
}
