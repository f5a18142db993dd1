package com.phillippitts.plantdx.service.retry;

import com.phillippitts.plantdx.config.properties.RetryProperties;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.RetryConfig;

import java.util.function.Predicate;

/**
 * Exponential backoff policy for provider calls.
 *
 * <p>The wait after the n-th failed attempt is {@code baseDelayMs * 2^(n-1)}. With a
 * non-zero {@code jitterRatio} each wait is randomized within plus or minus that fraction.
 *
 * @param maxAttempts total attempts including the first
 * @param baseDelayMs wait after the first failure, 0 for no wait
 * @param jitterRatio randomization factor in [0, 1), 0 for none
 */
public record RetryPolicy(int maxAttempts, long baseDelayMs, double jitterRatio) {

    static final double BACKOFF_MULTIPLIER = 2.0;

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException("baseDelayMs must be >= 0");
        }
        if (jitterRatio < 0.0 || jitterRatio >= 1.0) {
            throw new IllegalArgumentException("jitterRatio must be >= 0.0 and < 1.0");
        }
    }

    public static RetryPolicy from(RetryProperties props) {
        return new RetryPolicy(props.getMaxAttempts(), props.getBaseDelayMs(), props.getJitterRatio());
    }

    /** Wait before the next attempt, keyed by the 1-based number of attempts made so far. */
    public IntervalFunction intervalFunction() {
        if (baseDelayMs == 0) {
            return attempts -> 0L;
        }
        if (jitterRatio > 0.0) {
            return IntervalFunction.ofExponentialRandomBackoff(baseDelayMs, BACKOFF_MULTIPLIER, jitterRatio);
        }
        return IntervalFunction.ofExponentialBackoff(baseDelayMs, BACKOFF_MULTIPLIER);
    }

    /**
     * Resilience4j configuration for this policy.
     *
     * @param retryOn failures that deserve another attempt
     */
    public RetryConfig toRetryConfig(Predicate<Throwable> retryOn) {
        return RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(intervalFunction())
                .retryOnException(retryOn)
                .build();
    }
}
