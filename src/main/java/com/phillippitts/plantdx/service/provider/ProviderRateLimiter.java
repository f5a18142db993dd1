package com.phillippitts.plantdx.service.provider;

import com.phillippitts.plantdx.exception.ProviderCallExceptionBuilder;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;

import java.time.Duration;
import java.util.Objects;

/**
 * Enforces each provider's declared requests-per-minute with one Resilience4j
 * {@link RateLimiter} per provider.
 *
 * <p>Permits refresh every period (one minute in production) and are never waited for: a call
 * over the limit fails at once with a retryable exception so the retry executor backs off.
 */
public class ProviderRateLimiter {

    static final Duration DEFAULT_PERIOD = Duration.ofMinutes(1);

    private final Duration refreshPeriod;
    private final RateLimiterRegistry limiters = RateLimiterRegistry.ofDefaults();

    public ProviderRateLimiter() {
        this(DEFAULT_PERIOD);
    }

    /**
     * @param refreshPeriod how often the declared number of permits is restored
     */
    public ProviderRateLimiter(Duration refreshPeriod) {
        this.refreshPeriod = Objects.requireNonNull(refreshPeriod, "refreshPeriod");
    }

    /**
     * Takes a permit for the provider, or rejects the call when none is left this period.
     *
     * @param provider           provider name
     * @param requestsPerMinute  declared limit; 0 or less means unlimited
     * @throws com.phillippitts.plantdx.exception.ProviderCallException (retryable) when over the limit
     */
    public void acquire(String provider, int requestsPerMinute) {
        if (requestsPerMinute <= 0) {
            return;
        }
        RateLimiter limiter = limiterFor(provider, requestsPerMinute);
        if (!limiter.acquirePermission()) {
            throw ProviderCallExceptionBuilder.create("Rate limit exceeded")
                    .provider(provider)
                    .retryable(true)
                    .statusCode(429)
                    .metadata("limitPerMinute", requestsPerMinute)
                    .build();
        }
    }

    /** Permits left for the provider in the current period, or -1 when it was never limited. */
    int availablePermits(String provider) {
        return limiters.find(provider)
                .map(limiter -> limiter.getMetrics().getAvailablePermissions())
                .orElse(-1);
    }

    private RateLimiter limiterFor(String provider, int requestsPerMinute) {
        RateLimiter limiter = limiters.find(provider).orElseGet(() -> limiters.rateLimiter(provider,
                RateLimiterConfig.custom()
                        .limitForPeriod(requestsPerMinute)
                        .limitRefreshPeriod(refreshPeriod)
                        .timeoutDuration(Duration.ZERO)
                        .build()));
        if (limiter.getRateLimiterConfig().getLimitForPeriod() != requestsPerMinute) {
            // takes effect from the next refresh period
            limiter.changeLimitForPeriod(requestsPerMinute);
        }
        return limiter;
    }
}
