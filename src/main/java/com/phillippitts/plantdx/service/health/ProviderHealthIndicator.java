package com.phillippitts.plantdx.service.health;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Health indicator for diagnosis providers.
 *
 * <ul>
 *   <li>UP: every configured provider is healthy</li>
 *   <li>DEGRADED: at least one provider is enabled but some are degraded or disabled</li>
 *   <li>DOWN: no provider is enabled</li>
 * </ul>
 */
@Component
@ConditionalOnProperty(prefix = "diagnosis.health", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ProviderHealthIndicator implements HealthIndicator {

    private final ProviderHealthTracker tracker;

    public ProviderHealthIndicator(ProviderHealthTracker tracker) {
        this.tracker = tracker;
    }

    @Override
    public Health health() {
        List<ProviderHealthReport> reports = tracker.healthReport();
        long enabled = reports.stream().filter(ProviderHealthReport::enabled).count();
        boolean allHealthy = reports.stream()
                .filter(r -> r.state() != ProviderState.UNCONFIGURED)
                .allMatch(r -> r.state() == ProviderState.HEALTHY);

        Health.Builder builder = new Health.Builder();
        if (enabled == 0) {
            builder.down().withDetail("status", "No providers available");
        } else if (allHealthy) {
            builder.up().withDetail("status", "All configured providers operational");
        } else {
            builder.status("DEGRADED").withDetail("status", "Partial provider availability");
        }
        for (ProviderHealthReport report : reports) {
            builder.withDetail(report.provider(), describe(report));
        }
        return builder.build();
    }

    private static String describe(ProviderHealthReport report) {
        return switch (report.state()) {
            case HEALTHY -> "ready";
            case DEGRADED -> "degraded (" + report.failuresInWindow() + " recent failures)";
            case DISABLED -> "disabled until " + report.disabledUntil();
            case UNCONFIGURED -> "not configured";
        };
    }
}
