package com.phillippitts.plantdx.service.health;

import com.phillippitts.plantdx.config.properties.HealthProperties;
import com.phillippitts.plantdx.service.provider.DiagnosisProvider;
import com.phillippitts.plantdx.service.provider.ProviderCatalog;
import com.phillippitts.plantdx.service.registry.ProviderConfig;
import com.phillippitts.plantdx.service.registry.ProviderRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Event-driven health tracker that disables failing providers and re-enables them after a
 * successful probe.
 *
 * <p>Detection model:
 * <ul>
 *   <li>Provider calls publish {@link ProviderFailureEvent} after retries are exhausted.</li>
 *   <li>Failures are counted per provider in a sliding window; the first marks it DEGRADED.</li>
 *   <li>Exceeding the budget, or a credential rejection (HTTP 401/403), disables the provider in
 *       the {@link ProviderRegistry} for a cooldown period.</li>
 *   <li>A scheduled probe checks disabled providers whose cooldown elapsed and re-enables them
 *       when the probe passes.</li>
 * </ul>
 *
 * <p>Only real traffic drives state changes; healthy providers are never polled.
 */
@Component
@ConditionalOnProperty(prefix = "diagnosis.health", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ProviderHealthTracker {

    private static final Logger LOG = LogManager.getLogger(ProviderHealthTracker.class);

    private final ProviderCatalog catalog;
    private final ProviderRegistry registry;
    private final HealthProperties props;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    private final ConcurrentMap<String, Deque<Instant>> failureWindow = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ProviderState> state = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Instant> disabledUntil = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> lastError = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ReentrantLock> probeLocks = new ConcurrentHashMap<>();

    @Autowired
    public ProviderHealthTracker(ProviderCatalog catalog,
                                 ProviderRegistry registry,
                                 HealthProperties props,
                                 ApplicationEventPublisher publisher) {
        this(catalog, registry, props, publisher, Clock.systemUTC());
    }

    ProviderHealthTracker(ProviderCatalog catalog,
                          ProviderRegistry registry,
                          HealthProperties props,
                          ApplicationEventPublisher publisher,
                          Clock clock) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.props = Objects.requireNonNull(props, "props");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.clock = Objects.requireNonNull(clock, "clock");

        for (ProviderConfig config : registry.snapshot().providers()) {
            String name = config.name();
            failureWindow.put(name, new ArrayDeque<>());
            probeLocks.put(name, new ReentrantLock());
            state.put(name, config.enabled() ? ProviderState.HEALTHY : ProviderState.UNCONFIGURED);
        }
        for (String failed : catalog.initializationFailures()) {
            if (state.get(failed) == ProviderState.HEALTHY) {
                lastError.put(failed, "initialization failed");
                disable(failed, "initialization failed");
            }
        }
        LOG.info("Health tracker initialized: {}", state);
    }

    /** Visible for tests */
    ProviderState getState(String provider) {
        return state.get(provider);
    }

    @EventListener
    public void onFailure(ProviderFailureEvent event) {
        String provider = event.provider();
        Deque<Instant> window = failureWindow.get(provider);
        if (window == null) {
            LOG.warn("ProviderFailureEvent for unknown provider: {}", provider);
            return;
        }
        lastError.put(provider, event.message() == null ? "unknown" : event.message());
        ProviderState current = state.get(provider);
        if (current == ProviderState.DISABLED || current == ProviderState.UNCONFIGURED) {
            return;
        }

        if (event.isCredentialFailure()) {
            disable(provider, "credentials rejected (HTTP " + event.statusCode() + ")");
            return;
        }

        int failures;
        synchronized (window) {
            pruneOld(window);
            window.addLast(clock.instant());
            failures = window.size();
        }
        if (failures > props.getMaxFailuresPerWindow()) {
            disable(provider, failures + " failures within " + props.getWindowMinutes() + "m");
        } else {
            state.put(provider, ProviderState.DEGRADED);
            LOG.warn("Provider {} degraded ({} failures in window): {}", provider, failures, event.message());
        }
    }

    @EventListener
    public void onRecovered(ProviderRecoveredEvent event) {
        String provider = event.provider();
        if (state.get(provider) != ProviderState.DEGRADED) {
            return;
        }
        state.put(provider, ProviderState.HEALTHY);
        clearWindow(provider);
        LOG.info("Provider recovered: {}", provider);
    }

    /**
     * Probes disabled providers whose cooldown has elapsed and re-enables those that pass.
     */
    @Scheduled(fixedDelayString = "${diagnosis.health.probe-interval-ms:60000}",
            initialDelayString = "${diagnosis.health.probe-interval-ms:60000}")
    public void probeDisabledProviders() {
        if (!props.isProbeEnabled()) {
            return;
        }
        for (String provider : List.copyOf(state.keySet())) {
            if (state.get(provider) == ProviderState.DISABLED && cooldownElapsed(provider)) {
                probe(provider);
            }
        }
    }

    @Scheduled(fixedRate = 60_000)
    void logHealthSummary() {
        StringBuilder sb = new StringBuilder("Provider states: ");
        state.forEach((name, st) -> sb.append(name).append('=').append(st).append(' '));
        LOG.info(sb.toString().trim());
    }

    public List<ProviderHealthReport> healthReport() {
        List<ProviderHealthReport> reports = new ArrayList<>();
        for (ProviderConfig config : registry.snapshot().providers()) {
            String name = config.name();
            Deque<Instant> window = failureWindow.get(name);
            int failures;
            synchronized (window) {
                pruneOld(window);
                failures = window.size();
            }
            reports.add(new ProviderHealthReport(name, state.get(name), config.enabled(), failures,
                    disabledUntil.get(name), lastError.get(name)));
        }
        return reports;
    }

    private void probe(String provider) {
        ReentrantLock lock = probeLocks.get(provider);
        if (!lock.tryLock()) {
            LOG.debug("Probe already in progress for {}", provider);
            return;
        }
        try {
            DiagnosisProvider instance = catalog.find(provider).orElse(null);
            if (instance == null) {
                return;
            }
            try {
                instance.probe();
            } catch (RuntimeException ex) {
                lastError.put(provider, "probe failed: " + ex.getMessage());
                Instant until = clock.instant().plus(Duration.ofMinutes(props.getCooldownMinutes()));
                disabledUntil.put(provider, until);
                LOG.warn("Probe of {} failed, next attempt after {}: {}", provider, until, ex.getMessage());
                return;
            }
            registry.setEnabled(provider, true);
            state.put(provider, ProviderState.HEALTHY);
            disabledUntil.remove(provider);
            clearWindow(provider);
            publisher.publishEvent(new ProviderRecoveredEvent(provider, clock.instant()));
            LOG.info("Provider {} passed probe and was re-enabled", provider);
        } finally {
            lock.unlock();
        }
    }

    private void disable(String provider, String reason) {
        state.put(provider, ProviderState.DISABLED);
        Instant until = clock.instant().plus(Duration.ofMinutes(props.getCooldownMinutes()));
        disabledUntil.put(provider, until);
        registry.setEnabled(provider, false);
        LOG.error("Provider {} disabled: {}; cooldown until {}", provider, reason, until);
    }

    private boolean cooldownElapsed(String provider) {
        Instant until = disabledUntil.get(provider);
        return until == null || !clock.instant().isBefore(until);
    }

    private void clearWindow(String provider) {
        Deque<Instant> window = failureWindow.get(provider);
        synchronized (window) {
            window.clear();
        }
    }

    private void pruneOld(Deque<Instant> window) {
        Instant cutoff = clock.instant().minus(Duration.ofMinutes(props.getWindowMinutes()));
        while (!window.isEmpty() && window.peekFirst().isBefore(cutoff)) {
            window.removeFirst();
        }
    }
}
