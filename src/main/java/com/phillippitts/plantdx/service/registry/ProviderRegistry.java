package com.phillippitts.plantdx.service.registry;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * Holds the provider configuration as an immutable {@link Snapshot} that is swapped atomically.
 *
 * <p>Readers call {@link #snapshot()} and never block. Writers ({@link #setEnabled} and
 * {@link #updateConfidenceThreshold}) build a new snapshot under a lock held only for the
 * duration of the swap, so concurrent requests always see a consistent view.
 *
 * <p>Provider order is the registration order and is used wherever results must be
 * deterministic (ensemble dispatch and consensus tie-breaking).
 */
public final class ProviderRegistry {

    private static final Logger LOG = LogManager.getLogger(ProviderRegistry.class);

    /**
     * Immutable view of all provider configurations plus the global confidence threshold.
     */
    public record Snapshot(List<ProviderConfig> providers, double globalConfidenceThreshold) {
        public Snapshot {
            providers = List.copyOf(providers);
        }

        public Optional<ProviderConfig> find(String name) {
            return providers.stream().filter(p -> p.name().equals(name)).findFirst();
        }

        public List<ProviderConfig> enabledProviders() {
            return providers.stream().filter(ProviderConfig::enabled).toList();
        }
    }

    private final AtomicReference<Snapshot> current;
    private final ReentrantLock writeLock = new ReentrantLock();

    public ProviderRegistry(List<ProviderConfig> providers, double globalConfidenceThreshold) {
        Objects.requireNonNull(providers, "providers");
        Set<String> names = new LinkedHashSet<>();
        for (ProviderConfig p : providers) {
            if (!names.add(p.name())) {
                throw new IllegalArgumentException("Duplicate provider: " + p.name());
            }
        }
        validateThreshold(globalConfidenceThreshold);
        this.current = new AtomicReference<>(new Snapshot(providers, globalConfidenceThreshold));
    }

    public Snapshot snapshot() {
        return current.get();
    }

    public Optional<ProviderConfig> find(String name) {
        return snapshot().find(name);
    }

    public List<ProviderConfig> enabledProviders() {
        return snapshot().enabledProviders();
    }

    public boolean isEnabled(String name) {
        return find(name).map(ProviderConfig::enabled).orElse(false);
    }

    public double globalConfidenceThreshold() {
        return snapshot().globalConfidenceThreshold();
    }

    /**
     * Flips the enablement flag of one provider.
     *
     * @return true if the flag changed
     * @throws IllegalArgumentException if the provider is unknown
     */
    public boolean setEnabled(String name, boolean enabled) {
        writeLock.lock();
        try {
            Snapshot snap = current.get();
            ProviderConfig existing = snap.find(name)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown provider: " + name));
            if (existing.enabled() == enabled) {
                return false;
            }
            current.set(new Snapshot(replace(snap.providers(), name, p -> p.withEnabled(enabled)),
                    snap.globalConfidenceThreshold()));
            LOG.info("Provider {} {}", name, enabled ? "enabled" : "disabled");
            return true;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Sets the global threshold and every provider's declared threshold.
     *
     * @throws IllegalArgumentException if threshold is outside [0, 1]
     */
    public void updateConfidenceThreshold(double threshold) {
        validateThreshold(threshold);
        writeLock.lock();
        try {
            Snapshot snap = current.get();
            List<ProviderConfig> updated = snap.providers().stream()
                    .map(p -> p.withConfidenceThreshold(threshold))
                    .toList();
            current.set(new Snapshot(updated, threshold));
        } finally {
            writeLock.unlock();
        }
        LOG.info("Updated confidence threshold to {}", threshold);
    }

    private static List<ProviderConfig> replace(List<ProviderConfig> providers, String name,
                                                UnaryOperator<ProviderConfig> change) {
        List<ProviderConfig> copy = new ArrayList<>(providers.size());
        for (ProviderConfig p : providers) {
            copy.add(p.name().equals(name) ? change.apply(p) : p);
        }
        return copy;
    }

    private static void validateThreshold(double threshold) {
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("Confidence threshold must be between 0 and 1, got: " + threshold);
        }
    }
}
