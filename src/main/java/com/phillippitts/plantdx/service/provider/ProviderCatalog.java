package com.phillippitts.plantdx.service.provider;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered set of provider instances, keyed by name.
 *
 * <p>Initializes every provider at startup. A provider that fails to initialize is kept in
 * the catalog and reported through {@link #initializationFailures()} so the health tracker can
 * disable it and retry later.
 */
public class ProviderCatalog {

    private static final Logger LOG = LogManager.getLogger(ProviderCatalog.class);

    private final Map<String, DiagnosisProvider> providers;
    private final Set<String> initializationFailures = Collections.synchronizedSet(new LinkedHashSet<>());

    public ProviderCatalog(List<DiagnosisProvider> providers) {
        Map<String, DiagnosisProvider> byName = new LinkedHashMap<>();
        for (DiagnosisProvider p : providers) {
            if (byName.putIfAbsent(p.getProviderName(), p) != null) {
                throw new IllegalArgumentException("Duplicate provider: " + p.getProviderName());
            }
        }
        this.providers = Collections.unmodifiableMap(byName);
    }

    @PostConstruct
    public void initializeAll() {
        for (Map.Entry<String, DiagnosisProvider> entry : providers.entrySet()) {
            try {
                entry.getValue().initialize();
                LOG.debug("Provider {} initialized", entry.getKey());
            } catch (RuntimeException ex) {
                LOG.error("Failed to initialize provider {} at startup: {}", entry.getKey(), ex.getMessage());
                initializationFailures.add(entry.getKey());
            }
        }
    }

    @PreDestroy
    public void closeAll() {
        for (Map.Entry<String, DiagnosisProvider> entry : providers.entrySet()) {
            try {
                entry.getValue().close();
            } catch (RuntimeException ex) {
                LOG.warn("Error closing provider {}: {}", entry.getKey(), ex.toString());
            }
        }
    }

    public Optional<DiagnosisProvider> find(String name) {
        return Optional.ofNullable(providers.get(name));
    }

    public List<DiagnosisProvider> all() {
        return List.copyOf(providers.values());
    }

    public Set<String> names() {
        return providers.keySet();
    }

    public Set<String> initializationFailures() {
        synchronized (initializationFailures) {
            return Set.copyOf(initializationFailures);
        }
    }
}
