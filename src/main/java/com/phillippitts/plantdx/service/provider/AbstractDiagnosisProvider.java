package com.phillippitts.plantdx.service.provider;

import com.phillippitts.plantdx.exception.ProviderCallException;
import com.phillippitts.plantdx.service.registry.ProviderConfig;

import java.util.Objects;

/**
 * Base class for providers, managing the initialize/close lifecycle.
 *
 * <p>Template Method: subclasses implement {@link #doInitialize()} and {@link #doClose()}; this
 * class guarantees both run at most once per lifecycle and under a lock. Both
 * {@link #initialize()} and {@link #close()} are idempotent. A closed provider may be
 * initialized again, which is how the health tracker recovers a provider whose resources
 * failed to load.
 */
public abstract class AbstractDiagnosisProvider implements DiagnosisProvider {

    /**
     * Guards {@link #initialized}.
     */
    protected final Object lock = new Object();

    protected final ProviderConfig config;

    private boolean initialized = false;

    protected AbstractDiagnosisProvider(ProviderConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public String getProviderName() {
        return config.name();
    }

    @Override
    public final void initialize() {
        synchronized (lock) {
            if (initialized) {
                return;
            }
            doInitialize();
            initialized = true;
        }
    }

    /**
     * Provider-specific initialization. Called under {@link #lock}.
     *
     * @throws ProviderCallException if initialization fails
     */
    protected void doInitialize() {
    }

    @Override
    public final boolean isHealthy() {
        synchronized (lock) {
            return initialized;
        }
    }

    @Override
    public final void close() {
        synchronized (lock) {
            if (!initialized) {
                return;
            }
            doClose();
            initialized = false;
        }
    }

    /**
     * Provider-specific cleanup. Called under {@link #lock}; should log instead of throwing.
     */
    protected void doClose() {
    }

    /**
     * Fails the call when the provider is not initialized.
     *
     * @throws ProviderCallException (non-retryable) if not initialized
     */
    protected final void ensureInitialized() {
        synchronized (lock) {
            if (!initialized) {
                throw new ProviderCallException("Provider not initialized", getProviderName(), false);
            }
        }
    }

    /**
     * Fails the probe when the provider has no credentials configured.
     */
    protected final void requireApiKey() {
        if (!config.hasApiKey()) {
            throw new ProviderCallException("No API key configured", getProviderName(), false);
        }
    }
}
