package com.phillippitts.plantdx.service.health;

/**
 * Health state of a provider as tracked by {@link ProviderHealthTracker}.
 */
public enum ProviderState {
    /** Serving requests normally. */
    HEALTHY,
    /** Recent failures within the window, still enabled. */
    DEGRADED,
    /** Disabled after too many failures or rejected credentials; probed after cooldown. */
    DISABLED,
    /** Disabled by configuration (no credentials or model); never probed. */
    UNCONFIGURED
}
