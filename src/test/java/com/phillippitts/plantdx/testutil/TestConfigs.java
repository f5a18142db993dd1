package com.phillippitts.plantdx.testutil;

import com.phillippitts.plantdx.service.registry.ProviderConfig;

import java.time.Duration;
import java.util.Map;

/**
 * Provider configs for tests.
 */
public final class TestConfigs {

    private TestConfigs() {
    }

    public static ProviderConfig enabled(String name) {
        return config(name, true, Duration.ofSeconds(2));
    }

    public static ProviderConfig disabled(String name) {
        return config(name, false, Duration.ofSeconds(2));
    }

    public static ProviderConfig config(String name, boolean enabled, Duration timeout) {
        return new ProviderConfig(name, enabled, "test-key", "http://localhost/" + name, timeout, 0.7, 0, Map.of());
    }

    public static ProviderConfig withUrl(String name, String url, Map<String, String> options) {
        return new ProviderConfig(name, true, "test-key", url, Duration.ofSeconds(2), 0.7, 0, options);
    }
}
