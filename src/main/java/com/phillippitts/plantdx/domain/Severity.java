package com.phillippitts.plantdx.domain;

import java.util.Locale;

/**
 * Disease severity as reported to the platform.
 */
public enum Severity {
    LOW, MEDIUM, HIGH, CRITICAL;

    /**
     * Documented default for providers that cannot express severity:
     * confidence &ge; 0.9 is HIGH, &ge; 0.7 MEDIUM, &ge; 0.5 LOW, anything lower CRITICAL.
     *
     * @param confidence confidence score in [0,1]
     * @return severity bucket
     */
    public static Severity fromConfidence(double confidence) {
        if (confidence >= 0.9) {
            return HIGH;
        }
        if (confidence >= 0.7) {
            return MEDIUM;
        }
        if (confidence >= 0.5) {
            return LOW;
        }
        return CRITICAL;
    }

    /** Lower-case wire name, e.g. {@code "medium"}. */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
