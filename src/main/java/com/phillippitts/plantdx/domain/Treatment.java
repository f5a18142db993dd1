package com.phillippitts.plantdx.domain;

import java.util.List;

/**
 * Treatment recommendations grouped by category. Any list may be empty.
 */
public record Treatment(
        List<String> chemical,
        List<String> biological,
        List<String> organic,
        List<String> prevention
) {
    public static final Treatment NONE = new Treatment(List.of(), List.of(), List.of(), List.of());

    public Treatment {
        chemical = chemical == null ? List.of() : List.copyOf(chemical);
        biological = biological == null ? List.of() : List.copyOf(biological);
        organic = organic == null ? List.of() : List.copyOf(organic);
        prevention = prevention == null ? List.of() : List.copyOf(prevention);
    }

    public boolean isEmpty() {
        return chemical.isEmpty() && biological.isEmpty() && organic.isEmpty() && prevention.isEmpty();
    }
}
