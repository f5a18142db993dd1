package com.phillippitts.plantdx.domain;

import java.util.List;
import java.util.Objects;

/**
 * A group of treatment steps of one category with its default schedule.
 */
public record TreatmentStep(
        TreatmentType type,
        List<String> steps,
        String duration,
        String frequency
) {
    public TreatmentStep {
        Objects.requireNonNull(type, "type");
        steps = steps == null ? List.of() : List.copyOf(steps);
        Objects.requireNonNull(duration, "duration");
        Objects.requireNonNull(frequency, "frequency");
    }
}
