package com.phillippitts.plantdx.service.orchestration.event;

import com.phillippitts.plantdx.domain.DiagnosisMode;
import com.phillippitts.plantdx.domain.DiagnosisResult;

import java.time.Instant;
import java.util.List;

/**
 * Emitted when a diagnosis completes successfully.
 *
 * @param result        the diagnosis
 * @param timestamp     when the diagnosis completed
 * @param mode          orchestration mode used
 * @param providersUsed providers whose results contributed
 */
public record DiagnosisCompletedEvent(
        DiagnosisResult result,
        Instant timestamp,
        DiagnosisMode mode,
        List<String> providersUsed
) {
    public DiagnosisCompletedEvent {
        providersUsed = providersUsed == null ? List.of() : List.copyOf(providersUsed);
    }
}
