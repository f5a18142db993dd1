package com.phillippitts.plantdx.domain;

/**
 * Orchestration mode for a diagnosis request.
 */
public enum DiagnosisMode {
    /** Query the primary provider; fall back to the secondary on failure or low confidence. */
    PRIMARY,
    /** Query every enabled provider concurrently and combine their opinions. */
    ENSEMBLE
}
