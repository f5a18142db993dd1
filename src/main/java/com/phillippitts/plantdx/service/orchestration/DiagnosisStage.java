package com.phillippitts.plantdx.service.orchestration;

/**
 * Stages of one diagnosis request.
 */
public enum DiagnosisStage {
    IDLE,
    PREPROCESSING,
    DISPATCHING,
    /** Ensemble mode: waiting for every dispatched call to settle. */
    COLLECTING,
    /** Primary mode: primary failed, was disabled or fell below threshold. */
    FALLBACK_PROBING,
    FINALIZING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
