package com.phillippitts.plantdx.service.orchestration;

import com.phillippitts.plantdx.domain.DiagnosisMode;
import com.phillippitts.plantdx.domain.DiagnosisResult;

import java.util.List;

/**
 * Entry point of the diagnosis core: images in, one diagnosis out.
 */
public interface DiagnosisOrchestrator {

    /**
     * Diagnoses plant images.
     *
     * @param images   raw image bytes (at least one)
     * @param cropHint optional crop name, may be null
     * @param mode     primary-with-fallback or ensemble
     * @return the diagnosis with provenance
     * @throws com.phillippitts.plantdx.exception.InvalidImageException       if an image is unusable
     * @throws com.phillippitts.plantdx.exception.AllProvidersFailedException if no provider produced a result
     * @throws com.phillippitts.plantdx.exception.DiagnosisTimeoutException   if the request deadline passed
     */
    DiagnosisResult diagnose(List<byte[]> images, String cropHint, DiagnosisMode mode);

    /**
     * Diagnoses using the configured default mode.
     */
    DiagnosisResult diagnose(List<byte[]> images, String cropHint);
}
