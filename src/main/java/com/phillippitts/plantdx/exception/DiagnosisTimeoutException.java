package com.phillippitts.plantdx.exception;

import com.phillippitts.plantdx.domain.ProviderError;

import java.util.List;

/**
 * Thrown when a whole diagnosis request exceeds its deadline. Pending provider calls are
 * cancelled and any results already collected are discarded.
 */
public class DiagnosisTimeoutException extends PlantDxException {

    private final long timeoutMs;
    private final List<String> pendingProviders;
    private final List<ProviderError> errors;

    public DiagnosisTimeoutException(long timeoutMs, List<String> pendingProviders, List<ProviderError> errors) {
        super("Diagnosis timed out after " + timeoutMs + " ms; pending providers=" + pendingProviders
                + ", failed providers=" + (errors == null ? List.of() : errors.stream().map(ProviderError::provider).toList()));
        this.timeoutMs = timeoutMs;
        this.pendingProviders = pendingProviders == null ? List.of() : List.copyOf(pendingProviders);
        this.errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public List<String> getPendingProviders() {
        return pendingProviders;
    }

    public List<ProviderError> getErrors() {
        return errors;
    }
}
