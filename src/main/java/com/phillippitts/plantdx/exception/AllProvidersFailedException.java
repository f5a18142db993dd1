package com.phillippitts.plantdx.exception;

import com.phillippitts.plantdx.domain.ProviderError;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when no provider produced a usable result for a diagnosis request.
 *
 * <p>The message names every provider tried and why it failed. In primary-with-fallback
 * mode the primary's error comes first and is also the exception cause.
 */
public class AllProvidersFailedException extends PlantDxException {

    private final List<ProviderError> errors;

    public AllProvidersFailedException(String message, List<ProviderError> errors) {
        this(message, errors, null);
    }

    public AllProvidersFailedException(String message, List<ProviderError> errors, Throwable cause) {
        super(describe(message, errors), cause);
        this.errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public List<ProviderError> getErrors() {
        return errors;
    }

    public List<String> getProvidersTried() {
        return errors.stream().map(ProviderError::provider).toList();
    }

    private static String describe(String message, List<ProviderError> errors) {
        if (errors == null || errors.isEmpty()) {
            return message;
        }
        return message + ": " + errors.stream()
                .map(e -> e.provider() + "=" + e.message())
                .collect(Collectors.joining("; "));
    }
}
