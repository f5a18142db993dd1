package com.phillippitts.plantdx.exception;

/**
 * Thrown when a provider or the consensus engine produced an empty prediction set.
 * An empty answer is a failure, never an implicit "healthy" verdict.
 */
public class NoPredictionException extends ProviderCallException {

    public NoPredictionException(String message, String provider) {
        super(message, provider, false);
    }
}
