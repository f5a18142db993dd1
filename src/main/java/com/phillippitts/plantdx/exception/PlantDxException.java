package com.phillippitts.plantdx.exception;

/**
 * Base exception for all PlantDx application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class PlantDxException extends RuntimeException {

    public PlantDxException(String message) {
        super(message);
    }

    public PlantDxException(String message, Throwable cause) {
        super(message, cause);
    }

    public PlantDxException(Throwable cause) {
        super(cause);
    }
}
