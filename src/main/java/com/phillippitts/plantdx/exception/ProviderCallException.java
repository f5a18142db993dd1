package com.phillippitts.plantdx.exception;

/**
 * Thrown when a call to a diagnosis provider fails.
 *
 * <p>The {@code retryable} flag drives the retry executor: timeouts, 5xx and rate-limit
 * responses are retryable; bad credentials, malformed requests and unsupported media are not.
 * {@code statusCode} is the HTTP status when one was received, otherwise {@code 0}.
 */
public class ProviderCallException extends PlantDxException {

    private final String provider;
    private final boolean retryable;
    private final int statusCode;

    public ProviderCallException(String message, String provider, boolean retryable) {
        this(message, provider, retryable, 0, null);
    }

    public ProviderCallException(String message, String provider, boolean retryable, Throwable cause) {
        this(message, provider, retryable, 0, cause);
    }

    public ProviderCallException(String message, String provider, boolean retryable, int statusCode, Throwable cause) {
        super(message + " (provider: " + provider + ")", cause);
        this.provider = provider;
        this.retryable = retryable;
        this.statusCode = statusCode;
    }

    public String getProvider() {
        return provider;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public int getStatusCode() {
        return statusCode;
    }

    /**
     * Returns true when the provider rejected our credentials (HTTP 401/403).
     */
    public boolean isCredentialFailure() {
        return statusCode == 401 || statusCode == 403;
    }
}
