package com.phillippitts.plantdx.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for constructing {@link ProviderCallException} with contextual details.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * throw ProviderCallExceptionBuilder.create("Provider returned HTTP error")
 *         .provider("plant_id")
 *         .statusCode(503)
 *         .retryable(true)
 *         .metadata("url", url)
 *         .build();
 *
 * throw ProviderCallExceptionBuilder.create("Attempt timed out")
 *         .provider("huggingface")
 *         .retryable(true)
 *         .durationMs(10000)
 *         .cause(timeoutException)
 *         .build();
 * </pre>
 *
 * <p>The final message format is:
 * <pre>
 * {message} (statusCode={code}, durationMs={ms}, {key1}={val1}, ...)
 * </pre>
 */
public final class ProviderCallExceptionBuilder {

    private final String message;
    private String provider;
    private boolean retryable;
    private Throwable cause;
    private Integer statusCode;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private ProviderCallExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static ProviderCallExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new ProviderCallExceptionBuilder(message);
    }

    public ProviderCallExceptionBuilder provider(String provider) {
        this.provider = provider;
        return this;
    }

    public ProviderCallExceptionBuilder retryable(boolean retryable) {
        this.retryable = retryable;
        return this;
    }

    public ProviderCallExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public ProviderCallExceptionBuilder statusCode(int statusCode) {
        this.statusCode = statusCode;
        return this;
    }

    public ProviderCallExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are ignored.
     * Never pass credentials here; the message ends up in logs.
     */
    public ProviderCallExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    public ProviderCallException build() {
        String name = provider != null ? provider : "unknown";
        int status = statusCode != null ? statusCode : 0;
        return new ProviderCallException(buildDetailedMessage(), name, retryable, status, cause);
    }

    private String buildDetailedMessage() {
        boolean hasDetails = statusCode != null || durationMs != null || !metadata.isEmpty();
        if (!hasDetails) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;

        if (statusCode != null) {
            sb.append("statusCode=").append(statusCode);
            first = false;
        }

        if (durationMs != null) {
            if (!first) {
                sb.append(", ");
            }
            sb.append("durationMs=").append(durationMs);
            first = false;
        }

        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }

        sb.append(")");
        return sb.toString();
    }
}
