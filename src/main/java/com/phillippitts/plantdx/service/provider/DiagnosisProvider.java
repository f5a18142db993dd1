package com.phillippitts.plantdx.service.provider;

import com.phillippitts.plantdx.domain.ClassificationRequest;
import com.phillippitts.plantdx.domain.ProviderResult;
import com.phillippitts.plantdx.exception.NoPredictionException;
import com.phillippitts.plantdx.exception.ProviderCallException;

/**
 * Contract for plant disease classification providers.
 *
 * <p>Implementations wrap one external service (or the locally hosted model) and translate its
 * response into the canonical {@link ProviderResult}. Calls are blocking; concurrency,
 * timeouts and retries are handled by the caller.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>Provider is constructed from its configuration</li>
 *   <li>{@link #initialize()} prepares resources (a no-op for HTTP providers)</li>
 *   <li>{@link #classify(ClassificationRequest)} is called concurrently by diagnosis requests</li>
 *   <li>{@link #close()} releases resources on shutdown</li>
 * </ol>
 *
 * <p>Thread Safety: implementations must be safe for concurrent {@code classify} calls.
 */
public interface DiagnosisProvider extends AutoCloseable {

    /**
     * Returns the provider name used in configuration, logs and metrics.
     *
     * @return provider name, e.g. {@code "plant_id"}
     */
    String getProviderName();

    /**
     * Classifies the images of one request.
     *
     * @param request normalized images plus optional crop hint
     * @return result with at least one prediction, ordered by descending confidence
     * @throws ProviderCallException if the call fails; {@link ProviderCallException#isRetryable()}
     *                               tells the caller whether another attempt may succeed
     * @throws NoPredictionException if the provider answered but produced nothing usable
     */
    ProviderResult classify(ClassificationRequest request);

    /**
     * Prepares the provider for use.
     *
     * @throws ProviderCallException if the provider cannot be initialized
     */
    default void initialize() {
    }

    /**
     * Checks if the provider is currently able to serve requests.
     */
    default boolean isHealthy() {
        return true;
    }

    /**
     * Cheap availability check used by the health tracker before re-enabling a provider.
     *
     * @throws ProviderCallException if the provider is not available
     */
    default void probe() {
    }

    @Override
    default void close() {
    }
}
