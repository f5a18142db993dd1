package com.phillippitts.plantdx.service.retry;

import com.phillippitts.plantdx.exception.ProviderCallException;
import com.phillippitts.plantdx.exception.ProviderCallExceptionBuilder;
import com.phillippitts.plantdx.util.TimeUtils;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs provider calls with a per-attempt timeout and exponential backoff between attempts.
 *
 * <p>Backoff and attempt counting are delegated to one Resilience4j {@link Retry} per provider.
 * Each attempt is submitted to the provider-call executor and awaited for at most the given
 * timeout; an attempt that overruns is cancelled with interruption and counts as a retryable
 * failure. Only retryable {@link ProviderCallException}s lead to another attempt. Interrupting
 * the calling thread cancels the in-flight attempt and stops retrying.
 */
public class RetryingCallExecutor {

    private static final Logger LOG = LogManager.getLogger(RetryingCallExecutor.class);

    private final AsyncTaskExecutor callExecutor;
    private final RetryPolicy policy;
    private final RetryRegistry retryRegistry;

    public RetryingCallExecutor(AsyncTaskExecutor callExecutor, RetryPolicy policy) {
        this.callExecutor = Objects.requireNonNull(callExecutor, "callExecutor");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.retryRegistry = RetryRegistry.of(policy.toRetryConfig(RetryingCallExecutor::shouldRetry));
        this.retryRegistry.getEventPublisher().onEntryAdded(event -> logRetries(event.getAddedEntry()));
    }

    public RetryPolicy policy() {
        return policy;
    }

    /** The retry instance used for a provider, created on first use. */
    public Retry retryFor(String provider) {
        return retryRegistry.retry(provider);
    }

    /**
     * Executes the call, retrying retryable failures.
     *
     * @param provider provider name for error context
     * @param timeout  per-attempt timeout
     * @param call     the blocking provider call
     * @return the first successful result
     * @throws ProviderCallException the last failure when attempts are exhausted, the first
     *                               non-retryable failure, or an interruption
     */
    public <T> T execute(String provider, Duration timeout, Callable<T> call) {
        Objects.requireNonNull(call, "call");
        Callable<T> retrying = Retry.decorateCallable(retryFor(provider), () -> runAttempt(provider, timeout, call));
        try {
            return retrying.call();
        } catch (ProviderCallException e) {
            if (e.isRetryable() && Thread.currentThread().isInterrupted()) {
                throw new ProviderCallException("Interrupted during backoff", provider, false, e);
            }
            throw e;
        } catch (Exception e) {
            throw new ProviderCallException("Unexpected retry failure: " + e, provider, false, e);
        }
    }

    private static boolean shouldRetry(Throwable failure) {
        return failure instanceof ProviderCallException pce
                && pce.isRetryable()
                && !Thread.currentThread().isInterrupted();
    }

    private static void logRetries(Retry retry) {
        retry.getEventPublisher().onRetry(event -> LOG.warn("Call to {} failed (attempt {}), retrying in {} ms: {}",
                event.getName(), event.getNumberOfRetryAttempts(), event.getWaitInterval().toMillis(),
                event.getLastThrowable() == null ? "" : event.getLastThrowable().getMessage()));
    }

    private <T> T runAttempt(String provider, Duration timeout, Callable<T> call) {
        long t0 = System.nanoTime();
        Future<T> future;
        try {
            future = callExecutor.submit(call);
        } catch (TaskRejectedException e) {
            throw ProviderCallExceptionBuilder.create("Provider call capacity exhausted")
                    .provider(provider)
                    .retryable(true)
                    .cause(e)
                    .build();
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw ProviderCallExceptionBuilder.create("Attempt timed out")
                    .provider(provider)
                    .retryable(true)
                    .durationMs(TimeUtils.elapsedMillis(t0))
                    .cause(e)
                    .build();
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ProviderCallException("Interrupted while waiting for provider", provider, false, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ProviderCallException pce) {
                throw pce;
            }
            LOG.error("{} unexpected error", provider, cause);
            throw new ProviderCallException("Unexpected provider error: " + cause, provider, false, cause);
        }
    }
}
