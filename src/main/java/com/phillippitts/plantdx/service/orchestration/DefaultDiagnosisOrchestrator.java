package com.phillippitts.plantdx.service.orchestration;

import com.phillippitts.plantdx.config.properties.DiagnosisProperties;
import com.phillippitts.plantdx.domain.ClassificationRequest;
import com.phillippitts.plantdx.domain.DiagnosisMode;
import com.phillippitts.plantdx.domain.DiagnosisProvenance;
import com.phillippitts.plantdx.domain.DiagnosisResult;
import com.phillippitts.plantdx.domain.EnsembleResult;
import com.phillippitts.plantdx.domain.NormalizedImage;
import com.phillippitts.plantdx.domain.ProviderError;
import com.phillippitts.plantdx.domain.ProviderResult;
import com.phillippitts.plantdx.exception.AllProvidersFailedException;
import com.phillippitts.plantdx.exception.DiagnosisTimeoutException;
import com.phillippitts.plantdx.exception.InvalidImageException;
import com.phillippitts.plantdx.exception.PlantDxException;
import com.phillippitts.plantdx.exception.ProviderCallException;
import com.phillippitts.plantdx.exception.ProviderCallExceptionBuilder;
import com.phillippitts.plantdx.service.consensus.ConsensusEngine;
import com.phillippitts.plantdx.service.image.ImagePreprocessor;
import com.phillippitts.plantdx.service.metrics.DiagnosisMetricsPublisher;
import com.phillippitts.plantdx.service.orchestration.event.DiagnosisCompletedEvent;
import com.phillippitts.plantdx.service.registry.ProviderConfig;
import com.phillippitts.plantdx.service.registry.ProviderRegistry;
import com.phillippitts.plantdx.service.translate.DiagnosisResultTranslator;
import com.phillippitts.plantdx.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Default diagnosis pipeline: preprocess, dispatch to providers, combine or select, translate.
 *
 * <p><b>Primary-with-fallback:</b> the primary provider is called first; a result at or above
 * the global confidence threshold is final. Otherwise (failure, disabled primary, or low
 * confidence) the fallback provider is consulted and its result is final whatever its
 * confidence. When the primary succeeded below threshold and the fallback fails, the primary's
 * result is returned. When both fail, the primary's error is surfaced first.
 *
 * <p><b>Ensemble:</b> every enabled provider is called concurrently; the request waits for all
 * calls to settle, then the successful results, in registry order, go to the
 * {@link ConsensusEngine}.
 *
 * <p>The whole request is bounded by {@code diagnosis.request-timeout-ms}. On expiry, pending
 * provider calls are cancelled and {@link DiagnosisTimeoutException} is thrown; results that
 * already arrived are discarded. Provider calls only ever run on the dispatch executor; a call
 * the executor rejects is recorded as that provider's retryable error.
 *
 * <p>Not annotated as {@code @Component}; see
 * {@link com.phillippitts.plantdx.config.OrchestrationConfig} for bean wiring.
 */
public class DefaultDiagnosisOrchestrator implements DiagnosisOrchestrator {

    private static final Logger LOG = LogManager.getLogger(DefaultDiagnosisOrchestrator.class);

    static final String DIAGNOSIS_ID_KEY = "diagnosisId";

    private final ImagePreprocessor preprocessor;
    private final ProviderRegistry registry;
    private final ProviderCallRunner callRunner;
    private final ConsensusEngine consensusEngine;
    private final DiagnosisResultTranslator translator;
    private final DiagnosisProperties props;
    private final AsyncTaskExecutor dispatchExecutor;
    private final ApplicationEventPublisher publisher;
    private final DiagnosisMetricsPublisher metrics;

    // CHECKSTYLE.OFF: ParameterNumber - Package-private constructor only used by builder
    DefaultDiagnosisOrchestrator(ImagePreprocessor preprocessor,
                                 ProviderRegistry registry,
                                 ProviderCallRunner callRunner,
                                 ConsensusEngine consensusEngine,
                                 DiagnosisResultTranslator translator,
                                 DiagnosisProperties props,
                                 AsyncTaskExecutor dispatchExecutor,
                                 ApplicationEventPublisher publisher,
                                 DiagnosisMetricsPublisher metrics) {
        this.preprocessor = Objects.requireNonNull(preprocessor, "preprocessor");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.callRunner = Objects.requireNonNull(callRunner, "callRunner");
        this.consensusEngine = Objects.requireNonNull(consensusEngine, "consensusEngine");
        this.translator = Objects.requireNonNull(translator, "translator");
        this.props = Objects.requireNonNull(props, "props");
        this.dispatchExecutor = Objects.requireNonNull(dispatchExecutor, "dispatchExecutor");
        this.publisher = publisher;
        this.metrics = metrics == null ? DiagnosisMetricsPublisher.NOOP : metrics;
    }
    // CHECKSTYLE.ON: ParameterNumber

    @Override
    public DiagnosisResult diagnose(List<byte[]> images, String cropHint) {
        return diagnose(images, cropHint, props.getDefaultMode());
    }

    @Override
    public DiagnosisResult diagnose(List<byte[]> images, String cropHint, DiagnosisMode mode) {
        Objects.requireNonNull(mode, "mode");
        String previousId = ThreadContext.get(DIAGNOSIS_ID_KEY);
        ThreadContext.put(DIAGNOSIS_ID_KEY, UUID.randomUUID().toString());
        long t0 = System.nanoTime();
        long deadline = TimeUtils.deadlineNanos(t0, props.getRequestTimeoutMs());
        DiagnosisStateMachine state = new DiagnosisStateMachine();
        String modeTag = mode.name().toLowerCase(Locale.ROOT);
        try {
            state.transitionTo(DiagnosisStage.PREPROCESSING);
            List<NormalizedImage> normalized = preprocessor.preprocessAll(images);
            ClassificationRequest request = new ClassificationRequest(normalized, cropHint);

            state.transitionTo(DiagnosisStage.DISPATCHING);
            LOG.info("Diagnosis started: mode={}, images={}, cropHint={}", mode, normalized.size(), cropHint);
            DiagnosisResult result = mode == DiagnosisMode.ENSEMBLE
                    ? runEnsemble(request, state, t0, deadline)
                    : runPrimary(request, state, t0, deadline);
            state.transitionTo(DiagnosisStage.DONE);

            metrics.recordDiagnosis(modeTag, System.nanoTime() - t0, "success");
            publish(result, mode);
            LOG.info("Diagnosis completed: disease={}, confidence={}, providers={}, {} ms",
                    result.diseaseId(), String.format("%.3f", result.confidence()),
                    result.provenance().providersUsed(), result.provenance().totalProcessingTimeMs());
            return result;
        } catch (InvalidImageException e) {
            state.fail();
            metrics.recordDiagnosis(modeTag, System.nanoTime() - t0, "invalid_image");
            LOG.warn("Diagnosis rejected: {}", e.getMessage());
            throw e;
        } catch (DiagnosisTimeoutException e) {
            state.fail();
            metrics.recordDiagnosis(modeTag, System.nanoTime() - t0, "timeout");
            LOG.error("Diagnosis failed: {}", e.getMessage());
            throw e;
        } catch (PlantDxException e) {
            state.fail();
            metrics.recordDiagnosis(modeTag, System.nanoTime() - t0, "failure");
            LOG.error("Diagnosis failed: {}", e.getMessage());
            throw e;
        } finally {
            if (previousId == null) {
                ThreadContext.remove(DIAGNOSIS_ID_KEY);
            } else {
                ThreadContext.put(DIAGNOSIS_ID_KEY, previousId);
            }
        }
    }

    private DiagnosisResult runPrimary(ClassificationRequest request, DiagnosisStateMachine state,
                                       long t0, long deadline) {
        List<ProviderError> errors = Collections.synchronizedList(new ArrayList<>());
        AtomicReference<String> pending = new AtomicReference<>(props.getPrimaryProvider());

        Future<ProviderResult> chain;
        try {
            chain = dispatchExecutor.submit(() -> primaryChain(request, state, errors, pending));
        } catch (TaskRejectedException e) {
            ProviderCallException rejected = rejected(props.getPrimaryProvider(), e);
            throw new AllProvidersFailedException("All providers failed",
                    List.of(ProviderError.from(props.getPrimaryProvider(), rejected)), rejected);
        }
        ProviderResult selected = await(chain, deadline, () -> List.of(pending.get()), errors);

        state.transitionTo(DiagnosisStage.FINALIZING);
        DiagnosisProvenance provenance = new DiagnosisProvenance(DiagnosisMode.PRIMARY,
                List.of(selected.provider()), snapshot(errors), null, TimeUtils.elapsedMillis(t0));
        return translator.translate(selected, provenance);
    }

    private ProviderResult primaryChain(ClassificationRequest request, DiagnosisStateMachine state,
                                        List<ProviderError> errors, AtomicReference<String> pending) {
        String primary = props.getPrimaryProvider();
        String fallback = props.getFallbackProvider();
        ProviderResult primaryResult = null;
        ProviderCallException primaryError = null;

        if (registry.isEnabled(primary)) {
            try {
                primaryResult = callRunner.call(primary, request);
            } catch (ProviderCallException e) {
                if (Thread.currentThread().isInterrupted()) {
                    // request deadline passed; the caller has already given up
                    throw e;
                }
                primaryError = e;
                errors.add(ProviderError.from(primary, e));
            }
        } else {
            primaryError = new ProviderCallException("Provider not configured or disabled", primary, false);
            errors.add(ProviderError.from(primary, primaryError));
        }

        double threshold = registry.globalConfidenceThreshold();
        if (primaryResult != null && primaryResult.confidence() >= threshold) {
            return primaryResult;
        }

        String reason = primaryResult == null ? "primary_failed" : "low_confidence";
        if (fallback == null || fallback.isBlank() || fallback.equals(primary)) {
            return settle(primaryResult, primaryError, errors);
        }
        if (!registry.isEnabled(fallback)) {
            errors.add(ProviderError.from(fallback,
                    new ProviderCallException("Provider not configured or disabled", fallback, false)));
            return settle(primaryResult, primaryError, errors);
        }

        if (!state.transitionIfActive(DiagnosisStage.FALLBACK_PROBING)) {
            LOG.debug("Request already finished, not consulting fallback {}", fallback);
            return settle(primaryResult, primaryError, errors);
        }
        if (primaryResult != null) {
            LOG.info("Primary {} confidence {} below threshold {}, consulting fallback {}",
                    primary, primaryResult.confidence(), threshold, fallback);
        } else {
            LOG.info("Primary {} unavailable, consulting fallback {}", primary, fallback);
        }
        metrics.recordFallback(reason);
        pending.set(fallback);
        try {
            return callRunner.call(fallback, request);
        } catch (ProviderCallException e) {
            errors.add(ProviderError.from(fallback, e));
            return settle(primaryResult, primaryError, errors);
        }
    }

    /** Low-confidence primary beats no result; otherwise everything failed. */
    private static ProviderResult settle(ProviderResult primaryResult, ProviderCallException primaryError,
                                         List<ProviderError> errors) {
        if (primaryResult != null) {
            return primaryResult;
        }
        throw new AllProvidersFailedException("All providers failed", snapshot(errors), primaryError);
    }

    private DiagnosisResult runEnsemble(ClassificationRequest request, DiagnosisStateMachine state,
                                        long t0, long deadline) {
        List<ProviderConfig> enabled = registry.enabledProviders();
        if (enabled.isEmpty()) {
            throw new AllProvidersFailedException("No providers available", List.of());
        }

        List<String> names = enabled.stream().map(ProviderConfig::name).toList();
        List<Future<ProviderResult>> futures = new ArrayList<>(names.size());
        for (String name : names) {
            try {
                futures.add(dispatchExecutor.submit(() -> callRunner.call(name, request)));
            } catch (TaskRejectedException e) {
                futures.add(CompletableFuture.failedFuture(rejected(name, e)));
            }
        }
        state.transitionTo(DiagnosisStage.COLLECTING);

        List<ProviderResult> results = new ArrayList<>();
        List<ProviderError> errors = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            String name = names.get(i);
            try {
                results.add(futures.get(i).get(TimeUtils.remainingNanos(deadline), TimeUnit.NANOSECONDS));
            } catch (TimeoutException e) {
                throw timeout(names, futures, errors, i);
            } catch (InterruptedException e) {
                futures.forEach(f -> f.cancel(true));
                Thread.currentThread().interrupt();
                throw new PlantDxException("Diagnosis interrupted", e);
            } catch (ExecutionException e) {
                errors.add(ProviderError.from(name, e.getCause()));
            }
        }

        if (results.isEmpty()) {
            throw new AllProvidersFailedException("All providers failed", errors,
                    errors.isEmpty() ? null : firstCause(futures));
        }

        state.transitionTo(DiagnosisStage.FINALIZING);
        EnsembleResult ensemble = consensusEngine.combine(results);
        if (ensemble.consensus().conflictingPredictions()) {
            metrics.recordConflict();
        }
        DiagnosisProvenance provenance = new DiagnosisProvenance(DiagnosisMode.ENSEMBLE,
                ensemble.metadata().modelsUsed(), errors, ensemble.consensus(), TimeUtils.elapsedMillis(t0));
        return translator.translate(ensemble, provenance);
    }

    private static ProviderCallException rejected(String provider, TaskRejectedException e) {
        LOG.warn("Dispatch capacity exhausted, {} not called", provider);
        return ProviderCallExceptionBuilder.create("Dispatch capacity exhausted")
                .provider(provider)
                .retryable(true)
                .cause(e)
                .build();
    }

    /**
     * Cancels every unfinished call and builds the timeout error. Calls that already failed are
     * reported as errors; calls that already succeeded are discarded.
     */
    private DiagnosisTimeoutException timeout(List<String> names, List<Future<ProviderResult>> futures,
                                              List<ProviderError> errors, int from) {
        List<String> pendingNames = new ArrayList<>();
        List<ProviderError> allErrors = new ArrayList<>(errors);
        for (int j = from; j < futures.size(); j++) {
            Future<ProviderResult> f = futures.get(j);
            String name = names.get(j);
            if (!f.isDone()) {
                f.cancel(true);
                pendingNames.add(name);
            } else {
                failureOf(f).ifPresent(cause -> allErrors.add(ProviderError.from(name, cause)));
            }
        }
        return new DiagnosisTimeoutException(props.getRequestTimeoutMs(), pendingNames, allErrors);
    }

    private <T> T await(Future<T> future, long deadline,
                        Supplier<List<String>> pendingNames, List<ProviderError> errors) {
        try {
            return future.get(TimeUtils.remainingNanos(deadline), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new DiagnosisTimeoutException(props.getRequestTimeoutMs(), pendingNames.get(), snapshot(errors));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new PlantDxException("Diagnosis interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof PlantDxException pde) {
                throw pde;
            }
            throw new PlantDxException("Unexpected diagnosis failure", cause);
        }
    }

    private void publish(DiagnosisResult result, DiagnosisMode mode) {
        if (publisher != null) {
            publisher.publishEvent(new DiagnosisCompletedEvent(result, Instant.now(), mode,
                    result.provenance().providersUsed()));
        }
    }

    private static Throwable firstCause(List<Future<ProviderResult>> futures) {
        for (Future<ProviderResult> f : futures) {
            Optional<Throwable> cause = failureOf(f);
            if (cause.isPresent()) {
                return cause.get();
            }
        }
        return null;
    }

    private static Optional<Throwable> failureOf(Future<ProviderResult> future) {
        if (!future.isDone() || future.isCancelled()) {
            return Optional.empty();
        }
        try {
            future.get();
            return Optional.empty();
        } catch (ExecutionException e) {
            return Optional.ofNullable(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    private static List<ProviderError> snapshot(List<ProviderError> errors) {
        synchronized (errors) {
            return List.copyOf(errors);
        }
    }
}
