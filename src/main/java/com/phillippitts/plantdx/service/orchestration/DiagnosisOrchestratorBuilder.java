package com.phillippitts.plantdx.service.orchestration;

import com.phillippitts.plantdx.config.properties.DiagnosisProperties;
import com.phillippitts.plantdx.service.consensus.ConsensusEngine;
import com.phillippitts.plantdx.service.image.ImagePreprocessor;
import com.phillippitts.plantdx.service.metrics.DiagnosisMetricsPublisher;
import com.phillippitts.plantdx.service.registry.ProviderRegistry;
import com.phillippitts.plantdx.service.translate.DiagnosisResultTranslator;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.task.AsyncTaskExecutor;

import java.util.Objects;

/**
 * Builder for {@link DefaultDiagnosisOrchestrator}.
 *
 * <pre>{@code
 * DiagnosisOrchestrator orchestrator = DiagnosisOrchestratorBuilder.builder()
 *     .preprocessor(preprocessor)
 *     .registry(registry)
 *     .callRunner(runner)
 *     .consensusEngine(engine)
 *     .translator(translator)
 *     .properties(props)
 *     .dispatchExecutor(executor)
 *     .publisher(publisher)
 *     .metrics(metricsPublisher)
 *     .build();
 * }</pre>
 *
 * <p>The event publisher and metrics are optional; everything else is required.
 */
public final class DiagnosisOrchestratorBuilder {

    // Required dependencies
    private ImagePreprocessor preprocessor;
    private ProviderRegistry registry;
    private ProviderCallRunner callRunner;
    private ConsensusEngine consensusEngine;
    private DiagnosisResultTranslator translator;
    private DiagnosisProperties properties;
    private AsyncTaskExecutor dispatchExecutor;

    // Optional dependencies
    private ApplicationEventPublisher publisher;
    private DiagnosisMetricsPublisher metrics = DiagnosisMetricsPublisher.NOOP;

    private DiagnosisOrchestratorBuilder() {
        // Private constructor - use builder() factory method
    }

    public static DiagnosisOrchestratorBuilder builder() {
        return new DiagnosisOrchestratorBuilder();
    }

    public DiagnosisOrchestratorBuilder preprocessor(ImagePreprocessor preprocessor) {
        this.preprocessor = preprocessor;
        return this;
    }

    public DiagnosisOrchestratorBuilder registry(ProviderRegistry registry) {
        this.registry = registry;
        return this;
    }

    public DiagnosisOrchestratorBuilder callRunner(ProviderCallRunner callRunner) {
        this.callRunner = callRunner;
        return this;
    }

    public DiagnosisOrchestratorBuilder consensusEngine(ConsensusEngine consensusEngine) {
        this.consensusEngine = consensusEngine;
        return this;
    }

    public DiagnosisOrchestratorBuilder translator(DiagnosisResultTranslator translator) {
        this.translator = translator;
        return this;
    }

    public DiagnosisOrchestratorBuilder properties(DiagnosisProperties properties) {
        this.properties = properties;
        return this;
    }

    public DiagnosisOrchestratorBuilder dispatchExecutor(AsyncTaskExecutor dispatchExecutor) {
        this.dispatchExecutor = dispatchExecutor;
        return this;
    }

    public DiagnosisOrchestratorBuilder publisher(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
        return this;
    }

    /**
     * @param metrics metrics publisher; null falls back to {@link DiagnosisMetricsPublisher#NOOP}
     */
    public DiagnosisOrchestratorBuilder metrics(DiagnosisMetricsPublisher metrics) {
        this.metrics = metrics == null ? DiagnosisMetricsPublisher.NOOP : metrics;
        return this;
    }

    /**
     * @throws NullPointerException if a required dependency is missing
     */
    public DefaultDiagnosisOrchestrator build() {
        Objects.requireNonNull(preprocessor, "preprocessor is required");
        Objects.requireNonNull(registry, "registry is required");
        Objects.requireNonNull(callRunner, "callRunner is required");
        Objects.requireNonNull(consensusEngine, "consensusEngine is required");
        Objects.requireNonNull(translator, "translator is required");
        Objects.requireNonNull(properties, "properties is required");
        Objects.requireNonNull(dispatchExecutor, "dispatchExecutor is required");
        return new DefaultDiagnosisOrchestrator(preprocessor, registry, callRunner, consensusEngine,
                translator, properties, dispatchExecutor, publisher, metrics);
    }
}
