package com.phillippitts.plantdx.config;

import com.phillippitts.plantdx.config.properties.DiagnosisProperties;
import com.phillippitts.plantdx.service.consensus.ConsensusEngine;
import com.phillippitts.plantdx.service.image.ImagePreprocessor;
import com.phillippitts.plantdx.service.metrics.DiagnosisMetricsPublisher;
import com.phillippitts.plantdx.service.orchestration.DiagnosisOrchestrator;
import com.phillippitts.plantdx.service.orchestration.DiagnosisOrchestratorBuilder;
import com.phillippitts.plantdx.service.orchestration.ProviderCallRunner;
import com.phillippitts.plantdx.service.provider.ProviderCatalog;
import com.phillippitts.plantdx.service.provider.ProviderRateLimiter;
import com.phillippitts.plantdx.service.registry.ProviderRegistry;
import com.phillippitts.plantdx.service.retry.RetryingCallExecutor;
import com.phillippitts.plantdx.service.translate.DiagnosisResultTranslator;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;

/**
 * Wires the diagnosis orchestrator explicitly so the builder enforces its dependencies.
 */
@Configuration
public class OrchestrationConfig {

    private final ApplicationEventPublisher publisher;
    private final DiagnosisMetricsPublisher metricsPublisher;

    public OrchestrationConfig(ApplicationEventPublisher publisher, DiagnosisMetricsPublisher metricsPublisher) {
        this.publisher = publisher;
        this.metricsPublisher = metricsPublisher;
    }

    @Bean
    public ProviderCallRunner providerCallRunner(ProviderCatalog catalog,
                                                 ProviderRegistry registry,
                                                 RetryingCallExecutor retryingCallExecutor,
                                                 ProviderRateLimiter rateLimiter) {
        return new ProviderCallRunner(catalog, registry, retryingCallExecutor, rateLimiter,
                publisher, metricsPublisher);
    }

    @Bean
    public DiagnosisOrchestrator diagnosisOrchestrator(ImagePreprocessor preprocessor,
                                                       ProviderRegistry registry,
                                                       ProviderCallRunner providerCallRunner,
                                                       ConsensusEngine consensusEngine,
                                                       DiagnosisResultTranslator translator,
                                                       DiagnosisProperties diagnosisProperties,
                                                       @Qualifier("dispatchExecutor") AsyncTaskExecutor dispatchExecutor) {
        return DiagnosisOrchestratorBuilder.builder()
                .preprocessor(preprocessor)
                .registry(registry)
                .callRunner(providerCallRunner)
                .consensusEngine(consensusEngine)
                .translator(translator)
                .properties(diagnosisProperties)
                .dispatchExecutor(dispatchExecutor)
                .publisher(publisher)
                .metrics(metricsPublisher)
                .build();
    }
}
