package com.phillippitts.plantdx.service.orchestration;

import com.phillippitts.plantdx.config.ThreadPoolConfig;
import com.phillippitts.plantdx.config.properties.DiagnosisProperties;
import com.phillippitts.plantdx.config.properties.ImageProperties;
import com.phillippitts.plantdx.config.properties.ThreadPoolProperties;
import com.phillippitts.plantdx.domain.DiagnosisMode;
import com.phillippitts.plantdx.domain.DiagnosisResult;
import com.phillippitts.plantdx.domain.ProviderError;
import com.phillippitts.plantdx.exception.AllProvidersFailedException;
import com.phillippitts.plantdx.exception.DiagnosisTimeoutException;
import com.phillippitts.plantdx.exception.InvalidImageException;
import com.phillippitts.plantdx.exception.ProviderCallException;
import com.phillippitts.plantdx.service.consensus.WeightedVoteConsensusEngine;
import com.phillippitts.plantdx.service.health.ProviderFailureEvent;
import com.phillippitts.plantdx.service.image.ImagePreprocessor;
import com.phillippitts.plantdx.service.metrics.DiagnosisMetricsPublisher;
import com.phillippitts.plantdx.service.orchestration.event.DiagnosisCompletedEvent;
import com.phillippitts.plantdx.service.provider.DiagnosisProvider;
import com.phillippitts.plantdx.service.provider.ProviderCatalog;
import com.phillippitts.plantdx.service.provider.ProviderRateLimiter;
import com.phillippitts.plantdx.service.registry.ProviderConfig;
import com.phillippitts.plantdx.service.registry.ProviderRegistry;
import com.phillippitts.plantdx.service.retry.RetryPolicy;
import com.phillippitts.plantdx.service.retry.RetryingCallExecutor;
import com.phillippitts.plantdx.service.translate.DiagnosisResultTranslator;
import com.phillippitts.plantdx.testutil.EventCapturingPublisher;
import com.phillippitts.plantdx.testutil.FakeDiagnosisProvider;
import com.phillippitts.plantdx.testutil.TestImages;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.core.task.support.TaskExecutorAdapter;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.phillippitts.plantdx.testutil.TestConfigs.config;
import static com.phillippitts.plantdx.testutil.TestConfigs.disabled;
import static com.phillippitts.plantdx.testutil.TestConfigs.enabled;
import static com.phillippitts.plantdx.testutil.TestResults.result;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class DefaultDiagnosisOrchestratorTest {

    private static final List<byte[]> IMAGES = List.of(TestImages.jpeg(32, 24));

    private final ExecutorService dispatchPool = Executors.newFixedThreadPool(8);
    private final ExecutorService callPool = Executors.newFixedThreadPool(8);
    private final EventCapturingPublisher publisher = new EventCapturingPublisher();

    @AfterEach
    void tearDown() {
        dispatchPool.shutdownNow();
        callPool.shutdownNow();
    }

    // --- Primary with fallback ---

    @Test
    void confidentPrimaryIsFinalAndFallbackIsNotCalled() {
        FakeDiagnosisProvider primary = FakeDiagnosisProvider.returning(result("plant_id", "late_blight", 0.92));
        FakeDiagnosisProvider fallback = FakeDiagnosisProvider.returning(result("local_model", "rust", 0.8));
        DiagnosisOrchestrator orchestrator = orchestrator(30_000,
                List.of(enabled("plant_id"), enabled("local_model")), primary, fallback);

        DiagnosisResult out = orchestrator.diagnose(IMAGES, null, DiagnosisMode.PRIMARY);

        assertThat(out.diseaseId()).isEqualTo("late_blight");
        assertThat(out.confidence()).isEqualTo(0.92);
        assertThat(out.provenance().mode()).isEqualTo(DiagnosisMode.PRIMARY);
        assertThat(out.provenance().providersUsed()).containsExactly("plant_id");
        assertThat(out.provenance().findConsensus()).isEmpty();
        assertThat(fallback.calls.get()).isZero();
        assertThat(primary.lastRequest.images()).hasSize(1);
    }

    @Test
    void lowConfidencePrimaryFallsBackEvenWhenFallbackIsAlsoLow() {
        FakeDiagnosisProvider primary = FakeDiagnosisProvider.returning(result("plant_id", "leaf_spot", 0.4));
        FakeDiagnosisProvider fallback = FakeDiagnosisProvider.returning(result("local_model", "early_blight", 0.5));
        DiagnosisOrchestrator orchestrator = orchestrator(30_000,
                List.of(enabled("plant_id"), enabled("local_model")), primary, fallback);

        DiagnosisResult out = orchestrator.diagnose(IMAGES, "tomato", DiagnosisMode.PRIMARY);

        assertThat(out.diseaseId()).isEqualTo("early_blight");
        assertThat(out.confidence()).isEqualTo(0.5);
        assertThat(out.provenance().providersUsed()).containsExactly("local_model");
        assertThat(fallback.lastRequest.findCropHint()).contains("tomato");
    }

    @Test
    void failedPrimaryFallsBackAndKeepsPrimaryError() {
        FakeDiagnosisProvider primary = FakeDiagnosisProvider.failing("plant_id",
                new ProviderCallException("Provider rejected credentials", "plant_id", false, 401, null));
        FakeDiagnosisProvider fallback = FakeDiagnosisProvider.returning(result("local_model", "rust", 0.85));
        DiagnosisOrchestrator orchestrator = orchestrator(30_000,
                List.of(enabled("plant_id"), enabled("local_model")), primary, fallback);

        DiagnosisResult out = orchestrator.diagnose(IMAGES, null, DiagnosisMode.PRIMARY);

        assertThat(out.diseaseId()).isEqualTo("rust");
        assertThat(out.provenance().providerErrors()).extracting(ProviderError::provider).containsExactly("plant_id");
        assertThat(primary.calls.get()).isEqualTo(1);
        assertThat(publisher.eventsOfType(ProviderFailureEvent.class))
                .singleElement()
                .satisfies(e -> assertThat(e.isCredentialFailure()).isTrue());
    }

    @Test
    void bothFailingSurfacesPrimaryErrorFirst() {
        ProviderCallException primaryError = new ProviderCallException("Provider server error", "plant_id", false, 500, null);
        FakeDiagnosisProvider primary = FakeDiagnosisProvider.failing("plant_id", primaryError);
        FakeDiagnosisProvider fallback = FakeDiagnosisProvider.failing("local_model",
                new ProviderCallException("Model not loaded", "local_model", false));
        DiagnosisOrchestrator orchestrator = orchestrator(30_000,
                List.of(enabled("plant_id"), enabled("local_model")), primary, fallback);

        assertThatThrownBy(() -> orchestrator.diagnose(IMAGES, null, DiagnosisMode.PRIMARY))
                .isInstanceOfSatisfying(AllProvidersFailedException.class, e -> {
                    assertThat(e.getProvidersTried()).containsExactly("plant_id", "local_model");
                    assertThat(e.getCause()).isSameAs(primaryError);
                });
    }

    @Test
    void lowConfidencePrimaryIsKeptWhenFallbackFails() {
        FakeDiagnosisProvider primary = FakeDiagnosisProvider.returning(result("plant_id", "leaf_spot", 0.45));
        FakeDiagnosisProvider fallback = FakeDiagnosisProvider.failing("local_model",
                new ProviderCallException("Model not loaded", "local_model", false));
        DiagnosisOrchestrator orchestrator = orchestrator(30_000,
                List.of(enabled("plant_id"), enabled("local_model")), primary, fallback);

        DiagnosisResult out = orchestrator.diagnose(IMAGES, null, DiagnosisMode.PRIMARY);

        assertThat(out.diseaseId()).isEqualTo("leaf_spot");
        assertThat(out.provenance().providersUsed()).containsExactly("plant_id");
        assertThat(out.provenance().providerErrors()).extracting(ProviderError::provider)
                .containsExactly("local_model");
    }

    @Test
    void disabledPrimaryGoesStraightToFallback() {
        FakeDiagnosisProvider primary = FakeDiagnosisProvider.returning(result("plant_id", "late_blight", 0.95));
        FakeDiagnosisProvider fallback = FakeDiagnosisProvider.returning(result("local_model", "rust", 0.75));
        DiagnosisOrchestrator orchestrator = orchestrator(30_000,
                List.of(disabled("plant_id"), enabled("local_model")), primary, fallback);

        DiagnosisResult out = orchestrator.diagnose(IMAGES, null, DiagnosisMode.PRIMARY);

        assertThat(out.diseaseId()).isEqualTo("rust");
        assertThat(primary.calls.get()).isZero();
    }

    @Test
    void retryableFailuresAreRetriedBeforeFallingBack() {
        FakeDiagnosisProvider primary = new FakeDiagnosisProvider("plant_id")
                .thenThrow(new ProviderCallException("HTTP 503", "plant_id", true, 503, null))
                .thenThrow(new ProviderCallException("HTTP 503", "plant_id", true, 503, null))
                .thenReturn(result("plant_id", "powdery_mildew", 0.9));
        FakeDiagnosisProvider fallback = FakeDiagnosisProvider.returning(result("local_model", "rust", 0.75));
        DiagnosisOrchestrator orchestrator = orchestrator(30_000,
                List.of(enabled("plant_id"), enabled("local_model")), primary, fallback);

        DiagnosisResult out = orchestrator.diagnose(IMAGES, null, DiagnosisMode.PRIMARY);

        assertThat(out.diseaseId()).isEqualTo("powdery_mildew");
        assertThat(primary.calls.get()).isEqualTo(3);
        assertThat(fallback.calls.get()).isZero();
    }

    @Test
    void primaryModeTimesOutWhenChainOverrunsRequestDeadline() {
        FakeDiagnosisProvider primary = new FakeDiagnosisProvider("plant_id").thenHang();
        FakeDiagnosisProvider fallback = FakeDiagnosisProvider.returning(result("local_model", "rust", 0.75));
        DiagnosisOrchestrator orchestrator = orchestrator(300,
                List.of(config("plant_id", true, Duration.ofSeconds(10)), enabled("local_model")), primary, fallback);

        assertThatThrownBy(() -> orchestrator.diagnose(IMAGES, null, DiagnosisMode.PRIMARY))
                .isInstanceOfSatisfying(DiagnosisTimeoutException.class, e -> {
                    assertThat(e.getPendingProviders()).containsExactly("plant_id");
                    assertThat(e.getTimeoutMs()).isEqualTo(300);
                });
        await().atMost(Duration.ofSeconds(5)).until(() -> primary.interrupts.get() == 1);
        assertThat(fallback.calls.get()).isZero();
    }

    // --- Ensemble ---

    @Test
    void ensembleSucceedsWhenOneProviderExhaustsRetriesOnTimeouts() {
        FakeDiagnosisProvider plantId = FakeDiagnosisProvider.returning(result("plant_id", "leaf_blight", 0.9));
        FakeDiagnosisProvider plantNet = new FakeDiagnosisProvider("plantnet").thenHang();
        FakeDiagnosisProvider hf = FakeDiagnosisProvider.returning(result("huggingface", "leaf_blight", 0.8));
        DiagnosisOrchestrator orchestrator = orchestrator(30_000, List.of(
                enabled("plant_id"),
                config("plantnet", true, Duration.ofMillis(100)),
                enabled("huggingface")), plantId, plantNet, hf);

        DiagnosisResult out = orchestrator.diagnose(IMAGES, null, DiagnosisMode.ENSEMBLE);

        assertThat(out.diseaseId()).isEqualTo("leaf_blight");
        assertThat(out.provenance().providersUsed()).containsExactly("plant_id", "huggingface");
        assertThat(out.provenance().providerErrors()).extracting(ProviderError::provider).containsExactly("plantnet");
        assertThat(out.provenance().providerErrors().get(0).retryable()).isTrue();
        assertThat(out.provenance().findConsensus()).get()
                .satisfies(c -> assertThat(c.agreementLevel()).isEqualTo(1.0));
        assertThat(plantNet.calls.get()).isEqualTo(3);
    }

    @Test
    void ensembleResultsFollowRegistryOrderNotArrivalOrder() {
        FakeDiagnosisProvider slow = new FakeDiagnosisProvider("plant_id")
                .thenReturnAfter(result("plant_id", "rust", 0.6), 200);
        FakeDiagnosisProvider fast = FakeDiagnosisProvider.returning(result("plantnet", "blight", 0.6));
        DiagnosisOrchestrator orchestrator = orchestrator(30_000,
                List.of(enabled("plant_id"), enabled("plantnet")), slow, fast);

        DiagnosisResult out = orchestrator.diagnose(IMAGES, null, DiagnosisMode.ENSEMBLE);

        assertThat(out.provenance().providersUsed()).containsExactly("plant_id", "plantnet");
        assertThat(out.diseaseId()).isEqualTo("rust");
        assertThat(out.provenance().consensus().conflictingPredictions()).isTrue();
    }

    @Test
    void ensembleWithAllProvidersFailingListsEveryError() {
        FakeDiagnosisProvider a = FakeDiagnosisProvider.failing("plant_id",
                new ProviderCallException("bad", "plant_id", false, 400, null));
        FakeDiagnosisProvider b = FakeDiagnosisProvider.failing("plantnet",
                new ProviderCallException("bad", "plantnet", false, 415, null));
        DiagnosisOrchestrator orchestrator = orchestrator(30_000,
                List.of(enabled("plant_id"), enabled("plantnet")), a, b);

        assertThatThrownBy(() -> orchestrator.diagnose(IMAGES, null, DiagnosisMode.ENSEMBLE))
                .isInstanceOfSatisfying(AllProvidersFailedException.class,
                        e -> assertThat(e.getProvidersTried()).containsExactly("plant_id", "plantnet"));
    }

    @Test
    void ensembleWithoutEnabledProvidersFails() {
        DiagnosisOrchestrator orchestrator = orchestrator(30_000, List.of(disabled("plant_id")),
                FakeDiagnosisProvider.returning(result("plant_id", "rust", 0.9)));

        assertThatThrownBy(() -> orchestrator.diagnose(IMAGES, null, DiagnosisMode.ENSEMBLE))
                .isInstanceOf(AllProvidersFailedException.class)
                .hasMessageContaining("No providers available");
    }

    @Test
    void ensembleParentTimeoutCancelsPendingCallsAndDiscardsPartialResults() {
        FakeDiagnosisProvider fast = FakeDiagnosisProvider.returning(result("plant_id", "rust", 0.9));
        FakeDiagnosisProvider hanging = new FakeDiagnosisProvider("huggingface").thenHang();
        DiagnosisOrchestrator orchestrator = orchestrator(300, List.of(
                enabled("plant_id"),
                config("huggingface", true, Duration.ofSeconds(10))), fast, hanging);

        assertThatThrownBy(() -> orchestrator.diagnose(IMAGES, null, DiagnosisMode.ENSEMBLE))
                .isInstanceOfSatisfying(DiagnosisTimeoutException.class,
                        e -> assertThat(e.getPendingProviders()).containsExactly("huggingface"));
        assertThat(publisher.eventsOfType(DiagnosisCompletedEvent.class)).isEmpty();
        await().atMost(Duration.ofSeconds(5)).until(() -> hanging.interrupts.get() == 1);
    }

    // --- Cross-cutting ---

    @Test
    void invalidImageFailsBeforeAnyProviderCall() {
        FakeDiagnosisProvider primary = FakeDiagnosisProvider.returning(result("plant_id", "rust", 0.9));
        DiagnosisOrchestrator orchestrator = orchestrator(30_000, List.of(enabled("plant_id")), primary);

        assertThatThrownBy(() -> orchestrator.diagnose(List.of("not an image".getBytes()), null, DiagnosisMode.PRIMARY))
                .isInstanceOf(InvalidImageException.class);
        assertThat(primary.calls.get()).isZero();
    }

    @Test
    void publishesCompletionEventAndClearsDiagnosisId() {
        FakeDiagnosisProvider primary = FakeDiagnosisProvider.returning(result("plant_id", "rust", 0.9));
        DiagnosisOrchestrator orchestrator = orchestrator(30_000, List.of(enabled("plant_id")), primary);

        DiagnosisResult out = orchestrator.diagnose(IMAGES, null);

        assertThat(publisher.eventsOfType(DiagnosisCompletedEvent.class))
                .singleElement()
                .satisfies(e -> {
                    assertThat(e.result()).isEqualTo(out);
                    assertThat(e.mode()).isEqualTo(DiagnosisMode.PRIMARY);
                    assertThat(e.providersUsed()).containsExactly("plant_id");
                });
        assertThat(ThreadContext.get(DefaultDiagnosisOrchestrator.DIAGNOSIS_ID_KEY)).isNull();
    }

    // --- Saturated dispatch pool ---

    @Test
    void saturatedDispatchPoolStillHonoursRequestDeadline() {
        ThreadPoolTaskExecutor single = singleThreadDispatch();
        try {
            FakeDiagnosisProvider first = new FakeDiagnosisProvider("plant_id").thenHang();
            FakeDiagnosisProvider second = new FakeDiagnosisProvider("plantnet")
                    .thenReturnAfter(result("plantnet", "rust", 0.9), 3_000);
            DiagnosisOrchestrator orchestrator = orchestrator(500, single,
                    List.of(enabled("plant_id"), enabled("plantnet")), first, second);

            long t0 = System.nanoTime();
            assertThatThrownBy(() -> orchestrator.diagnose(IMAGES, null, DiagnosisMode.ENSEMBLE))
                    .isInstanceOfSatisfying(DiagnosisTimeoutException.class, e -> {
                        assertThat(e.getPendingProviders()).containsExactly("plant_id");
                        assertThat(e.getErrors()).singleElement().satisfies(err -> {
                            assertThat(err.provider()).isEqualTo("plantnet");
                            assertThat(err.retryable()).isTrue();
                            assertThat(err.message()).contains("capacity exhausted");
                        });
                    });

            assertThat(Duration.ofNanos(System.nanoTime() - t0)).isLessThan(Duration.ofMillis(2_000));
            assertThat(second.calls.get()).isZero();
            await().atMost(Duration.ofSeconds(2)).until(() -> first.interrupts.get() == 1);
        } finally {
            single.shutdown();
        }
    }

    @Test
    void saturatedDispatchPoolFailsPrimaryModeWithoutCallingOnCaller() throws Exception {
        ThreadPoolTaskExecutor single = singleThreadDispatch();
        CountDownLatch release = new CountDownLatch(1);
        try {
            single.submit(() -> {
                release.await();
                return null;
            });
            FakeDiagnosisProvider primary = FakeDiagnosisProvider.returning(result("plant_id", "rust", 0.9));
            DiagnosisOrchestrator orchestrator = orchestrator(30_000, single, List.of(enabled("plant_id")), primary);

            assertThatThrownBy(() -> orchestrator.diagnose(IMAGES, null, DiagnosisMode.PRIMARY))
                    .isInstanceOfSatisfying(AllProvidersFailedException.class, e -> {
                        assertThat(e.getProvidersTried()).containsExactly("plant_id");
                        assertThat(e.getCause()).isInstanceOf(ProviderCallException.class);
                        assertThat(e.getCause().getCause()).isInstanceOf(TaskRejectedException.class);
                    });
            assertThat(primary.calls.get()).isZero();
        } finally {
            release.countDown();
            single.shutdown();
        }
    }

    private static ThreadPoolTaskExecutor singleThreadDispatch() {
        ThreadPoolProperties.PoolProperties pool = new ThreadPoolProperties.PoolProperties();
        pool.setCorePoolSize(1);
        pool.setMaxPoolSize(1);
        pool.setQueueCapacity(0);
        pool.setThreadNamePrefix("dispatch-test-");
        ThreadPoolProperties props = new ThreadPoolProperties();
        props.setDispatch(pool);
        return new ThreadPoolConfig(props).dispatchExecutor();
    }

    @Test
    void builderRequiresCoreDependencies() {
        assertThatThrownBy(() -> DiagnosisOrchestratorBuilder.builder().build())
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("preprocessor");
    }

    private DiagnosisOrchestrator orchestrator(long requestTimeoutMs, List<ProviderConfig> configs,
                                               DiagnosisProvider... providers) {
        return orchestrator(requestTimeoutMs, new TaskExecutorAdapter(dispatchPool), configs, providers);
    }

    private DiagnosisOrchestrator orchestrator(long requestTimeoutMs, AsyncTaskExecutor dispatch,
                                               List<ProviderConfig> configs, DiagnosisProvider... providers) {
        ProviderRegistry registry = new ProviderRegistry(configs, 0.7);
        ProviderCatalog catalog = new ProviderCatalog(new ArrayList<>(List.of(providers)));
        RetryingCallExecutor retry = new RetryingCallExecutor(new TaskExecutorAdapter(callPool),
                new RetryPolicy(3, 0, 0.0));
        ProviderCallRunner runner = new ProviderCallRunner(catalog, registry, retry, new ProviderRateLimiter(),
                publisher, DiagnosisMetricsPublisher.NOOP);
        DiagnosisProperties props = new DiagnosisProperties(0.7, "plant_id", "local_model",
                DiagnosisMode.PRIMARY, requestTimeoutMs);
        return DiagnosisOrchestratorBuilder.builder()
                .preprocessor(new ImagePreprocessor(new ImageProperties()))
                .registry(registry)
                .callRunner(runner)
                .consensusEngine(new WeightedVoteConsensusEngine())
                .translator(new DiagnosisResultTranslator())
                .properties(props)
                .dispatchExecutor(dispatch)
                .publisher(publisher)
                .metrics(DiagnosisMetricsPublisher.NOOP)
                .build();
    }
}
