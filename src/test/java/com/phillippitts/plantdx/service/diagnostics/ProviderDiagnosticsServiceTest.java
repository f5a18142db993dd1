package com.phillippitts.plantdx.service.diagnostics;

import com.phillippitts.plantdx.config.properties.DiagnosisProperties;
import com.phillippitts.plantdx.config.properties.ImageProperties;
import com.phillippitts.plantdx.domain.DiagnosisMode;
import com.phillippitts.plantdx.domain.Prediction;
import com.phillippitts.plantdx.exception.InvalidImageException;
import com.phillippitts.plantdx.exception.ProviderCallException;
import com.phillippitts.plantdx.service.health.ProviderHealthReport;
import com.phillippitts.plantdx.service.health.ProviderHealthTracker;
import com.phillippitts.plantdx.service.health.ProviderState;
import com.phillippitts.plantdx.service.image.ImagePreprocessor;
import com.phillippitts.plantdx.service.provider.DiagnosisProvider;
import com.phillippitts.plantdx.service.provider.ProviderCatalog;
import com.phillippitts.plantdx.service.registry.ProviderConfig;
import com.phillippitts.plantdx.service.registry.ProviderRegistry;
import com.phillippitts.plantdx.service.retry.RetryPolicy;
import com.phillippitts.plantdx.service.retry.RetryingCallExecutor;
import com.phillippitts.plantdx.testutil.FakeDiagnosisProvider;
import com.phillippitts.plantdx.testutil.TestImages;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.support.TaskExecutorAdapter;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.phillippitts.plantdx.testutil.TestConfigs.disabled;
import static com.phillippitts.plantdx.testutil.TestConfigs.enabled;
import static com.phillippitts.plantdx.testutil.TestResults.prediction;
import static com.phillippitts.plantdx.testutil.TestResults.result;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ProviderDiagnosticsServiceTest {

    private static final List<byte[]> IMAGES = List.of(TestImages.jpeg(24, 24));

    private final ExecutorService pool = Executors.newSingleThreadExecutor();

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void serviceInfoListsEnabledProvidersAndSettings() {
        ProviderDiagnosticsService service = service(List.of(enabled("plant_id"), disabled("plantnet")), null,
                FakeDiagnosisProvider.returning(result("plant_id", "rust", 0.9)));

        ServiceInfo info = service.serviceInfo();

        assertThat(info.providers()).extracting(ServiceInfo.ProviderInfo::name).containsExactly("plant_id");
        assertThat(info.providers().get(0).hasApiKey()).isTrue();
        assertThat(info.providers().get(0).timeoutMs()).isEqualTo(2000);
        assertThat(info.primaryProvider()).isEqualTo("plant_id");
        assertThat(info.fallbackProvider()).isEqualTo("local_model");
        assertThat(info.defaultMode()).isEqualTo(DiagnosisMode.PRIMARY);
        assertThat(info.confidenceThreshold()).isEqualTo(0.7);
        assertThat(info.localModelLoaded()).isFalse();
        assertThat(info.maxDimension()).isEqualTo(512);
    }

    @Test
    void testProviderReportsTopThreePredictionsEvenWhenDisabled() {
        FakeDiagnosisProvider plantNet = FakeDiagnosisProvider.returning(result("plantnet", 0.6,
                prediction("rust", 0.6), prediction("blight", 0.2), prediction("mildew", 0.1),
                prediction("leaf_spot", 0.05)));
        ProviderDiagnosticsService service = service(List.of(disabled("plantnet")), null, plantNet);

        ProviderTestReport report = service.testProvider("plantnet", IMAGES);

        assertThat(report.success()).isTrue();
        assertThat(report.confidence()).isEqualTo(0.6);
        assertThat(report.topPredictions()).extracting(Prediction::diseaseId)
                .containsExactly("rust", "blight", "mildew");
        assertThat(report.error()).isNull();
        assertThat(plantNet.calls.get()).isEqualTo(1);
    }

    @Test
    void testProviderTurnsFailuresIntoReport() {
        FakeDiagnosisProvider vision = FakeDiagnosisProvider.failing("google_vision",
                new ProviderCallException("Provider rejected credentials", "google_vision", false, 401, null));
        ProviderDiagnosticsService service = service(List.of(enabled("google_vision")), null, vision);

        ProviderTestReport report = service.testProvider("google_vision", IMAGES);

        assertThat(report.success()).isFalse();
        assertThat(report.error()).contains("credentials");
        assertThat(report.topPredictions()).isEmpty();
    }

    @Test
    void testProviderRejectsUnknownNames() {
        ProviderDiagnosticsService service = service(List.of(enabled("plant_id")), null,
                FakeDiagnosisProvider.returning(result("plant_id", "rust", 0.9)));

        ProviderTestReport report = service.testProvider("nope", IMAGES);

        assertThat(report.success()).isFalse();
        assertThat(report.error()).isEqualTo("Unknown provider: nope");
    }

    @Test
    void testProviderStillValidatesImages() {
        ProviderDiagnosticsService service = service(List.of(enabled("plant_id")), null,
                FakeDiagnosisProvider.returning(result("plant_id", "rust", 0.9)));

        assertThatThrownBy(() -> service.testProvider("plant_id", List.of(new byte[0])))
                .isInstanceOf(InvalidImageException.class);
    }

    @Test
    void thresholdUpdateIsValidatedAndApplied() {
        ProviderDiagnosticsService service = service(List.of(enabled("plant_id")), null,
                FakeDiagnosisProvider.returning(result("plant_id", "rust", 0.9)));

        service.updateConfidenceThreshold(0.55);
        assertThat(service.serviceInfo().confidenceThreshold()).isEqualTo(0.55);
        assertThat(service.serviceInfo().providers().get(0).confidenceThreshold()).isEqualTo(0.55);

        assertThatThrownBy(() -> service.updateConfidenceThreshold(1.5))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(service.serviceInfo().confidenceThreshold()).isEqualTo(0.55);
    }

    @Test
    void healthReportDelegatesToTrackerWhenPresent() {
        ProviderHealthTracker tracker = mock(ProviderHealthTracker.class);
        List<ProviderHealthReport> reports = List.of(
                new ProviderHealthReport("plant_id", ProviderState.HEALTHY, true, 0, null, null));
        when(tracker.healthReport()).thenReturn(reports);

        assertThat(service(List.of(enabled("plant_id")), tracker).healthReport()).isEqualTo(reports);
        assertThat(service(List.of(enabled("plant_id")), null).healthReport()).isEmpty();
    }

    private ProviderDiagnosticsService service(List<ProviderConfig> configs, ProviderHealthTracker tracker,
                                               DiagnosisProvider... providers) {
        RetryingCallExecutor retry = new RetryingCallExecutor(new TaskExecutorAdapter(pool),
                new RetryPolicy(1, 0, 0.0));
        return new ProviderDiagnosticsService(new ProviderRegistry(configs, 0.7),
                new ProviderCatalog(List.of(providers)), retry, new ImagePreprocessor(new ImageProperties()),
                new DiagnosisProperties("plant_id", "local_model"), new ImageProperties(), tracker);
    }
}
