package com.phillippitts.plantdx.service.diagnostics;

import com.phillippitts.plantdx.config.properties.DiagnosisProperties;
import com.phillippitts.plantdx.config.properties.ImageProperties;
import com.phillippitts.plantdx.domain.ClassificationRequest;
import com.phillippitts.plantdx.domain.NormalizedImage;
import com.phillippitts.plantdx.domain.Prediction;
import com.phillippitts.plantdx.domain.ProviderResult;
import com.phillippitts.plantdx.exception.ProviderCallException;
import com.phillippitts.plantdx.service.health.ProviderHealthReport;
import com.phillippitts.plantdx.service.health.ProviderHealthTracker;
import com.phillippitts.plantdx.service.image.ImagePreprocessor;
import com.phillippitts.plantdx.service.provider.DiagnosisProvider;
import com.phillippitts.plantdx.service.provider.ProviderCatalog;
import com.phillippitts.plantdx.service.provider.ProviderNames;
import com.phillippitts.plantdx.service.provider.local.LocalModelProvider;
import com.phillippitts.plantdx.service.registry.ProviderConfig;
import com.phillippitts.plantdx.service.registry.ProviderRegistry;
import com.phillippitts.plantdx.service.retry.RetryingCallExecutor;
import com.phillippitts.plantdx.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;

/**
 * Operator-facing diagnostics: configuration summary, single-provider test calls, health
 * report and runtime threshold changes.
 */
@Service
public class ProviderDiagnosticsService {

    private static final Logger LOG = LogManager.getLogger(ProviderDiagnosticsService.class);
    private static final int TOP_PREDICTIONS = 3;

    private final ProviderRegistry registry;
    private final ProviderCatalog catalog;
    private final RetryingCallExecutor retryExecutor;
    private final ImagePreprocessor preprocessor;
    private final DiagnosisProperties diagnosisProps;
    private final ImageProperties imageProps;
    private final ProviderHealthTracker healthTracker;

    @Autowired
    public ProviderDiagnosticsService(ProviderRegistry registry,
                                      ProviderCatalog catalog,
                                      RetryingCallExecutor retryExecutor,
                                      ImagePreprocessor preprocessor,
                                      DiagnosisProperties diagnosisProps,
                                      ImageProperties imageProps,
                                      ObjectProvider<ProviderHealthTracker> healthTracker) {
        this(registry, catalog, retryExecutor, preprocessor, diagnosisProps, imageProps,
                healthTracker.getIfAvailable());
    }

    ProviderDiagnosticsService(ProviderRegistry registry,
                               ProviderCatalog catalog,
                               RetryingCallExecutor retryExecutor,
                               ImagePreprocessor preprocessor,
                               DiagnosisProperties diagnosisProps,
                               ImageProperties imageProps,
                               ProviderHealthTracker healthTracker) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.retryExecutor = Objects.requireNonNull(retryExecutor, "retryExecutor");
        this.preprocessor = Objects.requireNonNull(preprocessor, "preprocessor");
        this.diagnosisProps = Objects.requireNonNull(diagnosisProps, "diagnosisProps");
        this.imageProps = Objects.requireNonNull(imageProps, "imageProps");
        this.healthTracker = healthTracker;
    }

    public ServiceInfo serviceInfo() {
        ProviderRegistry.Snapshot snapshot = registry.snapshot();
        List<ServiceInfo.ProviderInfo> providers = snapshot.enabledProviders().stream()
                .map(c -> new ServiceInfo.ProviderInfo(c.name(), c.apiUrl(), c.confidenceThreshold(),
                        c.timeout().toMillis(), c.hasApiKey()))
                .toList();
        boolean localLoaded = catalog.find(ProviderNames.LOCAL_MODEL)
                .filter(LocalModelProvider.class::isInstance)
                .map(p -> ((LocalModelProvider) p).isModelLoaded())
                .orElse(false);
        return new ServiceInfo(providers,
                diagnosisProps.getPrimaryProvider(),
                diagnosisProps.getFallbackProvider(),
                diagnosisProps.getDefaultMode(),
                snapshot.globalConfidenceThreshold(),
                localLoaded,
                imageProps.getMaxInputBytes(),
                imageProps.getMaxDimension());
    }

    /**
     * Sends the images to one provider, ignoring its enablement flag.
     *
     * <p>Provider failures are reported in the returned report, never thrown. Invalid images
     * still fail with {@link com.phillippitts.plantdx.exception.InvalidImageException}.
     */
    public ProviderTestReport testProvider(String name, List<byte[]> images) {
        List<NormalizedImage> normalized = preprocessor.preprocessAll(images);
        long t0 = System.nanoTime();
        DiagnosisProvider provider = catalog.find(name).orElse(null);
        ProviderConfig config = registry.find(name).orElse(null);
        if (provider == null || config == null) {
            return ProviderTestReport.failure(name, 0, "Unknown provider: " + name);
        }
        ClassificationRequest request = new ClassificationRequest(normalized, null);
        try {
            ProviderResult result = retryExecutor.execute(name, config.timeout(), () -> provider.classify(request));
            List<Prediction> top = result.predictions().stream()
                    .limit(TOP_PREDICTIONS)
                    .toList();
            return new ProviderTestReport(name, true, result.confidence(), top,
                    TimeUtils.elapsedMillis(t0), result.healthy(), null);
        } catch (ProviderCallException e) {
            LOG.warn("Test call to {} failed: {}", name, e.getMessage());
            return ProviderTestReport.failure(name, TimeUtils.elapsedMillis(t0), e.getMessage());
        }
    }

    /**
     * Replaces the global and per-provider confidence thresholds.
     *
     * @throws IllegalArgumentException if the threshold is outside [0, 1]
     */
    public void updateConfidenceThreshold(double threshold) {
        registry.updateConfidenceThreshold(threshold);
    }

    /**
     * @return per-provider health, empty when health tracking is disabled
     */
    public List<ProviderHealthReport> healthReport() {
        return healthTracker == null ? List.of() : healthTracker.healthReport();
    }
}
