package com.phillippitts.plantdx.config;

import com.phillippitts.plantdx.config.properties.DiagnosisProperties;
import com.phillippitts.plantdx.config.properties.ProviderProperties;
import com.phillippitts.plantdx.config.properties.ProviderProperties.ProviderSettings;
import com.phillippitts.plantdx.config.properties.RetryProperties;
import com.phillippitts.plantdx.service.provider.DiagnosisProvider;
import com.phillippitts.plantdx.service.provider.ProviderCatalog;
import com.phillippitts.plantdx.service.provider.ProviderNames;
import com.phillippitts.plantdx.service.provider.ProviderRateLimiter;
import com.phillippitts.plantdx.service.provider.http.ProviderHttpClient;
import com.phillippitts.plantdx.service.provider.huggingface.HuggingFaceProvider;
import com.phillippitts.plantdx.service.provider.local.LocalModelProvider;
import com.phillippitts.plantdx.service.provider.local.OnnxImageClassifierModel;
import com.phillippitts.plantdx.service.provider.plantid.PlantIdProvider;
import com.phillippitts.plantdx.service.provider.plantnet.PlantNetProvider;
import com.phillippitts.plantdx.service.provider.vision.GoogleVisionProvider;
import com.phillippitts.plantdx.service.registry.ProviderConfig;
import com.phillippitts.plantdx.service.registry.ProviderRegistry;
import com.phillippitts.plantdx.service.retry.RetryPolicy;
import com.phillippitts.plantdx.service.retry.RetryingCallExecutor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds the provider registry and the closed set of provider adapters from
 * {@code diagnosis.providers.*}.
 *
 * <p>A provider is enabled when it has credentials (an API key, or a {@code model-path}
 * option for the local model) unless {@code enabled} is set explicitly.
 */
@Configuration
public class ProviderConfiguration {

    private static final Logger LOG = LogManager.getLogger(ProviderConfiguration.class);

    static final String MODEL_PATH_OPTION = "model-path";
    static final String INPUT_SIZE_OPTION = "input-size";
    static final int DEFAULT_INPUT_SIZE = 224;

    private static final Map<String, String> DEFAULT_URLS = Map.of(
            ProviderNames.PLANT_ID, "https://api.plant.id/v3",
            ProviderNames.PLANTNET, "https://my-api.plantnet.org/v2",
            ProviderNames.GOOGLE_VISION, "https://vision.googleapis.com/v1",
            ProviderNames.HUGGINGFACE, "https://api-inference.huggingface.co/models");

    @Bean
    public ProviderRegistry providerRegistry(ProviderProperties providerProperties,
                                             DiagnosisProperties diagnosisProperties) {
        return new ProviderRegistry(providerConfigs(providerProperties, diagnosisProperties.getConfidenceThreshold()),
                diagnosisProperties.getConfidenceThreshold());
    }

    @Bean
    public ProviderCatalog providerCatalog(ProviderRegistry providerRegistry,
                                           ObjectProvider<RestTemplateBuilder> restTemplateBuilder) {
        RestTemplateBuilder builder = restTemplateBuilder.getIfAvailable(RestTemplateBuilder::new);
        List<DiagnosisProvider> providers = new ArrayList<>();
        for (ProviderConfig config : providerRegistry.snapshot().providers()) {
            DiagnosisProvider provider = createProvider(config, builder);
            if (provider != null) {
                providers.add(provider);
            }
        }
        LOG.info("Provider catalog: {}; enabled: {}", providers.stream().map(DiagnosisProvider::getProviderName).toList(),
                providerRegistry.enabledProviders().stream().map(ProviderConfig::name).toList());
        return new ProviderCatalog(providers);
    }

    @Bean
    public ProviderRateLimiter providerRateLimiter() {
        return new ProviderRateLimiter();
    }

    @Bean
    public RetryingCallExecutor retryingCallExecutor(@Qualifier("providerCallExecutor") AsyncTaskExecutor executor,
                                                     RetryProperties retryProperties) {
        return new RetryingCallExecutor(executor, RetryPolicy.from(retryProperties));
    }

    /**
     * Converts bound settings into provider configs in the fixed provider order.
     *
     * @throws IllegalArgumentException if a configured provider name is unknown
     */
    static List<ProviderConfig> providerConfigs(ProviderProperties props, double globalThreshold) {
        for (String name : props.getProviders().keySet()) {
            if (!ProviderNames.isKnown(name)) {
                throw new IllegalArgumentException("Unknown provider '" + name + "'; expected one of "
                        + ProviderNames.ALL);
            }
        }
        List<ProviderConfig> configs = new ArrayList<>(ProviderNames.ALL.size());
        for (String name : ProviderNames.ALL) {
            ProviderSettings s = props.settingsFor(name);
            Map<String, String> options = s.getOptions();
            boolean hasCredentials = ProviderNames.LOCAL_MODEL.equals(name)
                    ? hasText(options.get(MODEL_PATH_OPTION))
                    : hasText(s.getApiKey());
            boolean enabled = s.getEnabled() != null ? s.getEnabled() && hasCredentials : hasCredentials;
            if (Boolean.TRUE.equals(s.getEnabled()) && !hasCredentials) {
                LOG.warn("Provider {} is enabled but has no credentials; leaving it disabled", name);
            }
            String url = hasText(s.getApiUrl()) ? s.getApiUrl() : DEFAULT_URLS.get(name);
            double threshold = s.getConfidenceThreshold() != null ? s.getConfidenceThreshold() : globalThreshold;
            configs.add(new ProviderConfig(name, enabled, s.getApiKey(), url,
                    Duration.ofMillis(s.getTimeoutMs()), threshold, s.getRateLimitPerMinute(), options));
        }
        return configs;
    }

    static DiagnosisProvider createProvider(ProviderConfig config, RestTemplateBuilder builder) {
        String name = config.name();
        return switch (name) {
            case ProviderNames.PLANT_ID -> new PlantIdProvider(config, http(config, builder));
            case ProviderNames.PLANTNET -> new PlantNetProvider(config, http(config, builder));
            case ProviderNames.GOOGLE_VISION -> new GoogleVisionProvider(config, http(config, builder));
            case ProviderNames.HUGGINGFACE -> new HuggingFaceProvider(config, http(config, builder));
            case ProviderNames.LOCAL_MODEL -> localModel(config);
            default -> throw new IllegalArgumentException("Unknown provider: " + name);
        };
    }

    private static DiagnosisProvider localModel(ProviderConfig config) {
        String modelPath = config.option(MODEL_PATH_OPTION, null);
        if (!hasText(modelPath)) {
            return null;
        }
        int inputSize = Integer.parseInt(config.option(INPUT_SIZE_OPTION, String.valueOf(DEFAULT_INPUT_SIZE)));
        return new LocalModelProvider(config, new OnnxImageClassifierModel(Path.of(modelPath), inputSize));
    }

    private static ProviderHttpClient http(ProviderConfig config, RestTemplateBuilder builder) {
        return ProviderHttpClient.create(config.name(), builder, config.timeout());
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
