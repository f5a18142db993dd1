package com.phillippitts.plantdx.service.provider.huggingface;

import com.phillippitts.plantdx.domain.ClassificationRequest;
import com.phillippitts.plantdx.domain.NormalizedImage;
import com.phillippitts.plantdx.domain.Prediction;
import com.phillippitts.plantdx.domain.ProviderResult;
import com.phillippitts.plantdx.domain.ProviderResultMetadata;
import com.phillippitts.plantdx.exception.NoPredictionException;
import com.phillippitts.plantdx.service.provider.AbstractDiagnosisProvider;
import com.phillippitts.plantdx.service.provider.http.ProviderHttpClient;
import com.phillippitts.plantdx.service.registry.ProviderConfig;
import com.phillippitts.plantdx.util.TimeUtils;
import org.json.JSONArray;
import org.json.JSONObject;
import org.springframework.http.HttpHeaders;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Hugging Face Inference API adapter.
 *
 * <p>The inference endpoint classifies one image per call, so a request with several images
 * makes several sequential calls and merges their labels.
 */
public class HuggingFaceProvider extends AbstractDiagnosisProvider {

    static final String DEFAULT_MODEL = "microsoft/plant-disease-classifier";

    private final ProviderHttpClient http;

    public HuggingFaceProvider(ProviderConfig config, ProviderHttpClient http) {
        super(config);
        this.http = Objects.requireNonNull(http, "http");
    }

    @Override
    public ProviderResult classify(ClassificationRequest request) {
        ensureInitialized();
        long t0 = System.nanoTime();
        String url = config.apiUrl() + "/" + model();
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(config.apiKey());

        Map<String, Prediction> byId = new LinkedHashMap<>();
        String lastBody = null;
        for (NormalizedImage image : request.images()) {
            JSONObject payload = new JSONObject()
                    .put("inputs", image.base64())
                    .put("options", new JSONObject().put("wait_for_model", true));
            lastBody = http.postJson(url, payload, headers);
            JSONArray entries = http.parseArray(lastBody);
            HuggingFaceResponseParser.collect(entries, byId);
        }

        List<Prediction> predictions = HuggingFaceResponseParser.top(byId);
        if (predictions.isEmpty()) {
            throw new NoPredictionException("Model returned no labels", getProviderName());
        }
        boolean healthy = predictions.get(0).diseaseName().toLowerCase(Locale.ROOT).contains("healthy");
        return ProviderResult.of(getProviderName(), predictions, healthy,
                new ProviderResultMetadata(TimeUtils.elapsedMillis(t0), request.imageCount(), model(), lastBody));
    }

    @Override
    public void probe() {
        requireApiKey();
    }

    String model() {
        return config.option("model", DEFAULT_MODEL);
    }
}
