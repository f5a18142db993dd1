package com.phillippitts.plantdx.service.provider.vision;

import com.phillippitts.plantdx.domain.ClassificationRequest;
import com.phillippitts.plantdx.domain.NormalizedImage;
import com.phillippitts.plantdx.domain.ProviderResult;
import com.phillippitts.plantdx.service.provider.AbstractDiagnosisProvider;
import com.phillippitts.plantdx.service.provider.http.ProviderHttpClient;
import com.phillippitts.plantdx.service.registry.ProviderConfig;
import com.phillippitts.plantdx.util.TimeUtils;
import org.json.JSONArray;
import org.json.JSONObject;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Objects;

/**
 * Google Cloud Vision adapter using label detection and object localization.
 */
public class GoogleVisionProvider extends AbstractDiagnosisProvider {

    static final int MAX_RESULTS = 10;

    private final ProviderHttpClient http;

    public GoogleVisionProvider(ProviderConfig config, ProviderHttpClient http) {
        super(config);
        this.http = Objects.requireNonNull(http, "http");
    }

    @Override
    public ProviderResult classify(ClassificationRequest request) {
        ensureInitialized();
        long t0 = System.nanoTime();
        String url = UriComponentsBuilder.fromHttpUrl(config.apiUrl() + "/images:annotate")
                .queryParam("key", config.apiKey())
                .toUriString();
        String body = http.postJson(url, buildRequest(request), null);
        JSONObject json = http.parseObject(body);
        return GoogleVisionResponseParser.parse(json, TimeUtils.elapsedMillis(t0), request.imageCount(), body);
    }

    @Override
    public void probe() {
        requireApiKey();
    }

    static JSONObject buildRequest(ClassificationRequest request) {
        JSONArray requests = new JSONArray();
        for (NormalizedImage image : request.images()) {
            JSONArray features = new JSONArray()
                    .put(new JSONObject().put("type", "LABEL_DETECTION").put("maxResults", MAX_RESULTS))
                    .put(new JSONObject().put("type", "OBJECT_LOCALIZATION").put("maxResults", MAX_RESULTS));
            requests.put(new JSONObject()
                    .put("image", new JSONObject().put("content", image.base64()))
                    .put("features", features));
        }
        return new JSONObject().put("requests", requests);
    }
}
