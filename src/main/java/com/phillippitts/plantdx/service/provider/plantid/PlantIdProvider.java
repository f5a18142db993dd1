package com.phillippitts.plantdx.service.provider.plantid;

import com.phillippitts.plantdx.domain.ClassificationRequest;
import com.phillippitts.plantdx.domain.NormalizedImage;
import com.phillippitts.plantdx.domain.ProviderResult;
import com.phillippitts.plantdx.service.provider.AbstractDiagnosisProvider;
import com.phillippitts.plantdx.service.provider.http.ProviderHttpClient;
import com.phillippitts.plantdx.service.registry.ProviderConfig;
import com.phillippitts.plantdx.util.TimeUtils;
import org.json.JSONArray;
import org.json.JSONObject;
import org.springframework.http.HttpHeaders;

import java.util.Objects;

/**
 * Plant.id disease identification adapter.
 *
 * <p>Sends every image of the request in one call to {@code POST {url}/identification}
 * authenticated with the {@code Api-Key} header.
 */
public class PlantIdProvider extends AbstractDiagnosisProvider {

    static final String API_KEY_HEADER = "Api-Key";

    private final ProviderHttpClient http;

    public PlantIdProvider(ProviderConfig config, ProviderHttpClient http) {
        super(config);
        this.http = Objects.requireNonNull(http, "http");
    }

    @Override
    public ProviderResult classify(ClassificationRequest request) {
        ensureInitialized();
        long t0 = System.nanoTime();
        String body = http.postJson(config.apiUrl() + "/identification", buildRequest(request), authHeaders());
        JSONObject json = http.parseObject(body);
        return PlantIdResponseParser.parse(json, TimeUtils.elapsedMillis(t0), request.imageCount(), body);
    }

    /**
     * Calls {@code GET {url}/health}.
     */
    @Override
    public void probe() {
        requireApiKey();
        http.get(config.apiUrl() + "/health", authHeaders());
    }

    static JSONObject buildRequest(ClassificationRequest request) {
        JSONArray images = new JSONArray();
        for (NormalizedImage image : request.images()) {
            images.put(image.base64());
        }
        return new JSONObject()
                .put("images", images)
                .put("plant_details", new JSONArray().put("common_names").put("url").put("description").put("taxonomy"))
                .put("disease_details", new JSONArray().put("description").put("treatment").put("classification"))
                .put("modifiers", new JSONArray().put("crops_fast").put("disease_similar_images"))
                .put("plant_identification", true)
                .put("crop", true);
    }

    private HttpHeaders authHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(API_KEY_HEADER, config.apiKey());
        return headers;
    }
}
