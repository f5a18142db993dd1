package com.phillippitts.plantdx.service.provider.plantnet;

import com.phillippitts.plantdx.domain.ClassificationRequest;
import com.phillippitts.plantdx.domain.NormalizedImage;
import com.phillippitts.plantdx.domain.ProviderResult;
import com.phillippitts.plantdx.service.provider.AbstractDiagnosisProvider;
import com.phillippitts.plantdx.service.provider.http.ProviderHttpClient;
import com.phillippitts.plantdx.service.registry.ProviderConfig;
import com.phillippitts.plantdx.util.TimeUtils;
import org.json.JSONObject;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.List;
import java.util.Objects;

/**
 * PlantNet species identification adapter.
 *
 * <p>Uploads the images as multipart parts to {@code POST {url}/identify/{project}}; the API
 * key travels as a query parameter. The project defaults to {@code weurope} and can be set
 * with the {@code project} option.
 */
public class PlantNetProvider extends AbstractDiagnosisProvider {

    static final String DEFAULT_PROJECT = "weurope";
    static final String DEFAULT_ORGAN = "leaf";

    private final ProviderHttpClient http;

    public PlantNetProvider(ProviderConfig config, ProviderHttpClient http) {
        super(config);
        this.http = Objects.requireNonNull(http, "http");
    }

    @Override
    public ProviderResult classify(ClassificationRequest request) {
        ensureInitialized();
        long t0 = System.nanoTime();
        String body = http.postMultipart(identifyUrl(), buildParts(request.images()), null);
        JSONObject json = http.parseObject(body);
        return PlantNetResponseParser.parse(json, TimeUtils.elapsedMillis(t0), request.imageCount(), body);
    }

    /**
     * PlantNet has no health endpoint; a configured key is the best available signal.
     */
    @Override
    public void probe() {
        requireApiKey();
    }

    String identifyUrl() {
        String project = config.option("project", DEFAULT_PROJECT);
        return UriComponentsBuilder.fromHttpUrl(config.apiUrl())
                .path("/identify/{project}")
                .queryParam("api-key", config.apiKey())
                .queryParam("include-related-images", false)
                .queryParam("nb-results", 5)
                .queryParam("lang", "en")
                .buildAndExpand(project)
                .toUriString();
    }

    private MultiValueMap<String, Object> buildParts(List<NormalizedImage> images) {
        String organ = config.option("organ", DEFAULT_ORGAN);
        MultiValueMap<String, Object> parts = new LinkedMultiValueMap<>();
        for (int i = 0; i < images.size(); i++) {
            final String filename = "image_" + i + ".jpg";
            parts.add("organs", organ);
            parts.add("images", new ByteArrayResource(images.get(i).bytes()) {
                @Override
                public String getFilename() {
                    return filename;
                }
            });
        }
        return parts;
    }
}
