package com.phillippitts.plantdx.service.provider.plantnet;

import com.phillippitts.plantdx.domain.Prediction;
import com.phillippitts.plantdx.domain.ProviderResult;
import com.phillippitts.plantdx.domain.ProviderResultMetadata;
import com.phillippitts.plantdx.domain.Severity;
import com.phillippitts.plantdx.exception.NoPredictionException;
import com.phillippitts.plantdx.service.provider.ProviderNames;
import com.phillippitts.plantdx.service.provider.ResponseParsing;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps a PlantNet identify response to a {@link ProviderResult}.
 *
 * <p>PlantNet identifies species, not diseases: each result becomes a LOW-severity prediction
 * keyed by scientific name and the result is always flagged healthy.
 */
final class PlantNetResponseParser {

    private PlantNetResponseParser() {}

    static ProviderResult parse(JSONObject root, long processingTimeMs, int imageCount, String rawBody) {
        JSONArray results = root.optJSONArray("results");
        List<Prediction> predictions = new ArrayList<>();
        if (results != null) {
            for (int i = 0; i < results.length(); i++) {
                JSONObject r = results.optJSONObject(i);
                JSONObject species = r == null ? null : r.optJSONObject("species");
                if (species == null) {
                    continue;
                }
                String scientific = species.optString("scientificNameWithoutAuthor", "").trim();
                if (scientific.isEmpty()) {
                    continue;
                }
                List<String> commonNames = ResponseParsing.strings(species.optJSONArray("commonNames"));
                String name = commonNames.isEmpty() ? scientific : commonNames.get(0);
                double score = ResponseParsing.clampConfidence(r.optDouble("score", 0.0));
                predictions.add(Prediction.builder(scientific.replaceAll("\\s+", "_"), name, score)
                        .severity(Severity.LOW)
                        .description("Plant identification: " + scientific)
                        .build());
            }
        }
        if (predictions.isEmpty()) {
            throw new NoPredictionException("No species matched", ProviderNames.PLANTNET);
        }
        String version = root.optString("version", null);
        return ProviderResult.of(ProviderNames.PLANTNET, predictions, true,
                new ProviderResultMetadata(processingTimeMs, imageCount, version, rawBody));
    }
}
