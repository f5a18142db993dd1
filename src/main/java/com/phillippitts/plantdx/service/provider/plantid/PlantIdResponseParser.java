package com.phillippitts.plantdx.service.provider.plantid;

import com.phillippitts.plantdx.domain.Prediction;
import com.phillippitts.plantdx.domain.ProviderResult;
import com.phillippitts.plantdx.domain.ProviderResultMetadata;
import com.phillippitts.plantdx.domain.Severity;
import com.phillippitts.plantdx.domain.Treatment;
import com.phillippitts.plantdx.exception.NoPredictionException;
import com.phillippitts.plantdx.service.provider.ProviderNames;
import com.phillippitts.plantdx.service.provider.ResponseParsing;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps a Plant.id identification response to a {@link ProviderResult}.
 *
 * <p>Accepts both layouts the API has used: {@code disease.suggestions} at the root and
 * {@code result.disease.suggestions}; {@code is_plant} may be a boolean or an object with a
 * {@code binary} flag. Disease details may be inlined or nested under {@code disease_details}.
 */
final class PlantIdResponseParser {

    static final String MODEL_VERSION = "3.0";
    static final double HEALTHY_CONFIDENCE = 0.9;

    private PlantIdResponseParser() {}

    static ProviderResult parse(JSONObject root, long processingTimeMs, int imageCount, String rawBody) {
        JSONObject scope = root.optJSONObject("result") != null ? root.getJSONObject("result") : root;
        JSONObject disease = scope.optJSONObject("disease");
        JSONArray suggestions = disease == null ? null : disease.optJSONArray("suggestions");
        boolean isPlant = readIsPlant(scope);

        List<Prediction> predictions = new ArrayList<>();
        if (suggestions != null) {
            for (int i = 0; i < suggestions.length(); i++) {
                JSONObject s = suggestions.optJSONObject(i);
                if (s != null) {
                    Prediction p = toPrediction(s);
                    if (p != null) {
                        predictions.add(p);
                    }
                }
            }
        }

        ProviderResultMetadata metadata =
                new ProviderResultMetadata(processingTimeMs, imageCount, MODEL_VERSION, rawBody);
        if (predictions.isEmpty()) {
            if (!isPlant) {
                throw new NoPredictionException("No disease suggestions and image is not a plant",
                        ProviderNames.PLANT_ID);
            }
            Prediction healthy = Prediction.builder("healthy", "Healthy Plant", HEALTHY_CONFIDENCE)
                    .severity(Severity.LOW)
                    .description("Plant appears to be healthy")
                    .build();
            return ProviderResult.of(ProviderNames.PLANT_ID, List.of(healthy), true, metadata);
        }
        return ProviderResult.of(ProviderNames.PLANT_ID, predictions, false, metadata);
    }

    private static Prediction toPrediction(JSONObject s) {
        String name = s.optString("name", "").trim();
        if (name.isEmpty()) {
            return null;
        }
        Object rawId = s.opt("id");
        String id = rawId == null || JSONObject.NULL.equals(rawId) || rawId.toString().isBlank()
                ? ResponseParsing.toDiseaseId(name)
                : rawId.toString();
        double confidence = ResponseParsing.clampConfidence(s.optDouble("probability", 0.0));

        JSONObject details = s.optJSONObject("details");
        if (details == null) {
            details = s.optJSONObject("disease_details");
        }
        if (details == null) {
            details = s;
        }

        JSONObject treatment = details.optJSONObject("treatment");
        Treatment t = treatment == null
                ? Treatment.NONE
                : new Treatment(
                        ResponseParsing.strings(treatment.optJSONArray("chemical")),
                        ResponseParsing.strings(treatment.optJSONArray("biological")),
                        List.of(),
                        ResponseParsing.strings(treatment.optJSONArray("prevention")));

        return Prediction.builder(id, name, confidence)
                .severity(Severity.fromConfidence(confidence))
                .description(details.optString("description", ""))
                .treatment(t)
                .symptoms(ResponseParsing.strings(details.optJSONArray("symptoms")))
                .causes(ResponseParsing.strings(details.optJSONArray("cause")))
                .affectedAreas(List.of("leaves"))
                .build();
    }

    private static boolean readIsPlant(JSONObject scope) {
        Object v = scope.opt("is_plant");
        if (v instanceof Boolean b) {
            return b;
        }
        if (v instanceof JSONObject o) {
            return o.optBoolean("binary", false);
        }
        return false;
    }
}
