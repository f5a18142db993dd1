package com.phillippitts.plantdx.service.provider.vision;

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
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps a Google Vision {@code images:annotate} response to a {@link ProviderResult}.
 *
 * <p>Vision returns generic labels, so only labels mentioning plant, leaf, disease or pest are
 * kept. Labels from all images are merged by id keeping the best score; the top five are used.
 */
final class GoogleVisionResponseParser {

    static final int MAX_PREDICTIONS = 5;
    private static final List<String> RELEVANT_TERMS = List.of("plant", "leaf", "disease", "pest");

    private GoogleVisionResponseParser() {}

    static ProviderResult parse(JSONObject root, long processingTimeMs, int imageCount, String rawBody) {
        Map<String, Prediction> byId = new LinkedHashMap<>();
        boolean diseaseMentioned = false;

        JSONArray responses = root.optJSONArray("responses");
        if (responses != null) {
            for (int i = 0; i < responses.length(); i++) {
                JSONObject response = responses.optJSONObject(i);
                JSONArray labels = response == null ? null : response.optJSONArray("labelAnnotations");
                if (labels == null) {
                    continue;
                }
                for (int j = 0; j < labels.length(); j++) {
                    JSONObject label = labels.optJSONObject(j);
                    String description = label == null ? "" : label.optString("description", "").trim();
                    if (!isRelevant(description)) {
                        continue;
                    }
                    if (description.toLowerCase(Locale.ROOT).contains("disease")) {
                        diseaseMentioned = true;
                    }
                    double score = ResponseParsing.clampConfidence(label.optDouble("score", 0.0));
                    String id = description.toLowerCase(Locale.ROOT).replaceAll("\\s+", "_");
                    Prediction existing = byId.get(id);
                    if (existing == null || existing.confidence() < score) {
                        byId.put(id, Prediction.builder(id, description, score)
                                .severity(Severity.MEDIUM)
                                .description("Detected: " + description)
                                .build());
                    }
                }
            }
        }

        if (byId.isEmpty()) {
            throw new NoPredictionException("No plant-related labels detected", ProviderNames.GOOGLE_VISION);
        }
        List<Prediction> predictions = new ArrayList<>(byId.values());
        predictions.sort(Comparator.comparingDouble(Prediction::confidence).reversed());
        if (predictions.size() > MAX_PREDICTIONS) {
            predictions = predictions.subList(0, MAX_PREDICTIONS);
        }
        return ProviderResult.of(ProviderNames.GOOGLE_VISION, predictions, !diseaseMentioned,
                new ProviderResultMetadata(processingTimeMs, imageCount, null, rawBody));
    }

    static boolean isRelevant(String description) {
        if (description == null || description.isBlank()) {
            return false;
        }
        String lower = description.toLowerCase(Locale.ROOT);
        return RELEVANT_TERMS.stream().anyMatch(lower::contains);
    }
}
