package com.phillippitts.plantdx.service.provider.huggingface;

import com.phillippitts.plantdx.domain.Prediction;
import com.phillippitts.plantdx.domain.Severity;
import com.phillippitts.plantdx.service.provider.ResponseParsing;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Parses Hugging Face image-classification output ({@code [{label, score}, ...]}).
 */
final class HuggingFaceResponseParser {

    static final int MAX_PREDICTIONS = 5;

    private HuggingFaceResponseParser() {}

    /**
     * Adds every {@code {label, score}} entry to {@code byId}, keeping the best score per id.
     */
    static void collect(JSONArray entries, Map<String, Prediction> byId) {
        for (int i = 0; i < entries.length(); i++) {
            JSONObject entry = entries.optJSONObject(i);
            if (entry == null) {
                continue;
            }
            String label = entry.optString("label", "").trim();
            if (label.isEmpty()) {
                continue;
            }
            double score = ResponseParsing.clampConfidence(entry.optDouble("score", 0.0));
            String id = ResponseParsing.toDiseaseId(label);
            Prediction existing = byId.get(id);
            if (existing == null || existing.confidence() < score) {
                byId.put(id, Prediction.builder(id, label, score)
                        .severity(Severity.fromConfidence(score))
                        .description("Detected: " + label)
                        .build());
            }
        }
    }

    /**
     * Sorted top predictions.
     */
    static List<Prediction> top(Map<String, Prediction> byId) {
        List<Prediction> all = new ArrayList<>(byId.values());
        all.sort(Comparator.comparingDouble(Prediction::confidence).reversed());
        return all.size() > MAX_PREDICTIONS ? List.copyOf(all.subList(0, MAX_PREDICTIONS)) : all;
    }
}
