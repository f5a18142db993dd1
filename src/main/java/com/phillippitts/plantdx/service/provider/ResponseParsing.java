package com.phillippitts.plantdx.service.provider;

import org.json.JSONArray;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Helpers shared by the provider response parsers.
 */
public final class ResponseParsing {

    private ResponseParsing() {}

    /**
     * Reads a JSON array of strings, skipping non-string and blank entries. Null yields an empty list.
     */
    public static List<String> strings(JSONArray array) {
        List<String> out = new ArrayList<>();
        if (array == null) {
            return out;
        }
        for (int i = 0; i < array.length(); i++) {
            Object v = array.opt(i);
            if (v instanceof String s && !s.isBlank()) {
                out.add(s.trim());
            }
        }
        return out;
    }

    /**
     * Clamps provider scores into [0, 1]; NaN becomes 0.
     */
    public static double clampConfidence(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    /**
     * Lower-cases a label and replaces every character outside {@code [a-z0-9]} with {@code _}.
     */
    public static String toDiseaseId(String label) {
        return label.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "_");
    }
}
