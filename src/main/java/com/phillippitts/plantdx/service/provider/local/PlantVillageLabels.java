package com.phillippitts.plantdx.service.provider.local;

import com.phillippitts.plantdx.service.provider.ResponseParsing;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Class labels of the PlantVillage classifier, in model output order.
 *
 * <p>Labels have the form {@code Crop___Disease}; healthy classes use {@code healthy} as the
 * disease part.
 */
public final class PlantVillageLabels {

    public static final List<String> LABELS = List.of(
            "Apple___Apple_scab",
            "Apple___Black_rot",
            "Apple___Cedar_apple_rust",
            "Apple___healthy",
            "Blueberry___healthy",
            "Cherry_(including_sour)___Powdery_mildew",
            "Cherry_(including_sour)___healthy",
            "Corn_(maize)___Cercospora_leaf_spot Gray_leaf_spot",
            "Corn_(maize)___Common_rust_",
            "Corn_(maize)___Northern_Leaf_Blight",
            "Corn_(maize)___healthy",
            "Grape___Black_rot",
            "Grape___Esca_(Black_Measles)",
            "Grape___Leaf_blight_(Isariopsis_Leaf_Spot)",
            "Grape___healthy",
            "Orange___Haunglongbing_(Citrus_greening)",
            "Peach___Bacterial_spot",
            "Peach___healthy",
            "Pepper,_bell___Bacterial_spot",
            "Pepper,_bell___healthy",
            "Potato___Early_blight",
            "Potato___Late_blight",
            "Potato___healthy",
            "Raspberry___healthy",
            "Soybean___healthy",
            "Squash___Powdery_mildew",
            "Strawberry___Leaf_scorch",
            "Strawberry___healthy",
            "Tomato___Bacterial_spot",
            "Tomato___Early_blight",
            "Tomato___Late_blight",
            "Tomato___Leaf_Mold",
            "Tomato___Septoria_leaf_spot",
            "Tomato___Spider_mites Two-spotted_spider_mite",
            "Tomato___Target_Spot",
            "Tomato___Yellow_Leaf_Curl_Virus",
            "Tomato___mosaic_virus",
            "Tomato___healthy"
    );

    private static final String SEPARATOR = "___";

    private PlantVillageLabels() {}

    public static String crop(String label) {
        int idx = label.indexOf(SEPARATOR);
        return idx < 0 ? label : label.substring(0, idx);
    }

    public static String disease(String label) {
        int idx = label.indexOf(SEPARATOR);
        return idx < 0 ? "unknown" : label.substring(idx + SEPARATOR.length());
    }

    public static boolean isHealthy(String label) {
        return "healthy".equals(disease(label));
    }

    public static String diseaseId(String label) {
        return ResponseParsing.toDiseaseId(label);
    }

    /**
     * Display name: {@code Healthy Apple} for healthy classes, otherwise the disease part with
     * underscores replaced by spaces.
     */
    public static String displayName(String label) {
        if (isHealthy(label)) {
            return "Healthy " + crop(label);
        }
        return disease(label).replace('_', ' ').trim();
    }

    /**
     * Indices of labels whose crop matches the hint, e.g. {@code "maize"} matches
     * {@code Corn_(maize)}. Returns an empty list when nothing matches.
     */
    public static List<Integer> indicesForCrop(String cropHint) {
        List<Integer> out = new ArrayList<>();
        if (cropHint == null) {
            return out;
        }
        String hint = normalize(cropHint);
        if (hint.isEmpty()) {
            return out;
        }
        for (int i = 0; i < LABELS.size(); i++) {
            if (normalize(crop(LABELS.get(i))).contains(hint)) {
                out.add(i);
            }
        }
        return out;
    }

    private static String normalize(String s) {
        return s.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
    }
}
