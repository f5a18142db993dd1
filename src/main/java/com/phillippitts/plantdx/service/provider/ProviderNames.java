package com.phillippitts.plantdx.service.provider;

import java.util.List;

/**
 * Canonical provider names. The order of {@link #ALL} is the registration order.
 */
public final class ProviderNames {

    public static final String PLANT_ID = "plant_id";
    public static final String PLANTNET = "plantnet";
    public static final String GOOGLE_VISION = "google_vision";
    public static final String HUGGINGFACE = "huggingface";
    public static final String LOCAL_MODEL = "local_model";

    public static final List<String> ALL = List.of(PLANT_ID, PLANTNET, GOOGLE_VISION, HUGGINGFACE, LOCAL_MODEL);

    private ProviderNames() {
        // Constants class - prevent instantiation
    }

    public static boolean isKnown(String name) {
        return ALL.contains(name);
    }
}
