package com.phillippitts.plantdx.domain;

import java.util.Locale;

public enum TreatmentType {
    CHEMICAL, BIOLOGICAL, ORGANIC;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
