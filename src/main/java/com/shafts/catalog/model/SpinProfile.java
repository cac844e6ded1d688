package com.shafts.catalog.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Spin characteristic published for a shaft.
 */
public enum SpinProfile implements CanonicalLabel {
    LOW("Low"),
    LOW_MID("Low-Mid"),
    MID("Mid"),
    MID_HIGH("Mid-High"),
    HIGH("High");

    private final String label;

    SpinProfile(String label) {
        this.label = label;
    }

    @Override
    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static SpinProfile fromLabel(String label) {
        return CanonicalLabel.fromLabel(SpinProfile.class, label);
    }
}
