package com.shafts.catalog.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Bend point location along the shaft.
 */
public enum Kickpoint implements CanonicalLabel {
    LOW("Low"),
    LOW_MID("Low-Mid"),
    MID("Mid"),
    MID_HIGH("Mid-High"),
    HIGH("High");

    private final String label;

    Kickpoint(String label) {
        this.label = label;
    }

    @Override
    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static Kickpoint fromLabel(String label) {
        return CanonicalLabel.fromLabel(Kickpoint.class, label);
    }
}
