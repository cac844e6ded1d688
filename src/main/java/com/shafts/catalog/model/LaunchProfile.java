package com.shafts.catalog.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Launch characteristic published for a shaft.
 */
public enum LaunchProfile implements CanonicalLabel {
    LOW("Low"),
    LOW_MID("Low-Mid"),
    MID("Mid"),
    MID_HIGH("Mid-High"),
    HIGH("High");

    private final String label;

    LaunchProfile(String label) {
        this.label = label;
    }

    @Override
    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static LaunchProfile fromLabel(String label) {
        return CanonicalLabel.fromLabel(LaunchProfile.class, label);
    }
}
