package com.shafts.catalog.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Relative stiffness of the tip section.
 */
public enum TipStiffness implements CanonicalLabel {
    SOFT("Soft"),
    MEDIUM("Medium"),
    FIRM("Firm"),
    VERY_FIRM("Very Firm");

    private final String label;

    TipStiffness(String label) {
        this.label = label;
    }

    @Override
    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static TipStiffness fromLabel(String label) {
        return CanonicalLabel.fromLabel(TipStiffness.class, label);
    }
}
