package com.shafts.catalog.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Club a shaft is designed for.
 */
public enum ClubType implements CanonicalLabel {
    WOODS("woods"),
    FAIRWAY("fairway"),
    HYBRID("hybrid"),
    IRON("iron"),
    WEDGE("wedge"),
    PUTTER("putter");

    private final String label;

    ClubType(String label) {
        this.label = label;
    }

    @Override
    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static ClubType fromLabel(String label) {
        return CanonicalLabel.fromLabel(ClubType.class, label);
    }
}
