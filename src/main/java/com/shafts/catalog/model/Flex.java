package com.shafts.catalog.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Canonical flex scale.
 * <p>
 * Declaration order is the authoritative stiffness order used for ranking and sorting:
 * Ladies &lt; Senior &lt; Regular &lt; Stiff &lt; X-Stiff &lt; TX. Vendor labels are mapped onto
 * this scale one-to-one by the manufacturer vocabularies.
 * </p>
 */
public enum Flex implements CanonicalLabel {
    LADIES("Ladies"),
    SENIOR("Senior"),
    REGULAR("Regular"),
    STIFF("Stiff"),
    X_STIFF("X-Stiff"),
    TX("TX");

    private final String label;

    Flex(String label) {
        this.label = label;
    }

    @Override
    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * @return position on the flex scale, 0 for Ladies up to 5 for TX
     */
    public int rank() {
        return ordinal();
    }

    @JsonCreator
    public static Flex fromLabel(String label) {
        return CanonicalLabel.fromLabel(Flex.class, label);
    }
}
