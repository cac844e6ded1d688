package com.shafts.catalog.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Comparator;

/**
 * Identity of a shaft record inside the catalog.
 * <p>
 * An absent generation is keyed as the empty string, so "no generation" is itself a distinct
 * identity. Keys sort by manufacturer, model, generation and club type (enum declaration order),
 * with flex rank as the final tie-break; this is the catalog's result order.
 * </p>
 *
 * @param manufacturer shaft OEM
 * @param model        product line
 * @param generation   generation or version, never {@code null}
 * @param clubType     intended club
 * @param flex         canonical flex
 */
public record ShaftKey(
        @JsonProperty("manufacturer") String manufacturer,
        @JsonProperty("model") String model,
        @JsonProperty("generation") String generation,
        @JsonProperty("club_type") ClubType clubType,
        @JsonProperty("flex") Flex flex) implements Comparable<ShaftKey> {

    private static final Comparator<ShaftKey> ORDER = Comparator
            .comparing(ShaftKey::manufacturer)
            .thenComparing(ShaftKey::model)
            .thenComparing(ShaftKey::generation)
            .thenComparing(ShaftKey::clubType)
            .thenComparing(ShaftKey::flex);

    public ShaftKey {
        manufacturer = manufacturer == null ? "" : manufacturer.trim();
        model = model == null ? "" : model.trim();
        generation = generation == null ? "" : generation.trim();
        if (clubType == null || flex == null) {
            throw new IllegalArgumentException("club_type and flex are part of the key and must be set");
        }
    }

    @Override
    public int compareTo(final ShaftKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return manufacturer + "|" + model + "|" + generation + "|" + clubType.getLabel() + "|" + flex.getLabel();
    }
}
