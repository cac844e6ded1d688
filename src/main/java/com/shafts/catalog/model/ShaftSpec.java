package com.shafts.catalog.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

/**
 * Normalized golf shaft specification, the unit of storage of the catalog.
 * <p>
 * Instances are immutable and are produced by the normalizer or read back from a catalog
 * snapshot. Optional numeric fields use {@code null} for "not published", which is distinct
 * from zero. JSON property names are the canonical column names.
 * </p>
 */
@Builder
public record ShaftSpec(
        @JsonProperty("manufacturer") String manufacturer,
        @JsonProperty("model") String model,
        @JsonProperty("generation") String generation,
        @JsonProperty("club_type") ClubType clubType,
        @JsonProperty("flex") Flex flex,
        @JsonProperty("weight_grams") double weightGrams,
        @JsonProperty("length_inches") Double lengthInches,
        @JsonProperty("torque_degrees") Double torqueDegrees,
        @JsonProperty("launch") LaunchProfile launch,
        @JsonProperty("spin") SpinProfile spin,
        @JsonProperty("butt_diameter_inches") Double buttDiameterInches,
        @JsonProperty("tip_diameter_inches") Double tipDiameterInches,
        @JsonProperty("tip_stiff") TipStiffness tipStiff,
        @JsonProperty("kickpoint") Kickpoint kickpoint,
        @JsonProperty("material") String material,
        @JsonProperty("msrp_usd") Double msrpUsd) {

    public ShaftSpec {
        manufacturer = manufacturer == null ? null : manufacturer.trim();
        model = model == null ? null : model.trim();
        generation = blankToNull(generation);
        material = blankToNull(material);
    }

    /**
     * @return the identity key of this record
     */
    @JsonIgnore
    public ShaftKey key() {
        return new ShaftKey(manufacturer, model, generation, clubType, flex);
    }

    /**
     * Human-readable identifier, e.g. {@code "Fujikura Ventus Blue TR X-Stiff"}.
     *
     * @return manufacturer, model, optional generation and flex label
     */
    @JsonIgnore
    public String displayName() {
        String gen = generation != null ? " " + generation : "";
        return manufacturer + " " + model + gen + " " + flex.getLabel();
    }

    private static String blankToNull(final String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
