package com.shafts.catalog.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Response DTO for catalog statistics.
 *
 * @param totalShafts      number of records
 * @param manufacturers    distinct manufacturers
 * @param models           distinct (manufacturer, model) pairs
 * @param clubTypes        record count per club type label
 * @param flexDistribution record count per flex label, in flex order
 * @param launchDistribution record count per launch label, records without launch left out
 * @param spinDistribution   record count per spin label, records without spin left out
 * @param meanMsrpByManufacturer mean list price (USD, two decimals) per manufacturer, one price
 *                               per model; manufacturers without prices are left out
 * @param weightRange      weight summary, {@code null} for an empty catalog
 */
public record CatalogStatsDto(
        @JsonProperty("total_shafts") long totalShafts,
        @JsonProperty("manufacturers") long manufacturers,
        @JsonProperty("models") long models,
        @JsonProperty("club_types") Map<String, Long> clubTypes,
        @JsonProperty("flex_distribution") Map<String, Long> flexDistribution,
        @JsonProperty("launch_distribution") Map<String, Long> launchDistribution,
        @JsonProperty("spin_distribution") Map<String, Long> spinDistribution,
        @JsonProperty("mean_msrp_by_manufacturer") Map<String, Double> meanMsrpByManufacturer,
        @JsonProperty("weight_range") WeightRange weightRange) {

    /**
     * @param min  lightest weight in grams
     * @param max  heaviest weight in grams
     * @param mean mean weight in grams, one decimal
     */
    public record WeightRange(double min, double max, double mean) {
    }
}
