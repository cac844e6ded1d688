package com.shafts.catalog.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/**
 * Side-by-side view of 2 to 4 shafts, in request order, with one row per canonical field.
 *
 * @param shafts       compared records, positionally; repeated keys are listed repeatedly
 * @param displayNames display name of each compared record
 * @param rows         one row per {@link ShaftField}, in column order
 */
public record ComparisonResult(
        @JsonProperty("shafts") List<ShaftSpec> shafts,
        @JsonProperty("display_names") List<String> displayNames,
        @JsonProperty("rows") List<ComparisonRow> rows) {

    /**
     * @param field canonical field
     * @return the row for {@code field}
     */
    public Optional<ComparisonRow> row(final ShaftField field) {
        return rows.stream()
                .filter(r -> r.field().equals(field.getColumnName()))
                .findFirst();
    }

    /**
     * @param field numeric canonical field
     * @return max − min of that field over the compared shafts, if any value is present
     */
    public Optional<Double> delta(final ShaftField field) {
        return row(field).map(ComparisonRow::delta);
    }
}
