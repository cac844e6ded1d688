package com.shafts.catalog.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One canonical field across the compared shafts.
 *
 * @param field  canonical field name
 * @param values value of each compared shaft, positionally; {@code null} where absent
 * @param delta  max − min over the present values for numeric fields, otherwise {@code null}
 * @param ranks  flex rank of each compared shaft, only on the flex row
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ComparisonRow(
        @JsonProperty("field") String field,
        @JsonProperty("values") List<Object> values,
        @JsonProperty("delta") Double delta,
        @JsonProperty("ranks") List<Integer> ranks) {
}
