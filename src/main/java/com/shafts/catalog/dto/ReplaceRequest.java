package com.shafts.catalog.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.shafts.catalog.model.ShaftKey;
import com.shafts.catalog.model.ShaftSpec;
import jakarta.validation.constraints.NotNull;

/**
 * Request payload for correcting a stored record.
 *
 * @param key   key of the record to replace
 * @param shaft canonical replacement; may carry a different key
 */
public record ReplaceRequest(
        @JsonProperty("key") @NotNull ShaftKey key,
        @JsonProperty("shaft") @NotNull ShaftSpec shaft) {
}
