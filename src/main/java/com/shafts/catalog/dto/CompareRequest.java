package com.shafts.catalog.dto;

import com.shafts.catalog.model.ShaftKey;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Request payload for a side-by-side comparison. The size bound (2 to 4) is enforced by the
 * comparison service so the error carries its own code.
 *
 * @param shafts identity keys in display order
 */
public record CompareRequest(@NotNull List<@NotNull ShaftKey> shafts) {
}
