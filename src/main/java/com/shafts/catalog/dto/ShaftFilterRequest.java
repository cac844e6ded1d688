package com.shafts.catalog.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.HashMap;
import java.util.Map;

/**
 * Request payload for a filtered catalog search.
 * <p>
 * Keys of {@code parameters} are canonical field names. Values may be:
 * <ul>
 *   <li>a single scalar for an exact match,</li>
 *   <li>a {@code List<?>} of allowed values,</li>
 *   <li>a map with {@code "min"} and/or {@code "max"} (and optional {@code "allowAbsent"})
 *       for an inclusive numeric range.</li>
 * </ul>
 * </p>
 * <pre>{@code
 * {
 *   "parameters": {
 *     "flex": "Stiff",
 *     "club_type": ["woods", "hybrid"],
 *     "weight_grams": {"min": 60, "max": 70}
 *   },
 *   "offset": 0,
 *   "limit": 20
 * }
 * }</pre>
 */
@Data
public class ShaftFilterRequest {

    /**
     * Field constraints combined with AND; empty matches every record.
     */
    @NotNull
    private Map<String, Object> parameters = new HashMap<>();

    @Min(0)
    private int offset;

    /**
     * Page size; the configured default applies when omitted.
     */
    @Min(1)
    private Integer limit;
}
