package com.shafts.catalog.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Request payload carrying raw manufacturer records for normalization and storage.
 * <p>
 * Each record is a flat map of raw column names to strings or numbers, e.g.
 * <pre>{@code
 * {
 *   "records": [
 *     {"manufacturer": "Project X", "model": "HZRDUS Black", "flex_raw": "6.0",
 *      "club_type": "woods", "weight": "65g"}
 *   ]
 * }
 * }</pre>
 * </p>
 */
@Data
public class IngestRequest {

    @NotNull
    private List<Map<String, Object>> records = new ArrayList<>();

    /**
     * Raw values applied to every record that lacks them, e.g. {@code {"club_type": "woods"}}.
     */
    private Map<String, Object> defaults = new HashMap<>();
}
