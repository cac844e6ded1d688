package com.shafts.catalog.controller;

import com.shafts.catalog.dto.CompareRequest;
import com.shafts.catalog.model.ComparisonResult;
import com.shafts.catalog.service.ShaftComparisonService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller comparing 2 to 4 shafts side by side.
 * <p>
 * Endpoint: <code>POST /api/compare</code>
 * </p>
 *
 * <h3>Example Request</h3>
 * <pre>{@code
 * {
 *   "shafts": [
 *     {"manufacturer": "Fujikura", "model": "Ventus Blue", "generation": "TR",
 *      "club_type": "woods", "flex": "Stiff"},
 *     {"manufacturer": "Fujikura", "model": "Ventus Blue", "generation": "TR",
 *      "club_type": "woods", "flex": "X-Stiff"}
 *   ]
 * }
 * }</pre>
 *
 * <h3>Response</h3>
 * A {@link ComparisonResult}: the records in request order and one row per canonical field
 * with the values aligned to the request, a {@code delta} for numeric fields and flex ranks.
 */
@RestController
@RequestMapping("/api/compare")
@RequiredArgsConstructor
public class CompareController {

    private final ShaftComparisonService comparisonService;

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ComparisonResult compare(@Valid @RequestBody final CompareRequest request) {
        return comparisonService.compare(request.shafts());
    }
}
