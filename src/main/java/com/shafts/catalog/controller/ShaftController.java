package com.shafts.catalog.controller;

import com.shafts.catalog.dto.CatalogStatsDto;
import com.shafts.catalog.dto.ReplaceRequest;
import com.shafts.catalog.dto.ShaftFilterRequest;
import com.shafts.catalog.exception.InvalidFilterException;
import com.shafts.catalog.model.ClubType;
import com.shafts.catalog.model.Flex;
import com.shafts.catalog.model.ShaftKey;
import com.shafts.catalog.model.ShaftSpec;
import com.shafts.catalog.model.filter.FilterSpecification;
import com.shafts.catalog.service.CatalogMaintenanceService;
import com.shafts.catalog.service.ShaftQueryService;
import com.shafts.catalog.service.export.ExportFormat;
import com.shafts.catalog.service.export.ShaftExporter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.io.StringWriter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * REST controller exposing the normalized shaft catalog.
 * <p>
 * Endpoint root: <code>/api/shafts</code><br>
 * Produces: <code>application/json</code> (CSV for exports)
 * </p>
 *
 * <h3>Query-string filters</h3>
 * <code>GET /api/shafts</code> and <code>GET /api/shafts/export</code> accept canonical field
 * names as query parameters:
 * <ul>
 *   <li><code>flex=Stiff</code>: exact match,</li>
 *   <li><code>club_type=iron&amp;club_type=wedge</code>: any of the given values,</li>
 *   <li><code>weight_grams_min=60&amp;weight_grams_max=70</code>: inclusive numeric range.</li>
 * </ul>
 * A field takes either a value or bounds, not both.
 * For richer filters use <code>POST /api/shafts/search</code> with a {@link ShaftFilterRequest}.
 *
 * <h3>Error Handling</h3>
 * See {@link CatalogExceptionHandler}.
 */
@Validated
@RestController
@RequestMapping("/api/shafts")
@RequiredArgsConstructor
public class ShaftController {

    private static final String MIN_SUFFIX = "_min";
    private static final String MAX_SUFFIX = "_max";
    private static final Set<String> PAGING = Set.of("offset", "limit", "format");

    private final ShaftQueryService queryService;

    private final CatalogMaintenanceService maintenanceService;

    private final ShaftExporter exporter;

    /**
     * Lists one page of the catalog, optionally filtered by query-string parameters.
     *
     * @param params filters plus optional {@code offset} and {@code limit}
     * @return matching records in catalog order
     */
    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public List<ShaftSpec> list(@RequestParam final MultiValueMap<String, String> params) {
        FilterSpecification filter = queryService.toFilter(toParameters(params));
        int offset = Integer.parseInt(params.getFirst("offset") == null ? "0" : params.getFirst("offset"));
        String limit = params.getFirst("limit");
        return queryService.search(filter, offset, limit == null ? null : Integer.valueOf(limit));
    }

    /**
     * Executes a filtered search.
     *
     * @param request filters and paging
     * @return matching records in catalog order
     */
    @PostMapping(path = "/search",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public List<ShaftSpec> search(@Valid @RequestBody final ShaftFilterRequest request) {
        FilterSpecification filter = queryService.toFilter(request.getParameters());
        return queryService.search(filter, request.getOffset(), request.getLimit());
    }

    /**
     * Fetches one record by its identity key.
     */
    @GetMapping(path = "/lookup", produces = MediaType.APPLICATION_JSON_VALUE)
    public ShaftSpec lookup(@RequestParam("manufacturer") final String manufacturer,
                            @RequestParam("model") final String model,
                            @RequestParam(value = "generation", required = false) final String generation,
                            @RequestParam("club_type") final String clubType,
                            @RequestParam("flex") final String flex) {
        return queryService.get(toKey(manufacturer, model, generation, clubType, flex));
    }

    /**
     * Case-insensitive substring search over manufacturer and model names.
     */
    @GetMapping(path = "/text-search", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<ShaftSpec> textSearch(@RequestParam("q") final String text) {
        return queryService.textSearch(text);
    }

    @GetMapping(path = "/stats", produces = MediaType.APPLICATION_JSON_VALUE)
    public CatalogStatsDto stats() {
        return queryService.statistics();
    }

    /**
     * Every flex of one model line, softest first.
     */
    @GetMapping(path = "/progression", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<ShaftSpec> progression(@RequestParam("manufacturer") final String manufacturer,
                                       @RequestParam("model") final String model) {
        return queryService.weightProgression(manufacturer, model);
    }

    /**
     * Downloads every record matching the query-string filters.
     *
     * @param params filters plus {@code format} ({@code csv} by default, or {@code json})
     * @return the document as an attachment
     * @throws IOException if rendering fails
     */
    @GetMapping(path = "/export")
    public ResponseEntity<String> export(@RequestParam final MultiValueMap<String, String> params)
            throws IOException {
        ExportFormat format = ExportFormat.fromValue(params.getFirst("format"));
        List<ShaftSpec> specs = queryService.query(queryService.toFilter(toParameters(params)));

        StringWriter out = new StringWriter();
        exporter.export(specs, format, out);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"shafts." + format.getExtension() + "\"")
                .contentType(MediaType.parseMediaType(format.getContentType()))
                .body(out.toString());
    }

    /**
     * Replaces a stored record with a corrected one.
     *
     * @param request key of the stored record and its canonical replacement
     * @return the stored replacement
     */
    @PutMapping(consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ShaftSpec replace(@Valid @RequestBody final ReplaceRequest request) {
        return maintenanceService.replace(request.key(), request.shaft());
    }

    /**
     * Removes a discontinued record.
     *
     * @return the removed record
     */
    @DeleteMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public ShaftSpec remove(@RequestParam("manufacturer") final String manufacturer,
                            @RequestParam("model") final String model,
                            @RequestParam(value = "generation", required = false) final String generation,
                            @RequestParam("club_type") final String clubType,
                            @RequestParam("flex") final String flex) {
        return maintenanceService.remove(toKey(manufacturer, model, generation, clubType, flex));
    }

    /**
     * Writes the catalog to the configured snapshot file.
     *
     * @return <code>{"saved": n}</code>
     * @throws IOException if the snapshot cannot be written
     */
    @PostMapping(path = "/snapshot", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Integer> snapshot() throws IOException {
        return Map.of("saved", maintenanceService.saveSnapshot());
    }

    /**
     * Folds query-string parameters into the filter-parameter shape understood by
     * {@link ShaftQueryService#toFilter(Map)}.
     */
    private static Map<String, Object> toParameters(final MultiValueMap<String, String> params) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        Map<String, Map<String, Object>> ranges = new LinkedHashMap<>();
        params.forEach((name, values) -> {
            if (PAGING.contains(name) || values == null || values.isEmpty()) {
                return;
            }
            if (name.endsWith(MIN_SUFFIX) || name.endsWith(MAX_SUFFIX)) {
                String field = name.substring(0, name.length() - MIN_SUFFIX.length());
                String bound = name.endsWith(MIN_SUFFIX) ? "min" : "max";
                ranges.computeIfAbsent(field, f -> new LinkedHashMap<>()).put(bound, values.get(0));
                return;
            }
            parameters.put(name, values.size() == 1 ? values.get(0) : List.copyOf(values));
        });
        ranges.forEach((field, range) -> {
            if (parameters.containsKey(field)) {
                throw new InvalidFilterException("Filter on " + field
                        + " mixes a value with " + MIN_SUFFIX + "/" + MAX_SUFFIX + " bounds");
            }
            parameters.put(field, range);
        });
        return parameters;
    }

    private static ShaftKey toKey(final String manufacturer, final String model, final String generation,
                                  final String clubType, final String flex) {
        return new ShaftKey(manufacturer, model, generation, ClubType.fromLabel(clubType), Flex.fromLabel(flex));
    }
}
