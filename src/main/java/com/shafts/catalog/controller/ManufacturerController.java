package com.shafts.catalog.controller;

import com.shafts.catalog.config.VocabularyRegistry;
import com.shafts.catalog.service.ShaftQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Lists manufacturers.
 * <p>
 * <code>GET /api/manufacturers</code> returns the manufacturers present in the catalog;
 * with <code>?declared=true</code> it returns every manufacturer that has a vocabulary, i.e.
 * every manufacturer whose records can be ingested.
 * </p>
 */
@RestController
@RequestMapping("/api/manufacturers")
@RequiredArgsConstructor
public class ManufacturerController {

    private final ShaftQueryService queryService;

    private final VocabularyRegistry vocabularies;

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public List<String> manufacturers(
            @RequestParam(value = "declared", defaultValue = "false") final boolean declared) {
        return declared ? vocabularies.manufacturers() : queryService.manufacturers();
    }
}
