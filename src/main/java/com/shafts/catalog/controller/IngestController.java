package com.shafts.catalog.controller;

import com.shafts.catalog.dto.IngestReport;
import com.shafts.catalog.dto.IngestRequest;
import com.shafts.catalog.model.RawRecord;
import com.shafts.catalog.service.IngestionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * REST controller accepting raw manufacturer records.
 * <p>
 * Endpoint: <code>POST /api/ingest</code><br>
 * Every record is normalized and stored on its own; the response is an {@link IngestReport}
 * with the accepted keys and one failure entry per rejected record. A batch with failures
 * still answers 200.
 * </p>
 */
@RestController
@RequestMapping("/api/ingest")
@RequiredArgsConstructor
public class IngestController {

    private static final String SOURCE = "request";

    private final IngestionService ingestionService;

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public IngestReport ingest(@Valid @RequestBody final IngestRequest request) {
        List<RawRecord> batch = new ArrayList<>(request.getRecords().size());
        int row = 1;
        for (Map<String, Object> values : request.getRecords()) {
            batch.add(new RawRecord(row++, values == null ? Map.of() : values));
        }
        return ingestionService.ingest(SOURCE, batch, request.getDefaults());
    }
}
