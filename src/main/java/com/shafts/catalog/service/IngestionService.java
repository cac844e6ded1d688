package com.shafts.catalog.service;

import com.shafts.catalog.dto.IngestReport;
import com.shafts.catalog.exception.DuplicateKeyException;
import com.shafts.catalog.exception.NormalizationException;
import com.shafts.catalog.model.RawRecord;
import com.shafts.catalog.model.ShaftKey;
import com.shafts.catalog.model.ShaftSpec;
import com.shafts.catalog.parser.RawRecordReader;
import com.shafts.catalog.service.core.ShaftCatalog;
import com.shafts.catalog.service.core.ShaftNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Batch ingestion: normalizes raw records and inserts them one by one.
 * <p>
 * Each record succeeds or fails on its own. Normalization failures and duplicate keys (within
 * the batch or against the catalog) are collected in the {@link IngestReport}; the remaining
 * records are still stored.
 * </p>
 */
@Slf4j
@Service
public class IngestionService {

    /** Rejections echoed to the log per batch; the report carries all of them. */
    private static final int LOGGED_FAILURES = 5;

    private final ShaftNormalizer normalizer;

    private final ShaftCatalog catalog;

    private final List<RawRecordReader> readers;

    public IngestionService(final ShaftNormalizer normalizer,
                            final ShaftCatalog catalog,
                            final List<RawRecordReader> readers) {
        this.normalizer = normalizer;
        this.catalog = catalog;
        this.readers = readers;
    }

    /**
     * @param source label for logs and the report
     * @param batch  raw records
     * @return per-record outcome
     */
    public IngestReport ingest(final String source, final List<RawRecord> batch) {
        return ingest(source, batch, Map.of());
    }

    /**
     * @param source   label for logs and the report
     * @param batch    raw records
     * @param defaults raw values applied to every record that lacks them (e.g. the manufacturer
     *                 and club type of a whole file)
     * @return per-record outcome
     */
    public IngestReport ingest(final String source, final List<RawRecord> batch, final Map<String, ?> defaults) {
        List<ShaftKey> accepted = new ArrayList<>();
        List<IngestReport.Failure> failures = new ArrayList<>();

        for (RawRecord record : batch) {
            RawRecord raw = record.withDefaults(defaults);
            try {
                ShaftSpec spec = normalizer.normalize(raw);
                catalog.insert(spec);
                accepted.add(spec.key());
            } catch (NormalizationException ex) {
                failures.add(new IngestReport.Failure(raw.getRow(), ex.getField(), ex.getCode(), ex.getMessage()));
            } catch (DuplicateKeyException ex) {
                failures.add(new IngestReport.Failure(raw.getRow(), null, ex.getCode(), ex.getMessage()));
            }
        }

        if (!failures.isEmpty()) {
            log.warn("{} of {} records failed normalization for {}", failures.size(), batch.size(), source);
            failures.stream().limit(LOGGED_FAILURES)
                    .forEach(f -> log.warn("  row {}: [{}] {}", f.row(), f.code(), f.message()));
            if (failures.size() > LOGGED_FAILURES) {
                log.warn("  ... and {} more", failures.size() - LOGGED_FAILURES);
            }
        }
        log.info("Ingested {} shafts from {}", accepted.size(), source);
        return new IngestReport(source, batch.size(),
                Collections.unmodifiableList(accepted), Collections.unmodifiableList(failures));
    }

    /**
     * Reads a raw CSV or JSON file and ingests it.
     *
     * @param file     raw manufacturer file
     * @param defaults raw values applied to every record of the file that lacks them
     * @return per-record outcome
     * @throws IOException              if the file cannot be read or parsed
     * @throws IllegalArgumentException if no reader handles the file type
     */
    public IngestReport ingestFile(final Path file, final Map<String, ?> defaults) throws IOException {
        String name = file.getFileName().toString();
        RawRecordReader reader = readers.stream()
                .filter(r -> r.supports(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No raw reader for file " + name));
        List<RawRecord> batch;
        try (Reader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            batch = reader.read(in);
        }
        return ingest(name, batch, defaults);
    }
}
