package com.shafts.catalog.service;

import com.shafts.catalog.config.CatalogProperties;
import com.shafts.catalog.dto.IngestReport;
import com.shafts.catalog.service.core.ShaftCatalog;
import com.shafts.catalog.service.export.CatalogSnapshotService;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Builds the catalog once at startup: first the canonical snapshot (if configured and present),
 * then every configured raw manufacturer file.
 * <p>
 * A raw file that cannot be read is logged and skipped; a broken snapshot stops startup,
 * since it is the catalog's own output.
 * </p>
 */
@Slf4j
@Component
public class CatalogBootstrap implements ApplicationRunner {

    private final CatalogProperties properties;

    private final CatalogSnapshotService snapshots;

    private final IngestionService ingestion;

    private final ShaftCatalog catalog;

    public CatalogBootstrap(final CatalogProperties properties,
                            final CatalogSnapshotService snapshots,
                            final IngestionService ingestion,
                            final ShaftCatalog catalog) {
        this.properties = properties;
        this.snapshots = snapshots;
        this.ingestion = ingestion;
        this.catalog = catalog;
    }

    @Override
    public void run(final ApplicationArguments args) throws IOException {
        if (StringUtils.isNotBlank(properties.getSnapshotFile())) {
            Path snapshot = Path.of(properties.getSnapshotFile());
            if (Files.isRegularFile(snapshot)) {
                snapshots.load(snapshot);
            } else {
                log.info("No snapshot at {}, starting empty", snapshot);
            }
        }

        for (CatalogProperties.RawSource source : properties.getRawSources()) {
            if (StringUtils.isBlank(source.getPath())) {
                continue;
            }
            Path file = Path.of(source.getPath().trim());
            try {
                IngestReport report = ingestion.ingestFile(file, source.getDefaults());
                log.info("{}: {} accepted, {} rejected", file, report.accepted().size(), report.failures().size());
            } catch (IOException | IllegalArgumentException ex) {
                log.error("Skipping raw file {}: {}", file, ex.getMessage());
            }
        }
        log.info("Catalog ready with {} shafts", catalog.size());
    }
}
