package com.shafts.catalog.service;

import com.shafts.catalog.config.CatalogProperties;
import com.shafts.catalog.exception.SnapshotNotConfiguredException;
import com.shafts.catalog.model.ShaftKey;
import com.shafts.catalog.model.ShaftSpec;
import com.shafts.catalog.service.core.ShaftCatalog;
import com.shafts.catalog.service.core.ShaftSpecValidator;
import com.shafts.catalog.service.export.CatalogSnapshotService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Explicit corrections to the catalog. Records are never edited in place: a correction is a
 * validated replacement and a discontinued model is removed by key.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CatalogMaintenanceService {

    private final ShaftCatalog catalog;

    private final ShaftSpecValidator validator;

    private final CatalogSnapshotService snapshots;

    private final CatalogProperties properties;

    /**
     * @param key  key of the stored record
     * @param spec canonical replacement, validated like a normalized record
     * @return the stored replacement
     */
    public ShaftSpec replace(final ShaftKey key, final ShaftSpec spec) {
        validator.validate(spec);
        ShaftSpec previous = catalog.replace(key, spec);
        log.info("Replaced {} with {}", previous.key(), spec.key());
        return spec;
    }

    /**
     * @param key key of the record to drop
     * @return the removed record
     */
    public ShaftSpec remove(final ShaftKey key) {
        ShaftSpec removed = catalog.remove(key);
        log.info("Removed {}", key);
        return removed;
    }

    /**
     * Writes the catalog to the configured snapshot file.
     *
     * @return number of records written
     * @throws IOException           if the file cannot be written
     * @throws SnapshotNotConfiguredException if no snapshot file is configured
     */
    public int saveSnapshot() throws IOException {
        if (StringUtils.isBlank(properties.getSnapshotFile())) {
            throw new SnapshotNotConfiguredException();
        }
        return snapshots.save(Path.of(properties.getSnapshotFile()));
    }
}
