package com.shafts.catalog.service.export;

import com.shafts.catalog.exception.DuplicateKeyException;
import com.shafts.catalog.model.ShaftSpec;
import com.shafts.catalog.service.core.ShaftCatalog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Persists the catalog as a canonical CSV snapshot and restores it.
 * <p>
 * A snapshot is written to a sibling temporary file and moved into place, so a reader never
 * sees a half-written file.
 * </p>
 */
@Slf4j
@Service
public class CatalogSnapshotService {

    private final ShaftCatalog catalog;

    private final ShaftCsvCodec codec;

    public CatalogSnapshotService(final ShaftCatalog catalog, final ShaftCsvCodec codec) {
        this.catalog = catalog;
        this.codec = codec;
    }

    /**
     * @param file snapshot destination; parent directories are created
     * @return number of records written
     * @throws IOException if the snapshot cannot be written
     */
    public int save(final Path file) throws IOException {
        List<ShaftSpec> all = catalog.all();
        Path target = file.toAbsolutePath();
        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        try (Writer out = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
            codec.write(out, all);
        }
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        log.info("Saved {} shafts to {}", all.size(), target);
        return all.size();
    }

    /**
     * Inserts every record of a snapshot into the catalog. Either the whole snapshot is loaded
     * or, on the first bad record, nothing is.
     *
     * @param file snapshot written by {@link #save(Path)}
     * @return number of records loaded
     * @throws IOException if the file is unreadable, malformed, holds an invalid record, or
     *                     repeats a key already present
     */
    public int load(final Path file) throws IOException {
        List<ShaftSpec> specs;
        try (Reader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            specs = codec.read(in);
        }
        for (ShaftSpec spec : specs) {
            if (catalog.contains(spec.key())) {
                throw new IOException("Snapshot " + file + " repeats key " + spec.key());
            }
        }
        int loaded = 0;
        try {
            for (ShaftSpec spec : specs) {
                catalog.insert(spec);
                loaded++;
            }
        } catch (DuplicateKeyException ex) {
            specs.stream().limit(loaded).forEach(s -> catalog.remove(s.key()));
            throw new IOException("Snapshot " + file + " repeats key: " + ex.getMessage(), ex);
        }
        log.info("Loaded {} shafts from {}", loaded, file);
        return loaded;
    }
}
