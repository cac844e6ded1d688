package com.shafts.catalog.service.export;

import com.shafts.catalog.CatalogFixtures;
import com.shafts.catalog.model.ClubType;
import com.shafts.catalog.model.Flex;
import com.shafts.catalog.model.ShaftSpec;
import com.shafts.catalog.service.core.InMemoryShaftCatalog;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static com.shafts.catalog.CatalogFixtures.shaft;
import static com.shafts.catalog.CatalogFixtures.ventusBlue;
import static org.junit.jupiter.api.Assertions.*;

class CatalogSnapshotServiceTest {

    private final ShaftCsvCodec codec = new ShaftCsvCodec(CatalogFixtures.validator());

    @Test
    void savedSnapshotRestoresEqualCatalog(@TempDir final Path dir) throws IOException {
        InMemoryShaftCatalog source = new InMemoryShaftCatalog();
        source.insert(ventusBlue(Flex.STIFF, 65.0));
        source.insert(ventusBlue(Flex.X_STIFF, 70.0));
        source.insert(shaft("KBS", "Tour", null, ClubType.IRON, Flex.STIFF, 120.0).build());
        Path file = dir.resolve("nested/catalog.csv");

        assertEquals(3, new CatalogSnapshotService(source, codec).save(file));
        assertFalse(Files.exists(dir.resolve("nested/catalog.csv.tmp")));

        InMemoryShaftCatalog target = new InMemoryShaftCatalog();
        assertEquals(3, new CatalogSnapshotService(target, codec).load(file));
        assertEquals(source.all(), target.all());
    }

    @Test
    void loadIsAllOrNothing(@TempDir final Path dir) throws IOException {
        InMemoryShaftCatalog source = new InMemoryShaftCatalog();
        ShaftSpec stiff = ventusBlue(Flex.STIFF, 65.0);
        source.insert(stiff);
        source.insert(ventusBlue(Flex.X_STIFF, 70.0));
        Path file = dir.resolve("catalog.csv");
        new CatalogSnapshotService(source, codec).save(file);

        InMemoryShaftCatalog target = new InMemoryShaftCatalog();
        target.insert(stiff);

        assertThrows(IOException.class, () -> new CatalogSnapshotService(target, codec).load(file));
        assertEquals(List.of(stiff), target.all());
    }

    @Test
    void loadRejectsInvalidRecords(@TempDir final Path dir) throws IOException {
        Path file = Files.writeString(dir.resolve("catalog.csv"),
                "manufacturer,model,club_type,flex,weight_grams,tip_diameter_inches\nKBS,Tour,iron,Stiff,120.0,0.34\n");
        InMemoryShaftCatalog target = new InMemoryShaftCatalog();

        assertThrows(IOException.class, () -> new CatalogSnapshotService(target, codec).load(file));
        assertEquals(0, target.size());
    }
}
