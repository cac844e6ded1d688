package com.shafts.catalog.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shafts.catalog.CatalogFixtures;
import com.shafts.catalog.dto.IngestReport;
import com.shafts.catalog.model.ClubType;
import com.shafts.catalog.model.Flex;
import com.shafts.catalog.model.RawRecord;
import com.shafts.catalog.model.ShaftKey;
import com.shafts.catalog.parser.CsvRawRecordReader;
import com.shafts.catalog.parser.JsonRawRecordReader;
import com.shafts.catalog.service.core.InMemoryShaftCatalog;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static com.shafts.catalog.CatalogFixtures.raw;
import static org.junit.jupiter.api.Assertions.*;

class IngestionServiceTest {

    private final InMemoryShaftCatalog catalog = new InMemoryShaftCatalog();

    private final IngestionService service = new IngestionService(CatalogFixtures.normalizer(), catalog,
            List.of(new CsvRawRecordReader(), new JsonRawRecordReader(new ObjectMapper())));

    @Test
    void badRecordsDoNotBlockTheRest() {
        List<RawRecord> batch = List.of(
                new RawRecord(1, raw("manufacturer", "Project X", "model", "HZRDUS Black",
                        "flex_raw", "6.0", "weight", "65g", "club_type", "driver")),
                new RawRecord(2, raw("manufacturer", "Project X", "model", "HZRDUS Black",
                        "flex_raw", "7.5", "weight", "65g", "club_type", "driver")),
                new RawRecord(3, raw("manufacturer", "Project X", "model", "HZRDUS Black",
                        "flex_raw", "S", "weight", "66g", "club_type", "woods")),
                new RawRecord(4, raw("manufacturer", "Project X", "model", "HZRDUS Black",
                        "flex_raw", "6.5", "weight", "70g", "club_type", "driver")));

        IngestReport report = service.ingest("test", batch);

        assertEquals(4, report.received());
        assertEquals(List.of(
                new ShaftKey("Project X", "HZRDUS Black", null, ClubType.WOODS, Flex.STIFF),
                new ShaftKey("Project X", "HZRDUS Black", null, ClubType.WOODS, Flex.X_STIFF)), report.accepted());
        assertEquals(2, report.failures().size());

        IngestReport.Failure unmapped = report.failures().get(0);
        assertEquals(2, unmapped.row());
        assertEquals("flex", unmapped.field());
        assertEquals("UNMAPPED_VOCABULARY_VALUE", unmapped.code());

        IngestReport.Failure duplicate = report.failures().get(1);
        assertEquals(3, duplicate.row());
        assertNull(duplicate.field());
        assertEquals("DUPLICATE_KEY", duplicate.code());
        assertEquals(2, catalog.size());
    }

    @Test
    void batchDefaultsFillMissingColumns() {
        List<RawRecord> batch = List.of(
                new RawRecord(1, raw("model", "HZRDUS Black", "flex_raw", "6.0", "weight", "65g")),
                new RawRecord(2, raw("model", "HZRDUS Black", "flex_raw", "5.5", "weight", "60g",
                        "club_type", "iron")));

        IngestReport report = service.ingest("test", batch,
                Map.of("manufacturer", "Project X", "club_type", "woods"));

        assertTrue(report.failures().isEmpty());
        assertEquals(ClubType.WOODS, report.accepted().get(0).clubType());
        assertEquals(ClubType.IRON, report.accepted().get(1).clubType());
    }

    @Test
    void ingestsCsvFile(@TempDir final Path dir) throws IOException {
        Path file = dir.resolve("fujikura.csv");
        Files.writeString(file, """
                Model,Gen,Flex,Weight,Weight Unit,Torque,Launch
                Ventus Blue,TR,S,65,g,3.4,mid
                Ventus Blue,TR,X,2.5,oz,3.2,low
                Ventus Blue,TR,XX,75,g,3.0,low
                """);

        IngestReport report = service.ingestFile(file, Map.of("manufacturer", "Fujikura", "club_type", "woods"));

        assertEquals("fujikura.csv", report.source());
        assertEquals(3, report.received());
        assertEquals(2, report.accepted().size());
        assertEquals(3, report.failures().get(0).row());
        assertEquals(70.874, catalog.get(report.accepted().get(1)).weightGrams());
    }

    @Test
    void ingestsJsonFile(@TempDir final Path dir) throws IOException {
        Path file = dir.resolve("px.json");
        Files.writeString(file, """
                {"records": [
                  {"manufacturer": "Project X", "model": "HZRDUS Black", "flex_raw": "6.0",
                   "weight": 65, "club_type": "driver", "msrp": "$350"}
                ]}
                """);

        IngestReport report = service.ingestFile(file, Map.of());

        assertEquals(1, report.accepted().size());
        assertEquals(350.0, catalog.get(report.accepted().get(0)).msrpUsd());
    }

    @Test
    void unknownFileTypeIsRejected(@TempDir final Path dir) throws IOException {
        Path file = dir.resolve("shafts.xlsx");
        Files.writeString(file, "");

        assertThrows(IllegalArgumentException.class, () -> service.ingestFile(file, Map.of()));
    }
}
