package com.shafts.catalog.service.export;

import com.shafts.catalog.CatalogFixtures;
import com.shafts.catalog.config.JacksonCatalogConfig;
import com.shafts.catalog.model.ClubType;
import com.shafts.catalog.model.Flex;
import com.shafts.catalog.model.ShaftSpec;
import com.shafts.catalog.model.TipStiffness;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.List;

import static com.shafts.catalog.CatalogFixtures.shaft;
import static com.shafts.catalog.CatalogFixtures.ventusBlue;
import static org.junit.jupiter.api.Assertions.*;

class ShaftExporterTest {

    private final ShaftExporter exporter = new ShaftExporter(new ShaftCsvCodec(CatalogFixtures.validator()),
            new JacksonCatalogConfig().catalogObjectMapper());

    private final List<ShaftSpec> specs = List.of(
            ventusBlue(Flex.X_STIFF, 70.0),
            shaft("KBS", "Tour", null, ClubType.IRON, Flex.STIFF, 120.0).tipStiff(TipStiffness.VERY_FIRM).build());

    @Test
    void jsonUsesCanonicalNamesAndLabels() throws IOException {
        StringWriter out = new StringWriter();

        exporter.export(specs, ExportFormat.JSON, out);

        String json = out.toString();
        assertTrue(json.contains("\"club_type\" : \"woods\""));
        assertTrue(json.contains("\"flex\" : \"X-Stiff\""));
        assertTrue(json.contains("\"tip_stiff\" : \"Very Firm\""));
        assertTrue(json.contains("\"weight_grams\" : 120.0"));
        assertFalse(json.contains("display"));
        assertEquals(specs, exporter.readJson(new StringReader(json)));
    }

    @Test
    void csvExportIsTheCodecFormat() throws IOException {
        StringWriter out = new StringWriter();

        exporter.export(specs, ExportFormat.CSV, out);

        assertEquals(3, out.toString().lines().count());
        assertTrue(out.toString().startsWith("\"manufacturer\",\"model\""));
    }

    @Test
    void formatNamesAreCaseInsensitive() {
        assertEquals(ExportFormat.JSON, ExportFormat.fromValue("Json"));
        assertEquals(ExportFormat.CSV, ExportFormat.fromValue(null));
        assertThrows(IllegalArgumentException.class, () -> ExportFormat.fromValue("xml"));
    }
}
