package com.shafts.catalog.service.export;

import com.shafts.catalog.CatalogFixtures;
import com.shafts.catalog.model.ClubType;
import com.shafts.catalog.model.Flex;
import com.shafts.catalog.model.Kickpoint;
import com.shafts.catalog.model.LaunchProfile;
import com.shafts.catalog.model.ShaftField;
import com.shafts.catalog.model.ShaftSpec;
import com.shafts.catalog.model.SpinProfile;
import com.shafts.catalog.model.TipStiffness;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static com.shafts.catalog.CatalogFixtures.shaft;
import static org.junit.jupiter.api.Assertions.*;

class ShaftCsvCodecTest {

    private final ShaftCsvCodec codec = new ShaftCsvCodec(CatalogFixtures.validator());

    private final ShaftSpec full = shaft("Project X", "HZRDUS Black, \"4th\" Gen", "4", ClubType.WOODS, Flex.X_STIFF, 65.204)
            .lengthInches(45.276)
            .torqueDegrees(3.9)
            .launch(LaunchProfile.LOW_MID)
            .spin(SpinProfile.LOW)
            .buttDiameterInches(0.6)
            .tipDiameterInches(0.335)
            .tipStiff(TipStiffness.VERY_FIRM)
            .kickpoint(Kickpoint.MID_HIGH)
            .material("graphite")
            .msrpUsd(350.0)
            .build();

    private final ShaftSpec sparse = shaft("KBS", "Tour", null, ClubType.IRON, Flex.STIFF, 120.0).build();

    @Test
    void writesCanonicalHeaderAndLabels() throws IOException {
        StringWriter out = new StringWriter();

        codec.write(out, List.of(full));

        String header = out.toString().lines().findFirst().orElseThrow();
        String expected = Arrays.stream(ShaftField.values())
                .map(f -> "\"" + f.getColumnName() + "\"")
                .collect(Collectors.joining(","));
        assertEquals(expected, header);
        assertTrue(out.toString().contains("\"X-Stiff\""));
        assertTrue(out.toString().contains("\"Very Firm\""));
        assertTrue(out.toString().contains("\"Low-Mid\""));
    }

    @Test
    void roundTripIsExact() throws IOException {
        StringWriter out = new StringWriter();
        codec.write(out, List.of(full, sparse));

        List<ShaftSpec> back = codec.read(new StringReader(out.toString()));

        assertEquals(List.of(full, sparse), back);
        assertNull(back.get(1).lengthInches());
        assertNull(back.get(1).generation());
    }

    @Test
    void columnsMayComeInAnyOrderAndOptionalOnesMayBeMissing() throws IOException {
        List<ShaftSpec> specs = codec.read(new StringReader("""
                flex,club_type,weight_grams,model,manufacturer
                Stiff,iron,120.0,Tour,KBS
                """));

        assertEquals(List.of(sparse), specs);
    }

    @Test
    void rejectsUnknownOrMissingColumns() {
        assertThrows(IOException.class, () -> codec.read(new StringReader("manufacturer,model,colour\n")));
        assertThrows(IOException.class, () -> codec.read(new StringReader("manufacturer,model,club_type,flex\n")));
    }

    @Test
    void rejectsNonCanonicalOrInvalidValues() {
        String header = "manufacturer,model,club_type,flex,weight_grams\n";

        assertThrows(IOException.class, () -> codec.read(new StringReader(header + "KBS,Tour,iron,S,120.0\n")));
        assertThrows(IOException.class, () -> codec.read(new StringReader(header + "KBS,Tour,iron,Stiff,300.0\n")));
        assertThrows(IOException.class, () -> codec.read(new StringReader(header + "KBS,Tour,iron,Stiff,\n")));
    }
}
