package com.shafts.catalog.service;

import com.shafts.catalog.exception.InvalidComparisonSizeException;
import com.shafts.catalog.exception.ShaftNotFoundException;
import com.shafts.catalog.model.ComparisonResult;
import com.shafts.catalog.model.ComparisonRow;
import com.shafts.catalog.model.Flex;
import com.shafts.catalog.model.ShaftField;
import com.shafts.catalog.model.ShaftKey;
import com.shafts.catalog.model.ShaftSpec;
import com.shafts.catalog.service.core.InMemoryShaftCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static com.shafts.catalog.CatalogFixtures.shaft;
import static com.shafts.catalog.CatalogFixtures.ventusBlue;
import static org.junit.jupiter.api.Assertions.*;

class ShaftComparisonServiceTest {

    private final InMemoryShaftCatalog catalog = new InMemoryShaftCatalog();

    private final ShaftComparisonService service = new ShaftComparisonService(catalog);

    private final ShaftSpec stiff = ventusBlue(Flex.STIFF, 65.0);
    private final ShaftSpec xStiff = ventusBlue(Flex.X_STIFF, 70.0);

    @BeforeEach
    void setUp() {
        catalog.insert(stiff);
        catalog.insert(xStiff);
    }

    @Test
    void weightDeltaOfTwoFlexes() {
        ComparisonResult result = service.compare(List.of(stiff.key(), xStiff.key()));

        assertEquals(Optional.of(5.0), result.delta(ShaftField.WEIGHT_GRAMS));
        assertEquals(List.of(stiff, xStiff), result.shafts());
        assertEquals(List.of("Fujikura Ventus Blue TR Stiff", "Fujikura Ventus Blue TR X-Stiff"), result.displayNames());
    }

    @Test
    void rowsAreAlignedWithRequestOrder() {
        ComparisonResult result = service.compare(List.of(xStiff.key(), stiff.key()));

        ComparisonRow flex = result.row(ShaftField.FLEX).orElseThrow();
        assertEquals(List.of(Flex.X_STIFF, Flex.STIFF), flex.values());
        assertEquals(List.of(Flex.X_STIFF.rank(), Flex.STIFF.rank()), flex.ranks());
        assertNull(flex.delta());
        assertEquals(ShaftField.values().length, result.rows().size());
    }

    @Test
    void deltaIgnoresAbsentValues() {
        ShaftSpec bare = shaft("Fujikura", "Ventus Blue", "TR", stiff.clubType(), Flex.REGULAR, 60.0)
                .torqueDegrees(4.0)
                .build();
        catalog.insert(bare);

        ComparisonResult result = service.compare(List.of(stiff.key(), bare.key()));

        assertEquals(0.6, result.delta(ShaftField.TORQUE_DEGREES).orElseThrow(), 1e-9);
        assertEquals(Arrays.asList(null, null), result.row(ShaftField.MSRP_USD).orElseThrow().values());
        assertNull(result.row(ShaftField.MSRP_USD).orElseThrow().delta());
        assertEquals(Arrays.asList(46.0, null), result.row(ShaftField.LENGTH_INCHES).orElseThrow().values());
    }

    @Test
    void deltaIsRoundedToThousandths() {
        ShaftSpec light = ventusBlue(Flex.REGULAR, 65.3);
        ShaftSpec heavy = ventusBlue(Flex.TX, 70.1);
        catalog.insert(light);
        catalog.insert(heavy);

        ComparisonResult result = service.compare(List.of(light.key(), heavy.key()));

        assertEquals(Optional.of(4.8), result.delta(ShaftField.WEIGHT_GRAMS));
    }

    @Test
    void nullKeyIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> service.compare(Arrays.asList(stiff.key(), null)));
    }

    @Test
    void repeatedKeyIsListedTwice() {
        ComparisonResult result = service.compare(List.of(stiff.key(), stiff.key()));

        assertEquals(2, result.shafts().size());
        assertEquals(Optional.of(0.0), result.delta(ShaftField.WEIGHT_GRAMS));
    }

    @Test
    void acceptsTwoToFourShafts() {
        assertEquals(4, service.compare(List.of(stiff.key(), xStiff.key(), stiff.key(), xStiff.key()))
                .shafts().size());
    }

    @Test
    void rejectsOneOrFiveShafts() {
        ShaftKey key = stiff.key();

        InvalidComparisonSizeException one = assertThrows(InvalidComparisonSizeException.class,
                () -> service.compare(List.of(key)));
        assertEquals(1, one.getRequested());
        assertThrows(InvalidComparisonSizeException.class,
                () -> service.compare(List.of(key, key, key, key, key)));
        assertThrows(InvalidComparisonSizeException.class, () -> service.compare(List.of()));
    }

    @Test
    void absentKeyIsNotFound() {
        ShaftKey absent = ventusBlue(Flex.TX, 80.0).key();

        assertThrows(ShaftNotFoundException.class, () -> service.compare(List.of(stiff.key(), absent)));
    }

    @Test
    void comparisonLeavesCatalogUntouched() {
        List<ShaftSpec> before = catalog.all();

        service.compare(List.of(stiff.key(), xStiff.key()));

        assertEquals(before, catalog.all());
    }
}
