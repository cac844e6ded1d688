package com.shafts.catalog.model;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FlexTest {

    @Test
    void ranksFollowStiffnessOrder() {
        List<Flex> sorted = Arrays.stream(Flex.values())
                .sorted((a, b) -> Integer.compare(a.rank(), b.rank()))
                .toList();

        assertEquals(List.of(Flex.LADIES, Flex.SENIOR, Flex.REGULAR, Flex.STIFF, Flex.X_STIFF, Flex.TX), sorted);
        assertTrue(Flex.LADIES.rank() < Flex.SENIOR.rank());
        assertTrue(Flex.X_STIFF.rank() < Flex.TX.rank());
    }

    @Test
    void resolvesCanonicalLabelsIgnoringCase() {
        assertEquals(Flex.X_STIFF, Flex.fromLabel("X-Stiff"));
        assertEquals(Flex.X_STIFF, Flex.fromLabel("  x-stiff "));
        assertEquals(TipStiffness.VERY_FIRM, TipStiffness.fromLabel("very firm"));
        assertEquals(ClubType.WOODS, ClubType.fromLabel("WOODS"));
        assertNull(Flex.fromLabel(null));
    }

    @Test
    void rejectsVendorSpellings() {
        assertThrows(IllegalArgumentException.class, () -> Flex.fromLabel("S"));
        assertThrows(IllegalArgumentException.class, () -> Flex.fromLabel("6.0"));
        assertThrows(IllegalArgumentException.class, () -> Kickpoint.fromLabel("rear"));
    }
}
