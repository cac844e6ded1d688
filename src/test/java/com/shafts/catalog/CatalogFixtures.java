package com.shafts.catalog;

import com.shafts.catalog.config.CatalogProperties;
import com.shafts.catalog.config.VocabularyCfg;
import com.shafts.catalog.config.VocabularyProperties;
import com.shafts.catalog.config.VocabularyRegistry;
import com.shafts.catalog.model.ClubType;
import com.shafts.catalog.model.Flex;
import com.shafts.catalog.model.LaunchProfile;
import com.shafts.catalog.model.ShaftSpec;
import com.shafts.catalog.service.core.ShaftNormalizer;
import com.shafts.catalog.service.core.ShaftSpecValidator;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Small vocabularies and sample records shared by the unit tests.
 */
public final class CatalogFixtures {

    private CatalogFixtures() {
    }

    public static VocabularyProperties vocabularyProperties() {
        VocabularyCfg common = new VocabularyCfg();
        common.setClubType(map("driver", "woods", "woods", "woods", "iron", "iron", "wedge", "wedge"));
        common.setFlex(map("r", "Regular", "regular", "Regular", "s", "Stiff", "stiff", "Stiff",
                "x", "X-Stiff", "x-stiff", "X-Stiff", "tx", "TX"));
        common.setLaunch(map("low", "Low", "low/mid", "Low-Mid", "mid", "Mid", "high", "High"));
        common.setSpin(map("low", "Low", "mid", "Mid", "high", "High"));
        common.setKickpoint(map("mid", "Mid", "rear", "High"));
        common.setTipStiff(map("firm", "Firm", "extra firm", "Very Firm"));

        VocabularyCfg projectX = new VocabularyCfg();
        projectX.setFlex(map("5.5", "Regular", "6.0", "Stiff", "6.5", "X-Stiff"));

        VocabularyCfg fujikura = new VocabularyCfg();

        VocabularyCfg nippon = new VocabularyCfg();
        nippon.setInheritCommon(false);
        nippon.setClubType(map("iron", "iron"));
        nippon.setFlex(map("firm", "Stiff", "r", "Regular"));

        VocabularyProperties properties = new VocabularyProperties();
        properties.setCommon(common);
        properties.getManufacturers().put("Project X", projectX);
        properties.getManufacturers().put("Fujikura", fujikura);
        properties.getManufacturers().put("Nippon", nippon);
        return properties;
    }

    public static VocabularyRegistry registry() {
        return new VocabularyRegistry(vocabularyProperties());
    }

    public static ShaftSpecValidator validator() {
        return new ShaftSpecValidator(new CatalogProperties());
    }

    public static ShaftNormalizer normalizer() {
        return new ShaftNormalizer(registry(), validator());
    }

    public static ShaftSpec.ShaftSpecBuilder shaft(final String manufacturer, final String model,
                                                   final String generation, final ClubType clubType,
                                                   final Flex flex, final double weightGrams) {
        return ShaftSpec.builder()
                .manufacturer(manufacturer)
                .model(model)
                .generation(generation)
                .clubType(clubType)
                .flex(flex)
                .weightGrams(weightGrams);
    }

    public static ShaftSpec ventusBlue(final Flex flex, final double weightGrams) {
        return shaft("Fujikura", "Ventus Blue", "TR", ClubType.WOODS, flex, weightGrams)
                .lengthInches(46.0)
                .torqueDegrees(3.4)
                .launch(LaunchProfile.MID)
                .build();
    }

    public static Map<String, Object> raw(final Object... keyValues) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            values.put((String) keyValues[i], keyValues[i + 1]);
        }
        return values;
    }

    private static Map<String, String> map(final String... keyValues) {
        Map<String, String> table = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            table.put(keyValues[i], keyValues[i + 1]);
        }
        return table;
    }
}
