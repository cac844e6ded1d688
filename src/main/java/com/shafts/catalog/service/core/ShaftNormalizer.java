package com.shafts.catalog.service.core;

import com.shafts.catalog.config.VocabularyRegistry;
import com.shafts.catalog.exception.NormalizationErrorCode;
import com.shafts.catalog.exception.NormalizationException;
import com.shafts.catalog.model.ClubType;
import com.shafts.catalog.model.Flex;
import com.shafts.catalog.model.Kickpoint;
import com.shafts.catalog.model.LaunchProfile;
import com.shafts.catalog.model.RawRecord;
import com.shafts.catalog.model.ShaftField;
import com.shafts.catalog.model.ShaftSpec;
import com.shafts.catalog.model.SpinProfile;
import com.shafts.catalog.model.TipStiffness;
import com.shafts.catalog.service.core.UnitConverter.Dimension;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * <h2>Shaft Normalizer</h2>
 * <p>Turns one {@link RawRecord} into exactly one canonical {@link ShaftSpec}, or fails with a
 * {@link NormalizationException} naming the offending field.</p>
 * <ol>
 *     <li><strong>Column aliases:</strong> each canonical field is read from the first
 *         non-blank of its known raw column names (e.g. {@code weight}, {@code weight_grams},
 *         {@code wt}).</li>
 *     <li><strong>Vocabulary:</strong> club type, flex, launch, spin, kickpoint and tip
 *         stiffness go through the manufacturer's {@link ManufacturerVocabulary}. A label that
 *         is not in the table is rejected, also for optional fields.</li>
 *     <li><strong>Units:</strong> numeric fields go through {@link UnitConverter}; the unit
 *         comes from the value or from a {@code <column>_unit} entry.</li>
 *     <li><strong>Validation:</strong> the built record is checked by
 *         {@link ShaftSpecValidator}.</li>
 * </ol>
 * <p>The result depends only on the input record and the vocabulary, so normalizing the same
 * record twice yields equal records.</p>
 */
@Slf4j
@Service
public class ShaftNormalizer {

    private static final String UNIT_SUFFIX = "_unit";

    private static final Map<ShaftField, List<String>> ALIASES = aliases();

    private final VocabularyRegistry vocabularies;

    private final ShaftSpecValidator validator;

    public ShaftNormalizer(final VocabularyRegistry vocabularies, final ShaftSpecValidator validator) {
        this.vocabularies = vocabularies;
        this.validator = validator;
    }

    /**
     * Normalizes a record with the vocabulary declared for its manufacturer.
     *
     * @param raw raw record
     * @return canonical record
     * @throws NormalizationException if the record cannot be normalized; a manufacturer without
     *                                a declared vocabulary is {@code UNMAPPED_VOCABULARY_VALUE}
     */
    public ShaftSpec normalize(final RawRecord raw) {
        String manufacturer = requiredText(raw, ShaftField.MANUFACTURER);
        ManufacturerVocabulary vocabulary = vocabularies.forManufacturer(manufacturer)
                .orElseThrow(() -> new NormalizationException(ShaftField.MANUFACTURER.getColumnName(),
                        NormalizationErrorCode.UNMAPPED_VOCABULARY_VALUE,
                        "no vocabulary declared for manufacturer '" + manufacturer + "'"));
        return normalize(raw, vocabulary);
    }

    /**
     * Normalizes a record with an explicit vocabulary.
     * The canonical manufacturer spelling is the one the vocabulary is declared under.
     *
     * @param raw        raw record
     * @param vocabulary tables of the record's manufacturer
     * @return canonical record
     * @throws NormalizationException if the record cannot be normalized
     */
    public ShaftSpec normalize(final RawRecord raw, final ManufacturerVocabulary vocabulary) {
        String manufacturer = requiredText(raw, ShaftField.MANUFACTURER);
        if (!manufacturer.equalsIgnoreCase(vocabulary.getManufacturer())) {
            throw new NormalizationException(ShaftField.MANUFACTURER.getColumnName(),
                    NormalizationErrorCode.UNMAPPED_VOCABULARY_VALUE,
                    "'" + manufacturer + "' does not match vocabulary of " + vocabulary.getManufacturer());
        }

        Double tipDiameter = optionalNumber(raw, ShaftField.TIP_DIAMETER_INCHES, Dimension.LENGTH);
        String material = optionalText(raw, ShaftField.MATERIAL);

        ShaftSpec spec = ShaftSpec.builder()
                .manufacturer(vocabulary.getManufacturer())
                .model(requiredText(raw, ShaftField.MODEL))
                .generation(optionalText(raw, ShaftField.GENERATION))
                .clubType(required(raw, vocabulary, VocabularyKind.CLUB_TYPE, ClubType.class))
                .flex(required(raw, vocabulary, VocabularyKind.FLEX, Flex.class))
                .weightGrams(requiredNumber(raw, ShaftField.WEIGHT_GRAMS, Dimension.MASS))
                .lengthInches(optionalNumber(raw, ShaftField.LENGTH_INCHES, Dimension.LENGTH))
                .torqueDegrees(optionalNumber(raw, ShaftField.TORQUE_DEGREES, Dimension.ANGLE))
                .launch(optional(raw, vocabulary, VocabularyKind.LAUNCH, LaunchProfile.class))
                .spin(optional(raw, vocabulary, VocabularyKind.SPIN, SpinProfile.class))
                .buttDiameterInches(optionalNumber(raw, ShaftField.BUTT_DIAMETER_INCHES, Dimension.LENGTH))
                .tipDiameterInches(tipDiameter == null ? null : validator.canonicalTipDiameter(tipDiameter))
                .tipStiff(optional(raw, vocabulary, VocabularyKind.TIP_STIFF, TipStiffness.class))
                .kickpoint(optional(raw, vocabulary, VocabularyKind.KICKPOINT, Kickpoint.class))
                .material(material == null ? null : material.toLowerCase(Locale.ROOT))
                .msrpUsd(optionalNumber(raw, ShaftField.MSRP_USD, Dimension.CURRENCY))
                .build();

        validator.validate(spec);
        log.debug("Row {} normalized to {}", raw.getRow(), spec.key());
        return spec;
    }

    /**
     * @param field canonical field
     * @return raw column names accepted for it, in priority order
     */
    public static List<String> aliasesOf(final ShaftField field) {
        return ALIASES.get(field);
    }

    private static String requiredText(final RawRecord raw, final ShaftField field) {
        return raw.first(aliasesOf(field))
                .map(RawRecord.Entry::text)
                .orElseThrow(() -> missing(field));
    }

    private static String optionalText(final RawRecord raw, final ShaftField field) {
        return raw.first(aliasesOf(field)).map(RawRecord.Entry::text).orElse(null);
    }

    private static <T> T required(final RawRecord raw, final ManufacturerVocabulary vocabulary,
                                  final VocabularyKind kind, final Class<T> type) {
        RawRecord.Entry entry = raw.first(aliasesOf(kind.field())).orElseThrow(() -> missing(kind.field()));
        return translate(entry, vocabulary, kind, type);
    }

    private static <T> T optional(final RawRecord raw, final ManufacturerVocabulary vocabulary,
                                  final VocabularyKind kind, final Class<T> type) {
        Optional<RawRecord.Entry> entry = raw.first(aliasesOf(kind.field()));
        return entry.map(e -> translate(e, vocabulary, kind, type)).orElse(null);
    }

    private static <T> T translate(final RawRecord.Entry entry, final ManufacturerVocabulary vocabulary,
                                   final VocabularyKind kind, final Class<T> type) {
        String label = entry.text();
        return vocabulary.lookup(kind, label)
                .map(type::cast)
                .orElseThrow(() -> new NormalizationException(kind.field().getColumnName(),
                        NormalizationErrorCode.UNMAPPED_VOCABULARY_VALUE,
                        "'" + label + "' is not in the " + vocabulary.getManufacturer() + " vocabulary"));
    }

    private static double requiredNumber(final RawRecord raw, final ShaftField field, final Dimension dimension) {
        Double value = optionalNumber(raw, field, dimension);
        if (value == null) {
            throw missing(field);
        }
        return value;
    }

    private static Double optionalNumber(final RawRecord raw, final ShaftField field, final Dimension dimension) {
        Optional<RawRecord.Entry> entry = raw.first(aliasesOf(field));
        if (entry.isEmpty()) {
            return null;
        }
        return UnitConverter.toCanonical(field.getColumnName(), entry.get().value(),
                declaredUnit(raw, entry.get().key(), field), dimension);
    }

    private static String declaredUnit(final RawRecord raw, final String matchedKey, final ShaftField field) {
        String unit = raw.text(matchedKey + UNIT_SUFFIX);
        if (unit != null) {
            return unit;
        }
        for (String alias : aliasesOf(field)) {
            unit = raw.text(alias + UNIT_SUFFIX);
            if (unit != null) {
                return unit;
            }
        }
        return null;
    }

    private static NormalizationException missing(final ShaftField field) {
        return new NormalizationException(field.getColumnName(), NormalizationErrorCode.MISSING_REQUIRED_FIELD,
                "required field is missing (accepted columns: " + aliasesOf(field) + ")");
    }

    private static Map<ShaftField, List<String>> aliases() {
        Map<ShaftField, List<String>> map = new EnumMap<>(ShaftField.class);
        map.put(ShaftField.MANUFACTURER, List.of("manufacturer", "brand", "oem"));
        map.put(ShaftField.MODEL, List.of("model", "shaft", "name", "product"));
        map.put(ShaftField.GENERATION, List.of("generation", "gen", "version"));
        map.put(ShaftField.CLUB_TYPE, List.of("club_type", "club", "type"));
        map.put(ShaftField.FLEX, List.of("flex", "flex_raw", "stiffness"));
        map.put(ShaftField.WEIGHT_GRAMS, List.of("weight", "weight_grams", "wt"));
        map.put(ShaftField.LENGTH_INCHES, List.of("length", "length_inches", "raw_length"));
        map.put(ShaftField.TORQUE_DEGREES, List.of("torque", "torque_degrees"));
        map.put(ShaftField.LAUNCH, List.of("launch", "launch_profile"));
        map.put(ShaftField.SPIN, List.of("spin", "spin_profile"));
        map.put(ShaftField.BUTT_DIAMETER_INCHES, List.of("butt_diameter", "butt", "butt_diameter_inches"));
        map.put(ShaftField.TIP_DIAMETER_INCHES, List.of("tip_diameter", "tip_dia", "tip_diameter_inches"));
        map.put(ShaftField.TIP_STIFF, List.of("tip_stiff", "tip_stiffness"));
        map.put(ShaftField.KICKPOINT, List.of("kickpoint", "kick_point", "bend_point"));
        map.put(ShaftField.MATERIAL, List.of("material"));
        map.put(ShaftField.MSRP_USD, List.of("msrp", "msrp_usd", "price"));
        return Collections.unmodifiableMap(map);
    }
}
