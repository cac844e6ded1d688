package com.shafts.catalog.service.core;

import com.shafts.catalog.exception.NormalizationErrorCode;
import com.shafts.catalog.exception.NormalizationException;
import org.apache.commons.lang3.StringUtils;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a numeric raw value with an optional unit and converts it to the canonical unit of its
 * dimension using fixed factors.
 * <p>
 * The unit is taken from the value itself ({@code "65g"}, {@code "$350"}) or from a declared
 * unit column; a bare number is taken to be in the canonical unit already. The converter never
 * guesses: an unknown unit, a unit of another dimension, or a suffix that disagrees with the
 * declared unit is a {@link NormalizationErrorCode#UNIT_MISMATCH}.
 * </p>
 */
public final class UnitConverter {

    /** Decimal places kept after a conversion, and in comparison deltas. */
    public static final int CONVERTED_SCALE = 3;

    private static final Pattern QUANTITY = Pattern.compile(
            "^(\\$)?\\s*([+-]?(?:\\d{1,3}(?:,\\d{3})+(?:\\.\\d+)?|\\d+(?:\\.\\d+)?|\\.\\d+))\\s*(.*)$");

    /**
     * Physical (or monetary) dimension of a numeric field.
     */
    public enum Dimension {
        MASS,
        LENGTH,
        ANGLE,
        CURRENCY
    }

    /**
     * Units accepted in raw records, with their factor to the canonical unit of the dimension.
     */
    public enum Unit {
        GRAM(Dimension.MASS, 1.0, "g", "gr", "gram", "grams"),
        OUNCE(Dimension.MASS, 28.349523125, "oz", "ounce", "ounces"),
        INCH(Dimension.LENGTH, 1.0, "in", "in.", "inch", "inches", "\""),
        CENTIMETER(Dimension.LENGTH, 1.0 / 2.54, "cm", "centimeter", "centimeters"),
        MILLIMETER(Dimension.LENGTH, 1.0 / 25.4, "mm", "millimeter", "millimeters"),
        DEGREE(Dimension.ANGLE, 1.0, "deg", "degree", "degrees", "°"),
        USD(Dimension.CURRENCY, 1.0, "usd", "$", "us$");

        private final Dimension dimension;
        private final double factor;
        private final String[] symbols;

        Unit(Dimension dimension, double factor, String... symbols) {
            this.dimension = dimension;
            this.factor = factor;
            this.symbols = symbols;
        }

        public Dimension dimension() {
            return dimension;
        }

        static Unit fromSymbol(final String symbol) {
            String wanted = symbol.trim().toLowerCase(Locale.ROOT);
            for (Unit unit : values()) {
                for (String s : unit.symbols) {
                    if (s.equals(wanted)) {
                        return unit;
                    }
                }
            }
            return null;
        }
    }

    private UnitConverter() {
    }

    /**
     * Converts a raw numeric value into the canonical unit of {@code dimension}.
     *
     * @param field        canonical field name, used in diagnostics
     * @param raw          a {@link Number} or a string such as {@code "2.3 oz"}
     * @param declaredUnit unit declared by the record for this field, may be {@code null}
     * @param dimension    dimension of the field
     * @return the value in grams, inches, degrees or US dollars
     * @throws NormalizationException with {@code MALFORMED_VALUE} or {@code UNIT_MISMATCH}
     */
    public static double toCanonical(final String field,
                                     final Object raw,
                                     final String declaredUnit,
                                     final Dimension dimension) {
        double amount;
        Unit suffixUnit = null;
        if (raw instanceof Number number) {
            amount = number.doubleValue();
        } else {
            String text = String.valueOf(raw).trim();
            Matcher m = QUANTITY.matcher(text);
            if (!m.matches()) {
                throw new NormalizationException(field, NormalizationErrorCode.MALFORMED_VALUE,
                        "'" + text + "' is not a number");
            }
            amount = Double.parseDouble(m.group(2).replace(",", ""));
            String symbol = m.group(1) != null ? m.group(1) : m.group(3);
            if (m.group(1) != null && StringUtils.isNotBlank(m.group(3))) {
                throw new NormalizationException(field, NormalizationErrorCode.UNIT_MISMATCH,
                        "'" + text + "' carries two units");
            }
            if (StringUtils.isNotBlank(symbol)) {
                suffixUnit = resolve(field, symbol);
            }
        }
        if (!Double.isFinite(amount)) {
            throw new NormalizationException(field, NormalizationErrorCode.MALFORMED_VALUE, "value is not finite");
        }

        Unit declared = StringUtils.isNotBlank(declaredUnit) ? resolve(field, declaredUnit) : null;
        if (suffixUnit != null && declared != null && suffixUnit != declared) {
            throw new NormalizationException(field, NormalizationErrorCode.UNIT_MISMATCH,
                    "value unit " + suffixUnit + " contradicts declared unit " + declared);
        }
        Unit unit = suffixUnit != null ? suffixUnit : declared;
        if (unit == null) {
            return amount;
        }
        if (unit.dimension() != dimension) {
            throw new NormalizationException(field, NormalizationErrorCode.UNIT_MISMATCH,
                    unit + " is not a unit of " + dimension.name().toLowerCase(Locale.ROOT));
        }
        if (unit.factor == 1.0) {
            return amount;
        }
        return BigDecimal.valueOf(amount * unit.factor)
                .setScale(CONVERTED_SCALE, RoundingMode.HALF_UP)
                .doubleValue();
    }

    private static Unit resolve(final String field, final String symbol) {
        Unit unit = Unit.fromSymbol(symbol);
        if (unit == null) {
            throw new NormalizationException(field, NormalizationErrorCode.UNIT_MISMATCH,
                    "unknown unit '" + symbol.trim() + "'");
        }
        return unit;
    }
}
