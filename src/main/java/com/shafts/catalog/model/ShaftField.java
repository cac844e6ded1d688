package com.shafts.catalog.model;

import java.util.Locale;
import java.util.function.Function;

/**
 * The canonical columns of a {@link ShaftSpec}, in published order.
 * <p>
 * Every consumer that works field-by-field (filters, CSV snapshots, comparisons) goes through
 * this table so that column names and value spellings stay identical across them.
 * </p>
 */
public enum ShaftField {
    MANUFACTURER("manufacturer", Kind.TEXT, ShaftSpec::manufacturer, text -> text, true),
    MODEL("model", Kind.TEXT, ShaftSpec::model, text -> text, true),
    GENERATION("generation", Kind.TEXT, ShaftSpec::generation, text -> text, false),
    CLUB_TYPE("club_type", Kind.CATEGORY, ShaftSpec::clubType, ClubType::fromLabel, true),
    FLEX("flex", Kind.CATEGORY, ShaftSpec::flex, Flex::fromLabel, true),
    WEIGHT_GRAMS("weight_grams", Kind.NUMBER, ShaftSpec::weightGrams, Double::valueOf, true),
    LENGTH_INCHES("length_inches", Kind.NUMBER, ShaftSpec::lengthInches, Double::valueOf, false),
    TORQUE_DEGREES("torque_degrees", Kind.NUMBER, ShaftSpec::torqueDegrees, Double::valueOf, false),
    LAUNCH("launch", Kind.CATEGORY, ShaftSpec::launch, LaunchProfile::fromLabel, false),
    SPIN("spin", Kind.CATEGORY, ShaftSpec::spin, SpinProfile::fromLabel, false),
    BUTT_DIAMETER_INCHES("butt_diameter_inches", Kind.NUMBER, ShaftSpec::buttDiameterInches,
            Double::valueOf, false),
    TIP_DIAMETER_INCHES("tip_diameter_inches", Kind.NUMBER, ShaftSpec::tipDiameterInches,
            Double::valueOf, false),
    TIP_STIFF("tip_stiff", Kind.CATEGORY, ShaftSpec::tipStiff, TipStiffness::fromLabel, false),
    KICKPOINT("kickpoint", Kind.CATEGORY, ShaftSpec::kickpoint, Kickpoint::fromLabel, false),
    MATERIAL("material", Kind.TEXT, ShaftSpec::material, text -> text, false),
    MSRP_USD("msrp_usd", Kind.NUMBER, ShaftSpec::msrpUsd, Double::valueOf, false);

    /**
     * Value family of a column.
     */
    public enum Kind {
        TEXT,
        CATEGORY,
        NUMBER
    }

    private final String columnName;
    private final Kind kind;
    private final Function<ShaftSpec, Object> accessor;
    private final Function<String, Object> parser;
    private final boolean required;

    ShaftField(String columnName, Kind kind, Function<ShaftSpec, Object> accessor,
               Function<String, Object> parser, boolean required) {
        this.columnName = columnName;
        this.kind = kind;
        this.accessor = accessor;
        this.parser = parser;
        this.required = required;
    }

    public String getColumnName() {
        return columnName;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isRequired() {
        return required;
    }

    public boolean isNumeric() {
        return kind == Kind.NUMBER;
    }

    /**
     * @param spec record to read
     * @return the typed value of this column, {@code null} when absent
     */
    public Object valueOf(final ShaftSpec spec) {
        return accessor.apply(spec);
    }

    /**
     * @param spec record to read
     * @return the numeric value of this column, {@code null} when absent or not numeric
     */
    public Double numberOf(final ShaftSpec spec) {
        Object value = valueOf(spec);
        return value instanceof Number n ? n.doubleValue() : null;
    }

    /**
     * Parses the canonical text form of a value (an enum label, a decimal number or plain text).
     *
     * @param text canonical text; blank means absent
     * @return typed value or {@code null}
     * @throws IllegalArgumentException if the text is not a canonical value of this column
     */
    public Object parse(final String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        return parser.apply(text.trim());
    }

    /**
     * Renders a typed value in its canonical text form, the inverse of {@link #parse(String)}.
     *
     * @param value typed value, may be {@code null}
     * @return canonical text, empty for {@code null}
     */
    public String format(final Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof CanonicalLabel label) {
            return label.getLabel();
        }
        return value.toString();
    }

    /**
     * @param name canonical column name, case-insensitive
     * @return the matching field
     * @throws IllegalArgumentException for unknown names
     */
    public static ShaftField fromColumnName(final String name) {
        if (name != null) {
            String wanted = name.trim().toLowerCase(Locale.ROOT);
            for (ShaftField field : values()) {
                if (field.columnName.equals(wanted)) {
                    return field;
                }
            }
        }
        throw new IllegalArgumentException("Unknown shaft field: " + name);
    }
}
