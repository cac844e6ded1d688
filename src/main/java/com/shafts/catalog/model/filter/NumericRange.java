package com.shafts.catalog.model.filter;

import com.shafts.catalog.model.ShaftField;
import com.shafts.catalog.model.ShaftSpec;

import java.util.Objects;

/**
 * Inclusive numeric range {@code min <= value <= max}; either bound may be open.
 * <p>
 * A record without a value for the field is excluded unless {@code allowAbsent} is set.
 * </p>
 *
 * @param field       numeric canonical field
 * @param min         lower bound or {@code null}
 * @param max         upper bound or {@code null}
 * @param allowAbsent whether an absent value satisfies the range
 */
public record NumericRange(ShaftField field, Double min, Double max, boolean allowAbsent)
        implements FieldConstraint {

    public NumericRange {
        Objects.requireNonNull(field, "field");
        if (!field.isNumeric()) {
            throw new IllegalArgumentException("Range filter requires a numeric field, got " + field.getColumnName());
        }
        if (min != null && max != null && min > max) {
            throw new IllegalArgumentException("Range on " + field.getColumnName() + " has min > max");
        }
    }

    public static NumericRange between(final ShaftField field, final Double min, final Double max) {
        return new NumericRange(field, min, max, false);
    }

    @Override
    public boolean test(final ShaftSpec spec) {
        Double value = field.numberOf(spec);
        if (value == null) {
            return allowAbsent;
        }
        return (min == null || value >= min) && (max == null || value <= max);
    }
}
