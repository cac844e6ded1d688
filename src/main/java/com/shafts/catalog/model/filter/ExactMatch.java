package com.shafts.catalog.model.filter;

import com.shafts.catalog.model.ShaftField;
import com.shafts.catalog.model.ShaftSpec;

import java.util.Objects;

/**
 * Field equals one typed value. Numbers compare by value, so {@code 65} matches {@code 65.0}.
 *
 * @param field canonical field
 * @param value typed expected value (enum constant, {@link Double} or {@link String})
 */
public record ExactMatch(ShaftField field, Object value) implements FieldConstraint {

    public ExactMatch {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(value, "value");
    }

    @Override
    public boolean test(final ShaftSpec spec) {
        return ValueMatching.sameValue(field.valueOf(spec), value);
    }
}
