package com.shafts.catalog.model.filter;

import com.shafts.catalog.model.ShaftField;
import com.shafts.catalog.model.ShaftSpec;

import java.util.List;
import java.util.Objects;

/**
 * Field value is one of the allowed values, e.g. {@code club_type ∈ {iron, wedge}}.
 * An absent value is never a member.
 *
 * @param field   canonical field
 * @param allowed typed allowed values, at least one
 */
public record SetMembership(ShaftField field, List<Object> allowed) implements FieldConstraint {

    public SetMembership {
        Objects.requireNonNull(field, "field");
        if (allowed == null || allowed.isEmpty()) {
            throw new IllegalArgumentException("Set filter on " + field.getColumnName() + " needs at least one value");
        }
        allowed = List.copyOf(allowed);
    }

    @Override
    public boolean test(final ShaftSpec spec) {
        Object actual = field.valueOf(spec);
        for (Object candidate : allowed) {
            if (ValueMatching.sameValue(actual, candidate)) {
                return true;
            }
        }
        return false;
    }
}
