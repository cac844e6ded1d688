package com.shafts.catalog.model.filter;

import com.shafts.catalog.model.ShaftField;
import com.shafts.catalog.model.ShaftSpec;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-query set of field constraints, combined with logical AND.
 * <p>
 * At most one constraint per field; adding a second one for the same field replaces the
 * first. An empty specification matches every record.
 * </p>
 */
public final class FilterSpecification {

    private static final FilterSpecification MATCH_ALL = new FilterSpecification(new EnumMap<>(ShaftField.class));

    private final Map<ShaftField, FieldConstraint> constraints;

    private FilterSpecification(final Map<ShaftField, FieldConstraint> constraints) {
        this.constraints = Collections.unmodifiableMap(constraints);
    }

    public static FilterSpecification matchAll() {
        return MATCH_ALL;
    }

    public static FilterSpecification of(final Collection<? extends FieldConstraint> constraints) {
        Map<ShaftField, FieldConstraint> byField = new EnumMap<>(ShaftField.class);
        constraints.forEach(c -> byField.put(c.field(), c));
        return new FilterSpecification(byField);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param spec candidate record
     * @return {@code true} if every constraint holds
     */
    public boolean matches(final ShaftSpec spec) {
        for (FieldConstraint constraint : constraints.values()) {
            if (!constraint.test(spec)) {
                return false;
            }
        }
        return true;
    }

    public Collection<FieldConstraint> constraints() {
        return constraints.values();
    }

    public boolean isEmpty() {
        return constraints.isEmpty();
    }

    @Override
    public String toString() {
        return "FilterSpecification" + constraints.values();
    }

    /**
     * Fluent construction, mostly for callers that build filters in code.
     */
    public static final class Builder {

        private final Map<ShaftField, FieldConstraint> byField = new EnumMap<>(ShaftField.class);

        private Builder() {
        }

        public Builder equalTo(final ShaftField field, final Object value) {
            return with(new ExactMatch(field, value));
        }

        public Builder in(final ShaftField field, final Object... values) {
            return with(new SetMembership(field, Arrays.asList(values)));
        }

        public Builder between(final ShaftField field, final Double min, final Double max) {
            return with(NumericRange.between(field, min, max));
        }

        public Builder with(final FieldConstraint constraint) {
            byField.put(constraint.field(), constraint);
            return this;
        }

        public FilterSpecification build() {
            return new FilterSpecification(new EnumMap<>(byField));
        }
    }
}
