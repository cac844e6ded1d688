package com.shafts.catalog.model.filter;

import com.shafts.catalog.model.ShaftField;
import com.shafts.catalog.model.ShaftSpec;

/**
 * A single-field predicate of a {@link FilterSpecification}.
 */
public interface FieldConstraint {

    /**
     * @return the canonical field this constraint reads
     */
    ShaftField field();

    /**
     * @param spec candidate record
     * @return {@code true} if the record's value satisfies the constraint
     */
    boolean test(ShaftSpec spec);
}
