package com.shafts.catalog.exception;

import lombok.Getter;

/**
 * A comparison was requested for fewer or more shafts than the comparator supports.
 */
@Getter
public class InvalidComparisonSizeException extends CatalogException {

    private final int requested;

    public InvalidComparisonSizeException(final int requested, final int min, final int max) {
        super("Comparison needs between " + min + " and " + max + " shafts, got " + requested);
        this.requested = requested;
    }

    @Override
    public String getCode() {
        return "INVALID_COMPARISON_SIZE";
    }
}
