package com.shafts.catalog.exception;

/**
 * A filter parameter names an unknown field or holds a value the field cannot take.
 */
public class InvalidFilterException extends CatalogException {

    public InvalidFilterException(final String message) {
        super(message);
    }

    @Override
    public String getCode() {
        return "INVALID_FILTER";
    }
}
