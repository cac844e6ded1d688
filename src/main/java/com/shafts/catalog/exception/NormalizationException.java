package com.shafts.catalog.exception;

import lombok.Getter;

/**
 * A raw record failed normalization on one field.
 */
@Getter
public class NormalizationException extends CatalogException {

    /** Canonical name of the offending field. */
    private final String field;

    private final NormalizationErrorCode reason;

    public NormalizationException(final String field, final NormalizationErrorCode reason, final String message) {
        super(field + ": " + message);
        this.field = field;
        this.reason = reason;
    }

    @Override
    public String getCode() {
        return reason.name();
    }
}
